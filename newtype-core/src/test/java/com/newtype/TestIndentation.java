package com.newtype;

import com.newtype.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestIndentation {

    private static void assertIndentationError(String source, int line, int actual, int required) {
        IndentationException e = assertThrows(IndentationException.class, () -> Parser.parse(source),
            "Expected an indentation error for:\n" + source);
        assertEquals(line, e.error().line(), "line");
        assertEquals(actual, e.actualColumn(), "actual column");
        assertEquals(required, e.requiredColumn(), "required column");
        assertEquals("incorrect indentation (got " + actual + ", should be greater than " + required + ")",
            e.error().message());
    }

    @Test
    void testBodyMustBeIndented() {
        assertIndentationError("type A =\n1\n", 2, 1, 1);
    }

    @Test
    void testEqualsMustBeIndented() {
        assertIndentationError("type A\n= 1\n", 2, 1, 1);
    }

    @Test
    void testIndentedContinuationIsAccepted() {
        TypeDefinition expected = TypeDefinition.of("A", IntegerLiteral.of(1));
        assertEquals(List.of(expected), Parser.parse("type A =\n  1\n").statements());
        assertEquals(List.of(expected), Parser.parse("type A\n  = 1\n").statements());
        System.out.println("✓ Continuation lines right of the type keyword are accepted");
    }

    @Test
    void testRequiredColumnFollowsTheStatement() {
        // An indented statement raises the bar for its own continuation lines
        assertIndentationError("  type A =\n  1", 2, 3, 3);
    }

    @Test
    void testOffsideTokenEndsArguments() {
        // B at column 1 is not an argument of A; it starts the next statement, which is invalid
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parse("type A = A\nB"));
        assertEquals(new ParseError(2, 1, "unexpected 'B', expecting statement"), e.error());
    }

    @Test
    void testUnionContinuesOnIndentedLine() {
        Program program = Parser.parse("type A = 1\n  | 2\ntype B = 3");
        assertEquals(List.of(
            TypeDefinition.of("A", new Union(IntegerLiteral.of(1), IntegerLiteral.of(2))),
            TypeDefinition.of("B", IntegerLiteral.of(3))), program.statements());
    }

    @Test
    void testOffsideOperatorEndsTheBody() {
        // The pipe is offside, so the definition ends before it and no statement starts with it
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class,
            () -> Parser.parse("type A = 1\n| 2"));
        assertEquals(new ParseError(2, 1, "unexpected '|', expecting statement"), e.error());
    }

    @Test
    void testApplicationArgumentsOnContinuationLines() {
        Expression expr = Parser.parseExpression("A\n  1\n  2");
        assertEquals(TypeApplication.of("A", IntegerLiteral.of(1), IntegerLiteral.of(2)), expr);
    }
}
