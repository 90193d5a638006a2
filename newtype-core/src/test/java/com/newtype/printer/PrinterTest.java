package com.newtype.printer;

import com.newtype.Parser;
import com.newtype.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrinterTest {

    private static String program(String source) {
        return Printer.render(Parser.parse(source));
    }

    private static String expression(String source) {
        return Printer.render(Parser.parseExpression(source));
    }

    // ==================== Literals and names ====================

    @Test
    void testLiterals() {
        assertEquals("\"a\\\"b\"", expression("\"a\\\"b\""));
        assertEquals("123456789012345678901234567890", expression("123456789012345678901234567890"));
        assertEquals("1.5", expression("1.5"));
        assertEquals("0.1", expression("0.1"));
        assertEquals("true", expression("true"));
        assertEquals("infer T", expression("?T"));
    }

    @Test
    void testQuoteEscapes() {
        assertEquals("\"a\\\"b\\\\c\\n\\t\"", Printer.quote("a\"b\\c\n\t"));
    }

    @Test
    void testTypeApplication() {
        assertEquals("A", Printer.render(new TypeApplication("A", List.of())));
        assertEquals("A<1, B<C>>", expression("A 1 (B C)"));
    }

    @Test
    void testObjectLiteral() {
        assertEquals("type A = {}", program("type A = {}"));
        assertEquals("type A = { a: 1, b: \"x\" }", program("type A = { a: 1, b: \"x\" }"));
        assertEquals("{ a: 1 }", expression("{ a: 1 }"));
    }

    @Test
    void testModifiers() {
        assertEquals("{ readonly a?: 1, -readonly b-?: 2 }", expression("{ readonly a?: 1, -readonly b-?: 2 }"));
    }

    @Test
    void testTuple() {
        assertEquals("[]", expression("[]"));
        assertEquals("[1, \"x\", A<B>]", expression("[1, \"x\", A B]"));
    }

    // ==================== Conditionals ====================

    @Test
    void testEqualsWrapsOperandsInTuples() {
        assertEquals("[A] extends [B] ? C : D", expression("if A == B then C else D"));
    }

    @Test
    void testNotEqualsWrapsAndSwapsBranches() {
        assertEquals("[A] extends [B] ? D : C", expression("if A != B then C else D"));
    }

    @Test
    void testNegatedRightExtends() {
        assertEquals("B extends A ? D : C", expression("if not A :> B then C else D"));
    }

    @Test
    void testCaseIsDesugaredWhenRendered() {
        assertEquals("A extends B ? 1 : A extends C ? 2 : never", expression("case A of\n  B -> 1\n  C -> 2"));
    }

    // ==================== Unions and intersections ====================

    @Test
    void testUnionInsideTypeDefinitionIsFlat() {
        assertEquals("type X = A | B | C", program("type X = A | B | C"));
    }

    @Test
    void testStandaloneUnionBreaks() {
        assertEquals("A\n| B", expression("A | B"));
    }

    @Test
    void testMixedOperatorsAreParenthesised() {
        assertEquals("type X = (B | C) & D", program("type X = (B | C) & D"));
        assertEquals("type X = A | (B & C)", program("type X = A | B & C"));
        assertEquals("(B | C)\n& D", expression("(B | C) & D"));
    }

    @Test
    void testConditionalOperandsAreParenthesised() {
        assertEquals("type A = (X extends Y ? Z : never) | W", program("type A = (if X <: Y then Z) | W"));
        assertEquals("type A = W | (X extends Y ? Z : never)", program("type A = W | (if X <: Y then Z)"));
        assertEquals("type A = (X extends Y ? 1 : never) & W", program("type A = (case X of Y -> 1) & W"));
    }

    @Test
    void testConditionalOnEitherSideOfExtendsIsParenthesised() {
        assertEquals("type A = X extends (Y extends Z ? 1 : 2) ? 3 : never",
            program("type A = if X <: (if Y <: Z then 1 else 2) then 3"));
        assertEquals("type A = (Y extends Z ? 1 : 2) extends X ? 3 : never",
            program("type A = if (if Y <: Z then 1 else 2) <: X then 3"));
    }

    @Test
    void testConditionalInBranchIsNotParenthesised() {
        assertEquals("type A = X extends Y ? Z extends W ? 1 : 2 : 3",
            program("type A = if X <: Y then (if Z <: W then 1 else 2) else 3"));
    }

    @Test
    void testLetIsParenthesisedByWhatItExpandsTo() {
        assertEquals("type A = (B | C) & D", program("type A = (let X = B | C in X) & D"));
        assertEquals("type A = B & D", program("type A = (let X = B in X) & D"));
    }

    @Test
    void testCompoundConditionIsExpandedWhenRendered() {
        assertEquals("A extends B ? C extends D ? E : F : F", expression("if A <: B and C <: D then E else F"));
        assertEquals("A extends B ? E : C extends D ? F : E", expression("if A <: B or not C <: D then E else F"));
    }

    // ==================== Statements ====================

    @Test
    void testTypeParams() {
        assertEquals("type Pair<A, B> = [A, B]", program("type Pair A B = [A, B]"));
    }

    @Test
    void testImports() {
        assertEquals("import {a, b as c} from \"lib\"", program("import \"lib\" (a, b as c)"));
        assertEquals("import * as NS from \"lib\"", program("import \"lib\" * as NS"));
        assertEquals("import D from \"lib\"", program("import \"lib\" D"));
        assertEquals("import D, * as NS from \"lib\"", program("import \"lib\" D, * as NS"));
        assertEquals("import D, {a} from \"lib\"", program("import \"lib\" D, (a)"));
    }

    @Test
    void testExportLeavesNoBlankLine() {
        assertEquals("type A = 1\ntype B = 2", program("export type A = 1\ntype B = 2"));
        assertEquals("", program("export"));
    }

    @Test
    void testInterface() {
        String source = "interface Box T extends Base T, Other where\n  value : T\n  readonly tag? : \"box\"";
        assertEquals("interface Box<T> extends Base<T>, Other {\n  value: T;\n  readonly tag?: \"box\";\n}",
            program(source));
    }

    @Test
    void testEmptyInterface() {
        assertEquals("interface Empty {}", program("interface Empty where"));
    }

    @Test
    void testInterfaceFollowedByType() {
        assertEquals("interface A {\n  foo: { a: 1 };\n}\ntype B = 1", program("interface A where\n  foo : { a: 1 }\ntype B = 1"));
    }

    // ==================== Page width ====================

    @Test
    void testBodyMovesUnderEqualsWhenTooWide() {
        Printer printer = new Printer(LayoutOptions.width(20));
        assertEquals("type Alpha =\n  { a: 1, b: 2 }", printer.print(Parser.parse("type Alpha = { a: 1, b: 2 }")));
    }

    @Test
    void testObjectBreaksOnePropertyPerLine() {
        Printer printer = new Printer(LayoutOptions.width(10));
        assertEquals("type A =\n  {\n    a: 1,\n    b: 2\n  }", printer.print(Parser.parse("type A = { a: 1, b: 2 }")));
    }

    @Test
    void testTupleBreaksOneElementPerLine() {
        Printer printer = new Printer(LayoutOptions.width(4));
        assertEquals("[\n  10,\n  20\n]", printer.print(Parser.parseExpression("[10, 20]")));
    }

    @Test
    void testBrokenUnionInTypeDefinition() {
        Printer printer = new Printer(LayoutOptions.width(12));
        assertEquals("type A =\n  \"aaaa\"\n  | \"bbbb\"", printer.print(Parser.parse("type A = \"aaaa\" | \"bbbb\"")));
    }
}
