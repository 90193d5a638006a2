package com.newtype;

import com.newtype.ast.*;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

public class Parser {
    // ========================================================================
    // Binding Power Constants for the operator layer
    // ========================================================================
    // Higher binding power = tighter binding. Both operators are left-associative.
    private static final int BP_NONE = 0;
    private static final int BP_UNION = 1;          // A | B
    private static final int BP_INTERSECTION = 2;   // A & B

    // Contextual words: ordinary identifiers that close the construct they follow,
    // so they never start an argument of a type application
    private static final Set<String> STOP_WORDS = Set.of("of", "where", "extends", "and", "or", "in");

    private final List<Token> tokens;
    private int current = 0;

    // ========================================================================
    // Layout
    // ========================================================================
    // Each open construct (statement, case arm, interface property) pushes an anchor.
    // A token on a later line than the anchor token must sit right of the anchor
    // column; otherwise it is "offside" and ends the construct.
    private record Anchor(int column, int line) {}
    private final ArrayDeque<Anchor> layout = new ArrayDeque<>();

    public Parser(String source) {
        this.tokens = new Lexer(source).tokenize();
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    public static Program parse(String source) {
        return new Parser(source).parseProgram();
    }

    /**
     * Parses a whole program, returning the first error instead of throwing it.
     */
    public static ParseResult<Program> parseProgram(String source) {
        try {
            return ParseResult.success(parse(source));
        } catch (ParseException e) {
            return ParseResult.failure(e.errors());
        }
    }

    /**
     * Parses exactly one statement. Unlike a program, this accepts nothing after it.
     */
    public static Statement parseStatement(String source) {
        Parser parser = new Parser(source);
        Statement statement = parser.statement();
        parser.expectEnd();
        return statement;
    }

    public static InterfaceDefinition parseInterface(String source) {
        Parser parser = new Parser(source);
        Token start = parser.peek();
        if (!parser.checkWord("interface")) {
            throw new UnexpectedTokenException(start, "interface definition");
        }
        InterfaceDefinition definition = parser.anchored(start, parser::interfaceDefinition);
        parser.expectEnd();
        return definition;
    }

    public static Expression parseExpression(String source) {
        Parser parser = new Parser(source);
        Expression expression = parser.expression();
        parser.expectEnd();
        return expression;
    }

    public Program parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return new Program(statements);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statement statement() {
        Token token = peek();
        // Statements are anchored on the indentation of the line they start on,
        // so `export type A =` still lets the body continue at any deeper column
        Token lineStart = firstTokenOnLine(current);

        if (checkWord("export")) {
            advance();
            return new ExportStatement();
        }
        if (check(TokenType.IMPORT)) {
            return anchored(lineStart, this::importDeclaration);
        }
        if (checkWord("type")) {
            return anchored(lineStart, this::typeDefinition);
        }
        if (checkWord("interface")) {
            return anchored(lineStart, this::interfaceDefinition);
        }
        throw new UnexpectedTokenException(token, "statement");
    }

    // import "module" (a, b as c)
    // import "module" * as NS
    // import "module" Default[, * as NS | , (a, b)]
    private ImportDeclaration importDeclaration() {
        consume(TokenType.IMPORT, "'import'");
        Token module = consume(TokenType.STRING, "from clause");
        ImportClause clause;
        if (check(TokenType.LPAREN)) {
            clause = new ImportClause.Named(importSpecifiers());
        } else if (check(TokenType.STAR)) {
            clause = new ImportClause.Namespace(namespaceBinding());
        } else {
            String defaultBinding = identifier("import binding");
            if (!match(TokenType.COMMA)) {
                clause = new ImportClause.Default(defaultBinding);
            } else if (check(TokenType.STAR)) {
                clause = new ImportClause.DefaultAndNamespace(defaultBinding, namespaceBinding());
            } else {
                clause = new ImportClause.DefaultAndNamed(defaultBinding, importSpecifiers());
            }
        }
        return new ImportDeclaration(clause, (String) module.literal());
    }

    private String namespaceBinding() {
        consume(TokenType.STAR, "'*'");
        consume(TokenType.AS, "'as'");
        return identifier("namespace binding");
    }

    private List<ImportSpecifier> importSpecifiers() {
        consume(TokenType.LPAREN, "'('");
        List<ImportSpecifier> specifiers = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                String binding = identifier("import binding");
                if (match(TokenType.AS)) {
                    specifiers.add(new ImportSpecifier.Alias(binding, identifier("import alias")));
                } else {
                    specifiers.add(new ImportSpecifier.Binding(binding));
                }
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')'");
        return specifiers;
    }

    // type Name [Param ...] = expression
    private TypeDefinition typeDefinition() {
        consumeWord("type");
        String name = identifier("type name");
        TypeParams params = typeParams();
        consume(TokenType.ASSIGN, "'='");
        Expression body = expression();
        return new TypeDefinition(name, params, body);
    }

    // interface Name [Param ...] [extends A, B] where
    //   key : value
    //   ...
    private InterfaceDefinition interfaceDefinition() {
        consumeWord("interface");
        String name = identifier("interface name");
        TypeParams params = typeParams();

        List<Expression> extendsList = new ArrayList<>();
        if (checkWord("extends")) {
            advance();
            do {
                extendsList.add(expression());
            } while (match(TokenType.COMMA));
        }
        consumeWord("where");

        List<KeyValue> props = new ArrayList<>();
        if (isAtEnd() || isOffside(peek())) {
            return new InterfaceDefinition(name, params, extendsList, props);
        }
        Token first = peek();
        int propColumn = first.column();
        while (true) {
            Token propStart = peek();
            props.add(anchored(propStart, this::objectLiteralProperty));
            if (match(TokenType.COMMA)) {
                expectPresent("object property");
                continue;
            }
            Token next = peek();
            if (isAtEnd() || isOffside(next) || next.column() != propColumn) {
                break;
            }
        }
        return new InterfaceDefinition(name, params, extendsList, props);
    }

    private TypeParams typeParams() {
        List<String> names = new ArrayList<>();
        while (checkAvailable(TokenType.IDENTIFIER) && !STOP_WORDS.contains(peek().lexeme())) {
            names.add(advance().lexeme());
        }
        return names.isEmpty() ? null : new TypeParams(names);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression expression() {
        return parseExpr(BP_UNION);
    }

    // Precedence climbing over terms. Parses operators with binding power >= minBp.
    private Expression parseExpr(int minBp) {
        Expression left = term();

        while (true) {
            Token token = peek();
            if (isOffside(token)) {
                break;
            }
            int bp = infixBindingPower(token.type());
            if (bp == BP_NONE || bp < minBp) {
                break;
            }
            advance();
            // Left-associative: the right operand only takes tighter operators
            Expression right = parseExpr(bp + 1);
            left = token.type() == TokenType.PIPE ? new Union(left, right) : new Intersection(left, right);
        }
        return left;
    }

    private static int infixBindingPower(TokenType type) {
        return switch (type) {
            case PIPE -> BP_UNION;
            case AMPERSAND -> BP_INTERSECTION;
            default -> BP_NONE;
        };
    }

    private Expression term() {
        Token token = expectPresent("expression");
        if (token.type() == TokenType.IDENTIFIER) {
            if (token.lexeme().equals("case")) {
                return caseExpression();
            }
            if (token.lexeme().equals("let")) {
                return letExpression();
            }
            advance();
            List<Expression> args = new ArrayList<>();
            while (startsArgument()) {
                args.add(argument());
            }
            return args.isEmpty() ? new Identifier(token.lexeme()) : new TypeApplication(token.lexeme(), args);
        }
        if (token.type() == TokenType.IF) {
            return conditional();
        }
        return atom();
    }

    // Arguments bind tighter than application: `A B C` is A<B, C>, never A<B<C>>
    private Expression argument() {
        if (check(TokenType.IDENTIFIER)) {
            return new Identifier(advance().lexeme());
        }
        return atom();
    }

    private boolean startsArgument() {
        Token token = peek();
        if (isOffside(token)) {
            return false;
        }
        return switch (token.type()) {
            case IDENTIFIER -> !STOP_WORDS.contains(token.lexeme())
                && !token.lexeme().equals("case") && !token.lexeme().equals("let");
            case INTEGER, DOUBLE, STRING, TRUE, FALSE, LPAREN, LBRACKET, LBRACE, QUESTION -> true;
            default -> false;
        };
    }

    // Terms that never take arguments
    private Expression atom() {
        Token token = expectPresent("expression");
        return switch (token.type()) {
            case INTEGER -> new IntegerLiteral((BigInteger) advance().literal());
            case DOUBLE -> new DoubleLiteral((Double) advance().literal());
            case STRING -> new StringLiteral((String) advance().literal());
            case TRUE -> {
                advance();
                yield new BooleanLiteral(true);
            }
            case FALSE -> {
                advance();
                yield new BooleanLiteral(false);
            }
            case QUESTION -> {
                advance();
                yield new InferIdentifier(identifier("identifier"));
            }
            case LPAREN -> {
                advance();
                Expression inner = expression();
                consume(TokenType.RPAREN, "')'");
                yield inner;
            }
            case LBRACKET -> tuple();
            case LBRACE -> objectLiteral();
            default -> throw unexpectedOrKeyword(token, "expression");
        };
    }

    private Tuple tuple() {
        consume(TokenType.LBRACKET, "'['");
        List<Expression> elements = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            do {
                elements.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACKET, "']'");
        return new Tuple(elements);
    }

    private ObjectLiteral objectLiteral() {
        consume(TokenType.LBRACE, "'{'");
        List<KeyValue> props = new ArrayList<>();
        if (!check(TokenType.RBRACE)) {
            do {
                props.add(objectLiteralProperty());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACE, "'}'");
        return new ObjectLiteral(props);
    }

    // [readonly | -readonly] key [? | -?] : value
    private KeyValue objectLiteralProperty() {
        Modifier readonly = Modifier.UNSET;
        if (match(TokenType.READONLY)) {
            readonly = Modifier.PRESENT;
        } else if (check(TokenType.MINUS) && checkAhead(1, TokenType.READONLY)) {
            advance();
            advance();
            readonly = Modifier.ABSENT;
        }

        String key = identifier("property key");

        Modifier optional = Modifier.UNSET;
        if (match(TokenType.QUESTION)) {
            optional = Modifier.PRESENT;
        } else if (match(TokenType.MINUS)) {
            consume(TokenType.QUESTION, "'?'");
            optional = Modifier.ABSENT;
        }

        consume(TokenType.COLON, "':'");
        Expression value = expression();
        return new KeyValue(readonly, optional, key, value);
    }

    // if condition then ifBody [else elseBody]
    private Expression conditional() {
        consume(TokenType.IF, "'if'");
        Condition condition = condition();
        consume(TokenType.THEN, "'then'");
        Expression ifBody = expression();
        Expression elseBody = Identifier.never();
        if (checkAvailable(TokenType.ELSE)) {
            advance();
            elseBody = expression();
        }

        // A single comparison, negated or not, is an extends expression directly
        if (condition instanceof Condition.Comparison c) {
            return new ExtendsExpression(c.lhs(), false, c.op(), c.rhs(), ifBody, elseBody);
        }
        if (condition instanceof Condition.Not not && not.condition() instanceof Condition.Comparison c) {
            return new ExtendsExpression(c.lhs(), true, c.op(), c.rhs(), ifBody, elseBody);
        }
        return new CompoundConditional(condition, ifBody, elseBody);
    }

    // condition := conjunction (or conjunction)*
    private Condition condition() {
        Condition left = conjunction();
        while (checkWord("or")) {
            advance();
            left = new Condition.Or(left, conjunction());
        }
        return left;
    }

    // conjunction := negation (and negation)*
    private Condition conjunction() {
        Condition left = negation();
        while (checkWord("and")) {
            advance();
            left = new Condition.And(left, negation());
        }
        return left;
    }

    // negation := not negation | lhs op rhs
    private Condition negation() {
        // `not` followed by an operator is a type named not
        if (checkWord("not") && startsTermAt(current + 1)) {
            advance();
            return new Condition.Not(negation());
        }
        Expression lhs = expression();
        ComparisonOperator op = comparisonOperator();
        Expression rhs = expression();
        return new Condition.Comparison(lhs, op, rhs);
    }

    private ComparisonOperator comparisonOperator() {
        Token token = expectPresent("comparison operator");
        ComparisonOperator op = ComparisonOperator.fromSymbol(token.lexeme());
        if (op == null) {
            throw new UnexpectedTokenException(token, "comparison operator ('<:', ':>', '==' or '!=')");
        }
        advance();
        return op;
    }

    // let Name = value [, Name = value] in body
    // Bindings may also sit one per line on the column of the first one.
    private LetExpression letExpression() {
        consumeWord("let");

        Token first = expectPresent("let binding");
        int bindingColumn = first.column();
        List<LetBinding> bindings = new ArrayList<>();
        while (true) {
            Token bindingStart = peek();
            bindings.add(anchored(bindingStart, this::letBinding));
            if (match(TokenType.COMMA)) {
                continue;
            }
            Token next = peek();
            if (isAtEnd() || isOffside(next) || checkWord("in")
                || next.line() == previous().line() || next.column() != bindingColumn) {
                break;
            }
        }
        consumeWord("in");
        return new LetExpression(bindings, expression());
    }

    private LetBinding letBinding() {
        String name = identifier("binding name");
        consume(TokenType.ASSIGN, "'='");
        return new LetBinding(name, expression());
    }

    // case scrutinee of
    //   pattern -> body
    //   ...
    private CaseStatement caseExpression() {
        consumeWord("case");
        Expression scrutinee = expression();
        consumeWord("of");

        Token first = expectPresent("case arm");
        int armColumn = first.column();
        List<CaseArm> arms = new ArrayList<>();
        while (true) {
            Token armStart = peek();
            arms.add(anchored(armStart, this::caseArm));
            Token next = peek();
            if (isAtEnd() || isOffside(next) || next.line() == previous().line() || next.column() != armColumn) {
                break;
            }
        }
        return new CaseStatement(scrutinee, arms);
    }

    private CaseArm caseArm() {
        Expression pattern = expression();
        consume(TokenType.ARROW, "'->'");
        Expression body = expression();
        return new CaseArm(pattern, body);
    }

    private boolean startsTermAt(int index) {
        if (index >= tokens.size()) {
            return false;
        }
        Token token = tokens.get(index);
        if (isOffside(token)) {
            return false;
        }
        return switch (token.type()) {
            case IDENTIFIER, INTEGER, DOUBLE, STRING, TRUE, FALSE, LPAREN, LBRACKET, LBRACE, QUESTION, IF -> true;
            default -> false;
        };
    }

    // ========================================================================
    // Layout helpers
    // ========================================================================

    private <T> T anchored(Token anchor, Supplier<T> production) {
        layout.push(new Anchor(anchor.column(), anchor.line()));
        try {
            return production.get();
        } finally {
            layout.pop();
        }
    }

    private boolean isOffside(Token token) {
        if (token.type() == TokenType.EOF || layout.isEmpty()) {
            return false;
        }
        Anchor anchor = layout.peek();
        return token.line() > anchor.line() && token.column() <= anchor.column();
    }

    private Token firstTokenOnLine(int index) {
        int line = tokens.get(index).line();
        int i = index;
        while (i > 0 && tokens.get(i - 1).line() == line) {
            i--;
        }
        return tokens.get(i);
    }

    /**
     * Returns the next token when the grammar requires one to be there, reporting
     * an offside token as an indentation error rather than a missing token.
     */
    private Token expectPresent(String expected) {
        Token token = peek();
        if (isOffside(token)) {
            throw new IndentationException(token, layout.peek().column());
        }
        if (token.type() == TokenType.EOF) {
            throw new UnexpectedTokenException(token, expected);
        }
        return token;
    }

    private void expectEnd() {
        if (!isAtEnd()) {
            throw new UnexpectedTokenException(peek(), "end of input");
        }
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private boolean match(TokenType type) {
        if (checkAvailable(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    // Like check, but an offside token does not count
    private boolean checkAvailable(TokenType type) {
        return check(type) && !isOffside(peek());
    }

    private boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    private boolean checkWord(String word) {
        Token token = peek();
        return token.type() == TokenType.IDENTIFIER && token.lexeme().equals(word) && !isOffside(token);
    }

    private Token consume(TokenType type, String expected) {
        Token token = expectPresent(expected);
        if (token.type() != type) {
            throw new UnexpectedTokenException(token, expected);
        }
        return advance();
    }

    private void consumeWord(String word) {
        Token token = expectPresent("'" + word + "'");
        if (token.type() != TokenType.IDENTIFIER || !token.lexeme().equals(word)) {
            throw new UnexpectedTokenException(token, "'" + word + "'");
        }
        advance();
    }

    private String identifier(String expected) {
        Token token = expectPresent(expected);
        if (token.type() != TokenType.IDENTIFIER) {
            throw unexpectedOrKeyword(token, expected);
        }
        return advance().lexeme();
    }

    private ParseException unexpectedOrKeyword(Token token, String expected) {
        if (Lexer.isReservedWord(token.lexeme())) {
            return new ParseException(token, "keyword \"" + token.lexeme() + "\" cannot be an identifier");
        }
        return new UnexpectedTokenException(token, expected);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
