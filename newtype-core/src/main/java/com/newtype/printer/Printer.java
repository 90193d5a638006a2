package com.newtype.printer;

import com.newtype.Desugarer;
import com.newtype.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders Newtype ASTs as TypeScript type syntax.
 *
 * <p>The printer only builds {@link Doc}s; all line breaking is left to {@link Layout}.
 * Case, let and compound conditional expressions are desugared before they are
 * rendered.</p>
 */
public final class Printer {

    private static final int INDENT = 2;

    private final LayoutOptions options;

    public Printer() {
        this(LayoutOptions.unbounded());
    }

    public Printer(LayoutOptions options) {
        this.options = options;
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    public static String render(Program program) {
        return new Printer().print(program);
    }

    public static String render(Statement statement) {
        return new Printer().print(statement);
    }

    public static String render(Expression expression) {
        return new Printer().print(expression);
    }

    public String print(Program program) {
        return Layout.render(toDoc(program), options);
    }

    public String print(Statement statement) {
        return Layout.render(toDoc(statement), options);
    }

    public String print(Expression expression) {
        return Layout.render(toDoc(expression), options);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    public static Doc toDoc(Program program) {
        List<Doc> statements = new ArrayList<>(program.statements().size());
        for (Statement statement : program.statements()) {
            statements.add(toDoc(statement));
        }
        // Export markers render empty and must not leave blank lines behind
        return Doc.vsep(statements);
    }

    public static Doc toDoc(Statement statement) {
        if (statement instanceof ExportStatement) {
            return Doc.empty();
        }
        if (statement instanceof TypeDefinition def) {
            return typeDefinition(def);
        }
        if (statement instanceof InterfaceDefinition def) {
            return interfaceDefinition(def);
        }
        if (statement instanceof ImportDeclaration decl) {
            return Doc.concat(
                Doc.text("import "),
                importClause(decl.importClause()),
                Doc.text(" from "),
                Doc.text(quote(decl.fromClause())));
        }
        throw new IllegalStateException("Unknown statement: " + statement.getClass().getSimpleName());
    }

    // type Name<P> = body, with the body moving under the `=` when it breaks
    private static Doc typeDefinition(TypeDefinition def) {
        Doc head = Doc.concat(Doc.text("type " + def.name()), typeParams(def.params()), Doc.text(" ="));
        return Doc.group(Doc.concat(head, Doc.nest(INDENT, Doc.concat(Doc.line(), toDoc(def.body())))));
    }

    private static Doc interfaceDefinition(InterfaceDefinition def) {
        List<Doc> head = new ArrayList<>();
        head.add(Doc.text("interface " + def.name()));
        head.add(typeParams(def.params()));
        if (!def.extendsList().isEmpty()) {
            head.add(Doc.text(" extends "));
            head.add(commaSeparated(def.extendsList()));
        }
        if (def.props().isEmpty()) {
            head.add(Doc.text(" {}"));
            return Doc.concat(head);
        }
        head.add(Doc.text(" {"));

        List<Doc> props = new ArrayList<>(def.props().size());
        for (KeyValue prop : def.props()) {
            props.add(Doc.concat(keyValue(prop), Doc.text(";")));
        }
        return Doc.concat(
            Doc.concat(head),
            Doc.nest(INDENT, Doc.concat(Doc.hardLine(), Doc.vsep(props))),
            Doc.hardLine(),
            Doc.text("}"));
    }

    private static Doc typeParams(TypeParams params) {
        if (params == null || params.names().isEmpty()) {
            return Doc.empty();
        }
        return Doc.text("<" + String.join(", ", params.names()) + ">");
    }

    private static Doc importClause(ImportClause clause) {
        if (clause instanceof ImportClause.Default d) {
            return Doc.text(d.binding());
        }
        if (clause instanceof ImportClause.Namespace ns) {
            return Doc.text("* as " + ns.binding());
        }
        if (clause instanceof ImportClause.Named named) {
            return importSpecifiers(named.specifiers());
        }
        if (clause instanceof ImportClause.DefaultAndNamespace dns) {
            return Doc.text(dns.defaultBinding() + ", * as " + dns.namespaceBinding());
        }
        if (clause instanceof ImportClause.DefaultAndNamed dn) {
            return Doc.concat(Doc.text(dn.defaultBinding() + ", "), importSpecifiers(dn.specifiers()));
        }
        throw new IllegalStateException("Unknown import clause: " + clause.getClass().getSimpleName());
    }

    private static Doc importSpecifiers(List<ImportSpecifier> specifiers) {
        List<String> parts = new ArrayList<>(specifiers.size());
        for (ImportSpecifier specifier : specifiers) {
            if (specifier instanceof ImportSpecifier.Alias alias) {
                parts.add(alias.from() + " as " + alias.to());
            } else {
                parts.add(((ImportSpecifier.Binding) specifier).name());
            }
        }
        return Doc.text("{" + String.join(", ", parts) + "}");
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    public static Doc toDoc(Expression expression) {
        if (expression instanceof StringLiteral s) {
            return Doc.text(quote(s.value()));
        }
        if (expression instanceof IntegerLiteral i) {
            return Doc.text(i.value().toString());
        }
        if (expression instanceof DoubleLiteral d) {
            return Doc.text(Double.toString(d.value()));
        }
        if (expression instanceof BooleanLiteral b) {
            return Doc.text(b.value() ? "true" : "false");
        }
        if (expression instanceof Identifier id) {
            return Doc.text(id.name());
        }
        if (expression instanceof InferIdentifier infer) {
            return Doc.text("infer " + infer.name());
        }
        if (expression instanceof TypeApplication app) {
            if (app.args().isEmpty()) {
                return Doc.text(app.name());
            }
            return Doc.concat(Doc.text(app.name() + "<"), commaSeparated(app.args()), Doc.text(">"));
        }
        if (expression instanceof ObjectLiteral object) {
            return objectLiteral(object);
        }
        if (expression instanceof Tuple tuple) {
            return tuple(tuple);
        }
        if (expression instanceof ExtendsExpression ext) {
            return extendsExpression(ext);
        }
        if (expression instanceof Union union) {
            return binary(union.left(), "| ", union.right(), Intersection.class);
        }
        if (expression instanceof Intersection intersection) {
            return binary(intersection.left(), "& ", intersection.right(), Union.class);
        }
        if (isSurfaceOnly(expression)) {
            return toDoc(Desugarer.simplify(expression));
        }
        throw new IllegalStateException("Unknown expression: " + expression.getClass().getSimpleName());
    }

    // { a: 1, b: 2 } flat, one property per line when broken
    private static Doc objectLiteral(ObjectLiteral object) {
        if (object.props().isEmpty()) {
            return Doc.text("{}");
        }
        List<Doc> props = new ArrayList<>(object.props().size());
        for (KeyValue prop : object.props()) {
            props.add(keyValue(prop));
        }
        return Doc.group(Doc.concat(
            Doc.text("{"),
            Doc.nest(INDENT, Doc.concat(Doc.line(), Doc.join(Doc.concat(Doc.text(","), Doc.line()), props))),
            Doc.line(),
            Doc.text("}")));
    }

    private static Doc tuple(Tuple tuple) {
        if (tuple.elements().isEmpty()) {
            return Doc.text("[]");
        }
        List<Doc> elements = new ArrayList<>(tuple.elements().size());
        for (Expression element : tuple.elements()) {
            elements.add(toDoc(element));
        }
        return Doc.group(Doc.concat(
            Doc.text("["),
            Doc.nest(INDENT, Doc.concat(Doc.lineBreak(), Doc.join(Doc.concat(Doc.text(","), Doc.line()), elements))),
            Doc.lineBreak(),
            Doc.text("]")));
    }

    private static Doc extendsExpression(ExtendsExpression ext) {
        Expression lhs = ext.lhs();
        Expression rhs = ext.rhs();
        Expression ifBody = ext.ifBody();
        Expression elseBody = ext.elseBody();

        if (ext.negate()) {
            Expression swap = ifBody;
            ifBody = elseBody;
            elseBody = swap;
        }
        switch (ext.op()) {
            case EXTENDS_LEFT -> { }
            case EXTENDS_RIGHT -> {
                Expression swap = lhs;
                lhs = rhs;
                rhs = swap;
            }
            case EQUALS -> {
                lhs = Tuple.of(lhs);
                rhs = Tuple.of(rhs);
            }
            case NOT_EQUALS -> {
                lhs = Tuple.of(lhs);
                rhs = Tuple.of(rhs);
                Expression swap = ifBody;
                ifBody = elseBody;
                elseBody = swap;
            }
        }
        return Doc.spaced(
            comparisonSide(lhs), Doc.text("extends"), comparisonSide(rhs),
            Doc.text("?"), toDoc(ifBody),
            Doc.text(":"), toDoc(elseBody));
    }

    // left <line> op right; an operand of the other operator or a conditional is parenthesised
    private static Doc binary(Expression left, String operator, Expression right, Class<? extends Expression> other) {
        return Doc.concat(
            operand(left, other),
            Doc.line(),
            Doc.text(operator),
            operand(right, other));
    }

    private static Doc operand(Expression operand, Class<? extends Expression> other) {
        Expression shown = rendered(operand);
        Doc doc = toDoc(shown);
        if (other.isInstance(shown) || shown instanceof ExtendsExpression) {
            return parenthesised(doc);
        }
        return doc;
    }

    // A conditional on either side of extends would swallow the rest of the conditional
    private static Doc comparisonSide(Expression side) {
        Expression shown = rendered(side);
        Doc doc = toDoc(shown);
        return shown instanceof ExtendsExpression ? parenthesised(doc) : doc;
    }

    private static Doc parenthesised(Doc doc) {
        return Doc.group(Doc.align(Doc.concat(
            Doc.flatAlt(Doc.text("( "), Doc.text("(")),
            doc,
            Doc.flatAlt(Doc.text(" )"), Doc.text(")")))));
    }

    // The node that is actually rendered for this expression
    private static Expression rendered(Expression expression) {
        return isSurfaceOnly(expression) ? Desugarer.simplify(expression) : expression;
    }

    private static boolean isSurfaceOnly(Expression expression) {
        return expression instanceof CaseStatement
            || expression instanceof CompoundConditional
            || expression instanceof LetExpression;
    }

    // [readonly |-readonly ]key[?|-?]: value
    private static Doc keyValue(KeyValue prop) {
        String readonly = switch (prop.readonly()) {
            case PRESENT -> "readonly ";
            case ABSENT -> "-readonly ";
            case UNSET -> "";
        };
        String optional = switch (prop.optional()) {
            case PRESENT -> "?";
            case ABSENT -> "-?";
            case UNSET -> "";
        };
        return Doc.concat(Doc.text(readonly + prop.key() + optional + ": "), toDoc(prop.value()));
    }

    private static Doc commaSeparated(List<Expression> expressions) {
        List<Doc> docs = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            docs.add(toDoc(expression));
        }
        return Doc.join(Doc.text(", "), docs);
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
