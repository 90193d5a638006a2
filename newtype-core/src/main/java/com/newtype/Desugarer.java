package com.newtype;

import com.newtype.ast.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites Newtype-only constructs into their TypeScript-compatible equivalents.
 *
 * <p>{@link CaseStatement} arms become a right-nested chain of {@code extends} conditionals tried in order:</p>
 * <pre>
 * case S of            S extends P1 ? B1
 *   P1 -> B1     =&gt;      : S extends P2 ? B2
 *   P2 -> B2               : never
 * </pre>
 * <p>An arm whose pattern is {@code _} supplies the final else branch instead of
 * {@code never}; arms after it can never match and are dropped.</p>
 *
 * <p>A {@link CompoundConditional} is expanded one comparison at a time: {@code not}
 * swaps the branches, {@code a and b} tests {@code b} inside the then branch of
 * {@code a}, and {@code a or b} tests {@code b} inside the else branch of {@code a}.
 * A {@link LetExpression} is replaced by its body with every bound identifier
 * substituted.</p>
 *
 * <p>The rewrite is applied everywhere in the tree and is idempotent.</p>
 */
public final class Desugarer {

    private static final String WILDCARD = "_";

    private Desugarer() {
        // Utility class
    }

    public static Program simplify(Program program) {
        List<Statement> statements = new ArrayList<>(program.statements().size());
        for (Statement statement : program.statements()) {
            statements.add(simplify(statement));
        }
        return new Program(statements);
    }

    public static Statement simplify(Statement statement) {
        if (statement instanceof TypeDefinition def) {
            return new TypeDefinition(def.name(), def.params(), simplify(def.body()));
        }
        if (statement instanceof InterfaceDefinition def) {
            return new InterfaceDefinition(def.name(), def.params(),
                simplifyAll(def.extendsList()), simplifyProps(def.props()));
        }
        if (statement instanceof ImportDeclaration || statement instanceof ExportStatement) {
            return statement;
        }
        throw new IllegalStateException("Unknown statement: " + statement.getClass().getSimpleName());
    }

    public static Expression simplify(Expression expression) {
        if (expression instanceof CaseStatement caseStatement) {
            return simplifyCase(caseStatement);
        }
        if (expression instanceof CompoundConditional conditional) {
            return expand(conditional.condition(), simplify(conditional.ifBody()), simplify(conditional.elseBody()));
        }
        if (expression instanceof LetExpression let) {
            return simplifyLet(let);
        }
        if (expression instanceof TypeApplication app) {
            return new TypeApplication(app.name(), simplifyAll(app.args()));
        }
        if (expression instanceof ObjectLiteral object) {
            return new ObjectLiteral(simplifyProps(object.props()));
        }
        if (expression instanceof Tuple tuple) {
            return new Tuple(simplifyAll(tuple.elements()));
        }
        if (expression instanceof Union union) {
            return new Union(simplify(union.left()), simplify(union.right()));
        }
        if (expression instanceof Intersection intersection) {
            return new Intersection(simplify(intersection.left()), simplify(intersection.right()));
        }
        if (expression instanceof ExtendsExpression ext) {
            return new ExtendsExpression(
                simplify(ext.lhs()),
                ext.negate(),
                ext.op(),
                simplify(ext.rhs()),
                simplify(ext.ifBody()),
                simplify(ext.elseBody()));
        }
        // Leaves: literals, identifiers, infer identifiers
        return expression;
    }

    private static Expression simplifyCase(CaseStatement caseStatement) {
        // The scrutinee is simplified once and shared by every generated conditional
        Expression scrutinee = simplify(caseStatement.scrutinee());

        List<CaseArm> arms = new ArrayList<>();
        Expression elseBody = Identifier.never();
        for (CaseArm arm : caseStatement.arms()) {
            if (isWildcard(arm.pattern())) {
                elseBody = simplify(arm.body());
                break;
            }
            arms.add(arm);
        }

        // Build from the last arm outwards so the first arm ends up outermost
        Expression result = elseBody;
        for (int i = arms.size() - 1; i >= 0; i--) {
            CaseArm arm = arms.get(i);
            result = ExtendsExpression.extendsLeft(scrutinee, simplify(arm.pattern()), simplify(arm.body()), result);
        }
        return result;
    }

    private static Expression expand(Condition condition, Expression ifBody, Expression elseBody) {
        if (condition instanceof Condition.Comparison c) {
            return new ExtendsExpression(simplify(c.lhs()), false, c.op(), simplify(c.rhs()), ifBody, elseBody);
        }
        if (condition instanceof Condition.Not not) {
            return expand(not.condition(), elseBody, ifBody);
        }
        if (condition instanceof Condition.And and) {
            return expand(and.left(), expand(and.right(), ifBody, elseBody), elseBody);
        }
        if (condition instanceof Condition.Or or) {
            return expand(or.left(), ifBody, expand(or.right(), ifBody, elseBody));
        }
        throw new IllegalStateException("Unknown condition: " + condition.getClass().getSimpleName());
    }

    private static Expression simplifyLet(LetExpression let) {
        Map<String, Expression> scope = new HashMap<>();
        for (LetBinding binding : let.bindings()) {
            // Computed before the put, so `X = X | 1` refers to the earlier X
            Expression value = substitute(simplify(binding.value()), scope);
            scope.put(binding.name(), value);
        }
        return substitute(simplify(let.body()), scope);
    }

    // Only runs on simplified trees, so no case, let or compound conditional is left
    private static Expression substitute(Expression expression, Map<String, Expression> scope) {
        if (scope.isEmpty()) {
            return expression;
        }
        if (expression instanceof Identifier id) {
            return scope.getOrDefault(id.name(), id);
        }
        if (expression instanceof TypeApplication app) {
            List<Expression> args = new ArrayList<>(app.args().size());
            for (Expression arg : app.args()) {
                args.add(substitute(arg, scope));
            }
            return new TypeApplication(app.name(), args);
        }
        if (expression instanceof ObjectLiteral object) {
            List<KeyValue> props = new ArrayList<>(object.props().size());
            for (KeyValue prop : object.props()) {
                props.add(new KeyValue(prop.readonly(), prop.optional(), prop.key(), substitute(prop.value(), scope)));
            }
            return new ObjectLiteral(props);
        }
        if (expression instanceof Tuple tuple) {
            List<Expression> elements = new ArrayList<>(tuple.elements().size());
            for (Expression element : tuple.elements()) {
                elements.add(substitute(element, scope));
            }
            return new Tuple(elements);
        }
        if (expression instanceof Union union) {
            return new Union(substitute(union.left(), scope), substitute(union.right(), scope));
        }
        if (expression instanceof Intersection intersection) {
            return new Intersection(substitute(intersection.left(), scope), substitute(intersection.right(), scope));
        }
        if (expression instanceof ExtendsExpression ext) {
            return new ExtendsExpression(
                substitute(ext.lhs(), scope),
                ext.negate(),
                ext.op(),
                substitute(ext.rhs(), scope),
                substitute(ext.ifBody(), scope),
                substitute(ext.elseBody(), scope));
        }
        return expression;
    }

    private static boolean isWildcard(Expression pattern) {
        return pattern instanceof Identifier id && id.name().equals(WILDCARD);
    }

    private static List<Expression> simplifyAll(List<Expression> expressions) {
        List<Expression> result = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            result.add(simplify(expression));
        }
        return result;
    }

    private static List<KeyValue> simplifyProps(List<KeyValue> props) {
        List<KeyValue> result = new ArrayList<>(props.size());
        for (KeyValue prop : props) {
            result.add(new KeyValue(prop.readonly(), prop.optional(), prop.key(), simplify(prop.value())));
        }
        return result;
    }
}
