package com.relcore.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Static helpers over expression trees: binding, conjunct handling and
 * canonicalisation.
 */
public final class Expressions {

    /** Id given to every alias by {@link #canonicalize}. */
    private static final ExprId CANONICAL_ID = new ExprId(-1);

    private Expressions() {}

    /**
     * Replaces every attribute reference with a {@link BoundReference} to its
     * position in {@code input}.
     *
     * @param expression the expression to bind
     * @param input the attributes of the input rows
     * @param <T> the expression type
     * @return the bound expression
     * @throws IllegalStateException if a referenced attribute is not in the input
     */
    @SuppressWarnings("unchecked")
    public static <T extends Expression> T bindReference(T expression, List<AttributeReference> input) {
        return (T) expression.transformDown(e -> {
            if (e instanceof AttributeReference) {
                AttributeReference attribute = (AttributeReference) e;
                int ordinal = indexOf(input, attribute);
                if (ordinal < 0) {
                    throw new IllegalStateException(
                        "Couldn't find %s in %s".formatted(attribute, input));
                }
                return new BoundReference(ordinal, attribute.dataType(), attribute.nullable());
            }
            return e;
        });
    }

    /**
     * Binds each expression of the list against {@code input}.
     *
     * @param expressions the expressions
     * @param input the attributes of the input rows
     * @param <T> the expression type
     * @return the bound expressions
     */
    public static <T extends Expression> List<T> bindReferences(List<T> expressions,
                                                                List<AttributeReference> input) {
        List<T> bound = new ArrayList<>(expressions.size());
        for (T expression : expressions) {
            bound.add(bindReference(expression, input));
        }
        return bound;
    }

    /**
     * Returns the position of the attribute (by id) in the list, or -1.
     *
     * @param attributes the list to search
     * @param attribute the attribute
     * @return the position, or -1 if absent
     */
    public static int indexOf(List<AttributeReference> attributes, AttributeReference attribute) {
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).exprId().equals(attribute.exprId())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Splits a predicate into its top-level conjuncts.
     *
     * @param condition the predicate
     * @return the conjuncts, in left-to-right order
     */
    public static List<Expression> splitConjunctivePredicates(Expression condition) {
        if (condition instanceof BinaryExpression
                && ((BinaryExpression) condition).operator() == BinaryExpression.Operator.AND) {
            BinaryExpression and = (BinaryExpression) condition;
            List<Expression> result = new ArrayList<>(splitConjunctivePredicates(and.left()));
            result.addAll(splitConjunctivePredicates(and.right()));
            return result;
        }
        return Collections.singletonList(condition);
    }

    /**
     * Combines predicates into a left-deep conjunction.
     *
     * @param predicates the conjuncts
     * @return the conjunction, or empty when there are no predicates
     */
    public static Optional<Expression> and(List<? extends Expression> predicates) {
        Expression result = null;
        for (Expression predicate : predicates) {
            result = result == null
                ? predicate
                : new BinaryExpression(result, BinaryExpression.Operator.AND, predicate);
        }
        return Optional.ofNullable(result);
    }

    /**
     * Rewrites an expression into a form that only depends on its structure and on
     * the positions of the attributes it reads from {@code input}.
     *
     * <p>Two expressions produced by independent analyses of the same query have
     * equal canonical forms even though their attribute and alias ids differ.
     *
     * @param expression the expression
     * @param input the input attributes of the node owning the expression
     * @return the canonical form
     */
    public static Expression canonicalize(Expression expression, List<AttributeReference> input) {
        return expression.transformUp(e -> {
            if (e instanceof AttributeReference) {
                AttributeReference attribute = (AttributeReference) e;
                int ordinal = indexOf(input, attribute);
                return ordinal < 0
                    ? attribute.withQualifiers(Collections.emptyList())
                    : new BoundReference(ordinal, attribute.dataType(), attribute.nullable());
            }
            if (e instanceof Alias) {
                Alias alias = (Alias) e;
                return new Alias(alias.child(), alias.name(), CANONICAL_ID, Collections.emptyList());
            }
            return e;
        });
    }

    /**
     * Returns whether the expression contains an aggregate function call.
     *
     * @param expression the expression
     * @return true if any node is an {@link AggregateFunction}
     */
    public static boolean containsAggregate(Expression expression) {
        return !expression.collect(e -> e instanceof AggregateFunction).isEmpty();
    }

    /**
     * Returns the output attributes of a list of named expressions.
     *
     * @param expressions the named expressions
     * @return their attributes
     */
    public static List<AttributeReference> toAttributes(List<? extends NamedExpression> expressions) {
        List<AttributeReference> attributes = new ArrayList<>(expressions.size());
        for (NamedExpression expression : expressions) {
            attributes.add(expression.toAttribute());
        }
        return attributes;
    }
}
