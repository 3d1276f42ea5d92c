package com.relcore.expression;

import com.relcore.row.Row;
import com.relcore.types.DataType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Base interface for all expressions in relcore.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Attribute references (columns of a plan's input)</li>
 *   <li>Arithmetic, comparison and logical operations</li>
 *   <li>Scalar and aggregate function calls</li>
 * </ul>
 *
 * <p>Expressions are immutable trees. The transform methods return the same
 * instance when a rule leaves a subtree untouched, so callers can detect "no
 * change" by reference comparison.
 *
 * <p>Expressions built by the user or a parser may be unresolved (they refer to
 * columns or functions by name). The analyzer replaces every unresolved node
 * before the plan is optimized or planned.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     * @throws IllegalStateException if the expression is unresolved
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Returns the child expressions.
     *
     * @return the children, empty for leaves
     */
    List<Expression> children();

    /**
     * Returns a copy of this expression with the given children.
     *
     * @param newChildren the replacement children, same arity as {@link #children()}
     * @return the new expression
     */
    Expression withNewChildren(List<Expression> newChildren);

    /**
     * Evaluates this expression against an input row.
     *
     * <p>Only bound expressions (attribute references replaced by
     * {@link BoundReference}s) can be evaluated.
     *
     * @param input the input row
     * @return the value, possibly null
     */
    Object eval(Row input);

    /**
     * Returns whether this expression and all its children are resolved.
     *
     * @return true if resolved
     */
    default boolean resolved() {
        return childrenResolved();
    }

    /**
     * Returns whether all children are resolved.
     *
     * @return true if every child is resolved
     */
    default boolean childrenResolved() {
        for (Expression child : children()) {
            if (!child.resolved()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks the data types of the inputs of this expression.
     *
     * @return an error message when the input types are invalid, empty otherwise
     */
    default Optional<String> checkInputDataTypes() {
        return Optional.empty();
    }

    /**
     * Returns the set of attributes referenced anywhere in this expression.
     *
     * @return the referenced attributes
     */
    default AttributeSet references() {
        AttributeSet result = AttributeSet.empty();
        for (Expression child : children()) {
            result = result.union(child.references());
        }
        return result;
    }

    /**
     * Applies {@code f} to each child and rebuilds this node if any child changed.
     *
     * @param f the child mapping
     * @return this expression, or a copy with new children
     */
    default Expression mapChildren(UnaryOperator<Expression> f) {
        List<Expression> children = children();
        if (children.isEmpty()) {
            return this;
        }
        boolean changed = false;
        List<Expression> mapped = new ArrayList<>(children.size());
        for (Expression child : children) {
            Expression next = f.apply(child);
            changed |= next != child;
            mapped.add(next);
        }
        return changed ? withNewChildren(mapped) : this;
    }

    /**
     * Applies {@code rule} to this node first, then recursively to the children
     * of the result.
     *
     * @param rule returns its argument unchanged when it does not apply
     * @return the transformed expression
     */
    default Expression transformDown(UnaryOperator<Expression> rule) {
        Expression afterRule = rule.apply(this);
        return afterRule.mapChildren(child -> child.transformDown(rule));
    }

    /**
     * Applies {@code rule} to the children first, then to this node.
     *
     * @param rule returns its argument unchanged when it does not apply
     * @return the transformed expression
     */
    default Expression transformUp(UnaryOperator<Expression> rule) {
        Expression afterChildren = mapChildren(child -> child.transformUp(rule));
        return rule.apply(afterChildren);
    }

    /**
     * Returns every node of this tree (pre-order) matching the predicate.
     *
     * @param predicate the node filter
     * @return the matching nodes
     */
    default List<Expression> collect(Predicate<Expression> predicate) {
        List<Expression> result = new ArrayList<>();
        if (predicate.test(this)) {
            result.add(this);
        }
        for (Expression child : children()) {
            result.addAll(child.collect(predicate));
        }
        return result;
    }
}
