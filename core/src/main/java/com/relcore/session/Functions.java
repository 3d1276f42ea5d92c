package com.relcore.session;

import com.relcore.analysis.UnresolvedAttribute;
import com.relcore.analysis.UnresolvedFunction;
import com.relcore.analysis.UnresolvedStar;
import com.relcore.expression.AggregateFunction;
import com.relcore.expression.Alias;
import com.relcore.expression.BinaryExpression;
import com.relcore.expression.Expression;
import com.relcore.expression.Literal;
import com.relcore.expression.NamedExpression;
import com.relcore.expression.SortOrder;
import com.relcore.expression.UnaryExpression;
import java.util.List;

/**
 * Static helpers for building expressions in data frame queries.
 *
 * <p>Example usage:
 * <pre>
 *   import static com.relcore.session.Functions.*;
 *
 *   df.filter(and(gt(col("age"), lit(21)), isNotNull(col("name"))))
 *     .groupBy(col("dept"))
 *     .agg(alias(avg(col("salary")), "avg_salary"));
 * </pre>
 */
public final class Functions {

    private Functions() {
    }

    /**
     * Refers to a column by name. {@code "*"} selects every column and
     * {@code "t.*"} every column of {@code t}.
     *
     * @param name the column name, optionally qualified
     * @return the unresolved column
     */
    public static NamedExpression col(String name) {
        if (name.equals("*")) {
            return new UnresolvedStar(null);
        }
        if (name.endsWith(".*")) {
            return new UnresolvedStar(name.substring(0, name.length() - 2));
        }
        return UnresolvedAttribute.quoted(name);
    }

    public static Literal lit(Object value) {
        return Literal.of(value);
    }

    public static Alias alias(Expression child, String name) {
        return new Alias(child, name);
    }

    // Comparison

    public static Expression eq(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.EQUAL, right);
    }

    public static Expression neq(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.NOT_EQUAL, right);
    }

    public static Expression lt(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.LESS_THAN, right);
    }

    public static Expression leq(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.LESS_THAN_OR_EQUAL, right);
    }

    public static Expression gt(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.GREATER_THAN, right);
    }

    public static Expression geq(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.GREATER_THAN_OR_EQUAL, right);
    }

    public static Expression isNull(Expression child) {
        return new UnaryExpression(UnaryExpression.Operator.IS_NULL, child);
    }

    public static Expression isNotNull(Expression child) {
        return new UnaryExpression(UnaryExpression.Operator.IS_NOT_NULL, child);
    }

    // Logical

    public static Expression and(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.AND, right);
    }

    public static Expression or(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.OR, right);
    }

    public static Expression not(Expression child) {
        return new UnaryExpression(UnaryExpression.Operator.NOT, child);
    }

    // Arithmetic

    public static Expression add(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.ADD, right);
    }

    public static Expression sub(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.SUBTRACT, right);
    }

    public static Expression mul(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.MULTIPLY, right);
    }

    public static Expression div(Expression left, Expression right) {
        return new BinaryExpression(left, BinaryExpression.Operator.DIVIDE, right);
    }

    public static Expression negate(Expression child) {
        return new UnaryExpression(UnaryExpression.Operator.NEGATE, child);
    }

    // Aggregates

    public static Expression count(Expression child) {
        return new AggregateFunction(AggregateFunction.Kind.COUNT, child);
    }

    public static Expression sum(Expression child) {
        return new AggregateFunction(AggregateFunction.Kind.SUM, child);
    }

    public static Expression min(Expression child) {
        return new AggregateFunction(AggregateFunction.Kind.MIN, child);
    }

    public static Expression max(Expression child) {
        return new AggregateFunction(AggregateFunction.Kind.MAX, child);
    }

    public static Expression avg(Expression child) {
        return new AggregateFunction(AggregateFunction.Kind.AVG, child);
    }

    // Registered functions, resolved by name during analysis

    public static Expression upper(Expression child) {
        return callUdf("upper", child);
    }

    public static Expression lower(Expression child) {
        return callUdf("lower", child);
    }

    public static Expression abs(Expression child) {
        return callUdf("abs", child);
    }

    /**
     * Calls a function registered with the session, looked up during analysis.
     *
     * @param name the function name
     * @param arguments the arguments
     * @return the unresolved call
     */
    public static Expression callUdf(String name, Expression... arguments) {
        return new UnresolvedFunction(name, List.of(arguments));
    }

    // Ordering

    public static SortOrder asc(Expression child) {
        return new SortOrder(child, true);
    }

    public static SortOrder desc(Expression child) {
        return new SortOrder(child, false);
    }
}
