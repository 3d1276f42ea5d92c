package com.relcore.expression;

import java.util.List;

/**
 * An expression that produces a named output column.
 *
 * <p>Projection and aggregation lists are made of named expressions: each one
 * becomes an attribute of the operator's output.
 */
public interface NamedExpression extends Expression {

    /**
     * Returns the output column name.
     *
     * @return the name
     */
    String name();

    /**
     * Returns the unique identity of the produced column.
     *
     * @return the expression id
     */
    ExprId exprId();

    /**
     * Returns the qualifiers (table or alias names) of the produced column.
     *
     * @return the qualifiers, possibly empty
     */
    List<String> qualifiers();

    /**
     * Returns the attribute through which parents refer to this column.
     *
     * @return the output attribute
     */
    AttributeReference toAttribute();
}
