package com.relcore.logical;

/**
 * A leaf relation that may appear more than once in a query.
 *
 * <p>When both sides of a join produce the same attributes, the analyzer
 * replaces one occurrence with a new instance carrying fresh attribute ids.
 */
public interface MultiInstanceRelation {

    /**
     * Returns a copy of this relation whose output attributes have new ids.
     *
     * @return the new instance
     */
    LogicalPlan newInstance();
}
