package com.relcore.session;

import com.relcore.exception.ParseException;
import com.relcore.logical.LogicalPlan;

/**
 * Turns query text of one dialect into an unresolved logical plan.
 */
@FunctionalInterface
public interface Parser {

    /**
     * Parses query text.
     *
     * @param sqlText the query
     * @return the unresolved plan
     * @throws ParseException if the text is not valid in this dialect
     */
    LogicalPlan parse(String sqlText);
}
