package com.relcore.analysis;

import com.relcore.exception.AnalysisException;
import com.relcore.expression.Expression;
import java.util.List;

/**
 * Maps function names to builders producing resolved expressions.
 */
public interface FunctionRegistry {

    /**
     * Builds the expression for a call, given its resolved arguments.
     */
    @FunctionalInterface
    interface FunctionBuilder {

        Expression build(List<Expression> children);
    }

    /**
     * Registers a function, replacing any function of the same name.
     *
     * @param name the function name
     * @param builder the builder
     */
    void registerFunction(String name, FunctionBuilder builder);

    /**
     * Resolves a call.
     *
     * @param name the function name
     * @param children the resolved arguments
     * @return the resolved expression
     * @throws AnalysisException if the function is not defined or rejects its arguments
     */
    Expression lookupFunction(String name, List<Expression> children);

    /**
     * Returns whether a function is registered.
     *
     * @param name the function name
     * @return true if the function exists
     */
    boolean functionExists(String name);
}
