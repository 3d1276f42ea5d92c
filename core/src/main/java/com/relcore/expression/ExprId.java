package com.relcore.expression;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-unique identity of a named expression.
 *
 * <p>Two attributes with the same name but different origins carry different ids,
 * so they stay distinguishable after self joins or re-aliasing.
 *
 * @param id the numeric id
 */
public record ExprId(long id) {

    private static final AtomicLong CURRENT = new AtomicLong();

    /**
     * Allocates a fresh id.
     *
     * @return a new, never previously returned id
     */
    public static ExprId newExprId() {
        return new ExprId(CURRENT.getAndIncrement());
    }

    @Override
    public String toString() {
        return Long.toString(id);
    }
}
