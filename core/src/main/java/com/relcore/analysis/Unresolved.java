package com.relcore.analysis;

/**
 * Error helper shared by the unresolved expression and plan nodes.
 */
final class Unresolved {

    private Unresolved() {}

    static IllegalStateException invalidCall(String method, Object node) {
        return new IllegalStateException(
            "Invalid call to %s on unresolved object %s".formatted(method, node));
    }
}
