package com.relcore.analysis;

import java.util.Locale;

/**
 * Decides whether two identifiers name the same thing.
 *
 * <p>The policy is fixed when a session is created and shared by the catalog and
 * the analyzer.
 */
@FunctionalInterface
public interface Resolver {

    Resolver CASE_SENSITIVE = String::equals;

    Resolver CASE_INSENSITIVE = String::equalsIgnoreCase;

    /**
     * Returns whether {@code a} and {@code b} refer to the same name.
     *
     * @param a the first identifier
     * @param b the second identifier
     * @return true if they match under this policy
     */
    boolean resolve(String a, String b);

    /**
     * Returns the resolver for the given case-sensitivity policy.
     *
     * @param caseSensitive whether names are case sensitive
     * @return the resolver
     */
    static Resolver forCaseSensitivity(boolean caseSensitive) {
        return caseSensitive ? CASE_SENSITIVE : CASE_INSENSITIVE;
    }

    /**
     * Normalizes a name the way a catalog with the given policy stores it.
     *
     * @param name the name
     * @param caseSensitive whether names are case sensitive
     * @return the stored form of the name
     */
    static String normalize(String name, boolean caseSensitive) {
        return caseSensitive ? name : name.toLowerCase(Locale.ROOT);
    }
}
