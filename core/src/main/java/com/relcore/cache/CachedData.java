package com.relcore.cache;

import com.relcore.logical.LogicalPlan;

/**
 * An entry of the cache registry: an analyzed plan and its cached result.
 *
 * @param plan the analyzed plan that was cached
 * @param cachedRepresentation the relation holding the cached rows
 */
public record CachedData(LogicalPlan plan, InMemoryRelation cachedRepresentation) {
}
