package com.relcore.cache;

import com.relcore.exception.TableNotFoundException;
import com.relcore.execution.PhysicalPlan;
import com.relcore.logical.LogicalPlan;
import com.relcore.session.DataFrame;
import com.relcore.session.Session;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of cached query results.
 *
 * <p>Each entry maps an analyzed plan to an {@link InMemoryRelation}. When a
 * query is executed, every fragment of its analyzed plan that has the same
 * result as a cached plan is replaced by a scan of the cached rows.
 *
 * <p>All access goes through one read-write lock. No query is planned or
 * executed while the lock is held.
 */
public class CacheManager {

    private static final Logger logger = LoggerFactory.getLogger(CacheManager.class);

    private final Session session;
    private final List<CachedData> cachedData = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public CacheManager(Session session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    private <T> T readLock(Supplier<T> f) {
        lock.readLock().lock();
        try {
            return f.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T writeLock(Supplier<T> f) {
        lock.writeLock().lock();
        try {
            return f.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns whether the table's current plan is cached.
     *
     * @param tableName the table
     * @return true if cached
     * @throws TableNotFoundException if the table does not exist
     */
    public boolean isCached(String tableName) {
        return lookupCachedData(session.table(tableName)).isPresent();
    }

    /**
     * Caches a table. The rows are materialized on the first scan.
     *
     * @param tableName the table
     * @throws TableNotFoundException if the table does not exist
     */
    public void cacheTable(String tableName) {
        cacheQuery(session.table(tableName), tableName);
    }

    /**
     * Removes a table from the cache. Does nothing if the table is not cached
     * or does not exist.
     *
     * @param tableName the table
     */
    public void uncacheTable(String tableName) {
        if (!session.catalog().tableExists(tableName)) {
            return;
        }
        tryUncacheQuery(session.table(tableName));
    }

    /**
     * Caches the result of a query. Logs a warning and does nothing if an
     * equivalent plan is already cached.
     *
     * @param query the query
     * @param tableName the table being cached, or null
     */
    public void cacheQuery(DataFrame query, String tableName) {
        LogicalPlan planToCache = query.queryExecution().analyzed();
        PhysicalPlan executedPlan = query.queryExecution().executedPlan();
        int batchSize = session.conf().columnBatchSize();
        writeLock(() -> {
            if (lookup(planToCache).isPresent()) {
                logger.warn("Asked to cache already cached data.");
            } else {
                cachedData.add(new CachedData(planToCache,
                    InMemoryRelation.create(batchSize, executedPlan, tableName)));
                logger.debug("Cached {}", tableName == null ? planToCache.simpleString() : tableName);
            }
            return null;
        });
    }

    /**
     * Removes the cached result of a query, if any.
     *
     * @param query the query
     * @return true if an entry was removed
     */
    public boolean tryUncacheQuery(DataFrame query) {
        LogicalPlan planToUncache = query.queryExecution().analyzed();
        return writeLock(() -> {
            for (int i = 0; i < cachedData.size(); i++) {
                if (cachedData.get(i).plan().sameResult(planToUncache)) {
                    CachedData removed = cachedData.remove(i);
                    removed.cachedRepresentation().clear();
                    logger.debug("Uncached {}", planToUncache.simpleString());
                    return true;
                }
            }
            return false;
        });
    }

    /**
     * Returns the cache entry for a query, if any.
     *
     * @param query the query
     * @return the entry
     */
    public Optional<CachedData> lookupCachedData(DataFrame query) {
        return lookupCachedData(query.queryExecution().analyzed());
    }

    /**
     * Returns the cache entry whose plan has the same result as {@code plan}, if any.
     *
     * @param plan an analyzed plan
     * @return the entry
     */
    public Optional<CachedData> lookupCachedData(LogicalPlan plan) {
        return readLock(() -> lookup(plan));
    }

    private Optional<CachedData> lookup(LogicalPlan plan) {
        for (CachedData data : cachedData) {
            if (plan.sameResult(data.plan())) {
                return Optional.of(data);
            }
        }
        return Optional.empty();
    }

    /**
     * Replaces every fragment of an analyzed plan that is cached with a relation
     * reading the cached rows under the fragment's own output attributes.
     *
     * @param plan an analyzed plan
     * @return the plan reading cached data where possible
     */
    public LogicalPlan useCachedData(LogicalPlan plan) {
        return readLock(() -> plan.transformDown(fragment -> {
            Optional<CachedData> cached = lookup(fragment);
            if (cached.isPresent()) {
                return cached.get().cachedRepresentation().withOutput(fragment.output());
            }
            return fragment;
        }));
    }

    /**
     * Drops every cached result.
     */
    public void clearCache() {
        writeLock(() -> {
            for (CachedData data : cachedData) {
                data.cachedRepresentation().clear();
            }
            cachedData.clear();
            logger.debug("Cleared cache");
            return null;
        });
    }

    /**
     * Forces every cached result that depends on {@code plan} to be recomputed
     * on its next scan.
     *
     * @param plan the plan whose data changed
     */
    public void invalidateCache(LogicalPlan plan) {
        writeLock(() -> {
            for (CachedData data : cachedData) {
                if (data.plan().find(fragment -> fragment.sameResult(plan)).isPresent()) {
                    data.cachedRepresentation().recache();
                    logger.debug("Invalidated cached plan {}", data.plan().simpleString());
                }
            }
            return null;
        });
    }

    /**
     * Returns whether nothing is cached.
     *
     * @return true if the registry is empty
     */
    public boolean isEmpty() {
        return readLock(cachedData::isEmpty);
    }
}
