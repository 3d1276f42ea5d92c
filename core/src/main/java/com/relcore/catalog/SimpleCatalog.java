package com.relcore.catalog;

import com.relcore.analysis.Resolver;
import com.relcore.exception.TableNotFoundException;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Subquery;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link Catalog} backed by a concurrent map.
 *
 * <p>When the catalog is case insensitive, names are lower-cased before they are
 * stored or looked up. Lookups never block on other catalog operations.
 */
public class SimpleCatalog implements Catalog {

    private static final Logger logger = LoggerFactory.getLogger(SimpleCatalog.class);

    private final Map<String, LogicalPlan> tables = new ConcurrentHashMap<>();
    private final boolean caseSensitive;

    public SimpleCatalog(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    @Override
    public boolean caseSensitive() {
        return caseSensitive;
    }

    @Override
    public boolean tableExists(List<String> tableIdentifier) {
        return tables.containsKey(tableName(tableIdentifier));
    }

    @Override
    public LogicalPlan lookupRelation(List<String> tableIdentifier, String alias) {
        String tableName = tableName(tableIdentifier);
        LogicalPlan table = tables.get(tableName);
        if (table == null) {
            throw new TableNotFoundException(String.join(".", tableIdentifier));
        }
        LogicalPlan relation = new Subquery(tableName, table);
        return alias == null ? relation : new Subquery(alias, relation);
    }

    @Override
    public void registerTable(List<String> tableIdentifier, LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        String tableName = tableName(tableIdentifier);
        tables.put(tableName, plan);
        logger.debug("Registered table {}", tableName);
    }

    @Override
    public void unregisterTable(List<String> tableIdentifier) {
        String tableName = tableName(tableIdentifier);
        if (tables.remove(tableName) != null) {
            logger.debug("Unregistered table {}", tableName);
        }
    }

    @Override
    public void unregisterAllTables() {
        tables.clear();
        logger.debug("Unregistered all tables");
    }

    @Override
    public Set<String> getTables() {
        return Set.copyOf(tables.keySet());
    }

    private String tableName(List<String> tableIdentifier) {
        if (tableIdentifier == null || tableIdentifier.isEmpty()) {
            throw new IllegalArgumentException("tableIdentifier must not be empty");
        }
        return Resolver.normalize(tableIdentifier.get(tableIdentifier.size() - 1), caseSensitive);
    }
}
