package com.relcore.catalog;

import com.relcore.exception.TableNotFoundException;
import com.relcore.logical.LogicalPlan;
import java.util.List;
import java.util.Set;

/**
 * Registry mapping table names to logical plans.
 *
 * <p>Table identifiers are lists of name parts; the last part is the table
 * name. Implementations must be safe for concurrent use by independently
 * compiling queries.
 */
public interface Catalog {

    /**
     * Returns whether table names are matched case sensitively.
     *
     * @return true if names are case sensitive
     */
    boolean caseSensitive();

    /**
     * Returns whether a table is registered under the identifier.
     *
     * @param tableIdentifier the table identifier
     * @return true if the table exists
     */
    boolean tableExists(List<String> tableIdentifier);

    /**
     * Looks up a table.
     *
     * <p>Every call returns a new {@code Subquery} wrapper named after the table,
     * itself wrapped in a second {@code Subquery} when an alias is given.
     *
     * @param tableIdentifier the table identifier
     * @param alias an alias for the relation, or null
     * @return the relation
     * @throws TableNotFoundException if no table is registered under the identifier
     */
    LogicalPlan lookupRelation(List<String> tableIdentifier, String alias);

    /**
     * Registers a table, replacing any existing table of the same name.
     *
     * @param tableIdentifier the table identifier
     * @param plan the plan producing the table's rows
     */
    void registerTable(List<String> tableIdentifier, LogicalPlan plan);

    /**
     * Removes a table. Does nothing if the table does not exist.
     *
     * @param tableIdentifier the table identifier
     */
    void unregisterTable(List<String> tableIdentifier);

    /**
     * Removes every table.
     */
    void unregisterAllTables();

    /**
     * Returns the names of all registered tables.
     *
     * @return a snapshot of the table names
     */
    Set<String> getTables();

    default boolean tableExists(String tableName) {
        return tableExists(List.of(tableName));
    }

    default LogicalPlan lookupRelation(String tableName) {
        return lookupRelation(List.of(tableName), null);
    }

    default void registerTable(String tableName, LogicalPlan plan) {
        registerTable(List.of(tableName), plan);
    }

    default void unregisterTable(String tableName) {
        unregisterTable(List.of(tableName));
    }
}
