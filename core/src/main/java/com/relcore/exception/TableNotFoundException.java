package com.relcore.exception;

/**
 * Thrown when a catalog lookup names a table that is not registered.
 */
public class TableNotFoundException extends AnalysisException {

    private final String tableName;

    public TableNotFoundException(String tableName) {
        super("Table not found: " + tableName);
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
