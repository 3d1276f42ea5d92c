package com.relcore.command;

import com.relcore.expression.AttributeReference;
import com.relcore.row.Row;
import com.relcore.session.Session;
import java.util.List;
import java.util.Objects;

/**
 * {@code UNCACHE TABLE name}. Does nothing if the table is not cached.
 */
public final class UncacheTableCommand extends RunnableCommand {

    private final String tableName;

    public UncacheTableCommand(String tableName) {
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
    }

    public String tableName() {
        return tableName;
    }

    @Override
    public List<Row> run(Session session) {
        session.uncacheTable(tableName);
        return List.of();
    }

    @Override
    public List<AttributeReference> output() {
        return List.of();
    }

    @Override
    protected List<Object> args() {
        return List.of(tableName);
    }

    @Override
    public String argString() {
        return tableName;
    }
}
