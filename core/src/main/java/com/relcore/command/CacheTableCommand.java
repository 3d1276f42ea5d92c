package com.relcore.command;

import com.relcore.expression.AttributeReference;
import com.relcore.logical.LogicalPlan;
import com.relcore.row.Row;
import com.relcore.session.DataFrame;
import com.relcore.session.Session;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@code CACHE [LAZY] TABLE name [AS query]}.
 *
 * <p>With a query, the query is registered under the name first. Unless lazy,
 * the cached data is materialized immediately.
 */
public final class CacheTableCommand extends RunnableCommand {

    private final String tableName;
    private final LogicalPlan plan;
    private final boolean isLazy;

    /**
     * @param tableName the table to cache
     * @param plan the query to register under the name, or null
     * @param isLazy whether to defer materialization to the first scan
     */
    public CacheTableCommand(String tableName, LogicalPlan plan, boolean isLazy) {
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.plan = plan;
        this.isLazy = isLazy;
    }

    public String tableName() {
        return tableName;
    }

    public boolean isLazy() {
        return isLazy;
    }

    @Override
    public List<Row> run(Session session) {
        if (plan != null) {
            session.registerDataFrameAsTable(new DataFrame(session, plan), tableName);
        }
        session.cacheTable(tableName);
        if (!isLazy) {
            session.table(tableName).count();
        }
        return List.of();
    }

    @Override
    public List<AttributeReference> output() {
        return List.of();
    }

    @Override
    protected List<Object> args() {
        return Arrays.asList(tableName, plan, isLazy);
    }

    @Override
    public String argString() {
        return (isLazy ? "LAZY " : "") + tableName;
    }
}
