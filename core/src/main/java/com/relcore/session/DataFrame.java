package com.relcore.session;

import com.relcore.analysis.UnresolvedAlias;
import com.relcore.analysis.UnresolvedAttribute;
import com.relcore.command.RunnableCommand;
import com.relcore.exception.AnalysisException;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.Expression;
import com.relcore.expression.NamedExpression;
import com.relcore.expression.SortOrder;
import com.relcore.logical.Filter;
import com.relcore.logical.Join;
import com.relcore.logical.Limit;
import com.relcore.logical.LocalRelation;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Project;
import com.relcore.logical.Sort;
import com.relcore.logical.Subquery;
import com.relcore.row.Row;
import com.relcore.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A query over the tables of a session.
 *
 * <p>Data frames are analyzed when created, so an invalid query fails at the
 * operation that made it invalid. A data frame over a command runs the command
 * when created and then holds its result rows.
 *
 * <p>Transformations return new data frames; nothing runs until
 * {@link #collect()} or {@link #count()} is called.
 */
public class DataFrame {

    private final Session session;
    private final QueryExecution queryExecution;
    private final LogicalPlan logicalPlan;

    /**
     * Creates a data frame and analyzes its plan.
     *
     * @param session the session
     * @param plan the logical plan
     * @throws AnalysisException if the plan cannot be analyzed
     */
    public DataFrame(Session session, LogicalPlan plan) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.queryExecution = session.executePlan(plan);
        LogicalPlan analyzed = queryExecution.analyzed();
        if (analyzed instanceof RunnableCommand) {
            List<Row> rows = new ArrayList<>();
            queryExecution.toRows().forEach(rows::add);
            this.logicalPlan = new LocalRelation(analyzed.output(), rows);
        } else {
            this.logicalPlan = analyzed;
        }
    }

    public Session session() {
        return session;
    }

    public QueryExecution queryExecution() {
        return queryExecution;
    }

    /**
     * Returns the analyzed plan, or the command result for a command.
     *
     * @return the plan further operations build on
     */
    public LogicalPlan logicalPlan() {
        return logicalPlan;
    }

    public StructType schema() {
        return logicalPlan.schema();
    }

    public List<String> columns() {
        List<String> names = new ArrayList<>();
        for (AttributeReference attribute : logicalPlan.output()) {
            names.add(attribute.name());
        }
        return names;
    }

    /**
     * Returns the resolved column of this data frame with the given name.
     * Useful to tell apart equally named columns in a join.
     *
     * @param name the column name, optionally qualified
     * @return the column
     * @throws AnalysisException if no column or more than one column matches
     */
    public NamedExpression col(String name) {
        if (name.equals("*")) {
            return Functions.col(name);
        }
        List<String> nameParts = UnresolvedAttribute.quoted(name).nameParts();
        return logicalPlan.resolve(nameParts, session.analyzer().resolver())
            .orElseThrow(() -> new AnalysisException(
                "Cannot resolve column name \"%s\" among (%s)".formatted(name, String.join(", ", columns()))));
    }

    // ------------------------------------------------------------------
    // Transformations
    // ------------------------------------------------------------------

    public DataFrame select(Expression... columns) {
        return select(Arrays.asList(columns));
    }

    public DataFrame select(String... columnNames) {
        List<Expression> columns = new ArrayList<>();
        for (String name : columnNames) {
            columns.add(Functions.col(name));
        }
        return select(columns);
    }

    public DataFrame select(List<? extends Expression> columns) {
        return withPlan(new Project(logicalPlan, named(columns)));
    }

    public DataFrame filter(Expression condition) {
        return withPlan(new Filter(logicalPlan, condition));
    }

    public DataFrame where(Expression condition) {
        return filter(condition);
    }

    /**
     * Cartesian product with another data frame.
     *
     * @param right the other side
     * @return the joined data frame
     */
    public DataFrame join(DataFrame right) {
        return withPlan(new Join(logicalPlan, right.logicalPlan, Join.JoinType.INNER, null));
    }

    public DataFrame join(DataFrame right, Expression condition) {
        return join(right, condition, Join.JoinType.INNER);
    }

    public DataFrame join(DataFrame right, Expression condition, Join.JoinType joinType) {
        return withPlan(new Join(logicalPlan, right.logicalPlan, joinType, condition));
    }

    public GroupedData groupBy(Expression... columns) {
        return new GroupedData(this, Arrays.asList(columns));
    }

    public GroupedData groupBy(String... columnNames) {
        List<Expression> columns = new ArrayList<>();
        for (String name : columnNames) {
            columns.add(Functions.col(name));
        }
        return new GroupedData(this, columns);
    }

    /**
     * Aggregates over all rows without grouping.
     *
     * @param aggregates the aggregate expressions
     * @return a one-row data frame
     */
    public DataFrame agg(Expression... aggregates) {
        return new GroupedData(this, List.of()).agg(aggregates);
    }

    /**
     * Sorts globally. Expressions that are not already {@link SortOrder}s sort ascending.
     *
     * @param columns the sort keys
     * @return the sorted data frame
     */
    public DataFrame orderBy(Expression... columns) {
        List<SortOrder> order = new ArrayList<>();
        for (Expression column : columns) {
            order.add(column instanceof SortOrder ? (SortOrder) column : new SortOrder(column, true));
        }
        return withPlan(new Sort(logicalPlan, order, true));
    }

    public DataFrame sort(Expression... columns) {
        return orderBy(columns);
    }

    public DataFrame limit(int n) {
        return withPlan(new Limit(logicalPlan, n));
    }

    /**
     * Qualifies every column with an alias, for use in self-joins.
     *
     * @param alias the alias
     * @return the aliased data frame
     */
    public DataFrame as(String alias) {
        return withPlan(new Subquery(alias, logicalPlan));
    }

    // ------------------------------------------------------------------
    // Actions
    // ------------------------------------------------------------------

    public List<Row> collect() {
        List<Row> rows = new ArrayList<>();
        queryExecution.toRows().forEach(rows::add);
        return rows;
    }

    public long count() {
        Row row = new GroupedData(this, List.of()).count().collect().get(0);
        return (Long) row.get(0);
    }

    /**
     * Caches the result of this data frame. The rows are materialized on the first scan.
     *
     * @return this data frame
     */
    public DataFrame cache() {
        session.cacheManager().cacheQuery(this, null);
        return this;
    }

    public DataFrame persist() {
        return cache();
    }

    public DataFrame unpersist() {
        session.cacheManager().tryUncacheQuery(this);
        return this;
    }

    public void registerTempTable(String tableName) {
        session.registerDataFrameAsTable(this, tableName);
    }

    /**
     * Renders the plan.
     *
     * @param extended whether to render every stage or only the physical plan
     * @return the rendering
     */
    public String explain(boolean extended) {
        return extended ? queryExecution.toString() : queryExecution.simpleString();
    }

    @Override
    public String toString() {
        List<String> fields = new ArrayList<>();
        for (AttributeReference attribute : logicalPlan.output()) {
            fields.add(attribute.name() + ": " + attribute.dataType());
        }
        return "[" + String.join(", ", fields) + "]";
    }

    DataFrame withPlan(LogicalPlan plan) {
        return new DataFrame(session, plan);
    }

    static List<NamedExpression> named(List<? extends Expression> expressions) {
        List<NamedExpression> named = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            named.add(expression instanceof NamedExpression
                ? (NamedExpression) expression
                : new UnresolvedAlias(expression));
        }
        return named;
    }
}
