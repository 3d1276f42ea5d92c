package com.relcore.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relcore.analysis.CheckAnalysis;
import com.relcore.analysis.RemoveHints;
import com.relcore.exception.AnalysisException;
import com.relcore.exception.PlanningException;
import com.relcore.execution.PhysicalPlan;
import com.relcore.logical.LogicalPlan;
import com.relcore.row.Row;
import com.relcore.util.OnceCell;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The pipeline that turns one logical plan into rows.
 *
 * <p>Stages, each computed at most once on first access:
 * <ol>
 *   <li>{@link #analyzed()} - resolved, hint-free and checked</li>
 *   <li>{@link #withCachedData()} - cached fragments replaced by cache scans</li>
 *   <li>{@link #optimizedPlan()} - optimizer rules applied</li>
 *   <li>{@link #sparkPlan()} - the first candidate of the planner</li>
 *   <li>{@link #executedPlan()} - exchanges inserted</li>
 *   <li>{@link #toRows()} - rows from the execution engine</li>
 * </ol>
 *
 * <p>A failed stage remembers its failure. {@link #toString()} renders every
 * stage it can, showing the error of a failed stage in its place.
 */
public class QueryExecution {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecution.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Session session;
    private final LogicalPlan logical;

    private final OnceCell<LogicalPlan> analyzed;
    private final OnceCell<LogicalPlan> withCachedData;
    private final OnceCell<LogicalPlan> optimizedPlan;
    private final OnceCell<PhysicalPlan> sparkPlan;
    private final OnceCell<PhysicalPlan> executedPlan;
    private final OnceCell<Iterable<Row>> toRows;

    /**
     * Creates the pipeline for a plan. Nothing is computed until a stage is read.
     *
     * @param session the owning session
     * @param logical the parsed or constructed plan
     */
    public QueryExecution(Session session, LogicalPlan logical) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.logical = Objects.requireNonNull(logical, "logical must not be null");

        this.analyzed = new OnceCell<>(() -> {
            LogicalPlan plan = new RemoveHints().apply(session.analyzer().execute(logical));
            CheckAnalysis.checkAnalysis(plan);
            logger.debug("Analyzed plan:\n{}", plan);
            return plan;
        });
        this.withCachedData = new OnceCell<>(() -> session.cacheManager().useCachedData(analyzed()));
        this.optimizedPlan = new OnceCell<>(() -> session.optimizer().execute(withCachedData()));
        this.sparkPlan = new OnceCell<>(() -> session.planner().plan(optimizedPlan()).next());
        this.executedPlan = new OnceCell<>(() -> {
            PhysicalPlan plan = session.prepareForExecution().execute(sparkPlan());
            logger.debug("Prepared physical plan:\n{}", plan);
            return plan;
        });
        this.toRows = new OnceCell<>(() -> {
            PhysicalPlan plan = executedPlan();
            return () -> session.executionEngine().execute(plan);
        });
    }

    public Session session() {
        return session;
    }

    public LogicalPlan logical() {
        return logical;
    }

    /**
     * Returns the analyzed plan.
     *
     * @return the analyzed plan
     * @throws AnalysisException if the plan cannot be analyzed
     */
    public LogicalPlan analyzed() {
        return analyzed.get();
    }

    /**
     * Fails unless the plan can be analyzed.
     *
     * @throws AnalysisException if the plan cannot be analyzed
     */
    public void assertAnalyzed() {
        analyzed();
    }

    public LogicalPlan withCachedData() {
        return withCachedData.get();
    }

    public LogicalPlan optimizedPlan() {
        return optimizedPlan.get();
    }

    /**
     * Returns the selected physical plan.
     *
     * @return the first candidate produced by the planner
     * @throws PlanningException if no strategy can plan the query
     */
    public PhysicalPlan sparkPlan() {
        return sparkPlan.get();
    }

    public PhysicalPlan executedPlan() {
        return executedPlan.get();
    }

    /**
     * Returns the result rows. Every iteration runs the prepared plan again.
     *
     * @return the rows
     */
    public Iterable<Row> toRows() {
        return toRows.get();
    }

    private static <T> String stringOrError(Supplier<T> stage, Function<T, String> render) {
        try {
            return render.apply(stage.get());
        } catch (RuntimeException e) {
            return e.toString();
        }
    }

    /**
     * Renders the physical plan only.
     *
     * @return the dump
     */
    public String simpleString() {
        return "== Physical Plan ==\n" + stringOrError(this::executedPlan, PhysicalPlan::treeString);
    }

    @Override
    public String toString() {
        return "== Parsed Logical Plan ==\n"
            + logical.treeString()
            + "== Analyzed Logical Plan ==\n"
            + stringOrError(this::analyzed, LogicalPlan::treeString)
            + "== Optimized Logical Plan ==\n"
            + stringOrError(this::optimizedPlan, LogicalPlan::treeString)
            + "== Physical Plan ==\n"
            + stringOrError(this::executedPlan, PhysicalPlan::treeString)
            + "Code Generation: "
            + stringOrError(this::executedPlan, plan -> String.valueOf(plan.codegenEnabled()));
    }

    /**
     * Renders every stage as JSON. A failed stage is rendered as {@code {"error": message}}.
     *
     * @return the JSON tree
     */
    public ObjectNode toJson() {
        ObjectNode root = MAPPER.createObjectNode();
        root.set("parsed", logical.toJson(MAPPER));
        putStage(root, "analyzed", this::analyzed, plan -> plan.toJson(MAPPER));
        putStage(root, "optimized", this::optimizedPlan, plan -> plan.toJson(MAPPER));
        putStage(root, "physical", this::executedPlan, plan -> plan.toJson(MAPPER));
        return root;
    }

    private static <T> void putStage(ObjectNode root, String name, Supplier<T> stage, Function<T, ObjectNode> render) {
        try {
            root.set(name, render.apply(stage.get()));
        } catch (RuntimeException e) {
            root.putObject(name).put("error", e.toString());
        }
    }
}
