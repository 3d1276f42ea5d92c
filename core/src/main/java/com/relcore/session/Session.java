package com.relcore.session;

import com.relcore.analysis.Analyzer;
import com.relcore.analysis.FunctionRegistry;
import com.relcore.analysis.SimpleFunctionRegistry;
import com.relcore.cache.CacheManager;
import com.relcore.catalog.Catalog;
import com.relcore.catalog.SimpleCatalog;
import com.relcore.exception.TableNotFoundException;
import com.relcore.exception.UnsupportedDialectException;
import com.relcore.execution.PhysicalPlan;
import com.relcore.execution.exchange.AddExchange;
import com.relcore.execution.exchange.PrepareForExecution;
import com.relcore.logical.LocalRelation;
import com.relcore.logical.LogicalPlan;
import com.relcore.optimizer.Optimizer;
import com.relcore.planning.SessionPlanner;
import com.relcore.planning.Strategy;
import com.relcore.row.Row;
import com.relcore.rules.Rule;
import com.relcore.sources.BaseRelation;
import com.relcore.sources.LogicalRelation;
import com.relcore.types.StructType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for working with relational data.
 *
 * <p>A session owns its catalog, function registry, configuration, cache and
 * planner. Every collaborator receives the session, or the part of it it
 * needs, through its constructor.
 *
 * <p>Example usage:
 * <pre>
 *   Session session = Session.builder()
 *       .config(SQLConf.SHUFFLE_PARTITIONS, "4")
 *       .build();
 *   DataFrame people = session.createDataFrame(rows, schema);
 *   people.registerTempTable("people");
 *   session.table("people").filter(Functions.gt(Functions.col("age"), Functions.lit(21))).collect();
 * </pre>
 */
public class Session {

    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private final SQLConf conf;
    private final Map<String, Parser> parsers;
    private final Catalog catalog;
    private final FunctionRegistry functionRegistry;
    private final Analyzer analyzer;
    private final Optimizer optimizer;
    private final CacheManager cacheManager;
    private final SessionPlanner planner;
    private final PrepareForExecution prepareForExecution;
    private final ExecutionEngine executionEngine;
    private final UDFRegistration udf;

    private Session(Builder builder) {
        this.conf = new SQLConf();
        Properties system = System.getProperties();
        for (String key : system.stringPropertyNames()) {
            if (key.startsWith(SQLConf.PREFIX)) {
                conf.setConf(key, system.getProperty(key));
            }
        }
        builder.settings.forEach(conf::setConf);

        this.parsers = Map.copyOf(builder.parsers);
        this.catalog = new SimpleCatalog(conf.caseSensitive());
        this.functionRegistry = SimpleFunctionRegistry.withBuiltins();
        this.analyzer = new Analyzer(catalog, functionRegistry, conf.caseSensitive());
        this.optimizer = new Optimizer(builder.extraOptimizations);
        this.cacheManager = new CacheManager(this);
        this.planner = new SessionPlanner(this, builder.extraStrategies);
        Rule<PhysicalPlan> exchangeRule = builder.preparationRule != null
            ? builder.preparationRule
            : new AddExchange(conf);
        this.prepareForExecution = new PrepareForExecution(exchangeRule);
        this.executionEngine = builder.executionEngine != null
            ? builder.executionEngine
            : new LocalExecutionEngine();
        this.udf = new UDFRegistration(functionRegistry);

        logger.info("Created session (dialect={}, caseSensitive={}, shufflePartitions={})",
            conf.dialect(), conf.caseSensitive(), conf.numShufflePartitions());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * Parses a query with the parser of the configured dialect.
     *
     * @param sqlText the query
     * @return the query as a data frame
     * @throws UnsupportedDialectException if no parser is registered for the dialect
     */
    public DataFrame sql(String sqlText) {
        return new DataFrame(this, parseSql(sqlText));
    }

    /**
     * Parses a query without analyzing it.
     *
     * @param sqlText the query
     * @return the parsed plan
     */
    public LogicalPlan parseSql(String sqlText) {
        String dialect = conf.dialect();
        Parser parser = parsers.get(dialect);
        if (parser == null) {
            throw new UnsupportedDialectException(dialect);
        }
        return parser.parse(sqlText);
    }

    /**
     * Returns a registered table.
     *
     * @param tableName the table
     * @return the table as a data frame
     * @throws TableNotFoundException if no such table is registered
     */
    public DataFrame table(String tableName) {
        return new DataFrame(this, catalog.lookupRelation(tableName));
    }

    /**
     * Creates a data frame over local rows.
     *
     * @param rows the rows
     * @param schema the schema every row must fit
     * @return the data frame
     * @throws IllegalArgumentException if a row does not fit the schema
     */
    public DataFrame createDataFrame(List<Row> rows, StructType schema) {
        for (Row row : rows) {
            schema.validate(row);
        }
        return new DataFrame(this, LocalRelation.fromSchema(schema, rows));
    }

    public DataFrame baseRelationToDataFrame(BaseRelation relation) {
        return new DataFrame(this, new LogicalRelation(relation));
    }

    /**
     * Starts the pipeline for a plan.
     *
     * @param plan the logical plan
     * @return the pipeline
     */
    public QueryExecution executePlan(LogicalPlan plan) {
        return new QueryExecution(this, plan);
    }

    // ------------------------------------------------------------------
    // Temporary tables and caching
    // ------------------------------------------------------------------

    public void registerDataFrameAsTable(DataFrame df, String tableName) {
        catalog.registerTable(tableName, df.logicalPlan());
    }

    /**
     * Drops a temporary table, removing its cached data first. Does nothing if
     * the table does not exist.
     *
     * @param tableName the table
     */
    public void dropTempTable(String tableName) {
        if (!catalog.tableExists(tableName)) {
            return;
        }
        cacheManager.tryUncacheQuery(table(tableName));
        catalog.unregisterTable(tableName);
    }

    public void cacheTable(String tableName) {
        cacheManager.cacheTable(tableName);
    }

    public void uncacheTable(String tableName) {
        cacheManager.uncacheTable(tableName);
    }

    public boolean isCached(String tableName) {
        return cacheManager.isCached(tableName);
    }

    public void clearCache() {
        cacheManager.clearCache();
    }

    // ------------------------------------------------------------------
    // Configuration
    // ------------------------------------------------------------------

    public SQLConf conf() {
        return conf;
    }

    public void setConf(String key, String value) {
        conf.setConf(key, value);
    }

    public String getConf(String key) {
        return conf.getConf(key);
    }

    public String getConf(String key, String defaultValue) {
        return conf.getConf(key, defaultValue);
    }

    public UDFRegistration udf() {
        return udf;
    }

    // ------------------------------------------------------------------
    // Collaborators
    // ------------------------------------------------------------------

    public Catalog catalog() {
        return catalog;
    }

    public FunctionRegistry functionRegistry() {
        return functionRegistry;
    }

    public Analyzer analyzer() {
        return analyzer;
    }

    public Optimizer optimizer() {
        return optimizer;
    }

    public CacheManager cacheManager() {
        return cacheManager;
    }

    public SessionPlanner planner() {
        return planner;
    }

    public PrepareForExecution prepareForExecution() {
        return prepareForExecution;
    }

    public ExecutionEngine executionEngine() {
        return executionEngine;
    }

    /**
     * Builder for {@link Session}.
     */
    public static final class Builder {

        private final Map<String, String> settings = new LinkedHashMap<>();
        private final Map<String, Parser> parsers = new HashMap<>();
        private final List<Strategy> extraStrategies = new ArrayList<>();
        private final List<Rule<LogicalPlan>> extraOptimizations = new ArrayList<>();
        private Rule<PhysicalPlan> preparationRule;
        private ExecutionEngine executionEngine;

        private Builder() {
        }

        /**
         * Sets a configuration value. Values set here win over system properties.
         *
         * @param key the key
         * @param value the value
         * @return this builder
         */
        public Builder config(String key, String value) {
            settings.put(Objects.requireNonNull(key, "key must not be null"),
                Objects.requireNonNull(value, "value must not be null"));
            return this;
        }

        public Builder parser(String dialect, Parser parser) {
            parsers.put(Objects.requireNonNull(dialect, "dialect must not be null"),
                Objects.requireNonNull(parser, "parser must not be null"));
            return this;
        }

        /**
         * Adds a planning strategy tried before the built-in ones, in the order added.
         *
         * @param strategy the strategy
         * @return this builder
         */
        public Builder extraStrategy(Strategy strategy) {
            extraStrategies.add(Objects.requireNonNull(strategy, "strategy must not be null"));
            return this;
        }

        public Builder extraStrategies(List<Strategy> strategies) {
            strategies.forEach(this::extraStrategy);
            return this;
        }

        public Builder extraOptimization(Rule<LogicalPlan> rule) {
            extraOptimizations.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        /**
         * Replaces the rule run once over every physical plan before execution.
         *
         * @param rule the rule, {@link AddExchange} by default
         * @return this builder
         */
        public Builder preparationRule(Rule<PhysicalPlan> rule) {
            this.preparationRule = Objects.requireNonNull(rule, "rule must not be null");
            return this;
        }

        public Builder executionEngine(ExecutionEngine engine) {
            this.executionEngine = Objects.requireNonNull(engine, "engine must not be null");
            return this;
        }

        public Session build() {
            return new Session(this);
        }
    }
}
