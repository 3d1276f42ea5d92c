package com.relcore.analysis;

import com.relcore.catalog.Catalog;
import com.relcore.expression.Alias;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.AttributeSet;
import com.relcore.expression.ExprId;
import com.relcore.expression.Expression;
import com.relcore.expression.Expressions;
import com.relcore.expression.NamedExpression;
import com.relcore.logical.Aggregate;
import com.relcore.logical.Join;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.MultiInstanceRelation;
import com.relcore.logical.Project;
import com.relcore.rules.Rule;
import com.relcore.rules.RuleExecutor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns unresolved logical plans into fully typed plans.
 *
 * <p>The analyzer replaces table references with catalog plans, attribute names
 * with the attributes they denote, function names with registry expressions,
 * and gives every projected expression a name. Running it on a plan it has
 * already analyzed returns that same plan.
 *
 * <p>Failures are reported by {@link CheckAnalysis}, which callers run on the
 * result; the rules themselves leave what they cannot resolve untouched.
 */
public class Analyzer extends RuleExecutor<LogicalPlan> {

    /** Iteration limit of the resolution batch. */
    public static final int MAX_ITERATIONS = 100;

    private final Catalog catalog;
    private final FunctionRegistry registry;
    private final Resolver resolver;
    private final List<Batch<LogicalPlan>> batches;

    /**
     * Creates an analyzer.
     *
     * @param catalog the catalog used to resolve table references
     * @param registry the function registry
     * @param caseSensitive whether attribute names are case sensitive
     */
    public Analyzer(Catalog catalog, FunctionRegistry registry, boolean caseSensitive) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = Resolver.forCaseSensitivity(caseSensitive);
        this.batches = List.of(
            new Batch<>("Resolution", new FixedPoint(MAX_ITERATIONS), List.of(
                new ResolveRelations(),
                new ResolveReferences(),
                new ResolveFunctions(),
                new ResolveAliases(),
                new GlobalAggregates())));
    }

    public Resolver resolver() {
        return resolver;
    }

    @Override
    protected List<Batch<LogicalPlan>> batches() {
        return batches;
    }

    /**
     * Replaces table references with the plans registered in the catalog.
     */
    final class ResolveRelations implements Rule<LogicalPlan> {

        @Override
        public LogicalPlan apply(LogicalPlan plan) {
            return plan.transformUp(node -> {
                if (node instanceof UnresolvedRelation) {
                    UnresolvedRelation relation = (UnresolvedRelation) node;
                    return catalog.lookupRelation(relation.tableIdentifier(), relation.alias());
                }
                return node;
            });
        }
    }

    /**
     * Resolves attribute names and stars against the output of each node's
     * children, and separates the two sides of a self join.
     */
    final class ResolveReferences implements Rule<LogicalPlan> {

        @Override
        public LogicalPlan apply(LogicalPlan plan) {
            return plan.transformUp(node -> {
                if (!node.childrenResolved()) {
                    return node;
                }
                if (node instanceof Join) {
                    LogicalPlan deduplicated = dedupRight((Join) node);
                    if (deduplicated != node) {
                        return deduplicated;
                    }
                }
                if (node instanceof Project && containsStar(((Project) node).projectList())) {
                    Project project = (Project) node;
                    return new Project(project.child(), expandStars(project.projectList(), project.child()));
                }
                if (node instanceof Aggregate && containsStar(((Aggregate) node).aggregateExpressions())) {
                    Aggregate aggregate = (Aggregate) node;
                    return new Aggregate(aggregate.child(), aggregate.groupingExpressions(),
                        expandStars(aggregate.aggregateExpressions(), aggregate.child()));
                }
                return node.transformExpressionsUp(e -> {
                    if (e instanceof UnresolvedAttribute) {
                        Optional<AttributeReference> resolved =
                            node.resolveChildren(((UnresolvedAttribute) e).nameParts(), resolver);
                        if (resolved.isPresent()) {
                            return resolved.get();
                        }
                    }
                    return e;
                });
            });
        }

        private boolean containsStar(List<NamedExpression> expressions) {
            for (NamedExpression expression : expressions) {
                if (expression instanceof UnresolvedStar) {
                    return true;
                }
            }
            return false;
        }

        private List<NamedExpression> expandStars(List<NamedExpression> expressions, LogicalPlan child) {
            List<NamedExpression> expanded = new ArrayList<>();
            for (NamedExpression expression : expressions) {
                if (expression instanceof UnresolvedStar) {
                    expanded.addAll(((UnresolvedStar) expression).expand(child.output(), resolver));
                } else {
                    expanded.add(expression);
                }
            }
            return expanded;
        }

        private LogicalPlan dedupRight(Join join) {
            AttributeSet conflicting = AttributeSet.fromAttributes(join.left().output())
                .intersect(AttributeSet.fromAttributes(join.right().output()));
            if (conflicting.isEmpty()) {
                return join;
            }
            Optional<LogicalPlan> oldRelation = join.right().find(node ->
                node instanceof MultiInstanceRelation
                    && !AttributeSet.fromAttributes(node.output()).intersect(conflicting).isEmpty());
            if (oldRelation.isEmpty()) {
                return join;
            }
            LogicalPlan newRelation = ((MultiInstanceRelation) oldRelation.get()).newInstance();
            Map<ExprId, AttributeReference> rewrites = new HashMap<>();
            List<AttributeReference> oldOutput = oldRelation.get().output();
            List<AttributeReference> newOutput = newRelation.output();
            for (int i = 0; i < oldOutput.size(); i++) {
                rewrites.put(oldOutput.get(i).exprId(), newOutput.get(i));
            }
            LogicalPlan newRight = join.right()
                .transformUp(node -> node == oldRelation.get() ? newRelation : node)
                .transformAllExpressions(e -> {
                    if (e instanceof AttributeReference) {
                        AttributeReference attribute = (AttributeReference) e;
                        AttributeReference replacement = rewrites.get(attribute.exprId());
                        if (replacement != null) {
                            return replacement.withQualifiers(attribute.qualifiers());
                        }
                    }
                    return e;
                });
            return join.withNewChildren(List.of(join.left(), newRight));
        }
    }

    /**
     * Replaces function calls whose arguments are resolved with registry expressions.
     */
    final class ResolveFunctions implements Rule<LogicalPlan> {

        @Override
        public LogicalPlan apply(LogicalPlan plan) {
            return plan.transformAllExpressions(e -> {
                if (e instanceof UnresolvedFunction && e.childrenResolved()) {
                    UnresolvedFunction function = (UnresolvedFunction) e;
                    return registry.lookupFunction(function.name(), function.children());
                }
                return e;
            });
        }
    }

    /**
     * Names projected expressions that were not given an explicit alias.
     */
    static final class ResolveAliases implements Rule<LogicalPlan> {

        @Override
        public LogicalPlan apply(LogicalPlan plan) {
            return plan.transformAllExpressions(e -> {
                if (e instanceof UnresolvedAlias && e.childrenResolved()) {
                    Expression child = ((UnresolvedAlias) e).child();
                    if (child instanceof NamedExpression) {
                        return child;
                    }
                    return new Alias(child, child.toString());
                }
                return e;
            });
        }
    }

    /**
     * Turns a projection containing aggregate functions into a global aggregate.
     */
    static final class GlobalAggregates implements Rule<LogicalPlan> {

        @Override
        public LogicalPlan apply(LogicalPlan plan) {
            return plan.transformUp(node -> {
                if (node instanceof Project) {
                    Project project = (Project) node;
                    for (NamedExpression expression : project.projectList()) {
                        if (Expressions.containsAggregate(expression)) {
                            return new Aggregate(project.child(), Collections.emptyList(), project.projectList());
                        }
                    }
                }
                return node;
            });
        }
    }
}
