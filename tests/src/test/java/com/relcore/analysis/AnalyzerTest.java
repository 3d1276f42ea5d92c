package com.relcore.analysis;

import com.relcore.catalog.SimpleCatalog;
import com.relcore.exception.AnalysisException;
import com.relcore.exception.TableNotFoundException;
import com.relcore.expression.AggregateFunction;
import com.relcore.expression.Alias;
import com.relcore.expression.AttributeReference;
import com.relcore.expression.AttributeSet;
import com.relcore.expression.NamedExpression;
import com.relcore.logical.Aggregate;
import com.relcore.logical.Filter;
import com.relcore.logical.Hint;
import com.relcore.logical.Join;
import com.relcore.logical.LocalRelation;
import com.relcore.logical.LogicalPlan;
import com.relcore.logical.Project;
import com.relcore.test.Fixtures;
import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;
import static com.relcore.session.Functions.*;

import java.util.List;

/**
 * Tests for the analyzer rules and the checks run on their result.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Analyzer Tests")
public class AnalyzerTest extends TestBase {

    private SimpleCatalog catalog;
    private Analyzer analyzer;
    private LocalRelation people;

    @Override
    protected void doSetUp() {
        catalog = new SimpleCatalog(false);
        analyzer = new Analyzer(catalog, SimpleFunctionRegistry.withBuiltins(), false);
        people = LocalRelation.fromSchema(Fixtures.PEOPLE_SCHEMA, Fixtures.PEOPLE);
        catalog.registerTable("people", people);
    }

    private LogicalPlan analyze(LogicalPlan plan) {
        LogicalPlan analyzed = new RemoveHints().apply(analyzer.execute(plan));
        CheckAnalysis.checkAnalysis(analyzed);
        return analyzed;
    }

    @Nested
    @DisplayName("Resolution")
    class ResolutionTests {

        @Test
        @DisplayName("Table references and column names resolve to catalog attributes")
        void testResolveRelationAndAttributes() {
            LogicalPlan plan = new Project(
                new Filter(new UnresolvedRelation("people"), gt(col("AGE"), lit(21))),
                List.of(col("name"), col("people.id")));

            LogicalPlan analyzed = analyze(plan);

            assertThat(analyzed.resolved()).isTrue();
            assertThat(analyzed.output()).extracting(AttributeReference::exprId)
                .containsExactly(people.output().get(1).exprId(), people.output().get(0).exprId());
        }

        @Test
        @DisplayName("Star expands to every input column in order")
        void testStarExpansion() {
            LogicalPlan plan = new Project(new UnresolvedRelation("people"), List.of(col("*")));

            LogicalPlan analyzed = analyze(plan);

            assertThat(analyzed.output()).extracting(AttributeReference::name)
                .containsExactly("id", "name", "age", "dept");
        }

        @Test
        @DisplayName("Unaliased expressions are named after themselves")
        void testUnresolvedAlias() {
            LogicalPlan plan = new Project(new UnresolvedRelation("people"),
                List.of(new UnresolvedAlias(add(col("age"), lit(1)))));

            LogicalPlan analyzed = analyze(plan);

            NamedExpression projected = ((Project) analyzed).projectList().get(0);
            assertThat(projected).isInstanceOf(Alias.class);
            assertThat(analyzed.output().get(0).dataType()).isEqualTo(people.output().get(2).dataType());
        }

        @Test
        @DisplayName("Registered functions resolve case-insensitively")
        void testFunctionResolution() {
            LogicalPlan plan = new Project(new UnresolvedRelation("people"),
                List.of(alias(callUdf("UPPER", col("name")), "upper_name")));

            LogicalPlan analyzed = analyze(plan);

            assertThat(analyzed.output().get(0).name()).isEqualTo("upper_name");
        }

        @Test
        @DisplayName("Projection with an aggregate becomes a global aggregate")
        void testGlobalAggregate() {
            LogicalPlan plan = new Project(new UnresolvedRelation("people"),
                List.of(alias(count(col("id")), "n")));

            LogicalPlan analyzed = analyze(plan);

            assertThat(analyzed).isInstanceOf(Aggregate.class);
            assertThat(((Aggregate) analyzed).groupingExpressions()).isEmpty();
            assertThat(((Alias) ((Aggregate) analyzed).aggregateExpressions().get(0)).child())
                .isInstanceOf(AggregateFunction.class);
        }

        @Test
        @DisplayName("Hints are removed from the analyzed plan")
        void testHintsRemoved() {
            LogicalPlan plan = new Hint("broadcast", new UnresolvedRelation("people"));

            LogicalPlan analyzed = analyze(plan);

            assertThat(analyzed.find(node -> node instanceof Hint)).isEmpty();
        }

        @Test
        @DisplayName("Self join gets distinct attributes on each side")
        void testSelfJoinDeduplication() {
            LogicalPlan plan = new Join(
                new UnresolvedRelation(List.of("people"), "a"),
                new UnresolvedRelation(List.of("people"), "b"),
                Join.JoinType.INNER,
                eq(col("a.id"), col("b.id")));

            LogicalPlan analyzed = analyze(plan);

            Join join = (Join) analyzed;
            AttributeSet left = AttributeSet.fromAttributes(join.left().output());
            AttributeSet right = AttributeSet.fromAttributes(join.right().output());
            assertThat(left.intersect(right).isEmpty()).isTrue();
            assertThat(join.condition()).isPresent();
            assertThat(join.condition().get().references().size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class IdempotenceTests {

        @Test
        @DisplayName("Analyzing an analyzed plan returns the same plan")
        void testFixedPoint() {
            LogicalPlan plan = new Aggregate(
                new Filter(new UnresolvedRelation("people"), isNotNull(col("age"))),
                List.of(col("dept")),
                List.of(col("dept"), alias(max(col("age")), "oldest")));

            LogicalPlan once = analyze(plan);
            LogicalPlan twice = analyze(once);

            assertThat(twice).isSameAs(once);
            assertThat(twice.treeString()).isEqualTo(once.treeString());
            assertThat(twice.sameResult(once)).isTrue();
        }

        @Test
        @DisplayName("Independently analyzed copies of a query have the same result")
        void testIndependentCopiesSameResult() {
            LogicalPlan first = analyze(new Project(new UnresolvedRelation("people"),
                List.of(alias(add(col("age"), lit(1)), "next_age"))));
            LogicalPlan second = analyze(new Project(new UnresolvedRelation("people"),
                List.of(alias(add(col("age"), lit(1)), "next_age"))));

            assertThat(first.sameResult(second)).isTrue();
            assertThat(first.output()).isNotEqualTo(second.output());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Unknown column reports the input columns")
        void testUnknownColumn() {
            LogicalPlan plan = new Project(new UnresolvedRelation("people"), List.of(col("salary")));

            assertThatThrownBy(() -> analyze(plan))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("cannot resolve 'salary' given input columns id, name, age, dept");
        }

        @Test
        @DisplayName("Unknown table fails with TableNotFoundException")
        void testUnknownTable() {
            assertThatThrownBy(() -> analyze(new UnresolvedRelation("nope")))
                .isInstanceOf(TableNotFoundException.class);
        }

        @Test
        @DisplayName("Unknown function fails")
        void testUnknownFunction() {
            LogicalPlan plan = new Project(new UnresolvedRelation("people"),
                List.of(alias(callUdf("frobnicate", col("name")), "x")));

            assertThatThrownBy(() -> analyze(plan))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("undefined function frobnicate");
        }

        @Test
        @DisplayName("Ambiguous reference names the candidates")
        void testAmbiguousReference() {
            LogicalPlan plan = new Project(
                new Join(new UnresolvedRelation(List.of("people"), "a"),
                    new UnresolvedRelation(List.of("people"), "b"), Join.JoinType.INNER, null),
                List.of(col("id")));

            assertThatThrownBy(() -> analyze(plan))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("is ambiguous");
        }

        @Test
        @DisplayName("Non-boolean filter condition is rejected")
        void testNonBooleanFilter() {
            LogicalPlan plan = new Filter(new UnresolvedRelation("people"), col("age"));

            assertThatThrownBy(() -> analyze(plan))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("is not a boolean");
        }

        @Test
        @DisplayName("Ungrouped column in an aggregate is rejected")
        void testUngroupedColumn() {
            LogicalPlan plan = new Aggregate(new UnresolvedRelation("people"),
                List.of(col("dept")),
                List.of(col("name"), alias(count(col("id")), "n")));

            assertThatThrownBy(() -> analyze(plan))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("neither present in the group by");
        }
    }
}
