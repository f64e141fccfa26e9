package io.github.cyfko.metricql.core.compiler;

import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.model.AgeFilter;
import io.github.cyfko.metricql.core.model.BooleanFilter;
import io.github.cyfko.metricql.core.model.BooleanProperty;
import io.github.cyfko.metricql.core.model.DateFilter;
import io.github.cyfko.metricql.core.model.DistributionSpec;
import io.github.cyfko.metricql.core.model.GroupBy;
import io.github.cyfko.metricql.core.model.Kpi;
import io.github.cyfko.metricql.core.model.LogicalNode;
import io.github.cyfko.metricql.core.model.MetricSpec;
import io.github.cyfko.metricql.core.model.MetricsCollection;
import io.github.cyfko.metricql.core.model.NihssFilter;
import io.github.cyfko.metricql.core.model.SexFilter;
import io.github.cyfko.metricql.core.model.SexType;
import io.github.cyfko.metricql.core.model.StrokeFilter;
import io.github.cyfko.metricql.core.model.StrokeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryCompiler")
class QueryCompilerTest {

    private final QueryCompiler compiler = new QueryCompiler();

    private static int occurrences(String text, String fragment) {
        Matcher matcher = Pattern.compile(Pattern.quote(fragment)).matcher(text);
        int count = 0;
        while (matcher.find()) count++;
        return count;
    }

    @Nested
    @DisplayName("Complete documents")
    class CompleteDocuments {

        @Test
        @DisplayName("Should compile a filtered metric with stats and distribution")
        void shouldCompileFilteredMetric() {
            // Given
            MetricsCollection metrics = new MetricsCollection(List.of(
                    new MetricSpec(Kpi.DTN, true, new DistributionSpec(12, 0, 120))));
            FilterNode filter = LogicalNode.and(new AgeFilter(Comparison.GE, 50), new SexFilter(SexType.MALE));

            // When
            String query = compiler.compile(metrics, filter);

            // Then
            assertEquals("query { getMetrics(filter: { timePeriod: { startDate: \"1000-01-01\", endDate: \"9999-12-31\" } , "
                    + "dataOrigin: { providerGroupId: [1] } , caseFilter: { node: { logicalOperator: AND, children: [ "
                    + "{ leaf: { integerCaseFilter: { property: \"AGE\", operator: \"GE\", value: 50 } } } , "
                    + "{ leaf: { enumCaseFilter: { sexType: { values: [MALE], contains: true } } } } ] } } } ) { "
                    + "metric_DTN: metric(metricId: DTN) { kpiGroup { kpi1: kpi(kpiOptions: { lowerBoundary: 0, upperBoundary: 120 } ) { "
                    + "caseCount percents normalizedPercents cohortSize normalizedCohortSize median mean variance "
                    + "confidenceIntervalMean confidenceIntervalMedian interquartileRange quartiles "
                    + "d1: distribution(binCount: 12) { edges caseCount percents normalizedPercents } } } } } }", query);
        }

        @Test
        @DisplayName("Should compile a grouped query with options and general statistics")
        void shouldCompileGroupedQuery() {
            // Given
            QueryOptions options = QueryOptions.builder()
                    .timePeriod(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31))
                    .providerGroupIds(List.of(2, 5))
                    .includeGeneralStats(true)
                    .build();

            // When
            String query = new QueryCompiler(options).compile(
                    new MetricsCollection(List.of(new MetricSpec(Kpi.AGE)), GroupBy.INR_MODE), null);

            // Then
            assertEquals("query { getMetrics(filter: { timePeriod: { startDate: \"2023-01-01\", endDate: \"2023-12-31\" } , "
                    + "dataOrigin: { providerGroupId: [2, 5] } } , groupBy: INR_MODE) { "
                    + "metric_AGE: metric(metricId: AGE) { kpiGroup { kpi1: kpi { caseCount } groupedBy { groupItemName } } } "
                    + "generalStatsGroup { generalStatistics { casesInPeriod filteredCasesInPeriod } } } }", query);
        }

        @Test
        @DisplayName("Explicit options override the compiler's own")
        void explicitOptionsOverride() {
            QueryOptions options = QueryOptions.builder().providerGroupIds(List.of(9)).build();

            String query = compiler.compile(List.of(new MetricSpec(Kpi.DTN)), Optional.empty(), Optional.empty(), options);

            assertTrue(query.contains("providerGroupId: [9]"));
            assertFalse(query.contains("caseFilter"));
            assertFalse(query.contains("groupBy"));
        }

        @Test
        @DisplayName("Empty metric list still yields a valid envelope")
        void emptyMetricsYieldEnvelope() {
            String query = compiler.compile(MetricsCollection.empty(), null);

            assertTrue(query.startsWith("query { getMetrics(filter: { timePeriod:"));
            assertTrue(query.endsWith(") { } }"));
            assertFalse(query.contains("metric_"));
        }
    }

    @Nested
    @DisplayName("Case filter rendering")
    class CaseFilter {

        @Test
        @DisplayName("Every leaf kind has its own shape")
        void shouldRenderEveryLeafKind() {
            FilterNode filter = LogicalNode.or(
                    new NihssFilter(Comparison.LT, 5),
                    new DateFilter(Comparison.LE, LocalDate.of(2024, 3, 31)),
                    LogicalNode.not(new StrokeFilter(StrokeType.TRANSIENT_ISCHEMIC)),
                    new BooleanFilter(BooleanProperty.THROMBECTOMY, false));

            String query = compiler.compile(MetricsCollection.empty(), filter);

            assertTrue(query.contains("{ integerCaseFilter: { property: \"ADMISSION_NIHSS\", operator: \"LT\", value: 5 } }"));
            assertTrue(query.contains("{ dateCaseFilter: { property: \"DISCHARGE_DATE\", operator: \"LE\", value: \"2024-03-31\" } }"));
            assertTrue(query.contains("{ node: { logicalOperator: NOT, children: [ { leaf: { enumCaseFilter: { strokeType: { values: [TRANSIENT_ISCHEMIC], contains: true } } } } ] } }"));
            assertTrue(query.contains("{ booleanCaseFilter: { property: \"THROMBECTOMY\", value: false } }"));
            assertTrue(query.contains("logicalOperator: OR"));
        }

        @Test
        @DisplayName("Node and leaf counts match the rendered tree")
        void countsMatchRenderedTree() {
            LogicalNode filter = LogicalNode.and(
                    new AgeFilter(Comparison.GE, 18),
                    LogicalNode.or(new SexFilter(SexType.FEMALE), new SexFilter(SexType.OTHER)),
                    LogicalNode.not(LogicalNode.and(new NihssFilter(Comparison.GT, 20))));

            String query = compiler.compile(MetricsCollection.empty(), filter);

            assertEquals(filter.leafCount(), occurrences(query, "leaf:"));
            assertEquals(filter.nodeCount() - filter.leafCount(), occurrences(query, "node:"));
        }
    }

    @Nested
    @DisplayName("Metric fields")
    class MetricFields {

        @Test
        @DisplayName("Metric without distribution has a bare kpi selection")
        void bareKpi() {
            assertEquals("metric_DTN: metric(metricId: DTN) { kpiGroup { kpi1: kpi { caseCount } } }",
                    QueryCompiler.metricField(new MetricSpec(Kpi.DTN), false));
        }

        @Test
        @DisplayName("Stats add the summary fields after caseCount")
        void statsAddSummaryFields() {
            String field = QueryCompiler.metricField(new MetricSpec(Kpi.AGE, true, Optional.empty()), false);

            assertTrue(field.contains("{ caseCount " + String.join(" ", QueryCompiler.STATS_FIELDS) + " }"));
            assertFalse(field.contains("distribution"));
        }

        @Test
        @DisplayName("Metrics keep their order")
        void metricsKeepOrder() {
            String query = compiler.compile(new MetricsCollection(List.of(
                    new MetricSpec(Kpi.DTN), new MetricSpec(Kpi.AGE), new MetricSpec(Kpi.AA_DTN_LE60))), null);

            int dtn = query.indexOf("metric_DTN:");
            int age = query.indexOf("metric_AGE:");
            int award = query.indexOf("metric_AA_DTN_LE60:");
            assertTrue(dtn > 0 && dtn < age && age < award);
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Should collapse whitespace and pad braces")
        void shouldCleanWhitespace() {
            assertEquals("a { b } c", QueryCompiler.clean("  a{b}\n\tc "));
            assertEquals("x { } }", QueryCompiler.clean("x{}}"));
        }

        @Test
        @DisplayName("Output is deterministic and single-line")
        void shouldBeDeterministic() {
            MetricsCollection metrics = new MetricsCollection(List.of(new MetricSpec(Kpi.DTN, true, new DistributionSpec(12, 0, 120))),
                    GroupBy.FIRST_CONTACT_PLACE);
            FilterNode filter = LogicalNode.and(new AgeFilter(Comparison.GE, 50));

            String first = compiler.compile(metrics, filter);
            String second = compiler.compile(metrics, filter);

            assertEquals(first, second);
            assertFalse(first.contains("\n"));
            assertFalse(first.contains("  "));
        }
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNulls() {
        MetricsCollection none = null;
        assertThrows(NullPointerException.class, () -> compiler.compile(none, null));
        assertThrows(NullPointerException.class, () -> compiler.compile(List.of(), null, Optional.empty()));
        assertThrows(NullPointerException.class, () -> new QueryCompiler(null));
    }

    @Nested
    @DisplayName("QueryOptions")
    class Options {

        @Test
        @DisplayName("Defaults cover the widest window and provider 1")
        void defaults() {
            QueryOptions options = QueryOptions.defaults();

            assertEquals(LocalDate.of(1000, 1, 1), options.startDate());
            assertEquals(LocalDate.of(9999, 12, 31), options.endDate());
            assertEquals(List.of(1), options.providerGroupIds());
            assertFalse(options.includeGeneralStats());
            assertEquals(options, compiler.getOptions());
        }

        @Test
        @DisplayName("Should reject inverted windows and empty providers")
        void shouldValidate() {
            assertThrows(IllegalArgumentException.class, () -> QueryOptions.builder()
                    .timePeriod(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)).build());
            assertThrows(IllegalArgumentException.class, () -> QueryOptions.builder().providerGroupIds(List.of()).build());
            assertThrows(IllegalArgumentException.class, () -> QueryOptions.builder().startDate(null).build());
        }
    }
}
