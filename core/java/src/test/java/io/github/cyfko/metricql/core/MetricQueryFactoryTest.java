package io.github.cyfko.metricql.core;

import io.github.cyfko.metricql.core.alias.AliasRegistry;
import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.api.DslParser;
import io.github.cyfko.metricql.core.api.MetricQuery;
import io.github.cyfko.metricql.core.compiler.QueryOptions;
import io.github.cyfko.metricql.core.config.DslPolicy;
import io.github.cyfko.metricql.core.entity.Entity;
import io.github.cyfko.metricql.core.entity.EntityTranslation;
import io.github.cyfko.metricql.core.exception.DSLSyntaxException;
import io.github.cyfko.metricql.core.exception.InvalidDistributionSpecException;
import io.github.cyfko.metricql.core.exception.LexicalGapException;
import io.github.cyfko.metricql.core.exception.UnknownKpiException;
import io.github.cyfko.metricql.core.model.AgeFilter;
import io.github.cyfko.metricql.core.model.Kpi;
import io.github.cyfko.metricql.core.model.LogicalNode;
import io.github.cyfko.metricql.core.model.MetricSpec;
import io.github.cyfko.metricql.core.model.MetricsCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("MetricQueryFactory")
class MetricQueryFactoryTest {

    private final MetricQuery query = MetricQueryFactory.of();

    @Nested
    @DisplayName("Command lines")
    class CommandLines {

        @Test
        @DisplayName("Should compile a full command end to end")
        void shouldCompileCommand() {
            // When
            String text = query.fromCommand(
                    "/query DTN -filter AND(AGE>=50, SEX==MALE) -stats -distribution DTN:12:0:120");

            // Then
            assertEquals(query.compile(
                    query.buildMetrics(List.of("DTN"), List.of("DTN:12:0:120"), true, null),
                    query.parseFilter("AND(AGE>=50, SEX==MALE)")), text);
            assertTrue(text.contains("metric_DTN: metric(metricId: DTN)"));
            assertTrue(text.contains("d1: distribution(binCount: 12)"));
            assertTrue(text.contains("caseFilter: { node: { logicalOperator: AND"));
        }

        @Test
        @DisplayName("Command without filter has no case filter")
        void commandWithoutFilter() {
            String text = query.fromCommand("/query AGE -group first seen");

            assertFalse(text.contains("caseFilter"));
            assertTrue(text.contains("groupBy: FIRST_CONTACT_PLACE"));
            assertTrue(text.contains("groupedBy { groupItemName }"));
        }

        @Test
        @DisplayName("Errors from any stage propagate")
        void errorsPropagate() {
            assertThrows(UnknownKpiException.class, () -> query.fromCommand("/query HAPPINESS"));
            assertThrows(InvalidDistributionSpecException.class, () -> query.fromCommand("/query DTN -distribution DTN:12:120:0"));
            assertThrows(DSLSyntaxException.class, () -> query.fromCommand("/query DTN -filter AND()"));
        }
    }

    @Nested
    @DisplayName("Entities")
    class Entities {

        @Test
        @DisplayName("Should compile entities with an exclusion message")
        void shouldCompileEntitiesWithExclusion() {
            // Given
            List<Entity> entities = List.of(
                    new Entity("kpi", "door to needle"),
                    new Entity("stroke_type", "ich"));

            // When
            String excluded = query.fromEntities(entities, "DTN excluding brain bleeds");
            String included = query.fromEntities(entities, "DTN for brain bleeds");

            // Then
            assertTrue(excluded.contains("logicalOperator: NOT"));
            assertFalse(included.contains("logicalOperator: NOT"));
            assertTrue(excluded.contains("kpi1: kpi(kpiOptions: { lowerBoundary: 0, upperBoundary: 120 } )"));
        }

        @Test
        @DisplayName("Translation exposes filter and metrics")
        void translationExposesParts() {
            EntityTranslation translation = query.translate(List.of(new Entity("age", "65", "lower"), new Entity("kpi", "AGE")), false);

            assertEquals(LogicalNode.and(new AgeFilter(Comparison.GE, 65)), translation.filter().orElseThrow());
            assertEquals(Kpi.AGE, translation.metrics().metrics().get(0).kpi());
        }
    }

    @Nested
    @DisplayName("Wiring")
    class Wiring {

        @Test
        @DisplayName("Should delegate filter parsing to a custom parser")
        void shouldDelegateToCustomParser() {
            // Given
            DslParser parser = mock(DslParser.class);
            when(parser.parse(anyString())).thenReturn(LogicalNode.and(new AgeFilter(Comparison.LT, 18)));
            MetricQuery custom = MetricQueryFactory.of(parser, QueryOptions.defaults(), AliasRegistry.defaults());

            // When
            String text = custom.fromCommand("/query AGE -filter anything at all");

            // Then
            verify(parser).parse("anything at all");
            verifyNoMoreInteractions(parser);
            assertTrue(text.contains("operator: \"LT\", value: 18"));
        }

        @Test
        @DisplayName("Custom parser is not called without a filter")
        void parserNotCalledWithoutFilter() {
            DslParser parser = mock(DslParser.class);
            MetricQuery custom = MetricQueryFactory.of(parser, QueryOptions.defaults(), AliasRegistry.defaults());

            custom.fromCommand("/query AGE");

            verifyNoInteractions(parser);
        }

        @Test
        @DisplayName("Policy and options are applied")
        void policyAndOptionsAreApplied() {
            QueryOptions options = QueryOptions.builder().providerGroupIds(List.of(4, 8)).includeGeneralStats(true).build();
            MetricQuery strict = MetricQueryFactory.of(DslPolicy.strict(), options);

            assertSame(options, strict.options());
            assertThrows(LexicalGapException.class, () -> strict.parseFilter("AND(AGE>=50; SEX==MALE)"));
            String text = strict.compile(new MetricsCollection(List.of(new MetricSpec(Kpi.AGE))), null);
            assertTrue(text.contains("providerGroupId: [4, 8]"));
            assertTrue(text.contains("generalStatsGroup"));
        }

        @Test
        @DisplayName("Should reject missing collaborators")
        void shouldRejectNulls() {
            DslPolicy noPolicy = null;
            DslParser noParser = null;

            assertThrows(NullPointerException.class, () -> MetricQueryFactory.of(noPolicy, QueryOptions.defaults()));
            assertThrows(NullPointerException.class,
                    () -> MetricQueryFactory.of(noParser, QueryOptions.defaults(), AliasRegistry.defaults()));
        }
    }
}
