package io.github.cyfko.metricql.integration;

import io.github.cyfko.metricql.core.api.MetricQuery;
import io.github.cyfko.metricql.core.config.DslPolicy;
import io.github.cyfko.metricql.core.entity.Entity;
import io.github.cyfko.metricql.core.exception.LexicalGapException;
import io.github.cyfko.metricql.core.exception.UnknownIdentifierException;
import io.github.cyfko.metricql.spring.service.MetricQlService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios through the auto-configured service, with the {@code test} profile
 * settings (strict policy, 2023 window, providers 2 and 5, general statistics).
 */
@SpringBootTest(classes = io.github.cyfko.Main.class)
@ActiveProfiles("test")
class MetricQlServiceIntegrationTest {

    @Autowired
    private MetricQlService service;

    @Autowired
    private MetricQuery metricQuery;

    @Autowired
    private DslPolicy dslPolicy;

    @Test
    void shouldApplyProfileSettings() {
        assertEquals(DslPolicy.strict(), dslPolicy);
        assertEquals(List.of(2, 5), metricQuery.options().providerGroupIds());
    }

    @Test
    void shouldCompileFilteredCommand() {
        // WHEN: a command with filter, stats and distribution
        String query = service.fromCommand(
                "/query DTN -filter AND(AGE>=50, SEX==MALE) -stats -distribution DTN:12:0:120");

        // THEN: the whole document matches
        assertEquals("query { getMetrics(filter: { timePeriod: { startDate: \"2023-01-01\", endDate: \"2023-12-31\" } , "
                + "dataOrigin: { providerGroupId: [2, 5] } , caseFilter: { node: { logicalOperator: AND, children: [ "
                + "{ leaf: { integerCaseFilter: { property: \"AGE\", operator: \"GE\", value: 50 } } } , "
                + "{ leaf: { enumCaseFilter: { sexType: { values: [MALE], contains: true } } } } ] } } } ) { "
                + "metric_DTN: metric(metricId: DTN) { kpiGroup { kpi1: kpi(kpiOptions: { lowerBoundary: 0, upperBoundary: 120 } ) { "
                + "caseCount percents normalizedPercents cohortSize normalizedCohortSize median mean variance "
                + "confidenceIntervalMean confidenceIntervalMedian interquartileRange quartiles "
                + "d1: distribution(binCount: 12) { edges caseCount percents normalizedPercents } } } } "
                + "generalStatsGroup { generalStatistics { casesInPeriod filteredCasesInPeriod } } } }", query);
    }

    @Test
    void shouldTranslateAgeRangeEntities() {
        // GIVEN: a lower and an upper age bound with a KPI
        List<Entity> entities = List.of(
                new Entity("age", "40", "lower"),
                new Entity("age", "60", "upper"),
                new Entity("kpi", "age"));

        // WHEN
        String query = service.fromEntities(entities, "age distribution of patients between 40 and 60");

        // THEN: both bounds under one AND, age metric with its default distribution
        assertTrue(query.contains("caseFilter: { node: { logicalOperator: AND, children: [ "
                + "{ leaf: { integerCaseFilter: { property: \"AGE\", operator: \"GE\", value: 40 } } } , "
                + "{ leaf: { integerCaseFilter: { property: \"AGE\", operator: \"LE\", value: 60 } } } ] } }"));
        assertTrue(query.contains("kpi1: kpi(kpiOptions: { lowerBoundary: 0, upperBoundary: 100 } )"));
        assertTrue(query.contains("d1: distribution(binCount: 10)"));
    }

    @Test
    void shouldRejectUnknownIdentifier() {
        assertThrows(UnknownIdentifierException.class, () -> service.fromCommand("/query DTN -filter AND(FOO==BAR)"));
    }

    @Test
    void strictProfileShouldRejectStrayCharacters() {
        assertThrows(LexicalGapException.class, () -> service.fromCommand("/query DTN -filter AND(AGE>=50 ; SEX==MALE)"));
    }
}
