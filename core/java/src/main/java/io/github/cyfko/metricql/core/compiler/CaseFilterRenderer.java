package io.github.cyfko.metricql.core.compiler;

import io.github.cyfko.metricql.core.api.FilterVisitor;
import io.github.cyfko.metricql.core.model.AgeFilter;
import io.github.cyfko.metricql.core.model.BooleanFilter;
import io.github.cyfko.metricql.core.model.DateFilter;
import io.github.cyfko.metricql.core.model.LogicalNode;
import io.github.cyfko.metricql.core.model.NihssFilter;
import io.github.cyfko.metricql.core.model.SexFilter;
import io.github.cyfko.metricql.core.model.StrokeFilter;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a filter tree as the {@code caseFilter} argument of the backend query.
 * <p>
 * Every logical node becomes one {@code node} object and every leaf one {@code leaf} object.
 * Property names and comparison codes are quoted strings; enum values, logical operators and
 * booleans are bare identifiers.
 * </p>
 *
 * @since 1.0.0
 */
final class CaseFilterRenderer implements FilterVisitor<String> {

    static final String AGE_PROPERTY = "AGE";
    static final String NIHSS_PROPERTY = "ADMISSION_NIHSS";
    static final String DISCHARGE_DATE_PROPERTY = "DISCHARGE_DATE";

    static final CaseFilterRenderer INSTANCE = new CaseFilterRenderer();

    private CaseFilterRenderer() {}

    @Override
    public String visitLogical(LogicalNode node) {
        String children = node.children().stream()
                .map(child -> child.accept(this))
                .collect(Collectors.joining(", "));
        return "{ node: { logicalOperator: " + node.operator().name() + ", children: [" + children + "] } }";
    }

    @Override
    public String visitAge(AgeFilter filter) {
        return integerLeaf(AGE_PROPERTY, filter.operator().getCode(), filter.value());
    }

    @Override
    public String visitNihss(NihssFilter filter) {
        return integerLeaf(NIHSS_PROPERTY, filter.operator().getCode(), filter.value());
    }

    @Override
    public String visitDate(DateFilter filter) {
        return String.format(Locale.ROOT, "{ leaf: { dateCaseFilter: { property: \"%s\", operator: \"%s\", value: \"%s\" } } }",
                DISCHARGE_DATE_PROPERTY, filter.operator().getCode(), filter.value());
    }

    @Override
    public String visitSex(SexFilter filter) {
        return enumLeaf("sexType", filter.value().name());
    }

    @Override
    public String visitStroke(StrokeFilter filter) {
        return enumLeaf("strokeType", filter.value().name());
    }

    @Override
    public String visitBoolean(BooleanFilter filter) {
        return String.format(Locale.ROOT, "{ leaf: { booleanCaseFilter: { property: \"%s\", value: %b } } }",
                filter.property().name(), filter.value());
    }

    private static String integerLeaf(String property, String operator, int value) {
        return String.format(Locale.ROOT, "{ leaf: { integerCaseFilter: { property: \"%s\", operator: \"%s\", value: %d } } }",
                property, operator, value);
    }

    private static String enumLeaf(String field, String value) {
        return String.format(Locale.ROOT, "{ leaf: { enumCaseFilter: { %s: { values: [%s], contains: true } } } }", field, value);
    }
}
