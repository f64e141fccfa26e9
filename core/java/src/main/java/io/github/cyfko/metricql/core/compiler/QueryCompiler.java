package io.github.cyfko.metricql.core.compiler;

import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.model.DistributionSpec;
import io.github.cyfko.metricql.core.model.GroupBy;
import io.github.cyfko.metricql.core.model.MetricSpec;
import io.github.cyfko.metricql.core.model.MetricsCollection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles a filter tree and a metric list into the single-line text of a backend
 * {@code getMetrics} query.
 *
 * <h2>Document Shape</h2>
 * <pre>
 * query { getMetrics(filter: { timePeriod: { startDate: "…", endDate: "…" },
 *                              dataOrigin: { providerGroupId: [1] },
 *                              caseFilter: … },
 *                    groupBy: FIRST_CONTACT_PLACE) {
 *   metric_DTN: metric(metricId: DTN) {
 *     kpiGroup {
 *       kpi1: kpi(kpiOptions: { lowerBoundary: 0, upperBoundary: 120 }) {
 *         caseCount percents … quartiles
 *         d1: distribution(binCount: 12) { edges caseCount percents normalizedPercents }
 *       }
 *       groupedBy { groupItemName }
 *     }
 *   }
 *   generalStatsGroup { generalStatistics { casesInPeriod filteredCasesInPeriod } }
 * } }
 * </pre>
 * <ul>
 *   <li>{@code caseFilter} is present only when a filter is given.</li>
 *   <li>{@code groupBy} is present only when grouping is requested, and then every metric selects
 *       {@code groupedBy}.</li>
 *   <li>A metric's {@code kpiOptions} carry the bounds of its distribution; without one,
 *       {@code kpi} has no argument list.</li>
 *   <li>The general statistics block is selected when {@link QueryOptions#includeGeneralStats()}
 *       is set.</li>
 * </ul>
 * <p>
 * The output is normalized: whitespace runs collapse to one space and every brace has exactly
 * one space on each side. Compilation is deterministic and never fails on a tree built through
 * the model constructors, which enforce all structural invariants.
 * </p>
 *
 * @since 1.0.0
 */
public class QueryCompiler {

    private static final Logger log = Logger.getLogger(QueryCompiler.class.getName());

    static final List<String> STATS_FIELDS = List.of(
            "percents", "normalizedPercents", "cohortSize", "normalizedCohortSize", "median", "mean",
            "variance", "confidenceIntervalMean", "confidenceIntervalMedian", "interquartileRange", "quartiles");

    static final String DISTRIBUTION_FIELDS = "edges caseCount percents normalizedPercents";
    static final String GROUPED_BY_BLOCK = "groupedBy { groupItemName }";
    static final String GENERAL_STATS_BLOCK = "generalStatsGroup { generalStatistics { casesInPeriod filteredCasesInPeriod } }";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern OPEN_BRACE = Pattern.compile("\\s*\\{\\s*");
    private static final Pattern CLOSE_BRACE = Pattern.compile("\\s*}\\s*");

    private final QueryOptions options;

    public QueryCompiler() {
        this(QueryOptions.defaults());
    }

    public QueryCompiler(QueryOptions options) {
        this.options = Objects.requireNonNull(options, "Query options are required");
    }

    /**
     * Compiles a metric collection, using its grouping dimension.
     *
     * @param metrics the metrics and optional grouping
     * @param filter  the case filter, or {@code null} for none
     * @return the query text
     */
    public String compile(MetricsCollection metrics, FilterNode filter) {
        Objects.requireNonNull(metrics, "Metrics collection cannot be null");
        return compile(metrics.metrics(), Optional.ofNullable(filter), metrics.groupBy(), options);
    }

    /**
     * Compiles a query with this compiler's options.
     *
     * @param metrics the metrics in field order
     * @param filter  the case filter
     * @param groupBy the grouping dimension
     * @return the query text
     */
    public String compile(List<MetricSpec> metrics, Optional<FilterNode> filter, Optional<GroupBy> groupBy) {
        return compile(metrics, filter, groupBy, options);
    }

    /**
     * Compiles a query.
     *
     * @param metrics the metrics in field order, possibly empty
     * @param filter  the case filter
     * @param groupBy the grouping dimension
     * @param options time window, data origin and general statistics selection
     * @return the normalized single-line query text
     */
    public String compile(List<MetricSpec> metrics, Optional<FilterNode> filter, Optional<GroupBy> groupBy, QueryOptions options) {
        Objects.requireNonNull(metrics, "Metric list cannot be null");
        Objects.requireNonNull(filter, "Filter cannot be null, use Optional.empty()");
        Objects.requireNonNull(groupBy, "GroupBy cannot be null, use Optional.empty()");
        Objects.requireNonNull(options, "Query options are required");

        if (metrics.isEmpty()) {
            log.warning("No metrics are selected, the query will only return its envelope");
        }

        List<String> filterArgs = new ArrayList<>();
        filterArgs.add(String.format("timePeriod: { startDate: \"%s\", endDate: \"%s\" }", options.startDate(), options.endDate()));
        filterArgs.add("dataOrigin: { providerGroupId: [" + options.providerGroupIds().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ")) + "] }");
        filter.ifPresent(node -> filterArgs.add("caseFilter: " + node.accept(CaseFilterRenderer.INSTANCE)));

        List<String> queryArgs = new ArrayList<>();
        queryArgs.add("filter: { " + String.join(", ", filterArgs) + " }");
        groupBy.ifPresent(group -> queryArgs.add("groupBy: " + group.name()));

        List<String> fields = new ArrayList<>();
        for (MetricSpec metric : metrics) {
            fields.add(metricField(metric, groupBy.isPresent()));
        }
        if (options.includeGeneralStats()) {
            fields.add(GENERAL_STATS_BLOCK);
        }

        String query = "query { getMetrics(" + String.join(", ", queryArgs) + ") { " + String.join(" ", fields) + " } }";
        String cleaned = clean(query);

        log.fine(() -> String.format("Compiled %d metric(s), filter=%s, groupBy=%s into %d characters",
                metrics.size(), filter.isPresent(), groupBy.map(Enum::name).orElse("none"), cleaned.length()));
        return cleaned;
    }

    public QueryOptions getOptions() {
        return options;
    }

    static String metricField(MetricSpec metric, boolean grouped) {
        List<String> kpiFields = new ArrayList<>();
        kpiFields.add("caseCount");
        if (metric.stats()) {
            kpiFields.addAll(STATS_FIELDS);
        }

        Optional<DistributionSpec> distribution = metric.distribution();
        distribution.ifPresent(d -> kpiFields.add(String.format(Locale.ROOT,
                "d1: distribution(binCount: %d) { %s }", d.binCount(), DISTRIBUTION_FIELDS)));

        String kpiCall = distribution
                .map(d -> String.format(Locale.ROOT, "kpi(kpiOptions: { lowerBoundary: %d, upperBoundary: %d })", d.lower(), d.upper()))
                .orElse("kpi");

        String kpiGroup = "kpi1: " + kpiCall + " { " + String.join(" ", kpiFields) + " }";
        if (grouped) {
            kpiGroup += " " + GROUPED_BY_BLOCK;
        }

        String id = metric.kpi().metricId();
        return "metric_" + id + ": metric(metricId: " + id + ") { kpiGroup { " + kpiGroup + " } }";
    }

    /**
     * Collapses whitespace and puts exactly one space around every brace.
     *
     * @param query raw query text
     * @return the normalized text, trimmed
     */
    static String clean(String query) {
        String result = WHITESPACE.matcher(query).replaceAll(" ");
        result = OPEN_BRACE.matcher(result).replaceAll(" { ");
        result = CLOSE_BRACE.matcher(result).replaceAll(" } ");
        return WHITESPACE.matcher(result).replaceAll(" ").strip();
    }
}
