package io.github.cyfko.metricql.core.parsing;

import io.github.cyfko.metricql.core.alias.AliasRegistry;
import io.github.cyfko.metricql.core.exception.InvalidDistributionSpecException;
import io.github.cyfko.metricql.core.exception.MetricDefinitionException;
import io.github.cyfko.metricql.core.exception.UnknownGroupByException;
import io.github.cyfko.metricql.core.exception.UnknownKpiException;
import io.github.cyfko.metricql.core.model.DistributionSpec;
import io.github.cyfko.metricql.core.model.GroupBy;
import io.github.cyfko.metricql.core.model.Kpi;
import io.github.cyfko.metricql.core.model.MetricSpec;
import io.github.cyfko.metricql.core.model.MetricsCollection;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds a {@link MetricsCollection} from command-style metric arguments.
 * <p>
 * Inputs are bare KPI words, distribution specs of the form {@code KPI:bins:lower:upper}, a
 * stats flag applied to every metric, and an optional group-by word. Every word is resolved
 * through the {@link AliasRegistry}; resolution is strict and the first unknown word fails the
 * whole request.
 * </p>
 *
 * <pre>{@code
 * MetricsCollection metrics = new MetricSpecBuilder().build(
 *     List.of("DTN", "AGE"), List.of("DTN:12:0:120"), true, "first seen");
 * // [MetricSpec(DTN, stats, 12 bins 0..120), MetricSpec(AGE, stats)], grouped by FIRST_CONTACT_PLACE
 * }</pre>
 *
 * @since 1.0.0
 */
public class MetricSpecBuilder {

    private static final Logger log = Logger.getLogger(MetricSpecBuilder.class.getName());

    private final AliasRegistry registry;

    public MetricSpecBuilder() {
        this(AliasRegistry.defaults());
    }

    public MetricSpecBuilder(AliasRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Alias registry is required");
    }

    /**
     * Builds the metric collection of a request.
     *
     * @param kpiWords          KPI names or aliases, in request order
     * @param distributionSpecs {@code KPI:bins:lower:upper} strings, possibly empty
     * @param stats             whether every metric selects summary statistics
     * @param group             group-by name or alias, {@code null} or blank for none
     * @return the collection
     * @throws UnknownKpiException               if a KPI word is unknown
     * @throws InvalidDistributionSpecException  if a distribution spec is malformed or violates
     *                                           the distribution invariants
     * @throws UnknownGroupByException           if the group word is unknown
     */
    public MetricsCollection build(List<String> kpiWords, List<String> distributionSpecs, boolean stats, String group) {
        Objects.requireNonNull(kpiWords, "KPI list cannot be null");
        Objects.requireNonNull(distributionSpecs, "Distribution list cannot be null");

        Map<Kpi, DistributionSpec> distributions = new EnumMap<>(Kpi.class);
        for (String spec : distributionSpecs) {
            Map.Entry<Kpi, DistributionSpec> parsed = parseDistribution(spec);
            distributions.put(parsed.getKey(), parsed.getValue());
        }

        List<MetricSpec> metrics = new ArrayList<>();
        for (String word : kpiWords) {
            Kpi kpi = resolveKpi(word);
            metrics.add(new MetricSpec(kpi, stats, distributions.get(kpi)));
        }

        distributions.keySet().stream()
                .filter(kpi -> metrics.stream().noneMatch(metric -> metric.kpi() == kpi))
                .forEach(kpi -> log.warning(() ->
                        String.format("Distribution for %s ignored: metric not requested", kpi)));

        return new MetricsCollection(metrics, resolveGroup(group));
    }

    /**
     * Parses one {@code KPI:bins:lower:upper} spec.
     *
     * @param spec the spec text
     * @return the KPI and its distribution
     * @throws InvalidDistributionSpecException if the spec is malformed, names an unknown KPI
     *                                          or violates the distribution invariants
     */
    public Map.Entry<Kpi, DistributionSpec> parseDistribution(String spec) {
        if (spec == null) {
            throw new InvalidDistributionSpecException("null", "spec cannot be null");
        }

        String[] fields = spec.split(":", -1);
        if (fields.length != 4) {
            throw new InvalidDistributionSpecException(spec,
                    "expected 4 ':'-separated fields (KPI:bins:lower:upper), got " + fields.length);
        }

        Kpi kpi;
        try {
            kpi = resolveKpi(fields[0]);
        } catch (UnknownKpiException e) {
            throw new InvalidDistributionSpecException(spec, e);
        }

        try {
            int binCount = Integer.parseInt(fields[1].trim());
            int lower = Integer.parseInt(fields[2].trim());
            int upper = Integer.parseInt(fields[3].trim());
            return Map.entry(kpi, new DistributionSpec(binCount, lower, upper));
        } catch (NumberFormatException e) {
            throw new InvalidDistributionSpecException(spec, "bins, lower and upper must be integers", e);
        } catch (MetricDefinitionException e) {
            throw new InvalidDistributionSpecException(spec, e);
        }
    }

    private Kpi resolveKpi(String word) {
        return registry.tryResolve(Kpi.class, word).orElseThrow(() -> new UnknownKpiException(word));
    }

    private GroupBy resolveGroup(String group) {
        if (group == null || group.isBlank()) return null;
        return registry.tryResolve(GroupBy.class, group).orElseThrow(() -> new UnknownGroupByException(group));
    }
}
