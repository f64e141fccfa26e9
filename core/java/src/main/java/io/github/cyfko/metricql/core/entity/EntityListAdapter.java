package io.github.cyfko.metricql.core.entity;

import io.github.cyfko.metricql.core.alias.AliasRegistry;
import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.LogicalOp;
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

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.BiFunction;
import java.util.logging.Logger;

/**
 * Translates entities extracted from a natural-language request into a filter tree and a
 * metric collection.
 *
 * <h2>Entity Types</h2>
 * <table border="1">
 * <caption>Supported entity types</caption>
 * <thead><tr><th>Type</th><th>Value</th><th>Translation</th></tr></thead>
 * <tbody>
 * <tr><td>{@code age}</td><td>integer</td><td>role {@code lower}: age &gt;= value, role {@code upper}: age &lt;= value</td></tr>
 * <tr><td>{@code nihss}</td><td>integer</td><td>same as age, on the admission NIHSS</td></tr>
 * <tr><td>{@code date}</td><td>ISO date</td><td>same as age, on the discharge date</td></tr>
 * <tr><td>{@code sex}</td><td>sex alias</td><td>one sex condition, several are OR-combined</td></tr>
 * <tr><td>{@code stroke_type}</td><td>stroke alias</td><td>one stroke condition, several are OR-combined</td></tr>
 * <tr><td>{@code boolean_type}</td><td>property alias</td><td>property is true</td></tr>
 * <tr><td>{@code kpi}</td><td>KPI alias</td><td>one metric</td></tr>
 * <tr><td>{@code group_by}</td><td>group alias</td><td>grouping dimension, the last one wins</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Combination Rules</h2>
 * <ul>
 *   <li>All conditions are combined under a single top-level AND, even a single one.</li>
 *   <li>Without any condition there is no filter.</li>
 *   <li>In an exclusion context each stroke condition is negated on its own, so excluded
 *       subtypes become {@code AND(NOT(a), NOT(b))} rather than {@code NOT(OR(a, b))}.</li>
 *   <li>Numeric KPIs (age, door-to-needle, door-in-door-out, admission NIHSS, door-to-imaging)
 *       get a default distribution and summary statistics.</li>
 * </ul>
 *
 * <p>
 * The adapter is lenient: an entity whose value cannot be resolved or converted is dropped
 * with a warning and the translation goes on.
 * </p>
 *
 * <pre>{@code
 * EntityTranslation result = new EntityListAdapter().fromEntities(List.of(
 *     new Entity("age", "40", "lower"),
 *     new Entity("age", "60", "upper"),
 *     new Entity("kpi", "door to needle")), false);
 * // filter:  AND(age >= 40, age <= 60)
 * // metrics: [DTN with stats and 12 bins over 0..120]
 * }</pre>
 *
 * @since 1.0.0
 */
public class EntityListAdapter {

    private static final Logger log = Logger.getLogger(EntityListAdapter.class.getName());

    public static final String AGE = "age";
    public static final String NIHSS = "nihss";
    public static final String DATE = "date";
    public static final String SEX = "sex";
    public static final String STROKE_TYPE = "stroke_type";
    public static final String BOOLEAN_TYPE = "boolean_type";
    public static final String KPI = "kpi";
    public static final String GROUP_BY = "group_by";

    /** Distributions attached to numeric KPIs requested through entities. */
    public static final Map<Kpi, DistributionSpec> DEFAULT_DISTRIBUTIONS;
    static {
        Map<Kpi, DistributionSpec> defaults = new EnumMap<>(Kpi.class);
        defaults.put(Kpi.AGE, new DistributionSpec(10, 0, 100));
        defaults.put(Kpi.DTN, new DistributionSpec(12, 0, 120));
        defaults.put(Kpi.DIDO, new DistributionSpec(20, 0, 200));
        defaults.put(Kpi.ADMISSION_NIHSS, new DistributionSpec(21, 0, 21));
        defaults.put(Kpi.DTI, new DistributionSpec(10, 0, 100));
        DEFAULT_DISTRIBUTIONS = Collections.unmodifiableMap(defaults);
    }

    private final AliasRegistry registry;

    public EntityListAdapter() {
        this(AliasRegistry.defaults());
    }

    public EntityListAdapter(AliasRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Alias registry is required");
    }

    /**
     * Translates entities into a filter and metrics.
     *
     * @param entities         the entities in extraction order
     * @param exclusionContext whether the request excludes the stroke subtypes it names
     * @return the translation; never fails on unresolvable values
     */
    public EntityTranslation fromEntities(List<Entity> entities, boolean exclusionContext) {
        Objects.requireNonNull(entities, "Entity list cannot be null");

        Buckets buckets = new Buckets();
        for (Entity entity : entities) {
            if (entity == null || entity.value() == null) continue;
            collect(entity, buckets);
        }

        List<FilterNode> conditions = new ArrayList<>();
        addRange(conditions, buckets.age, AgeFilter::new);
        addRange(conditions, buckets.nihss, NihssFilter::new);
        addRange(conditions, buckets.date, DateFilter::new);

        addAlternatives(conditions, buckets.sexes.stream().map(SexFilter::new).toList());

        List<FilterNode> strokes = buckets.strokes.stream().<FilterNode>map(StrokeFilter::new).toList();
        if (exclusionContext) {
            strokes.forEach(stroke -> conditions.add(LogicalNode.not(stroke)));
        } else {
            addAlternatives(conditions, strokes);
        }

        buckets.properties.forEach(property -> conditions.add(new BooleanFilter(property, true)));

        Optional<FilterNode> filter = conditions.isEmpty()
                ? Optional.empty()
                : Optional.of(new LogicalNode(LogicalOp.AND, conditions));

        List<MetricSpec> metrics = buckets.kpis.stream().map(EntityListAdapter::defaultMetric).toList();

        log.fine(() -> String.format("Translated %d entities into %d condition(s) and %d metric(s), exclusion=%b",
                entities.size(), conditions.size(), metrics.size(), exclusionContext));

        return new EntityTranslation(filter, new MetricsCollection(metrics, buckets.group));
    }

    /**
     * Builds the metric requested by a {@code kpi} entity.
     *
     * @param kpi the KPI
     * @return the metric, with default distribution and statistics for numeric KPIs
     */
    public static MetricSpec defaultMetric(Kpi kpi) {
        DistributionSpec distribution = DEFAULT_DISTRIBUTIONS.get(kpi);
        return new MetricSpec(kpi, distribution != null, distribution);
    }

    private void collect(Entity entity, Buckets buckets) {
        String value = entity.value().trim();
        switch (entity.normalizedType()) {
            case AGE -> putBound(entity, buckets.age, parseInteger(entity, value));
            case NIHSS -> putBound(entity, buckets.nihss, parseInteger(entity, value));
            case DATE -> putBound(entity, buckets.date, parseDate(entity, value));
            case SEX -> resolve(SexType.class, entity).ifPresent(buckets.sexes::add);
            case STROKE_TYPE -> resolve(StrokeType.class, entity).ifPresent(buckets.strokes::add);
            case BOOLEAN_TYPE -> resolve(BooleanProperty.class, entity).ifPresent(buckets.properties::add);
            case KPI -> resolve(Kpi.class, entity).ifPresent(buckets.kpis::add);
            case GROUP_BY -> resolve(GroupBy.class, entity).ifPresent(group -> buckets.group = group);
            default -> log.fine(() -> "Ignoring entity of unsupported type '" + entity.type() + "'");
        }
    }

    private <E extends Enum<E>> Optional<E> resolve(Class<E> type, Entity entity) {
        Optional<E> member = registry.tryResolve(type, entity.value());
        if (member.isEmpty()) {
            log.warning(() -> String.format("Dropping %s entity: unknown value '%s'", entity.type(), entity.value()));
        }
        return member;
    }

    private static <T> void putBound(Entity entity, Map<Comparison, T> range, Optional<T> value) {
        if (value.isEmpty()) return;

        if (entity.hasRole(Entity.ROLE_LOWER)) {
            range.put(Comparison.GE, value.get());
        } else if (entity.hasRole(Entity.ROLE_UPPER)) {
            range.put(Comparison.LE, value.get());
        } else {
            log.warning(() -> String.format("Dropping %s entity '%s': role must be '%s' or '%s', got '%s'",
                    entity.type(), entity.value(), Entity.ROLE_LOWER, Entity.ROLE_UPPER, entity.role()));
        }
    }

    private static Optional<Integer> parseInteger(Entity entity, String value) {
        try {
            return Optional.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            log.warning(() -> String.format("Dropping %s entity: '%s' is not an integer", entity.type(), value));
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> parseDate(Entity entity, String value) {
        try {
            return Optional.of(LocalDate.parse(value));
        } catch (DateTimeParseException e) {
            log.warning(() -> String.format("Dropping %s entity: '%s' is not an ISO date", entity.type(), value));
            return Optional.empty();
        }
    }

    private static <T> void addRange(List<FilterNode> conditions, Map<Comparison, T> range,
                                     BiFunction<Comparison, T, FilterNode> factory) {
        range.forEach((comparison, value) -> conditions.add(factory.apply(comparison, value)));
    }

    private static void addAlternatives(List<FilterNode> conditions, List<? extends FilterNode> alternatives) {
        if (alternatives.size() == 1) {
            conditions.add(alternatives.get(0));
        } else if (alternatives.size() > 1) {
            conditions.add(new LogicalNode(LogicalOp.OR, new ArrayList<FilterNode>(alternatives)));
        }
    }

    /**
     * Entities grouped by type. Range maps keep GE before LE.
     */
    private static final class Buckets {
        final Map<Comparison, Integer> age = new EnumMap<>(Comparison.class);
        final Map<Comparison, Integer> nihss = new EnumMap<>(Comparison.class);
        final Map<Comparison, LocalDate> date = new EnumMap<>(Comparison.class);
        final List<SexType> sexes = new ArrayList<>();
        final List<StrokeType> strokes = new ArrayList<>();
        final List<BooleanProperty> properties = new ArrayList<>();
        final List<Kpi> kpis = new ArrayList<>();
        GroupBy group;
    }
}
