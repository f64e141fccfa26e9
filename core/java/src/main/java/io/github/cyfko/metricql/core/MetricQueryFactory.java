package io.github.cyfko.metricql.core;

import io.github.cyfko.metricql.core.alias.AliasRegistry;
import io.github.cyfko.metricql.core.api.DslParser;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.MetricQuery;
import io.github.cyfko.metricql.core.compiler.QueryCompiler;
import io.github.cyfko.metricql.core.compiler.QueryOptions;
import io.github.cyfko.metricql.core.config.DslPolicy;
import io.github.cyfko.metricql.core.entity.Entity;
import io.github.cyfko.metricql.core.entity.EntityListAdapter;
import io.github.cyfko.metricql.core.entity.EntityTranslation;
import io.github.cyfko.metricql.core.entity.ExclusionDetector;
import io.github.cyfko.metricql.core.exception.DSLSyntaxException;
import io.github.cyfko.metricql.core.exception.MetricDefinitionException;
import io.github.cyfko.metricql.core.exception.UnknownAliasException;
import io.github.cyfko.metricql.core.impl.BasicDslParser;
import io.github.cyfko.metricql.core.model.MetricsCollection;
import io.github.cyfko.metricql.core.parsing.MetricSpecBuilder;
import io.github.cyfko.metricql.core.parsing.QueryCommand;
import io.github.cyfko.metricql.core.parsing.QueryCommandParser;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade wiring the parsers, the entity adapter and the compiler around one
 * {@link AliasRegistry}.
 *
 * <p><strong>Architecture Overview:</strong></p>
 * <ol>
 *   <li><strong>Parse:</strong> filter text into a {@link FilterNode} with a {@link DslParser}</li>
 *   <li><strong>Resolve:</strong> KPI words, distribution specs and group into a {@link MetricsCollection}</li>
 *   <li><strong>Translate:</strong> or take both from an entity list through the {@link EntityListAdapter}</li>
 *   <li><strong>Compile:</strong> filter and metrics into query text with a {@link QueryCompiler}</li>
 * </ol>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * MetricQuery query = MetricQueryFactory.of(
 *     DslPolicy.strict(),
 *     QueryOptions.builder().providerGroupIds(List.of(3)).build());
 *
 * String text = query.fromCommand(
 *     "/query AGE DTN -filter AND(AGE>=50, SEX==MALE) -stats -distribution DTN:10:0:120 -group FIRST_CONTACT_PLACE");
 * // send text to the backend
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link DSLSyntaxException} - malformed filter expression or command line</li>
 *   <li>{@link UnknownAliasException} - unknown identifier, KPI or group</li>
 *   <li>{@link MetricDefinitionException} - invalid distribution spec</li>
 * </ul>
 * <p>
 * Entity translation never fails on unresolvable values; they are dropped and logged.
 * </p>
 *
 * @see MetricQuery
 * @since 1.0.0
 */
public class MetricQueryFactory {

    private static final Logger log = Logger.getLogger(MetricQueryFactory.class.getName());

    private MetricQueryFactory() {}

    /**
     * Creates a {@link MetricQuery} with default policy, options and aliases.
     *
     * @return a new query facade
     */
    public static MetricQuery of() {
        return of(DslPolicy.defaults(), QueryOptions.defaults());
    }

    /**
     * Creates a {@link MetricQuery} with the given policy and options and the bundled aliases.
     *
     * @param dslPolicy the filter parser policy
     * @param options   the document options
     * @return a new query facade
     * @throws NullPointerException if an argument is null
     */
    public static MetricQuery of(DslPolicy dslPolicy, QueryOptions options) {
        return of(dslPolicy, options, AliasRegistry.defaults());
    }

    /**
     * Creates a {@link MetricQuery} resolving every name through {@code registry}.
     *
     * @param dslPolicy the filter parser policy
     * @param options   the document options
     * @param registry  the aliases
     * @return a new query facade
     * @throws NullPointerException if an argument is null
     */
    public static MetricQuery of(DslPolicy dslPolicy, QueryOptions options, AliasRegistry registry) {
        Objects.requireNonNull(dslPolicy, "DSL policy cannot be null");
        Objects.requireNonNull(registry, "Alias registry cannot be null");
        return of(new BasicDslParser(dslPolicy, registry), options, registry);
    }

    /**
     * Creates a {@link MetricQuery} with a custom filter parser.
     *
     * @param dslParser the filter parser
     * @param options   the document options
     * @param registry  the aliases used for metrics and entities
     * @return a new query facade
     * @throws NullPointerException if an argument is null
     */
    public static MetricQuery of(DslParser dslParser, QueryOptions options, AliasRegistry registry) {
        return new DefaultMetricQuery(
                dslParser,
                new MetricSpecBuilder(registry),
                new EntityListAdapter(registry),
                new QueryCompiler(options),
                new QueryCommandParser(),
                new ExclusionDetector());
    }

    /**
     * Default implementation of {@link MetricQuery}.
     */
    private record DefaultMetricQuery(DslParser dslParser,
                                      MetricSpecBuilder metricSpecBuilder,
                                      EntityListAdapter entityListAdapter,
                                      QueryCompiler compiler,
                                      QueryCommandParser commandParser,
                                      ExclusionDetector exclusionDetector) implements MetricQuery {
        private DefaultMetricQuery {
            Objects.requireNonNull(dslParser, "DSL parser cannot be null");
            Objects.requireNonNull(metricSpecBuilder, "Metric spec builder cannot be null");
            Objects.requireNonNull(entityListAdapter, "Entity adapter cannot be null");
            Objects.requireNonNull(compiler, "Compiler cannot be null");
            Objects.requireNonNull(commandParser, "Command parser cannot be null");
            Objects.requireNonNull(exclusionDetector, "Exclusion detector cannot be null");
        }

        @Override
        public FilterNode parseFilter(String expression) {
            return dslParser.parse(expression);
        }

        @Override
        public MetricsCollection buildMetrics(List<String> kpis, List<String> distributions, boolean stats, String group) {
            return metricSpecBuilder.build(kpis, distributions, stats, group);
        }

        @Override
        public String compile(MetricsCollection metrics, FilterNode filter) {
            return compiler.compile(metrics, filter);
        }

        @Override
        public String fromCommand(String commandLine) {
            QueryCommand command = commandParser.parse(commandLine);
            MetricsCollection metrics = buildMetrics(command.metrics(), command.distributions(), command.stats(), command.group());
            FilterNode filter = command.hasFilter() ? parseFilter(command.filter()) : null;

            log.fine(() -> String.format("Command resolved to %d metric(s), filter=%s", metrics.metrics().size(), filter != null));
            return compile(metrics, filter);
        }

        @Override
        public EntityTranslation translate(List<Entity> entities, boolean exclusionContext) {
            return entityListAdapter.fromEntities(entities, exclusionContext);
        }

        @Override
        public String fromEntities(List<Entity> entities, boolean exclusionContext) {
            EntityTranslation translation = translate(entities, exclusionContext);
            return compile(translation.metrics(), translation.filter().orElse(null));
        }

        @Override
        public String fromEntities(List<Entity> entities, String userMessage) {
            boolean exclusion = exclusionDetector.isExclusion(userMessage);
            log.fine(() -> "Exclusion context: " + exclusion);
            return fromEntities(entities, exclusion);
        }

        @Override
        public QueryOptions options() {
            return compiler.getOptions();
        }
    }
}
