package io.github.cyfko.metricql.core.api;

import io.github.cyfko.metricql.core.compiler.QueryOptions;
import io.github.cyfko.metricql.core.entity.Entity;
import io.github.cyfko.metricql.core.entity.EntityTranslation;
import io.github.cyfko.metricql.core.exception.DSLSyntaxException;
import io.github.cyfko.metricql.core.exception.MetricDefinitionException;
import io.github.cyfko.metricql.core.exception.UnknownAliasException;
import io.github.cyfko.metricql.core.model.MetricsCollection;

import java.util.List;

/**
 * Entry point turning any of the supported request forms into backend query text.
 *
 * <h3>Request forms</h3>
 * <ul>
 *   <li><b>Command line:</b> {@code /query DTN -filter AND(AGE>=50) -stats}</li>
 *   <li><b>Entity list:</b> entities extracted from a natural-language message</li>
 *   <li><b>Parts:</b> a filter expression and metric arguments, parsed and compiled separately</li>
 * </ul>
 *
 * <pre>{@code
 * MetricQuery query = MetricQueryFactory.of();
 *
 * String text = query.fromCommand(
 *     "/query DTN -filter AND(AGE>=50, SEX==MALE) -distribution DTN:12:0:120 -stats");
 *
 * String fromNlu = query.fromEntities(entities, "door to needle for women, excluding TIA");
 * }</pre>
 *
 * <p>Implementations are immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public interface MetricQuery {

    /**
     * Parses a filter expression.
     *
     * @param expression the expression, e.g. {@code AND(AGE>=50, SEX==MALE)}
     * @return the filter tree
     * @throws DSLSyntaxException    if the expression is malformed
     * @throws UnknownAliasException if a condition cannot be resolved
     */
    FilterNode parseFilter(String expression);

    /**
     * Builds a metric collection from command-style arguments.
     *
     * @param kpis          KPI names or aliases
     * @param distributions {@code KPI:bins:lower:upper} specs
     * @param stats         whether statistics are selected for every metric
     * @param group         group-by name or alias, {@code null} for none
     * @return the collection
     * @throws UnknownAliasException      if a KPI or the group is unknown
     * @throws MetricDefinitionException  if a distribution spec is invalid
     */
    MetricsCollection buildMetrics(List<String> kpis, List<String> distributions, boolean stats, String group);

    /**
     * Compiles metrics and an optional filter.
     *
     * @param metrics the metrics and grouping
     * @param filter  the filter, or {@code null} for none
     * @return the query text
     */
    String compile(MetricsCollection metrics, FilterNode filter);

    /**
     * Parses and compiles a {@code /query} command line.
     *
     * @param commandLine the command
     * @return the query text
     * @throws DSLSyntaxException         if the command or its filter is malformed
     * @throws UnknownAliasException      if a name cannot be resolved
     * @throws MetricDefinitionException  if a distribution spec is invalid
     */
    String fromCommand(String commandLine);

    /**
     * Translates entities without compiling them.
     *
     * @param entities         the entities
     * @param exclusionContext whether named stroke subtypes are excluded
     * @return the filter and metrics
     */
    EntityTranslation translate(List<Entity> entities, boolean exclusionContext);

    /**
     * Translates and compiles entities.
     *
     * @param entities         the entities
     * @param exclusionContext whether named stroke subtypes are excluded
     * @return the query text
     */
    String fromEntities(List<Entity> entities, boolean exclusionContext);

    /**
     * Translates and compiles entities, deriving the exclusion context from the user message.
     *
     * @param entities    the entities
     * @param userMessage the message the entities were extracted from
     * @return the query text
     */
    String fromEntities(List<Entity> entities, String userMessage);

    /**
     * @return the document options used for compilation
     */
    QueryOptions options();
}
