package io.github.cyfko.metricql.spring.service;

import io.github.cyfko.metricql.core.alias.AliasFamily;
import io.github.cyfko.metricql.core.entity.Entity;

import java.util.List;

/**
 * Main service for compiling metric requests in Spring Boot applications.
 * <p>
 * Accepts the three request shapes understood by MetricQL and returns the single-line
 * query text to send to the metrics backend. All settings come from the
 * {@code metricql.*} properties.
 * </p>
 *
 * <h2>Usage Context</h2>
 * <ul>
 *   <li>Chat commands such as {@code /query DTN -filter AND(AGE>=50) -stats}</li>
 *   <li>Structured calls from controllers with separate KPI, filter and group arguments</li>
 *   <li>Entity lists produced by an upstream extraction step, as objects or JSON</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface MetricQlService {

    String fromCommand(String commandLine);

    String compile(List<String> kpis, String filter, List<String> distributions, boolean stats, String group);

    String fromEntities(List<Entity> entities, String userMessage);

    /**
     * @param entityJson  a JSON array of {@code {"entity", "value", "role"}} objects
     * @param userMessage the original request, used to detect exclusions
     * @return the query text
     * @throws IllegalArgumentException if the JSON is malformed
     */
    String fromEntityJson(String entityJson, String userMessage);

    /**
     * Lists the accepted spellings of a family, for error hints.
     */
    String describe(AliasFamily family);
}
