package io.github.cyfko.metricql.spring.service.impl;

import io.github.cyfko.metricql.core.alias.AliasFamily;
import io.github.cyfko.metricql.core.alias.AliasRegistry;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.MetricQuery;
import io.github.cyfko.metricql.core.entity.Entity;
import io.github.cyfko.metricql.core.entity.EntityListReader;
import io.github.cyfko.metricql.core.model.MetricsCollection;
import io.github.cyfko.metricql.spring.service.MetricQlService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.logging.Logger;

@Service
public class MetricQlServiceImpl implements MetricQlService {

    private static final Logger log = Logger.getLogger(MetricQlServiceImpl.class.getName());

    private final MetricQuery metricQuery;
    private final AliasRegistry aliasRegistry;
    private final EntityListReader entityListReader;

    public MetricQlServiceImpl(MetricQuery metricQuery, AliasRegistry aliasRegistry, EntityListReader entityListReader) {
        this.metricQuery = metricQuery;
        this.aliasRegistry = aliasRegistry;
        this.entityListReader = entityListReader;
    }

    @Override
    public String fromCommand(String commandLine) {
        String query = metricQuery.fromCommand(commandLine);
        log.fine(() -> String.format("Command '%s' compiled into %d characters", commandLine, query.length()));
        return query;
    }

    @Override
    public String compile(List<String> kpis, String filter, List<String> distributions, boolean stats, String group) {
        MetricsCollection metrics = metricQuery.buildMetrics(
                kpis != null ? kpis : List.of(),
                distributions != null ? distributions : List.of(),
                stats,
                group);
        FilterNode node = filter == null || filter.isBlank() ? null : metricQuery.parseFilter(filter);
        return metricQuery.compile(metrics, node);
    }

    @Override
    public String fromEntities(List<Entity> entities, String userMessage) {
        return metricQuery.fromEntities(entities, userMessage);
    }

    @Override
    public String fromEntityJson(String entityJson, String userMessage) {
        List<Entity> entities = entityListReader.read(entityJson);
        log.fine(() -> "Read " + entities.size() + " entities from JSON");
        return fromEntities(entities, userMessage);
    }

    @Override
    public String describe(AliasFamily family) {
        return aliasRegistry.describe(family);
    }
}
