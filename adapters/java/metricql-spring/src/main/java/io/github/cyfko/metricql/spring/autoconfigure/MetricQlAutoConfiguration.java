package io.github.cyfko.metricql.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.metricql.core.MetricQueryFactory;
import io.github.cyfko.metricql.core.alias.AliasRegistry;
import io.github.cyfko.metricql.core.api.MetricQuery;
import io.github.cyfko.metricql.core.compiler.QueryOptions;
import io.github.cyfko.metricql.core.config.DslPolicy;
import io.github.cyfko.metricql.core.entity.EntityListReader;
import io.github.cyfko.metricql.core.exception.AliasDefinitionException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Logger;

/**
 * Registers the MetricQL components, each replaceable by a user-defined bean of the same type.
 *
 * @since 1.0.0
 */
@AutoConfiguration
@ComponentScan(basePackages = "io.github.cyfko.metricql.spring.service")
@ConditionalOnClass(MetricQuery.class)
@EnableConfigurationProperties(MetricQlProperties.class)
public class MetricQlAutoConfiguration {

    private static final Logger log = Logger.getLogger(MetricQlAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public AliasRegistry metricQlAliasRegistry(MetricQlProperties properties, ResourceLoader resourceLoader) {
        String location = properties.getAliasesLocation();
        if (location == null || location.isBlank()) {
            return AliasRegistry.defaults();
        }

        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            log.info(() -> "Loading MetricQL aliases from " + location);
            return AliasRegistry.load(in);
        } catch (IOException e) {
            throw new AliasDefinitionException("Unable to read alias document " + location, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public DslPolicy metricQlDslPolicy(MetricQlProperties properties) {
        return properties.getDsl().toDslPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryOptions metricQlQueryOptions(MetricQlProperties properties) {
        return properties.getQuery().toQueryOptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricQuery metricQuery(DslPolicy dslPolicy, QueryOptions queryOptions, AliasRegistry aliasRegistry) {
        log.fine(() -> String.format("MetricQL configured with policy %s and options %s", dslPolicy, queryOptions));
        return MetricQueryFactory.of(dslPolicy, queryOptions, aliasRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityListReader metricQlEntityListReader(ObjectProvider<ObjectMapper> objectMapper) {
        return new EntityListReader(objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
