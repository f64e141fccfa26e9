package io.github.cyfko.metricql.spring.autoconfigure;

import io.github.cyfko.metricql.core.compiler.QueryOptions;
import io.github.cyfko.metricql.core.config.DslPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code metricql.*} namespace.
 *
 * <pre>
 * metricql.aliases-location=classpath:custom-aliases.json
 * metricql.dsl.policy=STRICT
 * metricql.dsl.max-expression-length=2000
 * metricql.query.start-date=2023-01-01
 * metricql.query.end-date=2023-12-31
 * metricql.query.provider-group-ids=2,5
 * metricql.query.include-general-stats=true
 * </pre>
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "metricql")
public class MetricQlProperties {

    /**
     * Location of a JSON alias document replacing the bundled one.
     */
    private String aliasesLocation;
    private Dsl dsl = new Dsl();
    private Query query = new Query();

    public static class Dsl {
        /**
         * Base preset of the filter parser.
         */
        private Preset policy = Preset.DEFAULT;
        /**
         * Overrides the preset's maximum expression length.
         */
        private Integer maxExpressionLength;
        /**
         * Overrides whether the lexer rejects characters outside the grammar.
         */
        private Boolean rejectUnknownCharacters;

        public Preset getPolicy() { return policy; }
        public void setPolicy(Preset policy) { this.policy = policy; }
        public Integer getMaxExpressionLength() { return maxExpressionLength; }
        public void setMaxExpressionLength(Integer maxExpressionLength) { this.maxExpressionLength = maxExpressionLength; }
        public Boolean getRejectUnknownCharacters() { return rejectUnknownCharacters; }
        public void setRejectUnknownCharacters(Boolean rejectUnknownCharacters) { this.rejectUnknownCharacters = rejectUnknownCharacters; }

        /**
         * Resolves the preset and applies any override. An overridden preset becomes a
         * custom policy.
         *
         * @return the parser policy
         */
        public DslPolicy toDslPolicy() {
            DslPolicy base = switch (policy) {
                case STRICT -> DslPolicy.strict();
                case RELAXED -> DslPolicy.relaxed();
                default -> DslPolicy.defaults();
            };
            if (maxExpressionLength == null && rejectUnknownCharacters == null) {
                return base;
            }
            return DslPolicy.builder()
                    .maxExpressionLength(maxExpressionLength != null ? maxExpressionLength : base.maxExpressionLength())
                    .rejectUnknownCharacters(rejectUnknownCharacters != null ? rejectUnknownCharacters : base.rejectUnknownCharacters())
                    .build();
        }
    }

    public static class Query {
        /**
         * First day of the reporting window, ISO format.
         */
        private String startDate = QueryOptions.DEFAULT_START_DATE.toString();
        /**
         * Last day of the reporting window, ISO format.
         */
        private String endDate = QueryOptions.DEFAULT_END_DATE.toString();
        private List<Integer> providerGroupIds = new ArrayList<>(QueryOptions.DEFAULT_PROVIDER_GROUP_IDS);
        /**
         * Whether queries also select the general statistics block.
         */
        private boolean includeGeneralStats = false;

        public String getStartDate() { return startDate; }
        public void setStartDate(String startDate) { this.startDate = startDate; }
        public String getEndDate() { return endDate; }
        public void setEndDate(String endDate) { this.endDate = endDate; }
        public List<Integer> getProviderGroupIds() { return providerGroupIds; }
        public void setProviderGroupIds(List<Integer> providerGroupIds) { this.providerGroupIds = providerGroupIds; }
        public boolean isIncludeGeneralStats() { return includeGeneralStats; }
        public void setIncludeGeneralStats(boolean includeGeneralStats) { this.includeGeneralStats = includeGeneralStats; }

        /**
         * @return the document options
         * @throws IllegalArgumentException if a date is not ISO formatted or the options are inconsistent
         */
        public QueryOptions toQueryOptions() {
            return QueryOptions.builder()
                    .timePeriod(parseDate("start-date", startDate), parseDate("end-date", endDate))
                    .providerGroupIds(providerGroupIds)
                    .includeGeneralStats(includeGeneralStats)
                    .build();
        }

        private static LocalDate parseDate(String property, String value) {
            if (value == null) {
                throw new IllegalArgumentException("metricql.query." + property + " is required");
            }
            try {
                return LocalDate.parse(value.trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(String.format(
                        "metricql.query.%s must be an ISO date (yyyy-MM-dd), got '%s'", property, value), e);
            }
        }
    }

    public enum Preset {
        DEFAULT,
        STRICT,
        RELAXED
    }

    public String getAliasesLocation() { return aliasesLocation; }
    public void setAliasesLocation(String aliasesLocation) { this.aliasesLocation = aliasesLocation; }
    public Dsl getDsl() { return dsl; }
    public void setDsl(Dsl dsl) { this.dsl = dsl; }
    public Query getQuery() { return query; }
    public void setQuery(Query query) { this.query = query; }
}
