package io.github.cyfko.metricql.core.compiler;

import java.time.LocalDate;
import java.util.List;

/**
 * Document-level arguments of a compiled query.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li><strong>startDate</strong>: 1000-01-01</li>
 *   <li><strong>endDate</strong>: 9999-12-31</li>
 *   <li><strong>providerGroupIds</strong>: [1]</li>
 *   <li><strong>includeGeneralStats</strong>: false</li>
 * </ul>
 *
 * <pre>{@code
 * QueryOptions options = QueryOptions.builder()
 *     .timePeriod(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31))
 *     .providerGroupIds(List.of(4, 7))
 *     .includeGeneralStats(true)
 *     .build();
 * }</pre>
 *
 * @param startDate           first day of the time window, inclusive
 * @param endDate             last day of the time window, not before {@code startDate}
 * @param providerGroupIds    data-origin provider groups, at least one
 * @param includeGeneralStats whether the document selects the general statistics block
 * @since 1.0.0
 */
public record QueryOptions(LocalDate startDate, LocalDate endDate, List<Integer> providerGroupIds, boolean includeGeneralStats) {

    public static final LocalDate DEFAULT_START_DATE = LocalDate.of(1000, 1, 1);
    public static final LocalDate DEFAULT_END_DATE = LocalDate.of(9999, 12, 31);
    public static final List<Integer> DEFAULT_PROVIDER_GROUP_IDS = List.of(1);

    /**
     * @throws IllegalArgumentException if a date is missing, the window is reversed or no provider group is given
     */
    public QueryOptions {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("Time period requires both a start and an end date");
        }
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException(String.format("End date %s is before start date %s", endDate, startDate));
        }
        if (providerGroupIds == null || providerGroupIds.isEmpty()) {
            throw new IllegalArgumentException("At least one provider group id is required");
        }
        providerGroupIds = List.copyOf(providerGroupIds);
    }

    public static QueryOptions defaults() {
        return new QueryOptions(DEFAULT_START_DATE, DEFAULT_END_DATE, DEFAULT_PROVIDER_GROUP_IDS, false);
    }

    /**
     * @return a builder initialized with {@link #defaults()}
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalDate _startDate = DEFAULT_START_DATE;
        private LocalDate _endDate = DEFAULT_END_DATE;
        private List<Integer> _providerGroupIds = DEFAULT_PROVIDER_GROUP_IDS;
        private boolean _includeGeneralStats = false;

        private Builder() {}

        public QueryOptions build() {
            return new QueryOptions(_startDate, _endDate, _providerGroupIds, _includeGeneralStats);
        }

        public Builder startDate(LocalDate startDate) { this._startDate = startDate; return this; }
        public Builder endDate(LocalDate endDate) { this._endDate = endDate; return this; }
        public Builder timePeriod(LocalDate startDate, LocalDate endDate) { this._startDate = startDate; this._endDate = endDate; return this; }
        public Builder providerGroupIds(List<Integer> providerGroupIds) { this._providerGroupIds = providerGroupIds; return this; }
        public Builder includeGeneralStats(boolean include) { this._includeGeneralStats = include; return this; }
    }
}
