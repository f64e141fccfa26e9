package io.github.cyfko.metricql.core.parsing;

import java.util.List;
import java.util.Objects;

/**
 * The parts of a {@code /query} command line, still unresolved.
 *
 * @param metrics       KPI words preceding the first flag
 * @param filter        text of {@code -filter}, or {@code null}
 * @param group         text of {@code -group}, or {@code null}
 * @param distributions whitespace-separated specs of {@code -distribution}
 * @param stats         whether {@code -stats} was present
 * @since 1.0.0
 */
public record QueryCommand(List<String> metrics, String filter, String group, List<String> distributions, boolean stats) {

    public QueryCommand {
        metrics = List.copyOf(Objects.requireNonNull(metrics, "metrics"));
        distributions = List.copyOf(Objects.requireNonNull(distributions, "distributions"));
    }

    public boolean hasFilter() {
        return filter != null && !filter.isBlank();
    }
}
