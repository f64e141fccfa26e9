package io.github.cyfko.metricql.core.exception;

import io.github.cyfko.metricql.core.alias.AliasFamily;

/**
 * Thrown when a requested metric name resolves to no KPI.
 *
 * @since 1.0.0
 */
public class UnknownKpiException extends UnknownAliasException {

    public UnknownKpiException(String name) {
        super(AliasFamily.KPI, name, "Unknown KPI/metric '" + name + "'");
    }
}
