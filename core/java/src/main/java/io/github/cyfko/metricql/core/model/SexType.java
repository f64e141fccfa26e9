package io.github.cyfko.metricql.core.model;

/**
 * Patient sex as recorded by the registry.
 *
 * @since 1.0.0
 */
public enum SexType {
    MALE,
    FEMALE,
    OTHER,
    UNKNOWN
}
