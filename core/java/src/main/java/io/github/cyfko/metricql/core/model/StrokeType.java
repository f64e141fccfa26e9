package io.github.cyfko.metricql.core.model;

/**
 * Clinical stroke subtypes the backend can filter cases on.
 *
 * @since 1.0.0
 */
public enum StrokeType {
    ISCHEMIC,
    INTRACEREBRAL_HEMORRHAGE,
    TRANSIENT_ISCHEMIC,
    SUBARACHNOID_HEMORRHAGE,
    CEREBRAL_VENOUS_THROMBOSIS,
    STROKE_MIMICS,
    UNDETERMINED
}
