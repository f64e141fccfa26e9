package io.github.cyfko.metricql.core.model;

/**
 * Server-side dimensions metric results can be segmented by.
 * <p>
 * When a query is grouped, every metric field of the document also selects
 * {@code groupedBy { groupItemName }}.
 * </p>
 *
 * @since 1.0.0
 */
public enum GroupBy {
    EMS_PRENOTIFICATION,
    FIRST_CONTACT_PLACE,
    IVT_APPLICATION_DEPARTMENT,
    INR_MODE
}
