package io.github.cyfko.metricql.core.entity;

import java.util.Locale;
import java.util.Objects;

/**
 * One entity extracted from a user message by an upstream recognizer.
 *
 * @param type  the entity type, e.g. {@code age}, {@code sex}, {@code kpi}; matched case-insensitively
 * @param value the raw extracted text
 * @param role  {@code lower} or {@code upper} for range entities, otherwise usually {@code null}
 * @since 1.0.0
 */
public record Entity(String type, String value, String role) {

    public static final String ROLE_LOWER = "lower";
    public static final String ROLE_UPPER = "upper";

    public Entity {
        Objects.requireNonNull(type, "Entity type cannot be null");
    }

    public Entity(String type, String value) {
        this(type, value, null);
    }

    /**
     * @return the type, trimmed and lowercased
     */
    public String normalizedType() {
        return type.trim().toLowerCase(Locale.ROOT);
    }

    public boolean hasRole(String expected) {
        return role != null && role.trim().equalsIgnoreCase(expected);
    }
}
