package io.github.cyfko.metricql.core.alias;

import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.api.LogicalOp;
import io.github.cyfko.metricql.core.model.BooleanProperty;
import io.github.cyfko.metricql.core.model.GroupBy;
import io.github.cyfko.metricql.core.model.Kpi;
import io.github.cyfko.metricql.core.model.SexType;
import io.github.cyfko.metricql.core.model.StrokeType;

import java.util.Optional;

/**
 * The enumeration families the {@link AliasRegistry} resolves text for.
 * <p>
 * Each family binds the key used in the declarative alias source to the enum type whose
 * constants are the canonical members. Families are resolved independently: the same alias
 * may exist in two families (for instance {@code "unspecified"} for both a sex and a stroke
 * subtype) but never twice within one.
 * </p>
 *
 * @since 1.0.0
 */
public enum AliasFamily {
    COMPARISON("comparison", Comparison.class),
    LOGICAL_OPERATOR("logicalOperator", LogicalOp.class),
    SEX("sex", SexType.class),
    STROKE("stroke", StrokeType.class),
    BOOLEAN_PROPERTY("booleanProperty", BooleanProperty.class),
    KPI("kpi", Kpi.class),
    GROUP_BY("groupBy", GroupBy.class);

    private final String key;
    private final Class<? extends Enum<?>> type;

    AliasFamily(String key, Class<? extends Enum<?>> type) {
        this.key = key;
        this.type = type;
    }

    /**
     * @return the key of this family in the alias source document
     */
    public String key() {
        return key;
    }

    /**
     * @return the enum type holding the canonical members
     */
    public Class<? extends Enum<?>> type() {
        return type;
    }

    /**
     * @return a human-readable family name for diagnostics
     */
    public String displayName() {
        return type.getSimpleName();
    }

    /**
     * Returns the canonical members of this family in declaration order.
     *
     * @return the enum constants of {@link #type()}
     */
    public Enum<?>[] members() {
        return type.getEnumConstants();
    }

    /**
     * Finds the family whose canonical members are the constants of {@code type}.
     *
     * @param type an enum type
     * @return the matching family
     * @throws IllegalArgumentException if no family uses {@code type}
     */
    public static AliasFamily of(Class<?> type) {
        for (AliasFamily family : values()) {
            if (family.type == type) return family;
        }
        throw new IllegalArgumentException("No alias family for type " + type.getName());
    }

    /**
     * Finds a family by its key in the alias source document.
     *
     * @param key the family key, case-sensitive
     * @return the family, or empty if the key is unknown
     */
    public static Optional<AliasFamily> fromKey(String key) {
        for (AliasFamily family : values()) {
            if (family.key.equals(key)) return Optional.of(family);
        }
        return Optional.empty();
    }
}
