package io.github.cyfko.metricql.core.exception;

import io.github.cyfko.metricql.core.alias.AliasFamily;

/**
 * Thrown when a requested grouping dimension resolves to no group-by member.
 *
 * @since 1.0.0
 */
public class UnknownGroupByException extends UnknownAliasException {

    public UnknownGroupByException(String group) {
        super(AliasFamily.GROUP_BY, group, "Unknown group: " + group);
    }
}
