package io.github.cyfko.metricql.core.entity;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects whether a user message asks to exclude the categories it mentions
 * ("all strokes <em>except</em> TIA", "<em>without</em> hemorrhages").
 * <p>
 * Keywords are matched as whole words, case-insensitively.
 * </p>
 *
 * @since 1.0.0
 */
public class ExclusionDetector {

    public static final List<String> DEFAULT_KEYWORDS = List.of(
            "exclude", "excluding", "but not", "except", "without", "not", "dont", "don't", "remove", "skip");

    private final Pattern pattern;

    public ExclusionDetector() {
        this(DEFAULT_KEYWORDS);
    }

    public ExclusionDetector(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("At least one exclusion keyword is required");
        }
        this.pattern = Pattern.compile(keywords.stream()
                .map(keyword -> "\\b" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)) + "\\b")
                .collect(Collectors.joining("|")));
    }

    /**
     * @param message the user message, may be {@code null}
     * @return whether the message contains an exclusion keyword
     */
    public boolean isExclusion(String message) {
        return message != null && pattern.matcher(message.toLowerCase(Locale.ROOT)).find();
    }
}
