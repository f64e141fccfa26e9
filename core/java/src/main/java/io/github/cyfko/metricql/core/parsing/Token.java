package io.github.cyfko.metricql.core.parsing;

import java.util.Objects;

/**
 * A lexical token: its kind and the exact text it was matched from.
 * <p>
 * Tokens carry no character offset; their position is their index in the token list.
 * </p>
 *
 * @param kind the token kind
 * @param text the matched text, empty for {@link TokenKind#EOF}
 * @since 1.0.0
 */
public record Token(TokenKind kind, String text) {

    /** Marker returned when a parser reads past the last token. */
    public static final Token EOF = new Token(TokenKind.EOF, "");

    public Token {
        Objects.requireNonNull(kind, "Token kind cannot be null");
        Objects.requireNonNull(text, "Token text cannot be null");
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')";
    }
}
