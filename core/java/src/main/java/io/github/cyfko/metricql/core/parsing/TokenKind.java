package io.github.cyfko.metricql.core.parsing;

/**
 * Kinds of tokens produced by {@link FilterLexer}.
 *
 * @since 1.0.0
 */
public enum TokenKind {
    LPAREN,
    RPAREN,
    COMMA,
    /** Logical operator keyword: {@code AND}, {@code OR} or {@code NOT}. */
    OPERATOR,
    /** Comparison symbol: {@code == != >= <= > <}. */
    COMPARISON,
    IDENT,
    /** Digit run, or an ISO calendar date such as {@code 2023-01-01}. */
    NUMBER,
    /** Enum-like value. Shadowed by {@link #IDENT}, never produced by the default rules. */
    STRING,
    /** Synthetic end-of-stream marker, never part of a token list. */
    EOF;

    /**
     * @return whether a token of this kind may stand as the value of a condition
     */
    public boolean isValue() {
        return this == IDENT || this == NUMBER || this == STRING;
    }
}
