package io.github.cyfko.metricql.core.exception;

import io.github.cyfko.metricql.core.parsing.Token;
import io.github.cyfko.metricql.core.parsing.TokenKind;

/**
 * Exception thrown when a filter expression or a query command does not conform to the grammar.
 * <p>
 * When raised by the recursive descent parser, the exception carries the token kind that was
 * expected, the token actually found and the ordinal index of that token in the stream. Tokens
 * carry no character offsets, so the ordinal index is the only position information available.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parseFilterString("AND()");
 * // → "Expected token IDENT, got RPAREN ')' at position 2"
 *
 * parser.parseFilterString("AND(AGE>=50");
 * // → "Expected token RPAREN, got EOF '' at position 5"
 *
 * parser.parseFilterString("AGE>=50");
 * // → "Expected token OPERATOR, got IDENT 'AGE' at position 0"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     FilterNode filter = parser.parse(userExpression);
 * } catch (DSLSyntaxException e) {
 *     logger.warning("Invalid filter expression '" + userExpression + "': " + e.getMessage());
 *     // fall back to another front end or report to the caller
 * }
 * }</pre>
 *
 * @see LexicalGapException
 * @since 1.0.0
 */
public class DSLSyntaxException extends RuntimeException {

    private final TokenKind expected;
    private final Token found;
    private final int position;

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the cause of the exception
     */
    public DSLSyntaxException(String message) {
        super(message);
        this.expected = null;
        this.found = null;
        this.position = -1;
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     * <p>
     * Used when a token matched the grammar but its literal could not be converted,
     * for instance a non-numeric age or a malformed calendar date.
     * </p>
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public DSLSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.expected = null;
        this.found = null;
        this.position = -1;
    }

    /**
     * Creates an exception describing a token mismatch.
     *
     * @param expected the token kind the grammar required
     * @param found    the token actually present (an {@link TokenKind#EOF} token when the stream is exhausted)
     * @param position ordinal index of {@code found} in the token stream
     */
    public DSLSyntaxException(TokenKind expected, Token found, int position) {
        super(String.format("Expected token %s, got %s '%s' at position %d",
                expected, found.kind(), found.text(), position));
        this.expected = expected;
        this.found = found;
        this.position = position;
    }

    /**
     * @return the expected token kind, or {@code null} when the error is not a token mismatch
     */
    public TokenKind getExpected() {
        return expected;
    }

    /**
     * @return the offending token, or {@code null} when the error is not a token mismatch
     */
    public Token getFound() {
        return found;
    }

    /**
     * @return ordinal index of the offending token, or {@code -1} when unknown
     */
    public int getPosition() {
        return position;
    }
}
