package io.github.cyfko.metricql.core.exception;

import io.github.cyfko.metricql.core.config.DslPolicy;

/**
 * Thrown by the lexer when a character matches none of the token rules and the active
 * {@link DslPolicy} rejects unknown characters.
 * <p>
 * Under a lenient policy the same gap is only logged and the character is skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class LexicalGapException extends DSLSyntaxException {

    private final char character;
    private final int offset;

    /**
     * @param character the unrecognized character
     * @param offset    its zero-based character offset in the input
     */
    public LexicalGapException(char character, int offset) {
        super(String.format("Unrecognized character '%c' at offset %d", character, offset));
        this.character = character;
        this.offset = offset;
    }

    public char getCharacter() {
        return character;
    }

    public int getOffset() {
        return offset;
    }
}
