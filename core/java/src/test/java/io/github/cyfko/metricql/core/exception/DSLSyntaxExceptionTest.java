package io.github.cyfko.metricql.core.exception;

import io.github.cyfko.metricql.core.alias.AliasFamily;
import io.github.cyfko.metricql.core.parsing.Token;
import io.github.cyfko.metricql.core.parsing.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exceptions")
class DSLSyntaxExceptionTest {

    @Test
    @DisplayName("Token mismatch should describe expectation and position")
    void tokenMismatch() {
        DSLSyntaxException exception = new DSLSyntaxException(TokenKind.RPAREN, new Token(TokenKind.COMMA, ","), 7);

        assertEquals("Expected token RPAREN, got COMMA ',' at position 7", exception.getMessage());
        assertEquals(TokenKind.RPAREN, exception.getExpected());
        assertEquals(7, exception.getPosition());
        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    @DisplayName("Message-only syntax errors carry no token details")
    void messageOnly() {
        Throwable cause = new NumberFormatException("x");
        DSLSyntaxException exception = new DSLSyntaxException("bad", cause);

        assertEquals("bad", exception.getMessage());
        assertSame(cause, exception.getCause());
        assertNull(exception.getExpected());
        assertNull(exception.getFound());
    }

    @Test
    @DisplayName("Lexical gaps are syntax errors")
    void lexicalGap() {
        LexicalGapException exception = new LexicalGapException('#', 3);

        assertEquals("Unrecognized character '#' at offset 3", exception.getMessage());
        assertInstanceOf(DSLSyntaxException.class, exception);
    }

    @Test
    @DisplayName("Resolution errors share the unknown alias hierarchy")
    void unknownAliasHierarchy() {
        UnknownAliasException kpi = new UnknownKpiException("FOO");
        UnknownAliasException group = new UnknownGroupByException("BAR");
        UnknownAliasException identifier = new UnknownIdentifierException("BAZ");

        assertEquals(AliasFamily.KPI, kpi.getFamily());
        assertEquals(AliasFamily.GROUP_BY, group.getFamily());
        assertEquals("Unknown identifier or unsupported filter: BAZ", identifier.getMessage());
        assertEquals("Invalid value 'x' for SexType", new UnknownAliasException(AliasFamily.SEX, "x").getMessage());
    }

    @Test
    @DisplayName("Invalid distribution specs are metric definition errors")
    void invalidDistributionSpec() {
        InvalidDistributionSpecException exception = new InvalidDistributionSpecException("A:1", "too short");

        assertEquals("Invalid distribution spec 'A:1': too short", exception.getMessage());
        assertEquals("A:1", exception.getSpec());
        assertInstanceOf(MetricDefinitionException.class, exception);
    }
}
