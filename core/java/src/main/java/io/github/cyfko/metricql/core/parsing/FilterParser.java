package io.github.cyfko.metricql.core.parsing;

import io.github.cyfko.metricql.core.alias.AliasRegistry;
import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.api.FilterNode;
import io.github.cyfko.metricql.core.api.LogicalOp;
import io.github.cyfko.metricql.core.exception.DSLSyntaxException;
import io.github.cyfko.metricql.core.exception.UnknownIdentifierException;
import io.github.cyfko.metricql.core.model.AgeFilter;
import io.github.cyfko.metricql.core.model.BooleanFilter;
import io.github.cyfko.metricql.core.model.BooleanProperty;
import io.github.cyfko.metricql.core.model.DateFilter;
import io.github.cyfko.metricql.core.model.LogicalNode;
import io.github.cyfko.metricql.core.model.NihssFilter;
import io.github.cyfko.metricql.core.model.SexFilter;
import io.github.cyfko.metricql.core.model.SexType;
import io.github.cyfko.metricql.core.model.StrokeFilter;
import io.github.cyfko.metricql.core.model.StrokeType;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive descent parser building a filter tree from tokens.
 * <pre>
 * filter    := 'NOT' '(' expr ')'
 *            | OPERATOR '(' expr_list ')'
 * expr_list := expr (',' expr)*
 * expr      := filter | condition
 * condition := IDENT COMPARISON value
 * </pre>
 * <p>
 * The whole token list must be consumed: tokens left after the top-level filter are a
 * syntax error. Positions reported in {@link DSLSyntaxException} are token indexes.
 * </p>
 * <p>
 * Operators, comparisons and condition values are resolved through the {@link AliasRegistry}
 * given at construction. Instances hold no per-parse state and are thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterParser {

    static final String AGE = "AGE";
    static final String NIHSS = "NIHSS";
    static final String DISCHARGE_DATE = "DISCHARGEDATE";

    private final FilterLexer lexer;
    private final AliasRegistry registry;

    /**
     * Creates a parser with a default lexer and the bundled alias registry.
     */
    public FilterParser() {
        this(new FilterLexer(), AliasRegistry.defaults());
    }

    public FilterParser(FilterLexer lexer, AliasRegistry registry) {
        this.lexer = Objects.requireNonNull(lexer, "Lexer is required");
        this.registry = Objects.requireNonNull(registry, "Alias registry is required");
    }

    /**
     * Tokenizes and parses a filter expression.
     *
     * @param text the filter expression
     * @return the root logical node
     * @throws DSLSyntaxException if the text does not conform to the grammar
     * @throws UnknownIdentifierException if a condition matches no dispatch rule
     */
    public LogicalNode parseFilterString(String text) {
        return parse(lexer.tokenize(text));
    }

    /**
     * Parses a token list produced by {@link FilterLexer}.
     *
     * @param tokens the tokens, without EOF marker
     * @return the root logical node
     * @throws DSLSyntaxException if the tokens do not conform to the grammar
     * @throws UnknownIdentifierException if a condition matches no dispatch rule
     */
    public LogicalNode parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "Token list cannot be null");
        Cursor cursor = new Cursor(tokens);
        LogicalNode root = filter(cursor);
        cursor.expect(TokenKind.EOF);
        return root;
    }

    private LogicalNode filter(Cursor cursor) {
        LogicalOp operator = registry.resolve(LogicalOp.class, cursor.consume(TokenKind.OPERATOR).text());
        cursor.consume(TokenKind.LPAREN);
        // a unary operator takes one expression, so a following comma fails on the closing parenthesis
        List<FilterNode> children = operator.isUnary() ? List.of(expr(cursor)) : exprList(cursor);
        cursor.consume(TokenKind.RPAREN);
        return new LogicalNode(operator, children);
    }

    private List<FilterNode> exprList(Cursor cursor) {
        List<FilterNode> children = new ArrayList<>();
        children.add(expr(cursor));
        while (cursor.peek().is(TokenKind.COMMA)) {
            cursor.consume(TokenKind.COMMA);
            children.add(expr(cursor));
        }
        return children;
    }

    private FilterNode expr(Cursor cursor) {
        return cursor.peek().is(TokenKind.OPERATOR) ? filter(cursor) : condition(cursor);
    }

    private FilterNode condition(Cursor cursor) {
        String identifier = cursor.consume(TokenKind.IDENT).text().toUpperCase(Locale.ROOT);
        Comparison comparison = registry.resolve(Comparison.class, cursor.consume(TokenKind.COMPARISON).text());
        String value = cursor.consumeValue().text();

        switch (identifier) {
            case AGE:
                return new AgeFilter(comparison, integerValue(identifier, value));
            case NIHSS:
                return new NihssFilter(comparison, integerValue(identifier, value));
            case DISCHARGE_DATE:
                return new DateFilter(comparison, dateValue(identifier, value));
            default:
                break;
        }

        Optional<SexType> sex = registry.tryResolve(SexType.class, value);
        if (sex.isPresent()) return new SexFilter(sex.get());

        Optional<StrokeType> stroke = registry.tryResolve(StrokeType.class, value);
        if (stroke.isPresent()) return new StrokeFilter(stroke.get());

        Optional<BooleanProperty> property = registry.tryResolve(BooleanProperty.class, identifier);
        if (property.isPresent()) return new BooleanFilter(property.get(), "true".equalsIgnoreCase(value));

        throw new UnknownIdentifierException(identifier);
    }

    private static int integerValue(String identifier, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new DSLSyntaxException(String.format("%s expects an integer value, got '%s'", identifier, value), e);
        }
    }

    private static LocalDate dateValue(String identifier, String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new DSLSyntaxException(String.format("%s expects an ISO date (yyyy-MM-dd), got '%s'", identifier, value), e);
        }
    }

    /**
     * Read position over one token list.
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int position;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return position < tokens.size() ? tokens.get(position) : Token.EOF;
        }

        Token consume(TokenKind expected) {
            Token token = expect(expected);
            position++;
            return token;
        }

        Token expect(TokenKind expected) {
            Token token = peek();
            if (!token.is(expected)) {
                throw new DSLSyntaxException(expected, token, position);
            }
            return token;
        }

        Token consumeValue() {
            Token token = peek();
            if (!token.kind().isValue()) {
                throw new DSLSyntaxException(String.format(
                        "Expected a condition value, got %s '%s' at position %d", token.kind(), token.text(), position));
            }
            position++;
            return token;
        }
    }
}
