package io.github.cyfko.metricql.core.parsing;

import io.github.cyfko.metricql.core.config.DslPolicy;
import io.github.cyfko.metricql.core.exception.LexicalGapException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits a filter expression into an ordered list of {@link Token}s.
 * <p>
 * At each position the rules below are tried in order and the first one that matches wins:
 * </p>
 * <table border="1">
 * <caption>Token rules</caption>
 * <thead><tr><th>Kind</th><th>Pattern</th></tr></thead>
 * <tbody>
 * <tr><td>LPAREN</td><td>{@code \(}</td></tr>
 * <tr><td>RPAREN</td><td>{@code \)}</td></tr>
 * <tr><td>COMMA</td><td>{@code ,}</td></tr>
 * <tr><td>OPERATOR</td><td>{@code \b(?:AND|OR|NOT)\b}</td></tr>
 * <tr><td>COMPARISON</td><td>{@code ==|!=|>=|<=|>|<}</td></tr>
 * <tr><td>IDENT</td><td>{@code [A-Z_]+}</td></tr>
 * <tr><td>NUMBER</td><td>{@code \d{4}-\d{2}-\d{2}|\d+}</td></tr>
 * <tr><td>STRING</td><td>{@code [A-Z_]+}</td></tr>
 * <tr><td>(skipped)</td><td>{@code \s+}</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Matching is case-sensitive: lowercase letters match no rule. A character that matches
 * no rule is a <em>lexical gap</em>. Under a lenient {@link DslPolicy} it is logged and
 * skipped, under a policy with {@link DslPolicy#rejectUnknownCharacters()} it raises a
 * {@link LexicalGapException}.
 * </p>
 *
 * <pre>{@code
 * new FilterLexer().tokenize("AND(AGE>=50, SEX==MALE)");
 * // [OPERATOR('AND'), LPAREN('('), IDENT('AGE'), COMPARISON('>='), NUMBER('50'), COMMA(','),
 * //  IDENT('SEX'), COMPARISON('=='), IDENT('MALE'), RPAREN(')')]
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public class FilterLexer {

    private static final Logger log = Logger.getLogger(FilterLexer.class.getName());

    private static final String SKIP = "SKIP";

    private static final Map<String, String> RULES = new LinkedHashMap<>();
    static {
        RULES.put(TokenKind.LPAREN.name(), "\\(");
        RULES.put(TokenKind.RPAREN.name(), "\\)");
        RULES.put(TokenKind.COMMA.name(), ",");
        RULES.put(TokenKind.OPERATOR.name(), "\\b(?:AND|OR|NOT)\\b");
        RULES.put(TokenKind.COMPARISON.name(), "==|!=|>=|<=|>|<");
        RULES.put(TokenKind.IDENT.name(), "[A-Z_]+");
        RULES.put(TokenKind.NUMBER.name(), "\\d{4}-\\d{2}-\\d{2}|\\d+");
        RULES.put(TokenKind.STRING.name(), "[A-Z_]+");
        RULES.put(SKIP, "\\s+");
    }

    private static final Pattern SCANNER = Pattern.compile(RULES.entrySet().stream()
            .map(rule -> "(?<" + rule.getKey() + ">" + rule.getValue() + ")")
            .collect(Collectors.joining("|")));

    private final DslPolicy policy;

    /**
     * Creates a lexer using {@link DslPolicy#defaults()}.
     */
    public FilterLexer() {
        this(DslPolicy.defaults());
    }

    /**
     * @param policy the policy deciding how lexical gaps are handled
     */
    public FilterLexer(DslPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "DSL policy is required");
    }

    /**
     * Tokenizes {@code input}.
     *
     * @param input the filter expression
     * @return the tokens in source order, without whitespace and without an EOF marker
     * @throws LexicalGapException if the policy rejects unknown characters and one is found
     * @throws NullPointerException if input is null
     */
    public List<Token> tokenize(String input) {
        Objects.requireNonNull(input, "Filter expression cannot be null");

        List<Token> tokens = new ArrayList<>();
        Matcher matcher = SCANNER.matcher(input);
        matcher.useTransparentBounds(true).useAnchoringBounds(false);

        int offset = 0;
        while (offset < input.length()) {
            matcher.region(offset, input.length());
            if (!matcher.lookingAt()) {
                onGap(input, offset);
                offset++;
                continue;
            }

            String kind = matchedRule(matcher);
            if (!SKIP.equals(kind)) {
                tokens.add(new Token(TokenKind.valueOf(kind), matcher.group()));
            }
            offset = matcher.end();
        }

        log.finest(() -> String.format("Tokenized '%s' into %s", input, tokens));
        return tokens;
    }

    public DslPolicy getPolicy() {
        return policy;
    }

    private void onGap(String input, int offset) {
        char character = input.charAt(offset);
        if (policy.rejectUnknownCharacters()) {
            throw new LexicalGapException(character, offset);
        }
        log.warning(() -> String.format("Skipping unrecognized character '%c' at offset %d in filter expression", character, offset));
    }

    private static String matchedRule(Matcher matcher) {
        for (String name : RULES.keySet()) {
            if (matcher.group(name) != null) return name;
        }
        throw new IllegalStateException("Scanner matched without a named rule");
    }
}
