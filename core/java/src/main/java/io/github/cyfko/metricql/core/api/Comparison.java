package io.github.cyfko.metricql.core.api;

/**
 * Enumeration of the comparison operators a numeric or date condition may use.
 * <p>
 * Each operator defines the symbol accepted by the filter grammar and the code the backend
 * expects. Free-form spellings ("at least", "=&gt;", "no less than", ...) are resolved through
 * the alias registry, never through this enum directly.
 * </p>
 *
 * <p><strong>Symbol / code mappings:</strong></p>
 * <ul>
 *     <li>GE / &gt;=</li>
 *     <li>LE / &lt;=</li>
 *     <li>LT / &lt;</li>
 *     <li>GT / &gt;</li>
 *     <li>EQ / ==</li>
 *     <li>NE / !=</li>
 * </ul>
 *
 * <pre>{@code
 * Comparison op = registry.resolve(Comparison.class, "at least"); // GE
 * op.getCode();   // "GE", emitted as operator: "GE"
 * op.getSymbol(); // ">="
 * }</pre>
 *
 * @since 1.0.0
 */
public enum Comparison {

    /** Greater than or equal: "&gt;=" */
    GE(">="),

    /** Less than or equal: "&lt;=" */
    LE("<="),

    /** Strictly less than: "&lt;" */
    LT("<"),

    /** Strictly greater than: "&gt;" */
    GT(">"),

    /** Equality: "==" */
    EQ("=="),

    /** Inequality: "!=" */
    NE("!=");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the symbol of the operator in the filter grammar.
     *
     * @return the symbol, e.g. {@code ">="}
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the code sent to the backend.
     *
     * @return the operator code, e.g. {@code "GE"}
     */
    public String getCode() {
        return name();
    }
}
