package io.github.cyfko.metricql.core.parsing;

import io.github.cyfko.metricql.core.exception.DSLSyntaxException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Splits a command line into a {@link QueryCommand}.
 * <pre>
 * [/query] KPI... [-filter EXPR] [-group NAME] [-distribution SPEC...] [-stats]
 * </pre>
 * <p>
 * Flags start at every {@code " -"} boundary and may appear in any order; a repeated flag
 * overrides the previous occurrence. Words before the first flag are KPI names.
 * </p>
 *
 * <pre>{@code
 * QueryCommand command = new QueryCommandParser().parse(
 *     "/query AGE DTN -filter AND(AGE>=50, SEX==MALE) -stats -distribution DTN:10:0:120 -group FIRST_CONTACT_PLACE");
 * command.metrics();       // [AGE, DTN]
 * command.filter();        // "AND(AGE>=50, SEX==MALE)"
 * command.distributions(); // [DTN:10:0:120]
 * }</pre>
 *
 * @since 1.0.0
 */
public class QueryCommandParser {

    private static final Logger log = Logger.getLogger(QueryCommandParser.class.getName());

    /** Optional command word. */
    public static final String COMMAND = "/query";

    private static final Pattern FLAG_BOUNDARY = Pattern.compile("(?= -)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @param line the command line
     * @return the command parts
     * @throws DSLSyntaxException if a flag is unknown
     */
    public QueryCommand parse(String line) {
        Objects.requireNonNull(line, "Command line cannot be null");

        String command = line.strip();
        if (command.startsWith(COMMAND)) {
            command = command.substring(COMMAND.length()).strip();
        }

        String[] chunks = FLAG_BOUNDARY.split(command);
        List<String> metrics = words(command.startsWith("-") ? "" : chunks[0]);

        String filter = null;
        String group = null;
        List<String> distributions = new ArrayList<>();
        boolean stats = false;

        for (int i = command.startsWith("-") ? 0 : 1; i < chunks.length; i++) {
            String chunk = chunks[i].strip();
            String[] flagAndRest = chunk.split("\\s+", 2);
            String rest = flagAndRest.length > 1 ? flagAndRest[1].strip() : "";

            switch (flagAndRest[0]) {
                case "-filter" -> filter = rest;
                case "-group" -> group = rest;
                case "-distribution" -> distributions = words(rest);
                case "-stats" -> stats = true;
                default -> throw new DSLSyntaxException(String.format(
                        "Unknown command flag '%s' (expected -filter, -group, -distribution or -stats)", flagAndRest[0]));
            }
        }

        QueryCommand result = new QueryCommand(metrics, filter, group, distributions, stats);
        log.fine(() -> "Parsed command line into " + result);
        return result;
    }

    private static List<String> words(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? new ArrayList<>() : new ArrayList<>(Arrays.asList(WHITESPACE.split(stripped)));
    }
}
