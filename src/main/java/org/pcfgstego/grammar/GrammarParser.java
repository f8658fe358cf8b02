package org.pcfgstego.grammar;

import org.pcfgstego.grammar.api.GrammarErrorCode;
import org.pcfgstego.grammar.api.GrammarException;
import org.pcfgstego.grammar.api.GrammarIncompleteException;
import org.pcfgstego.grammar.api.GrammarSyntaxException;
import org.pcfgstego.grammar.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the line-oriented rule syntax into a {@link Grammar}.
 * <pre>
 * # comment
 * Start -&gt; Greeting CITY .
 * CITY  -&gt; "Boston" [0.5] | "Denver" [0.5]
 * </pre>
 * Each rule line is {@code SYMBOL -> ALT [p] | ALT [p] | ...}. A symbol may be continued on further
 * lines; their alternatives are appended. Weights that do not sum to one within the configured
 * tolerance are renormalized and reported as warnings.
 * <p>
 * In strict mode a weight outside [0, 1] is an error. In lenient mode it is replaced by 1.0 and
 * reported as a warning. Instances are immutable and can be reused.
 */
public final class GrammarParser {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarParser.class);

    /** Start symbol used when none is configured. */
    public static final String DEFAULT_START_SYMBOL = "Start";
    /** Maximum distance of a symbol's weight sum from 1 before it is renormalized. */
    public static final double DEFAULT_WEIGHT_TOLERANCE = 0.01;

    private static final String ARROW = "->";
    private static final Pattern WEIGHTED = Pattern.compile("^(.*?)\\s*\\[([^\\[\\]]*)]\\s*$", Pattern.DOTALL);

    private final String startSymbol;
    private final double weightTolerance;
    private final boolean strict;

    public GrammarParser(String startSymbol, double weightTolerance, boolean strict) {
        this.startSymbol = Objects.requireNonNull(startSymbol, "startSymbol");
        if (weightTolerance < 0) {
            throw new IllegalArgumentException("weightTolerance must be >= 0");
        }
        this.weightTolerance = weightTolerance;
        this.strict = strict;
    }

    /**
     * @return A strict parser with the default start symbol and tolerance.
     */
    public static GrammarParser strict() {
        return new GrammarParser(DEFAULT_START_SYMBOL, DEFAULT_WEIGHT_TOLERANCE, true);
    }

    /**
     * @return A lenient parser with the default start symbol and tolerance.
     */
    public static GrammarParser lenient() {
        return new GrammarParser(DEFAULT_START_SYMBOL, DEFAULT_WEIGHT_TOLERANCE, false);
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Parses grammar source held in memory.
     *
     * @param source The full grammar text.
     * @return The parsed grammar.
     * @throws GrammarException if the source is malformed or incomplete.
     */
    public Grammar parse(String source) throws GrammarException {
        return parse(Arrays.asList(source.split("\\r?\\n", -1)), "<memory>");
    }

    /**
     * Parses grammar lines.
     *
     * @param lines The lines of the grammar definition.
     * @param sourceName A name for the source, used in diagnostics.
     * @return The parsed grammar.
     * @throws GrammarSyntaxException if any rule line is malformed.
     * @throws GrammarIncompleteException if the start symbol has no rule.
     */
    public Grammar parse(List<String> lines, String sourceName) throws GrammarException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Map<String, List<PendingAlternative>> pending = new LinkedHashMap<>();
        Map<String, Integer> firstLine = new LinkedHashMap<>();
        GrammarErrorCode firstError = null;

        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            GrammarErrorCode error = parseRule(line, lineNumber, sourceName, diagnostics, pending, firstLine);
            if (error != null && firstError == null) {
                firstError = error;
            }
        }

        if (diagnostics.hasErrors()) {
            throw new GrammarSyntaxException(firstError, diagnostics.errorSummary());
        }
        if (!pending.containsKey(startSymbol)) {
            throw new GrammarIncompleteException(startSymbol, sourceName);
        }

        Map<String, List<Alternative>> rules = new LinkedHashMap<>();
        pending.forEach((symbol, alternatives) ->
                rules.put(symbol, normalize(symbol, alternatives, sourceName, firstLine.get(symbol), diagnostics)));

        LOG.debug("Parsed grammar {} with {} symbols", sourceName, rules.size());
        return new Grammar(startSymbol, rules, diagnostics.getWarnings());
    }

    private GrammarErrorCode parseRule(String line, int lineNumber, String sourceName, DiagnosticsEngine diagnostics,
                                       Map<String, List<PendingAlternative>> pending, Map<String, Integer> firstLine) {
        int arrow = line.indexOf(ARROW);
        if (arrow < 0) {
            diagnostics.reportError("Missing '" + ARROW + "' separator in rule: " + line, sourceName, lineNumber);
            return GrammarErrorCode.MALFORMED_RULE;
        }
        String symbol = line.substring(0, arrow).strip();
        if (symbol.isEmpty() || symbol.chars().anyMatch(Character::isWhitespace) || symbol.startsWith("\"")) {
            diagnostics.reportError("Invalid symbol name '" + symbol + "'", sourceName, lineNumber);
            return GrammarErrorCode.MALFORMED_RULE;
        }

        List<String> parts;
        try {
            parts = splitAlternatives(line.substring(arrow + ARROW.length()));
        } catch (IllegalArgumentException e) {
            diagnostics.reportError(e.getMessage(), sourceName, lineNumber);
            return GrammarErrorCode.MALFORMED_RULE;
        }

        GrammarErrorCode error = null;
        List<PendingAlternative> parsed = new ArrayList<>();
        for (String part : parts) {
            String body = part.strip();
            Double weight = null;
            Matcher m = WEIGHTED.matcher(body);
            if (m.matches()) {
                body = m.group(1).strip();
                String weightText = m.group(2).strip();
                try {
                    weight = Double.parseDouble(weightText);
                } catch (NumberFormatException e) {
                    diagnostics.reportError("Invalid probability '" + weightText + "' for " + symbol, sourceName, lineNumber);
                    error = firstOf(error, GrammarErrorCode.INVALID_PROBABILITY);
                    continue;
                }
                if (weight.isNaN() || weight < 0.0 || weight > 1.0) {
                    if (strict) {
                        diagnostics.reportError("Probability " + weightText + " for " + symbol + " is outside [0, 1]",
                                sourceName, lineNumber);
                        error = firstOf(error, GrammarErrorCode.PROBABILITY_OUT_OF_RANGE);
                        continue;
                    }
                    String message = "Probability " + weightText + " for " + symbol + " is outside [0, 1], using 1.0";
                    LOG.warn("{}:{}: {}", sourceName, lineNumber, message);
                    diagnostics.reportWarning(message, sourceName, lineNumber);
                    weight = 1.0;
                }
            }
            if (body.isEmpty()) {
                diagnostics.reportError("Empty alternative for " + symbol, sourceName, lineNumber);
                error = firstOf(error, GrammarErrorCode.EMPTY_ALTERNATIVE);
                continue;
            }
            parsed.add(new PendingAlternative(body, Tokens.split(body), weight));
        }

        if (error == null) {
            pending.computeIfAbsent(symbol, s -> new ArrayList<>()).addAll(parsed);
            firstLine.putIfAbsent(symbol, lineNumber);
        }
        return error;
    }

    private List<Alternative> normalize(String symbol, List<PendingAlternative> alternatives, String sourceName,
                                        int lineNumber, DiagnosticsEngine diagnostics) {
        int n = alternatives.size();
        if (n == 1) {
            PendingAlternative only = alternatives.get(0);
            return List.of(new Alternative(only.text(), only.tokens(), 1.0));
        }

        double declared = 0.0;
        int missing = 0;
        for (PendingAlternative a : alternatives) {
            if (a.weight() == null) {
                missing++;
            } else {
                declared += a.weight();
            }
        }
        double share = missing == 0 ? 0.0 : Math.max(0.0, 1.0 - declared) / missing;
        if (missing == n) {
            share = 1.0 / n;
        }

        double[] weights = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            Double w = alternatives.get(i).weight();
            weights[i] = w == null ? share : w;
            sum += weights[i];
        }

        if (Math.abs(sum - 1.0) > weightTolerance) {
            String message;
            if (sum <= 0.0) {
                Arrays.fill(weights, 1.0 / n);
                message = String.format("Weights of %s sum to 0, using a uniform distribution", symbol);
            } else {
                for (int i = 0; i < n; i++) {
                    weights[i] /= sum;
                }
                message = String.format(Locale.ROOT, "Weights of %s sum to %.4f, renormalized", symbol, sum);
            }
            LOG.warn("{}:{}: {}", sourceName, lineNumber, message);
            diagnostics.reportWarning(message, sourceName, lineNumber);
        }

        List<Alternative> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            PendingAlternative a = alternatives.get(i);
            result.add(new Alternative(a.text(), a.tokens(), weights[i]));
        }
        return result;
    }

    /**
     * Splits a right-hand side on {@code |} outside quoted literals.
     */
    private static List<String> splitAlternatives(String rhs) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < rhs.length(); i++) {
            char c = rhs.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            }
            if (c == '|' && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quoted literal in: " + rhs.strip());
        }
        parts.add(current.toString());
        return parts;
    }

    private static GrammarErrorCode firstOf(GrammarErrorCode current, GrammarErrorCode candidate) {
        return current != null ? current : candidate;
    }

    private record PendingAlternative(String text, List<String> tokens, Double weight) {}
}
