package org.pcfgstego.grammar.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one grammar parse so that every malformed line of a file is
 * reported at once instead of stopping at the first one.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param sourceName The grammar source in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String sourceName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, sourceName, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param sourceName The grammar source in which the warning occurred.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String sourceName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, sourceName, lineNumber));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return Only the warnings, in report order.
     */
    public List<Diagnostic> getWarnings() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.WARNING)
                .toList();
    }

    /**
     * Returns the errors as a single, newline-separated string.
     *
     * @return A formatted summary of all errors.
     */
    public String errorSummary() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
