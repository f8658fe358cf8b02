package org.pcfgstego.grammar.diagnostics;

/**
 * A single problem or remark found while reading a grammar definition.
 *
 * @param type The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param sourceName The logical name of the grammar source (file name or {@code <memory>}).
 * @param lineNumber The 1-based line the diagnostic refers to.
 */
public record Diagnostic(
        Type type,
        String message,
        String sourceName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Type {
        /** A problem that prevents the grammar from being built. */
        ERROR,
        /** A problem the parser repaired on its own. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, sourceName, lineNumber, message);
    }
}
