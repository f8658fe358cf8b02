package org.pcfgstego.grammar.api;

/**
 * Thrown when a grammar definition cannot be turned into a {@link org.pcfgstego.grammar.Grammar}.
 * <p>
 * Loading is all-or-nothing: when this exception is thrown no partially built grammar is reachable.
 */
public class GrammarException extends Exception {

    private final GrammarErrorCode errorCode;

    /**
     * @param errorCode The code identifying the first failure.
     * @param message A human-readable description, usually the diagnostics summary.
     */
    public GrammarException(GrammarErrorCode errorCode, String message) {
        super(message, null);
        this.errorCode = errorCode;
    }

    /**
     * @param errorCode The code identifying the failure.
     * @param message A human-readable description.
     * @param cause The underlying cause.
     */
    public GrammarException(GrammarErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The code identifying the first failure that was detected.
     */
    public GrammarErrorCode getErrorCode() {
        return errorCode;
    }
}
