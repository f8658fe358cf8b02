package org.pcfgstego.grammar.api;

/**
 * Stable, testable codes for every way a grammar can fail to load.
 * Tests assert on these instead of on message text.
 */
public enum GrammarErrorCode {
    // region Syntax
    /** A rule line has no {@code ->} separator, or an empty or malformed left-hand side. */
    MALFORMED_RULE,
    /** An alternative between two {@code |} separators contains no tokens. */
    EMPTY_ALTERNATIVE,
    /** A bracketed weight could not be read as a number. */
    INVALID_PROBABILITY,
    /** A weight lies outside [0, 1]. */
    PROBABILITY_OUT_OF_RANGE,
    // endregion

    // region Completeness
    /** The configured start symbol has no rule. */
    MISSING_START_SYMBOL,
    // endregion

    // region I/O
    /** The grammar file does not exist. */
    FILE_NOT_FOUND,
    /** The grammar file exists but could not be read. */
    IO_ERROR
    // endregion
}
