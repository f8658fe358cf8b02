package org.pcfgstego.grammar.api;

/**
 * The grammar parsed cleanly but does not define its start symbol.
 */
public class GrammarIncompleteException extends GrammarException {

    public GrammarIncompleteException(String startSymbol, String sourceName) {
        super(GrammarErrorCode.MISSING_START_SYMBOL,
                String.format("Start symbol '%s' is not defined in %s", startSymbol, sourceName));
    }
}
