package org.pcfgstego.grammar.api;

/**
 * A rule line is malformed or carries an unusable weight.
 */
public class GrammarSyntaxException extends GrammarException {

    public GrammarSyntaxException(GrammarErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
