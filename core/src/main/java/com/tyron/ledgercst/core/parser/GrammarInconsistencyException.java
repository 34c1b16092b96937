package com.tyron.ledgercst.core.parser;

/**
 * Thrown when a parse tree does not match the field layout registered for its rule, or
 * when placeholder ordering cannot be satisfied.
 */
public class GrammarInconsistencyException extends IllegalStateException {

    public GrammarInconsistencyException(String message) {
        super(message);
    }
}
