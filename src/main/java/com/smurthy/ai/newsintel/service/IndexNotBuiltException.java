package com.smurthy.ai.newsintel.service;

/**
 * Thrown when a caller reaches into the internals of a keyword index that has not been built.
 */
public class IndexNotBuiltException extends IllegalStateException {

    public IndexNotBuiltException(String message) {
        super(message);
    }
}
