package me.christianrobert.namereduce.semantic;

import me.christianrobert.namereduce.context.ReductionException;

/**
 * Thrown (or used to complete a future exceptionally) when the semantic oracle cannot
 * complete a request for a whole document.
 */
public class SemanticOracleException extends ReductionException {

    public SemanticOracleException(String message) {
        super(message);
    }

    public SemanticOracleException(String message, Throwable cause) {
        super(message, cause);
    }

    public SemanticOracleException(String message, String documentName, String context) {
        super(message, documentName, context);
    }
}
