package com.raditha.divergence.extraction;

/**
 * A required input (pipeline dump or mapping document) does not exist.
 * Raised before any processing starts.
 */
public class MissingInputException extends RuntimeException {

    public MissingInputException(String message) {
        super(message);
    }

    public MissingInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
