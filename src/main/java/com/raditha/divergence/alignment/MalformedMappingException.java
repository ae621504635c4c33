package com.raditha.divergence.alignment;

/**
 * The name-mapping document cannot be parsed into a string to string map.
 */
public class MalformedMappingException extends RuntimeException {

    public MalformedMappingException(String message) {
        super(message);
    }

    public MalformedMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
