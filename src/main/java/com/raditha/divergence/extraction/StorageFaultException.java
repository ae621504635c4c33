package com.raditha.divergence.extraction;

/**
 * An extracted block could not be written or read back. Fatal for the run.
 */
public class StorageFaultException extends RuntimeException {

    public StorageFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
