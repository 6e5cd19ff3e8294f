package com.fops.core.error;

/**
 * Root of the pipeline's unchecked exceptions.
 */
public class FopsException extends RuntimeException {

    public FopsException(String message) {
        super(message);
    }

    public FopsException(String message, Throwable cause) {
        super(message, cause);
    }
}
