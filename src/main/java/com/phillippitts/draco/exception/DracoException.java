package com.phillippitts.draco.exception;

/**
 * Base exception for all Draco application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DracoException extends RuntimeException {

    public DracoException(String message) {
        super(message);
    }

    public DracoException(String message, Throwable cause) {
        super(message, cause);
    }

    public DracoException(Throwable cause) {
        super(cause);
    }
}
