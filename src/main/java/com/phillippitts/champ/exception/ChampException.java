package com.phillippitts.champ.exception;

/**
 * Base exception for all champ application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ChampException extends RuntimeException {

    public ChampException(String message) {
        super(message);
    }

    public ChampException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChampException(Throwable cause) {
        super(cause);
    }
}
