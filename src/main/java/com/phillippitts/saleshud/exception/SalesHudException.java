package com.phillippitts.saleshud.exception;

/**
 * Base exception for all sales-hud application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SalesHudException extends RuntimeException {

    public SalesHudException(String message) {
        super(message);
    }

    public SalesHudException(String message, Throwable cause) {
        super(message, cause);
    }
}
