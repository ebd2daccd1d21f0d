package com.phillippitts.presetgraph.exception;

/**
 * Base exception for all presetgraph application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PresetGraphException extends RuntimeException {

    public PresetGraphException(String message) {
        super(message);
    }

    public PresetGraphException(String message, Throwable cause) {
        super(message, cause);
    }

    public PresetGraphException(Throwable cause) {
        super(cause);
    }
}
