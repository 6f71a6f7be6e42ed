package com.phillippitts.recorderbridge.exception;

/**
 * Base exception for all recorder-bridge application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class RecorderBridgeException extends RuntimeException {

    public RecorderBridgeException(String message) {
        super(message);
    }

    public RecorderBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public RecorderBridgeException(Throwable cause) {
        super(cause);
    }
}
