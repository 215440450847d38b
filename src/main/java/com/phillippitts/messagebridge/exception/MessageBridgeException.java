package com.phillippitts.messagebridge.exception;

/**
 * Base exception for all messageBridge application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MessageBridgeException extends RuntimeException {

    public MessageBridgeException(String message) {
        super(message);
    }

    public MessageBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public MessageBridgeException(Throwable cause) {
        super(cause);
    }
}
