package com.phillippitts.messagebridge.exception;

/**
 * Thrown when an outbound message violates admission rules: blank recipient,
 * blank body, or a body longer than the permitted maximum.
 */
public class InvalidMessageException extends MessageBridgeException {

    private final String field;
    private final String reason;

    public InvalidMessageException(String field, String reason) {
        super("Invalid message: " + field + " " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
