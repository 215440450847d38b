package com.phillippitts.messagebridge.exception;

/**
 * Thrown when an OS automation script fails.
 * This may occur due to a timeout, a non-zero exit (e.g. no matching call UI), or an I/O error.
 */
public class AutomationException extends MessageBridgeException {

    private final String action;

    public AutomationException(String message) {
        super(message);
        this.action = "unknown";
    }

    public AutomationException(String message, String action) {
        super(message + " (action: " + action + ")");
        this.action = action;
    }

    public AutomationException(String message, String action, Throwable cause) {
        super(message + " (action: " + action + ")", cause);
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
