package com.phillippitts.messagebridge.exception;

/**
 * Thrown when the external sender rejects or fails to deliver a message.
 * The delivery worker logs and drops the message; this never reaches a caller.
 */
public class SendFailureException extends MessageBridgeException {

    private final String recipient;

    public SendFailureException(String message, String recipient) {
        super(message + " (recipient: " + recipient + ")");
        this.recipient = recipient;
    }

    public SendFailureException(String message, String recipient, Throwable cause) {
        super(message + " (recipient: " + recipient + ")", cause);
        this.recipient = recipient;
    }

    public String getRecipient() {
        return recipient;
    }
}
