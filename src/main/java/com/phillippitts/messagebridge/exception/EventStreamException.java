package com.phillippitts.messagebridge.exception;

/**
 * Thrown when the external event source cannot be acquired or read.
 * Normal end-of-stream is not an error and is signalled by the stream itself.
 */
public class EventStreamException extends MessageBridgeException {

    public EventStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
