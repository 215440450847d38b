package com.phillippitts.messagebridge.service.delivery;

import com.phillippitts.messagebridge.exception.SendFailureException;

/** Delivers one message through the external messaging channel. */
public interface MessageSender {

    /**
     * Sends synchronously; returns only after the channel accepted the message.
     *
     * @throws SendFailureException if the channel rejected or failed to send
     */
    void send(String recipient, String body);
}
