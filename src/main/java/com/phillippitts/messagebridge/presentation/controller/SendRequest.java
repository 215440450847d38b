package com.phillippitts.messagebridge.presentation.controller;

import com.phillippitts.messagebridge.domain.OutboundMessage;

/**
 * Body of {@code POST /send}. Both fields are trimmed before validation.
 */
record SendRequest(String to, String message) {

    OutboundMessage toMessage() {
        return OutboundMessage.trimmed(to, message);
    }
}
