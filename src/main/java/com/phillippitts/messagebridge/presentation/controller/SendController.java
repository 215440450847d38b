package com.phillippitts.messagebridge.presentation.controller;

import com.phillippitts.messagebridge.domain.OutboundMessage;
import com.phillippitts.messagebridge.service.delivery.OutboundDeliveryQueue;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Accepts outbound messages and queues them; delivery happens later on the worker thread.
 * Invalid input surfaces as {@link com.phillippitts.messagebridge.exception.InvalidMessageException} (400).
 */
@RestController
class SendController {

    static final String SOURCE = "api";

    private final OutboundDeliveryQueue queue;

    SendController(OutboundDeliveryQueue queue) {
        this.queue = queue;
    }

    @PostMapping("/send")
    ResponseEntity<Map<String, Object>> send(@RequestBody SendRequest request) {
        OutboundMessage message = request.toMessage();
        queue.enqueue(message, SOURCE);
        return ResponseEntity.ok(Map.of(
                "status", "queued",
                "to", message.recipient()
        ));
    }
}
