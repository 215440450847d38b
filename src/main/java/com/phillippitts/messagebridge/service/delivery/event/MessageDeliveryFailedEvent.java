package com.phillippitts.messagebridge.service.delivery.event;

import java.time.Instant;

/** Published when the delivery worker drops a message after a failed send. No message text. */
public record MessageDeliveryFailedEvent(String recipient, String reason, Instant at) { }
