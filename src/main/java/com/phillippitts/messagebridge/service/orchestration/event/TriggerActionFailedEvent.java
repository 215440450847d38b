package com.phillippitts.messagebridge.service.orchestration.event;

import java.time.Instant;

/** Published when one action of a call trigger fails; the remaining actions still run. */
public record TriggerActionFailedEvent(String action, String callId, String reason, Instant at) { }
