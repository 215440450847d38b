package com.phillippitts.messagebridge.service.watcher.event;

import java.time.Instant;

/**
 * Published when the event source closes or fails.
 *
 * @param reason "eof" for a normal end, otherwise the failure's simple class name
 * @param willRestart whether the watcher is going to resubscribe
 */
public record EventStreamEndedEvent(String reason, boolean willRestart, Instant at) { }
