package com.phillippitts.messagebridge.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A qualifying log line together with the call identifier derived from it.
 *
 * <p>Ephemeral: created by the watcher pipeline for one line and discarded after that pass.
 *
 * @param rawText the original log line
 * @param callId identifier used for cooldown deduplication
 * @param observedAt time the line was read
 */
public record CallEvent(String rawText, String callId, Instant observedAt) {

    public CallEvent {
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(callId, "callId");
        Objects.requireNonNull(observedAt, "observedAt");
    }
}
