package com.phillippitts.messagebridge.service.watcher;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call-id sliding cooldown: an id may trigger again only once {@code window} has passed
 * since its last trigger. Ids never affect each other.
 *
 * <p>Not thread-safe. The instance belongs to {@link CallEventPipeline}, which is only ever
 * driven by the watcher thread, so check-and-record is atomic without a lock.
 *
 * <p>Entries are kept for the process lifetime.
 */
public final class CooldownDeduplicator {

    private final Duration window;
    private final Map<String, Instant> lastTriggered = new HashMap<>();

    public CooldownDeduplicator(Duration window) {
        Objects.requireNonNull(window, "window");
        if (window.isNegative()) {
            throw new IllegalArgumentException("cooldown window must not be negative: " + window);
        }
        this.window = window;
    }

    /**
     * Returns true and records {@code now} if {@code callId} has never triggered or its last
     * trigger is at least one window old; otherwise returns false and changes nothing.
     */
    public boolean shouldTrigger(String callId, Instant now) {
        Objects.requireNonNull(callId, "callId");
        Objects.requireNonNull(now, "now");
        Instant last = lastTriggered.get(callId);
        if (last != null && Duration.between(last, now).compareTo(window) < 0) {
            return false;
        }
        lastTriggered.put(callId, now);
        return true;
    }

    public Optional<Instant> lastTriggered(String callId) {
        return Optional.ofNullable(lastTriggered.get(callId));
    }

    public int size() {
        return lastTriggered.size();
    }

    public Duration window() {
        return window;
    }
}
