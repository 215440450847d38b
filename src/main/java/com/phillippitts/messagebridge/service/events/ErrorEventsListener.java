package com.phillippitts.messagebridge.service.events;

import com.phillippitts.messagebridge.service.delivery.event.MessageDeliveryFailedEvent;
import com.phillippitts.messagebridge.service.orchestration.event.TriggerActionFailedEvent;
import com.phillippitts.messagebridge.service.watcher.event.EventStreamEndedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator hints for recurring failures. No message text; throttled per key to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onActionFailed(TriggerActionFailedEvent e) {
        String key = "action-" + e.action() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Call action '{}' failing ({}). Check that the app has Accessibility and Automation "
                    + "permission: System Settings → Privacy & Security.", e.action(), e.reason());
        }
    }

    @EventListener
    void onDeliveryFailed(MessageDeliveryFailedEvent e) {
        if (shouldLog("delivery-" + e.reason())) {
            LOG.warn("Outbound delivery failing ({}). Check Messages.app is signed in to iMessage.", e.reason());
        }
    }

    @EventListener
    void onStreamEnded(EventStreamEndedEvent e) {
        if (!e.willRestart()) {
            LOG.error("Event stream ended ({}) and will not restart; incoming calls are no longer watched",
                    e.reason());
        } else if (shouldLog("stream-" + e.reason())) {
            LOG.warn("Event stream ended ({}); watcher will resubscribe", e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
