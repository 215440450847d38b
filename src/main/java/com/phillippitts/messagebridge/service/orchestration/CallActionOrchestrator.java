package com.phillippitts.messagebridge.service.orchestration;

import com.phillippitts.messagebridge.domain.CallEvent;
import com.phillippitts.messagebridge.service.metrics.BridgeMetrics;
import com.phillippitts.messagebridge.service.orchestration.event.TriggerActionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Runs every enabled action in a fixed order: decline -> restart -> auto-reply.
 *
 * <p>Unlike a fallback chain this never stops early: each action's failure is logged, counted
 * and published, then the next action runs. Nothing is retried within a trigger.
 */
@Service
public class CallActionOrchestrator {
    private static final Logger LOG = LogManager.getLogger(CallActionOrchestrator.class);

    static final List<String> ORDER = List.of(
            DeclineCallAction.NAME, RestartApplicationAction.NAME, AutoReplyAction.NAME);

    private final List<TriggerAction> actions;
    private final BridgeMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public CallActionOrchestrator(List<TriggerAction> actions, BridgeMetrics metrics,
                                  ApplicationEventPublisher publisher) {
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
        // Known actions first in their fixed position; anything else after, stable
        List<TriggerAction> ordered = new ArrayList<>(actions);
        ordered.sort(Comparator.comparingInt(a -> position(a.name())));
        this.actions = List.copyOf(ordered);
        LOG.info("Call actions: {}", this.actions.stream().map(TriggerAction::name).toList());
    }

    private static int position(String name) {
        int idx = ORDER.indexOf(name);
        return idx < 0 ? ORDER.size() : idx;
    }

    /**
     * Runs all actions for one triggered call.
     *
     * @param event the call that passed the cooldown
     * @return per-action outcome
     */
    public TriggerReport trigger(CallEvent event) {
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (TriggerAction a : actions) {
            if (!a.isEnabled()) {
                LOG.debug("Skipping action {}: disabled", a.name());
                skipped.add(a.name());
                continue;
            }
            try {
                a.execute(event);
                succeeded.add(a.name());
                LOG.info("Action {} completed", a.name());
            } catch (Exception e) {
                failed.add(a.name());
                LOG.warn("Action {} failed: {}", a.name(), e.getMessage());
                metrics.incrementActionFailure(a.name());
                publisher.publishEvent(new TriggerActionFailedEvent(a.name(), event.callId(),
                        e.getClass().getSimpleName(), Instant.now()));
            }
        }
        return new TriggerReport(succeeded, failed, skipped);
    }

    /** Visible for tests */
    List<String> actionNames() {
        return actions.stream().map(TriggerAction::name).toList();
    }
}
