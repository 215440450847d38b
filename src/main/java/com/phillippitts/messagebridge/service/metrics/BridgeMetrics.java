package com.phillippitts.messagebridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for the call watcher and the outbound delivery path.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Messages enqueued, delivered and failed</li>
 *   <li>Call triggers fired and suppressed by cooldown</li>
 *   <li>Trigger action failures per action</li>
 *   <li>Event stream resubscriptions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class BridgeMetrics {

    private static final String METRIC_PREFIX = "messagebridge";

    private final MeterRegistry registry;

    public BridgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers a gauge reporting the current delivery queue depth.
     *
     * @param depth supplier of the live depth (called on scrape)
     */
    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder(METRIC_PREFIX + ".delivery.queue.depth", depth)
                .description("Messages waiting for the delivery worker")
                .register(registry);
    }

    public void incrementEnqueued(String source) {
        Counter.builder(METRIC_PREFIX + ".delivery.enqueued")
                .description("Messages admitted to the delivery queue")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void incrementDelivered() {
        Counter.builder(METRIC_PREFIX + ".delivery.sent")
                .description("Messages handed to the sender successfully")
                .register(registry)
                .increment();
    }

    /**
     * @param reason exception simple name
     */
    public void incrementDeliveryFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".delivery.failure")
                .description("Messages dropped after a failed send")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementTriggered() {
        Counter.builder(METRIC_PREFIX + ".calls.triggered")
                .description("Incoming calls that fired the action sequence")
                .register(registry)
                .increment();
    }

    public void incrementSuppressed() {
        Counter.builder(METRIC_PREFIX + ".calls.suppressed")
                .description("Qualifying lines suppressed by the per-call cooldown")
                .register(registry)
                .increment();
    }

    public void incrementActionFailure(String action) {
        Counter.builder(METRIC_PREFIX + ".actions.failure")
                .description("Trigger actions that failed")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void incrementStreamRestart() {
        Counter.builder(METRIC_PREFIX + ".watcher.restarts")
                .description("Times the event stream was re-acquired after ending")
                .register(registry)
                .increment();
    }
}
