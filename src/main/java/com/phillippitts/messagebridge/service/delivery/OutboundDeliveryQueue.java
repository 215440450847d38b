package com.phillippitts.messagebridge.service.delivery;

import com.phillippitts.messagebridge.domain.OutboundMessage;
import com.phillippitts.messagebridge.service.metrics.BridgeMetrics;
import com.phillippitts.messagebridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of outbound messages: many producers, exactly one consumer ({@link DeliveryWorker}).
 *
 * <p>{@link #enqueue} never blocks and never fails because of queue state. Messages are validated
 * when constructed, so nothing invalid can be admitted.
 */
@Component
public class OutboundDeliveryQueue {

    private static final Logger LOG = LogManager.getLogger(OutboundDeliveryQueue.class);

    private final BlockingQueue<OutboundMessage> queue = new LinkedBlockingQueue<>();
    private final BridgeMetrics metrics;

    public OutboundDeliveryQueue(BridgeMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        metrics.registerQueueDepth(queue::size);
    }

    /**
     * Appends a message to the tail and returns without waiting for delivery.
     *
     * @param message validated message
     * @param source producer tag for metrics (api, auto-reply)
     */
    public void enqueue(OutboundMessage message, String source) {
        Objects.requireNonNull(message, "message");
        queue.add(message);
        metrics.incrementEnqueued(source);
        LOG.info("Queued message to {} from {} (chars={}, depth={})",
                message.recipient(), source, message.body().length(), queue.size());
        LOG.debug("Queued preview: '{}'", LogSanitizer.preview(message.body()));
    }

    /**
     * Removes the head, blocking until one is available. Consumer side only.
     */
    OutboundMessage take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }
}
