package com.phillippitts.messagebridge.service.delivery;

import com.phillippitts.messagebridge.domain.OutboundMessage;
import com.phillippitts.messagebridge.exception.SendFailureException;
import com.phillippitts.messagebridge.service.delivery.event.MessageDeliveryFailedEvent;
import com.phillippitts.messagebridge.service.metrics.BridgeMetrics;
import com.phillippitts.messagebridge.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;

/**
 * Sole consumer of the {@link OutboundDeliveryQueue}.
 *
 * <p>One dedicated thread takes messages in arrival order and hands each to the
 * {@link MessageSender}, waiting for the send to finish before taking the next. The messaging
 * channel has no defined behavior for concurrent sends from one origin, so there is never more
 * than one message in flight.
 *
 * <p>A failed send is logged, counted and dropped: no retry and no re-enqueue. The loop only
 * ends when the application context stops.
 */
@Service
public class DeliveryWorker implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(DeliveryWorker.class);

    private final OutboundDeliveryQueue queue;
    private final MessageSender sender;
    private final BridgeMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private volatile boolean running;
    private volatile Thread thread;

    public DeliveryWorker(OutboundDeliveryQueue queue,
                          MessageSender sender,
                          BridgeMetrics metrics,
                          ApplicationEventPublisher publisher) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread t = new Thread(this::drain, "delivery-worker");
        t.setDaemon(true);
        thread = t;
        t.start();
        LOG.info("Outbound delivery worker running");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread t = thread;
        thread = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(ProcessTimeouts.WORKER_STOP_TIMEOUT.toMillis());
                if (t.isAlive()) {
                    LOG.warn("Delivery worker did not terminate within {}ms",
                            ProcessTimeouts.WORKER_STOP_TIMEOUT.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for delivery worker to terminate");
            }
        }
        int pending = queue.size();
        if (pending > 0) {
            LOG.warn("Delivery worker stopped with {} undelivered message(s)", pending);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** True while the consumer thread is alive; used by the health indicator. */
    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    private void drain() {
        while (running) {
            OutboundMessage message;
            try {
                message = queue.take();
            } catch (InterruptedException e) {
                if (!running) {
                    break;
                }
                LOG.warn("Delivery worker interrupted while running; continuing");
                continue;
            }
            try {
                deliver(message);
            } catch (RuntimeException e) {
                // Failure-event listeners must not be able to kill the consumer
                LOG.error("Post-delivery handling failed for {}", message.recipient(), e);
            }
        }
        LOG.info("Outbound delivery worker stopped");
    }

    /**
     * One delivery attempt. Never throws {@link Exception}; failures are logged and the message dropped.
     */
    void deliver(OutboundMessage message) {
        try {
            sender.send(message.recipient(), message.body());
            metrics.incrementDelivered();
            LOG.info("Sent message to {}", message.recipient());
        } catch (SendFailureException e) {
            LOG.warn("Send failed for {}: {}", message.recipient(), e.getMessage());
            dropped(message, e);
        } catch (Exception e) {
            LOG.error("Unexpected send error for {}", message.recipient(), e);
            dropped(message, e);
        }
    }

    private void dropped(OutboundMessage message, Exception cause) {
        String reason = cause.getClass().getSimpleName();
        metrics.incrementDeliveryFailure(reason);
        publisher.publishEvent(new MessageDeliveryFailedEvent(message.recipient(), reason, Instant.now()));
    }
}
