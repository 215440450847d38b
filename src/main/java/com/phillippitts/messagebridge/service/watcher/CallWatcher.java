package com.phillippitts.messagebridge.service.watcher;

import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import com.phillippitts.messagebridge.exception.EventStreamException;
import com.phillippitts.messagebridge.service.metrics.BridgeMetrics;
import com.phillippitts.messagebridge.service.watcher.event.EventStreamEndedEvent;
import com.phillippitts.messagebridge.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * Supervises the incoming-call pipeline on one dedicated thread.
 *
 * <p>The thread opens the event source, feeds every line to {@link CallEventPipeline}, and when
 * the source ends or fails either resubscribes after {@code bridge.watcher.restart-delay}
 * ({@code restart-on-end=true}, the default) or stops for good. A failure while handling one
 * line is logged and the next line is read as usual.
 */
@Service
public class CallWatcher implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(CallWatcher.class);

    static final String REASON_EOF = "eof";

    private final EventStreamReader reader;
    private final CallEventPipeline pipeline;
    private final WatcherProperties props;
    private final ApplicationEventPublisher publisher;
    private final BridgeMetrics metrics;

    private volatile boolean running;
    private volatile Thread thread;
    private volatile EventStream current;

    public CallWatcher(EventStreamReader reader,
                       CallEventPipeline pipeline,
                       WatcherProperties props,
                       ApplicationEventPublisher publisher,
                       BridgeMetrics metrics) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!props.isEnabled()) {
            LOG.info("Call watcher disabled (bridge.watcher.enabled=false)");
            return;
        }
        running = true;
        Thread t = new Thread(this::watch, "call-watcher");
        t.setDaemon(true);
        thread = t;
        t.start();
        LOG.info("Call watcher started (keyword='{}', cooldown={})",
                props.getTriggerKeyword(), props.getCooldown());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        EventStream stream = current;
        if (stream != null) {
            stream.close();
        }
        Thread t = thread;
        thread = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(ProcessTimeouts.WORKER_STOP_TIMEOUT.toMillis());
                if (t.isAlive()) {
                    LOG.warn("Call watcher did not terminate within {}ms",
                            ProcessTimeouts.WORKER_STOP_TIMEOUT.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for call watcher to terminate");
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** True while the watcher thread is alive; used by the health indicator. */
    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    private void watch() {
        while (running) {
            String reason = consumeOnce();
            if (!running) {
                break;
            }
            boolean restart = props.isRestartOnEnd();
            publisher.publishEvent(new EventStreamEndedEvent(reason, restart, Instant.now()));
            if (!restart) {
                LOG.warn("Event stream ended ({}); restart disabled, call watcher stopping", reason);
                running = false;
                break;
            }
            metrics.incrementStreamRestart();
            LOG.warn("Event stream ended ({}); resubscribing in {}", reason, props.getRestartDelay());
            if (!pause()) {
                break;
            }
        }
        LOG.info("Call watcher stopped");
    }

    /**
     * Reads one subscription to its end.
     *
     * @return {@value #REASON_EOF} for a normal end, otherwise the failure's simple class name
     */
    String consumeOnce() {
        try (EventStream stream = reader.open()) {
            current = stream;
            // stop() may have run while open() was blocked and found no stream to close
            if (!running) {
                return REASON_EOF;
            }
            String line;
            while (running && (line = stream.nextLine()) != null) {
                handle(line);
            }
            return REASON_EOF;
        } catch (IOException | EventStreamException e) {
            if (running) {
                LOG.warn("Event stream failed: {}", e.getMessage());
            }
            return e.getClass().getSimpleName();
        } catch (RuntimeException e) {
            LOG.error("Event stream failed unexpectedly", e);
            return e.getClass().getSimpleName();
        } finally {
            current = null;
        }
    }

    private void handle(String line) {
        try {
            pipeline.process(line);
        } catch (RuntimeException e) {
            LOG.error("Failed to process event line", e);
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(props.getRestartDelay().toMillis());
            return true;
        } catch (InterruptedException e) {
            if (!running) {
                Thread.currentThread().interrupt();
                return false;
            }
            // Stray interrupt: resubscribe now. Re-asserting it would make every later sleep fail at once.
            LOG.warn("Call watcher interrupted during restart delay; resubscribing now");
            return true;
        }
    }
}
