package com.phillippitts.messagebridge.service.watcher;

import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import com.phillippitts.messagebridge.domain.CallEvent;
import com.phillippitts.messagebridge.service.metrics.BridgeMetrics;
import com.phillippitts.messagebridge.service.orchestration.CallActionOrchestrator;
import com.phillippitts.messagebridge.service.orchestration.TriggerReport;
import com.phillippitts.messagebridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;

/**
 * Keyword filter, identity extraction, cooldown and action dispatch for one log line.
 *
 * <p>Runs as a single sequential chain on the caller's thread. Only {@link CallWatcher} calls
 * {@link #process}, which keeps the cooldown table single-writer.
 */
@Component
public class CallEventPipeline {

    private static final Logger LOG = LogManager.getLogger(CallEventPipeline.class);

    static final String MDC_CALL_ID = "callId";

    private final String keyword;
    private final CallIdentityExtractor extractor;
    private final CooldownDeduplicator deduplicator;
    private final CallActionOrchestrator orchestrator;
    private final Clock clock;
    private final BridgeMetrics metrics;

    public CallEventPipeline(WatcherProperties props,
                             CallIdentityExtractor extractor,
                             CallActionOrchestrator orchestrator,
                             Clock clock,
                             BridgeMetrics metrics) {
        this.keyword = props.getTriggerKeyword().toLowerCase(Locale.ROOT);
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.deduplicator = new CooldownDeduplicator(props.getCooldown());
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Pushes one line through the pipeline.
     *
     * @param line raw log line (null is treated as non-qualifying)
     * @return what happened to the line
     */
    public PipelineOutcome process(String line) {
        if (line == null || !qualifies(line)) {
            return PipelineOutcome.IGNORED;
        }
        String callId = extractor.extract(line);
        CallEvent event = new CallEvent(line, callId, clock.instant());

        if (!deduplicator.shouldTrigger(callId, event.observedAt())) {
            metrics.incrementSuppressed();
            LOG.debug("Suppressed repeat within cooldown: callId={}", callId);
            return PipelineOutcome.SUPPRESSED;
        }

        metrics.incrementTriggered();
        LOG.info("Incoming call detected: callId={}", callId);
        LOG.debug("Trigger line: '{}'", LogSanitizer.preview(line));
        ThreadContext.put(MDC_CALL_ID, callId);
        try {
            TriggerReport report = orchestrator.trigger(event);
            LOG.info("Call actions finished: succeeded={}, failed={}, skipped={}",
                    report.succeeded(), report.failed(), report.skipped());
        } finally {
            ThreadContext.remove(MDC_CALL_ID);
        }
        return PipelineOutcome.TRIGGERED;
    }

    boolean qualifies(String line) {
        return line.toLowerCase(Locale.ROOT).contains(keyword);
    }

    /** Visible for tests */
    CooldownDeduplicator deduplicator() {
        return deduplicator;
    }
}
