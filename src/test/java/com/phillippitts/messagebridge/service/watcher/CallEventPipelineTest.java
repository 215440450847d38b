package com.phillippitts.messagebridge.service.watcher;

import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import com.phillippitts.messagebridge.domain.CallEvent;
import com.phillippitts.messagebridge.service.metrics.BridgeMetrics;
import com.phillippitts.messagebridge.service.orchestration.CallActionOrchestrator;
import com.phillippitts.messagebridge.service.orchestration.TriggerReport;
import com.phillippitts.messagebridge.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CallEventPipelineTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    private CallActionOrchestrator orchestrator;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private CallEventPipeline pipeline;

    @BeforeEach
    void setUp() {
        orchestrator = mock(CallActionOrchestrator.class);
        when(orchestrator.trigger(any())).thenReturn(new TriggerReport(List.of("decline"), List.of(), List.of()));
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(T0);
        pipeline = newPipeline(WatcherProperties.defaults());
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    private CallEventPipeline newPipeline(WatcherProperties props) {
        return new CallEventPipeline(props, new CallIdentityExtractor(props), orchestrator, clock,
                new BridgeMetrics(registry));
    }

    @Test
    void ignoresLinesWithoutKeyword() {
        assertThat(pipeline.process("FaceTime: call ended id=1")).isEqualTo(PipelineOutcome.IGNORED);
        assertThat(pipeline.process(null)).isEqualTo(PipelineOutcome.IGNORED);
        verifyNoInteractions(orchestrator);
        assertThat(pipeline.deduplicator().size()).isZero();
    }

    @Test
    void keywordMatchIsCaseInsensitive() {
        assertThat(pipeline.process("FaceTime: INCOMING call id=5")).isEqualTo(PipelineOutcome.TRIGGERED);
    }

    @Test
    void passesExtractedIdAndClockTimeToOrchestrator() {
        pipeline.process("FaceTime: Incoming call call-id: 1234-abcd");

        ArgumentCaptor<CallEvent> captor = ArgumentCaptor.forClass(CallEvent.class);
        verify(orchestrator).trigger(captor.capture());
        assertThat(captor.getValue().callId()).isEqualTo("1234-abcd");
        assertThat(captor.getValue().observedAt()).isEqualTo(T0);
        assertThat(captor.getValue().rawText()).isEqualTo("FaceTime: Incoming call call-id: 1234-abcd");
    }

    @Test
    void repeatsWithinCooldownTriggerOnce() {
        String line = "FaceTime: Incoming call call-id: 1234-abcd";
        int triggered = 0;
        for (int i = 0; i < 5; i++) {
            if (pipeline.process(line) == PipelineOutcome.TRIGGERED) {
                triggered++;
            }
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(triggered).isEqualTo(1);
        verify(orchestrator, times(1)).trigger(any());
        assertThat(registry.get("messagebridge.calls.triggered").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("messagebridge.calls.suppressed").counter().count()).isEqualTo(4.0);
    }

    @Test
    void triggersAgainOnceCooldownHasElapsed() {
        String line = "incoming call-id: A";
        pipeline.process(line);
        clock.advance(Duration.ofSeconds(10));

        assertThat(pipeline.process(line)).isEqualTo(PipelineOutcome.TRIGGERED);
        verify(orchestrator, times(2)).trigger(any());
    }

    @Test
    void differentCallsTriggerIndependently() {
        assertThat(pipeline.process("incoming call-id: A")).isEqualTo(PipelineOutcome.TRIGGERED);
        assertThat(pipeline.process("incoming call-id: B")).isEqualTo(PipelineOutcome.TRIGGERED);
        assertThat(pipeline.process("incoming call-id: A")).isEqualTo(PipelineOutcome.SUPPRESSED);
    }

    @Test
    void callIdIsInLogContextOnlyWhileActionsRun() {
        AtomicReference<String> seen = new AtomicReference<>();
        when(orchestrator.trigger(any())).thenAnswer(inv -> {
            seen.set(ThreadContext.get("callId"));
            return new TriggerReport(List.of(), List.of(), List.of());
        });

        pipeline.process("incoming call-id: ctx-1");

        assertThat(seen.get()).isEqualTo("ctx-1");
        assertThat(ThreadContext.get("callId")).isNull();
    }

    @Test
    void callIdRemovedFromLogContextWhenOrchestratorThrows() {
        when(orchestrator.trigger(any())).thenThrow(new IllegalStateException("boom"));

        try {
            pipeline.process("incoming call-id: ctx-2");
        } catch (IllegalStateException expected) {
            // propagates to the watcher, which logs it
        }

        assertThat(ThreadContext.get("callId")).isNull();
    }

    @Test
    void honorsConfiguredKeyword() {
        WatcherProperties props = new WatcherProperties(null, null, "Ringing", null, null, null, null);
        CallEventPipeline custom = newPipeline(props);

        assertThat(custom.process("incoming call id=1")).isEqualTo(PipelineOutcome.IGNORED);
        assertThat(custom.process("call id=1 is RINGING")).isEqualTo(PipelineOutcome.TRIGGERED);
    }
}
