package com.phillippitts.messagebridge.service.watcher;

import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import com.phillippitts.messagebridge.exception.EventStreamException;
import com.phillippitts.messagebridge.service.metrics.BridgeMetrics;
import com.phillippitts.messagebridge.service.watcher.event.EventStreamEndedEvent;
import com.phillippitts.messagebridge.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CallWatcherTest {

    private CallEventPipeline pipeline;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private CallWatcher watcher;

    @BeforeEach
    void setUp() {
        pipeline = mock(CallEventPipeline.class);
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.stop();
        }
    }

    private CallWatcher newWatcher(EventStreamReader reader, boolean enabled, boolean restartOnEnd) {
        return newWatcher(reader, enabled, restartOnEnd, Duration.ofMillis(10));
    }

    private CallWatcher newWatcher(EventStreamReader reader, boolean enabled, boolean restartOnEnd,
                                   Duration restartDelay) {
        WatcherProperties props = new WatcherProperties(enabled, null, null, null, null,
                restartOnEnd, restartDelay);
        watcher = new CallWatcher(reader, pipeline, props, publisher, new BridgeMetrics(registry));
        return watcher;
    }

    @Test
    void feedsEveryLineToPipelineInOrder() {
        ScriptedReader reader = new ScriptedReader(List.of("first", "incoming a", "last"));
        newWatcher(reader, true, true).start();

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(pipeline).process("last"));
        InOrder inOrder = inOrder(pipeline);
        inOrder.verify(pipeline).process("first");
        inOrder.verify(pipeline).process("incoming a");
        inOrder.verify(pipeline).process("last");
    }

    @Test
    void resubscribesAfterEndOfStream() {
        ScriptedReader reader = new ScriptedReader(List.of("incoming a"), List.of("incoming b"));
        newWatcher(reader, true, true).start();

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(pipeline).process("incoming b"));
        await().atMost(Duration.ofSeconds(2)).until(() -> reader.opens.get() >= 3);

        List<EventStreamEndedEvent> ended = publisher.eventsOfType(EventStreamEndedEvent.class);
        assertThat(ended).hasSizeGreaterThanOrEqualTo(2);
        assertThat(ended).allSatisfy(e -> {
            assertThat(e.reason()).isEqualTo(CallWatcher.REASON_EOF);
            assertThat(e.willRestart()).isTrue();
        });
        assertThat(registry.get("messagebridge.watcher.restarts").counter().count()).isGreaterThanOrEqualTo(2.0);
        assertThat(watcher.isAlive()).isTrue();
    }

    @Test
    void stopsForGoodWhenRestartDisabled() {
        ScriptedReader reader = new ScriptedReader(List.of("incoming a"));
        newWatcher(reader, true, false).start();

        await().atMost(Duration.ofSeconds(2)).until(() -> !watcher.isRunning() && !watcher.isAlive());

        assertThat(reader.opens.get()).isEqualTo(1);
        verify(pipeline).process("incoming a");
        List<EventStreamEndedEvent> ended = publisher.eventsOfType(EventStreamEndedEvent.class);
        assertThat(ended).hasSize(1);
        assertThat(ended.get(0).willRestart()).isFalse();
    }

    @Test
    void treatsOpenFailureAsStreamEnd() {
        ScriptedReader reader = new ScriptedReader(
                new EventStreamException("log not found", new IOException("ENOENT")),
                List.of("incoming after failure"));
        newWatcher(reader, true, true).start();

        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> verify(pipeline).process("incoming after failure"));
        assertThat(publisher.eventsOfType(EventStreamEndedEvent.class).get(0).reason())
                .isEqualTo("EventStreamException");
    }

    @Test
    void unexpectedOpenFailureIsTreatedAsStreamEnd() {
        ScriptedReader reader = new ScriptedReader(
                new IllegalStateException("reader bug"),
                List.of("incoming after bug"));
        newWatcher(reader, true, true).start();

        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> verify(pipeline).process("incoming after bug"));
        assertThat(publisher.eventsOfType(EventStreamEndedEvent.class).get(0).reason())
                .isEqualTo("IllegalStateException");
        assertThat(watcher.isAlive()).isTrue();
    }

    @Test
    void stopCutsRestartDelayShort() {
        ScriptedReader reader = new ScriptedReader(List.of("incoming a"));
        newWatcher(reader, true, true, Duration.ofSeconds(10)).start();
        await().atMost(Duration.ofSeconds(2))
                .until(() -> !publisher.eventsOfType(EventStreamEndedEvent.class).isEmpty());

        long started = System.nanoTime();
        watcher.stop();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
        assertThat(watcher.isAlive()).isFalse();
        assertThat(reader.opens.get()).isEqualTo(1);
    }

    @Test
    void strayInterruptDuringRestartDelayResubscribesImmediately() {
        ScriptedReader reader = new ScriptedReader(List.of("incoming a"), List.of("incoming b"));
        newWatcher(reader, true, true, Duration.ofSeconds(10)).start();
        await().atMost(Duration.ofSeconds(2))
                .until(() -> !publisher.eventsOfType(EventStreamEndedEvent.class).isEmpty());

        Thread.getAllStackTraces().keySet().stream()
                .filter(t -> "call-watcher".equals(t.getName()) && t.isAlive())
                .forEach(Thread::interrupt);

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(pipeline).process("incoming b"));
        assertThat(watcher.isRunning()).isTrue();
    }

    @Test
    void streamOpenedAfterStopIsClosedWithoutReading() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        RecordingStream stream = new RecordingStream();
        AtomicInteger opens = new AtomicInteger();
        EventStreamReader slowReader = () -> {
            opens.incrementAndGet();
            awaitUninterruptibly(gate);
            return stream;
        };
        newWatcher(slowReader, true, true).start();
        await().atMost(Duration.ofSeconds(2)).until(() -> opens.get() == 1);

        Thread stopper = new Thread(watcher::stop, "stopper");
        stopper.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> !watcher.isRunning());
        gate.countDown();
        stopper.join(Duration.ofSeconds(5).toMillis());

        assertThat(stream.closed).isTrue();
        assertThat(stream.reads.get()).isZero();
        assertThat(opens.get()).isEqualTo(1);
        await().atMost(Duration.ofSeconds(2)).until(() -> !watcher.isAlive());
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void lineFailureDoesNotStopWatcher() {
        doThrow(new IllegalStateException("boom")).when(pipeline).process("bad");
        ScriptedReader reader = new ScriptedReader(List.of("bad", "incoming ok"));
        newWatcher(reader, true, true).start();

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(pipeline).process("incoming ok"));
        assertThat(reader.opens.get()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void disabledWatcherDoesNotStart() {
        ScriptedReader reader = new ScriptedReader(List.of("incoming a"));
        newWatcher(reader, false, true).start();

        assertThat(watcher.isRunning()).isFalse();
        assertThat(watcher.isAlive()).isFalse();
        assertThat(reader.opens.get()).isZero();
    }

    @Test
    void stopClosesBlockedStream() {
        ScriptedReader reader = new ScriptedReader();
        newWatcher(reader, true, true).start();
        await().atMost(Duration.ofSeconds(2)).until(() -> reader.opens.get() == 1);

        watcher.stop();

        assertThat(watcher.isRunning()).isFalse();
        assertThat(watcher.isAlive()).isFalse();
        assertThat(reader.idle).allSatisfy(s -> assertThat(s.closed.getCount()).isZero());
    }

    /**
     * Replays scripted subscriptions in order. Each script is a list of lines or an exception to
     * throw from open(). Once exhausted, every open() returns a stream that blocks until closed.
     */
    static final class ScriptedReader implements EventStreamReader {
        private final Deque<Object> scripts = new ConcurrentLinkedDeque<>();
        final AtomicInteger opens = new AtomicInteger();
        final List<BlockingStream> idle = new CopyOnWriteArrayList<>();

        ScriptedReader(Object... scripts) {
            this.scripts.addAll(List.of(scripts));
        }

        @Override
        @SuppressWarnings("unchecked")
        public EventStream open() {
            opens.incrementAndGet();
            Object next = scripts.poll();
            if (next == null) {
                BlockingStream s = new BlockingStream();
                idle.add(s);
                return s;
            }
            if (next instanceof RuntimeException e) {
                throw e;
            }
            return new ListStream((List<String>) next);
        }
    }

    static final class ListStream implements EventStream {
        private final Deque<String> lines;

        ListStream(List<String> lines) {
            this.lines = new ArrayDeque<>(lines);
        }

        @Override
        public String nextLine() {
            return lines.poll();
        }

        @Override
        public void close() {
        }
    }

    static final class RecordingStream implements EventStream {
        final AtomicInteger reads = new AtomicInteger();
        volatile boolean closed;

        @Override
        public String nextLine() {
            reads.incrementAndGet();
            return null;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    static final class BlockingStream implements EventStream {
        final CountDownLatch closed = new CountDownLatch(1);

        @Override
        public String nextLine() {
            try {
                closed.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }

        @Override
        public void close() {
            closed.countDown();
        }
    }
}
