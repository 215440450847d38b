package com.phillippitts.messagebridge.service.watcher;

import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import com.phillippitts.messagebridge.exception.EventStreamException;
import com.phillippitts.messagebridge.testutil.FakeProcess;
import com.phillippitts.messagebridge.testutil.StubProcessFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Hermetic tests for LogStreamReader using a fake process instead of {@code log stream}.
 */
class LogStreamReaderTest {

    @Test
    void readsLinesUntilEndOfStream() throws IOException {
        FakeProcess process = FakeProcess.finished("first line\nincoming call-id: 1\n", "", 0);
        LogStreamReader reader = new LogStreamReader(StubProcessFactory.returning(process),
                WatcherProperties.defaults());

        try (EventStream stream = reader.open()) {
            assertThat(stream.nextLine()).isEqualTo("first line");
            assertThat(stream.nextLine()).isEqualTo("incoming call-id: 1");
            assertThat(stream.nextLine()).isNull();
        }
    }

    @Test
    void runsConfiguredCommand() {
        StubProcessFactory factory = StubProcessFactory.returning(FakeProcess.finished("", "", 0));
        WatcherProperties props = new WatcherProperties(null, List.of("tail", "-f", "/tmp/calls.log"),
                null, null, null, null, null);

        new LogStreamReader(factory, props).open().close();

        assertThat(factory.commands()).containsExactly(List.of("tail", "-f", "/tmp/calls.log"));
    }

    @Test
    void defaultCommandStreamsFaceTimeLog() {
        StubProcessFactory factory = StubProcessFactory.returning(FakeProcess.finished("", "", 0));

        new LogStreamReader(factory, WatcherProperties.defaults()).open().close();

        assertThat(factory.commands().get(0)).containsExactly(
                "/usr/bin/log", "stream", "--predicate", "eventMessage contains \"FaceTime\"", "--info");
    }

    @Test
    void replacesUndecodableBytes() throws IOException {
        byte[] out = new byte[] {'i', 'n', (byte) 0xFF, 'c', '\n'};
        FakeProcess process = new FakeProcess(out, new byte[0], 0, 0);
        LogStreamReader reader = new LogStreamReader(StubProcessFactory.returning(process),
                WatcherProperties.defaults());

        try (EventStream stream = reader.open()) {
            assertThat(stream.nextLine()).isEqualTo("in\uFFFDc");
        }
    }

    @Test
    void wrapsStartFailure() {
        LogStreamReader reader = new LogStreamReader(StubProcessFactory.failing(new IOException("ENOENT")),
                WatcherProperties.defaults());

        assertThatThrownBy(reader::open)
                .isInstanceOf(EventStreamException.class)
                .hasMessageContaining("/usr/bin/log")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void closeDestroysRunningProcessOnce() {
        FakeProcess process = new FakeProcess("incoming\n".getBytes(StandardCharsets.UTF_8), new byte[0], 0, -1);
        LogStreamReader reader = new LogStreamReader(StubProcessFactory.returning(process),
                WatcherProperties.defaults());

        EventStream stream = reader.open();
        stream.close();
        stream.close();

        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(process.isAlive()).isFalse();
    }
}
