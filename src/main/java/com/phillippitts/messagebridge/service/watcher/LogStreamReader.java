package com.phillippitts.messagebridge.service.watcher;

import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import com.phillippitts.messagebridge.exception.EventStreamException;
import com.phillippitts.messagebridge.service.process.ProcessFactory;
import com.phillippitts.messagebridge.service.process.StreamGobbler;
import com.phillippitts.messagebridge.util.LogSanitizer;
import com.phillippitts.messagebridge.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads the macOS unified log by running {@code log stream} and consuming its stdout line by line.
 *
 * <p>Each {@link #open()} spawns a new process. Undecodable bytes are replaced rather than
 * failing the stream. stderr is drained in the background and reported when the stream ends.
 */
@Component
public class LogStreamReader implements EventStreamReader {

    private static final Logger LOG = LogManager.getLogger(LogStreamReader.class);

    private static final int STDERR_MAX_CHARS = 8 * 1024;

    private final ProcessFactory processFactory;
    private final List<String> command;

    public LogStreamReader(ProcessFactory processFactory, WatcherProperties props) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.command = props.getCommand();
    }

    @Override
    public EventStream open() {
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException e) {
            throw new EventStreamException("Failed to start event source: " + command.get(0), e);
        }
        LOG.info("Event source started: {}", String.join(" ", command));
        StreamGobbler.Started stderr = StreamGobbler.start(process.getErrorStream(), "log-stream-err",
                STDERR_MAX_CHARS);
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        return new ProcessEventStream(process, reader, stderr);
    }

    private static final class ProcessEventStream implements EventStream {
        private final Process process;
        private final BufferedReader reader;
        private final StreamGobbler.Started stderr;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        ProcessEventStream(Process process, BufferedReader reader, StreamGobbler.Started stderr) {
            this.process = process;
            this.reader = reader;
            this.stderr = stderr;
        }

        @Override
        public String nextLine() throws IOException {
            String line = reader.readLine();
            if (line == null && !closed.get()) {
                stderr.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
                LOG.warn("Event source closed its output (alive={}, stderr='{}')",
                        process.isAlive(), LogSanitizer.preview(stderr.contents()));
            }
            return line;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                if (!ProcessTimeouts.destroy(process)) {
                    LOG.warn("Event source process still alive after destroyForcibly");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while stopping event source");
            }
            try {
                reader.close();
            } catch (IOException e) {
                LOG.debug("Error closing event source reader: {}", e.toString());
            }
        }
    }
}
