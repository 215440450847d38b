package com.phillippitts.messagebridge.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a process stream into a bounded buffer on its own daemon thread.
 *
 * <p>Reads lines until end-of-stream. Once the cap is hit it keeps reading without accumulating
 * so the child process never blocks on a full pipe.
 */
public final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final StringBuilder sink = new StringBuilder();
    private final String name;
    private final int maxChars;

    private StreamGobbler(InputStream inputStream, String name, int maxChars) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxChars = maxChars;
    }

    /**
     * Starts a daemon thread draining {@code inputStream}.
     *
     * @param inputStream stream to drain
     * @param name thread name, also used in log lines
     * @param maxChars cap on retained characters
     * @return the running gobbler; join {@link #thread()} before reading {@link #contents()}
     */
    public static Started start(InputStream inputStream, String name, int maxChars) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, name, maxChars);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return new Started(gobbler, thread);
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                synchronized (sink) {
                    if (sink.length() >= maxChars) {
                        if (!capReached) {
                            LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                            capReached = true;
                        }
                        continue;
                    }
                    if (sink.length() > 0) {
                        sink.append('\n');
                    }
                    int available = maxChars - sink.length();
                    sink.append(line, 0, Math.min(line.length(), Math.max(available, 0)));
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    String snapshot() {
        synchronized (sink) {
            return sink.toString();
        }
    }

    /**
     * Handle to a gobbler and its thread.
     */
    public record Started(StreamGobbler gobbler, Thread thread) {

        public String contents() {
            return gobbler.snapshot();
        }

        /** Waits up to {@code millis} for the stream to drain; restores the interrupt flag if interrupted. */
        public void join(long millis) {
            try {
                thread.join(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
