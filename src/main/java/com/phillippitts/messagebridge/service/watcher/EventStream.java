package com.phillippitts.messagebridge.service.watcher;

import java.io.IOException;

/**
 * One subscription to a live line-oriented event source.
 *
 * <p>Not restartable: once {@link #nextLine()} returns {@code null} the caller must
 * {@link EventStreamReader#open() open} a new stream.
 */
public interface EventStream extends AutoCloseable {

    /**
     * Blocks until the next line is available.
     *
     * @return the line without its terminator, or {@code null} at end-of-stream
     * @throws IOException if reading fails
     */
    String nextLine() throws IOException;

    /** Releases the source. Idempotent; unblocks a pending {@link #nextLine()}. */
    @Override
    void close();
}
