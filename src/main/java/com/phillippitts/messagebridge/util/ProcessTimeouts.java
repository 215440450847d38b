package com.phillippitts.messagebridge.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Standard timeout values for subprocess and worker-thread management.
 *
 * <p>Used by {@link com.phillippitts.messagebridge.service.automation.OsaScriptRunner},
 * {@link com.phillippitts.messagebridge.service.watcher.LogStreamReader} and the long-running
 * worker threads when they are stopped with the application context.
 *
 * <p>The automation timeout itself is configurable ({@code bridge.automation.timeout}); the values
 * here only bound cleanup.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     *
     * <p>{@code log stream} and {@code osascript} both exit within a few hundred ms on SIGTERM.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the delivery worker and watcher threads to terminate when the context stops.
     *
     * <p>A send in progress is not cut short; the thread is a daemon and dies with the JVM if it
     * outlives this.
     */
    public static final Duration WORKER_STOP_TIMEOUT = Duration.ofMillis(2000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }

    /**
     * Destroys a process, first gracefully then forcibly, waiting at most the bounded timeouts.
     *
     * @param process process to terminate (ignored when null or already exited)
     * @return true if the process is no longer alive
     */
    public static boolean destroy(Process process) throws InterruptedException {
        if (process == null || !process.isAlive()) {
            return true;
        }
        process.destroy();
        if (process.waitFor(GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            return true;
        }
        process.destroyForcibly();
        process.waitFor(FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        return !process.isAlive();
    }
}
