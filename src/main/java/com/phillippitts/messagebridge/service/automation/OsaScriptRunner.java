package com.phillippitts.messagebridge.service.automation;

import com.phillippitts.messagebridge.config.properties.AutomationProperties;
import com.phillippitts.messagebridge.exception.AutomationException;
import com.phillippitts.messagebridge.exception.AutomationExceptionBuilder;
import com.phillippitts.messagebridge.service.process.ProcessFactory;
import com.phillippitts.messagebridge.service.process.StreamGobbler;
import com.phillippitts.messagebridge.util.LogSanitizer;
import com.phillippitts.messagebridge.util.ProcessTimeouts;
import com.phillippitts.messagebridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs AppleScript source through {@code osascript} with a hard timeout.
 *
 * <p>Responsibilities:
 * - Build {@code osascript -e <script> [args...]}; arguments reach the script as {@code argv},
 *   never by string interpolation
 * - Capture stdout and stderr concurrently with capped gobblers
 * - Kill the script when it exceeds {@code bridge.automation.timeout}
 * - Report every failure as an {@link AutomationException} with exit code, duration and stderr
 *
 * <p>Stateless apart from configuration; concurrent calls run independent processes.
 */
@Component
public class OsaScriptRunner {

    private static final Logger LOG = LogManager.getLogger(OsaScriptRunner.class);

    static final int STDOUT_MAX_CHARS = 64 * 1024;
    static final int STDERR_MAX_CHARS = 16 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 512;

    private final ProcessFactory processFactory;
    private final String osascriptPath;
    private final Duration timeout;

    public OsaScriptRunner(AutomationProperties props, ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.osascriptPath = props.getOsascriptPath();
        this.timeout = props.getTimeout();
    }

    /**
     * Executes a script and returns its stdout.
     *
     * @param action short action name used in logs and errors (decline, restart, send)
     * @param script AppleScript source
     * @param args values passed to the script's {@code on run argv} handler
     * @return trimmed stdout (may be empty)
     * @throws AutomationException on timeout, non-zero exit, interruption or I/O error
     */
    public String run(String action, String script, List<String> args) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(script, "script");

        List<String> command = new ArrayList<>();
        command.add(osascriptPath);
        command.add("-e");
        command.add(script);
        command.addAll(args);

        long startTime = System.nanoTime();
        Process process = null;
        try {
            process = processFactory.start(command);
            StreamGobbler.Started out = StreamGobbler.start(process.getInputStream(),
                    "osascript-" + action + "-out", STDOUT_MAX_CHARS);
            StreamGobbler.Started err = StreamGobbler.start(process.getErrorStream(),
                    "osascript-" + action + "-err", STDERR_MAX_CHARS);

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyQuietly(process);
                throw failure("Timeout after " + timeout.toMillis() + "ms", action, -1, startTime,
                        err.contents(), null);
            }

            out.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            err.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure("Non-zero exit: " + exitCode, action, exitCode, startTime, err.contents(), null);
            }
            String output = out.contents().strip();
            LOG.debug("osascript action={} finished in {}ms (stdout={} chars)",
                    action, TimeUtils.elapsedMillis(startTime), output.length());
            return output;
        } catch (IOException e) {
            throw failure("I/O failure: " + e.getMessage(), action, -1, startTime, null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyQuietly(process);
            throw failure("Interrupted", action, -1, startTime, null, e);
        }
    }

    private void destroyQuietly(Process process) {
        try {
            if (!ProcessTimeouts.destroy(process)) {
                LOG.warn("osascript process still alive after destroyForcibly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying osascript process");
        }
    }

    private AutomationException failure(String msg, String action, int exitCode, long startTime,
                                        String stderr, Throwable cause) {
        AutomationExceptionBuilder builder = AutomationExceptionBuilder.create(msg)
                .action(action)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startTime));
        if (stderr != null && !stderr.isEmpty()) {
            builder.metadata("stderr", LogSanitizer.truncate(stderr.strip(), ERROR_SNIPPET_MAX_CHARS));
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
