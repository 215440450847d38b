package com.phillippitts.messagebridge.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing AutomationException with rich contextual information.
 *
 * <p>Every script-backed action (decline, restart, send) reports failures through this builder
 * so log lines share one shape.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw AutomationExceptionBuilder.create("Non-zero exit")
 *         .action("decline")
 *         .exitCode(1)
 *         .durationMs(420)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class AutomationExceptionBuilder {

    private final String message;
    private String actionName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private AutomationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static AutomationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new AutomationExceptionBuilder(message);
    }

    public AutomationExceptionBuilder action(String actionName) {
        this.actionName = actionName;
        return this;
    }

    public AutomationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public AutomationExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public AutomationExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public AutomationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the AutomationException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (action: {action})
     * </pre>
     *
     * @return constructed AutomationException
     */
    public AutomationException build() {
        String detailedMessage = buildDetailedMessage();
        String action = actionName != null ? actionName : "unknown";

        if (cause != null) {
            return new AutomationException(detailedMessage, action, cause);
        }
        return new AutomationException(detailedMessage, action);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
