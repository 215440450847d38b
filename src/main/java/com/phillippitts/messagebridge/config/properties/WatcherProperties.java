package com.phillippitts.messagebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Typed properties for the incoming-call watcher.
 *
 * <p>Identity patterns are tried in list order and the first match wins, so more specific
 * identifier kinds must come before the generic {@code id:} rule. Each pattern must declare
 * capture group 1 for the identifier.
 */
@Validated
@ConfigurationProperties(prefix = "bridge.watcher")
public class WatcherProperties {

    /** {@code log stream} filtered to FaceTime messages at info level. */
    public static final List<String> DEFAULT_COMMAND = List.of(
            "/usr/bin/log", "stream", "--predicate", "eventMessage contains \"FaceTime\"", "--info");

    public static final List<String> DEFAULT_ID_PATTERNS = List.of(
            // labelled UUID
            "(?i)\\buuid\\s*[:=]\\s*([0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12})",
            // call-id, call_id, callId, call uuid
            "(?i)\\bcall[-_ ]?(?:id|uuid)\\s*[:=]\\s*([A-Za-z0-9][A-Za-z0-9._-]*)",
            // session-id, sessionId
            "(?i)\\bsession[-_ ]?id\\s*[:=]\\s*([A-Za-z0-9][A-Za-z0-9._-]*)",
            // bare UUID anywhere
            "(?i)\\b([0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12})\\b",
            // generic id
            "(?i)\\bid\\s*[:=]\\s*([A-Za-z0-9][A-Za-z0-9._-]*)");

    /** Start the watcher with the application context. Disabled in tests and on non-macOS hosts. */
    private final boolean enabled;

    @NotEmpty
    private final List<String> command;

    /** Case-insensitive keyword a line must contain to qualify. */
    @NotBlank
    private final String triggerKeyword;

    /** Minimum spacing between triggers for the same call identifier. */
    @NotNull
    private final Duration cooldown;

    @NotEmpty
    private final List<String> idPatterns;

    /** Resubscribe to the event source when it ends; false lets the watcher stop for good. */
    private final boolean restartOnEnd;

    @NotNull
    private final Duration restartDelay;

    @ConstructorBinding
    public WatcherProperties(Boolean enabled,
                             List<String> command,
                             String triggerKeyword,
                             Duration cooldown,
                             List<String> idPatterns,
                             Boolean restartOnEnd,
                             Duration restartDelay) {
        this.enabled = enabled == null ? true : enabled;
        this.command = (command == null || command.isEmpty()) ? DEFAULT_COMMAND : List.copyOf(command);
        this.triggerKeyword = (triggerKeyword == null || triggerKeyword.isBlank()) ? "incoming" : triggerKeyword;
        this.cooldown = cooldown == null ? Duration.ofSeconds(10) : cooldown;
        this.idPatterns = (idPatterns == null || idPatterns.isEmpty()) ? DEFAULT_ID_PATTERNS : List.copyOf(idPatterns);
        this.restartOnEnd = restartOnEnd == null ? true : restartOnEnd;
        this.restartDelay = restartDelay == null ? Duration.ofSeconds(5) : restartDelay;
    }

    /**
     * All defaults.
     */
    public static WatcherProperties defaults() {
        return new WatcherProperties(null, null, null, null, null, null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> getCommand() {
        return command;
    }

    public String getTriggerKeyword() {
        return triggerKeyword;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public List<String> getIdPatterns() {
        return idPatterns;
    }

    public boolean isRestartOnEnd() {
        return restartOnEnd;
    }

    public Duration getRestartDelay() {
        return restartDelay;
    }
}
