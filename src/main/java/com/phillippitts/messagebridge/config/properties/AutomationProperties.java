package com.phillippitts.messagebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for AppleScript-driven automation (call decline, app restart, message send).
 *
 * <p>Script locations are Spring resource strings and are read once at startup.
 */
@Validated
@ConfigurationProperties(prefix = "bridge.automation")
public class AutomationProperties {

    @NotBlank
    private final String osascriptPath;

    /** Upper bound for a single script run; exceeding it kills the script and counts as a failure. */
    @NotNull
    private final Duration timeout;

    private final boolean declineEnabled;

    private final boolean restartEnabled;

    @NotBlank
    private final String declineScript;

    @NotBlank
    private final String restartScript;

    @NotBlank
    private final String sendScript;

    @ConstructorBinding
    public AutomationProperties(String osascriptPath,
                                Duration timeout,
                                Boolean declineEnabled,
                                Boolean restartEnabled,
                                String declineScript,
                                String restartScript,
                                String sendScript) {
        this.osascriptPath = isBlank(osascriptPath) ? "/usr/bin/osascript" : osascriptPath;
        this.timeout = timeout == null ? Duration.ofSeconds(15) : timeout;
        this.declineEnabled = declineEnabled == null ? true : declineEnabled;
        this.restartEnabled = restartEnabled == null ? true : restartEnabled;
        this.declineScript = isBlank(declineScript) ? "classpath:scripts/decline-call.applescript" : declineScript;
        this.restartScript = isBlank(restartScript) ? "classpath:scripts/restart-facetime.applescript" : restartScript;
        this.sendScript = isBlank(sendScript) ? "classpath:scripts/send-message.applescript" : sendScript;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getOsascriptPath() {
        return osascriptPath;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isDeclineEnabled() {
        return declineEnabled;
    }

    public boolean isRestartEnabled() {
        return restartEnabled;
    }

    public String getDeclineScript() {
        return declineScript;
    }

    public String getRestartScript() {
        return restartScript;
    }

    public String getSendScript() {
        return sendScript;
    }
}
