package com.phillippitts.messagebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Fixed automated reply sent when an incoming call triggers.
 */
@Validated
@ConfigurationProperties(prefix = "bridge.reply")
public class AutoReplyProperties {

    public static final String DEFAULT_TEMPLATE = "Corn On The Corner, This is our storefront location: "
            + "1041 Howard St, Dearborn, MI 48124. Please text your order "
            + "including a name and confirm the given pick up time. Thank you.";

    private final boolean enabled;

    @NotBlank
    private final String recipient;

    @NotBlank
    @Size(max = 10_000)
    private final String template;

    @ConstructorBinding
    public AutoReplyProperties(Boolean enabled, String recipient, String template) {
        this.enabled = enabled == null ? true : enabled;
        this.recipient = (recipient == null || recipient.isBlank()) ? "7345893340" : recipient.strip();
        this.template = (template == null || template.isBlank()) ? DEFAULT_TEMPLATE : template;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getRecipient() {
        return recipient;
    }

    public String getTemplate() {
        return template;
    }
}
