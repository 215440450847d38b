package com.phillippitts.messagebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Bearer key required on the submission endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "bridge.api")
public class ApiProperties {

    @NotBlank
    private final String key;

    @ConstructorBinding
    public ApiProperties(String key) {
        this.key = (key == null || key.isBlank()) ? "changeme" : key;
    }

    public String getKey() {
        return key;
    }
}
