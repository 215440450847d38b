package com.phillippitts.messagebridge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class BridgeConfig {

    /**
     * Time source for call observation timestamps; tests substitute a fixed or mutable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
