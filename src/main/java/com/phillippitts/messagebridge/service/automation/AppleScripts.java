package com.phillippitts.messagebridge.service.automation;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads AppleScript source from Spring resource locations. */
public final class AppleScripts {

    private AppleScripts() {}

    /**
     * Reads a script resource fully as UTF-8.
     *
     * @param loader resource loader (the application context in production)
     * @param location e.g. {@code classpath:scripts/decline-call.applescript}
     * @throws IllegalStateException if the resource does not exist
     * @throws UncheckedIOException if it cannot be read
     */
    public static String load(ResourceLoader loader, String location) {
        Resource resource = loader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("AppleScript resource not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read AppleScript resource " + location, e);
        }
    }
}
