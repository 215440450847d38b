package com.phillippitts.messagebridge.service.watcher;

import com.phillippitts.messagebridge.config.properties.WatcherProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Derives a stable call identifier from a qualifying log line.
 *
 * <p>Patterns are tried in configured order and the first one that finds a non-blank group 1
 * wins. The order decides which notifications count as the same call, so specific identifier
 * kinds (UUID, call id, session id) come before the generic {@code id:} rule.
 *
 * <p>When nothing matches, the identifier is {@value #FALLBACK_PREFIX} followed by the first
 * 128 bits of the SHA-256 of the line's UTF-8 bytes: identical lines share it, different lines
 * do not.
 */
@Component
public class CallIdentityExtractor {

    static final String FALLBACK_PREFIX = "line-";

    private static final int FALLBACK_DIGEST_BYTES = 16;

    private final List<Pattern> patterns;

    @Autowired
    public CallIdentityExtractor(WatcherProperties props) {
        this(props.getIdPatterns());
    }

    /**
     * @param regexes ordered patterns, each with at least one capture group
     * @throws IllegalArgumentException if a pattern does not compile or has no capture group
     */
    CallIdentityExtractor(List<String> regexes) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : regexes) {
            Pattern p;
            try {
                p = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid identity pattern: " + regex, e);
            }
            if (p.matcher("").groupCount() < 1) {
                throw new IllegalArgumentException("Identity pattern must declare a capture group: " + regex);
            }
            compiled.add(p);
        }
        this.patterns = List.copyOf(compiled);
    }

    /**
     * @param line qualifying log line
     * @return the first pattern capture, or a hash-derived fallback
     */
    public String extract(String line) {
        Objects.requireNonNull(line, "line");
        for (Pattern p : patterns) {
            Matcher m = p.matcher(line);
            if (m.find()) {
                String id = m.group(1);
                if (id != null && !id.isBlank()) {
                    return id;
                }
            }
        }
        return fallbackId(line);
    }

    static String fallbackId(String line) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(line.getBytes(StandardCharsets.UTF_8));
            return FALLBACK_PREFIX + HexFormat.of().formatHex(digest, 0, FALLBACK_DIGEST_BYTES);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
