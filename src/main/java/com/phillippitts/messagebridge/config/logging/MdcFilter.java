package com.phillippitts.messagebridge.config.logging;

import com.phillippitts.messagebridge.util.LogSanitizer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tags every HTTP request's log lines so API submissions can be told apart from watcher activity.
 *
 * <p>Keys set on Log4j2's ThreadContext:</p>
 * <ul>
 *   <li>requestId: the caller's X-Request-ID (control characters dropped, capped at
 *       {@value #MAX_REQUEST_ID_CHARS} chars) or a generated UUID; echoed back on the response</li>
 *   <li>source: always {@value #SOURCE}, matching the queue source of HTTP submissions</li>
 *   <li>method and uri of the request</li>
 * </ul>
 *
 * <p>Only these keys are removed afterwards; a callId set by the watcher thread is never touched.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String SOURCE = "api";
    static final int MAX_REQUEST_ID_CHARS = 64;

    private static final List<String> KEYS = List.of("requestId", "source", "method", "uri");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = requestIdOf(http);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
                Map<String, String> tags = new LinkedHashMap<>();
                tags.put("requestId", requestId);
                tags.put("source", SOURCE);
                tags.put("method", http.getMethod());
                tags.put("uri", http.getRequestURI());
                ThreadContext.putAll(tags);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.removeAll(KEYS);
        }
    }

    private static String requestIdOf(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        if (v == null) {
            return UUID.randomUUID().toString();
        }
        String clean = LogSanitizer.truncate(v.replaceAll("\\p{Cntrl}", "").strip(), MAX_REQUEST_ID_CHARS);
        return clean.isEmpty() ? UUID.randomUUID().toString() : clean;
    }
}
