package com.phillippitts.messagebridge.presentation.auth;

import com.phillippitts.messagebridge.config.properties.ApiProperties;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Bearer-token check for the submission endpoint.
 *
 * <p>Missing or malformed {@code Authorization} header → 401; wrong key → 403.
 *
 * <p>Checks every request it receives. Which requests those are is decided by the container's
 * URL mapping in {@link ApiKeyFilterConfig}, which matches the decoded path without path
 * parameters, the same path Spring MVC routes on.
 */
public class ApiKeyFilter implements Filter {

    private static final Logger LOG = LogManager.getLogger(ApiKeyFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expectedKey;

    public ApiKeyFilter(ApiProperties props) {
        this.expectedKey = props.getKey().getBytes(StandardCharsets.UTF_8);
        if ("changeme".equals(props.getKey())) {
            LOG.warn("bridge.api.key is the default value; set IMESSAGE_API_KEY before exposing this service");
        }
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)
                || !(response instanceof HttpServletResponse httpResponse)) {
            throw new ServletException("ApiKeyFilter requires an HTTP request");
        }

        String auth = http.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith(BEARER_PREFIX)) {
            reject(httpResponse, HttpServletResponse.SC_UNAUTHORIZED, "Missing or invalid Authorization header");
            return;
        }
        byte[] presented = auth.substring(BEARER_PREFIX.length()).strip().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(presented, expectedKey)) {
            LOG.warn("Rejected request with invalid API key");
            reject(httpResponse, HttpServletResponse.SC_FORBIDDEN, "Invalid API key");
            return;
        }
        chain.doFilter(request, response);
    }

    private static void reject(HttpServletResponse response, int status, String detail) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write("{\"detail\":\"" + detail + "\"}");
    }
}
