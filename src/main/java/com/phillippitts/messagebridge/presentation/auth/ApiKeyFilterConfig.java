package com.phillippitts.messagebridge.presentation.auth;

import com.phillippitts.messagebridge.config.properties.ApiProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Mounts {@link ApiKeyFilter} on the submission route.
 */
@Configuration
public class ApiKeyFilterConfig {

    /** Container URL patterns guarded by the bearer key. */
    static final String[] PROTECTED_PATTERNS = {"/send"};

    @Bean
    FilterRegistrationBean<ApiKeyFilter> apiKeyFilterRegistration(ApiProperties props) {
        FilterRegistrationBean<ApiKeyFilter> registration = new FilterRegistrationBean<>(new ApiKeyFilter(props));
        registration.setName("apiKeyFilter");
        registration.addUrlPatterns(PROTECTED_PATTERNS);
        // After MdcFilter so rejections carry a request id
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
