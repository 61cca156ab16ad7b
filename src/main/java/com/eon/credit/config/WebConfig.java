package com.eon.credit.config;

import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Browser access to the ledger API. Origins come from {@code app.cors.allowed-origins}; none by default. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final String CALLER_HEADER = "X-Caller";

    @Value("${app.cors.allowed-origins:}")
    private String corsOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (!StringUtils.hasText(corsOrigins)) {
            return;
        }
        String[] origins = Arrays.stream(corsOrigins.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .toArray(String[]::new);
        registry.addMapping("/api/**")
                .allowedOrigins(origins)
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders("Content-Type", CALLER_HEADER);
    }
}
