package com.inkboard.selectionservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "inkboard.cors")
public class CorsProperties {

    /**
     * Origin patterns allowed to call the REST API and open the selection socket, in the syntax of
     * {@link org.springframework.web.cors.CorsConfiguration#setAllowedOriginPatterns(List)}
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of(
            "http://localhost:*",
            "http://127.0.0.1:*"
    ));

    /**
     * How long browsers may cache a preflight response.
     */
    private long maxAgeSeconds = 1800;

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public long getMaxAgeSeconds() {
        return maxAgeSeconds;
    }

    public void setMaxAgeSeconds(long maxAgeSeconds) {
        this.maxAgeSeconds = maxAgeSeconds;
    }
}
