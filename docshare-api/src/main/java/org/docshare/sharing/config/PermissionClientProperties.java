package org.docshare.sharing.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings of the HTTP client used by the optimistic update coordinator.
 * Maps to docshare.client.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "docshare.client")
public class PermissionClientProperties {

    /**
     * Base URL of the permission authority, without the /api/v1 prefix.
     */
    private String baseUrl = "http://localhost:8081";

    /**
     * Maximum time to wait for the authority before the call is treated as a transient failure.
     */
    private Duration timeout = Duration.ofSeconds(10);

    @PostConstruct
    public void validate() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("docshare.client.base-url must not be blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("docshare.client.timeout must be a positive duration. Current value: " + timeout);
        }
    }
}
