package com.gatehouse.api.config;

import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe service properties, bound from the {@code gatehouse.service.*} prefix:
 *
 * <pre>
 * gatehouse:
 *   service:
 *     name: gatehouse-api-service
 *     description: An application programming interface service.
 *     version: v0.1.1
 *     api-prefix: /api/v1
 *     cors-origins: http://localhost:8000
 *     frontend-host: http://localhost:5173
 * </pre>
 *
 * @param name service name used for logging and metric tags. Required.
 * @param description human-readable description
 * @param version service version reported by {@code /actuator/info}
 * @param apiPrefix path prefix for every REST controller (default {@code /api/v1})
 * @param corsOrigins origins allowed to call the API from a browser
 * @param frontendHost the frontend origin, always allowed
 */
@ConfigurationProperties(prefix = "gatehouse.service")
@Validated
public record ApiServiceProperties(
        @NotBlank String name,
        String description,
        String version,
        String apiPrefix,
        List<String> corsOrigins,
        String frontendHost) {

    public static final String DEFAULT_API_PREFIX = "/api/v1";

    /** Applies defaults before Bean Validation runs. */
    public ApiServiceProperties {
        if (apiPrefix == null || apiPrefix.isBlank()) {
            apiPrefix = DEFAULT_API_PREFIX;
        }
        if (!apiPrefix.startsWith("/")) {
            apiPrefix = "/" + apiPrefix;
        }
        if (apiPrefix.length() > 1 && apiPrefix.endsWith("/")) {
            apiPrefix = apiPrefix.substring(0, apiPrefix.length() - 1);
        }
        corsOrigins = corsOrigins == null ? List.of() : List.copyOf(corsOrigins);
    }

    /** Configured CORS origins without trailing slashes, followed by the frontend host. */
    public List<String> allCorsOrigins() {
        List<String> origins = new ArrayList<>();
        for (String origin : corsOrigins) {
            String trimmed = origin.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            origins.add(trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed);
        }
        if (frontendHost != null && !frontendHost.isBlank()) {
            origins.add(frontendHost.strip());
        }
        return List.copyOf(origins);
    }
}
