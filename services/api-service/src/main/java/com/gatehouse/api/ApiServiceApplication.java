package com.gatehouse.api;

import com.gatehouse.api.config.ApiServiceProperties;
import com.gatehouse.api.config.SecurityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Gatehouse API service.
 *
 * <p>Exposes a login endpoint that issues bearer tokens, current-user endpoints and a CRUD
 * resource API. Every protected route runs through an {@link com.gatehouse.security.AccessGuard}
 * built for its scopes.
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, info and metrics endpoints
 *   <li>Correlation ID propagation on every HTTP request
 *   <li>Flyway-managed schema and superuser seeding at startup
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({ApiServiceProperties.class, SecurityProperties.class})
public class ApiServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(ApiServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ApiServiceApplication.class, args);
        log.info("Gatehouse API service started");
    }
}
