package com.gatehouse.api.config;

import com.gatehouse.api.infrastructure.web.CurrentUserArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.HandlerTypePredicate;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: API prefix, CORS and the {@code @CurrentUser} resolver.
 *
 * <p>Every {@link RestController} is mounted under {@link ApiServiceProperties#apiPrefix()}.
 * Actuator endpoints are not affected.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ApiServiceProperties properties;
    private final CurrentUserArgumentResolver currentUserResolver;

    public WebConfig(ApiServiceProperties properties, CurrentUserArgumentResolver currentUserResolver) {
        this.properties = properties;
        this.currentUserResolver = currentUserResolver;
    }

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        configurer.addPathPrefix(properties.apiPrefix(), HandlerTypePredicate.forAnnotation(RestController.class));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = properties.allCorsOrigins();
        if (origins.isEmpty()) {
            return;
        }
        registry.addMapping(properties.apiPrefix() + "/**")
                .allowedOrigins(origins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(currentUserResolver);
    }
}
