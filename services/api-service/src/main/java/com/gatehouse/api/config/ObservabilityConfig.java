package com.gatehouse.api.config;

import com.gatehouse.observability.MetricFactory;
import com.gatehouse.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ApiServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}
