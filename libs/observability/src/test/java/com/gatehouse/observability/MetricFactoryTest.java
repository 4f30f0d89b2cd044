package com.gatehouse.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "api-test");
    }

    @Test
    @DisplayName("rejects a missing registry or service name")
    void rejectsBadArguments() {
        assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registry");
        assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }

    @Nested
    @DisplayName("counters")
    class Counters {

        @Test
        @DisplayName("carry the service tag next to their own tags")
        void tagged() {
            factory.counter("gatehouse.auth.logins", "Login attempts", "outcome", "success").increment();

            assertThat(registry.get("gatehouse.auth.logins")
                            .tags("service", "api-test", "outcome", "success")
                            .counter()
                            .count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("resolve to one meter per name and tags")
        void deduplicated() {
            factory.counter("gatehouse.auth.denials", "Denials", "reason", "invalid_token").increment();
            factory.counter("gatehouse.auth.denials", "Denials", "reason", "invalid_token").increment();
            factory.counter("gatehouse.auth.denials", "Denials", "reason", "inactive_user").increment();

            assertThat(registry.get("gatehouse.auth.denials").tag("reason", "invalid_token").counter().count())
                    .isEqualTo(2.0);
            assertThat(registry.get("gatehouse.auth.denials").counters()).hasSize(2);
        }

        @Test
        @DisplayName("reject an unpaired tag")
        void unpairedTag() {
            assertThatThrownBy(() -> factory.counter("gatehouse.auth.logins", "Login attempts", "outcome"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("key/value pairs");
        }
    }

    @Test
    @DisplayName("timers publish latency percentiles")
    void timerPercentiles() {
        Timer timer = factory.timer("gatehouse.auth.login.duration", "Login duration");

        timer.record(Duration.ofMillis(150));
        timer.record(Duration.ofMillis(250));

        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.getId().getTag("service")).isEqualTo("api-test");
        assertThat(Arrays.stream(timer.takeSnapshot().percentileValues()).map(ValueAtPercentile::percentile))
                .containsExactly(0.5, 0.95, 0.99);
    }
}
