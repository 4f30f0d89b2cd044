package com.gatehouse.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Registers the meters of one Gatehouse service.
 * <p>
 * Every meter carries a {@value #TAG_SERVICE} tag with the service name. Timers publish the
 * {@link #PERCENTILES} client-side so latency can be read without a histogram backend. The
 * registry deduplicates meters, so the same name and tags always resolve to the same meter.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    /** Percentiles published by every timer. */
    static final double[] PERCENTILES = {0.5, 0.95, 0.99};

    private final MeterRegistry registry;
    private final Tags serviceTags;

    /**
     * @param registry    registry the meters are bound to
     * @param serviceName value of the {@value #TAG_SERVICE} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * @param tags alternating tag keys and values
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(withService(tags))
                .register(registry);
    }

    /**
     * @param tags alternating tag keys and values
     * @throws IllegalArgumentException if {@code tags} has an odd length
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(withService(tags))
                .publishPercentiles(PERCENTILES)
                .register(registry);
    }

    private Tags withService(String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs, got " + tags.length + " values");
        }
        return serviceTags.and(tags);
    }
}
