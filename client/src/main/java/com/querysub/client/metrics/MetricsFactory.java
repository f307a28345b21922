package com.querysub.client.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * Fallback registry for applications that do not export metrics.
 */
@Factory
public class MetricsFactory {

    @Singleton
    @Requires(missingBeans = MeterRegistry.class)
    public MeterRegistry fallbackMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
