package com.fintech.signals.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Common tags and client-side percentiles for every timer.
 *
 * Timer SLO buckets cover the engine's range: sub-millisecond candle ingestion up to
 * multi-second upstream fetches and portfolio fan-outs.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "rwa-signal-engine",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99, 0.999)
                        .percentilePrecision(2)
                        .serviceLevelObjectives(
                            Duration.ofNanos(100_000).toNanos(),    // 100 μs
                            Duration.ofMillis(1).toNanos(),
                            Duration.ofMillis(10).toNanos(),
                            Duration.ofMillis(50).toNanos(),
                            Duration.ofMillis(100).toNanos(),
                            Duration.ofMillis(250).toNanos(),
                            Duration.ofMillis(500).toNanos(),
                            Duration.ofSeconds(1).toNanos(),
                            Duration.ofSeconds(5).toNanos()     // upstream read timeout
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofSeconds(60))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
