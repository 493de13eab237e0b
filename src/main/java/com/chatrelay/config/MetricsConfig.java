package com.chatrelay.config;

import com.chatrelay.metrics.GlobalMetrics;
import com.chatrelay.metrics.MetricsRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Hands the process-wide registry to the Spring context, so injected
 * components and static {@link GlobalMetrics} callers share one instance.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricsRegistry metricsRegistry() {
        return GlobalMetrics.get();
    }
}
