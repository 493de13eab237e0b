package com.chatrelay.metrics;

import com.chatrelay.error.ErrorCategory;

import java.time.Duration;
import java.util.EnumMap;

/**
 * No-op metrics implementation.
 * Used for tests where metrics collection is irrelevant.
 */
public class NoOpMetrics implements Metrics {

    @Override
    public void recordCommand(boolean successful) {
        // no-op
    }

    @Override
    public void recordExternalRequest(boolean successful, long responseTimeMillis) {
        // no-op
    }

    @Override
    public void recordError(ErrorCategory category) {
        // no-op
    }

    @Override
    public double averageResponseTime() {
        return 0.0;
    }

    @Override
    public Duration uptime() {
        return Duration.ZERO;
    }

    @Override
    public double commandsPerSecond() {
        return 0.0;
    }

    @Override
    public double externalRequestsPerSecond() {
        return 0.0;
    }

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                0, 0, 0, 0.0, 0.0,
                0, 0, 0, 0.0, 0.0, 0.0,
                new EnumMap<>(ErrorCategory.class),
                0.0,
                "1970-01-01T00:00:00Z"
        );
    }
}
