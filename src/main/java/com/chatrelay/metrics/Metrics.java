package com.chatrelay.metrics;

import com.chatrelay.error.ErrorCategory;

import java.time.Duration;

/**
 * Metrics API used by the dispatcher and the reply sink, and exposed via /metrics.
 * <p>
 * Recording is best effort: implementations normalize bad input instead of
 * throwing, so a metrics call can never abort the operation being measured.
 */
public interface Metrics {

    void recordCommand(boolean successful);

    void recordExternalRequest(boolean successful, long responseTimeMillis);

    void recordError(ErrorCategory category);

    double averageResponseTime();

    Duration uptime();

    /**
     * Commands per second as of the most recent record call. May lag the window by one update.
     */
    double commandsPerSecond();

    /**
     * External requests per second as of the most recent record call.
     */
    double externalRequestsPerSecond();

    MetricsSnapshot snapshot();
}
