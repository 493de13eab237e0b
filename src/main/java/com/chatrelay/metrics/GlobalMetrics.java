package com.chatrelay.metrics;

import com.chatrelay.error.ErrorClassifier;

import java.time.Clock;

/**
 * Process-wide access to the one {@link MetricsRegistry}.
 * <p>
 * The registry is built on first access with a 60 second rate window and the
 * UTC system clock. Code outside Spring (or before the context is up) can
 * record through the static helpers; beans get the same instance injected.
 */
public final class GlobalMetrics {

    private static final LazyInitializer<MetricsRegistry> REGISTRY = new LazyInitializer<>(
            () -> new MetricsRegistry(Clock.systemUTC(), MetricsRegistry.DEFAULT_RATE_WINDOW)
    );

    private GlobalMetrics() {
    }

    public static MetricsRegistry get() {
        return REGISTRY.get();
    }

    public static void recordCommand(boolean successful) {
        get().recordCommand(successful);
    }

    public static void recordExternalRequest(boolean successful, long responseTimeMillis) {
        get().recordExternalRequest(successful, responseTimeMillis);
    }

    /**
     * Classify the failure and count it under its category.
     */
    public static void recordError(Throwable failure) {
        get().recordError(ErrorClassifier.classify(failure));
    }
}
