package com.chatrelay.metrics;

import com.chatrelay.error.ErrorCategory;
import com.chatrelay.error.RelayException;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * GlobalMetrics is process-wide state, so assertions here are relative to
 * whatever earlier tests in the same JVM recorded.
 */
public class GlobalMetricsTest {

    @Test
    public void testEveryCallerGetsTheSameRegistry() throws Exception {
        Set<MetricsRegistry> seen = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < 64; i++) {
            executor.submit(() -> {
                start.await();
                seen.add(GlobalMetrics.get());
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(seen).hasSize(1);
        assertThat(seen.iterator().next()).isSameAs(GlobalMetrics.get());
    }

    @Test
    public void testStaticHelpersRecordIntoTheSharedRegistry() {
        MetricsRegistry registry = GlobalMetrics.get();
        long commandsBefore = registry.commandCounts().total();
        long requestsBefore = registry.externalRequestCounts().total();
        long rateLimitsBefore = registry.errorCount(ErrorCategory.RATE_LIMIT);
        long internalBefore = registry.errorCount(ErrorCategory.INTERNAL);

        GlobalMetrics.recordCommand(true);
        GlobalMetrics.recordExternalRequest(false, 12);
        GlobalMetrics.recordError(RelayException.rateLimit("slow down", 3));
        GlobalMetrics.recordError(new IllegalStateException("boom"));

        assertThat(registry.commandCounts().total()).isEqualTo(commandsBefore + 1);
        assertThat(registry.externalRequestCounts().total()).isEqualTo(requestsBefore + 1);
        assertThat(registry.errorCount(ErrorCategory.RATE_LIMIT)).isEqualTo(rateLimitsBefore + 1);
        assertThat(registry.errorCount(ErrorCategory.INTERNAL)).isEqualTo(internalBefore + 1);
    }
}
