package com.chatrelay.metrics;

import com.chatrelay.error.ErrorCategory;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters, rates and latency for command handling and outbound calls.
 * <p>
 * Each counter group (commands, external requests) sits behind its own monitor,
 * error counts are independent atomics. No lock is held across groups, so
 * snapshots are consistent per group, not across groups.
 * <p>
 * Obtain the shared instance through {@link GlobalMetrics#get()}; the Spring
 * context exposes the same object as its {@link Metrics} bean.
 */
@Slf4j
public class MetricsRegistry implements Metrics {

    public static final Duration DEFAULT_RATE_WINDOW = Duration.ofSeconds(60);

    private final Clock clock;
    private final Instant startTime;

    private final OutcomeCounter commands = new OutcomeCounter();
    private final OutcomeCounter externalRequests = new OutcomeCounter();

    private final Map<ErrorCategory, AtomicLong> errorsByCategory = new ConcurrentHashMap<>();

    private final RateWindow commandWindow;
    private final RateWindow externalRequestWindow;

    // refreshed on every record, informational only
    private volatile double commandsPerSecond;
    private volatile double externalRequestsPerSecond;

    public MetricsRegistry(Clock clock, Duration rateWindow) {
        this.clock = clock;
        this.startTime = clock.instant();
        this.commandWindow = new RateWindow(rateWindow, clock);
        this.externalRequestWindow = new RateWindow(rateWindow, clock);
        log.info("Initialized MetricsRegistry with rate window: {} seconds", rateWindow.toSeconds());
    }

    @Override
    public void recordCommand(boolean successful) {
        commands.record(successful);
        commandWindow.record();
        commandsPerSecond = commandWindow.rate();
    }

    @Override
    public void recordExternalRequest(boolean successful, long responseTimeMillis) {
        long normalized = responseTimeMillis;
        if (normalized < 0) {
            log.warn("Clamping negative response time {}ms to 0", responseTimeMillis);
            normalized = 0;
        }
        externalRequests.record(successful, normalized);
        externalRequestWindow.record();
        externalRequestsPerSecond = externalRequestWindow.rate();
    }

    @Override
    public void recordError(ErrorCategory category) {
        ErrorCategory normalized = category != null ? category : ErrorCategory.INTERNAL;
        errorsByCategory
                .computeIfAbsent(normalized, c -> new AtomicLong())
                .incrementAndGet();
    }

    @Override
    public double averageResponseTime() {
        return externalRequests.read().averageDurationMillis();
    }

    @Override
    public Duration uptime() {
        Duration uptime = Duration.between(startTime, clock.instant());
        return uptime.isNegative() ? Duration.ZERO : uptime;
    }

    @Override
    public double commandsPerSecond() {
        return commandsPerSecond;
    }

    @Override
    public double externalRequestsPerSecond() {
        return externalRequestsPerSecond;
    }

    public OutcomeCounts commandCounts() {
        return commands.read();
    }

    public OutcomeCounts externalRequestCounts() {
        return externalRequests.read();
    }

    public long errorCount(ErrorCategory category) {
        AtomicLong count = errorsByCategory.get(category);
        return count != null ? count.get() : 0L;
    }

    public Instant getStartTime() {
        return startTime;
    }

    /* ---------- Snapshot ---------- */

    /**
     * Copy every value out of the registry. Rates are recomputed against the
     * clock here so an idle relay reports 0.0 instead of the last cached rate.
     */
    @Override
    public MetricsSnapshot snapshot() {
        OutcomeCounts commandCounts = commands.read();
        OutcomeCounts externalCounts = externalRequests.read();

        double commandRate = commandWindow.rate();
        double externalRate = externalRequestWindow.rate();
        commandsPerSecond = commandRate;
        externalRequestsPerSecond = externalRate;

        return new MetricsSnapshot(
                commandCounts.total(),
                commandCounts.succeeded(),
                commandCounts.failed(),
                commandRate,
                commandCounts.successRatePercent(),
                externalCounts.total(),
                externalCounts.succeeded(),
                externalCounts.failed(),
                externalRate,
                externalCounts.successRatePercent(),
                externalCounts.averageDurationMillis(),
                copyErrors(),
                uptime().toMillis() / 1000.0,
                DateTimeFormatter.ISO_INSTANT.format(startTime.truncatedTo(ChronoUnit.SECONDS))
        );
    }

    private Map<ErrorCategory, Long> copyErrors() {
        Map<ErrorCategory, Long> copy = new EnumMap<>(ErrorCategory.class);
        for (ErrorCategory category : ErrorCategory.values()) {
            copy.put(category, errorCount(category));
        }
        return Collections.unmodifiableMap(copy);
    }
}
