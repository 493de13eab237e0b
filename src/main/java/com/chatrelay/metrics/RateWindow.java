package com.chatrelay.metrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding window of event timestamps used to derive an events-per-second rate.
 * <p>
 * Timestamps are kept oldest first. Anything at least one window old is dropped
 * lazily, on the next write or read, so memory is bounded by the number of
 * events that fit in one window.
 * <p>
 * All access goes through the instance monitor; readers never see a half-evicted deque.
 */
public class RateWindow {

    private final Duration window;
    private final double windowSeconds;
    private final Clock clock;

    private final Deque<Instant> events = new ArrayDeque<>();

    public RateWindow(Duration window, Clock clock) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Rate window must be positive, got " + window);
        }
        this.window = window;
        this.windowSeconds = window.toNanos() / 1_000_000_000.0;
        this.clock = clock;
    }

    /**
     * Record an event at the current clock time.
     * The timestamp is taken under the lock so the deque stays in chronological order.
     */
    public synchronized void record() {
        record(clock.instant());
    }

    /**
     * Record an event at the given time, then evict everything at or before
     * {@code timestamp - window}.
     * <p>
     * A timestamp older than the newest one held (explicit back-dating, or a
     * wall clock stepped backwards) is inserted in order, so head-only eviction
     * still drops it once it leaves the window.
     *
     * @param timestamp event time, treated as "now" for eviction
     */
    public synchronized void record(Instant timestamp) {
        if (events.isEmpty() || !events.peekLast().isAfter(timestamp)) {
            events.addLast(timestamp);
        } else {
            insertInOrder(timestamp);
        }
        evictExpired(timestamp.minus(window));
    }

    /**
     * Events per second over the trailing window, measured against the clock.
     *
     * @return the rate, exactly 0.0 when the window is empty
     */
    public synchronized double rate() {
        evictExpired(clock.instant().minus(window));
        if (events.isEmpty()) {
            return 0.0;
        }
        return events.size() / windowSeconds;
    }

    /**
     * Number of timestamps currently held, without evicting.
     */
    public synchronized int retainedCount() {
        return events.size();
    }

    // keeps entries strictly newer than the cutoff
    private void evictExpired(Instant cutoff) {
        while (!events.isEmpty() && !events.peekFirst().isAfter(cutoff)) {
            events.pollFirst();
        }
    }

    private void insertInOrder(Instant timestamp) {
        Deque<Instant> newer = new ArrayDeque<>();
        while (!events.isEmpty() && events.peekLast().isAfter(timestamp)) {
            newer.addFirst(events.pollLast());
        }
        events.addLast(timestamp);
        events.addAll(newer);
    }
}
