package com.chatrelay.metrics;

/**
 * Values of one {@link OutcomeCounter} read inside a single critical section.
 * Derived percentages computed from here always fall in [0, 100].
 */
public record OutcomeCounts(
        long total,
        long succeeded,
        long failed,
        long durationSumMillis,
        long durationCount
) {

    public double successRatePercent() {
        if (total == 0) {
            return 0.0;
        }
        return (double) succeeded / total * 100.0;
    }

    public double averageDurationMillis() {
        if (durationCount == 0) {
            return 0.0;
        }
        return (double) durationSumMillis / durationCount;
    }
}
