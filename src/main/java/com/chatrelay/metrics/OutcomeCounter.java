package com.chatrelay.metrics;

/**
 * Total/succeeded/failed counters plus an optional duration accumulator,
 * guarded by one monitor so that {@code total == succeeded + failed} holds
 * for every reader.
 */
class OutcomeCounter {

    private long total;
    private long succeeded;
    private long failed;
    private long durationSumMillis;
    private long durationCount;

    synchronized void record(boolean successful) {
        total++;
        if (successful) {
            succeeded++;
        } else {
            failed++;
        }
    }

    synchronized void record(boolean successful, long durationMillis) {
        record(successful);
        durationSumMillis += durationMillis;
        durationCount++;
    }

    synchronized OutcomeCounts read() {
        return new OutcomeCounts(total, succeeded, failed, durationSumMillis, durationCount);
    }
}
