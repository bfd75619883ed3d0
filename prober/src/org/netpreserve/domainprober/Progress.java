package org.netpreserve.domainprober;

/**
 * Snapshot of the counters of a probe run.
 *
 * @param generated candidates drawn from the source
 * @param skipped   candidates dropped because their outcome was already known
 * @param submitted candidates handed to a worker
 * @param inFlight  submitted candidates without a result yet
 */
public record Progress(long generated, long skipped, long submitted, long live, long parked, long empty,
                       long errors, int inFlight) {
    public static final Progress EMPTY = new Progress(0, 0, 0, 0, 0, 0, 0, 0);

    public long completed() {
        return live + parked + empty + errors;
    }
}
