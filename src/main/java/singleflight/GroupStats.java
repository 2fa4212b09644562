package singleflight;

/**
 * Point-in-time counters for a Group.
 *
 * @param executions Computations started
 * @param joins Callers and subscribers that attached to an already in-flight call
 * @param forgotten Records evicted by forgetUnshared
 */
public record GroupStats(long executions, long joins, long forgotten) {

    /**
     * @return Percentage of requests that were served by another caller's computation
     */
    public double dedupRatioPercent() {
        long total = executions + joins;
        if (total == 0) {
            return 0.0;
        }
        return (double) joins / total * 100;
    }
}
