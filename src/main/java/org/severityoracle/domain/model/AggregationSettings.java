package org.severityoracle.domain.model;

/**
 * Process-wide aggregation knobs. Immutable so a reader always sees a quorum and a
 * threshold pair that were set together.
 *
 * @param quorum          minimum distinct submissions before finalize is allowed, {@code > 0}
 * @param mediumThreshold lowest median classified {@link Category#M}
 * @param largeThreshold  lowest median classified {@link Category#L}, strictly above medium
 */
public record AggregationSettings(int quorum, int mediumThreshold, int largeThreshold) {

    public AggregationSettings {
        if (quorum <= 0) {
            throw AggregationException.invalidArgument("quorum must be > 0, got " + quorum);
        }
        if (mediumThreshold >= largeThreshold) {
            throw AggregationException.invalidArgument(
                    "medium threshold " + mediumThreshold + " must be below large threshold " + largeThreshold);
        }
    }

    public AggregationSettings withQuorum(int newQuorum) {
        return new AggregationSettings(newQuorum, mediumThreshold, largeThreshold);
    }

    public AggregationSettings withThresholds(int medium, int large) {
        return new AggregationSettings(quorum, medium, large);
    }
}
