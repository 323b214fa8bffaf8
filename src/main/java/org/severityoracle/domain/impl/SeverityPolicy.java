package org.severityoracle.domain.impl;

import org.severityoracle.domain.model.AggregationException;

/**
 * Validation rule for incoming severities. Negative values are never accepted; the upper bound
 * is only checked when {@code enforceMax} is on.
 */
public record SeverityPolicy(boolean enforceMax, int max) {

    public static final int UINT16_MAX = 65_535;

    public SeverityPolicy {
        if (max < 0) {
            throw new IllegalArgumentException("max severity must be >= 0, got " + max);
        }
    }

    public static SeverityPolicy unbounded() {
        return new SeverityPolicy(false, UINT16_MAX);
    }

    public void check(int severity) {
        if (severity < 0) {
            throw AggregationException.invalidArgument("severity must be >= 0, got " + severity);
        }
        if (enforceMax && severity > max) {
            throw AggregationException.invalidArgument("severity " + severity + " exceeds max " + max);
        }
    }
}
