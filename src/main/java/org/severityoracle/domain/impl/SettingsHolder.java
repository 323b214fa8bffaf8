package org.severityoracle.domain.impl;

import org.severityoracle.domain.model.AggregationSettings;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Live aggregation settings. Changes apply to every request that has not been finalized yet;
 * nothing is snapshotted at open time.
 */
public final class SettingsHolder {

    private final AtomicReference<AggregationSettings> current;

    public SettingsHolder(AggregationSettings initial) {
        this.current = new AtomicReference<>(initial);
    }

    public AggregationSettings current() { return current.get(); }

    public AggregationSettings setQuorum(int quorum) {
        return current.updateAndGet(s -> s.withQuorum(quorum));
    }

    public AggregationSettings setThresholds(int medium, int large) {
        return current.updateAndGet(s -> s.withThresholds(medium, large));
    }
}
