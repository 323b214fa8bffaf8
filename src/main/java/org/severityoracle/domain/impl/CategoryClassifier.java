package org.severityoracle.domain.impl;

import org.severityoracle.domain.model.AggregationSettings;
import org.severityoracle.domain.model.Category;

/**
 * Two-threshold classification. A median equal to a threshold already belongs to the higher tier.
 */
public final class CategoryClassifier {

    public Category classify(int median, AggregationSettings settings) {
        if (median < settings.mediumThreshold()) {
            return Category.S;
        }
        if (median < settings.largeThreshold()) {
            return Category.M;
        }
        return Category.L;
    }
}
