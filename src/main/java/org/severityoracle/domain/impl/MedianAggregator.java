package org.severityoracle.domain.impl;

import org.severityoracle.domain.model.AggregationException;
import org.severityoracle.domain.model.ErrorKind;

import java.util.List;

/**
 * Exact integer median of a small set of severities.
 * <ul>
 *   <li>odd count: middle element of the ascending order</li>
 *   <li>even count: floor of the mean of the two middle elements</li>
 * </ul>
 * No floating point anywhere, so every node computes the same value.
 */
public final class MedianAggregator {

    public int median(List<Integer> severities) {
        if (severities == null || severities.isEmpty()) {
            throw new AggregationException(ErrorKind.NO_VALUES, "cannot take the median of no values");
        }

        int n = severities.size();
        int[] sorted = new int[n];
        for (int i = 0; i < n; i++) {
            sorted[i] = severities.get(i);
        }
        insertionSort(sorted);

        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        // long sum: unbounded severities may overflow an int
        long sum = (long) sorted[n / 2 - 1] + sorted[n / 2];
        return (int) Math.floorDiv(sum, 2L);
    }

    /** Stable, in place. Quorums are a handful of values. */
    static void insertionSort(int[] a) {
        for (int i = 1; i < a.length; i++) {
            int key = a[i];
            int j = i - 1;
            while (j >= 0 && a[j] > key) {
                a[j + 1] = a[j];
                j--;
            }
            a[j + 1] = key;
        }
    }
}
