package com.egressoptimizer.anomaly;

import java.util.Comparator;

/**
 * Identity of one metric series of one resource.
 */
record SeriesKey(String resourceId, String resourceName, String metricName) implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::resourceId)
            .thenComparing(SeriesKey::resourceName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(SeriesKey::metricName);

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }
}
