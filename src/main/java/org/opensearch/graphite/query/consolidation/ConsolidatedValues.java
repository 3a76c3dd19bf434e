/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.consolidation;

/**
 * Display-resolution view of a series.
 *
 * @param startTime timestamp of the first consolidated point
 * @param stepTime distance between consolidated points
 * @param values consolidated values, NaN where absent
 * @param absent absence mask parallel to {@code values}
 */
public record ConsolidatedValues(long startTime, long stepTime, double[] values, boolean[] absent) {

    public int size() {
        return values.length;
    }

    /**
     * @return timestamp of the point at {@code index}
     */
    public long timestampAt(int index) {
        return startTime + index * stepTime;
    }
}
