/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.utils;

/**
 * A scalar key attached to the position of the series it was computed from.
 *
 * @param index position of the series in its input list
 * @param value ranking key
 */
public record IndexedValue(int index, double value) implements Comparable<IndexedValue> {

    /**
     * Orders by value; NaN sorts above every number. Ties are broken by index.
     */
    @Override
    public int compareTo(IndexedValue other) {
        int cmp = Double.compare(value, other.value);
        return cmp != 0 ? cmp : Integer.compare(index, other.index);
    }
}
