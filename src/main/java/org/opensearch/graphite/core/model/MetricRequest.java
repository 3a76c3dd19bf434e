/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.core.model;

import java.util.Objects;

/**
 * Key identifying one fetch: a metric pattern and the window it was fetched for.
 * Binds raw fetched series to the leaves of an expression.
 *
 * @param pattern metric name or glob pattern
 * @param from window start, epoch seconds
 * @param until window end, epoch seconds
 */
public record MetricRequest(String pattern, long from, long until) {

    public MetricRequest {
        Objects.requireNonNull(pattern, "pattern cannot be null");
    }

    /**
     * @return a request for the same pattern with the window moved by {@code offset} seconds
     */
    public MetricRequest shift(long offset) {
        return new MetricRequest(pattern, from + offset, until + offset);
    }
}
