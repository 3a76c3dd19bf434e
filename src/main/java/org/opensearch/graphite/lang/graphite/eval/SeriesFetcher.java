/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.eval;

import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.query.function.QueryContext;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Backend that turns metric patterns into raw series.
 */
@FunctionalInterface
public interface SeriesFetcher {

    /**
     * Fetch the raw series of every request. Requests without data may be left out of the result.
     *
     * @param ctx deadline and cancellation the fetch must honour
     * @param requests distinct leaf requests
     * @return fetched series by request
     */
    Map<MetricRequest, List<MetricData>> fetch(QueryContext ctx, Collection<MetricRequest> requests);
}
