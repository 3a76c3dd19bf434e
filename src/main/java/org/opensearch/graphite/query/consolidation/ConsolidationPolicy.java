/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.consolidation;

/**
 * Bucket placement policy applied when a series is consolidated for display.
 *
 * @param nudgeStartTime align the first bucket boundary to a multiple of the bucket width in epoch time,
 *                       dropping the leading partial bucket
 * @param useBucketsHighestTimestamp label each consolidated point with the last timestamp of its bucket
 */
public record ConsolidationPolicy(boolean nudgeStartTime, boolean useBucketsHighestTimestamp) {

    private static final ConsolidationPolicy DEFAULT = new ConsolidationPolicy(false, false);

    /**
     * @return the policy with both flags disabled
     */
    public static ConsolidationPolicy defaultPolicy() {
        return DEFAULT;
    }
}
