/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.consolidation;

/**
 * Reduces a group of values to one. Absent samples are passed in as {@link Double#NaN};
 * implementations return NaN when nothing contributes to the result.
 */
@FunctionalInterface
public interface ValueReducer {

    double reduce(double[] values);
}
