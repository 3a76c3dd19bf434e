/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

/**
 * Ordering constraint of a function relative to others producing the same output name.
 */
public enum FunctionOrder {
    /** No constraint; nearly every function. */
    ANY,
    /** Must run after the other functions. */
    LAST
}
