/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import java.util.Objects;

/**
 * A name under which a function implementation is registered. One implementation may be registered under several
 * names, e.g. {@code sumSeries} and {@code sum}.
 *
 * @param name registered name
 * @param function implementation
 */
public record FunctionMetadata(String name, GraphiteFunction function) {

    public FunctionMetadata {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
    }
}
