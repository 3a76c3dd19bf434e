/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parameter value shown to users as an option, a suggestion or a default. Holds a string, a number or a boolean.
 *
 * @param value the suggested value
 */
public record Suggestion(Object value) {

    public Suggestion {
        Objects.requireNonNull(value, "value cannot be null");
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException("unsupported suggestion type " + value.getClass().getName());
        }
    }

    public static Suggestion of(Object value) {
        return new Suggestion(value);
    }

    public static List<Suggestion> listOf(Object... values) {
        List<Suggestion> result = new ArrayList<>(values.length);
        for (Object value : values) {
            result.add(new Suggestion(value));
        }
        return result;
    }
}
