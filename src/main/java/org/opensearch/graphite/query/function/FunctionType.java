/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

/**
 * Semantic type of a function parameter, rendered with its Graphite name in function metadata.
 */
public enum FunctionType {
    SERIES_LIST("seriesList"),
    SERIES_LISTS("seriesLists"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    NODE("node"),
    NODE_OR_TAG("nodeOrTag"),
    TAG("tag"),
    INTERVAL("interval"),
    INT_OR_INTERVAL("intOrInterval"),
    INT_OR_INF("intOrInf"),
    STRING("string"),
    DATE("date"),
    AGG_FUNC("aggFunc"),
    AGG_OR_SERIES_FUNC("aggOrSeriesFunc"),
    ANY("any");

    private final String jsonName;

    FunctionType(String jsonName) {
        this.jsonName = jsonName;
    }

    /**
     * @return the name used in the function metadata JSON
     */
    public String jsonName() {
        return jsonName;
    }

    @Override
    public String toString() {
        return jsonName;
    }
}
