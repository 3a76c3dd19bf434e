/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.expr;

/**
 * Kind of a node in a Graphite target expression.
 */
public enum ExprType {
    /** Metric name or glob pattern, resolved through the fetch bindings. */
    NAME,
    /** Function call with positional and named arguments. */
    FUNC,
    /** Numeric literal. */
    CONST,
    /** Quoted string literal. */
    STRING,
    /** {@code true} or {@code false} literal. */
    BOOL
}
