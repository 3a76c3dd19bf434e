/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.common;

import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;

import java.util.Objects;

/**
 * Failure raised by function evaluation, tagged with an {@link ErrorKind}.
 *
 * <p>Messages are passed through pre-formatted; series patterns may contain braces which must not be
 * interpreted as format placeholders.</p>
 */
public class GraphiteFunctionException extends OpenSearchException {

    private final ErrorKind kind;

    public GraphiteFunctionException(ErrorKind kind) {
        this(kind, kind.getDefaultMessage());
    }

    public GraphiteFunctionException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public GraphiteFunctionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    /**
     * Create an exception whose message is the kind's canonical message followed by a detail.
     *
     * @param kind the error kind
     * @param detail additional context, e.g. the offending argument
     * @return the exception
     */
    public static GraphiteFunctionException of(ErrorKind kind, String detail) {
        return new GraphiteFunctionException(kind, kind.getDefaultMessage() + ": " + detail);
    }

    /**
     * Wrap an exception with the name of the function that raised it, keeping its kind.
     *
     * @param functionName the function being evaluated
     * @param e the original failure
     * @return a new exception with the prefixed message
     */
    public static GraphiteFunctionException withFunction(String functionName, GraphiteFunctionException e) {
        return new GraphiteFunctionException(e.kind, "function=" + functionName + ": " + e.getMessage(), e);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return true when this exception, or a {@link GraphiteFunctionException} cause, has the given kind
     */
    public boolean is(ErrorKind other) {
        Throwable current = this;
        while (current != null) {
            if (current instanceof GraphiteFunctionException && ((GraphiteFunctionException) current).kind == other) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public RestStatus status() {
        return kind.getStatus();
    }
}
