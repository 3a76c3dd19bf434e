/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.common;

import org.opensearch.core.rest.RestStatus;

/**
 * Kinds of failures raised while evaluating Graphite functions.
 *
 * <p>Each kind carries the canonical message used by Graphite compatible front ends and the
 * HTTP status it maps to. Argument and structural precondition failures are client errors.</p>
 */
public enum ErrorKind {
    /** A required series argument resolved to nothing. */
    MISSING_TIMESERIES("missing time series argument", RestStatus.BAD_REQUEST),
    /** A named leaf had no matching data at all. */
    SERIES_DOES_NOT_EXIST("no timeseries with that name", RestStatus.BAD_REQUEST),
    /** A function requiring exactly one series received several. */
    WILDCARD_NOT_ALLOWED("found wildcard where series expected", RestStatus.BAD_REQUEST),
    TOO_MANY_ARGUMENTS("too many arguments", RestStatus.BAD_REQUEST),
    BAD_TYPE("bad type", RestStatus.BAD_REQUEST),
    MISSING_ARGUMENT("missing argument", RestStatus.BAD_REQUEST),
    INVALID_ARGUMENT("invalid function arguments", RestStatus.BAD_REQUEST),
    TOO_FEW_DATASETS("bad data: need at least 2 data sets to process", RestStatus.BAD_REQUEST),
    MISMATCHED_SERIES_LENGTH("bad data: length of series does not match", RestStatus.BAD_REQUEST),
    EMPTY_SERIES("bad data: empty series", RestStatus.BAD_REQUEST),
    TOO_FEW_MARKS("bad data: could not find 2 marks", RestStatus.BAD_REQUEST),
    /** The function is registered but its optional backend is not part of this build. */
    UNSUPPORTED_BUILD("function is not supported in this build", RestStatus.NOT_IMPLEMENTED),
    UNKNOWN_FUNCTION("unknown function", RestStatus.BAD_REQUEST),
    TIMEOUT("timeout while waiting for a backend resource", RestStatus.GATEWAY_TIMEOUT),
    BACKEND_FAILURE("backend request failed", RestStatus.INTERNAL_SERVER_ERROR);

    private final String defaultMessage;
    private final RestStatus status;

    ErrorKind(String defaultMessage, RestStatus status) {
        this.defaultMessage = defaultMessage;
        this.status = status;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public RestStatus getStatus() {
        return status;
    }
}
