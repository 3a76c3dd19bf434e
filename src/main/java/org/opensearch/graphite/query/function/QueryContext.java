/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per query deadline and cancellation signal, checked by fetches and by functions that wait on external
 * resources.
 */
public final class QueryContext {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long deadlineNanos;
    private final int maxDataPoints;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private QueryContext(long deadlineNanos, int maxDataPoints) {
        this.deadlineNanos = deadlineNanos;
        this.maxDataPoints = maxDataPoints;
    }

    /**
     * A context without deadline and without a data point limit.
     */
    public static QueryContext unbounded() {
        return new QueryContext(NO_DEADLINE, 0);
    }

    /**
     * @param timeout time budget of the query, starting now
     * @param maxDataPoints display width, {@code 0} for no consolidation
     */
    public static QueryContext withTimeout(TimeValue timeout, int maxDataPoints) {
        return new QueryContext(System.nanoTime() + timeout.nanos(), maxDataPoints);
    }

    public int getMaxDataPoints() {
        return maxDataPoints;
    }

    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    /**
     * @return nanoseconds until the deadline, never negative; {@link Long#MAX_VALUE} without deadline
     */
    public long remainingNanos() {
        if (!hasDeadline()) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, deadlineNanos - System.nanoTime());
    }

    public long remainingMillis() {
        long remaining = remainingNanos();
        return remaining == Long.MAX_VALUE ? Long.MAX_VALUE : TimeUnit.NANOSECONDS.toMillis(remaining);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws GraphiteFunctionException with {@link ErrorKind#TIMEOUT} when the query was cancelled or its deadline
     *         has passed
     */
    public void ensureActive(String operation) {
        if (isCancelled()) {
            throw GraphiteFunctionException.of(ErrorKind.TIMEOUT, operation + " cancelled");
        }
        if (hasDeadline() && remainingNanos() == 0) {
            throw GraphiteFunctionException.of(ErrorKind.TIMEOUT, operation + " exceeded the query deadline");
        }
    }
}
