/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lookup;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.query.function.QueryContext;

import java.io.Closeable;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JDBC connection pool with a hard bound on concurrently checked out connections.
 *
 * <h2>Checkout:</h2>
 * <p>{@link #acquire(QueryContext)} waits for a free slot at most until the earlier of the pool's acquire timeout and
 * the query deadline, and gives up on cancellation. Giving up raises {@link ErrorKind#TIMEOUT}; it never blocks
 * past the caller's budget.</p>
 *
 * <h2>Release:</h2>
 * <p>{@link Lease} is {@link AutoCloseable}; closing it returns the slot and keeps the connection for reuse unless it
 * was marked broken or is already closed. Use it in try-with-resources so every exit path releases.</p>
 */
public class BoundedConnectionPool implements Closeable {

    private static final Logger logger = LogManager.getLogger(BoundedConnectionPool.class);

    private final String name;
    private final ConnectionFactory factory;
    private final Semaphore permits;
    private final TimeValue acquireTimeout;
    private final ConcurrentLinkedDeque<Connection> idle = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public BoundedConnectionPool(String name, ConnectionFactory factory, int maxConnections, TimeValue acquireTimeout) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive, got " + maxConnections);
        }
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
        this.permits = new Semaphore(maxConnections, true);
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout cannot be null");
    }

    public String getName() {
        return name;
    }

    /**
     * @return number of connections that can be checked out right now
     */
    public int availablePermits() {
        return permits.availablePermits();
    }

    /**
     * Check out a connection.
     *
     * @throws GraphiteFunctionException {@link ErrorKind#TIMEOUT} when no slot frees up in time or the query is
     *         cancelled, {@link ErrorKind#BACKEND_FAILURE} when a new connection cannot be opened
     */
    public Lease acquire(QueryContext ctx) {
        if (closed.get()) {
            throw GraphiteFunctionException.of(ErrorKind.BACKEND_FAILURE, "connection pool [" + name + "] is closed");
        }
        ctx.ensureActive("connection checkout from [" + name + "]");
        long waitNanos = Math.min(acquireTimeout.nanos(), ctx.remainingNanos());
        boolean acquired;
        try {
            acquired = waitNanos <= 0 ? permits.tryAcquire() : permits.tryAcquire(waitNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphiteFunctionException(ErrorKind.TIMEOUT, "interrupted waiting for a connection from [" + name + "]", e);
        }
        if (!acquired) {
            logger.debug("No connection from [{}] within {}ns", name, waitNanos);
            throw GraphiteFunctionException.of(ErrorKind.TIMEOUT, "no connection available from [" + name + "]");
        }

        try {
            ctx.ensureActive("connection checkout from [" + name + "]");
            return new Lease(this, borrow());
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    private Connection borrow() {
        Connection connection;
        while ((connection = idle.pollFirst()) != null) {
            if (isUsable(connection)) {
                return connection;
            }
        }
        try {
            return factory.open();
        } catch (SQLException e) {
            throw new GraphiteFunctionException(ErrorKind.BACKEND_FAILURE, "failed to connect to [" + name + "]", e);
        }
    }

    private static boolean isUsable(Connection connection) {
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    private void release(Connection connection, boolean broken) {
        try {
            if (broken || closed.get() || !isUsable(connection)) {
                closeQuietly(connection);
            } else {
                idle.offerFirst(connection);
            }
        } finally {
            permits.release();
        }
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Failed to close connection of [{}]", name, e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            Connection connection;
            while ((connection = idle.pollFirst()) != null) {
                closeQuietly(connection);
            }
        }
    }

    /**
     * A checked out connection; closing the lease releases it to the pool exactly once.
     */
    public static final class Lease implements AutoCloseable {
        private final BoundedConnectionPool pool;
        private final Connection connection;
        private final AtomicBoolean released = new AtomicBoolean();
        private volatile boolean broken;

        private Lease(BoundedConnectionPool pool, Connection connection) {
            this.pool = pool;
            this.connection = connection;
        }

        public Connection connection() {
            return connection;
        }

        /**
         * Discard the connection on release instead of reusing it.
         */
        public void markBroken() {
            this.broken = true;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                pool.release(connection, broken);
            }
        }
    }
}
