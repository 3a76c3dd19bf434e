/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lookup;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens physical JDBC connections for a {@link BoundedConnectionPool}.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection open() throws SQLException;

    /**
     * Connections from {@link DriverManager} for the configured database.
     */
    static ConnectionFactory driverManager(AliasByPostgresConfig.Database database) {
        return () -> DriverManager.getConnection(database.url(), database.username(), database.password());
    }
}
