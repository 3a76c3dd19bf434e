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
import org.opensearch.OpenSearchException;
import org.opensearch.graphite.query.function.EngineConfig;
import org.opensearch.graphite.query.function.FunctionProvider;
import org.opensearch.graphite.query.function.FunctionRegistration;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds {@code aliasByPostgres} from the file named by {@code graphite.functions.alias_by_postgres.config}.
 *
 * <p>Without a file, with an unreadable one, or with {@code enabled: false}, the function is registered as disabled
 * with the reason.</p>
 */
public class AliasByPostgresProvider implements FunctionProvider {

    private static final Logger logger = LogManager.getLogger(AliasByPostgresProvider.class);

    private final Function<AliasByPostgresConfig.Database, ConnectionFactory> connections;

    public AliasByPostgresProvider() {
        this(ConnectionFactory::driverManager);
    }

    public AliasByPostgresProvider(Function<AliasByPostgresConfig.Database, ConnectionFactory> connections) {
        this.connections = Objects.requireNonNull(connections, "connections cannot be null");
    }

    @Override
    public FunctionRegistration create(EngineConfig config) {
        String path = config.aliasByPostgresConfig();
        if (path.isEmpty()) {
            return FunctionRegistration.disabled(AliasByPostgresFunction.NAME, "no config file specified");
        }
        AliasByPostgresConfig aliasConfig;
        try {
            aliasConfig = AliasByPostgresConfig.load(Path.of(path));
        } catch (IOException | OpenSearchException e) {
            logger.error("Failed to read aliasByPostgres config [{}]", path, e);
            return FunctionRegistration.disabled(AliasByPostgresFunction.NAME, "failed to read config file: " + e.getMessage());
        }
        return create(aliasConfig);
    }

    /**
     * Register the function for an already loaded config.
     */
    public FunctionRegistration create(AliasByPostgresConfig aliasConfig) {
        if (!aliasConfig.enabled()) {
            return FunctionRegistration.disabled(AliasByPostgresFunction.NAME, "disabled in config");
        }
        Map<String, BoundedConnectionPool> pools = new LinkedHashMap<>();
        for (Map.Entry<String, AliasByPostgresConfig.Database> entry : aliasConfig.databases().entrySet()) {
            AliasByPostgresConfig.Database database = entry.getValue();
            pools.put(
                entry.getKey(),
                new BoundedConnectionPool(entry.getKey(), connections.apply(database), database.maxConnections(), database.acquireTimeout())
            );
        }
        logger.info("aliasByPostgres enabled for databases {}", pools.keySet());
        return FunctionRegistration.registered(new AliasByPostgresFunction(aliasConfig, pools), AliasByPostgresFunction.NAME);
    }
}
