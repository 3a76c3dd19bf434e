/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

/**
 * Constructs a function family from the engine configuration.
 */
@FunctionalInterface
public interface FunctionProvider {

    /**
     * @param config engine configuration, including paths of optional function config files
     * @return the names to register, or a disabled registration with its reason
     */
    FunctionRegistration create(EngineConfig config);
}
