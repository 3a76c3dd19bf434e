/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.common.util.io.IOUtils;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable table of functions keyed by name.
 *
 * <p>A registry is built once at startup with {@link Builder} and handed to the evaluator. Several independent
 * registries may coexist, e.g. one per test.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * FunctionRegistry registry = FunctionRegistry.builder()
 *     .register("scale", new ScaleFunction())
 *     .register(new AliasByPostgresProvider(), config)
 *     .build();
 * }</pre>
 */
public final class FunctionRegistry implements Closeable {

    private static final Logger logger = LogManager.getLogger(FunctionRegistry.class);

    private final Map<String, GraphiteFunction> functions;
    private final Map<String, String> disabled;

    private FunctionRegistry(Map<String, GraphiteFunction> functions, Map<String, String> disabled) {
        this.functions = Collections.unmodifiableMap(new TreeMap<>(functions));
        this.disabled = Collections.unmodifiableMap(new TreeMap<>(disabled));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the function registered under {@code name}, or {@code null}
     */
    public GraphiteFunction get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return functions.keySet();
    }

    /**
     * @return names of functions that opted out at construction, with the reason
     */
    public Map<String, String> disabledFunctions() {
        return disabled;
    }

    /**
     * @return metadata of {@code name}, or {@code null} if it is not registered or undocumented
     */
    public FunctionDescription description(String name) {
        GraphiteFunction function = functions.get(name);
        return function == null ? null : function.description().get(name);
    }

    /**
     * @return metadata of every registered name, sorted by name
     */
    public Map<String, FunctionDescription> descriptions() {
        Map<String, FunctionDescription> result = new TreeMap<>();
        for (Map.Entry<String, GraphiteFunction> entry : functions.entrySet()) {
            FunctionDescription description = entry.getValue().description().get(entry.getKey());
            if (description != null) {
                result.put(entry.getKey(), description);
            }
        }
        return result;
    }

    public int size() {
        return functions.size();
    }

    @Override
    public void close() throws IOException {
        Map<GraphiteFunction, Boolean> seen = new IdentityHashMap<>();
        List<Closeable> resources = new ArrayList<>();
        for (GraphiteFunction function : functions.values()) {
            if (function instanceof Closeable && seen.put(function, Boolean.TRUE) == null) {
                resources.add((Closeable) function);
            }
        }
        IOUtils.close(resources);
    }

    /**
     * Builder for {@link FunctionRegistry}. Registering a name twice is an error.
     */
    public static final class Builder {
        private final Map<String, GraphiteFunction> functions = new TreeMap<>();
        private final Map<String, String> disabled = new TreeMap<>();

        private Builder() {}

        public Builder register(String name, GraphiteFunction function) {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(function, "function cannot be null");
            GraphiteFunction previous = functions.putIfAbsent(name, function);
            if (previous != null) {
                throw new IllegalArgumentException("function [" + name + "] is already registered");
            }
            return this;
        }

        public Builder register(FunctionRegistration registration) {
            if (registration.isDisabled()) {
                logger.warn(
                    "Function [{}] is disabled: {}",
                    registration.getDisabledName(),
                    registration.getDisabledReason()
                );
                disabled.put(registration.getDisabledName(), registration.getDisabledReason());
                return this;
            }
            for (FunctionMetadata metadata : registration.getFunctions()) {
                register(metadata.name(), metadata.function());
            }
            return this;
        }

        public Builder register(FunctionProvider provider, EngineConfig config) {
            return register(provider.create(config));
        }

        public FunctionRegistry build() {
            FunctionRegistry registry = new FunctionRegistry(functions, disabled);
            logger.info("Built function registry with {} functions, {} disabled", registry.size(), disabled.size());
            return registry;
        }
    }
}
