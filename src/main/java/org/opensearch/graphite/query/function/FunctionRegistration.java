/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of constructing a function family: either the names to register, or the reason it was disabled.
 *
 * <p>Functions backed by optional external resources return {@link #disabled(String, String)} when their configuration
 * is missing or turned off, so the registry can report why they are unavailable.</p>
 */
public final class FunctionRegistration {

    private final List<FunctionMetadata> functions;
    private final String disabledName;
    private final String disabledReason;

    private FunctionRegistration(List<FunctionMetadata> functions, String disabledName, String disabledReason) {
        this.functions = functions;
        this.disabledName = disabledName;
        this.disabledReason = disabledReason;
    }

    public static FunctionRegistration registered(List<FunctionMetadata> functions) {
        if (functions.isEmpty()) {
            throw new IllegalArgumentException("a registration needs at least one function");
        }
        return new FunctionRegistration(List.copyOf(functions), null, null);
    }

    /**
     * Register {@code function} under each of {@code names}.
     */
    public static FunctionRegistration registered(GraphiteFunction function, String... names) {
        FunctionMetadata[] metadata = new FunctionMetadata[names.length];
        for (int i = 0; i < names.length; i++) {
            metadata[i] = new FunctionMetadata(names[i], function);
        }
        return registered(List.of(metadata));
    }

    /**
     * @param name name the function would have been registered under
     * @param reason why it is unavailable, e.g. a missing config file
     */
    public static FunctionRegistration disabled(String name, String reason) {
        return new FunctionRegistration(
            List.of(),
            Objects.requireNonNull(name, "name cannot be null"),
            Objects.requireNonNull(reason, "reason cannot be null")
        );
    }

    public boolean isDisabled() {
        return disabledReason != null;
    }

    public List<FunctionMetadata> getFunctions() {
        return functions;
    }

    public String getDisabledName() {
        return disabledName;
    }

    public String getDisabledReason() {
        return disabledReason;
    }
}
