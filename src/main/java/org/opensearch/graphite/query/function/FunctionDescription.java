/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.function;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Static metadata of a function, as published by the functions endpoint.
 *
 * <p>The JSON layout ({@code description, function, group, module, name, params}) is consumed by external
 * compatibility tooling and must stay stable. The change flags describe what the function does to its input and
 * are only rendered when set.</p>
 */
public final class FunctionDescription implements ToXContentObject {

    /** Module reported for every built-in function. */
    public static final String DEFAULT_MODULE = "graphite.render.functions";

    private final String name;
    private final String function;
    private final String description;
    private final String group;
    private final String module;
    private final List<FunctionParam> params;
    private final boolean aggregated;
    private final boolean nameChange;
    private final boolean nameTagChange;
    private final boolean valuesChange;

    private FunctionDescription(Builder builder) {
        this.name = builder.name;
        this.function = builder.function;
        this.description = builder.description;
        this.group = builder.group;
        this.module = builder.module;
        this.params = List.copyOf(builder.params);
        this.aggregated = builder.aggregated;
        this.nameChange = builder.nameChange;
        this.nameTagChange = builder.nameTagChange;
        this.valuesChange = builder.valuesChange;
    }

    /**
     * @param name function name as registered
     * @param function signature string, e.g. {@code scale(seriesList, factor)}
     */
    public static Builder builder(String name, String function) {
        return new Builder(name, function);
    }

    public String getName() {
        return name;
    }

    public String getFunction() {
        return function;
    }

    public String getDescription() {
        return description;
    }

    public String getGroup() {
        return group;
    }

    public String getModule() {
        return module;
    }

    public List<FunctionParam> getParams() {
        return params;
    }

    public boolean isAggregated() {
        return aggregated;
    }

    public boolean isNameChange() {
        return nameChange;
    }

    public boolean isNameTagChange() {
        return nameTagChange;
    }

    public boolean isValuesChange() {
        return valuesChange;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params xParams) throws IOException {
        builder.startObject();
        builder.field("description", description);
        builder.field("function", function);
        builder.field("group", group);
        builder.field("module", module);
        builder.field("name", name);
        if (!params.isEmpty()) {
            builder.startArray("params");
            for (FunctionParam param : params) {
                param.toXContent(builder, xParams);
            }
            builder.endArray();
        }
        builder.field("proxied", false);
        if (aggregated) {
            builder.field("aggregate", true);
        }
        if (nameChange) {
            builder.field("name-change", true);
        }
        if (nameTagChange) {
            builder.field("name-tag-change", true);
        }
        if (valuesChange) {
            builder.field("values-change", true);
        }
        return builder.endObject();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionDescription that = (FunctionDescription) o;
        return aggregated == that.aggregated
            && nameChange == that.nameChange
            && nameTagChange == that.nameTagChange
            && valuesChange == that.valuesChange
            && name.equals(that.name)
            && function.equals(that.function)
            && description.equals(that.description)
            && group.equals(that.group)
            && module.equals(that.module)
            && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, function, description, group, module, params, aggregated, nameChange, nameTagChange, valuesChange);
    }

    /**
     * Builder for {@link FunctionDescription}.
     */
    public static final class Builder {
        private final String name;
        private final String function;
        private String description = "";
        private String group = "";
        private String module = DEFAULT_MODULE;
        private final List<FunctionParam> params = new ArrayList<>();
        private boolean aggregated;
        private boolean nameChange;
        private boolean nameTagChange;
        private boolean valuesChange;

        private Builder(String name, String function) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
            this.function = Objects.requireNonNull(function, "function cannot be null");
        }

        public Builder description(String description) {
            this.description = Objects.requireNonNull(description);
            return this;
        }

        public Builder group(String group) {
            this.group = Objects.requireNonNull(group);
            return this;
        }

        public Builder module(String module) {
            this.module = Objects.requireNonNull(module);
            return this;
        }

        public Builder param(FunctionParam param) {
            this.params.add(param);
            return this;
        }

        public Builder aggregated() {
            this.aggregated = true;
            return this;
        }

        public Builder nameChange() {
            this.nameChange = true;
            return this;
        }

        public Builder nameTagChange() {
            this.nameTagChange = true;
            return this;
        }

        public Builder valuesChange() {
            this.valuesChange = true;
            return this;
        }

        public FunctionDescription build() {
            return new FunctionDescription(this);
        }
    }
}
