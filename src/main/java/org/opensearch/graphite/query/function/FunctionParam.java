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
import java.util.List;
import java.util.Objects;

/**
 * Description of a single function parameter. Optional attributes are omitted from the JSON when unset.
 */
public final class FunctionParam implements ToXContentObject {

    private final String name;
    private final FunctionType type;
    private boolean required;
    private boolean multiple;
    private List<Suggestion> options = List.of();
    private List<Suggestion> suggestions = List.of();
    private Suggestion defaultValue;

    private FunctionParam(String name, FunctionType type) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
    }

    public static FunctionParam of(String name, FunctionType type) {
        return new FunctionParam(name, type);
    }

    /**
     * Shortcut for the usual required {@code seriesList} first parameter.
     */
    public static FunctionParam seriesList() {
        return of("seriesList", FunctionType.SERIES_LIST).required();
    }

    public FunctionParam required() {
        this.required = true;
        return this;
    }

    public FunctionParam multiple() {
        this.multiple = true;
        return this;
    }

    public FunctionParam options(Object... values) {
        this.options = Suggestion.listOf(values);
        return this;
    }

    public FunctionParam suggestions(Object... values) {
        this.suggestions = Suggestion.listOf(values);
        return this;
    }

    public FunctionParam defaultValue(Object value) {
        this.defaultValue = Suggestion.of(value);
        return this;
    }

    public String getName() {
        return name;
    }

    public FunctionType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isMultiple() {
        return multiple;
    }

    public List<Suggestion> getOptions() {
        return options;
    }

    public List<Suggestion> getSuggestions() {
        return suggestions;
    }

    public Suggestion getDefaultValue() {
        return defaultValue;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("name", name);
        if (multiple) {
            builder.field("multiple", true);
        }
        if (required) {
            builder.field("required", true);
        }
        builder.field("type", type.jsonName());
        writeSuggestions(builder, "options", options);
        writeSuggestions(builder, "suggestions", suggestions);
        if (defaultValue != null) {
            builder.field("default", defaultValue.value());
        }
        return builder.endObject();
    }

    private static void writeSuggestions(XContentBuilder builder, String field, List<Suggestion> values) throws IOException {
        if (values.isEmpty()) {
            return;
        }
        builder.startArray(field);
        for (Suggestion suggestion : values) {
            builder.value(suggestion.value());
        }
        builder.endArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FunctionParam that = (FunctionParam) o;
        return required == that.required
            && multiple == that.multiple
            && name.equals(that.name)
            && type == that.type
            && options.equals(that.options)
            && suggestions.equals(that.suggestions)
            && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, required, multiple, options, suggestions, defaultValue);
    }
}
