/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.core.model;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.graphite.query.consolidation.ConsolidatedValues;
import org.opensearch.graphite.query.consolidation.ConsolidationFunctions;
import org.opensearch.graphite.query.consolidation.ConsolidationPolicy;
import org.opensearch.graphite.query.consolidation.Consolidator;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A single time series as seen by Graphite functions.
 *
 * <p>The series covers the half-open interval {@code [startTime, stopTime)} in epoch seconds with one sample
 * every {@code stepTime} seconds. Every sample has a value and an absence flag; an absent sample means
 * "no data" whatever double is stored for it.</p>
 *
 * <h2>Ownership:</h2>
 * <p>Identity, time range and sample buffers are immutable. Functions never modify a series they received;
 * they derive a new one through {@link #toBuilder()} with freshly allocated buffers. Accessors that expose
 * buffers return copies.</p>
 *
 * <h2>Display state:</h2>
 * <p>{@link #setValuesPerPoint(int, ConsolidationPolicy)} is the only mutation. It records the consolidation
 * factor chosen by {@link Consolidator}; the consolidated view is computed lazily and cached.</p>
 *
 * <h2>Tags:</h2>
 * <p>Tags always contain {@code "name"}, the metric name before any alias was applied. Tags are extracted
 * from names in the {@code path;tag1=value1;tag2=value2} form.</p>
 */
public class MetricData implements Writeable, ToXContentObject {

    /** Tag holding the original metric name. */
    public static final String NAME_TAG = "name";

    /** Consolidation function used when none is specified. */
    public static final String DEFAULT_CONSOLIDATION = "avg";

    private final String name;
    private final String pathExpression;
    private final Map<String, String> tags;
    private final long startTime;
    private final long stopTime;
    private final long stepTime;
    private final double[] values;
    private final boolean[] absent;
    private final String consolidationFunc;
    private final float xFilesFactor;

    private volatile int valuesPerPoint = 1;
    private volatile ConsolidationPolicy consolidationPolicy = ConsolidationPolicy.defaultPolicy();
    private volatile ConsolidatedValues consolidated;

    private MetricData(Builder builder) {
        this.name = builder.name;
        this.pathExpression = builder.pathExpression;
        this.tags = Collections.unmodifiableMap(new TreeMap<>(builder.tags));
        this.startTime = builder.startTime;
        this.stepTime = builder.stepTime;
        this.values = builder.values;
        this.absent = builder.absent;
        this.stopTime = builder.stopTime != null ? builder.stopTime : builder.startTime + (long) builder.values.length * builder.stepTime;
        this.consolidationFunc = builder.consolidationFunc;
        this.xFilesFactor = builder.xFilesFactor;
        this.valuesPerPoint = builder.valuesPerPoint;
        this.consolidationPolicy = builder.consolidationPolicy;
        if (stopTime < startTime) {
            throw new IllegalArgumentException("stopTime " + stopTime + " must not be before startTime " + startTime);
        }
    }

    /**
     * Create a series from raw values; NaN values are marked absent.
     *
     * @param name metric name, tags are extracted from it
     * @param startTime first timestamp
     * @param stepTime seconds between samples
     * @param values samples
     * @return the series
     */
    public static MetricData of(String name, long startTime, long stepTime, double... values) {
        return builder(name).startTime(startTime).stepTime(stepTime).values(values).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Read a series from a stream written by {@link #writeTo(StreamOutput)}.
     */
    public MetricData(StreamInput in) throws IOException {
        this.name = in.readString();
        this.pathExpression = in.readOptionalString();
        this.tags = Collections.unmodifiableMap(new TreeMap<>(in.readMap(StreamInput::readString, StreamInput::readString)));
        this.startTime = in.readLong();
        this.stopTime = in.readLong();
        this.stepTime = in.readVLong();
        this.values = in.readDoubleArray();
        int absentLength = in.readVInt();
        this.absent = new boolean[absentLength];
        for (int i = 0; i < absentLength; i++) {
            absent[i] = in.readBoolean();
        }
        this.consolidationFunc = in.readString();
        this.xFilesFactor = in.readFloat();
        this.valuesPerPoint = in.readVInt();
        this.consolidationPolicy = new ConsolidationPolicy(in.readBoolean(), in.readBoolean());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(name);
        out.writeOptionalString(pathExpression);
        out.writeMap(tags, StreamOutput::writeString, StreamOutput::writeString);
        out.writeLong(startTime);
        out.writeLong(stopTime);
        out.writeVLong(stepTime);
        out.writeDoubleArray(values);
        out.writeVInt(absent.length);
        for (boolean a : absent) {
            out.writeBoolean(a);
        }
        out.writeString(consolidationFunc);
        out.writeFloat(xFilesFactor);
        out.writeVInt(valuesPerPoint);
        out.writeBoolean(consolidationPolicy.nudgeStartTime());
        out.writeBoolean(consolidationPolicy.useBucketsHighestTimestamp());
    }

    /**
     * Render the series in the Graphite render API JSON shape using the consolidated view:
     * {@code {"target": name, "datapoints": [[value|null, timestamp], ...], "tags": {...}, "step": step}}.
     */
    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        ConsolidatedValues view = getConsolidatedValues();
        builder.startObject();
        builder.field("target", name);
        builder.startArray("datapoints");
        for (int i = 0; i < view.size(); i++) {
            builder.startArray();
            double v = view.values()[i];
            if (view.absent()[i] || Double.isInfinite(v)) {
                builder.nullValue();
            } else {
                builder.value(v);
            }
            builder.value(view.timestampAt(i));
            builder.endArray();
        }
        builder.endArray();
        builder.startObject("tags");
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            builder.field(tag.getKey(), tag.getValue());
        }
        builder.endObject();
        builder.field("step", view.stepTime());
        builder.endObject();
        return builder;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the pattern this series was fetched for, or null for derived series
     */
    public String getPathExpression() {
        return pathExpression;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    /**
     * @return the {@code name} tag, falling back to the display name
     */
    public String getNameTag() {
        return tags.getOrDefault(NAME_TAG, name);
    }

    public long getStartTime() {
        return startTime;
    }

    public long getStopTime() {
        return stopTime;
    }

    public long getStepTime() {
        return stepTime;
    }

    public int size() {
        return values.length;
    }

    public double getValue(int index) {
        return values[index];
    }

    public boolean isAbsent(int index) {
        return absent[index];
    }

    /**
     * @return the value at {@code index}, or NaN if the sample is absent
     */
    public double valueOrNaN(int index) {
        return absent[index] ? Double.NaN : values[index];
    }

    /**
     * @return a copy of the values with absent samples replaced by NaN
     */
    public double[] valuesWithNaN() {
        double[] copy = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = absent[i] ? Double.NaN : values[i];
        }
        return copy;
    }

    /**
     * @return a copy of the stored values
     */
    public double[] getValues() {
        return values.clone();
    }

    /**
     * @return a copy of the absence mask
     */
    public boolean[] getAbsent() {
        return absent.clone();
    }

    /**
     * @return the index of the last present sample, or -1 if every sample is absent
     */
    public int lastPresentIndex() {
        for (int i = values.length - 1; i >= 0; i--) {
            if (!absent[i]) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return true if at least one sample is present
     */
    public boolean hasPresentValues() {
        return lastPresentIndex() >= 0;
    }

    public String getConsolidationFunc() {
        return consolidationFunc;
    }

    public float getXFilesFactor() {
        return xFilesFactor;
    }

    public int getValuesPerPoint() {
        return valuesPerPoint;
    }

    public ConsolidationPolicy getConsolidationPolicy() {
        return consolidationPolicy;
    }

    /**
     * Record the consolidation factor and placement policy; drops the cached consolidated view.
     */
    public void setValuesPerPoint(int valuesPerPoint, ConsolidationPolicy policy) {
        synchronized (this) {
            this.valuesPerPoint = Math.max(1, valuesPerPoint);
            this.consolidationPolicy = Objects.requireNonNull(policy, "policy cannot be null");
            this.consolidated = null;
        }
    }

    /**
     * @return the consolidated view, computed on first access
     */
    public ConsolidatedValues getConsolidatedValues() {
        ConsolidatedValues view = consolidated;
        if (view == null) {
            synchronized (this) {
                view = consolidated;
                if (view == null) {
                    view = Consolidator.bucketize(
                        this,
                        valuesPerPoint,
                        consolidationPolicy,
                        ConsolidationFunctions.forName(consolidationFunc)
                    );
                    consolidated = view;
                }
            }
        }
        return view;
    }

    /**
     * @return step between consolidated points
     */
    public long getAggregatedTimeStep() {
        return valuesPerPoint <= 1 ? stepTime : stepTime * valuesPerPoint;
    }

    /**
     * @return a builder initialised with every attribute of this series
     */
    public Builder toBuilder() {
        Builder builder = new Builder(name);
        builder.pathExpression = pathExpression;
        builder.tags = new TreeMap<>(tags);
        builder.startTime = startTime;
        builder.stopTime = stopTime;
        builder.stepTime = stepTime;
        builder.values = values;
        builder.absent = absent;
        builder.consolidationFunc = consolidationFunc;
        builder.xFilesFactor = xFilesFactor;
        builder.valuesPerPoint = valuesPerPoint;
        builder.consolidationPolicy = consolidationPolicy;
        return builder;
    }

    /**
     * @return a series sharing everything with this one but the display name
     */
    public MetricData withName(String newName) {
        return toBuilder().name(newName).build();
    }

    /**
     * @return a series with the display name and the {@code name} tag both set to {@code newName}
     */
    public MetricData withNameAndTag(String newName) {
        return toBuilder().name(newName).tag(NAME_TAG, newName).build();
    }

    /**
     * Extract tags from a {@code path;tag=value} style name. The {@code name} tag is the path part.
     */
    public static Map<String, String> extractTags(String name) {
        Map<String, String> result = new TreeMap<>();
        int separator = name.indexOf(';');
        if (separator < 0) {
            result.put(NAME_TAG, name);
            return result;
        }
        result.put(NAME_TAG, name.substring(0, separator));
        for (String pair : name.substring(separator + 1).split(";")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                result.put(pair.substring(0, eq), pair.substring(eq + 1));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MetricData that = (MetricData) o;
        return startTime == that.startTime
            && stopTime == that.stopTime
            && stepTime == that.stepTime
            && Float.compare(that.xFilesFactor, xFilesFactor) == 0
            && name.equals(that.name)
            && Objects.equals(pathExpression, that.pathExpression)
            && tags.equals(that.tags)
            && Arrays.equals(values, that.values)
            && Arrays.equals(absent, that.absent)
            && consolidationFunc.equals(that.consolidationFunc);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, pathExpression, tags, startTime, stopTime, stepTime, consolidationFunc, xFilesFactor);
        result = 31 * result + Arrays.hashCode(values);
        result = 31 * result + Arrays.hashCode(absent);
        return result;
    }

    @Override
    public String toString() {
        return "MetricData{name='"
            + name
            + "', start="
            + startTime
            + ", stop="
            + stopTime
            + ", step="
            + stepTime
            + ", values="
            + Arrays.toString(valuesWithNaN())
            + ", tags="
            + tags
            + "}";
    }

    /**
     * Builder for {@link MetricData}. Buffers passed in are owned by the built series and must not be modified
     * afterwards.
     */
    public static final class Builder {
        private String name;
        private String pathExpression;
        private Map<String, String> tags;
        private long startTime;
        private Long stopTime;
        private long stepTime = 1;
        private double[] values = new double[0];
        private boolean[] absent = new boolean[0];
        private String consolidationFunc = DEFAULT_CONSOLIDATION;
        private float xFilesFactor;
        private int valuesPerPoint = 1;
        private ConsolidationPolicy consolidationPolicy = ConsolidationPolicy.defaultPolicy();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
            this.tags = extractTags(name);
        }

        /**
         * Set the display name; tags are left as they are.
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
            return this;
        }

        public Builder pathExpression(String pathExpression) {
            this.pathExpression = pathExpression;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = new TreeMap<>(tags);
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public Builder startTime(long startTime) {
            this.startTime = startTime;
            return this;
        }

        /**
         * Set the stop time explicitly. When not set it is derived as {@code start + size * step}.
         */
        public Builder stopTime(long stopTime) {
            this.stopTime = stopTime;
            return this;
        }

        /**
         * Derive the stop time from start, step and the number of samples on build.
         */
        public Builder deriveStopTime() {
            this.stopTime = null;
            return this;
        }

        public Builder stepTime(long stepTime) {
            if (stepTime <= 0) {
                throw new IllegalArgumentException("stepTime must be positive, got " + stepTime);
            }
            this.stepTime = stepTime;
            return this;
        }

        /**
         * Set the samples; NaN values are marked absent.
         */
        public Builder values(double[] values) {
            boolean[] mask = new boolean[values.length];
            for (int i = 0; i < values.length; i++) {
                mask[i] = Double.isNaN(values[i]);
            }
            this.values = values;
            this.absent = mask;
            return this;
        }

        /**
         * Set the samples and their absence mask.
         */
        public Builder values(double[] values, boolean[] absent) {
            if (values.length != absent.length) {
                throw new IllegalArgumentException(
                    "values and absent mask must have the same length, got " + values.length + " and " + absent.length
                );
            }
            this.values = values;
            this.absent = absent;
            return this;
        }

        public Builder consolidationFunc(String consolidationFunc) {
            this.consolidationFunc = Objects.requireNonNull(consolidationFunc, "consolidationFunc cannot be null");
            return this;
        }

        public Builder xFilesFactor(float xFilesFactor) {
            this.xFilesFactor = xFilesFactor;
            return this;
        }

        /**
         * Reset display state; used by functions that produce values at a new resolution.
         */
        public Builder resetValuesPerPoint() {
            this.valuesPerPoint = 1;
            this.consolidationPolicy = ConsolidationPolicy.defaultPolicy();
            return this;
        }

        public MetricData build() {
            return new MetricData(this);
        }
    }
}
