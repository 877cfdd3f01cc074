package io.nosqlbench.spinpop.interp;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.spinpop.config.SpinPopGson;
import io.nosqlbench.spinpop.models.SpinParameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of an {@link InterpolatedDensityModel}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "parameters": ["a_1", "a_2"],
 *   "minimum": 0.0,
 *   "maximum": 1.0,
 *   "nodes": 5,
 *   "kind": "cubic",
 *   "identical": true
 * }
 * }</pre>
 *
 * <p>With {@code identical} set, every parameter reads the node keys of a shared
 * base name: the first parameter with a trailing {@code _1} removed. Otherwise
 * each parameter uses its own name as the base.
 */
public class InterpolationConfig {

    public static final int DEFAULT_NODES = 5;

    @SerializedName("parameters")
    private List<String> parameters;

    @SerializedName("minimum")
    private double minimum;

    @SerializedName("maximum")
    private double maximum;

    @SerializedName("nodes")
    private int nodes = DEFAULT_NODES;

    @SerializedName("kind")
    private InterpolationKind kind = InterpolationKind.CUBIC;

    @SerializedName("identical")
    private boolean identical = true;

    /** For Gson. */
    InterpolationConfig() {
    }

    public InterpolationConfig(List<String> parameters, double minimum, double maximum,
                               int nodes, InterpolationKind kind, boolean identical) {
        this.parameters = new ArrayList<>(Objects.requireNonNull(parameters, "parameters cannot be null"));
        this.minimum = minimum;
        this.maximum = maximum;
        this.nodes = nodes;
        this.kind = kind;
        this.identical = identical;
        validate();
    }

    /// Spline in both spin magnitudes on [0, 1], components sharing nodes `a0..a4`.
    public static InterpolationConfig spinMagnitudeIdentical() {
        return spinMagnitudeIdentical(DEFAULT_NODES, InterpolationKind.CUBIC);
    }

    public static InterpolationConfig spinMagnitudeIdentical(int nodes, InterpolationKind kind) {
        return new InterpolationConfig(List.of(SpinParameters.A_1, SpinParameters.A_2),
            SpinParameters.A_MIN, SpinParameters.A_MAX, nodes, kind, true);
    }

    /// Spline in both tilt cosines on [-1, 1], components sharing nodes `cos_tilt0..cos_tilt4`.
    public static InterpolationConfig spinTiltIdentical() {
        return spinTiltIdentical(DEFAULT_NODES, InterpolationKind.CUBIC);
    }

    public static InterpolationConfig spinTiltIdentical(int nodes, InterpolationKind kind) {
        return new InterpolationConfig(List.of(SpinParameters.COS_TILT_1, SpinParameters.COS_TILT_2),
            SpinParameters.COS_TILT_MIN, SpinParameters.COS_TILT_MAX, nodes, kind, true);
    }

    /// Spline in both spin magnitudes with separate nodes `a_10..` and `a_20..`.
    public static InterpolationConfig spinMagnitudeIndependent(int nodes, InterpolationKind kind) {
        return new InterpolationConfig(List.of(SpinParameters.A_1, SpinParameters.A_2),
            SpinParameters.A_MIN, SpinParameters.A_MAX, nodes, kind, false);
    }

    public static InterpolationConfig spinTiltIndependent(int nodes, InterpolationKind kind) {
        return new InterpolationConfig(List.of(SpinParameters.COS_TILT_1, SpinParameters.COS_TILT_2),
            SpinParameters.COS_TILT_MIN, SpinParameters.COS_TILT_MAX, nodes, kind, false);
    }

    /**
     * Parses a configuration from JSON.
     *
     * @throws JsonParseException if the JSON is malformed or empty
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public static InterpolationConfig fromJson(String json) {
        InterpolationConfig config = SpinPopGson.gson().fromJson(json, InterpolationConfig.class);
        if (config == null) {
            throw new JsonParseException("interpolation configuration is empty");
        }
        config.validate();
        return config;
    }

    public String toJson() {
        return SpinPopGson.gson().toJson(this);
    }

    private void validate() {
        if (parameters == null || parameters.isEmpty()) {
            throw new IllegalArgumentException("at least one parameter is required");
        }
        if (!(minimum < maximum)) {
            throw new IllegalArgumentException("minimum must be below maximum, got: [" + minimum + ", " + maximum + "]");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (nodes < kind.minimumNodes()) {
            throw new IllegalArgumentException(kind.configName() + " interpolation needs at least "
                + kind.minimumNodes() + " nodes, got: " + nodes);
        }
    }

    /**
     * Returns the hyperparameter base name the given parameter reads its nodes from.
     */
    public String baseName(String parameter) {
        if (identical) {
            String first = parameters.get(0);
            return first.endsWith("_1") ? first.substring(0, first.length() - 2) : first;
        }
        return parameter;
    }

    /// Hyperparameter key of the i-th node location.
    public String nodeKey(String parameter, int index) {
        return baseName(parameter) + index;
    }

    /// Hyperparameter key of the i-th log-density value.
    public String valueKey(String parameter, int index) {
        return "f" + baseName(parameter) + index;
    }

    public List<String> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public double minimum() {
        return minimum;
    }

    public double maximum() {
        return maximum;
    }

    public int nodes() {
        return nodes;
    }

    public InterpolationKind kind() {
        return kind;
    }

    public boolean identical() {
        return identical;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InterpolationConfig)) return false;
        InterpolationConfig that = (InterpolationConfig) o;
        return Double.compare(minimum, that.minimum) == 0
            && Double.compare(maximum, that.maximum) == 0
            && nodes == that.nodes
            && identical == that.identical
            && kind == that.kind
            && Objects.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, minimum, maximum, nodes, kind, identical);
    }

    @Override
    public String toString() {
        return "InterpolationConfig[parameters=" + parameters + ", range=[" + minimum + ", " + maximum
            + "], nodes=" + nodes + ", kind=" + kind.configName() + ", identical=" + identical + "]";
    }
}
