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

import com.google.gson.annotations.SerializedName;
import org.apache.commons.math3.analysis.interpolation.AkimaSplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;

import java.util.Locale;

/**
 * Interpolation schemes available to {@link InterpolatedDensityModel}.
 */
public enum InterpolationKind {

    /** Piecewise linear through the nodes. */
    @SerializedName("linear")
    LINEAR("linear", 2),

    /** Natural cubic spline. */
    @SerializedName("cubic")
    CUBIC("cubic", 3),

    /** Akima spline, less prone to overshoot near sharp features. */
    @SerializedName("akima")
    AKIMA("akima", 5);

    private final String configName;
    private final int minimumNodes;

    InterpolationKind(String configName, int minimumNodes) {
        this.configName = configName;
        this.minimumNodes = minimumNodes;
    }

    public String configName() {
        return configName;
    }

    /// Fewest nodes the underlying interpolator accepts.
    public int minimumNodes() {
        return minimumNodes;
    }

    UnivariateInterpolator interpolator() {
        switch (this) {
            case LINEAR:
                return new LinearInterpolator();
            case CUBIC:
                return new SplineInterpolator();
            case AKIMA:
                return new AkimaSplineInterpolator();
            default:
                throw new IllegalStateException("Unhandled interpolation kind: " + this);
        }
    }

    /**
     * Parses a configuration name such as {@code "cubic"}.
     *
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static InterpolationKind fromConfigName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (InterpolationKind kind : values()) {
                if (kind.configName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown interpolation kind '" + name + "', expected one of linear, cubic, akima");
    }
}
