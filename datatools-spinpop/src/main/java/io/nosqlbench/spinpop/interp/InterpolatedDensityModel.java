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

import io.nosqlbench.spinpop.Dataset;
import io.nosqlbench.spinpop.DegenerateNormalizationException;
import io.nosqlbench.spinpop.DensityModel;
import io.nosqlbench.spinpop.Hyperparameters;
import io.nosqlbench.spinpop.backend.ArrayBackend;
import io.nosqlbench.spinpop.backend.ArrayBackends;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/// Non-parametric density built by interpolating log-density values at free nodes.
///
/// ## Definition
///
/// For each configured parameter `x` with base name `b`:
///
/// ```text
///   nodes   : (b0, fb0), (b1, fb1), ... , (b{n-1}, fb{n-1})    from the hyperparameters
///   s(x)    : spline through the nodes, held at the end values beyond them
///   p(x)    : exp(s(x)) / Z   on [minimum, maximum], 0 outside
///   Z       : trapz(exp(s), linspace(minimum, maximum, 1000))
/// ```
///
/// The joint density is the product of `p` over the configured parameters.
/// Node locations need not arrive sorted; they are ordered before
/// interpolation and must be distinct.
///
/// ## Example
///
/// ```java
/// DensityModel model = new InterpolatedDensityModel(InterpolationConfig.spinMagnitudeIdentical());
/// double[] density = model.evaluate(dataset, Hyperparameters.of(
///     "a0", 0.0, "a1", 0.25, "a2", 0.5, "a3", 0.75, "a4", 1.0,
///     "fa0", 0.0, "fa1", 0.5, "fa2", 0.3, "fa3", -0.2, "fa4", -1.0));
/// ```
public class InterpolatedDensityModel implements DensityModel {

    private static final Logger logger = LogManager.getLogger(InterpolatedDensityModel.class);

    /// Grid size used for the normalizing integral.
    public static final int NORMALIZATION_POINTS = 1000;

    private final InterpolationConfig config;
    private final ArrayBackend backend;
    private final Set<String> parameters;
    private final Set<String> hyperparameters;

    public InterpolatedDensityModel(InterpolationConfig config) {
        this(config, ArrayBackends.current());
    }

    public InterpolatedDensityModel(InterpolationConfig config, ArrayBackend backend) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
        this.parameters = Collections.unmodifiableSet(new LinkedHashSet<>(config.parameters()));
        Set<String> keys = new LinkedHashSet<>();
        for (String parameter : config.parameters()) {
            for (int i = 0; i < config.nodes(); i++) {
                keys.add(config.nodeKey(parameter, i));
            }
            for (int i = 0; i < config.nodes(); i++) {
                keys.add(config.valueKey(parameter, i));
            }
        }
        this.hyperparameters = Collections.unmodifiableSet(keys);
    }

    /// @throws io.nosqlbench.spinpop.MissingParameterException if a column or node key is absent
    /// @throws IllegalArgumentException if two node locations coincide
    /// @throws DegenerateNormalizationException if exp(spline) has no usable integral
    @Override
    public double[] evaluate(Dataset dataset, Hyperparameters hyperparameters) {
        Map<String, NormalizedSpline> splines = new HashMap<>();
        double[] result = null;
        for (String parameter : config.parameters()) {
            NormalizedSpline spline = splines.computeIfAbsent(config.baseName(parameter),
                base -> normalizedSpline(parameter, hyperparameters));
            double[] values = dataset.get(parameter);
            double[] density = backend.applyMask(backend.map(values, spline::density),
                backend.within(values, config.minimum(), config.maximum()));
            result = result == null ? density : backend.multiply(result, density);
        }
        return result;
    }

    private NormalizedSpline normalizedSpline(String parameter, Hyperparameters hyperparameters) {
        int n = config.nodes();
        double[] x = new double[n];
        double[] f = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = hyperparameters.get(config.nodeKey(parameter, i));
            f[i] = hyperparameters.get(config.valueKey(parameter, i));
        }
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> x[i]));
        double[] sortedX = new double[n];
        double[] sortedF = new double[n];
        for (int i = 0; i < n; i++) {
            sortedX[i] = x[order[i]];
            sortedF[i] = f[order[i]];
            if (i > 0 && !(sortedX[i] > sortedX[i - 1])) {
                throw new IllegalArgumentException("Interpolation nodes for " + config.baseName(parameter)
                    + " must be distinct, got: " + Arrays.toString(x));
            }
        }

        UnivariateFunction spline = config.kind().interpolator().interpolate(sortedX, sortedF);
        double low = sortedX[0];
        double high = sortedX[n - 1];
        UnivariateFunction unnormalized = value -> Math.exp(spline.value(Math.min(Math.max(value, low), high)));

        double[] grid = backend.linspace(config.minimum(), config.maximum(), NORMALIZATION_POINTS);
        double normalization = backend.trapz(backend.map(grid, unnormalized::value), grid);
        if (!DegenerateNormalizationException.isUsable(normalization)) {
            logger.warn("Spline normalization {} is unusable for {}", normalization, config.baseName(parameter));
            throw new DegenerateNormalizationException(
                config.kind().configName() + " spline in " + config.baseName(parameter), normalization);
        }
        logger.debug("Spline normalization {} for {}", normalization, config.baseName(parameter));
        return new NormalizedSpline(unnormalized, normalization);
    }

    @Override
    public Set<String> parameters() {
        return parameters;
    }

    @Override
    public Set<String> hyperparameters() {
        return hyperparameters;
    }

    public InterpolationConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "InterpolatedDensityModel[" + config + "]";
    }

    private static final class NormalizedSpline {
        private final UnivariateFunction unnormalized;
        private final double normalization;

        private NormalizedSpline(UnivariateFunction unnormalized, double normalization) {
            this.unnormalized = unnormalized;
            this.normalization = normalization;
        }

        double density(double x) {
            return unnormalized.value(x) / normalization;
        }
    }
}
