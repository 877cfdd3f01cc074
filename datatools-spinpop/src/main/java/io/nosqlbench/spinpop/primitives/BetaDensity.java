package io.nosqlbench.spinpop.primitives;

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

import io.nosqlbench.spinpop.backend.ArrayBackend;
import org.apache.commons.math3.special.Beta;

/**
 * Beta distribution density rescaled to the support [0, scale].
 *
 * <h2>Definition</h2>
 *
 * <pre>{@code
 *              (x/s)^(α-1) · (1 - x/s)^(β-1)
 *   p(x) = ─────────────────────────────────     for 0 ≤ x ≤ s
 *                     s · B(α, β)
 *
 *   p(x) = 0                                      otherwise
 * }</pre>
 *
 * <p>Each rescaled density integrates to 1 over [0, scale], so products of
 * beta densities need no further normalization.
 *
 * <h2>Special Cases</h2>
 *
 * <ul>
 *   <li>α = β = 1: uniform density 1/scale</li>
 *   <li>α &lt; 1 or β &lt; 1: unbounded at the matching endpoint</li>
 * </ul>
 */
public final class BetaDensity {

    private BetaDensity() {
        // Utility class
    }

    /**
     * Evaluates the rescaled beta density at one point.
     *
     * @param x the value
     * @param alpha the first shape parameter (α); must be positive
     * @param beta the second shape parameter (β); must be positive
     * @param scale the upper end of the support; must be positive
     * @return the density at x
     * @throws IllegalArgumentException if alpha, beta or scale is not positive
     */
    public static double pdf(double x, double alpha, double beta, double scale) {
        validate(alpha, beta, scale);
        return pdf(x, alpha, beta, scale, logNormalization(alpha, beta, scale));
    }

    /**
     * Evaluates the rescaled beta density at every element of {@code x}.
     *
     * @param backend the array backend
     * @param x the values
     * @param alpha the first shape parameter (α); must be positive
     * @param beta the second shape parameter (β); must be positive
     * @param scale the upper end of the support; must be positive
     * @return the densities, zero outside [0, scale]
     * @throws IllegalArgumentException if alpha, beta or scale is not positive
     */
    public static double[] density(ArrayBackend backend, double[] x, double alpha, double beta, double scale) {
        validate(alpha, beta, scale);
        double logNorm = logNormalization(alpha, beta, scale);
        return backend.map(x, v -> pdf(v, alpha, beta, scale, logNorm));
    }

    private static double pdf(double x, double alpha, double beta, double scale, double logNorm) {
        if (!(x >= 0 && x <= scale)) {
            return 0.0;
        }
        double t = x / scale;
        return Math.pow(t, alpha - 1) * Math.pow(1 - t, beta - 1) * Math.exp(-logNorm);
    }

    private static double logNormalization(double alpha, double beta, double scale) {
        return Math.log(scale) + Beta.logBeta(alpha, beta);
    }

    private static void validate(double alpha, double beta, double scale) {
        if (!(alpha > 0)) {
            throw new IllegalArgumentException("Alpha must be positive, got: " + alpha);
        }
        if (!(beta > 0)) {
            throw new IllegalArgumentException("Beta must be positive, got: " + beta);
        }
        if (!(scale > 0)) {
            throw new IllegalArgumentException("Scale must be positive, got: " + scale);
        }
    }
}
