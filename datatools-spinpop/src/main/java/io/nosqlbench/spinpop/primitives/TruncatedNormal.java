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

import io.nosqlbench.spinpop.DegenerateNormalizationException;
import io.nosqlbench.spinpop.backend.ArrayBackend;
import org.apache.commons.math3.special.Erf;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Normal density truncated to [low, high] and renormalized.
 *
 * <h2>Definition</h2>
 *
 * <pre>{@code
 *                 φ((x - μ)/σ)
 *   p(x) = ───────────────────────     for low ≤ x ≤ high
 *           σ · (Φ(b) - Φ(a))
 *
 *   a = (low - μ)/σ,  b = (high - μ)/σ
 * }</pre>
 *
 * <p>The truncated mass {@code Φ(b) - Φ(a)} is computed as
 * {@code [erf(b/√2) - erf(a/√2)] / 2} with the two-argument {@link Erf#erf(double, double)},
 * which switches to erfc when both bounds sit in the same tail.
 */
public final class TruncatedNormal {

    private static final Logger logger = LogManager.getLogger(TruncatedNormal.class);

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2_PI = Math.sqrt(2.0 * Math.PI);

    private TruncatedNormal() {
        // Utility class
    }

    /**
     * Evaluates the truncated normal density at one point.
     *
     * @param x the value
     * @param mu the mean (μ) of the untruncated normal
     * @param sigma the standard deviation (σ); must be positive
     * @param high the upper truncation bound
     * @param low the lower truncation bound
     * @return the density at x, zero outside [low, high]
     * @throws IllegalArgumentException if sigma is not positive or low ≥ high
     * @throws DegenerateNormalizationException if [low, high] carries no probability mass
     */
    public static double pdf(double x, double mu, double sigma, double high, double low) {
        double norm = normalization(mu, sigma, high, low);
        return pdf(x, mu, sigma, high, low, norm);
    }

    /**
     * Evaluates the truncated normal density at every element of {@code x}.
     *
     * @param backend the array backend
     * @param x the values
     * @param mu the mean (μ) of the untruncated normal
     * @param sigma the standard deviation (σ); must be positive
     * @param high the upper truncation bound
     * @param low the lower truncation bound
     * @return the densities, zero outside [low, high]
     * @throws IllegalArgumentException if sigma is not positive or low ≥ high
     * @throws DegenerateNormalizationException if [low, high] carries no probability mass
     */
    public static double[] density(ArrayBackend backend, double[] x, double mu, double sigma,
                                   double high, double low) {
        double norm = normalization(mu, sigma, high, low);
        return backend.map(x, v -> pdf(v, mu, sigma, high, low, norm));
    }

    private static double pdf(double x, double mu, double sigma, double high, double low, double norm) {
        if (!(x >= low && x <= high)) {
            return 0.0;
        }
        double z = (x - mu) / sigma;
        return Math.exp(-0.5 * z * z) * norm;
    }

    /**
     * Returns the factor {@code 1 / (σ √(2π) (Φ(b) - Φ(a)))} applied to the Gaussian kernel.
     */
    static double normalization(double mu, double sigma, double high, double low) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("Standard deviation must be positive, got: " + sigma);
        }
        if (!(low < high)) {
            throw new IllegalArgumentException("Lower bound must be less than upper: " + low + " >= " + high);
        }
        double mass = 0.5 * Erf.erf((low - mu) / (SQRT_2 * sigma), (high - mu) / (SQRT_2 * sigma));
        if (!DegenerateNormalizationException.isUsable(mass)) {
            String context = "truncated normal(mu=" + mu + ", sigma=" + sigma + ", low=" + low + ", high=" + high + ")";
            logger.warn("No probability mass inside truncation interval for {}", context);
            throw new DegenerateNormalizationException(context, mass);
        }
        return 1.0 / (sigma * SQRT_2_PI * mass);
    }
}
