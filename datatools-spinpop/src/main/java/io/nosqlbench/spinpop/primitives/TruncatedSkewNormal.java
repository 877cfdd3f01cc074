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
 * Skew-normal density truncated to [low, high] and renormalized.
 *
 * <h2>Definition</h2>
 *
 * <pre>{@code
 *   z = (x - μ)/σ
 *
 *   skew-normal:   f(x) = (2/σ) φ(z) Φ(αz) = (1/σ) φ(z) (1 + erf(αz/√2))
 *   CDF:           F(x) = Φ(z) - 2 T(z, α)            (T = Owen's T)
 *   mass:          F(high) - F(low) = [Φ(b) - Φ(a)] - 2 [T(b, α) - T(a, α)]
 *
 *                      f(x)
 *   truncated:  p(x) = ───────────────────    for low ≤ x ≤ high
 *                      F(high) - F(low)
 * }</pre>
 *
 * <p>With α = 0 this is exactly {@link TruncatedNormal}.
 */
public final class TruncatedSkewNormal {

    private static final Logger logger = LogManager.getLogger(TruncatedSkewNormal.class);

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2_PI = Math.sqrt(2.0 * Math.PI);

    private TruncatedSkewNormal() {
        // Utility class
    }

    /**
     * Evaluates the truncated skew-normal density at one point.
     *
     * @param x the value
     * @param mu the location (μ)
     * @param sigma the scale (σ); must be positive
     * @param alpha the skewness (α); positive values skew to the right
     * @param high the upper truncation bound
     * @param low the lower truncation bound
     * @return the density at x, zero outside [low, high]
     * @throws IllegalArgumentException if sigma is not positive or low ≥ high
     * @throws DegenerateNormalizationException if [low, high] carries no probability mass
     */
    public static double pdf(double x, double mu, double sigma, double alpha, double high, double low) {
        double mass = truncatedMass(mu, sigma, alpha, high, low);
        return pdf(x, mu, sigma, alpha, high, low, mass);
    }

    /**
     * Evaluates the truncated skew-normal density at every element of {@code x}.
     *
     * @see #pdf(double, double, double, double, double, double)
     */
    public static double[] density(ArrayBackend backend, double[] x, double mu, double sigma, double alpha,
                                   double high, double low) {
        double mass = truncatedMass(mu, sigma, alpha, high, low);
        return backend.map(x, v -> pdf(v, mu, sigma, alpha, high, low, mass));
    }

    private static double pdf(double x, double mu, double sigma, double alpha,
                              double high, double low, double mass) {
        if (!(x >= low && x <= high)) {
            return 0.0;
        }
        double z = (x - mu) / sigma;
        double skewed = Math.exp(-0.5 * z * z) * (1.0 + Erf.erf(alpha * z / SQRT_2)) / (sigma * SQRT_2_PI);
        return skewed / mass;
    }

    /**
     * Returns the untruncated skew-normal CDF at x.
     */
    public static double cdf(double x, double mu, double sigma, double alpha) {
        double z = (x - mu) / sigma;
        return OwensT.standardNormalCdf(z) - 2.0 * OwensT.value(z, alpha);
    }

    static double truncatedMass(double mu, double sigma, double alpha, double high, double low) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("Standard deviation must be positive, got: " + sigma);
        }
        if (!(low < high)) {
            throw new IllegalArgumentException("Lower bound must be less than upper: " + low + " >= " + high);
        }
        double zLow = (low - mu) / sigma;
        double zHigh = (high - mu) / sigma;
        // F(high) - F(low) with the Φ difference taken directly, so bounds far in the upper tail keep their mass
        double mass = 0.5 * Erf.erf(zLow / SQRT_2, zHigh / SQRT_2)
            - 2.0 * (OwensT.value(zHigh, alpha) - OwensT.value(zLow, alpha));
        if (!DegenerateNormalizationException.isUsable(mass)) {
            String context = "truncated skew normal(mu=" + mu + ", sigma=" + sigma + ", alpha=" + alpha
                + ", low=" + low + ", high=" + high + ")";
            logger.warn("No probability mass inside truncation interval for {}", context);
            throw new DegenerateNormalizationException(context, mass);
        }
        return mass;
    }
}
