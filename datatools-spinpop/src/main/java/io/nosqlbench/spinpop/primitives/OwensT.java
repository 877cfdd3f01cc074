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

import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.analysis.integration.UnivariateIntegrator;
import org.apache.commons.math3.special.Erf;

/// Owen's T function, used for the skew-normal CDF.
///
/// ```text
///                 1     a   exp(-h²(1 + x²)/2)
///   T(h, a) = ─────  ∫   ────────────────────  dx
///               2π    0         1 + x²
///
///   T(h, -a) = -T(h, a)        T(-h, a) = T(h, a)
///   T(0, a)  = atan(a) / 2π    T(h, 1)  = Φ(h)(1 - Φ(h)) / 2
/// ```
///
/// For |a| ≤ 1 the integral is evaluated directly by Gauss-Legendre
/// quadrature. For |a| > 1 the reflection identity
///
/// ```text
///   T(h, a) = Q(h)/2 + Q(ah)/2 - Q(h)Q(ah) - T(ah, 1/a)      (h ≥ 0, a > 0, Q = 1 - Φ)
/// ```
///
/// maps the problem back onto an integration range of at most one. The
/// reflection is written in upper-tail probabilities so that T stays
/// relatively accurate for large h, where it is far below one ulp of Φ.
public final class OwensT {

    private static final int MAX_EVALUATIONS = 100_000;
    private static final double TWO_PI = 2.0 * Math.PI;

    private OwensT() {
        // Utility class
    }

    /// Evaluates T(h, a).
    ///
    /// @param h the first argument
    /// @param a the second argument
    /// @return T(h, a)
    public static double value(double h, double a) {
        if (Double.isNaN(h) || Double.isNaN(a)) {
            return Double.NaN;
        }
        if (a < 0) {
            return -value(h, -a);
        }
        double absH = Math.abs(h);
        if (a == 0) {
            return 0.0;
        }
        if (absH == 0) {
            return Math.atan(a) / TWO_PI;
        }
        if (Double.isInfinite(absH)) {
            return 0.0;
        }
        if (a <= 1.0) {
            return integrate(absH, a);
        }
        double ah = a * absH;
        double qH = standardNormalCdf(-absH);
        double qAH = standardNormalCdf(-ah);
        double reflected = Double.isInfinite(a) ? 0.0 : integrate(ah, 1.0 / a);
        return qH * (0.5 - qAH) + 0.5 * qAH - reflected;
    }

    private static double integrate(double h, double a) {
        double halfH2 = 0.5 * h * h;
        UnivariateIntegrator integrator = new IterativeLegendreGaussIntegrator(16, 1e-12, Double.MIN_NORMAL);
        double integral = integrator.integrate(MAX_EVALUATIONS,
            x -> Math.exp(-halfH2 * (1.0 + x * x)) / (1.0 + x * x), 0.0, a);
        return integral / TWO_PI;
    }

    static double standardNormalCdf(double x) {
        return 0.5 * Erf.erfc(-x / Math.sqrt(2.0));
    }
}
