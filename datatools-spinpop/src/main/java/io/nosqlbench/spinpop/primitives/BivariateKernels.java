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
import org.apache.commons.math3.special.Erf;

/**
 * Unnormalized bivariate Gaussian and skew-Gaussian kernels.
 *
 * <h2>Gaussian Kernel</h2>
 *
 * <p>With covariance matrix
 * <pre>{@code
 *   Σ = | σx²      ρ σx σy |
 *       | ρ σx σy  σy²     |
 *
 *   rx = (μx - x) σy,   ry = (μy - y) σx,   det = σx² σy² (1 - ρ²)
 *
 *   k(x, y) = exp( -(rx² + ry² - 2 ρ rx ry) / (2 det) )
 * }</pre>
 *
 * <p>The kernel peaks at 1 at (μx, μy). It carries no normalizing constant;
 * on a truncated support that constant has no closed form when ρ ≠ 0 and is
 * computed by quadrature in the effective-spin models.
 *
 * <h2>Skew-Gaussian Kernel</h2>
 *
 * <pre>{@code
 *   s(x, y) = k(x, y) · (1 + erf(αx zx / √2)) · (1 + erf(αy zy / √2))
 *   zx = (x - μx)/σx,   zy = (y - μy)/σy
 * }</pre>
 *
 * <p>At ρ = 0 the skew kernel factorizes into two skew-normal shapes, matching
 * {@link TruncatedSkewNormal} once normalized.
 */
public final class BivariateKernels {

    private static final double SQRT_2 = Math.sqrt(2.0);

    private BivariateKernels() {
        // Utility class
    }

    /**
     * Evaluates the Gaussian kernel at one point.
     *
     * @throws IllegalArgumentException if a sigma is not positive or |ρ| ≥ 1
     */
    public static double gaussian(double x, double y, double muX, double muY,
                                  double sigmaX, double sigmaY, double rho) {
        validate(sigmaX, sigmaY, rho);
        return gaussianKernel(x, y, muX, muY, sigmaX, sigmaY, rho);
    }

    /**
     * Evaluates the Gaussian kernel at paired points.
     */
    public static double[] gaussian(ArrayBackend backend, double[] x, double[] y, double muX, double muY,
                                    double sigmaX, double sigmaY, double rho) {
        validate(sigmaX, sigmaY, rho);
        return backend.zip(x, y, (xv, yv) -> gaussianKernel(xv, yv, muX, muY, sigmaX, sigmaY, rho));
    }

    /**
     * Evaluates the Gaussian kernel over a mesh.
     */
    public static double[][] gaussian(ArrayBackend backend, double[][] xGrid, double[][] yGrid, double muX, double muY,
                                      double sigmaX, double sigmaY, double rho) {
        validate(sigmaX, sigmaY, rho);
        return backend.zip(xGrid, yGrid, (xv, yv) -> gaussianKernel(xv, yv, muX, muY, sigmaX, sigmaY, rho));
    }

    /**
     * Evaluates the skew-Gaussian kernel at one point.
     *
     * @throws IllegalArgumentException if a sigma is not positive or |ρ| ≥ 1
     */
    public static double skewGaussian(double x, double y, double muX, double muY, double sigmaX, double sigmaY,
                                      double alphaX, double alphaY, double rho) {
        validate(sigmaX, sigmaY, rho);
        return skewKernel(x, y, muX, muY, sigmaX, sigmaY, alphaX, alphaY, rho);
    }

    /**
     * Evaluates the skew-Gaussian kernel at paired points.
     */
    public static double[] skewGaussian(ArrayBackend backend, double[] x, double[] y, double muX, double muY,
                                        double sigmaX, double sigmaY, double alphaX, double alphaY, double rho) {
        validate(sigmaX, sigmaY, rho);
        return backend.zip(x, y,
            (xv, yv) -> skewKernel(xv, yv, muX, muY, sigmaX, sigmaY, alphaX, alphaY, rho));
    }

    /**
     * Evaluates the skew-Gaussian kernel over a mesh.
     */
    public static double[][] skewGaussian(ArrayBackend backend, double[][] xGrid, double[][] yGrid,
                                          double muX, double muY, double sigmaX, double sigmaY,
                                          double alphaX, double alphaY, double rho) {
        validate(sigmaX, sigmaY, rho);
        return backend.zip(xGrid, yGrid,
            (xv, yv) -> skewKernel(xv, yv, muX, muY, sigmaX, sigmaY, alphaX, alphaY, rho));
    }

    private static double gaussianKernel(double x, double y, double muX, double muY,
                                         double sigmaX, double sigmaY, double rho) {
        double determinant = sigmaX * sigmaX * sigmaY * sigmaY * (1.0 - rho * rho);
        double residualX = (muX - x) * sigmaY;
        double residualY = (muY - y) * sigmaX;
        double quadratic = residualX * residualX + residualY * residualY - 2.0 * rho * residualX * residualY;
        return Math.exp(-quadratic / (2.0 * determinant));
    }

    private static double skewKernel(double x, double y, double muX, double muY, double sigmaX, double sigmaY,
                                     double alphaX, double alphaY, double rho) {
        double gaussian = gaussianKernel(x, y, muX, muY, sigmaX, sigmaY, rho);
        double skewX = 1.0 + Erf.erf(alphaX * (x - muX) / (sigmaX * SQRT_2));
        double skewY = 1.0 + Erf.erf(alphaY * (y - muY) / (sigmaY * SQRT_2));
        return gaussian * skewX * skewY;
    }

    private static void validate(double sigmaX, double sigmaY, double rho) {
        if (!(sigmaX > 0)) {
            throw new IllegalArgumentException("sigmaX must be positive, got: " + sigmaX);
        }
        if (!(sigmaY > 0)) {
            throw new IllegalArgumentException("sigmaY must be positive, got: " + sigmaY);
        }
        if (!(Math.abs(rho) < 1)) {
            throw new IllegalArgumentException("Correlation must satisfy |rho| < 1, got: " + rho);
        }
    }
}
