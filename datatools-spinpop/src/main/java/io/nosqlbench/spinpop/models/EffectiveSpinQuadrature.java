package io.nosqlbench.spinpop.models;

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
import io.nosqlbench.spinpop.backend.Mesh;
import io.nosqlbench.spinpop.primitives.BivariateKernels;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Grid quadrature for the normalizing constant of correlated effective-spin kernels.
///
/// ## Grid
///
/// ```text
///   chi_eff : 500 points on [-1, 1]   (columns, integrated first)
///   chi_p   : 250 points on [ 0, 1]   (rows, integrated second)
///
///   Z = trapz_chi_p( trapz_chi_eff( k(chi_eff, chi_p) ) )
/// ```
///
/// The mesh is built fresh on every call. Every function here takes all of
/// its hyperparameters as arguments and has no other inputs.
final class EffectiveSpinQuadrature {

    private static final Logger logger = LogManager.getLogger(EffectiveSpinQuadrature.class);

    static final int CHI_EFF_POINTS = 500;
    static final int CHI_P_POINTS = 250;

    private EffectiveSpinQuadrature() {
        // Utility class
    }

    /// Builds the quadrature mesh: x follows chi_eff, y follows chi_p.
    static Mesh mesh(ArrayBackend backend) {
        double[] chiEff = backend.linspace(SpinParameters.CHI_EFF_MIN, SpinParameters.CHI_EFF_MAX, CHI_EFF_POINTS);
        double[] chiP = backend.linspace(SpinParameters.CHI_P_MIN, SpinParameters.CHI_P_MAX, CHI_P_POINTS);
        return backend.meshgrid(chiEff, chiP);
    }

    /// Normalizing constant of the bivariate Gaussian kernel on the effective-spin support.
    ///
    /// @throws DegenerateNormalizationException if the constant cannot be divided by
    static double gaussianNormalization(ArrayBackend backend, double muChiEff, double sigmaChiEff,
                                        double muChiP, double sigmaChiP, double rho) {
        Mesh mesh = mesh(backend);
        double[][] probGrid = BivariateKernels.gaussian(backend, mesh.xGrid(), mesh.yGrid(),
            muChiEff, muChiP, sigmaChiEff, sigmaChiP, rho);
        double normalization = integrate(backend, mesh, probGrid);
        return requireUsable(normalization, "gaussian chi_eff/chi_p kernel(mu_chi_eff=" + muChiEff
            + ", sigma_chi_eff=" + sigmaChiEff + ", mu_chi_p=" + muChiP + ", sigma_chi_p=" + sigmaChiP
            + ", rho=" + rho + ")");
    }

    /// Normalizing constant of the bivariate skew-Gaussian kernel on the effective-spin support.
    ///
    /// @throws DegenerateNormalizationException if the constant cannot be divided by
    static double skewGaussianNormalization(ArrayBackend backend, double muChiEff, double sigmaChiEff,
                                            double muChiP, double sigmaChiP, double skewChiEff,
                                            double skewChiP, double rho) {
        Mesh mesh = mesh(backend);
        double[][] probGrid = BivariateKernels.skewGaussian(backend, mesh.xGrid(), mesh.yGrid(),
            muChiEff, muChiP, sigmaChiEff, sigmaChiP, skewChiEff, skewChiP, rho);
        double normalization = integrate(backend, mesh, probGrid);
        return requireUsable(normalization, "skew gaussian chi_eff/chi_p kernel(mu_chi_eff=" + muChiEff
            + ", sigma_chi_eff=" + sigmaChiEff + ", mu_chi_p=" + muChiP + ", sigma_chi_p=" + sigmaChiP
            + ", skew_chi_eff=" + skewChiEff + ", skew_chi_p=" + skewChiP + ", rho=" + rho + ")");
    }

    /// Integrates a mesh of values over chi_eff (last axis) and then over chi_p.
    static double integrate(ArrayBackend backend, Mesh mesh, double[][] values) {
        double[] overChiEff = backend.trapz(values, mesh.x());
        return backend.trapz(overChiEff, mesh.y());
    }

    private static double requireUsable(double normalization, String context) {
        if (!DegenerateNormalizationException.isUsable(normalization)) {
            logger.warn("Quadrature normalization {} is unusable for {}", normalization, context);
            throw new DegenerateNormalizationException(context, normalization);
        }
        logger.debug("Quadrature normalization {} for {}", normalization, context);
        return normalization;
    }
}
