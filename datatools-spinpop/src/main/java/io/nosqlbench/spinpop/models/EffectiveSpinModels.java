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

import io.nosqlbench.spinpop.Dataset;
import io.nosqlbench.spinpop.backend.ArrayBackend;
import io.nosqlbench.spinpop.backend.ArrayBackends;
import io.nosqlbench.spinpop.primitives.BivariateKernels;
import io.nosqlbench.spinpop.primitives.TruncatedNormal;
import io.nosqlbench.spinpop.primitives.TruncatedSkewNormal;

import java.util.Objects;

/// Effective aligned spin (`chi_eff`) and effective precessing spin (`chi_p`) models.
///
/// See arXiv:2001.06051 and arXiv:2010.14533.
///
/// ## Marginals
///
/// | Model | Distribution | Support |
/// |-------|--------------|---------|
/// | [#gaussianChiEff] | truncated normal | chi_eff ∈ [-1, 1] |
/// | [#gaussianChiP] | truncated normal | chi_p ∈ [0, 1] |
/// | [#skewGaussianChiEff] | truncated skew normal | chi_eff ∈ [-1, 1] |
/// | [#skewGaussianChiP] | truncated skew normal | chi_p ∈ [0, 1] |
///
/// ## Correlated Joint Models
///
/// ```text
///   Σ = | σ_eff²           ρ σ_eff σ_p |
///       | ρ σ_eff σ_p      σ_p²        |
///
///                        ┌── ρ == 0 ──► marginal(chi_eff) · marginal(chi_p)
///   (dataset, Λ) ────────┤
///                        └── ρ != 0 ──► kernel(chi_eff, chi_p) / Z(Λ)
///                                       zeroed outside [-1,1] × [0,1]
/// ```
///
/// When ρ = 0 the truncated joint density separates into the two marginals,
/// each with a closed-form normalization, so no quadrature runs. Otherwise
/// `Z(Λ)` comes from [EffectiveSpinQuadrature] on a fresh 500 × 250 grid.
public final class EffectiveSpinModels {

    private final ArrayBackend backend;

    /// Creates the models on the process-wide backend.
    public EffectiveSpinModels() {
        this(ArrayBackends.current());
    }

    public EffectiveSpinModels(ArrayBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
    }

    /// Truncated Gaussian in chi_eff on [-1, 1].
    ///
    /// @param dataset must contain `chi_eff`
    /// @param muChiEff mean of the distribution
    /// @param sigmaChiEff standard deviation of the distribution
    /// @return the density per sample
    public double[] gaussianChiEff(Dataset dataset, double muChiEff, double sigmaChiEff) {
        return TruncatedNormal.density(backend, dataset.get(SpinParameters.CHI_EFF), muChiEff, sigmaChiEff,
            SpinParameters.CHI_EFF_MAX, SpinParameters.CHI_EFF_MIN);
    }

    /// Truncated Gaussian in chi_p on [0, 1].
    ///
    /// @param dataset must contain `chi_p`
    /// @param muChiP mean of the distribution
    /// @param sigmaChiP standard deviation of the distribution
    /// @return the density per sample
    public double[] gaussianChiP(Dataset dataset, double muChiP, double sigmaChiP) {
        return TruncatedNormal.density(backend, dataset.get(SpinParameters.CHI_P), muChiP, sigmaChiP,
            SpinParameters.CHI_P_MAX, SpinParameters.CHI_P_MIN);
    }

    /// Truncated skew Gaussian in chi_eff on [-1, 1].
    ///
    /// @param skewChiEff skewness of the distribution
    public double[] skewGaussianChiEff(Dataset dataset, double muChiEff, double sigmaChiEff, double skewChiEff) {
        return TruncatedSkewNormal.density(backend, dataset.get(SpinParameters.CHI_EFF), muChiEff, sigmaChiEff,
            skewChiEff, SpinParameters.CHI_EFF_MAX, SpinParameters.CHI_EFF_MIN);
    }

    /// Truncated skew Gaussian in chi_p on [0, 1].
    ///
    /// @param skewChiP skewness of the distribution
    public double[] skewGaussianChiP(Dataset dataset, double muChiP, double sigmaChiP, double skewChiP) {
        return TruncatedSkewNormal.density(backend, dataset.get(SpinParameters.CHI_P), muChiP, sigmaChiP,
            skewChiP, SpinParameters.CHI_P_MAX, SpinParameters.CHI_P_MIN);
    }

    /// Covariant Gaussian in effective aligned and precessing spins.
    ///
    /// @param dataset must contain `chi_eff` and `chi_p`
    /// @param muChiEff mean of chi_eff
    /// @param sigmaChiEff standard deviation of chi_eff
    /// @param muChiP mean of chi_p
    /// @param sigmaChiP standard deviation of chi_p
    /// @param rho correlation between chi_eff and chi_p, |ρ| < 1
    /// @return the normalized joint density per sample
    /// @throws io.nosqlbench.spinpop.DegenerateNormalizationException if the support holds no mass
    public double[] gaussianChiEffChiP(Dataset dataset, double muChiEff, double sigmaChiEff,
                                       double muChiP, double sigmaChiP, double rho) {
        if (rho == 0) {
            return backend.multiply(
                gaussianChiEff(dataset, muChiEff, sigmaChiEff),
                gaussianChiP(dataset, muChiP, sigmaChiP));
        }
        return correlatedGaussianChiEffChiP(dataset, muChiEff, sigmaChiEff, muChiP, sigmaChiP, rho);
    }

    /// Covariant skew Gaussian in effective aligned and precessing spins.
    ///
    /// @param skewChiEff skewness of chi_eff
    /// @param skewChiP skewness of chi_p
    /// @see #gaussianChiEffChiP
    public double[] skewGaussianChiEffChiP(Dataset dataset, double muChiEff, double sigmaChiEff,
                                           double muChiP, double sigmaChiP,
                                           double skewChiEff, double skewChiP, double rho) {
        if (rho == 0) {
            return backend.multiply(
                skewGaussianChiEff(dataset, muChiEff, sigmaChiEff, skewChiEff),
                skewGaussianChiP(dataset, muChiP, sigmaChiP, skewChiP));
        }
        return correlatedSkewGaussianChiEffChiP(dataset, muChiEff, sigmaChiEff, muChiP, sigmaChiP,
            skewChiEff, skewChiP, rho);
    }

    /// Quadrature-normalized Gaussian path, valid for any |ρ| < 1 including 0.
    double[] correlatedGaussianChiEffChiP(Dataset dataset, double muChiEff, double sigmaChiEff,
                                          double muChiP, double sigmaChiP, double rho) {
        double[] chiEff = dataset.get(SpinParameters.CHI_EFF);
        double[] chiP = dataset.get(SpinParameters.CHI_P);
        double[] prob = BivariateKernels.gaussian(backend, chiEff, chiP,
            muChiEff, muChiP, sigmaChiEff, sigmaChiP, rho);
        double normalization = EffectiveSpinQuadrature.gaussianNormalization(backend,
            muChiEff, sigmaChiEff, muChiP, sigmaChiP, rho);
        return truncate(backend.divide(prob, normalization), chiEff, chiP);
    }

    /// Quadrature-normalized skew Gaussian path, valid for any |ρ| < 1 including 0.
    double[] correlatedSkewGaussianChiEffChiP(Dataset dataset, double muChiEff, double sigmaChiEff,
                                              double muChiP, double sigmaChiP,
                                              double skewChiEff, double skewChiP, double rho) {
        double[] chiEff = dataset.get(SpinParameters.CHI_EFF);
        double[] chiP = dataset.get(SpinParameters.CHI_P);
        double[] prob = BivariateKernels.skewGaussian(backend, chiEff, chiP,
            muChiEff, muChiP, sigmaChiEff, sigmaChiP, skewChiEff, skewChiP, rho);
        double normalization = EffectiveSpinQuadrature.skewGaussianNormalization(backend,
            muChiEff, sigmaChiEff, muChiP, sigmaChiP, skewChiEff, skewChiP, rho);
        return truncate(backend.divide(prob, normalization), chiEff, chiP);
    }

    private double[] truncate(double[] prob, double[] chiEff, double[] chiP) {
        double[] masked = backend.applyMask(prob,
            backend.within(chiEff, SpinParameters.CHI_EFF_MIN, SpinParameters.CHI_EFF_MAX));
        return backend.applyMask(masked,
            backend.within(chiP, SpinParameters.CHI_P_MIN, SpinParameters.CHI_P_MAX));
    }
}
