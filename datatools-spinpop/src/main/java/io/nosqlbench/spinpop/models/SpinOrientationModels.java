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
import io.nosqlbench.spinpop.primitives.TruncatedNormal;

import java.util.Objects;

/**
 * Isotropic plus preferentially-aligned mixture model for spin tilts.
 *
 * <h2>Definition</h2>
 *
 * <pre>{@code
 *   p(z_1, z_2 | ξ, σ1, σ2) = (1 - ξ)/4 + ξ · N(z_1; 1, σ1, [-1, 1]) · N(z_2; 1, σ2, [-1, 1])
 * }</pre>
 *
 * <p>where {@code z_i} is the cosine of the tilt and {@code N} is the truncated
 * normal centred on perfect alignment. See arXiv:1704.08370 Eq. (4).
 *
 * <h2>Components</h2>
 *
 * <ul>
 *   <li><b>Isotropic</b>: uniform 1/2 per axis, 1/4 jointly, weight (1 - ξ)</li>
 *   <li><b>Aligned</b>: both tilts drawn from the aligned component together, weight ξ</li>
 * </ul>
 *
 * <p>The aligned weight is ξ rather than ξ² because a binary is either
 * dynamically assembled (both spins isotropic) or formed in the field (both
 * spins aligned), not each spin independently. Each component integrates to 1
 * over [-1, 1]², so the mixture does too.
 */
public final class SpinOrientationModels {

    private static final double ALIGNED_MEAN = 1.0;
    private static final double ISOTROPIC_DENSITY = 0.25;

    private final ArrayBackend backend;

    /** Creates the models on the process-wide backend. */
    public SpinOrientationModels() {
        this(ArrayBackends.current());
    }

    public SpinOrientationModels(ArrayBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
    }

    /**
     * Tilt mixture with identical aligned widths for both black holes.
     *
     * @param dataset must contain {@code cos_tilt_1} and {@code cos_tilt_2}
     * @param xiSpin fraction of binaries in the aligned component (ξ)
     * @param sigmaSpin width of the aligned component for both black holes
     * @return the joint tilt density
     */
    public double[] iidSpinOrientationGaussianIsotropic(Dataset dataset, double xiSpin, double sigmaSpin) {
        return independentSpinOrientationGaussianIsotropic(dataset, xiSpin, sigmaSpin, sigmaSpin);
    }

    /**
     * Tilt mixture with separate aligned widths per black hole.
     *
     * @param dataset must contain {@code cos_tilt_1} and {@code cos_tilt_2}
     * @param xiSpin fraction of binaries in the aligned component (ξ)
     * @param sigma1 aligned width for the more massive black hole
     * @param sigma2 aligned width for the less massive black hole
     * @return the joint tilt density
     */
    public double[] independentSpinOrientationGaussianIsotropic(Dataset dataset, double xiSpin,
                                                                double sigma1, double sigma2) {
        double[] aligned1 = TruncatedNormal.density(backend, dataset.get(SpinParameters.COS_TILT_1),
            ALIGNED_MEAN, sigma1, SpinParameters.COS_TILT_MAX, SpinParameters.COS_TILT_MIN);
        double[] aligned2 = TruncatedNormal.density(backend, dataset.get(SpinParameters.COS_TILT_2),
            ALIGNED_MEAN, sigma2, SpinParameters.COS_TILT_MAX, SpinParameters.COS_TILT_MIN);
        double isotropic = (1 - xiSpin) * ISOTROPIC_DENSITY;
        return backend.zip(aligned1, aligned2, (p1, p2) -> isotropic + xiSpin * p1 * p2);
    }
}
