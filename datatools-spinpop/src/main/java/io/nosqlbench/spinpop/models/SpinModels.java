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

import java.util.Objects;

/**
 * Joint spin models combining magnitudes and orientations.
 *
 * <p>Magnitudes and orientations are assumed independent, so the joint
 * density is the product of {@link SpinMagnitudeModels} and
 * {@link SpinOrientationModels}.
 */
public final class SpinModels {

    private final ArrayBackend backend;
    private final SpinMagnitudeModels magnitudes;
    private final SpinOrientationModels orientations;

    /** Creates the models on the process-wide backend. */
    public SpinModels() {
        this(ArrayBackends.current());
    }

    public SpinModels(ArrayBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
        this.magnitudes = new SpinMagnitudeModels(backend);
        this.orientations = new SpinOrientationModels(backend);
    }

    /**
     * Independently and identically distributed spins: beta magnitudes and an
     * isotropic plus aligned tilt mixture.
     *
     * @param dataset must contain {@code a_1}, {@code a_2}, {@code cos_tilt_1}, {@code cos_tilt_2}
     * @param xiSpin fraction of binaries in the aligned tilt component
     * @param sigmaSpin width of the aligned tilt component
     * @param amax maximum black hole spin
     * @param alphaChi first beta shape parameter
     * @param betaChi second beta shape parameter
     * @return the joint spin density
     */
    public double[] iidSpin(Dataset dataset, double xiSpin, double sigmaSpin,
                            double amax, double alphaChi, double betaChi) {
        double[] orientation = orientations.iidSpinOrientationGaussianIsotropic(dataset, xiSpin, sigmaSpin);
        double[] magnitude = magnitudes.iidSpinMagnitudeBeta(dataset, amax, alphaChi, betaChi);
        return backend.multiply(orientation, magnitude);
    }

    public SpinMagnitudeModels magnitudes() {
        return magnitudes;
    }

    public SpinOrientationModels orientations() {
        return orientations;
    }
}
