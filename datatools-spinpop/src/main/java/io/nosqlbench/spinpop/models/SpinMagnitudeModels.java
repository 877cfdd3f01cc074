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
import io.nosqlbench.spinpop.primitives.BetaDensity;

import java.util.Objects;

/**
 * Beta-distributed spin magnitude models.
 *
 * <pre>{@code
 *   p(a_1, a_2) = Beta(a_1; α1, β1, [0, amax_1]) · Beta(a_2; α2, β2, [0, amax_2])
 * }</pre>
 *
 * <p>See arXiv:1805.06442 Eq. (10). Each factor already integrates to 1 over
 * its support, so the product is not renormalized. Shape parameters are
 * validated by {@link BetaDensity}.
 */
public final class SpinMagnitudeModels {

    private final ArrayBackend backend;

    /** Creates the models on the process-wide backend. */
    public SpinMagnitudeModels() {
        this(ArrayBackends.current());
    }

    public SpinMagnitudeModels(ArrayBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
    }

    /**
     * Independent and identically distributed beta distributions for both spin magnitudes.
     *
     * @param dataset must contain {@code a_1} and {@code a_2}
     * @param amax maximum black hole spin
     * @param alphaChi first beta shape parameter for both black holes
     * @param betaChi second beta shape parameter for both black holes
     * @return the joint magnitude density
     */
    public double[] iidSpinMagnitudeBeta(Dataset dataset, double amax, double alphaChi, double betaChi) {
        return independentSpinMagnitudeBeta(dataset, alphaChi, alphaChi, betaChi, betaChi, amax, amax);
    }

    /**
     * Independent beta distributions for both spin magnitudes.
     *
     * @param dataset must contain {@code a_1} and {@code a_2}
     * @param alphaChi1 first shape parameter for the more massive black hole
     * @param alphaChi2 first shape parameter for the less massive black hole
     * @param betaChi1 second shape parameter for the more massive black hole
     * @param betaChi2 second shape parameter for the less massive black hole
     * @param amax1 maximum spin of the more massive black hole
     * @param amax2 maximum spin of the less massive black hole
     * @return the joint magnitude density
     */
    public double[] independentSpinMagnitudeBeta(Dataset dataset, double alphaChi1, double alphaChi2,
                                                 double betaChi1, double betaChi2, double amax1, double amax2) {
        double[] primary = BetaDensity.density(backend, dataset.get(SpinParameters.A_1), alphaChi1, betaChi1, amax1);
        double[] secondary = BetaDensity.density(backend, dataset.get(SpinParameters.A_2), alphaChi2, betaChi2, amax2);
        return backend.multiply(primary, secondary);
    }
}
