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
import io.nosqlbench.spinpop.backend.ScalarArrayBackend;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class EffectiveSpinQuadratureTest {

    private final ArrayBackend backend = ScalarArrayBackend.instance();

    @Test
    void meshCoversTheEffectiveSpinSupport() {
        Mesh mesh = EffectiveSpinQuadrature.mesh(backend);
        assertEquals(EffectiveSpinQuadrature.CHI_P_POINTS, mesh.rows());
        assertEquals(EffectiveSpinQuadrature.CHI_EFF_POINTS, mesh.columns());
        assertEquals(-1.0, mesh.x()[0]);
        assertEquals(1.0, mesh.x()[mesh.columns() - 1]);
        assertEquals(0.0, mesh.y()[0]);
        assertEquals(1.0, mesh.y()[mesh.rows() - 1]);
    }

    @Test
    void separableKernelFactorsIntoOneDimensionalIntegrals() {
        Mesh mesh = EffectiveSpinQuadrature.mesh(backend);
        double[] overChiEff = backend.map(mesh.x(), x -> Math.exp(-0.5 * Math.pow((x - 0.1) / 0.3, 2)));
        double[] overChiP = backend.map(mesh.y(), y -> Math.exp(-0.5 * Math.pow((y - 0.4) / 0.2, 2)));
        double expected = backend.trapz(overChiEff, mesh.x()) * backend.trapz(overChiP, mesh.y());
        double actual = EffectiveSpinQuadrature.gaussianNormalization(backend, 0.1, 0.3, 0.4, 0.2, 0.0);
        assertEquals(expected, actual, 1e-12 * expected);
    }

    @Test
    void wideKernelApproachesSupportArea() {
        // A very wide kernel is nearly flat, so Z tends to the area of [-1,1] x [0,1]
        double z = EffectiveSpinQuadrature.gaussianNormalization(backend, 0.0, 1e3, 0.5, 1e3, 0.2);
        assertEquals(2.0, z, 1e-5);
    }

    @Test
    void zeroSkewNormalizationMatchesGaussian() {
        double gaussian = EffectiveSpinQuadrature.gaussianNormalization(backend, 0.0, 0.3, 0.5, 0.2, 0.4);
        double skew = EffectiveSpinQuadrature.skewGaussianNormalization(backend, 0.0, 0.3, 0.5, 0.2, 0.0, 0.0, 0.4);
        assertEquals(gaussian, skew, 1e-15 * gaussian);
    }

    @Test
    void underflowingKernelIsDegenerate() {
        assertThrows(DegenerateNormalizationException.class,
            () -> EffectiveSpinQuadrature.gaussianNormalization(backend, -40.0, 0.01, 0.5, 0.2, 0.3));
    }
}
