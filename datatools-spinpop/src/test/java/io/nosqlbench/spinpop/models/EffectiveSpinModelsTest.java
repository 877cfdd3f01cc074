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
import io.nosqlbench.spinpop.DegenerateNormalizationException;
import io.nosqlbench.spinpop.MissingParameterException;
import io.nosqlbench.spinpop.backend.ArrayBackend;
import io.nosqlbench.spinpop.backend.Mesh;
import io.nosqlbench.spinpop.backend.ParallelArrayBackend;
import io.nosqlbench.spinpop.backend.ScalarArrayBackend;
import io.nosqlbench.spinpop.primitives.TruncatedNormal;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.ForkJoinPool;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class EffectiveSpinModelsTest {

    private final ArrayBackend backend = ScalarArrayBackend.instance();
    private final EffectiveSpinModels models = new EffectiveSpinModels(backend);

    private final Dataset samples = Dataset.of(
        "chi_eff", new double[]{-0.8, -0.2, 0.0, 0.05, 0.3, 0.9},
        "chi_p", new double[]{0.05, 0.4, 0.2, 0.7, 0.15, 0.95});

    @Test
    void marginalsAreTruncatedNormals() {
        double[] chiEff = models.gaussianChiEff(samples, 0.1, 0.3);
        double[] chiP = models.gaussianChiP(samples, 0.2, 0.25);
        for (int i = 0; i < chiEff.length; i++) {
            assertEquals(TruncatedNormal.pdf(samples.get("chi_eff")[i], 0.1, 0.3, 1, -1), chiEff[i], 1e-14);
            assertEquals(TruncatedNormal.pdf(samples.get("chi_p")[i], 0.2, 0.25, 1, 0), chiP[i], 1e-14);
        }
    }

    @Test
    void uncorrelatedJointIsProductOfMarginals() {
        double[] joint = models.gaussianChiEffChiP(samples, 0.05, 0.2, 0.3, 0.15, 0.0);
        double[] product = backend.multiply(models.gaussianChiEff(samples, 0.05, 0.2),
            models.gaussianChiP(samples, 0.3, 0.15));
        assertArrayEquals(product, joint, 0.0);

        double[] skewJoint = models.skewGaussianChiEffChiP(samples, 0.05, 0.2, 0.3, 0.15, 2.0, -1.0, 0.0);
        double[] skewProduct = backend.multiply(models.skewGaussianChiEff(samples, 0.05, 0.2, 2.0),
            models.skewGaussianChiP(samples, 0.3, 0.15, -1.0));
        assertArrayEquals(skewProduct, skewJoint, 0.0);
    }

    @Test
    void quadraturePathAgreesWithSeparableLimit() {
        double[] fast = models.gaussianChiEffChiP(samples, 0.0, 0.3, 0.3, 0.2, 0.0);
        double[] general = models.correlatedGaussianChiEffChiP(samples, 0.0, 0.3, 0.3, 0.2, 0.0);
        assertRelativelyClose(fast, general, 1e-3);

        double[] skewFast = models.skewGaussianChiEffChiP(samples, 0.0, 0.3, 0.3, 0.2, 1.5, 0.5, 0.0);
        double[] skewGeneral = models.correlatedSkewGaussianChiEffChiP(samples, 0.0, 0.3, 0.3, 0.2, 1.5, 0.5, 0.0);
        assertRelativelyClose(skewFast, skewGeneral, 1e-3);
    }

    @Test
    void correlatedDensityIntegratesToOneOnTheGrid() {
        Mesh mesh = EffectiveSpinQuadrature.mesh(backend);
        Dataset grid = flatten(mesh);

        double[] gaussian = models.gaussianChiEffChiP(grid, 0.1, 0.25, 0.35, 0.2, -0.6);
        assertEquals(1.0, EffectiveSpinQuadrature.integrate(backend, mesh, reshape(gaussian, mesh)), 1e-10);

        double[] skew = models.skewGaussianChiEffChiP(grid, 0.1, 0.25, 0.35, 0.2, -2.0, 3.0, 0.4);
        assertEquals(1.0, EffectiveSpinQuadrature.integrate(backend, mesh, reshape(skew, mesh)), 1e-10);
    }

    @Test
    void zeroOutsideTheSupport() {
        Dataset outside = Dataset.of("chi_eff", new double[]{1.2, -1.01, 0.0, 0.0},
            "chi_p", new double[]{0.5, 0.5, -0.1, 1.3});
        for (double rho : new double[]{0.0, 0.5}) {
            double[] gaussian = models.gaussianChiEffChiP(outside, 0.0, 0.5, 0.5, 0.5, rho);
            double[] skew = models.skewGaussianChiEffChiP(outside, 0.0, 0.5, 0.5, 0.5, 1.0, 1.0, rho);
            for (int i = 0; i < 4; i++) {
                assertEquals(0.0, gaussian[i], "rho=" + rho + " i=" + i);
                assertEquals(0.0, skew[i], "rho=" + rho + " i=" + i);
            }
        }
    }

    @Test
    void correlatedModeSitsAtTheMeans() {
        double[] chiEffAxis = backend.linspace(-1.0, 1.0, 401);
        double[] chiPAxis = backend.linspace(0.0, 1.0, 201);
        double[] chiEff = new double[chiEffAxis.length * chiPAxis.length];
        double[] chiP = new double[chiEff.length];
        for (int j = 0; j < chiPAxis.length; j++) {
            for (int i = 0; i < chiEffAxis.length; i++) {
                chiEff[j * chiEffAxis.length + i] = chiEffAxis[i];
                chiP[j * chiEffAxis.length + i] = chiPAxis[j];
            }
        }
        double[] density = models.gaussianChiEffChiP(Dataset.of("chi_eff", chiEff, "chi_p", chiP),
            0.0, 0.2, 0.2, 0.2, 0.5);
        int peak = 0;
        for (int k = 1; k < density.length; k++) {
            if (density[k] > density[peak]) {
                peak = k;
            }
        }
        assertEquals(0.0, chiEff[peak], 1e-9);
        assertEquals(0.2, chiP[peak], 1e-9);

        Mesh mesh = EffectiveSpinQuadrature.mesh(backend);
        double[] onMesh = models.gaussianChiEffChiP(flatten(mesh), 0.0, 0.2, 0.2, 0.2, 0.5);
        assertEquals(1.0, EffectiveSpinQuadrature.integrate(backend, mesh, reshape(onMesh, mesh)), 1e-10);
    }

    @Test
    void meanFarAboveTheSupportKeepsTheSeparableLimit() {
        Dataset tail = Dataset.of("chi_eff", new double[]{0.6, 0.8, 0.95, 1.0},
            "chi_p", new double[]{0.3, 0.4, 0.5, 0.2});
        double[] fast = models.gaussianChiEffChiP(tail, 5.0, 0.3, 0.4, 0.2, 0.0);
        double[] general = models.correlatedGaussianChiEffChiP(tail, 5.0, 0.3, 0.4, 0.2, 1e-9);
        for (double value : fast) {
            assertTrue(value > 0 && Double.isFinite(value), "density " + value);
        }
        // Trapezoid error on the steep tail is a few tenths of a percent
        assertRelativelyClose(fast, general, 1e-2);
    }

    @Test
    void correlationSignFavoursMatchingDeviations() {
        Dataset dataset = Dataset.of("chi_eff", new double[]{0.2, -0.2}, "chi_p", new double[]{0.5, 0.5});
        double[] positive = models.gaussianChiEffChiP(dataset, 0.0, 0.2, 0.3, 0.2, 0.7);
        double[] negative = models.gaussianChiEffChiP(dataset, 0.0, 0.2, 0.3, 0.2, -0.7);
        assertTrue(positive[0] > positive[1]);
        assertTrue(negative[1] > negative[0]);
    }

    @Test
    void degenerateNormalizationIsReported() {
        DegenerateNormalizationException correlated = assertThrows(DegenerateNormalizationException.class,
            () -> models.gaussianChiEffChiP(samples, 50.0, 0.01, 0.3, 0.2, 0.5));
        assertEquals(0.0, correlated.getNormalization());
        assertTrue(correlated.getContext().contains("rho=0.5"));

        assertThrows(DegenerateNormalizationException.class,
            () -> models.skewGaussianChiEffChiP(samples, 50.0, 0.01, 0.3, 0.2, 1.0, 1.0, 0.5));
        assertThrows(DegenerateNormalizationException.class,
            () -> models.gaussianChiEffChiP(samples, 50.0, 0.01, 0.3, 0.2, 0.0));
    }

    @Test
    void invalidArgumentsAndMissingColumns() {
        assertThrows(IllegalArgumentException.class,
            () -> models.gaussianChiEffChiP(samples, 0.0, 0.2, 0.3, 0.2, 1.0));
        assertThrows(IllegalArgumentException.class,
            () -> models.gaussianChiEffChiP(samples, 0.0, -0.2, 0.3, 0.2, 0.3));
        Dataset noChiP = Dataset.of("chi_eff", 0.1, 0.2);
        MissingParameterException e = assertThrows(MissingParameterException.class,
            () -> models.gaussianChiEffChiP(noChiP, 0.0, 0.2, 0.3, 0.2, 0.3));
        assertEquals("chi_p", e.getParameterName());
    }

    @Test
    void repeatedCallsAreIdenticalAcrossBackends() {
        ForkJoinPool pool = new ForkJoinPool(3);
        try {
            EffectiveSpinModels parallel = new EffectiveSpinModels(new ParallelArrayBackend(pool, 64));
            double[] first = models.skewGaussianChiEffChiP(samples, 0.1, 0.2, 0.3, 0.25, -1.0, 2.0, 0.35);
            double[] second = models.skewGaussianChiEffChiP(samples, 0.1, 0.2, 0.3, 0.25, -1.0, 2.0, 0.35);
            double[] onPool = parallel.skewGaussianChiEffChiP(samples, 0.1, 0.2, 0.3, 0.25, -1.0, 2.0, 0.35);
            assertArrayEquals(first, second, 0.0);
            assertArrayEquals(first, onPool, 0.0);
        } finally {
            pool.shutdown();
        }
    }

    private static void assertRelativelyClose(double[] expected, double[] actual, double tolerance) {
        assertEquals(expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], actual[i], tolerance * Math.abs(expected[i]), "index " + i);
        }
    }

    private static Dataset flatten(Mesh mesh) {
        double[] chiEff = new double[mesh.size()];
        double[] chiP = new double[mesh.size()];
        double[][] xGrid = mesh.xGrid();
        double[][] yGrid = mesh.yGrid();
        for (int j = 0; j < mesh.rows(); j++) {
            System.arraycopy(xGrid[j], 0, chiEff, j * mesh.columns(), mesh.columns());
            System.arraycopy(yGrid[j], 0, chiP, j * mesh.columns(), mesh.columns());
        }
        return Dataset.of("chi_eff", chiEff, "chi_p", chiP);
    }

    private static double[][] reshape(double[] flat, Mesh mesh) {
        double[][] grid = new double[mesh.rows()][];
        for (int j = 0; j < mesh.rows(); j++) {
            grid[j] = Arrays.copyOfRange(flat, j * mesh.columns(), (j + 1) * mesh.columns());
        }
        return grid;
    }
}
