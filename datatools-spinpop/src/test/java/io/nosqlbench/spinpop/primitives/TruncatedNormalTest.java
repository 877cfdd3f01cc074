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
import io.nosqlbench.spinpop.backend.ScalarArrayBackend;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TruncatedNormalTest {

    @Test
    void matchesRenormalizedNormal() {
        NormalDistribution normal = new NormalDistribution(0.3, 0.4);
        double mass = normal.cumulativeProbability(1.0) - normal.cumulativeProbability(-1.0);
        for (double x = -0.95; x < 1.0; x += 0.15) {
            assertEquals(normal.density(x) / mass, TruncatedNormal.pdf(x, 0.3, 0.4, 1.0, -1.0), 1e-10, "x=" + x);
        }
    }

    @Test
    void alignedTiltAtPerfectAlignment() {
        NormalDistribution normal = new NormalDistribution(1.0, 0.5);
        double mass = normal.cumulativeProbability(1.0) - normal.cumulativeProbability(-1.0);
        assertEquals(normal.density(1.0) / mass, TruncatedNormal.pdf(1.0, 1.0, 0.5, 1.0, -1.0), 1e-12);
    }

    @Test
    void integratesToOne() {
        ScalarArrayBackend backend = ScalarArrayBackend.instance();
        double[] grid = backend.linspace(0, 1, 4001);
        double[] values = TruncatedNormal.density(backend, grid, 0.2, 0.15, 1.0, 0.0);
        assertEquals(1.0, backend.trapz(values, grid), 1e-6);
    }

    @Test
    void meanFarOutsideTheBoundsStillNormalizes() {
        ScalarArrayBackend backend = ScalarArrayBackend.instance();
        double[] grid = backend.linspace(-1, 1, 4001);
        double[] values = TruncatedNormal.density(backend, grid, 5.0, 0.3, 1.0, -1.0);
        assertTrue(values[values.length - 1] > 0 && Double.isFinite(values[values.length - 1]));
        assertEquals(1.0, backend.trapz(values, grid), 1e-3);
    }

    @Test
    void zeroOutsideBounds() {
        double[] values = TruncatedNormal.density(ScalarArrayBackend.instance(),
            new double[]{-1.5, 0.0, 1.0001}, 0.0, 1.0, 1.0, -1.0);
        assertEquals(0.0, values[0]);
        assertTrue(values[1] > 0);
        assertEquals(0.0, values[2]);
    }

    @Test
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> TruncatedNormal.pdf(0, 0, 0, 1, -1));
        assertThrows(IllegalArgumentException.class, () -> TruncatedNormal.pdf(0, 0, 1, -1, 1));
    }

    @Test
    void noMassInsideBounds() {
        DegenerateNormalizationException e = assertThrows(DegenerateNormalizationException.class,
            () -> TruncatedNormal.pdf(0.5, 50.0, 0.01, 1.0, 0.0));
        assertEquals(0.0, e.getNormalization());
    }
}
