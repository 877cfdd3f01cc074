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

import io.nosqlbench.spinpop.backend.ScalarArrayBackend;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class BetaDensityTest {

    @Test
    void matchesCommonsMathOnUnitInterval() {
        BetaDistribution reference = new BetaDistribution(2.5, 4.0);
        for (double x = 0.05; x < 1.0; x += 0.1) {
            assertEquals(reference.density(x), BetaDensity.pdf(x, 2.5, 4.0, 1.0), 1e-12, "x=" + x);
        }
    }

    @Test
    void rescaledSupportDividesByScale() {
        BetaDistribution reference = new BetaDistribution(2.0, 3.0);
        double scale = 0.8;
        double x = 0.3;
        assertEquals(reference.density(x / scale) / scale, BetaDensity.pdf(x, 2.0, 3.0, scale), 1e-12);
    }

    @Test
    void beta22AtKnownPoints() {
        // 6 x (1 - x)
        assertEquals(1.5, BetaDensity.pdf(0.5, 2, 2, 1), 1e-12);
        assertEquals(1.26, BetaDensity.pdf(0.3, 2, 2, 1), 1e-12);
    }

    @Test
    void zeroOutsideSupport() {
        double[] values = BetaDensity.density(ScalarArrayBackend.instance(),
            new double[]{-0.1, 0.5, 0.9, 1.2}, 2, 2, 0.8);
        assertEquals(0.0, values[0]);
        assertTrue(values[1] > 0);
        assertEquals(0.0, values[2]);
        assertEquals(0.0, values[3]);
    }

    @Test
    void invalidShapeParameters() {
        assertThrows(IllegalArgumentException.class, () -> BetaDensity.pdf(0.5, 0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> BetaDensity.pdf(0.5, 1, -2, 1));
        assertThrows(IllegalArgumentException.class, () -> BetaDensity.pdf(0.5, 1, 1, 0));
    }
}
