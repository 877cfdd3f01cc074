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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class OwensTTest {

    @Test
    void zeroHeightIsArctangent() {
        for (double a : new double[]{0.1, 0.5, 1.0, 3.0, 20.0}) {
            assertEquals(Math.atan(a) / (2 * Math.PI), OwensT.value(0.0, a), 1e-14, "a=" + a);
        }
    }

    @Test
    void unitSlopeClosedForm() {
        for (double h : new double[]{-2.0, -0.5, 0.3, 1.0, 2.5}) {
            double phi = OwensT.standardNormalCdf(h);
            assertEquals(0.5 * phi * (1 - phi), OwensT.value(h, 1.0), 1e-12, "h=" + h);
        }
    }

    @Test
    void symmetries() {
        assertEquals(OwensT.value(0.7, 0.4), OwensT.value(-0.7, 0.4), 1e-15);
        assertEquals(-OwensT.value(0.7, 0.4), OwensT.value(0.7, -0.4), 1e-15);
        assertEquals(0.0, OwensT.value(1.3, 0.0));
    }

    @Test
    void reflectionMatchesDirectRangeNearOne() {
        // a slightly above 1 goes through the reflection, slightly below does not
        double below = OwensT.value(0.8, 0.999999);
        double above = OwensT.value(0.8, 1.000001);
        assertEquals(below, above, 1e-6);
    }

    @Test
    void infiniteSlopeLimit() {
        // T(h, ∞) = (1 - Φ(|h|)) / 2
        double h = 0.6;
        assertEquals(0.5 * (1 - OwensT.standardNormalCdf(h)), OwensT.value(h, Double.POSITIVE_INFINITY), 1e-12);
    }

    @Test
    void largeHeightKeepsRelativePrecision() {
        double h = 12.0;
        double upper = OwensT.standardNormalCdf(-h);
        assertEquals(0.5 * upper, OwensT.value(h, Double.POSITIVE_INFINITY), 1e-12 * upper);
        double unit = 0.5 * OwensT.standardNormalCdf(10.0) * OwensT.standardNormalCdf(-10.0);
        assertEquals(unit, OwensT.value(10.0, 1.0), 1e-8 * unit);
    }

    @Test
    void nanPropagates() {
        assertTrue(Double.isNaN(OwensT.value(Double.NaN, 1.0)));
    }
}
