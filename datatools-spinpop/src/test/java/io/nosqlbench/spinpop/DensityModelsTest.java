package io.nosqlbench.spinpop;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DensityModelsTest {

    private final DensityModel doubled = DensityModels.of(Set.of("x"), Set.of("k"),
        (d, h) -> ScalarArrayBackend.instance().scale(d.get("x"), h.get("k")));
    private final DensityModel squared = DensityModels.of(Set.of("y"), Set.of("m"),
        (d, h) -> ScalarArrayBackend.instance().map(d.get("y"), v -> v * v * h.get("m")));

    @Test
    void productMultipliesAndUnionsNames() {
        DensityModel joint = DensityModels.product(ScalarArrayBackend.instance(), doubled, squared);
        assertEquals(Set.of("x", "y"), joint.parameters());
        assertEquals(Set.of("k", "m"), joint.hyperparameters());

        Dataset dataset = Dataset.of("x", new double[]{1, 2}, "y", new double[]{3, 4});
        double[] result = joint.evaluate(dataset, Hyperparameters.of("k", 2, "m", 1));
        assertArrayEquals(new double[]{18, 64}, result);
    }

    @Test
    void productPropagatesMissingHyperparameters() {
        DensityModel joint = DensityModels.product(ScalarArrayBackend.instance(), List.of(doubled, squared));
        Dataset dataset = Dataset.of("x", new double[]{1}, "y", new double[]{1});
        assertThrows(MissingParameterException.class, () -> joint.evaluate(dataset, Hyperparameters.of("k", 2)));
    }

    @Test
    void emptyProductIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> DensityModels.product(ScalarArrayBackend.instance(), List.of()));
    }
}
