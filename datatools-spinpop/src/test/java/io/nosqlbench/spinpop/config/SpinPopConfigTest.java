package io.nosqlbench.spinpop.config;

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

import com.google.gson.JsonParseException;
import io.nosqlbench.spinpop.backend.ArrayBackend;
import io.nosqlbench.spinpop.backend.ArrayBackends;
import io.nosqlbench.spinpop.backend.BackendMode;
import io.nosqlbench.spinpop.backend.ParallelArrayBackend;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SpinPopConfigTest {

    @Test
    void defaultsSelectScalarBackend() {
        SpinPopConfig config = SpinPopConfig.defaults();
        assertEquals(BackendMode.SCALAR, config.backendMode());
        assertEquals(0, config.parallelism());
    }

    @Test
    void classpathResourceIsRead() {
        // src/test/resources/spinpop.json selects the parallel backend
        SpinPopConfig config = SpinPopConfig.resolve(new Properties());
        assertEquals(BackendMode.PARALLEL, config.backendMode());
        assertEquals(2, config.parallelism());
    }

    @Test
    void propertiesOverrideResource() {
        Properties properties = new Properties();
        properties.setProperty(SpinPopConfig.BACKEND_PROPERTY, " Scalar ");
        properties.setProperty(SpinPopConfig.PARALLELISM_PROPERTY, "0");
        SpinPopConfig config = SpinPopConfig.resolve(properties);
        assertEquals(BackendMode.SCALAR, config.backendMode());
        assertEquals(0, config.parallelism());
    }

    @Test
    void invalidValues() {
        Properties unknown = new Properties();
        unknown.setProperty(SpinPopConfig.BACKEND_PROPERTY, "gpu");
        assertThrows(IllegalStateException.class, () -> SpinPopConfig.resolve(unknown));

        Properties notANumber = new Properties();
        notANumber.setProperty(SpinPopConfig.PARALLELISM_PROPERTY, "many");
        assertThrows(IllegalArgumentException.class, () -> SpinPopConfig.resolve(notANumber));

        assertThrows(IllegalArgumentException.class, () -> SpinPopConfig.fromJson("{\"parallelism\": -1}"));
        assertThrows(JsonParseException.class, () -> SpinPopConfig.fromJson(""));
    }

    @Test
    void saveAndLoad(@TempDir Path dir) throws IOException {
        SpinPopConfig config = new SpinPopConfig(BackendMode.PARALLEL, 3);
        Path file = dir.resolve("spinpop.json");
        config.save(file);
        assertEquals(config, SpinPopConfig.load(file));
    }

    @Test
    void createBuildsConfiguredBackend() {
        ArrayBackend backend = ArrayBackends.create(new SpinPopConfig(BackendMode.PARALLEL, 2));
        assertInstanceOf(ParallelArrayBackend.class, backend);
        ParallelArrayBackend parallel = (ParallelArrayBackend) backend;
        try {
            assertEquals(2, parallel.parallelism());
        } finally {
            parallel.shutdown();
        }
        assertTrue(parallel.isShutdown());
        assertEquals(BackendMode.SCALAR, ArrayBackends.forMode(BackendMode.SCALAR).mode());
    }
}
