package io.nosqlbench.spinpop.backend;

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

import java.util.Locale;

/// Execution modes for an [ArrayBackend].
///
/// | Mode | Description | Selected by |
/// |------|-------------|-------------|
/// | **SCALAR** | Single-threaded loops | `spinpop.backend=scalar` (default) |
/// | **PARALLEL** | Fork/join data parallelism | `spinpop.backend=parallel` |
///
/// Both modes return identical values; only throughput differs.
public enum BackendMode {

    /// Pure Java single-threaded loops.
    SCALAR("scalar", "Scalar", "Single-threaded elementwise loops"),

    /// Rows and elements spread across a fork/join pool.
    ///
    /// Worth it for large datasets and for the 125,000 point quadrature mesh.
    PARALLEL("parallel", "Parallel", "Fork/join data-parallel elementwise loops");

    private final String configName;
    private final String displayName;
    private final String description;

    BackendMode(String configName, String displayName, String description) {
        this.configName = configName;
        this.displayName = displayName;
        this.description = description;
    }

    /// Returns the name used in configuration files and system properties.
    public String configName() {
        return configName;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    /// Resolves a mode from its configuration name, ignoring case.
    ///
    /// @param name the configuration name, e.g. "scalar" or "parallel"
    /// @return the matching mode
    /// @throws IllegalStateException if no mode has that name
    public static BackendMode fromConfigName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (BackendMode mode : values()) {
                if (mode.configName.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalStateException("Unknown array backend '" + name + "', expected one of: scalar, parallel");
    }
}
