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

import io.nosqlbench.spinpop.config.SpinPopConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Process-wide [ArrayBackend] selection.
///
/// ## Usage
///
/// ```java
/// // The backend configured for this JVM (resolved on first use)
/// ArrayBackend backend = ArrayBackends.current();
///
/// // A specific backend, e.g. in tests comparing modes
/// ArrayBackend parallel = ArrayBackends.forMode(BackendMode.PARALLEL);
/// ```
///
/// The current backend is resolved exactly once from [SpinPopConfig#resolve()]
/// and never changes afterwards.
public final class ArrayBackends {

    private static final Logger logger = LogManager.getLogger(ArrayBackends.class);

    private ArrayBackends() {
        // Utility class
    }

    private static final class Holder {
        private static final ArrayBackend CURRENT = create(SpinPopConfig.resolve());
    }

    /// Returns the backend configured for this process.
    ///
    /// @throws IllegalStateException if the configuration names an unknown backend
    public static ArrayBackend current() {
        return Holder.CURRENT;
    }

    /// Returns a backend for the given mode with default settings.
    public static ArrayBackend forMode(BackendMode mode) {
        return create(new SpinPopConfig(mode, 0));
    }

    /// Creates the backend described by a configuration.
    ///
    /// A parallel backend with an explicit parallelism owns a dedicated pool;
    /// callers that discard it should call [ParallelArrayBackend#shutdown()].
    public static ArrayBackend create(SpinPopConfig config) {
        ArrayBackend backend;
        switch (config.backendMode()) {
            case PARALLEL:
                backend = config.parallelism() > 0
                    ? new ParallelArrayBackend(config.parallelism())
                    : new ParallelArrayBackend();
                break;
            case SCALAR:
            default:
                backend = ScalarArrayBackend.instance();
                break;
        }
        logger.debug("Using array backend {} ({})", backend, backend.mode().description());
        return backend;
    }
}
