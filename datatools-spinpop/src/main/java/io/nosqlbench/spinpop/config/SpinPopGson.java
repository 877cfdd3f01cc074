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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Shared Gson instances for spinpop configuration and hyperparameter files.
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled ([#gson()] only) | Human-readable config files |
/// | HTML escaping | Disabled | Cleaner numeric output |
/// | Special floats | Allowed | NaN and Infinity hyperparameters survive a round trip |
///
/// [Gson] instances are thread-safe and shared.
public final class SpinPopGson {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private SpinPopGson() {
        // Utility class
    }

    /// Returns the pretty-printing Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns a single-line Gson instance.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with spinpop defaults.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
