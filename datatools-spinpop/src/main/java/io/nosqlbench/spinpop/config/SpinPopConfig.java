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
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.spinpop.backend.BackendMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * JSON-serializable process configuration for spinpop.
 *
 * <h2>Purpose</h2>
 *
 * <p>Selects the array backend that every density model runs on. The backend
 * is resolved once per process by {@link io.nosqlbench.spinpop.backend.ArrayBackends}
 * from the configuration returned by {@link #resolve()}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "backend": "parallel",   // "scalar" (default) or "parallel"
 *   "parallelism": 8         // fork/join pool size, 0 = common pool
 * }
 * }</pre>
 *
 * <h2>Resolution Order</h2>
 *
 * <ol>
 *   <li>Built-in defaults (scalar backend)</li>
 *   <li>Classpath resource {@value #RESOURCE_NAME}, if present</li>
 *   <li>System properties {@value #BACKEND_PROPERTY} and {@value #PARALLELISM_PROPERTY}</li>
 * </ol>
 */
public class SpinPopConfig {

    private static final Logger logger = LogManager.getLogger(SpinPopConfig.class);

    public static final String RESOURCE_NAME = "spinpop.json";
    public static final String BACKEND_PROPERTY = "spinpop.backend";
    public static final String PARALLELISM_PROPERTY = "spinpop.parallelism";

    @SerializedName("backend")
    private String backend = BackendMode.SCALAR.configName();

    @SerializedName("parallelism")
    private int parallelism;

    public SpinPopConfig() {
    }

    public SpinPopConfig(BackendMode mode, int parallelism) {
        this.backend = Objects.requireNonNull(mode, "mode cannot be null").configName();
        this.parallelism = parallelism;
        validate();
    }

    /**
     * Returns the built-in defaults.
     */
    public static SpinPopConfig defaults() {
        return new SpinPopConfig();
    }

    /**
     * Resolves the process configuration from defaults, the classpath resource
     * and system properties.
     *
     * @return the effective configuration
     * @throws IllegalStateException if a configured backend name is unknown
     */
    public static SpinPopConfig resolve() {
        return resolve(System.getProperties());
    }

    /**
     * Resolves the configuration against an explicit set of properties.
     *
     * @param properties properties that override the classpath resource
     * @return the effective configuration
     */
    public static SpinPopConfig resolve(Properties properties) {
        SpinPopConfig config = loadResource();
        String backendOverride = properties.getProperty(BACKEND_PROPERTY);
        if (backendOverride != null && !backendOverride.isBlank()) {
            config.backend = backendOverride.trim();
        }
        String parallelismOverride = properties.getProperty(PARALLELISM_PROPERTY);
        if (parallelismOverride != null && !parallelismOverride.isBlank()) {
            try {
                config.parallelism = Integer.parseInt(parallelismOverride.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PARALLELISM_PROPERTY + " must be an integer, got: "
                    + parallelismOverride, e);
            }
        }
        config.validate();
        logger.debug("Resolved spinpop configuration: {}", config);
        return config;
    }

    private static SpinPopConfig loadResource() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SpinPopConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                return defaults();
            }
            logger.debug("Loading spinpop configuration from classpath resource {}", RESOURCE_NAME);
            return fromJson(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource " + RESOURCE_NAME, e);
        }
    }

    /**
     * Loads configuration from a JSON file.
     */
    public static SpinPopConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    /**
     * Parses configuration from JSON.
     *
     * @throws JsonParseException if the JSON is malformed or empty
     */
    public static SpinPopConfig fromJson(Reader reader) {
        SpinPopConfig config = SpinPopGson.gson().fromJson(reader, SpinPopConfig.class);
        if (config == null) {
            throw new JsonParseException("spinpop configuration is empty");
        }
        config.validate();
        return config;
    }

    /**
     * Parses configuration from a JSON string.
     */
    public static SpinPopConfig fromJson(String json) {
        SpinPopConfig config = SpinPopGson.gson().fromJson(json, SpinPopConfig.class);
        if (config == null) {
            throw new JsonParseException("spinpop configuration is empty");
        }
        config.validate();
        return config;
    }

    /**
     * Writes this configuration as JSON.
     */
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            SpinPopGson.gson().toJson(this, writer);
        }
    }

    public String toJson() {
        return SpinPopGson.gson().toJson(this);
    }

    private void validate() {
        backendMode();
        if (parallelism < 0) {
            throw new IllegalArgumentException("parallelism must be non-negative, got: " + parallelism);
        }
    }

    /**
     * Returns the configured backend mode.
     *
     * @throws IllegalStateException if the configured name is unknown
     */
    public BackendMode backendMode() {
        return BackendMode.fromConfigName(backend);
    }

    /**
     * Returns the pool size for the parallel backend; 0 selects the common pool.
     */
    public int parallelism() {
        return parallelism;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpinPopConfig)) return false;
        SpinPopConfig that = (SpinPopConfig) o;
        return parallelism == that.parallelism && Objects.equals(backend, that.backend);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backend, parallelism);
    }

    @Override
    public String toString() {
        return "SpinPopConfig[backend=" + backend + ", parallelism=" + parallelism + "]";
    }
}
