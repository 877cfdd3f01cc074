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

import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.nosqlbench.spinpop.config.SpinPopGson;

import java.io.Reader;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Flat, immutable set of scalar hyperparameters for one density evaluation.
///
/// Names follow the population-model conventions (`xi_spin`, `sigma_spin`,
/// `alpha_chi`, `mu_chi_eff`, `rho`, ...). Values are scalars only; there are
/// no per-sample hyperparameters.
///
/// ## JSON
///
/// A hyperparameter set can be read from a flat JSON object:
///
/// ```json
/// {"mu_chi_eff": 0.0, "sigma_chi_eff": 0.2, "mu_chi_p": 0.2, "sigma_chi_p": 0.2, "rho": 0.5}
/// ```
public final class Hyperparameters {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Double>>() {}.getType();

    private final Map<String, Double> values;

    private Hyperparameters(Map<String, Double> values) {
        this.values = values;
    }

    /// Creates a hyperparameter set from a map.
    public static Hyperparameters of(Map<String, ? extends Number> values) {
        Objects.requireNonNull(values, "values cannot be null");
        Builder builder = builder();
        values.forEach((name, value) -> {
            Objects.requireNonNull(value, "value for hyperparameter '" + name + "' cannot be null");
            builder.put(name, value.doubleValue());
        });
        return builder.build();
    }

    /// Creates a hyperparameter set from alternating name/value pairs.
    ///
    /// ```java
    /// Hyperparameters.of("xi_spin", 0.5, "sigma_spin", 0.5);
    /// ```
    ///
    /// @param namesAndValues alternating `String` names and `Number` values
    /// @return the hyperparameter set
    /// @throws IllegalArgumentException if the pairs are malformed
    public static Hyperparameters of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        Builder builder = builder();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String) || !(namesAndValues[i + 1] instanceof Number)) {
                throw new IllegalArgumentException("Argument pair " + (i / 2) + " is not a (String, Number) pair: "
                    + namesAndValues[i] + ", " + namesAndValues[i + 1]);
            }
            builder.put((String) namesAndValues[i], ((Number) namesAndValues[i + 1]).doubleValue());
        }
        return builder.build();
    }

    /// Parses a flat JSON object of hyperparameters.
    ///
    /// @throws JsonParseException if the text is not a flat object of numbers
    public static Hyperparameters fromJson(String json) {
        Map<String, Double> parsed = SpinPopGson.gson().fromJson(json, MAP_TYPE);
        return fromParsed(parsed);
    }

    /// Parses a flat JSON object of hyperparameters from a reader.
    public static Hyperparameters fromJson(Reader reader) {
        Map<String, Double> parsed = SpinPopGson.gson().fromJson(reader, MAP_TYPE);
        return fromParsed(parsed);
    }

    private static Hyperparameters fromParsed(Map<String, Double> parsed) {
        if (parsed == null) {
            throw new JsonParseException("Hyperparameter JSON is empty");
        }
        return of(parsed);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the named hyperparameter.
    ///
    /// @throws MissingParameterException if the set has no such hyperparameter
    public double get(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw MissingParameterException.hyperparameter(name, values.keySet());
        }
        return value;
    }

    /// Returns the named hyperparameter, or the fallback when it is absent.
    ///
    /// Only model catalogs with documented defaults should use this.
    public double getOrDefault(String name, double fallback) {
        Double value = values.get(name);
        return value == null ? fallback : value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, Double> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /// Returns a copy of this set with one value added or replaced.
    public Hyperparameters with(String name, double value) {
        return builder().putAll(this).put(name, value).build();
    }

    public String toJson() {
        return SpinPopGson.compactGson().toJson(values, MAP_TYPE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hyperparameters)) return false;
        return values.equals(((Hyperparameters) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Hyperparameters" + values;
    }

    public static final class Builder {

        private final Map<String, Double> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, double value) {
            Objects.requireNonNull(name, "hyperparameter name cannot be null");
            values.put(name, value);
            return this;
        }

        public Builder putAll(Hyperparameters other) {
            values.putAll(other.values);
            return this;
        }

        public Hyperparameters build() {
            return new Hyperparameters(new LinkedHashMap<>(values));
        }
    }
}
