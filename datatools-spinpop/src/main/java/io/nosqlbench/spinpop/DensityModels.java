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

import io.nosqlbench.spinpop.backend.ArrayBackend;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/// Factories and composition operators for [DensityModel]s.
///
/// ## Composition Algebra
///
/// Independent sub-models combine by elementwise multiplication:
///
/// ```
///   p(a_1, a_2, z_1, z_2 | Λ) = p_mag(a_1, a_2 | Λ) · p_tilt(z_1, z_2 | Λ)
/// ```
///
/// The product of normalized models over disjoint parameters is itself
/// normalized, so no further normalization is applied.
public final class DensityModels {

    private DensityModels() {
        // Utility class
    }

    /// Wraps a function as a density model with declared parameters.
    ///
    /// @param parameters dataset columns the function reads
    /// @param hyperparameters hyperparameter names the function reads
    /// @param function the density function
    /// @return a density model delegating to the function
    public static DensityModel of(Set<String> parameters, Set<String> hyperparameters,
                                  BiFunction<Dataset, Hyperparameters, double[]> function) {
        Objects.requireNonNull(function, "function cannot be null");
        Set<String> params = Collections.unmodifiableSet(new LinkedHashSet<>(parameters));
        Set<String> hypers = Collections.unmodifiableSet(new LinkedHashSet<>(hyperparameters));
        return new DensityModel() {
            @Override
            public double[] evaluate(Dataset dataset, Hyperparameters hyperparameters) {
                return function.apply(dataset, hyperparameters);
            }

            @Override
            public Set<String> parameters() {
                return params;
            }

            @Override
            public Set<String> hyperparameters() {
                return hypers;
            }

            @Override
            public String toString() {
                return "DensityModel[parameters=" + params + ", hyperparameters=" + hypers + "]";
            }
        };
    }

    /// Composes independent models as the elementwise product of their densities.
    ///
    /// @param backend the array backend used for the multiplication
    /// @param models the factor models
    /// @return the joint model
    /// @throws IllegalArgumentException if no models are given
    public static DensityModel product(ArrayBackend backend, DensityModel... models) {
        return product(backend, Arrays.asList(models));
    }

    /// Composes independent models as the elementwise product of their densities.
    public static DensityModel product(ArrayBackend backend, List<? extends DensityModel> models) {
        Objects.requireNonNull(backend, "backend cannot be null");
        Objects.requireNonNull(models, "models cannot be null");
        if (models.isEmpty()) {
            throw new IllegalArgumentException("product needs at least one model");
        }
        List<DensityModel> factors = List.copyOf(models);
        Set<String> parameters = new LinkedHashSet<>();
        Set<String> hyperparameters = new LinkedHashSet<>();
        for (DensityModel factor : factors) {
            parameters.addAll(factor.parameters());
            hyperparameters.addAll(factor.hyperparameters());
        }
        return of(parameters, hyperparameters, (dataset, hypers) -> {
            double[] result = factors.get(0).evaluate(dataset, hypers);
            for (int i = 1; i < factors.size(); i++) {
                result = backend.multiply(result, factors.get(i).evaluate(dataset, hypers));
            }
            return result;
        });
    }
}
