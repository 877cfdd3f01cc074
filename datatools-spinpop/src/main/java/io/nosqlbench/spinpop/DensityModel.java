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

import java.util.Set;

/// A population density over one or more per-sample parameters.
///
/// ## Contract
///
/// ```
///   Dataset (N rows) ──┐
///                      ├──► evaluate ──► double[N], every entry >= 0
///   Hyperparameters ───┘
/// ```
///
/// Implementations must be pure functions of their two arguments:
/// - no state carried between calls
/// - no dependence on call order
/// - bit-for-bit reproducible for the same backend and inputs
/// - the dataset is never modified
///
/// A model reads only the dataset columns named by [#parameters()] and the
/// hyperparameters named by [#hyperparameters()]. An absent column or
/// hyperparameter raises [MissingParameterException]; errors from the
/// underlying primitive densities propagate unchanged.
///
/// @see DensityModels
public interface DensityModel {

    /// Evaluates the density at every row of the dataset.
    ///
    /// @param dataset the per-sample parameter columns
    /// @param hyperparameters the population hyperparameters
    /// @return one density value per dataset row
    double[] evaluate(Dataset dataset, Hyperparameters hyperparameters);

    /// Returns the dataset columns this model reads.
    Set<String> parameters();

    /// Returns the hyperparameter names this model reads.
    Set<String> hyperparameters();
}
