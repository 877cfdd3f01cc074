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

/// # Spin Population Models
///
/// Population-level density models for binary black hole spins, grouped by the
/// spin parameters they describe.
///
/// ```text
/// ┌───────────────────────────────┬────────────────────────────┬──────────────────────────┐
/// │ Class                         │ Columns                    │ Normalization            │
/// ├───────────────────────────────┼────────────────────────────┼──────────────────────────┤
/// │ SpinMagnitudeModels           │ a_1, a_2                   │ closed form (beta)       │
/// │ SpinOrientationModels         │ cos_tilt_1, cos_tilt_2     │ closed form (erf)        │
/// │ SpinModels                    │ all four of the above      │ product                  │
/// │ EffectiveSpinModels (ρ = 0)   │ chi_eff, chi_p             │ closed form (erf, T)     │
/// │ EffectiveSpinModels (ρ ≠ 0)   │ chi_eff, chi_p             │ 500 × 250 trapezoid grid │
/// └───────────────────────────────┴────────────────────────────┴──────────────────────────┘
/// ```
///
/// [SpinModelCatalog] exposes every model under its canonical name as an
/// [io.nosqlbench.spinpop.DensityModel].
///
/// All models are stateless apart from their [io.nosqlbench.spinpop.backend.ArrayBackend];
/// each call depends only on its dataset and hyperparameters.
package io.nosqlbench.spinpop.models;
