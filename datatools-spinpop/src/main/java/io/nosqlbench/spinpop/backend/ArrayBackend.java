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

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/// Numeric array operations used by every density model.
///
/// ## Purpose
///
/// Density models are written against this capability set and never against
/// a concrete execution strategy. The same model code runs on the
/// single-threaded [ScalarArrayBackend] or on the data-parallel
/// [ParallelArrayBackend], selected once at startup through [ArrayBackends].
///
/// ## Capabilities
///
/// | Operation | Shape | Notes |
/// |-----------|-------|-------|
/// | [#linspace] | 1-D | endpoints inclusive |
/// | [#meshgrid] | 2-D | `xy` indexing: rows follow y, columns follow x |
/// | [#map], [#zip] | 1-D, 2-D | elementwise |
/// | [#within], [#applyMask] | 1-D | boolean masks |
/// | [#trapz(double\[\], double\[\])] | 1-D → scalar | trapezoidal rule |
/// | [#trapz(double\[\]\[\], double\[\])] | 2-D → 1-D | along the last axis |
///
/// ## Determinism
///
/// Implementations must produce identical results for identical inputs.
/// Reductions run in a fixed order so that switching backends never changes
/// a density value.
///
/// All operations return new arrays; inputs are never modified.
public interface ArrayBackend {

    /// Returns the execution mode of this backend.
    BackendMode mode();

    /// Returns `count` evenly spaced values from `start` to `stop` inclusive.
    ///
    /// @throws IllegalArgumentException if count is less than 1
    double[] linspace(double start, double stop, int count);

    /// Builds coordinate matrices from two coordinate vectors.
    ///
    /// For `x` of length nx and `y` of length ny the result has ny rows and nx
    /// columns, with `xGrid[j][i] = x[i]` and `yGrid[j][i] = y[j]`.
    Mesh meshgrid(double[] x, double[] y);

    double[] map(double[] values, DoubleUnaryOperator op);

    double[] zip(double[] a, double[] b, DoubleBinaryOperator op);

    double[][] zip(double[][] a, double[][] b, DoubleBinaryOperator op);

    /// Elementwise product.
    default double[] multiply(double[] a, double[] b) {
        return zip(a, b, (l, r) -> l * r);
    }

    /// Multiplies every element by a scalar.
    default double[] scale(double[] values, double factor) {
        return map(values, v -> v * factor);
    }

    /// Divides every element by a scalar.
    default double[] divide(double[] values, double divisor) {
        return map(values, v -> v / divisor);
    }

    /// Returns a mask that is true where `low <= value <= high`.
    ///
    /// NaN values fall outside every interval.
    boolean[] within(double[] values, double low, double high);

    /// Returns a copy of `values` with every element whose mask entry is false set to zero.
    double[] applyMask(double[] values, boolean[] mask);

    /// Integrates `y(x)` with the trapezoidal rule.
    ///
    /// @param y sample values
    /// @param x sample coordinates, same length as y
    /// @return the integral, 0 for fewer than two points
    double trapz(double[] y, double[] x);

    /// Integrates every row of `y` against `x` with the trapezoidal rule.
    ///
    /// @param y a matrix whose rows have the length of x
    /// @param x coordinates along the last axis
    /// @return one integral per row
    double[] trapz(double[][] y, double[] x);
}
