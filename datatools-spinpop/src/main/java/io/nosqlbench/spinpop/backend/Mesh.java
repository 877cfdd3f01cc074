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

/// Coordinate matrices produced by [ArrayBackend#meshgrid].
///
/// ```
///              x[0]   x[1]  ...  x[nx-1]
///   y[0]    ┌──────┬──────┬───┬────────┐
///   y[1]    │      │      │   │        │   rows    = ny
///   ...     │      │      │   │        │   columns = nx
///   y[ny-1] └──────┴──────┴───┴────────┘
/// ```
public final class Mesh {

    private final double[] x;
    private final double[] y;
    private final double[][] xGrid;
    private final double[][] yGrid;

    Mesh(double[] x, double[] y, double[][] xGrid, double[][] yGrid) {
        this.x = x;
        this.y = y;
        this.xGrid = xGrid;
        this.yGrid = yGrid;
    }

    /// Returns the x coordinate vector (columns).
    public double[] x() {
        return x.clone();
    }

    /// Returns the y coordinate vector (rows).
    public double[] y() {
        return y.clone();
    }

    public double[][] xGrid() {
        return xGrid;
    }

    public double[][] yGrid() {
        return yGrid;
    }

    public int rows() {
        return y.length;
    }

    public int columns() {
        return x.length;
    }

    /// Returns the number of mesh points.
    public int size() {
        return rows() * columns();
    }
}
