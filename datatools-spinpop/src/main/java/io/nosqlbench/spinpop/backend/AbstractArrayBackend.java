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

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.IntConsumer;

/// Shared implementation of [ArrayBackend] in terms of a single indexed loop.
///
/// Subclasses decide only how the index range `[0, count)` is visited. Each
/// index writes exactly one output slot and every reduction (the trapezoidal
/// sums) runs sequentially inside a single index, so the visiting order never
/// changes a result.
public abstract class AbstractArrayBackend implements ArrayBackend {

    /// Visits every index in `[0, count)` exactly once.
    ///
    /// @param count the number of indices
    /// @param body the work for one index
    protected abstract void forEachIndex(int count, IntConsumer body);

    /// Visits every row of a `rows x columns` matrix exactly once.
    ///
    /// Defaults to [#forEachIndex]; backends that split work by size override
    /// this to account for the whole matrix.
    protected void forEachRow(int rows, int columns, IntConsumer body) {
        forEachIndex(rows, body);
    }

    @Override
    public double[] linspace(double start, double stop, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("linspace count must be at least 1, got: " + count);
        }
        double[] values = new double[count];
        if (count == 1) {
            values[0] = start;
            return values;
        }
        double step = (stop - start) / (count - 1);
        forEachIndex(count, i -> values[i] = start + i * step);
        values[count - 1] = stop;
        return values;
    }

    @Override
    public Mesh meshgrid(double[] x, double[] y) {
        double[] xs = x.clone();
        double[] ys = y.clone();
        double[][] xGrid = new double[ys.length][];
        double[][] yGrid = new double[ys.length][];
        forEachRow(ys.length, xs.length, j -> {
            xGrid[j] = xs.clone();
            double[] row = new double[xs.length];
            Arrays.fill(row, ys[j]);
            yGrid[j] = row;
        });
        return new Mesh(xs, ys, xGrid, yGrid);
    }

    @Override
    public double[] map(double[] values, DoubleUnaryOperator op) {
        double[] result = new double[values.length];
        forEachIndex(values.length, i -> result[i] = op.applyAsDouble(values[i]));
        return result;
    }

    @Override
    public double[] zip(double[] a, double[] b, DoubleBinaryOperator op) {
        requireSameLength(a.length, b.length);
        double[] result = new double[a.length];
        forEachIndex(a.length, i -> result[i] = op.applyAsDouble(a[i], b[i]));
        return result;
    }

    @Override
    public double[][] zip(double[][] a, double[][] b, DoubleBinaryOperator op) {
        requireSameLength(a.length, b.length);
        double[][] result = new double[a.length][];
        forEachRow(a.length, a.length == 0 ? 0 : a[0].length, j -> {
            double[] left = a[j];
            double[] right = b[j];
            requireSameLength(left.length, right.length);
            double[] row = new double[left.length];
            for (int i = 0; i < row.length; i++) {
                row[i] = op.applyAsDouble(left[i], right[i]);
            }
            result[j] = row;
        });
        return result;
    }

    @Override
    public boolean[] within(double[] values, double low, double high) {
        boolean[] mask = new boolean[values.length];
        forEachIndex(values.length, i -> mask[i] = values[i] >= low && values[i] <= high);
        return mask;
    }

    @Override
    public double[] applyMask(double[] values, boolean[] mask) {
        requireSameLength(values.length, mask.length);
        double[] result = new double[values.length];
        forEachIndex(values.length, i -> result[i] = mask[i] ? values[i] : 0.0);
        return result;
    }

    @Override
    public double trapz(double[] y, double[] x) {
        requireSameLength(y.length, x.length);
        return trapezoid(y, x);
    }

    @Override
    public double[] trapz(double[][] y, double[] x) {
        double[] result = new double[y.length];
        forEachRow(y.length, x.length, j -> {
            requireSameLength(y[j].length, x.length);
            result[j] = trapezoid(y[j], x);
        });
        return result;
    }

    private static double trapezoid(double[] y, double[] x) {
        double sum = 0.0;
        for (int i = 1; i < y.length; i++) {
            sum += (x[i] - x[i - 1]) * (y[i] + y[i - 1]) / 2.0;
        }
        return sum;
    }

    private static void requireSameLength(int a, int b) {
        if (a != b) {
            throw new IllegalArgumentException("Array lengths differ: " + a + " != " + b);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + mode().displayName() + "]";
    }
}
