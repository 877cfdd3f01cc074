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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Named columns of per-sample parameter values.
///
/// ## Purpose
///
/// A dataset holds one `double[]` per parameter name (for example `a_1`,
/// `cos_tilt_2` or `chi_eff`), all of the same length N. Each index is one
/// sample or one grid point. Density models read columns from a dataset and
/// return an array of N densities, one per row.
///
/// ```
///            row 0    row 1    row 2   ...  row N-1
///  a_1      [ 0.50 ][ 0.12 ][ 0.91 ]  ...  [ 0.33 ]
///  a_2      [ 0.30 ][ 0.44 ][ 0.05 ]  ...  [ 0.72 ]
///  chi_eff  [ 0.01 ][-0.20 ][ 0.35 ]  ...  [ 0.00 ]
/// ```
///
/// ## Ownership
///
/// Columns are copied on the way in and on the way out, so neither the caller
/// nor a model can change a dataset after it has been built.
///
/// ## Missing Columns
///
/// Reading a column that was never added throws [MissingParameterException].
/// There is no default value: evaluating a population density on a silently
/// substituted column would corrupt every downstream likelihood.
public final class Dataset {

    private final Map<String, double[]> columns;
    private final int size;

    private Dataset(Map<String, double[]> columns, int size) {
        this.columns = columns;
        this.size = size;
    }

    /// Creates a dataset from a map of columns.
    ///
    /// @param columns the parameter columns; all must have equal length
    /// @return a new dataset holding copies of the columns
    /// @throws IllegalArgumentException if the columns differ in length
    public static Dataset of(Map<String, double[]> columns) {
        Objects.requireNonNull(columns, "columns cannot be null");
        Builder builder = builder();
        columns.forEach(builder::column);
        return builder.build();
    }

    /// Creates a single-column dataset.
    public static Dataset of(String name, double... values) {
        return builder().column(name, values).build();
    }

    /// Creates a two-column dataset, the common shape for paired spin parameters.
    public static Dataset of(String name1, double[] values1, String name2, double[] values2) {
        return builder().column(name1, values1).column(name2, values2).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a copy of the named column.
    ///
    /// @param name the parameter name
    /// @return the column values
    /// @throws MissingParameterException if the dataset has no such column
    public double[] get(String name) {
        double[] column = columns.get(name);
        if (column == null) {
            throw MissingParameterException.datasetKey(name, columns.keySet());
        }
        return Arrays.copyOf(column, column.length);
    }

    public boolean contains(String name) {
        return columns.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    /// Returns the number of rows N shared by every column.
    public int size() {
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset)) return false;
        Dataset that = (Dataset) o;
        if (size != that.size || !columns.keySet().equals(that.columns.keySet())) {
            return false;
        }
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            if (!Arrays.equals(entry.getValue(), that.columns.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(size);
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            result += entry.getKey().hashCode() ^ Arrays.hashCode(entry.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return "Dataset[columns=" + columns.keySet() + ", size=" + size + "]";
    }

    /// Accumulates columns and checks that their lengths agree.
    public static final class Builder {

        private final Map<String, double[]> columns = new LinkedHashMap<>();
        private int size = -1;

        private Builder() {
        }

        public Builder column(String name, double[] values) {
            Objects.requireNonNull(name, "column name cannot be null");
            Objects.requireNonNull(values, "values for column '" + name + "' cannot be null");
            if (size >= 0 && values.length != size) {
                throw new IllegalArgumentException("Column '" + name + "' has length " + values.length
                    + " but dataset columns have length " + size);
            }
            size = values.length;
            columns.put(name, Arrays.copyOf(values, values.length));
            return this;
        }

        public Dataset build() {
            return new Dataset(new LinkedHashMap<>(columns), Math.max(size, 0));
        }
    }
}
