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

/// Thrown when a normalizing constant is zero, sub-normal, infinite or NaN.
///
/// This happens for extreme hyperparameter draws, for example a narrow
/// distribution centred far outside its truncation interval, where all of the
/// probability mass falls outside the support. Dividing by such a constant
/// would produce infinities or NaNs in the density. Callers in an inference
/// loop catch this exception and treat the draw as having zero likelihood.
public class DegenerateNormalizationException extends ArithmeticException {

    private final double normalization;
    private final String context;

    public DegenerateNormalizationException(String context, double normalization) {
        super("Degenerate normalization " + normalization + " for " + context);
        this.context = context;
        this.normalization = normalization;
    }

    /// Returns the offending normalizing constant.
    public double getNormalization() {
        return normalization;
    }

    /// Returns a description of the model and hyperparameters being normalized.
    public String getContext() {
        return context;
    }

    /// Returns whether a normalizing constant can safely be divided by.
    ///
    /// @param normalization the constant
    /// @return true for positive, finite, normal doubles
    public static boolean isUsable(double normalization) {
        return normalization >= Double.MIN_NORMAL && !Double.isInfinite(normalization);
    }
}
