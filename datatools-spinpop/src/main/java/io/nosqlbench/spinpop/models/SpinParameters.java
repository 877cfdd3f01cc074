package io.nosqlbench.spinpop.models;

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

/// Dataset column names for binary spin parameters.
///
/// | Column | Meaning | Support |
/// |--------|---------|---------|
/// | `a_1`, `a_2` | dimensionless spin magnitudes | [0, amax] |
/// | `cos_tilt_1`, `cos_tilt_2` | cosine of spin tilt to the orbital axis | [-1, 1] |
/// | `chi_eff` | effective aligned spin | [-1, 1] |
/// | `chi_p` | effective precessing spin | [0, 1] |
///
/// Suffix 1 is the more massive black hole, suffix 2 the less massive one.
public final class SpinParameters {

    public static final String A_1 = "a_1";
    public static final String A_2 = "a_2";
    public static final String COS_TILT_1 = "cos_tilt_1";
    public static final String COS_TILT_2 = "cos_tilt_2";
    public static final String CHI_EFF = "chi_eff";
    public static final String CHI_P = "chi_p";

    public static final double A_MIN = 0.0;
    public static final double A_MAX = 1.0;
    public static final double CHI_EFF_MIN = -1.0;
    public static final double CHI_EFF_MAX = 1.0;
    public static final double CHI_P_MIN = 0.0;
    public static final double CHI_P_MAX = 1.0;
    public static final double COS_TILT_MIN = -1.0;
    public static final double COS_TILT_MAX = 1.0;

    private SpinParameters() {
        // Constants
    }
}
