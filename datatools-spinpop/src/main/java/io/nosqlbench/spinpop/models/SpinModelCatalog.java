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

import io.nosqlbench.spinpop.DensityModel;
import io.nosqlbench.spinpop.DensityModels;
import io.nosqlbench.spinpop.backend.ArrayBackend;
import io.nosqlbench.spinpop.backend.ArrayBackends;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.nosqlbench.spinpop.models.SpinParameters.A_1;
import static io.nosqlbench.spinpop.models.SpinParameters.A_2;
import static io.nosqlbench.spinpop.models.SpinParameters.CHI_EFF;
import static io.nosqlbench.spinpop.models.SpinParameters.CHI_P;
import static io.nosqlbench.spinpop.models.SpinParameters.COS_TILT_1;
import static io.nosqlbench.spinpop.models.SpinParameters.COS_TILT_2;

/**
 * Analytic spin population models exposed through the {@link DensityModel} contract.
 *
 * <h2>Models</h2>
 *
 * <table>
 *   <caption>Registered models</caption>
 *   <tr><th>Name</th><th>Columns</th><th>Hyperparameters</th></tr>
 *   <tr><td>{@value #IID_SPIN}</td><td>a_1, a_2, cos_tilt_1, cos_tilt_2</td>
 *       <td>xi_spin, sigma_spin, amax, alpha_chi, beta_chi</td></tr>
 *   <tr><td>{@value #IID_SPIN_MAGNITUDE_BETA}</td><td>a_1, a_2</td>
 *       <td>amax, alpha_chi, beta_chi (each defaults to 1)</td></tr>
 *   <tr><td>{@value #INDEPENDENT_SPIN_MAGNITUDE_BETA}</td><td>a_1, a_2</td>
 *       <td>alpha_chi_1, alpha_chi_2, beta_chi_1, beta_chi_2, amax_1, amax_2</td></tr>
 *   <tr><td>{@value #IID_SPIN_ORIENTATION}</td><td>cos_tilt_1, cos_tilt_2</td>
 *       <td>xi_spin, sigma_spin</td></tr>
 *   <tr><td>{@value #INDEPENDENT_SPIN_ORIENTATION}</td><td>cos_tilt_1, cos_tilt_2</td>
 *       <td>xi_spin, sigma_1, sigma_2</td></tr>
 *   <tr><td>{@value #GAUSSIAN_CHI_EFF}</td><td>chi_eff</td><td>mu_chi_eff, sigma_chi_eff</td></tr>
 *   <tr><td>{@value #GAUSSIAN_CHI_P}</td><td>chi_p</td><td>mu_chi_p, sigma_chi_p</td></tr>
 *   <tr><td>{@value #GAUSSIAN_CHI_EFF_CHI_P}</td><td>chi_eff, chi_p</td>
 *       <td>mu_chi_eff, sigma_chi_eff, mu_chi_p, sigma_chi_p, rho</td></tr>
 *   <tr><td>{@value #SKEW_GAUSSIAN_CHI_EFF}</td><td>chi_eff</td>
 *       <td>mu_chi_eff, sigma_chi_eff, skew_chi_eff</td></tr>
 *   <tr><td>{@value #SKEW_GAUSSIAN_CHI_P}</td><td>chi_p</td><td>mu_chi_p, sigma_chi_p, skew_chi_p</td></tr>
 *   <tr><td>{@value #SKEW_GAUSSIAN_CHI_EFF_CHI_P}</td><td>chi_eff, chi_p</td>
 *       <td>mu_chi_eff, sigma_chi_eff, mu_chi_p, sigma_chi_p, skew_chi_eff, skew_chi_p, rho</td></tr>
 * </table>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * DensityModel model = new SpinModelCatalog().get("gaussian_chi_eff_chi_p");
 * double[] density = model.evaluate(dataset, Hyperparameters.of(
 *     "mu_chi_eff", 0.0, "sigma_chi_eff", 0.2,
 *     "mu_chi_p", 0.2, "sigma_chi_p", 0.2, "rho", 0.5));
 * }</pre>
 */
public final class SpinModelCatalog {

    public static final String IID_SPIN = "iid_spin";
    public static final String IID_SPIN_MAGNITUDE_BETA = "iid_spin_magnitude_beta";
    public static final String INDEPENDENT_SPIN_MAGNITUDE_BETA = "independent_spin_magnitude_beta";
    public static final String IID_SPIN_ORIENTATION = "iid_spin_orientation_gaussian_isotropic";
    public static final String INDEPENDENT_SPIN_ORIENTATION = "independent_spin_orientation_gaussian_isotropic";
    public static final String GAUSSIAN_CHI_EFF = "gaussian_chi_eff";
    public static final String GAUSSIAN_CHI_P = "gaussian_chi_p";
    public static final String GAUSSIAN_CHI_EFF_CHI_P = "gaussian_chi_eff_chi_p";
    public static final String SKEW_GAUSSIAN_CHI_EFF = "skew_gaussian_chi_eff";
    public static final String SKEW_GAUSSIAN_CHI_P = "skew_gaussian_chi_p";
    public static final String SKEW_GAUSSIAN_CHI_EFF_CHI_P = "skew_gaussian_chi_eff_chi_p";

    private final Map<String, DensityModel> models = new LinkedHashMap<>();

    /** Creates a catalog on the process-wide backend. */
    public SpinModelCatalog() {
        this(ArrayBackends.current());
    }

    public SpinModelCatalog(ArrayBackend backend) {
        Objects.requireNonNull(backend, "backend cannot be null");
        SpinMagnitudeModels magnitudes = new SpinMagnitudeModels(backend);
        SpinOrientationModels orientations = new SpinOrientationModels(backend);
        EffectiveSpinModels effective = new EffectiveSpinModels(backend);

        DensityModel iidMagnitude = DensityModels.of(orderedSet(A_1, A_2), orderedSet("amax", "alpha_chi", "beta_chi"),
            (d, h) -> magnitudes.iidSpinMagnitudeBeta(d, h.get("amax"), h.get("alpha_chi"), h.get("beta_chi")));
        DensityModel iidOrientation = DensityModels.of(orderedSet(COS_TILT_1, COS_TILT_2),
            orderedSet("xi_spin", "sigma_spin"),
            (d, h) -> orientations.iidSpinOrientationGaussianIsotropic(d, h.get("xi_spin"), h.get("sigma_spin")));

        register(IID_SPIN, DensityModels.product(backend, iidOrientation, iidMagnitude));
        register(IID_SPIN_MAGNITUDE_BETA, DensityModels.of(orderedSet(A_1, A_2),
            orderedSet("amax", "alpha_chi", "beta_chi"),
            (d, h) -> magnitudes.iidSpinMagnitudeBeta(d,
                h.getOrDefault("amax", 1.0), h.getOrDefault("alpha_chi", 1.0), h.getOrDefault("beta_chi", 1.0))));
        register(INDEPENDENT_SPIN_MAGNITUDE_BETA, DensityModels.of(orderedSet(A_1, A_2),
            orderedSet("alpha_chi_1", "alpha_chi_2", "beta_chi_1", "beta_chi_2", "amax_1", "amax_2"),
            (d, h) -> magnitudes.independentSpinMagnitudeBeta(d, h.get("alpha_chi_1"), h.get("alpha_chi_2"),
                h.get("beta_chi_1"), h.get("beta_chi_2"), h.get("amax_1"), h.get("amax_2"))));
        register(IID_SPIN_ORIENTATION, iidOrientation);
        register(INDEPENDENT_SPIN_ORIENTATION, DensityModels.of(orderedSet(COS_TILT_1, COS_TILT_2),
            orderedSet("xi_spin", "sigma_1", "sigma_2"),
            (d, h) -> orientations.independentSpinOrientationGaussianIsotropic(d,
                h.get("xi_spin"), h.get("sigma_1"), h.get("sigma_2"))));

        register(GAUSSIAN_CHI_EFF, DensityModels.of(orderedSet(CHI_EFF), orderedSet("mu_chi_eff", "sigma_chi_eff"),
            (d, h) -> effective.gaussianChiEff(d, h.get("mu_chi_eff"), h.get("sigma_chi_eff"))));
        register(GAUSSIAN_CHI_P, DensityModels.of(orderedSet(CHI_P), orderedSet("mu_chi_p", "sigma_chi_p"),
            (d, h) -> effective.gaussianChiP(d, h.get("mu_chi_p"), h.get("sigma_chi_p"))));
        register(GAUSSIAN_CHI_EFF_CHI_P, DensityModels.of(orderedSet(CHI_EFF, CHI_P),
            orderedSet("mu_chi_eff", "sigma_chi_eff", "mu_chi_p", "sigma_chi_p", "rho"),
            (d, h) -> effective.gaussianChiEffChiP(d, h.get("mu_chi_eff"), h.get("sigma_chi_eff"),
                h.get("mu_chi_p"), h.get("sigma_chi_p"), h.get("rho"))));
        register(SKEW_GAUSSIAN_CHI_EFF, DensityModels.of(orderedSet(CHI_EFF),
            orderedSet("mu_chi_eff", "sigma_chi_eff", "skew_chi_eff"),
            (d, h) -> effective.skewGaussianChiEff(d, h.get("mu_chi_eff"), h.get("sigma_chi_eff"),
                h.get("skew_chi_eff"))));
        register(SKEW_GAUSSIAN_CHI_P, DensityModels.of(orderedSet(CHI_P),
            orderedSet("mu_chi_p", "sigma_chi_p", "skew_chi_p"),
            (d, h) -> effective.skewGaussianChiP(d, h.get("mu_chi_p"), h.get("sigma_chi_p"),
                h.get("skew_chi_p"))));
        register(SKEW_GAUSSIAN_CHI_EFF_CHI_P, DensityModels.of(orderedSet(CHI_EFF, CHI_P),
            orderedSet("mu_chi_eff", "sigma_chi_eff", "mu_chi_p", "sigma_chi_p", "skew_chi_eff", "skew_chi_p", "rho"),
            (d, h) -> effective.skewGaussianChiEffChiP(d, h.get("mu_chi_eff"), h.get("sigma_chi_eff"),
                h.get("mu_chi_p"), h.get("sigma_chi_p"), h.get("skew_chi_eff"), h.get("skew_chi_p"),
                h.get("rho"))));
    }

    private void register(String name, DensityModel model) {
        models.put(name, model);
    }

    private static Set<String> orderedSet(String... names) {
        Set<String> set = new LinkedHashSet<>();
        Collections.addAll(set, names);
        return set;
    }

    /**
     * Returns the model registered under the given name.
     *
     * @throws IllegalArgumentException if no model has that name
     */
    public DensityModel get(String name) {
        DensityModel model = models.get(name);
        if (model == null) {
            throw new IllegalArgumentException("Unknown spin model '" + name + "', known models: " + models.keySet());
        }
        return model;
    }

    public boolean contains(String name) {
        return models.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(models.keySet());
    }
}
