package io.surfworks.evalhub.expand;

import io.surfworks.evalhub.config.ConfigurationException;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.config.RiskCategoryProfile;
import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.BenchmarkSpec;
import io.surfworks.evalhub.model.ConfigMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns a risk category into concrete backends and benchmarks.
 *
 * <p>One backend is produced per configured backend, in configuration order. Each
 * carries exactly the category's benchmarks, one task per benchmark named after it,
 * and an empty configuration; backend defaults are applied later. The result depends
 * only on the category and the configuration.
 */
public final class RiskCategoryExpander {

    private static final Logger LOG = Logger.getLogger(RiskCategoryExpander.class.getName());

    private final EvalHubConfig config;
    private final BackendKindPolicy kindPolicy;

    public RiskCategoryExpander(EvalHubConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.kindPolicy = BackendKindPolicy.from(config);
    }

    /**
     * Synthesizes backends for a risk category.
     *
     * @param riskCategory the category label
     * @param modelName    the model being evaluated (used for logging only)
     * @return one backend per configured backend
     * @throws ConfigurationException if the category has no mapping or no backends are configured
     */
    public List<BackendSpec> expand(String riskCategory, String modelName) throws ConfigurationException {
        RiskCategoryProfile profile = riskCategory == null ? null : config.riskCategories().get(riskCategory);
        if (profile == null) {
            throw new ConfigurationException("No configuration found for risk category: " + riskCategory
                    + ". Configured categories: " + config.riskCategories().keySet());
        }
        if (config.backendConfigs().isEmpty()) {
            throw new ConfigurationException("No backends configured to expand risk category " + riskCategory);
        }

        List<BackendSpec> backends = new ArrayList<>();
        for (String backendName : config.backendConfigs().keySet()) {
            List<BenchmarkSpec> benchmarks = new ArrayList<>(profile.benchmarks().size());
            for (String benchmarkName : profile.benchmarks()) {
                benchmarks.add(new BenchmarkSpec(
                        benchmarkName,
                        List.of(benchmarkName),
                        profile.numFewshot(),
                        null,
                        profile.limit(),
                        null,
                        ConfigMap.empty(),
                        Set.of(),
                        Set.of()
                ));
            }
            backends.add(BackendSpec.of(backendName, kindPolicy.kindOf(backendName), benchmarks));
            LOG.fine("Generated backend " + backendName + " for risk category " + riskCategory
                    + " (" + benchmarks.size() + " benchmarks, model " + modelName + ")");
        }
        return backends;
    }
}
