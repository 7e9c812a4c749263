package io.surfworks.evalhub.pipeline;

import io.surfworks.evalhub.config.ConfigurationException;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.defaults.DefaultingEngine;
import io.surfworks.evalhub.expand.RiskCategoryExpander;
import io.surfworks.evalhub.model.BackendSpec;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.validation.RequestValidator;
import io.surfworks.evalhub.validation.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns a submitted request into a fully resolved one.
 *
 * <p>Stages:
 * <ol>
 *   <li><b>validate</b>: reject malformed input ({@link RequestValidator})</li>
 *   <li><b>expand</b>: synthesize backends for units that only name a risk category</li>
 *   <li><b>default</b>: merge backend and benchmark defaults ({@link DefaultingEngine})</li>
 * </ol>
 *
 * <p>Resolution is synchronous and touches no external system, so it is safe to call
 * from any thread. The caller's request is left unchanged.
 */
public final class RequestResolver {

    private static final Logger LOG = Logger.getLogger(RequestResolver.class.getName());

    private final RequestValidator validator;
    private final RiskCategoryExpander expander;
    private final DefaultingEngine defaults;

    public RequestResolver(EvalHubConfig config) {
        this(new RequestValidator(config), new RiskCategoryExpander(config), new DefaultingEngine(config));
    }

    public RequestResolver(RequestValidator validator, RiskCategoryExpander expander, DefaultingEngine defaults) {
        this.validator = Objects.requireNonNull(validator, "validator cannot be null");
        this.expander = Objects.requireNonNull(expander, "expander cannot be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults cannot be null");
    }

    /**
     * Validates, expands and defaults a request.
     *
     * @param request the request as submitted
     * @return a copy in which every evaluation has concrete, defaulted backends
     * @throws ValidationException    if the request is malformed
     * @throws ConfigurationException if a risk category cannot be expanded
     */
    public EvaluationRequest resolve(EvaluationRequest request) throws ValidationException, ConfigurationException {
        LOG.info("Resolving request " + request.requestId() + " with "
                + request.evaluations().size() + " evaluations");

        validator.validate(request);

        List<EvaluationSpec> resolved = new ArrayList<>(request.evaluations().size());
        for (EvaluationSpec evaluation : request.evaluations()) {
            resolved.add(resolveEvaluation(evaluation));
        }

        EvaluationRequest result = request.withEvaluations(resolved);
        LOG.info("Resolved request " + request.requestId() + ": "
                + result.benchmarkCount() + " benchmark units");
        return result;
    }

    private EvaluationSpec resolveEvaluation(EvaluationSpec evaluation) throws ConfigurationException {
        List<BackendSpec> backends = evaluation.backends();
        if (!evaluation.hasBackends() && evaluation.hasRiskCategory()) {
            LOG.fine("Generating backends for evaluation " + evaluation.id()
                    + " from risk category " + evaluation.riskCategory());
            backends = expander.expand(evaluation.riskCategory(), evaluation.modelName());
        }

        List<BackendSpec> defaulted = new ArrayList<>(backends.size());
        for (BackendSpec backend : backends) {
            defaulted.add(defaults.applyDefaults(backend));
        }
        return evaluation.withBackends(defaulted);
    }
}
