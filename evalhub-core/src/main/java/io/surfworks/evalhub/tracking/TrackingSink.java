package io.surfworks.evalhub.tracking;

import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.result.EvaluationResult;
import io.surfworks.evalhub.status.EvaluationStatus;

import java.util.Map;

/**
 * Service Provider Interface for experiment-tracking systems.
 *
 * <p>A request maps to one experiment and each evaluation unit to one run inside it.
 * Callers treat every {@link TrackingException} as non-fatal: tracking problems are
 * logged and never stop execution or hide a response.
 *
 * <p>Implementations must be thread-safe.
 */
public interface TrackingSink {

    /**
     * Returns the name of this sink (e.g., "mlflow", "noop").
     */
    String name();

    /**
     * Creates the experiment for a request, or reuses one with the same name.
     *
     * @return experiment ID
     * @throws TrackingException if the tracking system cannot be reached or refuses
     */
    String createExperiment(EvaluationRequest request) throws TrackingException;

    /**
     * Starts a run for one evaluation unit.
     *
     * @return run ID
     * @throws TrackingException if the run cannot be created
     */
    String startRun(String experimentId, EvaluationSpec evaluation) throws TrackingException;

    /**
     * Logs string parameters on a run.
     *
     * @throws TrackingException if logging fails
     */
    void logParameters(String runId, Map<String, String> parameters) throws TrackingException;

    /**
     * Logs one benchmark result (metrics, status, timings) on a run.
     *
     * @throws TrackingException if logging fails
     */
    void logResult(String runId, EvaluationResult result) throws TrackingException;

    /**
     * Marks a run as finished with the unit's final status.
     *
     * @throws TrackingException if the run cannot be updated
     */
    void endRun(String runId, EvaluationStatus status) throws TrackingException;

    /**
     * Returns the UI URL of an experiment.
     */
    String experimentUrl(String experimentId);
}
