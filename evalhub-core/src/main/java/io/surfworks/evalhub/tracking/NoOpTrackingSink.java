package io.surfworks.evalhub.tracking;

import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.model.EvaluationSpec;
import io.surfworks.evalhub.result.EvaluationResult;
import io.surfworks.evalhub.status.EvaluationStatus;

import java.util.Map;

/**
 * Sink used when tracking is disabled. Creates nothing and reports no URL.
 */
public final class NoOpTrackingSink implements TrackingSink {

    @Override
    public String name() {
        return "noop";
    }

    @Override
    public String createExperiment(EvaluationRequest request) {
        return null;
    }

    @Override
    public String startRun(String experimentId, EvaluationSpec evaluation) {
        return null;
    }

    @Override
    public void logParameters(String runId, Map<String, String> parameters) {
    }

    @Override
    public void logResult(String runId, EvaluationResult result) {
    }

    @Override
    public void endRun(String runId, EvaluationStatus status) {
    }

    @Override
    public String experimentUrl(String experimentId) {
        return null;
    }
}
