package io.surfworks.evalhub.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the experiment-tracking server.
 *
 * @param enabled           Whether results are sent to the tracking server at all
 * @param trackingUri       Tracking server base URI (e.g., "http://localhost:5000")
 * @param experimentPrefix  Prefix for generated experiment names
 * @param artifactLocation  Artifact root for new experiments (may be null)
 * @param connectionTimeout Timeout for establishing connections
 * @param requestTimeout    Timeout for individual requests
 */
public record TrackingConfig(
        boolean enabled,
        String trackingUri,
        String experimentPrefix,
        String artifactLocation,
        Duration connectionTimeout,
        Duration requestTimeout
) {

    /** Default tracking server */
    public static final String DEFAULT_TRACKING_URI = "http://localhost:5000";

    /** Default experiment name prefix */
    public static final String DEFAULT_EXPERIMENT_PREFIX = "eval-hub";

    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public TrackingConfig {
        Objects.requireNonNull(trackingUri, "trackingUri cannot be null");
        Objects.requireNonNull(experimentPrefix, "experimentPrefix cannot be null");
        connectionTimeout = connectionTimeout == null ? DEFAULT_CONNECTION_TIMEOUT : connectionTimeout;
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;

        if (trackingUri.isBlank()) {
            throw new IllegalArgumentException("trackingUri cannot be blank");
        }
    }

    public static TrackingConfig defaults() {
        return new TrackingConfig(true, DEFAULT_TRACKING_URI, DEFAULT_EXPERIMENT_PREFIX, null,
                DEFAULT_CONNECTION_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    public static TrackingConfig disabled() {
        return defaults().withEnabled(false);
    }

    public TrackingConfig withEnabled(boolean value) {
        return new TrackingConfig(value, trackingUri, experimentPrefix, artifactLocation,
                connectionTimeout, requestTimeout);
    }

    public TrackingConfig withTrackingUri(String value) {
        return new TrackingConfig(enabled, value, experimentPrefix, artifactLocation,
                connectionTimeout, requestTimeout);
    }

    public TrackingConfig withExperimentPrefix(String value) {
        return new TrackingConfig(enabled, trackingUri, value, artifactLocation,
                connectionTimeout, requestTimeout);
    }

    public TrackingConfig withArtifactLocation(String value) {
        return new TrackingConfig(enabled, trackingUri, experimentPrefix, value,
                connectionTimeout, requestTimeout);
    }

    /**
     * Returns the base URL for the REST API.
     */
    public String apiUrl() {
        return baseUrl() + "/api/2.0/mlflow/";
    }

    /**
     * Returns the tracking URI without a trailing slash.
     */
    public String baseUrl() {
        return trackingUri.endsWith("/") ? trackingUri.substring(0, trackingUri.length() - 1) : trackingUri;
    }
}
