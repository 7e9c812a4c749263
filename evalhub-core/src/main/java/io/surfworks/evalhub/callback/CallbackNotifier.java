package io.surfworks.evalhub.callback;

import io.surfworks.evalhub.config.CallbackConfig;
import io.surfworks.evalhub.json.EvalHubJson;
import io.surfworks.evalhub.result.EvaluationResponse;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.logging.Logger;

/**
 * Posts a final response to a caller-supplied URL.
 *
 * <p>Each attempt has its own timeout; failed attempts are retried after a fixed delay
 * until the attempt budget is spent. Any 2xx status counts as delivered.
 */
public final class CallbackNotifier {

    private static final Logger LOG = Logger.getLogger(CallbackNotifier.class.getName());

    private final CallbackConfig config;
    private final EvalHubJson json;
    private final HttpClient httpClient;

    public CallbackNotifier(CallbackConfig config, EvalHubJson json) {
        this.config = config;
        this.json = json;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .build();
    }

    /**
     * Delivers the response.
     *
     * @param url      callback target
     * @param response final response to send
     * @throws CallbackException if every attempt failed
     */
    public void send(String url, EvaluationResponse response) throws CallbackException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .timeout(config.timeout())
                    .POST(HttpRequest.BodyPublishers.ofString(json.toJson(json.writeResponse(response))))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new CallbackException("Invalid callback URL " + url + ": " + e.getMessage(), 0, e);
        }

        String lastError = null;
        Exception lastCause = null;
        for (int attempt = 1; attempt <= config.retryAttempts(); attempt++) {
            try {
                HttpResponse<String> reply = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (reply.statusCode() / 100 == 2) {
                    LOG.info("Delivered callback for request " + response.requestId() + " to " + url);
                    return;
                }
                lastError = "HTTP " + reply.statusCode();
                lastCause = null;
            } catch (IOException e) {
                lastError = e.toString();
                lastCause = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CallbackException("Interrupted while delivering callback to " + url, attempt, e);
            }

            LOG.warning("Callback attempt " + attempt + "/" + config.retryAttempts()
                    + " for request " + response.requestId() + " failed: " + lastError);

            if (attempt < config.retryAttempts()) {
                try {
                    Thread.sleep(config.retryDelay().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CallbackException("Interrupted while delivering callback to " + url, attempt, e);
                }
            }
        }

        throw new CallbackException("Callback to " + url + " failed after "
                + config.retryAttempts() + " attempts: " + lastError, config.retryAttempts(), lastCause);
    }
}
