package io.surfworks.evalhub.aggregate;

import io.surfworks.evalhub.config.EstimationConfig;
import io.surfworks.evalhub.config.EvalHubConfig;
import io.surfworks.evalhub.model.EvaluationRequest;
import io.surfworks.evalhub.result.EvaluationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summarizes metrics across results and estimates how long a request will take.
 *
 * <p>Only numeric metric values are aggregated; string values stay on their result.
 * Metric names are kept in first-seen order.
 */
public final class ResultAggregator {

    private final int maxConcurrent;
    private final EstimationConfig estimation;

    public ResultAggregator(EvalHubConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.maxConcurrent = config.maxConcurrentEvaluations();
        this.estimation = config.estimation();
    }

    /**
     * Computes mean, min, max and count for every numeric metric.
     *
     * @return metric name to summary; empty for no results
     */
    public Map<String, MetricSummary> summarize(List<EvaluationResult> results) {
        Map<String, List<Double>> values = new LinkedHashMap<>();
        for (EvaluationResult result : results) {
            for (Map.Entry<String, Object> metric : result.metrics().entrySet()) {
                if (metric.getValue() instanceof Number number) {
                    values.computeIfAbsent(metric.getKey(), k -> new ArrayList<>()).add(number.doubleValue());
                }
            }
        }

        Map<String, MetricSummary> summaries = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : values.entrySet()) {
            List<Double> list = entry.getValue();
            double sum = 0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : list) {
                sum += v;
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            summaries.put(entry.getKey(), new MetricSummary(sum / list.size(), min, max, list.size()));
        }
        return summaries;
    }

    /**
     * Flattened form of {@link #summarize}: {@code <metric>_mean}, {@code _min},
     * {@code _max} (doubles) and {@code _count} (integer) per metric.
     */
    public Map<String, Object> aggregate(List<EvaluationResult> results) {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map.Entry<String, MetricSummary> entry : summarize(results).entrySet()) {
            String name = entry.getKey();
            MetricSummary summary = entry.getValue();
            flat.put(name + "_mean", summary.mean());
            flat.put(name + "_min", summary.min());
            flat.put(name + "_max", summary.max());
            flat.put(name + "_count", summary.count());
        }
        return flat;
    }

    /**
     * Number of benchmark runs a resolved request will perform.
     */
    public int totalBenchmarkCount(EvaluationRequest request) {
        return request.benchmarkCount();
    }

    /**
     * Estimated wall-clock minutes for a resolved request.
     *
     * <p>{@code benchmarks * minutesPerBenchmark}, multiplied by the queuing penalty when
     * there are more benchmarks than concurrent slots, and never below the minimum.
     */
    public int estimateCompletionMinutes(EvaluationRequest request) {
        return estimateMinutes(totalBenchmarkCount(request));
    }

    int estimateMinutes(int benchmarks) {
        int minutes = benchmarks * estimation.minutesPerBenchmark();
        if (benchmarks > maxConcurrent) {
            minutes = (int) (minutes * estimation.queuingPenalty());
        }
        return Math.max(minutes, estimation.minimumMinutes());
    }
}
