package io.surfworks.evalhub.aggregate;

/**
 * Summary statistics of one numeric metric across results.
 *
 * @param mean  arithmetic mean
 * @param min   smallest value
 * @param max   largest value
 * @param count number of values
 */
public record MetricSummary(double mean, double min, double max, int count) {

    public MetricSummary {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive");
        }
    }
}
