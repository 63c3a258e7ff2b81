// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import java.util.List;
import java.util.Objects;

import sh.batchapi.core.model.StressMethod;

/**
 * Timing statistics of one {@code (method, batchapi, entries)} series.
 *
 * @param method   the measured operation
 * @param batchapi whether the batch API was used
 * @param entries  entries per invocation
 * @param count    number of samples
 * @param mean     mean elapsed milliseconds
 * @param std      sample standard deviation, NaN for a single sample
 */
public record SeriesStats(StressMethod method, boolean batchapi, int entries, int count, double mean, double std) {

    public SeriesStats {
        Objects.requireNonNull(method, "method");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive");
        }
    }

    /**
     * @throws IllegalArgumentException if {@code millis} is empty
     */
    public static SeriesStats of(
            final StressMethod method, final boolean batchapi, final int entries, final List<Long> millis) {
        if (millis.isEmpty()) {
            throw new IllegalArgumentException("no samples");
        }
        final int n = millis.size();
        double sum = 0;
        for (long m : millis) {
            sum += m;
        }
        final double mean = sum / n;
        double std = Double.NaN;
        if (n > 1) {
            double squares = 0;
            for (long m : millis) {
                squares += (m - mean) * (m - mean);
            }
            std = Math.sqrt(squares / (n - 1));
        }
        return new SeriesStats(method, batchapi, entries, n, mean, std);
    }
}
