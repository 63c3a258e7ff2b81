// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.batchapi.core.error.MetricsParseException;
import sh.batchapi.core.model.InvocationMetrics;
import sh.batchapi.core.model.StressMethod;

/**
 * Aggregates stress logs into per-series timing statistics.
 *
 * <p>Every non-blank line is parsed with {@link InvocationMetrics#parseLine}, so both
 * bare metrics lines and full {@code Prefix:{...}} responses are accepted. In lenient
 * mode malformed lines are counted and skipped; in strict mode the first one fails
 * the analysis.
 */
public final class StressLogAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(StressLogAnalyzer.class);

    private static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::method)
            .thenComparingInt(SeriesKey::entries)
            .thenComparing(key -> !key.batchapi());

    private final boolean strict;

    public StressLogAnalyzer(final boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @throws UncheckedIOException   if a file cannot be read
     * @throws MetricsParseException  in strict mode, on the first malformed line
     */
    public StressSummary analyze(final List<Path> files) {
        final Accumulator acc = new Accumulator();
        for (Path file : files) {
            final List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read stress log " + file, e);
            }
            accumulate(acc, file.toString(), lines);
        }
        return acc.summary();
    }

    /**
     * Analyzes lines already in memory.
     *
     * @throws MetricsParseException in strict mode, on the first malformed line
     */
    public StressSummary analyzeLines(final List<String> lines) {
        final Accumulator acc = new Accumulator();
        accumulate(acc, "<lines>", lines);
        return acc.summary();
    }

    private void accumulate(final Accumulator acc, final String source, final List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            final String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            final InvocationMetrics metrics;
            try {
                metrics = InvocationMetrics.parseLine(line);
            } catch (MetricsParseException e) {
                if (strict) {
                    throw new MetricsParseException(source + ": " + e.getMessage(), i + 1, e);
                }
                LOG.warn("{}:{} skipped: {}", source, i + 1, e.getMessage());
                acc.malformed++;
                continue;
            }
            acc.add(metrics);
        }
    }

    private record SeriesKey(StressMethod method, boolean batchapi, int entries) {
    }

    private static final class Accumulator {
        private final Map<SeriesKey, List<Long>> samples = new TreeMap<>(ORDER);
        private int count;
        private int malformed;

        void add(final InvocationMetrics metrics) {
            samples.computeIfAbsent(
                    new SeriesKey(metrics.method(), metrics.batchapi(), metrics.entries()),
                    k -> new ArrayList<>()).add(metrics.millis());
            count++;
        }

        StressSummary summary() {
            final List<SeriesStats> series = new ArrayList<>(samples.size());
            samples.forEach((key, millis) ->
                    series.add(SeriesStats.of(key.method(), key.batchapi(), key.entries(), millis)));
            return new StressSummary(series, count, malformed);
        }
    }
}
