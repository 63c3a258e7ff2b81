// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import sh.batchapi.core.model.StressMethod;

/**
 * Result of analyzing stress logs.
 *
 * @param series    per-series statistics, ordered by method, entries, then batch first
 * @param samples   number of metrics lines read
 * @param malformed number of lines skipped in lenient mode
 */
public record StressSummary(List<SeriesStats> series, int samples, int malformed) {

    public StressSummary {
        series = List.copyOf(series);
    }

    public Optional<SeriesStats> find(final StressMethod method, final boolean batchapi, final int entries) {
        return series.stream()
                .filter(s -> s.method() == method && s.batchapi() == batchapi && s.entries() == entries)
                .findFirst();
    }

    /**
     * Renders a table comparing batch and single-call means per method and entry count.
     * The speedup is {@code standard / batch}.
     */
    public String toMarkdown() {
        final StringBuilder sb = new StringBuilder();
        sb.append("| method | entries | batch mean (ms) | standard mean (ms) | speedup |\n");
        sb.append("|---|---:|---:|---:|---:|\n");
        final Set<Row> rows = new LinkedHashSet<>();
        for (SeriesStats s : series) {
            rows.add(new Row(s.method(), s.entries()));
        }
        for (Row row : rows) {
            final Optional<SeriesStats> batch = find(row.method(), true, row.entries());
            final Optional<SeriesStats> standard = find(row.method(), false, row.entries());
            sb.append("| ").append(row.method().wireName())
                    .append(" | ").append(row.entries())
                    .append(" | ").append(batch.map(s -> format(s.mean())).orElse("-"))
                    .append(" | ").append(standard.map(s -> format(s.mean())).orElse("-"))
                    .append(" | ").append(speedup(batch, standard))
                    .append(" |\n");
        }
        sb.append('\n').append(samples).append(" samples");
        if (malformed > 0) {
            sb.append(", ").append(malformed).append(" malformed lines skipped");
        }
        sb.append('\n');
        return sb.toString();
    }

    /**
     * Renders one series as {@code entries,mean,std} lines with a header.
     */
    public String toCsv(final StressMethod method, final boolean batchapi) {
        final StringBuilder sb = new StringBuilder("entries,mean,std\n");
        for (SeriesStats s : series) {
            if (s.method() == method && s.batchapi() == batchapi) {
                sb.append(s.entries()).append(',')
                        .append(format(s.mean())).append(',')
                        .append(format(s.std())).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Writes {@code <method>-<batch|standard>.csv} for every series present.
     *
     * @return the written files
     * @throws UncheckedIOException if a file cannot be written
     */
    public List<Path> writeCsv(final Path directory) {
        final List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            for (StressMethod method : StressMethod.values()) {
                for (boolean batchapi : new boolean[] {true, false}) {
                    if (series.stream().noneMatch(s -> s.method() == method && s.batchapi() == batchapi)) {
                        continue;
                    }
                    final Path file = directory.resolve(csvName(method, batchapi));
                    Files.writeString(file, toCsv(method, batchapi), StandardCharsets.UTF_8);
                    written.add(file);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV files to " + directory, e);
        }
        return written;
    }

    public static String csvName(final StressMethod method, final boolean batchapi) {
        return method.wireName() + "-" + (batchapi ? "batch" : "standard") + ".csv";
    }

    private record Row(StressMethod method, int entries) {
    }

    private static String speedup(final Optional<SeriesStats> batch, final Optional<SeriesStats> standard) {
        if (batch.isEmpty() || standard.isEmpty() || batch.get().mean() == 0) {
            return "-";
        }
        return format(standard.get().mean() / batch.get().mean()) + "x";
    }

    private static String format(final double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
