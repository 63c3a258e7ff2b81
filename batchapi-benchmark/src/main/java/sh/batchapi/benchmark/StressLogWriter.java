// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.batchapi.core.model.InvocationMetrics;

/**
 * Appends one metrics JSON object per line to a stress log.
 *
 * <p>Responses are reduced to their metrics; the {@code Prefix:} is dropped and any
 * verbose text goes to the debug log instead. Existing logs are appended to, never
 * truncated.
 */
public final class StressLogWriter implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(StressLogWriter.class);

    private final Path path;
    private final BufferedWriter writer;

    private StressLogWriter(final Path path, final BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    /**
     * Opens {@code directory/fileName} for appending, creating the directory if needed.
     *
     * @throws UncheckedIOException if the file cannot be opened
     */
    public static StressLogWriter open(final Path directory, final String fileName) {
        final Path path = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            return new StressLogWriter(path, Files.newBufferedWriter(
                    path,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open stress log " + path, e);
        }
    }

    public Path path() {
        return path;
    }

    /**
     * Writes the metrics of a stress response and returns them.
     *
     * @throws sh.batchapi.core.error.MetricsParseException if the response carries no metrics
     */
    public InvocationMetrics append(final String response) {
        final InvocationMetrics metrics = InvocationMetrics.parseLine(response);
        if (LOG.isDebugEnabled()) {
            final String verbose = InvocationMetrics.verboseTail(response);
            if (!verbose.isEmpty()) {
                LOG.debug("{} {}: {}", path.getFileName(), metrics.method(), verbose);
            }
        }
        try {
            writer.write(metrics.toJson());
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write stress log " + path, e);
        }
        return metrics;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
