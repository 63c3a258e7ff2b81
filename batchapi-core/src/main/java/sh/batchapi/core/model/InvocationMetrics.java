// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jspecify.annotations.Nullable;

import sh.batchapi.core.error.MetricsParseException;

/**
 * Timing record returned by every stress function and written to stress logs.
 *
 * <p>Responses have the shape {@code <Prefix>:<json>[ <verbose text>]}, for example:
 * <pre>{@code
 * PutState:{"method":"put","entries":1000,"millis":12,"keylen":20,"batchapi":true,"collection":"","seed":3}
 * }</pre>
 * Range methods omit {@code keylen}, {@code collection} and {@code seed}.
 *
 * @param method     the measured operation
 * @param entries    number of entries written, read or deleted
 * @param millis     elapsed milliseconds of the state-access section only
 * @param keylen     key and value length, null for range methods
 * @param batchapi   whether the batch API was used
 * @param collection private data collection ("" for public state), null for range methods
 * @param seed       generator seed, null for range methods
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"method", "entries", "millis", "keylen", "batchapi", "collection", "seed"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvocationMetrics(
        StressMethod method,
        int entries,
        long millis,
        @Nullable Integer keylen,
        boolean batchapi,
        @Nullable String collection,
        @Nullable Integer seed) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, false);

    public InvocationMetrics {
        Objects.requireNonNull(method, "method");
        if (entries < 0) {
            throw new IllegalArgumentException("entries must not be negative");
        }
        if (millis < 0) {
            throw new IllegalArgumentException("millis must not be negative");
        }
    }

    public static InvocationMetrics ofStress(
            final StressMethod method, final int entries, final long millis, final StressOptions options) {
        return new InvocationMetrics(
                method,
                entries,
                millis,
                options.keyLength(),
                options.useBatchApi(),
                options.collection(),
                options.seed());
    }

    public static InvocationMetrics ofRange(
            final StressMethod method, final int entries, final long millis, final boolean batchapi) {
        return new InvocationMetrics(method, entries, millis, null, batchapi, null, null);
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metrics: " + e.getMessage(), e);
        }
    }

    /**
     * Renders the response line, {@code <Prefix>:<json>} followed by a space and the
     * verbose text when one is given.
     */
    public String toResponse(@Nullable final String verbose) {
        final String line = method.responsePrefix() + ":" + toJson();
        if (verbose == null || verbose.isEmpty()) {
            return line;
        }
        return line + " " + verbose;
    }

    /**
     * Parses a metrics object from a response or stress log line. Parsing starts at
     * the first {@code '{'}; any text after the JSON object is ignored.
     *
     * @throws MetricsParseException if the line carries no metrics object
     */
    public static InvocationMetrics parseLine(final String line) {
        if (line == null) {
            throw new MetricsParseException("line is null");
        }
        final int start = line.indexOf('{');
        if (start < 0) {
            throw new MetricsParseException("no metrics object in: " + abbreviate(line));
        }
        try {
            return MAPPER.readValue(line.substring(start), InvocationMetrics.class);
        } catch (JsonProcessingException e) {
            throw new MetricsParseException(
                    "invalid metrics object in: " + abbreviate(line) + " (" + e.getOriginalMessage() + ")", -1, e);
        }
    }

    /**
     * Returns the text after the metrics JSON, or the empty string.
     */
    public static String verboseTail(final String response) {
        final int start = response.indexOf('{');
        if (start < 0) {
            return "";
        }
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < response.length(); i++) {
            final char c = response.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return response.substring(i + 1).strip();
            }
        }
        return "";
    }

    private static String abbreviate(final String line) {
        return line.length() > 120 ? line.substring(0, 117) + "..." : line;
    }
}
