// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.error;

/**
 * Exception thrown when a stress response or stress log line does not carry an
 * invocation metrics object.
 */
public final class MetricsParseException extends BatchApiException {

    private final int lineNumber;

    public MetricsParseException(final String message) {
        this(message, -1, null);
    }

    public MetricsParseException(final String message, final int lineNumber, final Throwable cause) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based line number of the offending line, or -1 when unknown.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
