// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core;

import static sh.batchapi.core.AnsiColors.*;

/**
 * Log formatter for shim calls and transactions with colored, structured output.
 *
 * <p>
 * Status symbols (✓ ✗ ○) indicate success, failure and pending states; the
 * bracketed tag names the operation. Every method is a pure function and the
 * results can be handed to {@link DebugLogger} or any SLF4J logger.
 *
 * <pre>{@code
 * DebugLogger.logShim(LogFormatter.formatShim("PutState", "", "OBJ00001", 12));
 * // Output: [SHIM] op=PutState key=OBJ00001 duration=0.01ms
 *
 * DebugLogger.logShim(LogFormatter.formatBatch("PutStateBatch", 1000, 5230));
 * // Output: [BATCH] op=PutStateBatch entries=1000 duration=5.23ms
 * }</pre>
 *
 * @see AnsiColors
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Keys longer than this are shortened to keep single-key lines readable. */
    private static final int MAX_KEY_LENGTH = 32;

    private LogFormatter() {
    }

    /**
     * Format: [SHIM] op=GetPrivateData collection=collectionMarbles key=marble1 duration=0.02ms
     */
    public static String formatShim(String op, String collection, String key, long durationMicros) {
        if (collection == null || collection.isEmpty()) {
            return String.format(
                    "%s[SHIM]%s op=%s key=%s %s",
                    INDIGO, RESET,
                    op,
                    shortenKey(key),
                    duration(durationMicros));
        }
        return String.format(
                "%s[SHIM]%s op=%s collection=%s key=%s %s",
                INDIGO, RESET,
                op,
                collection,
                shortenKey(key),
                duration(durationMicros));
    }

    /**
     * Format: [BATCH] op=PutStateBatch entries=1000 duration=5.23ms
     */
    public static String formatBatch(String op, int entries, long durationMicros) {
        return String.format(
                "%s[BATCH]%s op=%s entries=%d %s",
                AMBER, RESET,
                op,
                entries,
                duration(durationMicros));
    }

    /**
     * Format: [TX-SUBMIT] chaincode=batchapicc function=putManyObjectsBatch txId=4f1c...
     */
    public static String formatTxSubmit(String chaincode, String function, String txId) {
        return String.format(
                "%s[TX-SUBMIT]%s chaincode=%s function=%s txId=%s",
                LAVENDER, RESET,
                chaincode, function, shortenKey(txId));
    }

    /**
     * Format: ○ [TX-EVALUATE] chaincode=batchapicc function=getRange txId=4f1c...
     */
    public static String formatTxEvaluate(String chaincode, String function, String txId) {
        return String.format(
                "%s○%s %s[TX-EVALUATE]%s chaincode=%s function=%s txId=%s",
                SLATE, RESET,
                SLATE, RESET,
                chaincode, function, shortenKey(txId));
    }

    /**
     * Format: ✓ [TX-RESULT] txId=4f1c... status=200 writes=1000 duration=7.10ms
     * or: ✗ [TX-RESULT] txId=4f1c... status=500 message=Assets not found duration=0.40ms
     */
    public static String formatTxResult(String txId, int status, String message, int writes, long durationMicros) {
        boolean ok = status < 400;
        if (ok) {
            return String.format(
                    "%s✓%s %s[TX-RESULT]%s txId=%s status=%d writes=%d %s",
                    TEAL, RESET,
                    TEAL, RESET,
                    shortenKey(txId),
                    status,
                    writes,
                    duration(durationMicros));
        }
        return String.format(
                "%s✗%s %s[TX-RESULT]%s txId=%s status=%d message=%s%s%s %s",
                CORAL, RESET,
                CORAL, RESET,
                shortenKey(txId),
                status,
                CORAL, message, RESET,
                duration(durationMicros));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    /**
     * Composite keys carry U+0000 separators which are rendered as {@code ~}.
     */
    private static String shortenKey(String key) {
        if (key == null) {
            return "null";
        }
        String printable = key.replace('\u0000', '~');
        if (printable.length() <= MAX_KEY_LENGTH) {
            return printable;
        }
        return printable.substring(0, MAX_KEY_LENGTH - 3) + "...";
    }
}
