// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug output for shim calls and transactions, gated by {@link BatchDebug}.
 *
 * <p>Colored lines go straight to stdout on a terminal; otherwise they are logged
 * at INFO on {@code sh.batchapi.debug}. Every line passes through {@link LogSanitizer}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.batchapi.debug");

    private DebugLogger() {
    }

    public static void logShim(final String message, final Object... args) {
        if (BatchDebug.isShimLoggingEnabled()) {
            emit(message, args);
        }
    }

    public static void logTx(final String message, final Object... args) {
        if (BatchDebug.isTxLoggingEnabled()) {
            emit(message, args);
        }
    }

    /**
     * Logs the transient map of a transaction. Values are decoded as UTF-8, so
     * private inputs such as marble prices are redacted like any other payload.
     */
    public static void logTransient(final String txId, final Map<String, byte[]> transientMap) {
        if (!BatchDebug.isTxLoggingEnabled() || transientMap.isEmpty()) {
            return;
        }
        final StringJoiner entries = new StringJoiner(", ", "{", "}");
        transientMap.forEach((k, v) -> entries.add(k + "=" + new String(v, StandardCharsets.UTF_8)));
        emit("[TX-TRANSIENT] txId=%s %s", txId, entries);
    }

    private static void emit(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);
        if (AnsiColors.enabled()) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
