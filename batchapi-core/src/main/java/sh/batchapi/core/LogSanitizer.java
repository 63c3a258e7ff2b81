// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core;

import java.util.regex.Pattern;

/**
 * Utility that removes private data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts {@code price} values, which only ever travel in transient
 * private-data maps</li>
 * <li>Truncates excessively long logs (verbose stress responses list every
 * generated key)</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    // any JSON scalar: string (with escapes), number, boolean or null
    private static final Pattern PRICE_VALUE = Pattern.compile(
            "\"price\"\\s*:\\s*(\"(?:[^\"\\\\]|\\\\.)*\"|-?[0-9][0-9.eE+-]*|true|false|null)");

    private static final String REDACTED_PRICE = "\"price\":\"***[REDACTED]***\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"price\"")) {
            sanitized = PRICE_VALUE.matcher(sanitized).replaceAll(REDACTED_PRICE);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
