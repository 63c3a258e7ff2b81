// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core;

/**
 * Global toggle for enabling verbose debug logging across the harness modules.
 */
public final class BatchDebug {

    private static volatile boolean shimLogging = false;
    private static volatile boolean txLogging = false;

    private BatchDebug() {
    }

    public static boolean isEnabled() {
        return shimLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        shimLogging = enabled;
        txLogging = enabled;
    }

    public static void setShimLogging(final boolean enabled) {
        shimLogging = enabled;
    }

    public static boolean isShimLoggingEnabled() {
        return shimLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
