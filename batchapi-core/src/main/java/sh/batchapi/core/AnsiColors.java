// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core;

/**
 * ANSI color palette for terminal output with automatic TTY detection.
 *
 * <p>
 * Colors are disabled when not running in a TTY environment unless
 * {@code FORCE_COLOR=true} is set, so every constant is safe to concatenate
 * into plain log output.
 *
 * <ul>
 * <li><b>TEAL</b> - success
 * <li><b>CORAL</b> - errors
 * <li><b>INDIGO</b> - shim calls
 * <li><b>AMBER</b> - batch calls
 * <li><b>LAVENDER</b> - transactions
 * <li><b>SLATE</b> - metadata such as durations
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    private static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    public static final String TEAL = ansi("38;5;44");

    public static final String CORAL = ansi("38;5;204");

    public static final String INDIGO = ansi("38;5;99");

    public static final String AMBER = ansi("38;5;214");

    public static final String SLATE = ansi("38;5;247");

    public static final String LAVENDER = ansi("38;5;183");

    private AnsiColors() {
    }

    /**
     * Whether escape codes are emitted.
     */
    public static boolean enabled() {
        return IS_TTY;
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
