// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.keys;

import java.util.Random;

/**
 * Reproducible random key and value generator used by the stress functions.
 *
 * <p>Each stress invocation resets the generator with its seed and draws two
 * strings per entry, a key and then a value. Readers and deleters draw (and
 * discard) the value as well so that the same seed, entry count and length
 * address exactly the keys a writer produced.
 *
 * <p>Instances are not thread-safe; every stress invocation creates its own.
 */
public final class SeededKeyGenerator {

    public static final String CHARSET = "abcdefghijklmnopqrstuvwxyz"
            + "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    public static final int DEFAULT_SEED = 1;

    private final Random random;

    public SeededKeyGenerator() {
        this(DEFAULT_SEED);
    }

    public SeededKeyGenerator(final long seed) {
        this.random = new Random(seed);
    }

    public void reset(final long seed) {
        random.setSeed(seed);
    }

    public String next(final int length) {
        return next(length, CHARSET);
    }

    public String next(final int length, final String charset) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        if (charset == null || charset.isEmpty()) {
            throw new IllegalArgumentException("charset must not be empty");
        }
        final char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = charset.charAt(random.nextInt(charset.length()));
        }
        return new String(chars);
    }
}
