// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.batchapi.core.keys.SeededKeyGenerator;

/**
 * Parameters of a stress invocation and their string-argument protocol.
 *
 * <p>Arguments are {@code NUMBER} followed by optional tokens in any order:
 * <pre>
 * verbose              include generated keys and parameters in the response
 * nobatchapi           one single-key call per entry instead of one batch call
 * seed N               generator seed (unparsable values fall back to the default)
 * collection NAME      private data collection ("" = public state)
 * keylength N          key and value length (unparsable values fall back to the default)
 * </pre>
 * A flag whose value is missing is ignored.
 *
 * @param entries     number of entries to generate
 * @param keyLength   length of each generated key and value
 * @param useBatchApi whether to use one batch call
 * @param seed        generator seed
 * @param collection  private data collection, "" for public state
 * @param verbose     whether to include generated keys in the response
 */
public record StressOptions(
        int entries,
        int keyLength,
        boolean useBatchApi,
        int seed,
        String collection,
        boolean verbose) {

    public static final String VERBOSE = "verbose";
    public static final String NO_BATCH_API = "nobatchapi";
    public static final String SEED = "seed";
    public static final String COLLECTION = "collection";
    public static final String KEY_LENGTH = "keylength";

    public StressOptions {
        if (entries < 0) {
            throw new IllegalArgumentException("entries must not be negative: " + entries);
        }
        if (keyLength <= 0) {
            throw new IllegalArgumentException("keyLength must be positive: " + keyLength);
        }
        collection = collection == null ? "" : collection;
    }

    /**
     * Parses stress arguments.
     *
     * @param args             the invocation arguments, {@code args[0]} being the entry count
     * @param defaultKeyLength key length when {@code keylength} is absent or unparsable
     * @param honorKeyLength   whether the {@code keylength} flag is read at all
     * @throws IllegalArgumentException if the entry count is missing or not a number
     */
    public static StressOptions parse(final List<String> args, final int defaultKeyLength, final boolean honorKeyLength) {
        Objects.requireNonNull(args, "args");
        if (args.isEmpty()) {
            throw new IllegalArgumentException(
                    "Incorrect arguments. Expecting at least one argument - number of random keys/value");
        }
        final int entries;
        try {
            entries = Integer.parseInt(args.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number of entries: " + args.get(0), e);
        }
        final int seed = intAfter(args, SEED, SeededKeyGenerator.DEFAULT_SEED);
        final int keyLength = honorKeyLength ? intAfter(args, KEY_LENGTH, defaultKeyLength) : defaultKeyLength;
        final String collection = valueAfter(args, COLLECTION);
        return new StressOptions(
                entries,
                keyLength > 0 ? keyLength : defaultKeyLength,
                !args.contains(NO_BATCH_API),
                seed,
                collection == null ? "" : collection,
                args.contains(VERBOSE));
    }

    /**
     * Renders these options as invocation arguments.
     */
    public List<String> toArgs() {
        final List<String> args = new ArrayList<>();
        args.add(Integer.toString(entries));
        args.add(KEY_LENGTH);
        args.add(Integer.toString(keyLength));
        if (!useBatchApi) {
            args.add(NO_BATCH_API);
        }
        args.add(SEED);
        args.add(Integer.toString(seed));
        if (!collection.isEmpty()) {
            args.add(COLLECTION);
            args.add(collection);
        }
        if (verbose) {
            args.add(VERBOSE);
        }
        return args;
    }

    public boolean isPrivate() {
        return !collection.isEmpty();
    }

    private static String valueAfter(final List<String> args, final String flag) {
        final int index = args.indexOf(flag);
        if (index == -1 || index + 1 >= args.size()) {
            return null;
        }
        return args.get(index + 1);
    }

    private static int intAfter(final List<String> args, final String flag, final int fallback) {
        final String value = valueAfter(args, flag);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
