// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.client;

import java.util.List;
import java.util.Objects;

import sh.batchapi.core.keys.SeededKeyGenerator;
import sh.batchapi.core.model.StressOptions;

/**
 * Typed builder for stress-function arguments.
 *
 * <pre>{@code
 * String[] args = StressRequest.builder()
 *     .entries(1000)
 *     .keyLength(20)
 *     .seed(3)
 *     .useBatchApi(false)
 *     .build()
 *     .toArgs();
 * contract.submitTransaction("putManyObjectsBatch", args);
 * }</pre>
 */
public final class StressRequest {

    public static final int DEFAULT_KEY_LENGTH = 7;

    private final StressOptions options;

    private StressRequest(final StressOptions options) {
        this.options = options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public StressOptions options() {
        return options;
    }

    public List<String> toArgList() {
        return options.toArgs();
    }

    public String[] toArgs() {
        return options.toArgs().toArray(new String[0]);
    }

    @Override
    public String toString() {
        return "StressRequest" + options.toArgs();
    }

    public static final class Builder {
        private int entries;
        private int keyLength = DEFAULT_KEY_LENGTH;
        private boolean useBatchApi = true;
        private int seed = SeededKeyGenerator.DEFAULT_SEED;
        private String collection = "";
        private boolean verbose;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if entries is negative
         */
        public Builder entries(final int entries) {
            if (entries < 0) {
                throw new IllegalArgumentException("entries must not be negative");
            }
            this.entries = entries;
            return this;
        }

        /**
         * @throws IllegalArgumentException if keyLength is not positive
         */
        public Builder keyLength(final int keyLength) {
            if (keyLength <= 0) {
                throw new IllegalArgumentException("keyLength must be positive");
            }
            this.keyLength = keyLength;
            return this;
        }

        public Builder useBatchApi(final boolean useBatchApi) {
            this.useBatchApi = useBatchApi;
            return this;
        }

        /**
         * @throws IllegalArgumentException if seed is negative
         */
        public Builder seed(final int seed) {
            if (seed < 0) {
                throw new IllegalArgumentException("seed must not be negative");
            }
            this.seed = seed;
            return this;
        }

        public Builder collection(final String collection) {
            this.collection = Objects.requireNonNull(collection, "collection must not be null");
            return this;
        }

        public Builder verbose(final boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public StressRequest build() {
            return new StressRequest(new StressOptions(entries, keyLength, useBatchApi, seed, collection, verbose));
        }
    }
}
