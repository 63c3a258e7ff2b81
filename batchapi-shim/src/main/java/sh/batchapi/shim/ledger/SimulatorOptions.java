// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import java.time.Duration;
import java.util.Objects;

/**
 * Cost model of the simulated chaincode-to-peer channel.
 *
 * <p>Every shim call pays {@code callLatency} once plus {@code perEntryLatency}
 * for each entry it carries; range and rich query iterators pay one call per
 * {@code queryPageSize} results fetched.
 *
 * <pre>{@code
 * var options = SimulatorOptions.builder()
 *     .callLatency(Duration.ofNanos(20_000))
 *     .perEntryLatency(Duration.ofNanos(500))
 *     .build();
 * }</pre>
 */
public final class SimulatorOptions {

    public static final Duration DEFAULT_CALL_LATENCY = Duration.ZERO;

    public static final Duration DEFAULT_PER_ENTRY_LATENCY = Duration.ZERO;

    /** Results fetched per round trip by query iterators. */
    public static final int DEFAULT_QUERY_PAGE_SIZE = 100;

    private static final SimulatorOptions DEFAULTS = new SimulatorOptions(
            DEFAULT_CALL_LATENCY,
            DEFAULT_PER_ENTRY_LATENCY,
            DEFAULT_QUERY_PAGE_SIZE);

    private final Duration callLatency;
    private final Duration perEntryLatency;
    private final int queryPageSize;

    private SimulatorOptions(final Duration callLatency, final Duration perEntryLatency, final int queryPageSize) {
        this.callLatency = callLatency;
        this.perEntryLatency = perEntryLatency;
        this.queryPageSize = queryPageSize;
    }

    public static SimulatorOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration callLatency() {
        return callLatency;
    }

    public Duration perEntryLatency() {
        return perEntryLatency;
    }

    public int queryPageSize() {
        return queryPageSize;
    }

    /**
     * Simulated cost in nanoseconds of one call carrying {@code entries} entries.
     */
    public long costNanos(final int entries) {
        return callLatency.toNanos() + entries * perEntryLatency.toNanos();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SimulatorOptions other)) {
            return false;
        }
        return queryPageSize == other.queryPageSize
                && callLatency.equals(other.callLatency)
                && perEntryLatency.equals(other.perEntryLatency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callLatency, perEntryLatency, queryPageSize);
    }

    @Override
    public String toString() {
        return "SimulatorOptions{"
                + "callLatency=" + callLatency
                + ", perEntryLatency=" + perEntryLatency
                + ", queryPageSize=" + queryPageSize
                + '}';
    }

    public static final class Builder {
        private Duration callLatency = DEFAULT_CALL_LATENCY;
        private Duration perEntryLatency = DEFAULT_PER_ENTRY_LATENCY;
        private int queryPageSize = DEFAULT_QUERY_PAGE_SIZE;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if callLatency is negative
         */
        public Builder callLatency(final Duration callLatency) {
            Objects.requireNonNull(callLatency, "callLatency must not be null");
            if (callLatency.isNegative()) {
                throw new IllegalArgumentException("callLatency must not be negative");
            }
            this.callLatency = callLatency;
            return this;
        }

        /**
         * @throws IllegalArgumentException if perEntryLatency is negative
         */
        public Builder perEntryLatency(final Duration perEntryLatency) {
            Objects.requireNonNull(perEntryLatency, "perEntryLatency must not be null");
            if (perEntryLatency.isNegative()) {
                throw new IllegalArgumentException("perEntryLatency must not be negative");
            }
            this.perEntryLatency = perEntryLatency;
            return this;
        }

        /**
         * @throws IllegalArgumentException if queryPageSize is not positive
         */
        public Builder queryPageSize(final int queryPageSize) {
            if (queryPageSize <= 0) {
                throw new IllegalArgumentException("queryPageSize must be positive");
            }
            this.queryPageSize = queryPageSize;
            return this;
        }

        public SimulatorOptions build() {
            return new SimulatorOptions(callLatency, perEntryLatency, queryPageSize);
        }
    }
}
