// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Properties;

import sh.batchapi.shim.ledger.SimulatorOptions;

/**
 * Parameters of the stress scenarios and of the simulated peer they run against.
 *
 * <p>Properties files use the {@code batchapi.} prefix:
 * <pre>
 * batchapi.start=100
 * batchapi.step=300
 * batchapi.end=10000
 * batchapi.keyLength=20
 * batchapi.seed=1
 * batchapi.repeat=10
 * batchapi.testId=1
 * batchapi.pauseMs=0
 * batchapi.logDir=stress_logs
 * batchapi.callLatencyUs=0
 * batchapi.entryLatencyUs=0
 * </pre>
 */
public final class ScenarioConfig {

    public static final String PREFIX = "batchapi.";

    public static final int DEFAULT_START = 100;
    public static final int DEFAULT_STEP = 300;
    public static final int DEFAULT_END = 10_000;
    public static final int DEFAULT_KEY_LENGTH = 20;
    public static final int DEFAULT_SEED = 1;
    public static final int DEFAULT_REPEAT = 10;
    public static final int DEFAULT_TEST_ID = 1;
    public static final Duration DEFAULT_PAUSE = Duration.ZERO;
    public static final Path DEFAULT_LOG_DIR = Path.of("stress_logs");

    private static final ScenarioConfig DEFAULTS = builder().build();

    private final int start;
    private final int step;
    private final int end;
    private final int keyLength;
    private final int seed;
    private final int repeat;
    private final int testId;
    private final Duration pause;
    private final Path logDir;
    private final Duration callLatency;
    private final Duration entryLatency;

    private ScenarioConfig(final Builder builder) {
        this.start = builder.start;
        this.step = builder.step;
        this.end = builder.end;
        this.keyLength = builder.keyLength;
        this.seed = builder.seed;
        this.repeat = builder.repeat;
        this.testId = builder.testId;
        this.pause = builder.pause;
        this.logDir = builder.logDir;
        this.callLatency = builder.callLatency;
        this.entryLatency = builder.entryLatency;
    }

    public static ScenarioConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized from this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .start(start)
                .step(step)
                .end(end)
                .keyLength(keyLength)
                .seed(seed)
                .repeat(repeat)
                .testId(testId)
                .pause(pause)
                .logDir(logDir)
                .callLatency(callLatency)
                .entryLatency(entryLatency);
    }

    /**
     * Reads {@code batchapi.*} keys; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is not a number or out of range
     */
    public static ScenarioConfig fromProperties(final Properties properties) {
        Objects.requireNonNull(properties, "properties");
        final Builder builder = builder();
        final PropertyReader reader = new PropertyReader(properties);
        reader.intValue("start").ifPresent(builder::start);
        reader.intValue("step").ifPresent(builder::step);
        reader.intValue("end").ifPresent(builder::end);
        reader.intValue("keyLength").ifPresent(builder::keyLength);
        reader.intValue("seed").ifPresent(builder::seed);
        reader.intValue("repeat").ifPresent(builder::repeat);
        reader.intValue("testId").ifPresent(builder::testId);
        reader.longValue("pauseMs").ifPresent(ms -> builder.pause(Duration.ofMillis(ms)));
        reader.longValue("callLatencyUs").ifPresent(us -> builder.callLatency(Duration.ofNanos(us * 1_000)));
        reader.longValue("entryLatencyUs").ifPresent(us -> builder.entryLatency(Duration.ofNanos(us * 1_000)));
        final String logDir = properties.getProperty(PREFIX + "logDir");
        if (logDir != null && !logDir.isBlank()) {
            builder.logDir(Path.of(logDir.strip()));
        }
        return builder.build();
    }

    public int start() {
        return start;
    }

    public int step() {
        return step;
    }

    public int end() {
        return end;
    }

    public int keyLength() {
        return keyLength;
    }

    public int seed() {
        return seed;
    }

    public int repeat() {
        return repeat;
    }

    public int testId() {
        return testId;
    }

    public Duration pause() {
        return pause;
    }

    public Path logDir() {
        return logDir;
    }

    public Duration callLatency() {
        return callLatency;
    }

    public Duration entryLatency() {
        return entryLatency;
    }

    /**
     * Cost model for the peer the scenarios run against.
     */
    public SimulatorOptions simulatorOptions() {
        return SimulatorOptions.builder()
                .callLatency(callLatency)
                .perEntryLatency(entryLatency)
                .build();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ScenarioConfig other)) {
            return false;
        }
        return start == other.start
                && step == other.step
                && end == other.end
                && keyLength == other.keyLength
                && seed == other.seed
                && repeat == other.repeat
                && testId == other.testId
                && pause.equals(other.pause)
                && logDir.equals(other.logDir)
                && callLatency.equals(other.callLatency)
                && entryLatency.equals(other.entryLatency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, step, end, keyLength, seed, repeat, testId, pause, logDir, callLatency, entryLatency);
    }

    @Override
    public String toString() {
        return "ScenarioConfig{"
                + "start=" + start
                + ", step=" + step
                + ", end=" + end
                + ", keyLength=" + keyLength
                + ", seed=" + seed
                + ", repeat=" + repeat
                + ", testId=" + testId
                + ", pause=" + pause
                + ", logDir=" + logDir
                + ", callLatency=" + callLatency
                + ", entryLatency=" + entryLatency
                + '}';
    }

    public static final class Builder {
        private int start = DEFAULT_START;
        private int step = DEFAULT_STEP;
        private int end = DEFAULT_END;
        private int keyLength = DEFAULT_KEY_LENGTH;
        private int seed = DEFAULT_SEED;
        private int repeat = DEFAULT_REPEAT;
        private int testId = DEFAULT_TEST_ID;
        private Duration pause = DEFAULT_PAUSE;
        private Path logDir = DEFAULT_LOG_DIR;
        private Duration callLatency = Duration.ZERO;
        private Duration entryLatency = Duration.ZERO;

        private Builder() {
        }

        public Builder start(final int start) {
            this.start = start;
            return this;
        }

        public Builder step(final int step) {
            this.step = step;
            return this;
        }

        public Builder end(final int end) {
            this.end = end;
            return this;
        }

        public Builder keyLength(final int keyLength) {
            this.keyLength = keyLength;
            return this;
        }

        public Builder seed(final int seed) {
            this.seed = seed;
            return this;
        }

        public Builder repeat(final int repeat) {
            this.repeat = repeat;
            return this;
        }

        public Builder testId(final int testId) {
            this.testId = testId;
            return this;
        }

        public Builder pause(final Duration pause) {
            this.pause = Objects.requireNonNull(pause, "pause must not be null");
            return this;
        }

        public Builder logDir(final Path logDir) {
            this.logDir = Objects.requireNonNull(logDir, "logDir must not be null");
            return this;
        }

        public Builder callLatency(final Duration callLatency) {
            this.callLatency = Objects.requireNonNull(callLatency, "callLatency must not be null");
            return this;
        }

        public Builder entryLatency(final Duration entryLatency) {
            this.entryLatency = Objects.requireNonNull(entryLatency, "entryLatency must not be null");
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public ScenarioConfig build() {
            if (start < 0) {
                throw new IllegalArgumentException("start must not be negative: " + start);
            }
            if (step <= 0) {
                throw new IllegalArgumentException("step must be positive: " + step);
            }
            if (start > end) {
                throw new IllegalArgumentException("start must not exceed end: " + start + " > " + end);
            }
            if (keyLength <= 0) {
                throw new IllegalArgumentException("keyLength must be positive: " + keyLength);
            }
            if (seed < 0) {
                throw new IllegalArgumentException("seed must not be negative: " + seed);
            }
            if (repeat <= 0) {
                throw new IllegalArgumentException("repeat must be positive: " + repeat);
            }
            if (pause.isNegative() || callLatency.isNegative() || entryLatency.isNegative()) {
                throw new IllegalArgumentException("durations must not be negative");
            }
            return new ScenarioConfig(this);
        }
    }

    private record PropertyReader(Properties properties) {

        OptionalInt intValue(final String name) {
            final String raw = properties.getProperty(PREFIX + name);
            if (raw == null || raw.isBlank()) {
                return OptionalInt.empty();
            }
            try {
                return OptionalInt.of(Integer.parseInt(raw.strip()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + PREFIX + name + ": " + raw, e);
            }
        }

        OptionalLong longValue(final String name) {
            final String raw = properties.getProperty(PREFIX + name);
            if (raw == null || raw.isBlank()) {
                return OptionalLong.empty();
            }
            try {
                return OptionalLong.of(Long.parseLong(raw.strip()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + PREFIX + name + ": " + raw, e);
            }
        }
    }
}
