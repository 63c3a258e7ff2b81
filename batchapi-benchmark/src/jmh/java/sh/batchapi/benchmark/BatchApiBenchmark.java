// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import sh.batchapi.core.keys.SeededKeyGenerator;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;
import sh.batchapi.shim.ledger.SimulatedStub;
import sh.batchapi.shim.ledger.SimulatorOptions;
import sh.batchapi.shim.ledger.WorldState;

/**
 * JMH benchmark comparing batch shim calls with one call per key.
 *
 * <p>Every shim call pays {@code callLatencyUs}, so the single-key variants
 * grow with {@code entries} while the batch variants pay it once.
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class BatchApiBenchmark {

    private static final int KEY_LENGTH = 20;

    @Param({"100", "1000"})
    public int entries;

    @Param({"0", "20"})
    public int callLatencyUs;

    private WorldState state;
    private SimulatorOptions options;
    private List<StateKV> pairs;
    private List<StateKey> keys;

    @Setup
    public void setup() {
        options = SimulatorOptions.builder()
                .callLatency(Duration.ofNanos(callLatencyUs * 1_000L))
                .build();
        SeededKeyGenerator generator = new SeededKeyGenerator(SeededKeyGenerator.DEFAULT_SEED);
        pairs = new ArrayList<>(entries);
        keys = new ArrayList<>(entries);
        for (int i = 0; i < entries; i++) {
            String key = generator.next(KEY_LENGTH);
            String value = generator.next(KEY_LENGTH);
            pairs.add(StateKV.of(key, value));
            keys.add(StateKey.of(key));
        }

        // Committed copy for the read benchmarks
        state = new WorldState();
        SimulatedStub loader = stub("load");
        loader.putStateBatch(pairs);
        state.apply(loader.writeSet());
    }

    private SimulatedStub stub(String function) {
        return new SimulatedStub(state, options, "bench", function, List.of(), Map.of());
    }

    @Benchmark
    public void putStateBatch(Blackhole bh) {
        SimulatedStub stub = stub("putStateBatch");
        stub.putStateBatch(pairs);
        bh.consume(stub.writeSet());
    }

    @Benchmark
    public void putStateLoop(Blackhole bh) {
        SimulatedStub stub = stub("putState");
        for (StateKV pair : pairs) {
            stub.putState(pair.key(), pair.value());
        }
        bh.consume(stub.writeSet());
    }

    @Benchmark
    public List<StateKV> getStateBatch() {
        return stub("getStateBatch").getStateBatch(keys);
    }

    @Benchmark
    public void getStateLoop(Blackhole bh) {
        SimulatedStub stub = stub("getState");
        for (StateKey key : keys) {
            bh.consume(stub.getState(key.key()));
        }
    }
}
