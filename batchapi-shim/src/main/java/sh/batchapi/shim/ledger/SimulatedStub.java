// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.batchapi.core.BatchDebug;
import sh.batchapi.core.DebugLogger;
import sh.batchapi.core.LogFormatter;
import sh.batchapi.core.error.StateAccessException;
import sh.batchapi.core.types.CompositeKey;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;
import sh.batchapi.shim.ChaincodeStub;
import sh.batchapi.shim.StateIterator;

/**
 * Transaction simulator over a {@link WorldState}.
 *
 * <p>Reads go to committed state, writes accumulate in a {@link WriteSet} that the
 * host applies on commit. Every call is charged the cost configured in
 * {@link SimulatorOptions}, which is what separates the single-key and batch
 * code paths in measurements.
 *
 * <p>One stub serves one transaction and is not thread-safe.
 */
public final class SimulatedStub implements ChaincodeStub {

    private final WorldState state;
    private final SimulatorOptions options;
    private final String txId;
    private final String function;
    private final List<String> parameters;
    private final Map<String, byte[]> transientMap;
    private final WriteSet writeSet = new WriteSet();
    private long calls;

    public SimulatedStub(
            final WorldState state,
            final SimulatorOptions options,
            final String txId,
            final String function,
            final List<String> parameters,
            final Map<String, byte[]> transientMap) {
        this.state = Objects.requireNonNull(state, "state");
        this.options = Objects.requireNonNull(options, "options");
        this.txId = Objects.requireNonNull(txId, "txId");
        this.function = Objects.requireNonNull(function, "function");
        this.parameters = List.copyOf(parameters);
        final Map<String, byte[]> copy = new LinkedHashMap<>();
        transientMap.forEach((k, v) -> copy.put(k, v.clone()));
        this.transientMap = Collections.unmodifiableMap(copy);
    }

    public WriteSet writeSet() {
        return writeSet;
    }

    /**
     * Number of simulated round trips so far.
     */
    public long calls() {
        return calls;
    }

    @Override
    public String getFunction() {
        return function;
    }

    @Override
    public List<String> getParameters() {
        return parameters;
    }

    @Override
    public String getTxId() {
        return txId;
    }

    @Override
    public Map<String, byte[]> getTransient() {
        return transientMap;
    }

    @Override
    public byte @Nullable [] getState(final String key) {
        return read("GetState", "", key);
    }

    @Override
    public void putState(final String key, final byte[] value) {
        write("PutState", "", key, value);
    }

    @Override
    public void delState(final String key) {
        delete("DelState", "", key);
    }

    @Override
    public byte @Nullable [] getPrivateData(final String collection, final String key) {
        requireCollection(collection);
        return read("GetPrivateData", collection, key);
    }

    @Override
    public void putPrivateData(final String collection, final String key, final byte[] value) {
        requireCollection(collection);
        write("PutPrivateData", collection, key, value);
    }

    @Override
    public void delPrivateData(final String collection, final String key) {
        requireCollection(collection);
        delete("DelPrivateData", collection, key);
    }

    @Override
    public StateIterator getStateByRange(final String startKey, final String endKey) {
        requireSimpleRangeKey(startKey);
        requireSimpleRangeKey(endKey);
        return query("GetStateByRange", simpleKeysOnly(state.range("", startKey, endKey)));
    }

    @Override
    public StateIterator getPrivateDataByRange(final String collection, final String startKey, final String endKey) {
        requireCollection(collection);
        requireSimpleRangeKey(startKey);
        requireSimpleRangeKey(endKey);
        return query("GetPrivateDataByRange", simpleKeysOnly(state.range(collection, startKey, endKey)));
    }

    @Override
    public StateIterator getQueryResult(final String query) {
        final SelectorQuery selector = SelectorQuery.parse(query);
        return query("GetQueryResult", select(selector, simpleKeysOnly(state.snapshot(""))));
    }

    @Override
    public StateIterator getPrivateDataQueryResult(final String collection, final String query) {
        requireCollection(collection);
        final SelectorQuery selector = SelectorQuery.parse(query);
        return query("GetPrivateDataQueryResult", select(selector, simpleKeysOnly(state.snapshot(collection))));
    }

    @Override
    public List<StateKV> getStateBatch(final List<StateKey> keys) {
        Objects.requireNonNull(keys, "keys");
        keys.forEach(this::requireStateKey);
        final long start = System.nanoTime();
        roundTrip(keys.size());
        final List<StateKV> out = new ArrayList<>(keys.size());
        for (StateKey key : keys) {
            final byte[] value = state.get(key.collection(), key.key());
            if (value != null) {
                out.add(new StateKV(key.collection(), key.key(), value));
            }
        }
        logBatch("GetStateBatch", keys.size(), start);
        return out;
    }

    @Override
    public void putStateBatch(final List<StateKV> entries) {
        Objects.requireNonNull(entries, "entries");
        for (StateKV kv : entries) {
            if (kv == null) {
                throw new StateAccessException("batch entry must not be null");
            }
            requireStateKey(kv.stateKey());
        }
        final long start = System.nanoTime();
        roundTrip(entries.size());
        for (StateKV kv : entries) {
            writeSet.put(kv.stateKey(), kv.value());
        }
        logBatch("PutStateBatch", entries.size(), start);
    }

    @Override
    public void delStateBatch(final List<StateKey> keys) {
        Objects.requireNonNull(keys, "keys");
        keys.forEach(this::requireStateKey);
        final long start = System.nanoTime();
        roundTrip(keys.size());
        for (StateKey key : keys) {
            writeSet.delete(key);
        }
        logBatch("DelStateBatch", keys.size(), start);
    }

    @Override
    public String createCompositeKey(final String objectType, final String... attributes) {
        try {
            return CompositeKey.of(objectType, attributes).toKey();
        } catch (IllegalArgumentException e) {
            throw new StateAccessException(e.getMessage(), e);
        }
    }

    private byte @Nullable [] read(final String op, final String collection, final String key) {
        requireKey(key);
        final long start = System.nanoTime();
        roundTrip(1);
        final byte[] value = state.get(collection, key);
        logShim(op, collection, key, start);
        return value;
    }

    private void write(final String op, final String collection, final String key, final byte[] value) {
        requireKey(key);
        if (value == null) {
            throw new StateAccessException(op + ": value must not be null for key " + key);
        }
        final long start = System.nanoTime();
        roundTrip(1);
        writeSet.put(StateKey.of(collection, key), value);
        logShim(op, collection, key, start);
    }

    private void delete(final String op, final String collection, final String key) {
        requireKey(key);
        final long start = System.nanoTime();
        roundTrip(1);
        writeSet.delete(StateKey.of(collection, key));
        logShim(op, collection, key, start);
    }

    private StateIterator query(final String op, final List<StateKV> results) {
        final long start = System.nanoTime();
        roundTrip(Math.min(results.size(), options.queryPageSize()));
        logBatch(op, results.size(), start);
        return new PagedStateIterator(
                results,
                options.queryPageSize(),
                () -> roundTrip(options.queryPageSize()));
    }

    private static List<StateKV> select(final SelectorQuery selector, final List<StateKV> candidates) {
        final List<StateKV> out = new ArrayList<>();
        for (StateKV kv : candidates) {
            if (selector.matches(kv.value())) {
                out.add(kv);
            }
        }
        return out;
    }

    private static List<StateKV> simpleKeysOnly(final List<StateKV> entries) {
        final List<StateKV> out = new ArrayList<>(entries.size());
        for (StateKV kv : entries) {
            if (!CompositeKey.isComposite(kv.key())) {
                out.add(kv);
            }
        }
        return out;
    }

    private void requireStateKey(final StateKey key) {
        if (key == null) {
            throw new StateAccessException("state key must not be null");
        }
        if (key.isPrivate()) {
            requireCollection(key.collection());
        }
        requireKey(key.key());
    }

    private static void requireKey(final String key) {
        if (key == null || key.isEmpty()) {
            throw new StateAccessException("key must not be an empty string");
        }
    }

    private void requireCollection(final String collection) {
        if (collection == null || collection.isEmpty()) {
            throw new StateAccessException("collection must not be an empty string");
        }
        if (!state.hasCollection(collection)) {
            throw new StateAccessException("private data collection " + collection + " is not defined");
        }
    }

    private static void requireSimpleRangeKey(final String key) {
        if (key == null) {
            throw new StateAccessException("range bound must not be null");
        }
        if (CompositeKey.isComposite(key)) {
            throw new StateAccessException("range bound must be a simple key: " + key.replace('\u0000', '~'));
        }
    }

    /**
     * Busy-waits for the simulated cost; parking is too coarse for microsecond latencies.
     */
    private void roundTrip(final int entries) {
        calls++;
        final long cost = options.costNanos(entries);
        if (cost <= 0) {
            return;
        }
        final long deadline = System.nanoTime() + cost;
        while (System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
    }

    private static void logShim(final String op, final String collection, final String key, final long startNanos) {
        if (BatchDebug.isShimLoggingEnabled()) {
            DebugLogger.logShim(LogFormatter.formatShim(op, collection, key, (System.nanoTime() - startNanos) / 1_000));
        }
    }

    private static void logBatch(final String op, final int entries, final long startNanos) {
        if (BatchDebug.isShimLoggingEnabled()) {
            DebugLogger.logShim(LogFormatter.formatBatch(op, entries, (System.nanoTime() - startNanos) / 1_000));
        }
    }
}
