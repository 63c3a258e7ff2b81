// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.contract;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import sh.batchapi.core.keys.SeededKeyGenerator;
import sh.batchapi.core.model.InvocationMetrics;
import sh.batchapi.core.model.StressMethod;
import sh.batchapi.core.model.StressOptions;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;
import sh.batchapi.shim.ChaincodeStub;
import sh.batchapi.shim.Response;

/**
 * Seeded put, get and delete stress runs shared by the chaincodes.
 *
 * <p>Each run draws from its own generator seeded with the requested seed, a key
 * and a value per entry, so a get or delete with the same seed, count and key length
 * addresses exactly the keys of an earlier put. Only the state-access section is
 * timed; key generation is not.
 *
 * <p>Stateless, so concurrent invocations of one chaincode never share a generator.
 */
public final class StressOperations {

    static final String ASSETS_NOT_FOUND = "Assets not found";

    /**
     * Writes {@code options.entries()} generated pairs with one batch call or one
     * single-key call per pair.
     */
    public Response put(final ChaincodeStub stub, final StressOptions options) {
        final SeededKeyGenerator generator = new SeededKeyGenerator(options.seed());
        final List<StateKV> entries = new ArrayList<>(options.entries());
        for (int i = 0; i < options.entries(); i++) {
            final String key = generator.next(options.keyLength());
            final String value = generator.next(options.keyLength());
            entries.add(new StateKV(options.collection(), key, value.getBytes(StandardCharsets.UTF_8)));
        }

        final long start = System.nanoTime();
        if (options.useBatchApi()) {
            stub.putStateBatch(entries);
        } else if (options.isPrivate()) {
            for (StateKV kv : entries) {
                stub.putPrivateData(options.collection(), kv.key(), kv.value());
            }
        } else {
            for (StateKV kv : entries) {
                stub.putState(kv.key(), kv.value());
            }
        }
        final long millis = elapsedMillis(start);

        String verbose = null;
        if (options.verbose()) {
            verbose = String.format(
                    "useBatchAPI: %b, Collection: `%s`, Seed: %d, KeyLength: %d, Keys: %s",
                    options.useBatchApi(),
                    options.collection(),
                    options.seed(),
                    options.keyLength(),
                    String.join(", ", entries.stream().map(StateKV::key).toList()));
        }
        return Response.success(
                InvocationMetrics.ofStress(StressMethod.PUT, options.entries(), millis, options).toResponse(verbose));
    }

    /**
     * Reads back the keys of a put with the same options. Keys that do not exist are
     * left out of the result; an empty result is an error.
     */
    public Response get(final ChaincodeStub stub, final StressOptions options) {
        final List<StateKey> keys = regenerateKeys(options);

        final long start = System.nanoTime();
        final List<StateKV> found;
        if (options.useBatchApi()) {
            found = stub.getStateBatch(keys);
        } else {
            found = new ArrayList<>(keys.size());
            for (StateKey key : keys) {
                final byte[] value = options.isPrivate()
                        ? stub.getPrivateData(options.collection(), key.key())
                        : stub.getState(key.key());
                if (value != null) {
                    found.add(new StateKV(options.collection(), key.key(), value));
                }
            }
        }
        final long millis = elapsedMillis(start);

        if (found.isEmpty()) {
            return Response.error(ASSETS_NOT_FOUND + ": " + options.toArgs());
        }

        String verbose = null;
        if (options.verbose()) {
            final StringBuilder sb = new StringBuilder();
            for (StateKV kv : found) {
                sb.append(kv.key()).append(": ").append(kv.valueAsString())
                        .append(" (collection:`").append(kv.collection()).append("`)\n");
            }
            sb.append("useBatchAPI: ").append(options.useBatchApi()).append(", Seed: ").append(options.seed());
            verbose = sb.toString();
        }
        return Response.success(
                InvocationMetrics.ofStress(StressMethod.GET, options.entries(), millis, options).toResponse(verbose));
    }

    /**
     * Deletes the keys of a put with the same options.
     */
    public Response delete(final ChaincodeStub stub, final StressOptions options) {
        final List<StateKey> keys = regenerateKeys(options);

        final long start = System.nanoTime();
        if (options.useBatchApi()) {
            stub.delStateBatch(keys);
        } else if (options.isPrivate()) {
            for (StateKey key : keys) {
                stub.delPrivateData(options.collection(), key.key());
            }
        } else {
            for (StateKey key : keys) {
                stub.delState(key.key());
            }
        }
        final long millis = elapsedMillis(start);

        String verbose = null;
        if (options.verbose()) {
            verbose = String.format(
                    "useBatchAPI: %b, Collection: `%s`, Seed: %d, Keys: %s",
                    options.useBatchApi(),
                    options.collection(),
                    options.seed(),
                    String.join(", ", keys.stream().map(StateKey::key).toList()));
        }
        return Response.success(
                InvocationMetrics.ofStress(StressMethod.DEL, options.entries(), millis, options).toResponse(verbose));
    }

    private static List<StateKey> regenerateKeys(final StressOptions options) {
        final SeededKeyGenerator generator = new SeededKeyGenerator(options.seed());
        final List<StateKey> keys = new ArrayList<>(options.entries());
        for (int i = 0; i < options.entries(); i++) {
            keys.add(StateKey.of(options.collection(), generator.next(options.keyLength())));
            // value draw, keeps the sequence aligned with put
            generator.next(options.keyLength());
        }
        return keys;
    }

    static long elapsedMillis(final long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
