// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim;

import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import sh.batchapi.core.error.StateAccessException;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;

/**
 * The chaincode's view of the runtime during one transaction simulation.
 *
 * <p>Single-key operations cost one round trip to the peer each. The batch
 * operations carry any number of entries, public or private, in one round trip:
 * <pre>{@code
 * List<StateKV> kvs = ...;
 * stub.putStateBatch(kvs);                // one call
 * for (StateKV kv : kvs) {
 *     stub.putState(kv.key(), kv.value()); // kvs.size() calls
 * }
 * }</pre>
 *
 * <p>Reads observe committed state only; writes become visible once the
 * transaction is committed. All operations throw {@link StateAccessException}
 * on invalid input.
 */
public interface ChaincodeStub {

    String getFunction();

    List<String> getParameters();

    String getTxId();

    /**
     * Returns the transient map: private inputs that are not recorded in the transaction.
     */
    Map<String, byte[]> getTransient();

    byte @Nullable [] getState(String key);

    void putState(String key, byte[] value);

    void delState(String key);

    byte @Nullable [] getPrivateData(String collection, String key);

    void putPrivateData(String collection, String key, byte[] value);

    void delPrivateData(String collection, String key);

    /**
     * Scans public simple keys in {@code [startKey, endKey)}. Empty bounds are open.
     */
    StateIterator getStateByRange(String startKey, String endKey);

    /**
     * Scans keys of a private data collection in {@code [startKey, endKey)}. Empty bounds are open.
     */
    StateIterator getPrivateDataByRange(String collection, String startKey, String endKey);

    /**
     * Runs a JSON selector query over public state.
     */
    StateIterator getQueryResult(String query);

    /**
     * Runs a JSON selector query over a private data collection.
     */
    StateIterator getPrivateDataQueryResult(String collection, String query);

    /**
     * Reads many keys in one call. Keys that do not exist are left out; the
     * others are returned in request order.
     */
    List<StateKV> getStateBatch(List<StateKey> keys);

    /**
     * Writes many entries in one call. Either every entry is recorded or, on a
     * validation failure, none is.
     */
    void putStateBatch(List<StateKV> entries);

    /**
     * Deletes many keys in one call.
     */
    void delStateBatch(List<StateKey> keys);

    String createCompositeKey(String objectType, String... attributes);
}
