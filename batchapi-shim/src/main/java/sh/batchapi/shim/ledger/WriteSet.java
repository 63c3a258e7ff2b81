// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import sh.batchapi.core.types.StateKey;

/**
 * Writes and deletes recorded during one simulation, in first-write order.
 * The last write to a key wins; a {@code null} value marks a delete.
 */
public final class WriteSet {

    private final Map<StateKey, byte @Nullable []> writes = new LinkedHashMap<>();

    void put(final StateKey key, final byte[] value) {
        writes.put(key, value.clone());
    }

    void delete(final StateKey key) {
        writes.put(key, null);
    }

    public boolean isEmpty() {
        return writes.isEmpty();
    }

    public int size() {
        return writes.size();
    }

    public boolean isDelete(final StateKey key) {
        return writes.containsKey(key) && writes.get(key) == null;
    }

    /**
     * Returns an unmodifiable view; {@code null} values are deletes.
     */
    public Map<StateKey, byte @Nullable []> entries() {
        return Collections.unmodifiableMap(writes);
    }
}
