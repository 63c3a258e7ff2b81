// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jspecify.annotations.Nullable;

import sh.batchapi.core.error.StateAccessException;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;

/**
 * Committed key/value state: one public namespace plus named private data collections.
 *
 * <p>All methods are thread-safe. Write sets are applied atomically with respect to
 * readers. This is an in-memory stand-in for the peer's state database and keeps
 * no history or versions.
 */
public final class WorldState {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final NavigableMap<String, byte[]> publicState = new TreeMap<>();
    private final Map<String, NavigableMap<String, byte[]>> collections = new HashMap<>();

    /**
     * Defines a private data collection. Defining an existing collection is a no-op.
     */
    public WorldState defineCollection(final String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("collection name must not be empty");
        }
        lock.writeLock().lock();
        try {
            collections.computeIfAbsent(name, n -> new TreeMap<>());
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    public boolean hasCollection(final String name) {
        lock.readLock().lock();
        try {
            return collections.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> collections() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(collections.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public byte @Nullable [] get(final String collection, final String key) {
        lock.readLock().lock();
        try {
            final byte[] value = namespace(collection).get(key);
            return value == null ? null : value.clone();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the entries in {@code [startKey, endKey)}, key-ordered. Empty bounds are open.
     */
    public List<StateKV> range(final String collection, final String startKey, final String endKey) {
        lock.readLock().lock();
        try {
            NavigableMap<String, byte[]> view = namespace(collection);
            if (!startKey.isEmpty() && !endKey.isEmpty()) {
                if (startKey.compareTo(endKey) > 0) {
                    return List.of();
                }
                view = view.subMap(startKey, true, endKey, false);
            } else if (!startKey.isEmpty()) {
                view = view.tailMap(startKey, true);
            } else if (!endKey.isEmpty()) {
                view = view.headMap(endKey, false);
            }
            return copy(collection, view);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns every entry of a namespace, key-ordered.
     */
    public List<StateKV> snapshot(final String collection) {
        lock.readLock().lock();
        try {
            return copy(collection, namespace(collection));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size(final String collection) {
        lock.readLock().lock();
        try {
            return namespace(collection).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies every write and delete of the set in one step.
     *
     * @throws StateAccessException if the set names an undefined collection; nothing is applied then
     */
    public void apply(final WriteSet writeSet) {
        lock.writeLock().lock();
        try {
            for (StateKey key : writeSet.entries().keySet()) {
                namespace(key.collection());
            }
            for (Map.Entry<StateKey, byte @Nullable []> entry : writeSet.entries().entrySet()) {
                final NavigableMap<String, byte[]> target = namespace(entry.getKey().collection());
                final byte[] value = entry.getValue();
                if (value == null) {
                    target.remove(entry.getKey().key());
                } else {
                    target.put(entry.getKey().key(), value.clone());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Caller must hold the lock. */
    private NavigableMap<String, byte[]> namespace(final String collection) {
        if (collection == null || collection.isEmpty()) {
            return publicState;
        }
        final NavigableMap<String, byte[]> map = collections.get(collection);
        if (map == null) {
            throw new StateAccessException("private data collection " + collection + " is not defined");
        }
        return map;
    }

    private static List<StateKV> copy(final String collection, final Map<String, byte[]> view) {
        final List<StateKV> out = new ArrayList<>(view.size());
        for (Map.Entry<String, byte[]> entry : view.entrySet()) {
            out.add(new StateKV(collection, entry.getKey(), entry.getValue()));
        }
        return out;
    }
}
