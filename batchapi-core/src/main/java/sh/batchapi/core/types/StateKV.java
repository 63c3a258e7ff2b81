// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.types;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A state entry with its value, as carried by batch puts and returned by batch gets.
 *
 * @param collection the private data collection, or the empty string for public state
 * @param key        the state key
 * @param value      the value bytes
 */
public record StateKV(String collection, String key, byte[] value) {

    public StateKV {
        collection = collection == null ? "" : collection;
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        value = value.clone();
    }

    public static StateKV of(final String key, final String value) {
        return new StateKV("", key, value.getBytes(StandardCharsets.UTF_8));
    }

    public static StateKV of(final String collection, final String key, final String value) {
        return new StateKV(collection, key, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns a copy of the value bytes.
     */
    @Override
    public byte[] value() {
        return value.clone();
    }

    public String valueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    public StateKey stateKey() {
        return new StateKey(collection, key);
    }

    public boolean isPrivate() {
        return !collection.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StateKV other)) return false;
        return collection.equals(other.collection)
                && key.equals(other.key)
                && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, key, Arrays.hashCode(value));
    }

    @Override
    public String toString() {
        return "StateKV[collection=" + collection + ", key=" + key + ", value=(" + value.length + " bytes)]";
    }
}
