// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.types;

import java.util.Objects;

/**
 * Address of a single state entry: a key in public state or in a private data collection.
 *
 * @param collection the private data collection, or the empty string for public state
 * @param key        the state key
 */
public record StateKey(String collection, String key) {

    public StateKey {
        collection = collection == null ? "" : collection;
        Objects.requireNonNull(key, "key");
    }

    public static StateKey of(final String key) {
        return new StateKey("", key);
    }

    public static StateKey of(final String collection, final String key) {
        return new StateKey(collection, key);
    }

    public boolean isPrivate() {
        return !collection.isEmpty();
    }
}
