// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Composite keys in the ledger's layout:
 * {@code U+0000 objectType U+0000 attr1 U+0000 ... attrN U+0000}.
 *
 * <p>The leading {@code U+0000} keeps composite keys out of simple-key range scans.
 *
 * @param objectType the index or object type name, e.g. {@code color~name}
 * @param attributes the key attributes in order
 */
public record CompositeKey(String objectType, List<String> attributes) {

    public static final char NAMESPACE = '\u0000';

    private static final int MAX_UNICODE_RUNE = 0x10FFFF;

    public CompositeKey {
        Objects.requireNonNull(objectType, "objectType");
        validate(objectType);
        attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes"));
        attributes.forEach(CompositeKey::validate);
    }

    public static CompositeKey of(final String objectType, final String... attributes) {
        return new CompositeKey(objectType, List.of(attributes));
    }

    /**
     * Renders this composite key as a state key string.
     */
    public String toKey() {
        final StringBuilder sb = new StringBuilder();
        sb.append(NAMESPACE).append(objectType).append(NAMESPACE);
        for (String attribute : attributes) {
            sb.append(attribute).append(NAMESPACE);
        }
        return sb.toString();
    }

    /**
     * Parses a key produced by {@link #toKey()}.
     *
     * @throws IllegalArgumentException if the key is not a composite key
     */
    public static CompositeKey parse(final String key) {
        Objects.requireNonNull(key, "key");
        if (!isComposite(key) || key.length() < 2 || key.charAt(key.length() - 1) != NAMESPACE) {
            throw new IllegalArgumentException("Not a composite key: " + key.replace(NAMESPACE, '~'));
        }
        final List<String> parts = new ArrayList<>();
        int start = 1;
        for (int i = 1; i < key.length(); i++) {
            if (key.charAt(i) == NAMESPACE) {
                parts.add(key.substring(start, i));
                start = i + 1;
            }
        }
        return new CompositeKey(parts.get(0), parts.subList(1, parts.size()));
    }

    public static boolean isComposite(final String key) {
        return key != null && !key.isEmpty() && key.charAt(0) == NAMESPACE;
    }

    private static void validate(final String part) {
        Objects.requireNonNull(part, "composite key attribute");
        if (part.indexOf(NAMESPACE) >= 0 || part.codePoints().anyMatch(cp -> cp == MAX_UNICODE_RUNE)) {
            throw new IllegalArgumentException("Composite key attribute contains a reserved character: " + part);
        }
    }
}
