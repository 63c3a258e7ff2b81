// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.contract.marbles;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Marble as stored in {@code collectionMarbles}.
 *
 * @param docType always {@value #DOC_TYPE}, lets rich queries tell object kinds apart
 * @param name    the marble name, also its state key
 * @param color   the color
 * @param size    the size
 * @param owner   the current owner
 */
@JsonPropertyOrder({"docType", "name", "color", "size", "owner"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record Marble(
        @JsonProperty("docType") String docType,
        @JsonProperty("name") String name,
        @JsonProperty("color") String color,
        @JsonProperty("size") int size,
        @JsonProperty("owner") String owner) {

    public static final String DOC_TYPE = "marble";

    public static Marble of(final String name, final String color, final int size, final String owner) {
        return new Marble(DOC_TYPE, name, color, size, owner);
    }

    public Marble withOwner(final String newOwner) {
        return new Marble(docType, name, color, size, newOwner);
    }
}
