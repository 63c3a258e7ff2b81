// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.contract.marbles;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Price of a marble, kept in {@code collectionMarblePrivateDetails}.
 */
@JsonPropertyOrder({"docType", "name", "price"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record MarblePrivateDetails(
        @JsonProperty("docType") String docType,
        @JsonProperty("name") String name,
        @JsonProperty("price") int price) {

    public static final String DOC_TYPE = "marblePrivateDetails";

    public static MarblePrivateDetails of(final String name, final int price) {
        return new MarblePrivateDetails(DOC_TYPE, name, price);
    }
}
