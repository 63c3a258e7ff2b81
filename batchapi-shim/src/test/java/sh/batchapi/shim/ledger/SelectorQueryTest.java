// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.batchapi.core.error.StateAccessException;

class SelectorQueryTest {

    private static final byte[] MARBLE = "{\"docType\":\"marble\",\"name\":\"marble1\",\"color\":\"blue\",\"size\":35,\"owner\":\"tom\"}"
            .getBytes(StandardCharsets.UTF_8);

    @Test
    void equalityOnTopLevelFields() {
        assertTrue(SelectorQuery.parse("{\"selector\":{\"docType\":\"marble\",\"owner\":\"tom\"}}").matches(MARBLE));
        assertFalse(SelectorQuery.parse("{\"selector\":{\"owner\":\"jerry\"}}").matches(MARBLE));
    }

    @Test
    void comparisonOperators() {
        assertTrue(SelectorQuery.parse("{\"selector\":{\"size\":{\"$gt\":0,\"$lte\":35}}}").matches(MARBLE));
        assertFalse(SelectorQuery.parse("{\"selector\":{\"size\":{\"$lt\":35}}}").matches(MARBLE));
        assertTrue(SelectorQuery.parse("{\"selector\":{\"color\":{\"$ne\":\"red\"}}}").matches(MARBLE));
        assertTrue(SelectorQuery.parse("{\"selector\":{\"size\":{\"$eq\":35.0}}}").matches(MARBLE));
    }

    @Test
    void mismatchedTypesNeverOrder() {
        assertFalse(SelectorQuery.parse("{\"selector\":{\"owner\":{\"$lt\":100}}}").matches(MARBLE));
        assertFalse(SelectorQuery.parse("{\"selector\":{\"owner\":{\"$gt\":100}}}").matches(MARBLE));
    }

    @Test
    void missingFieldOnlyMatchesNotEqual() {
        assertFalse(SelectorQuery.parse("{\"selector\":{\"price\":1}}").matches(MARBLE));
        assertTrue(SelectorQuery.parse("{\"selector\":{\"price\":{\"$ne\":1}}}").matches(MARBLE));
    }

    @Test
    void ignoresExtraQueryMembers() {
        String query = "{\"selector\":{\"docType\":{\"$eq\":\"marble\"},\"size\":{\"$gt\":0}},"
                + "\"fields\":[\"docType\",\"owner\",\"size\"],\"sort\":[{\"size\":\"desc\"}],"
                + "\"use_index\":\"_design/indexSizeSortDoc\"}";

        assertTrue(SelectorQuery.parse(query).matches(MARBLE));
    }

    @Test
    void nonJsonValuesNeverMatch() {
        SelectorQuery query = SelectorQuery.parse("{\"selector\":{}}");

        assertTrue(query.matches(MARBLE));
        assertFalse(query.matches(new byte[] {0x00}));
        assertFalse(query.matches("[1,2]".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void rejectsMalformedQueries() {
        assertThrows(StateAccessException.class, () -> SelectorQuery.parse("not json"));
        assertThrows(StateAccessException.class, () -> SelectorQuery.parse("{\"fields\":[]}"));
        assertThrows(StateAccessException.class, () -> SelectorQuery.parse("{\"selector\":{\"a\":{\"$regex\":\"x\"}}}"));
    }
}
