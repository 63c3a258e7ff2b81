// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.batchapi.core.error.StateAccessException;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;

class WorldStateTest {

    private WorldState state;

    @BeforeEach
    void setUp() {
        state = new WorldState().defineCollection("coll");
        WriteSet ws = new WriteSet();
        for (String key : List.of("OBJ00000", "OBJ00001", "OBJ00002", "OBJ00003")) {
            ws.put(StateKey.of(key), key.getBytes(StandardCharsets.UTF_8));
        }
        ws.put(StateKey.of("coll", "secret"), bytes("42"));
        state.apply(ws);
    }

    @Test
    void rangeIsHalfOpen() {
        List<StateKV> range = state.range("", "OBJ00001", "OBJ00003");

        assertEquals(List.of("OBJ00001", "OBJ00002"), range.stream().map(StateKV::key).toList());
    }

    @Test
    void emptyBoundsAreOpen() {
        assertEquals(4, state.range("", "", "").size());
        assertEquals(2, state.range("", "OBJ00002", "").size());
        assertEquals(1, state.range("", "", "OBJ00001").size());
        assertTrue(state.range("", "OBJ00003", "OBJ00001").isEmpty());
    }

    @Test
    void collectionsAreSeparate() {
        assertArrayEquals(bytes("42"), state.get("coll", "secret"));
        assertNull(state.get("", "secret"));
        assertEquals(1, state.size("coll"));
    }

    @Test
    void deletesRemoveKeys() {
        WriteSet ws = new WriteSet();
        ws.delete(StateKey.of("OBJ00000"));
        ws.delete(StateKey.of("missing"));
        state.apply(ws);

        assertNull(state.get("", "OBJ00000"));
        assertEquals(3, state.size(""));
    }

    @Test
    void undefinedCollectionAppliesNothing() {
        WriteSet ws = new WriteSet();
        ws.put(StateKey.of("late"), bytes("v"));
        ws.put(StateKey.of("nope", "k"), bytes("v"));

        assertThrows(StateAccessException.class, () -> state.apply(ws));
        assertNull(state.get("", "late"));
    }

    @Test
    void returnedValuesAreCopies() {
        byte[] value = state.get("", "OBJ00000");
        value[0] = 'x';

        assertArrayEquals(bytes("OBJ00000"), state.get("", "OBJ00000"));
    }

    @Test
    void collectionNamesMustNotBeEmpty() {
        assertThrows(IllegalArgumentException.class, () -> state.defineCollection(""));
        assertEquals(java.util.Set.of("coll"), state.collections());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
