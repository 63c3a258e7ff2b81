// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class StressOptionsTest {

    @Test
    void defaultsWhenOnlyCountGiven() {
        StressOptions options = StressOptions.parse(List.of("100"), 7, true);

        assertEquals(100, options.entries());
        assertEquals(7, options.keyLength());
        assertEquals(1, options.seed());
        assertEquals("", options.collection());
        assertTrue(options.useBatchApi());
        assertFalse(options.verbose());
    }

    @Test
    void flagsInAnyOrder() {
        StressOptions options = StressOptions.parse(
                List.of("10", "verbose", "collection", "coll1", "nobatchapi", "keylength", "20", "seed", "5"), 7, true);

        assertEquals(20, options.keyLength());
        assertEquals(5, options.seed());
        assertEquals("coll1", options.collection());
        assertFalse(options.useBatchApi());
        assertTrue(options.verbose());
        assertTrue(options.isPrivate());
    }

    @Test
    void unparsableValuesFallBack() {
        StressOptions options = StressOptions.parse(List.of("10", "seed", "abc", "keylength", "x"), 7, true);

        assertEquals(1, options.seed());
        assertEquals(7, options.keyLength());
    }

    @Test
    void flagWithoutValueIsIgnored() {
        StressOptions options = StressOptions.parse(List.of("10", "collection"), 7, true);

        assertEquals("", options.collection());
    }

    @Test
    void keyLengthFlagCanBeDisabled() {
        StressOptions options = StressOptions.parse(List.of("10", "keylength", "30"), 7, false);

        assertEquals(7, options.keyLength());
    }

    @Test
    void countIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> StressOptions.parse(List.of(), 7, true));
        assertThrows(IllegalArgumentException.class, () -> StressOptions.parse(List.of("many"), 7, true));
    }

    @Test
    void argsRoundTripThroughParser() {
        StressOptions options = new StressOptions(300, 20, false, 4, "coll", true);

        assertEquals(options, StressOptions.parse(options.toArgs(), 7, true));
        assertEquals(List.of("300", "keylength", "20", "nobatchapi", "seed", "4", "collection", "coll", "verbose"),
                options.toArgs());
    }
}
