// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class SimulatorOptionsTest {

    @Test
    void defaultsAreFree() {
        SimulatorOptions options = SimulatorOptions.defaults();

        assertEquals(0L, options.costNanos(1_000));
        assertEquals(100, options.queryPageSize());
    }

    @Test
    void costIsCallPlusPerEntry() {
        SimulatorOptions options = SimulatorOptions.builder()
                .callLatency(Duration.ofNanos(20_000))
                .perEntryLatency(Duration.ofNanos(500))
                .build();

        assertEquals(20_500L, options.costNanos(1));
        assertEquals(70_000L, options.costNanos(100));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> SimulatorOptions.builder().callLatency(Duration.ofNanos(-1)));
        assertThrows(IllegalArgumentException.class,
                () -> SimulatorOptions.builder().perEntryLatency(Duration.ofNanos(-1)));
        assertThrows(IllegalArgumentException.class,
                () -> SimulatorOptions.builder().queryPageSize(0));
    }

    @Test
    void equalityIsByValue() {
        SimulatorOptions a = SimulatorOptions.builder().queryPageSize(10).build();
        SimulatorOptions b = SimulatorOptions.builder().queryPageSize(10).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(SimulatorOptions.defaults(), a);
    }
}
