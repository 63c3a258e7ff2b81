// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.batchapi.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        BatchDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.logShim("nor this");
        DebugLogger.logTx("nor that");
        DebugLogger.logTransient("tx1", Map.of("marble", "{}".getBytes(StandardCharsets.UTF_8)));

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void transientValuesAreSanitized() {
        BatchDebug.setTxLogging(true);
        DebugLogger.logTransient("tx1", Map.of(
                "marble", "{\"name\":\"marble1\",\"price\":99}".getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, appender.list.size());
        String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.startsWith("[TX-TRANSIENT] txId=tx1 {marble="));
        assertTrue(message.contains("***[REDACTED]***"));
        assertFalse(message.contains("\"price\":99"));
    }

    @Test
    void emptyTransientMapIsNotLogged() {
        BatchDebug.setTxLogging(true);
        DebugLogger.logTransient("tx1", Map.of());

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void shimAndTxTogglesAreIndependent() {
        BatchDebug.setShimLogging(true);

        DebugLogger.logShim("shim %s", "call");
        DebugLogger.logTx("tx %s", "call");

        assertEquals(1, appender.list.size());
        assertEquals("shim call", appender.list.get(0).getFormattedMessage());
        assertTrue(BatchDebug.isEnabled());
    }
}
