// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import sh.batchapi.contract.ObjectsChaincode;
import sh.batchapi.contract.marbles.MarblesChaincode;
import sh.batchapi.core.BatchDebug;
import sh.batchapi.core.error.ChaincodeException;
import sh.batchapi.core.model.InvocationMetrics;
import sh.batchapi.shim.Response;
import sh.batchapi.shim.ledger.SimulatorOptions;
import sh.batchapi.shim.ledger.WorldState;

class LocalPeerTest {

    private LocalPeer peer;

    @BeforeEach
    void setUp() {
        WorldState state = new WorldState()
                .defineCollection(MarblesChaincode.COLLECTION_MARBLES)
                .defineCollection(MarblesChaincode.COLLECTION_PRIVATE_DETAILS);
        peer = new LocalPeer(state, SimulatorOptions.defaults())
                .install(ObjectsChaincode.NAME, new ObjectsChaincode())
                .install(MarblesChaincode.NAME, new MarblesChaincode());
    }

    @AfterEach
    void tearDown() {
        BatchDebug.setEnabled(false);
    }

    @Test
    void submitCommitsOnSuccess() {
        Response response = peer.submit(ObjectsChaincode.NAME, "putManyObjectsBatch", List.of("40"), Map.of());

        assertTrue(response.isSuccess());
        assertEquals(40, peer.worldState().size(""));
    }

    @Test
    void failedSubmitCommitsNothing() {
        Response response = peer.submit(
                ObjectsChaincode.NAME, "putManyObjectsBatch", List.of("40", "collection", "missing"), Map.of());

        assertFalse(response.isSuccess());
        assertEquals(0, peer.worldState().size(""));
    }

    @Test
    void evaluateNeverCommits() {
        Response response = peer.evaluate(ObjectsChaincode.NAME, "putManyObjectsBatch", List.of("40"));

        assertTrue(response.isSuccess());
        assertEquals(0, peer.worldState().size(""));
    }

    @Test
    void unknownChaincode() {
        assertThrows(IllegalArgumentException.class,
                () -> peer.submit("nope", "f", List.of(), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> peer.contract("nope"));
        assertThrows(IllegalArgumentException.class,
                () -> peer.install(ObjectsChaincode.NAME, new ObjectsChaincode()));
    }

    @Test
    void contractThrowsOnErrorResponse() {
        Contract contract = peer.contract(ObjectsChaincode.NAME);

        ChaincodeException ex = assertThrows(ChaincodeException.class,
                () -> contract.evaluateTransaction("getManyObjectsBatch", "5"));

        assertEquals(500, ex.status());
        assertEquals("getManyObjectsBatch", ex.function());
        assertTrue(ex.isNotFound());
    }

    @Test
    void contractPassesTransientData() {
        Contract contract = peer.contract(MarblesChaincode.NAME);
        byte[] marble = "{\"name\":\"m1\",\"color\":\"blue\",\"size\":3,\"owner\":\"tom\",\"price\":7}"
                .getBytes(StandardCharsets.UTF_8);

        contract.submitTransaction("initMarble", Map.of("marble", marble));
        String details = new String(contract.evaluateTransaction("readMarblePrivateDetails", "m1"),
                StandardCharsets.UTF_8);

        assertTrue(details.contains("\"price\":7"));
    }

    @Test
    void stressRequestRoundTripThroughContract() {
        Contract contract = peer.contract(ObjectsChaincode.NAME);
        StressRequest put = StressRequest.builder().entries(25).keyLength(10).seed(9).build();

        contract.submitTransaction("putManyObjectsBatch", put.toArgs());
        String get = new String(contract.evaluateTransaction("getManyObjectsBatch", put.toArgs()),
                StandardCharsets.UTF_8);

        InvocationMetrics metrics = InvocationMetrics.parseLine(get);
        assertEquals(25, metrics.entries());
        assertEquals(10, metrics.keylen());
        assertEquals(9, metrics.seed());
    }

    @Test
    void concurrentEvaluatesReadTheKeysOfTheirOwnSeed() throws Exception {
        Contract contract = peer.contract(ObjectsChaincode.NAME);
        Map<Integer, String> expected = new HashMap<>();
        for (int seed = 1; seed <= 2; seed++) {
            StressRequest request = StressRequest.builder().entries(200).seed(seed).build();
            contract.submitTransaction("putManyObjectsBatch", request.toArgs());
            expected.put(seed, verboseGet(contract, seed));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<Integer>> workers = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                workers.add(pool.submit(() -> {
                    int wrong = 0;
                    for (int i = 0; i < 100; i++) {
                        int seed = 1 + i % 2;
                        if (!expected.get(seed).equals(verboseGet(contract, seed))) {
                            wrong++;
                        }
                    }
                    return wrong;
                }));
            }
            for (Future<Integer> worker : workers) {
                assertEquals(0, worker.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static String verboseGet(Contract contract, int seed) {
        StressRequest request = StressRequest.builder().entries(200).seed(seed).verbose(true).build();
        String response = new String(
                contract.evaluateTransaction("getManyObjectsBatch", request.toArgs()), StandardCharsets.UTF_8);
        return InvocationMetrics.verboseTail(response);
    }

    @Test
    void transactionLoggingThroughDebugLogger() {
        Logger logger = (Logger) LoggerFactory.getLogger("sh.batchapi.debug");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        BatchDebug.setTxLogging(true);
        try {
            peer.submit(ObjectsChaincode.NAME, "putManyObjectsBatch", List.of("3"), Map.of());
            peer.evaluate(MarblesChaincode.NAME, "readMarble", List.of("ghost"));
            peer.submit(MarblesChaincode.NAME, "initMarble", List.of(), Map.of("marble",
                    "{\"name\":\"m1\",\"color\":\"blue\",\"size\":5,\"owner\":\"tom\",\"price\":4321}"
                            .getBytes(StandardCharsets.UTF_8)));
            Response stringPrice = peer.submit(MarblesChaincode.NAME, "initMarble", List.of(), Map.of("marble",
                    "{\"name\":\"m2\",\"color\":\"red\",\"size\":5,\"owner\":\"tom\",\"price\":\"4242\"}"
                            .getBytes(StandardCharsets.UTF_8)));
            assertTrue(stringPrice.isSuccess());
        } finally {
            logger.detachAppender(appender);
        }

        List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        assertTrue(messages.stream().anyMatch(m -> m.contains("[TX-SUBMIT]") && m.contains("putManyObjectsBatch")));
        assertTrue(messages.stream().anyMatch(m -> m.contains("[TX-EVALUATE]") && m.contains("readMarble")));
        assertTrue(messages.stream().anyMatch(m -> m.contains("status=500")));
        assertTrue(messages.stream().anyMatch(m -> m.contains("[TX-TRANSIENT]") && m.contains("***[REDACTED]***")));
        assertTrue(messages.stream().noneMatch(m -> m.contains("\"price\":4321")));
        assertTrue(messages.stream()
                .noneMatch(m -> m.contains("\"price\":\"4242\"") || m.contains("\"price\":4242")));
    }
}
