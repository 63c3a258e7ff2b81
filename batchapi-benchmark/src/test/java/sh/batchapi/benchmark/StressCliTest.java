// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import sh.batchapi.core.model.InvocationMetrics;
import sh.batchapi.core.model.StressMethod;

class StressCliTest {

    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private StressCli cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new StressCli(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return cli.run(args);
    }

    private String logDir() {
        return dir.resolve("logs").toString();
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(StressCli.EXIT_USAGE, run());
        assertTrue(stdout().contains("Usage: batchapi <command>"));
    }

    @Test
    void unknownCommandIsAUsageError() {
        assertEquals(StressCli.EXIT_USAGE, run("teleport", "5"));
        assertTrue(stderr().contains("Unknown command: teleport"));
    }

    @Test
    void commandHelpListsOptions() {
        assertEquals(StressCli.EXIT_OK, run("put", "-h"));
        assertTrue(stdout().contains("--no-batch-api"));
        assertTrue(stdout().contains("--key-length"));
    }

    @Test
    void putPrintsResponseAndAppendsStressLog() throws IOException {
        int code = run("put", "-n", "-s", "3", "-k", "5", "--log-dir", logDir(), "25");

        assertEquals(StressCli.EXIT_OK, code);
        assertTrue(stdout().startsWith("PutState:"));
        List<String> lines = Files.readAllLines(dir.resolve("logs").resolve(StressScenarios.SEED_SWEEP_LOG));
        assertEquals(1, lines.size());
        InvocationMetrics metrics = InvocationMetrics.parseLine(lines.get(0));
        assertEquals(StressMethod.PUT, metrics.method());
        assertEquals(25, metrics.entries());
        assertFalse(metrics.batchapi());
        assertEquals(3, metrics.seed());
        assertEquals(5, metrics.keylen());
    }

    @Test
    void verboseGetWithPreloadListsKeys() {
        int code = run("get", "--preload", "-v", "-s", "9", "--log-dir", logDir(), "4");

        assertEquals(StressCli.EXIT_OK, code);
        assertTrue(stdout().startsWith("GetState:"));
        assertTrue(stdout().contains("useBatchAPI: true, Seed: 9"));
    }

    @Test
    void getOnEmptyLedgerIsAChaincodeFailure() {
        assertEquals(StressCli.EXIT_FAILURE, run("get", "--log-dir", logDir(), "4"));
        assertTrue(stderr().contains("Assets not found"));
    }

    @Test
    void privateCollectionIsDefinedOnDemand() {
        int code = run("del", "--preload", "-c", "stressCollection", "--log-dir", logDir(), "10");

        assertEquals(StressCli.EXIT_OK, code);
        assertTrue(stdout().contains("\"collection\":\"stressCollection\""));
    }

    @Test
    void marblesChaincodeCanBeSelected() {
        int code = run("put", "--chaincode", "marbles", "-c", "collectionMarbles", "--log-dir", logDir(), "3");

        assertEquals(StressCli.EXIT_OK, code);
        assertTrue(stdout().startsWith("PutState:"));
    }

    @Test
    void badArgumentsAreUsageErrors() {
        assertEquals(StressCli.EXIT_USAGE, run("put", "--log-dir", logDir(), "many"));
        assertEquals(StressCli.EXIT_USAGE, run("put", "--log-dir", logDir()));
        assertEquals(StressCli.EXIT_USAGE, run("put", "-k", "0", "--log-dir", logDir(), "5"));
        assertEquals(StressCli.EXIT_USAGE, run("put", "--chaincode", "fabcar", "--log-dir", logDir(), "5"));
        assertEquals(StressCli.EXIT_USAGE, run("put", "--no-such-option", "5"));
        assertTrue(stderr().contains("NUMBER must be an integer: many"));
    }

    @Test
    void scenarioWritesItsLog() throws IOException {
        int code = run("scenario", "put-increasing",
                "--start", "10", "--step", "10", "--end", "20", "-k", "4", "--test-id", "3",
                "--log-dir", logDir());

        assertEquals(StressCli.EXIT_OK, code);
        Path log = dir.resolve("logs").resolve(StressScenarios.putIncreasingLog(3, 4));
        assertEquals(2, Files.readAllLines(log).size());
    }

    @Test
    void marblesScenarioLogsUseTheChaincodeKeyLength() throws IOException {
        int code = run("scenario", "put-increasing", "--chaincode", "marbles", "-c", "collectionMarbles",
                "--start", "5", "--step", "5", "--end", "10", "-k", "4", "--test-id", "2",
                "--log-dir", logDir());

        assertEquals(StressCli.EXIT_OK, code);
        Path logs = dir.resolve("logs");
        assertFalse(Files.exists(logs.resolve(StressScenarios.putIncreasingLog(2, 4))));
        List<String> lines = Files.readAllLines(logs.resolve(StressScenarios.putIncreasingLog(2, 7)));
        assertEquals(2, lines.size());
        assertEquals(7, InvocationMetrics.parseLine(lines.get(0)).keylen());
        assertTrue(stderr().contains("ignoring --key-length 4"));
    }

    @Test
    void marblesScenarioWithDefaultKeyLength() {
        int code = run("scenario", "put-del", "--chaincode", "marbles", "-c", "collectionMarbles",
                "--start", "3", "--step", "3", "--end", "3", "--test-id", "8", "--log-dir", logDir());

        assertEquals(StressCli.EXIT_OK, code);
        assertTrue(Files.exists(dir.resolve("logs").resolve(StressScenarios.putAndDelLog(8, 7))));
        assertEquals("", stderr());
    }

    @Test
    void rangeScenarioUsesObjectsChaincode() throws IOException {
        int code = run("scenario", "range", "--chaincode", "marbles", "--entries", "20", "--log-dir", logDir());

        assertEquals(StressCli.EXIT_OK, code);
        assertEquals(2, Files.readAllLines(dir.resolve("logs").resolve(StressScenarios.rangeLog(1))).size());
    }

    @Test
    void unknownScenarioIsAUsageError() {
        assertEquals(StressCli.EXIT_USAGE, run("scenario", "warp", "--log-dir", logDir()));
        assertTrue(stderr().contains("put-increasing"));
    }

    @Test
    void configFileSuppliesDefaults() throws IOException {
        Path config = dir.resolve("batchapi.properties");
        Files.writeString(config, "batchapi.logDir=" + logDir().replace('\\', '/') + "\nbatchapi.seed=6\n");

        assertEquals(StressCli.EXIT_OK, run("put", "--config", config.toString(), "2"));
        List<String> lines = Files.readAllLines(dir.resolve("logs").resolve(StressScenarios.SEED_SWEEP_LOG));
        assertEquals(6, InvocationMetrics.parseLine(lines.get(0)).seed());
    }

    @Test
    void missingConfigFileIsAUsageError() {
        assertEquals(StressCli.EXIT_USAGE, run("put", "--config", dir.resolve("absent").toString(), "2"));
    }

    @Test
    void analyzeSummarizesAndWritesCsv() throws IOException {
        run("put", "-s", "1", "--log-dir", logDir(), "10");
        run("put", "-n", "-s", "1", "--log-dir", logDir(), "10");
        out.reset();
        Path log = dir.resolve("logs").resolve(StressScenarios.SEED_SWEEP_LOG);

        int code = run("analyze", "--csv", dir.resolve("csv").toString(), log.toString());

        assertEquals(StressCli.EXIT_OK, code);
        assertTrue(stdout().contains("| put | 10 |"));
        assertTrue(Files.exists(dir.resolve("csv").resolve("put-batch.csv")));
        assertTrue(Files.exists(dir.resolve("csv").resolve("put-standard.csv")));
    }

    @Test
    void strictAnalyzeFailsOnMalformedLog() throws IOException {
        Path log = dir.resolve("broken.log");
        Files.writeString(log, "not a metrics line\n");

        assertEquals(StressCli.EXIT_FAILURE, run("analyze", "--strict", log.toString()));
        assertEquals(StressCli.EXIT_OK, run("analyze", log.toString()));
        assertEquals(StressCli.EXIT_USAGE, run("analyze"));
    }
}
