// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.batchapi.client.Contract;
import sh.batchapi.client.LocalPeer;
import sh.batchapi.client.StressRequest;
import sh.batchapi.contract.ObjectsChaincode;
import sh.batchapi.contract.marbles.MarblesChaincode;
import sh.batchapi.core.BatchDebug;
import sh.batchapi.core.error.BatchApiException;
import sh.batchapi.core.error.ChaincodeException;
import sh.batchapi.core.model.InvocationMetrics;
import sh.batchapi.shim.ledger.WorldState;

/**
 * Command line entry point.
 *
 * <pre>
 * batchapi put|get|del [-v] [-n] [-s SEED] [-c COLLECTION] [-k KEY_LENGTH] [--chaincode NAME] NUMBER
 * batchapi scenario NAME [--start N] [--step N] [--end N] [--repeat N] [--test-id N] [--pause-ms MS]
 * batchapi analyze [--csv DIR] [--strict] FILE...
 * </pre>
 * Every command also accepts {@code --call-latency-us}, {@code --entry-latency-us},
 * {@code --config FILE}, {@code --log-dir DIR}, {@code -d} and {@code -h}.
 *
 * <p>Exit codes: 0 on success, 1 on usage errors, 2 when a chaincode or the
 * analysis fails.
 */
public final class StressCli {

    private static final Logger LOG = LoggerFactory.getLogger(StressCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    static final List<String> SCENARIOS = List.of("put-increasing", "put-repeat", "put-del", "range", "seed-sweep");

    private final PrintStream out;
    private final PrintStream err;

    public StressCli(final PrintStream out, final PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(final String[] args) {
        System.exit(new StressCli(System.out, System.err).run(args));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(final String[] args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }
        final String command = args[0];
        if ("-h".equals(command) || "--help".equals(command)) {
            printUsage();
            return EXIT_OK;
        }
        final Options options = optionsFor(command);
        if (options == null) {
            err.println("Unknown command: " + command);
            printUsage();
            return EXIT_USAGE;
        }

        final CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, Arrays.copyOfRange(args, 1, args.length));
        } catch (ParseException e) {
            return usageError(command, options, e.getMessage());
        }
        if (cmd.hasOption("help")) {
            printHelp(command, options);
            return EXIT_OK;
        }

        if (cmd.hasOption("debug")) {
            BatchDebug.setEnabled(true);
        }
        try {
            final ScenarioConfig config = config(cmd);
            return switch (command) {
                case "put", "get", "del" -> runStress(command, cmd, config);
                case "scenario" -> runScenario(cmd, config);
                default -> runAnalyze(cmd);
            };
        } catch (UsageException | IllegalArgumentException e) {
            return usageError(command, options, e.getMessage());
        } catch (ChaincodeException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (BatchApiException | UncheckedIOException e) {
            LOG.debug("{} failed", command, e);
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int runStress(final String command, final CommandLine cmd, final ScenarioConfig config)
            throws UsageException {
        final int entries = number(cmd);
        final String collection = cmd.getOptionValue("collection", "");
        final StressRequest.Builder request = StressRequest.builder()
                .entries(entries)
                .keyLength(intOption(cmd, "key-length", StressRequest.DEFAULT_KEY_LENGTH))
                .seed(intOption(cmd, "seed", config.seed()))
                .useBatchApi(!cmd.hasOption("no-batch-api"))
                .collection(collection);
        final Contract contract = contract(cmd, config, collection);
        final StressFunctions functions = StressFunctions.forChaincode(contract.chaincodeName());

        if (cmd.hasOption("preload") && !"put".equals(command)) {
            contract.submitTransaction(functions.put(), request.verbose(false).build().toArgs());
        }
        final String[] stressArgs = request.verbose(cmd.hasOption("verbose")).build().toArgs();
        final byte[] payload = switch (command) {
            case "put" -> contract.submitTransaction(functions.put(), stressArgs);
            case "get" -> contract.evaluateTransaction(functions.get(), stressArgs);
            default -> contract.submitTransaction(functions.delete(), stressArgs);
        };
        final String response = new String(payload, StandardCharsets.UTF_8);
        out.println(response);
        try (StressLogWriter log = StressLogWriter.open(config.logDir(), StressScenarios.SEED_SWEEP_LOG)) {
            log.append(response);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return EXIT_OK;
    }

    private int runScenario(final CommandLine cmd, final ScenarioConfig config) throws UsageException {
        final List<String> names = cmd.getArgList();
        if (names.size() != 1 || !SCENARIOS.contains(names.get(0))) {
            throw new UsageException("Expecting one scenario name: " + String.join(", ", SCENARIOS));
        }
        final String name = names.get(0);
        final String collection = cmd.getOptionValue("collection", "");
        final boolean batch = !cmd.hasOption("no-batch-api");
        final Contract contract = "range".equals(name)
                ? peer(config, collection).contract(ObjectsChaincode.NAME)
                : contract(cmd, config, collection);
        int keyLength = intOption(cmd, "key-length", config.keyLength());
        if (MarblesChaincode.NAME.equals(contract.chaincodeName()) && keyLength != MarblesChaincode.KEY_LENGTH) {
            // log names carry the key length the chaincode actually writes
            if (cmd.hasOption("key-length")) {
                err.println("Marbles keys are always " + MarblesChaincode.KEY_LENGTH
                        + " characters long, ignoring --key-length " + keyLength);
            }
            keyLength = MarblesChaincode.KEY_LENGTH;
        }
        final StressScenarios scenarios = new StressScenarios(contract, config);

        final List<InvocationMetrics> metrics = switch (name) {
            case "put-increasing" -> scenarios.putWithIncreasingKeyNumber(
                    config.testId(), config.start(), config.step(), config.end(), keyLength, batch, collection);
            case "put-repeat" -> {
                final List<InvocationMetrics> all = new ArrayList<>();
                for (long entries = config.start(); entries <= config.end(); entries += config.step()) {
                    all.addAll(scenarios.putWithSameKeyNumberNTimes(
                            (int) entries, config.repeat(), keyLength, batch, collection));
                }
                yield all;
            }
            case "put-del" -> scenarios.putAndDelWithIncreasingKeyNumber(
                    config.testId(), config.start(), config.step(), config.end(),
                    keyLength, config.seed(), batch, collection);
            case "range" -> scenarios.getRangeVersusBatch(
                    config.testId(),
                    intOption(cmd, "entries", ObjectsChaincode.DEFAULT_RANGE_SIZE),
                    cmd.hasOption("verbose"));
            default -> scenarios.seedSweep(config.start(), config.step(), config.end(), keyLength);
        };
        metrics.forEach(m -> out.println(m.toJson()));
        out.println("Logs written to " + config.logDir().toAbsolutePath());
        return EXIT_OK;
    }

    private int runAnalyze(final CommandLine cmd) throws UsageException {
        final List<String> files = cmd.getArgList();
        if (files.isEmpty()) {
            throw new UsageException("Expecting at least one stress log");
        }
        final StressLogAnalyzer analyzer = new StressLogAnalyzer(cmd.hasOption("strict"));
        final StressSummary summary = analyzer.analyze(files.stream().map(Path::of).toList());
        out.print(summary.toMarkdown());
        if (cmd.hasOption("csv")) {
            for (Path file : summary.writeCsv(Path.of(cmd.getOptionValue("csv")))) {
                out.println("Wrote " + file);
            }
        }
        return EXIT_OK;
    }

    private static Contract contract(final CommandLine cmd, final ScenarioConfig config, final String collection)
            throws UsageException {
        final String chaincode = cmd.getOptionValue("chaincode", ObjectsChaincode.NAME);
        if (!ObjectsChaincode.NAME.equals(chaincode) && !MarblesChaincode.NAME.equals(chaincode)) {
            throw new UsageException("Unknown chaincode: " + chaincode);
        }
        return peer(config, collection).contract(chaincode);
    }

    private static LocalPeer peer(final ScenarioConfig config, final String collection) {
        final WorldState state = new WorldState()
                .defineCollection(MarblesChaincode.COLLECTION_MARBLES)
                .defineCollection(MarblesChaincode.COLLECTION_PRIVATE_DETAILS);
        if (!collection.isEmpty()) {
            state.defineCollection(collection);
        }
        return new LocalPeer(state, config.simulatorOptions())
                .install(ObjectsChaincode.NAME, new ObjectsChaincode())
                .install(MarblesChaincode.NAME, new MarblesChaincode());
    }

    private static ScenarioConfig config(final CommandLine cmd) throws UsageException {
        ScenarioConfig base = ScenarioConfig.defaults();
        if (cmd.hasOption("config")) {
            final Path file = Path.of(cmd.getOptionValue("config"));
            final Properties properties = new Properties();
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException e) {
                throw new UsageException("Cannot read config " + file + ": " + e.getMessage());
            }
            try {
                base = ScenarioConfig.fromProperties(properties);
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }
        final ScenarioConfig.Builder builder = base.toBuilder()
                .start(intOption(cmd, "start", base.start()))
                .step(intOption(cmd, "step", base.step()))
                .end(intOption(cmd, "end", base.end()))
                .repeat(intOption(cmd, "repeat", base.repeat()))
                .testId(intOption(cmd, "test-id", base.testId()))
                .seed(intOption(cmd, "seed", base.seed()))
                .pause(Duration.ofMillis(intOption(cmd, "pause-ms", (int) base.pause().toMillis())))
                .callLatency(micros(cmd, "call-latency-us", base.callLatency()))
                .entryLatency(micros(cmd, "entry-latency-us", base.entryLatency()));
        if (cmd.hasOption("log-dir")) {
            builder.logDir(Path.of(cmd.getOptionValue("log-dir")));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static int number(final CommandLine cmd) throws UsageException {
        final List<String> rest = cmd.getArgList();
        if (rest.size() != 1) {
            throw new UsageException("Expecting exactly one NUMBER argument");
        }
        try {
            final int n = Integer.parseInt(rest.get(0));
            if (n < 0) {
                throw new UsageException("NUMBER must not be negative: " + n);
            }
            return n;
        } catch (NumberFormatException e) {
            throw new UsageException("NUMBER must be an integer: " + rest.get(0));
        }
    }

    private static int intOption(final CommandLine cmd, final String name, final int fallback)
            throws UsageException {
        if (!cmd.hasOption(name)) {
            return fallback;
        }
        final String value = cmd.getOptionValue(name);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " must be an integer: " + value);
        }
    }

    private static Duration micros(final CommandLine cmd, final String name, final Duration fallback)
            throws UsageException {
        if (!cmd.hasOption(name)) {
            return fallback;
        }
        final int us = intOption(cmd, name, 0);
        if (us < 0) {
            throw new UsageException("--" + name + " must not be negative: " + us);
        }
        return Duration.ofNanos(us * 1_000L);
    }

    static Options optionsFor(final String command) {
        final Options options;
        switch (command) {
            case "put", "get", "del" -> {
                options = stressOptions();
                if (!"put".equals(command)) {
                    options.addOption(Option.builder()
                            .longOpt("preload")
                            .desc("Put the same keys first")
                            .build());
                }
            }
            case "scenario" -> {
                options = stressOptions();
                options.addOption(intOpt("start", "First entry count"));
                options.addOption(intOpt("step", "Entry count increment"));
                options.addOption(intOpt("end", "Last entry count (inclusive)"));
                options.addOption(intOpt("repeat", "Invocations per entry count (put-repeat)"));
                options.addOption(intOpt("test-id", "Test id used in log file names"));
                options.addOption(intOpt("pause-ms", "Pause between steps (seed-sweep)"));
                options.addOption(intOpt("entries", "Object count (range)"));
            }
            case "analyze" -> {
                options = new Options();
                options.addOption(Option.builder()
                        .longOpt("csv")
                        .hasArg()
                        .argName("DIR")
                        .desc("Write per-series CSV files to DIR")
                        .build());
                options.addOption(Option.builder()
                        .longOpt("strict")
                        .desc("Fail on the first malformed line")
                        .build());
            }
            default -> {
                return null;
            }
        }
        options.addOption(intOpt("call-latency-us", "Simulated cost of every shim call"));
        options.addOption(intOpt("entry-latency-us", "Simulated cost of every entry a shim call carries"));
        options.addOption(Option.builder()
                .longOpt("config")
                .hasArg()
                .argName("FILE")
                .desc("Properties file with batchapi.* settings")
                .build());
        options.addOption(Option.builder()
                .longOpt("log-dir")
                .hasArg()
                .argName("DIR")
                .desc("Directory for stress logs")
                .build());
        options.addOption("d", "debug", false, "Log every shim call and transaction");
        options.addOption("h", "help", false, "Show help");
        return options;
    }

    private static Options stressOptions() {
        final Options options = new Options();
        options.addOption("v", "verbose", false, "Chaincode returns generated keys and parameters");
        options.addOption("n", "no-batch-api", false, "One single-key call per entry instead of one batch call");
        options.addOption(Option.builder("s")
                .longOpt("seed")
                .hasArg()
                .argName("SEED")
                .desc("Seed that reproduces the generated keys")
                .build());
        options.addOption(Option.builder("c")
                .longOpt("collection")
                .hasArg()
                .argName("COLLECTION")
                .desc("Private data collection")
                .build());
        options.addOption(Option.builder("k")
                .longOpt("key-length")
                .hasArg()
                .argName("KEY_LENGTH")
                .desc("Key and value length")
                .build());
        options.addOption(Option.builder()
                .longOpt("chaincode")
                .hasArg()
                .argName("NAME")
                .desc("objects (default) or marbles")
                .build());
        return options;
    }

    private static Option intOpt(final String longOpt, final String desc) {
        return Option.builder()
                .longOpt(longOpt)
                .hasArg()
                .argName("N")
                .desc(desc)
                .build();
    }

    private int usageError(final String command, final Options options, final String message) {
        err.println(message);
        printHelp(command, options);
        return EXIT_USAGE;
    }

    private void printHelp(final String command, final Options options) {
        final PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "batchapi " + command,
                null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }

    private void printUsage() {
        out.println("Usage: batchapi <command> [options]");
        out.println("Commands:");
        out.println("  put|get|del NUMBER   seeded stress run against the objects or marbles chaincode");
        out.println("  scenario NAME        one of " + String.join(", ", SCENARIOS));
        out.println("  analyze FILE...      summarize stress logs");
        out.println("Run 'batchapi <command> -h' for command options.");
    }

    /** Invalid command line; reported with help and exit code 1. */
    static final class UsageException extends Exception {
        private static final long serialVersionUID = 1L;

        UsageException(final String message) {
            super(message);
        }
    }
}
