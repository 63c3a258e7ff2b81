// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.batchapi.client.Contract;
import sh.batchapi.client.StressRequest;
import sh.batchapi.core.model.InvocationMetrics;
import sh.batchapi.core.model.StressOptions;

/**
 * Stress scenarios that drive a chaincode through its {@link Contract} and record
 * every response's metrics in a log under {@link ScenarioConfig#logDir()}.
 *
 * <p>Entry counts run from {@code start} to {@code end} inclusive in steps of
 * {@code step}. Log files are appended to, so repeated runs accumulate samples
 * for {@link StressLogAnalyzer}.
 */
public final class StressScenarios {

    private static final Logger LOG = LoggerFactory.getLogger(StressScenarios.class);

    /** Log written by {@link #seedSweep}. */
    public static final String SEED_SWEEP_LOG = "stress.log";

    private final Contract contract;
    private final ScenarioConfig config;
    private final StressFunctions functions;

    /**
     * @throws IllegalArgumentException if the contract's chaincode has no stress functions
     */
    public StressScenarios(final Contract contract, final ScenarioConfig config) {
        this.contract = Objects.requireNonNull(contract, "contract");
        this.config = Objects.requireNonNull(config, "config");
        this.functions = StressFunctions.forChaincode(contract.chaincodeName());
    }

    public static String putIncreasingLog(final int testId, final int keyLength) {
        return "stressPut" + testId + ".KeyLen" + keyLength + ".log";
    }

    public static String putRepeatLog(final int entries, final int keyLength) {
        return "stressPut" + entries + "Entries.KeyLen" + keyLength + ".log";
    }

    public static String putAndDelLog(final int testId, final int keyLength) {
        return "stressPutAndDel" + testId + ".KeyLen" + keyLength + ".log";
    }

    public static String rangeLog(final int testId) {
        return "scenarioGetRangeVSBatchAPI" + testId + ".log";
    }

    /**
     * Puts {@code start, start+step, ..., <= end} entries, one transaction per count.
     */
    public List<InvocationMetrics> putWithIncreasingKeyNumber(
            final int testId,
            final int start,
            final int step,
            final int end,
            final int keyLength,
            final boolean useBatchApi,
            final String collection) {
        requireRange(start, step, end);
        final List<InvocationMetrics> out = new ArrayList<>();
        try (StressLogWriter log = StressLogWriter.open(config.logDir(), putIncreasingLog(testId, keyLength))) {
            for (long entries = start; entries <= end; entries += step) {
                final StressRequest request = request((int) entries, keyLength, config.seed(), useBatchApi, collection);
                out.add(log.append(submit(functions.put(), request)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out;
    }

    /**
     * Puts the same number of entries {@code times} times with the same seed.
     */
    public List<InvocationMetrics> putWithSameKeyNumberNTimes(
            final int entries,
            final int times,
            final int keyLength,
            final boolean useBatchApi,
            final String collection) {
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive: " + times);
        }
        final List<InvocationMetrics> out = new ArrayList<>(times);
        try (StressLogWriter log = StressLogWriter.open(config.logDir(), putRepeatLog(entries, keyLength))) {
            final StressRequest request = request(entries, keyLength, config.seed(), useBatchApi, collection);
            for (int i = 0; i < times; i++) {
                out.add(log.append(submit(functions.put(), request)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out;
    }

    /**
     * Puts and then deletes the same keys for every entry count.
     */
    public List<InvocationMetrics> putAndDelWithIncreasingKeyNumber(
            final int testId,
            final int start,
            final int step,
            final int end,
            final int keyLength,
            final int seed,
            final boolean useBatchApi,
            final String collection) {
        requireRange(start, step, end);
        final List<InvocationMetrics> out = new ArrayList<>();
        try (StressLogWriter log = StressLogWriter.open(config.logDir(), putAndDelLog(testId, keyLength))) {
            for (long entries = start; entries <= end; entries += step) {
                final StressRequest request = request((int) entries, keyLength, seed, useBatchApi, collection);
                final String put = submit(functions.put(), request);
                final String del = submit(functions.delete(), request);
                out.add(log.append(put));
                out.add(log.append(del));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out;
    }

    /**
     * Writes the range objects, then reads them once with a range iterator and once
     * with a batch get. Requires the {@code objects} chaincode.
     */
    public List<InvocationMetrics> getRangeVersusBatch(final int testId, final int entries, final boolean verbose) {
        final String count = Integer.toString(entries);
        final List<String> flags = verbose ? List.of(StressOptions.VERBOSE) : List.of();
        final List<InvocationMetrics> out = new ArrayList<>(2);
        try (StressLogWriter log = StressLogWriter.open(config.logDir(), rangeLog(testId))) {
            final String put = text(contract.submitTransaction("putRange", count));
            LOG.debug("putRange {}: {}", count, put);

            final List<String> rangeArgs = new ArrayList<>();
            rangeArgs.add(count);
            rangeArgs.add(StressOptions.NO_BATCH_API);
            rangeArgs.addAll(flags);
            out.add(log.append(evaluate("getRange", rangeArgs)));

            final List<String> batchArgs = new ArrayList<>();
            batchArgs.add(count);
            batchArgs.addAll(flags);
            out.add(log.append(evaluate("getRange", batchArgs)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out;
    }

    /**
     * For each entry count, bumps the seed and puts fresh keys, pausing between steps.
     */
    public List<InvocationMetrics> seedSweep(final int start, final int step, final int end, final int keyLength) {
        requireRange(start, step, end);
        final List<InvocationMetrics> out = new ArrayList<>();
        int seed = config.seed();
        try (StressLogWriter log = StressLogWriter.open(config.logDir(), SEED_SWEEP_LOG)) {
            for (long entries = start; entries <= end; entries += step) {
                seed++;
                out.add(log.append(submit(functions.put(), request((int) entries, keyLength, seed, true, ""))));
                pause();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out;
    }

    private String submit(final String function, final StressRequest request) {
        final String response = text(contract.submitTransaction(function, request.toArgs()));
        LOG.debug("{} {}: {}", function, request.toArgList(), response);
        return response;
    }

    private String evaluate(final String function, final List<String> args) {
        final String response = text(contract.evaluateTransaction(function, args.toArray(new String[0])));
        LOG.debug("{} {}: {}", function, args, response);
        return response;
    }

    private void pause() {
        if (config.pause().isZero()) {
            return;
        }
        try {
            Thread.sleep(config.pause().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between scenario steps", e);
        }
    }

    private static StressRequest request(
            final int entries, final int keyLength, final int seed, final boolean useBatchApi, final String collection) {
        return StressRequest.builder()
                .entries(entries)
                .keyLength(keyLength)
                .seed(seed)
                .useBatchApi(useBatchApi)
                .collection(collection == null ? "" : collection)
                .build();
    }

    private static void requireRange(final int start, final int step, final int end) {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        if (start > end) {
            throw new IllegalArgumentException("start must not exceed end: " + start + " > " + end);
        }
    }

    private static String text(final byte[] payload) {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
