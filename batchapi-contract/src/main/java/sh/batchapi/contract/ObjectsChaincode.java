// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.contract;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.batchapi.core.model.InvocationMetrics;
import sh.batchapi.core.model.StressMethod;
import sh.batchapi.core.model.StressOptions;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;
import sh.batchapi.shim.ChaincodeStub;
import sh.batchapi.shim.Response;
import sh.batchapi.shim.StateIterator;

/**
 * Public-state chaincode used to compare the batch API with single-key calls.
 *
 * <p>Functions:
 * <pre>
 * putObjectsBatch k1 v1 ... kn vn        put explicit pairs with one batch call
 * getObjectsBatch k1 ... kn              get explicit keys with one batch call
 * putManyObjectsBatch N [opts]           seeded put stress run
 * getManyObjectsBatch N [opts]           seeded get stress run
 * delManyObjectsBatch N [opts]           seeded delete stress run
 * putRange [N]                           write OBJ00000 .. OBJ{N-1}
 * getRange [N] [nobatchapi] [verbose]    read [OBJ00000, OBJ{N}) by range or by batch
 * </pre>
 * Stress options are described in {@link StressOptions}; {@code keylength} is honored
 * and defaults to {@value #DEFAULT_KEY_LENGTH}.
 */
public final class ObjectsChaincode extends AbstractBatchChaincode {

    public static final String NAME = "objects";

    public static final int DEFAULT_KEY_LENGTH = 7;

    /** Object count of {@code putRange} and {@code getRange} when none is given. */
    public static final int DEFAULT_RANGE_SIZE = 1000;

    public static final int MAX_RANGE_SIZE = 99_999;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ObjectsChaincode() {
        super();
    }

    public ObjectsChaincode(final StressOperations stress) {
        super(stress);
    }

    @Override
    protected Response dispatch(final ChaincodeStub stub, final String function, final List<String> args) {
        return switch (function) {
            case "putObjectsBatch" -> putPairs(stub, args);
            case "getObjectsBatch" -> getKeys(stub, args);
            case "putManyObjectsBatch" -> stress.put(stub, options(args));
            case "getManyObjectsBatch" -> stress.get(stub, options(args));
            case "delManyObjectsBatch" -> stress.delete(stub, options(args));
            case "putRange" -> putRange(stub, args);
            case "getRange" -> getRange(stub, args);
            default -> unknownFunction(function);
        };
    }

    /**
     * Returns the state key of the {@code index}-th range object.
     */
    public static String rangeKey(final int index) {
        return String.format("OBJ%05d", index);
    }

    private static StressOptions options(final List<String> args) {
        return StressOptions.parse(args, DEFAULT_KEY_LENGTH, true);
    }

    private Response putRange(final ChaincodeStub stub, final List<String> args) {
        final int count = rangeSize(args);
        final List<StateKV> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final String value = "{\"test\":\"object\",\"message\":\"hello developer!\",\"id\":\"" + i + "\"}";
            entries.add(new StateKV("", rangeKey(i), value.getBytes(StandardCharsets.UTF_8)));
        }

        final long start = System.nanoTime();
        stub.putStateBatch(entries);
        final long millis = StressOperations.elapsedMillis(start);

        return Response.success(
                InvocationMetrics.ofRange(StressMethod.PUT_RANGE, count, millis, true).toResponse(null));
    }

    private Response getRange(final ChaincodeStub stub, final List<String> args) {
        final int count = rangeSize(args);
        final boolean useBatchApi = !args.contains(StressOptions.NO_BATCH_API);
        final boolean verbose = args.contains(StressOptions.VERBOSE);
        final List<StateKey> keys = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            keys.add(StateKey.of(rangeKey(i)));
        }

        final long start = System.nanoTime();
        final List<StateKV> found;
        if (useBatchApi) {
            found = stub.getStateBatch(keys);
        } else {
            found = new ArrayList<>(count);
            try (StateIterator it = stub.getStateByRange(rangeKey(0), rangeKey(count))) {
                it.forEachRemaining(found::add);
            }
        }
        final long millis = StressOperations.elapsedMillis(start);

        String tail = null;
        if (verbose) {
            final ObjectNode values = MAPPER.createObjectNode();
            found.forEach(kv -> values.put(kv.key(), kv.valueAsString()));
            tail = values.toString();
        }
        return Response.success(
                InvocationMetrics.ofRange(StressMethod.GET_RANGE, found.size(), millis, useBatchApi).toResponse(tail));
    }

    /**
     * The optional leading count of {@code putRange} and {@code getRange}.
     */
    private static int rangeSize(final List<String> args) {
        if (args.isEmpty() || StressOptions.NO_BATCH_API.equals(args.get(0))
                || StressOptions.VERBOSE.equals(args.get(0))) {
            return DEFAULT_RANGE_SIZE;
        }
        final int count;
        try {
            count = Integer.parseInt(args.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number of objects: " + args.get(0), e);
        }
        // five-digit keys; OBJ100000 would sort inside the range
        if (count < 0 || count > MAX_RANGE_SIZE) {
            throw new IllegalArgumentException(
                    "Number of objects must be between 0 and " + MAX_RANGE_SIZE + ": " + count);
        }
        return count;
    }
}
