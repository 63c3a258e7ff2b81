// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.contract;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.batchapi.core.error.BatchApiException;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;
import sh.batchapi.shim.Chaincode;
import sh.batchapi.shim.ChaincodeStub;
import sh.batchapi.shim.Response;

/**
 * Base class for the benchmark chaincodes: function dispatch, error mapping and the
 * explicit-argument batch functions both chaincodes expose.
 *
 * <p>Shim rejections and argument errors raised while a function runs are returned
 * as error responses; nothing escapes {@link #invoke(ChaincodeStub)}.
 */
public abstract class AbstractBatchChaincode implements Chaincode {

    public static final String UNKNOWN_FUNCTION = "Received unknown function invocation";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final StressOperations stress;

    protected AbstractBatchChaincode() {
        this(new StressOperations());
    }

    protected AbstractBatchChaincode(final StressOperations stress) {
        this.stress = stress;
    }

    @Override
    public Response init(final ChaincodeStub stub) {
        return Response.success();
    }

    @Override
    public final Response invoke(final ChaincodeStub stub) {
        final String function = stub.getFunction();
        log.debug("invoke is running {}", function);
        try {
            return dispatch(stub, function, stub.getParameters());
        } catch (BatchApiException | IllegalArgumentException e) {
            log.debug("{} failed: {}", function, e.getMessage());
            return Response.error(e.getMessage());
        }
    }

    /**
     * Runs one function.
     *
     * @param stub     the transaction's stub
     * @param function the function name
     * @param args     the function arguments
     * @return the function's response
     */
    protected abstract Response dispatch(ChaincodeStub stub, String function, List<String> args);

    protected Response unknownFunction(final String function) {
        log.warn("invoke did not find func: {}", function);
        return Response.error(UNKNOWN_FUNCTION);
    }

    /**
     * Stores {@code k1 v1 ... kn vn} in public state with one batch call.
     */
    protected static Response putPairs(final ChaincodeStub stub, final List<String> args) {
        if (args.size() < 2) {
            return Response.error("Incorrect arguments. Expecting at least a key and a value");
        }
        if (args.size() % 2 != 0) {
            return Response.error(
                    "Incorrect arguments. Expecting even number of arguments: k1, v1, k2, v2, ..., kn, vn");
        }
        final List<StateKV> entries = new ArrayList<>(args.size() / 2);
        for (int i = 0; i < args.size(); i += 2) {
            entries.add(StateKV.of(args.get(i), args.get(i + 1)));
        }
        stub.putStateBatch(entries);
        return Response.success(listing(entries));
    }

    /**
     * Reads the given public keys with one batch call.
     */
    protected static Response getKeys(final ChaincodeStub stub, final List<String> args) {
        if (args.isEmpty()) {
            return Response.error("Incorrect arguments. Expecting at least one key");
        }
        final List<StateKey> keys = args.stream().map(StateKey::of).toList();
        final List<StateKV> found = stub.getStateBatch(keys);
        if (found.isEmpty()) {
            return Response.error(StressOperations.ASSETS_NOT_FOUND + ": " + args);
        }
        return Response.success(listing(found));
    }

    private static String listing(final List<StateKV> entries) {
        final StringBuilder sb = new StringBuilder();
        for (StateKV kv : entries) {
            sb.append(kv.key()).append(": ").append(kv.valueAsString())
                    .append(" (").append(kv.collection()).append(")\n");
        }
        return sb.toString();
    }
}
