// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.batchapi.core.DebugLogger;
import sh.batchapi.core.LogFormatter;
import sh.batchapi.core.error.ChaincodeException;
import sh.batchapi.shim.Chaincode;
import sh.batchapi.shim.Response;
import sh.batchapi.shim.ledger.SimulatedStub;
import sh.batchapi.shim.ledger.SimulatorOptions;
import sh.batchapi.shim.ledger.WorldState;

/**
 * In-process peer hosting installed chaincodes over one {@link WorldState}.
 *
 * <p>{@link #submit} simulates a transaction and commits its write set when the
 * chaincode answers with a success status; {@link #evaluate} simulates without
 * committing. Submits are serialized so that a transaction's reads and its commit
 * see no interleaved writes.
 *
 * <pre>{@code
 * var peer = new LocalPeer(new WorldState(), SimulatorOptions.defaults());
 * peer.install("objects", new ObjectsChaincode());
 * Contract contract = peer.contract("objects");
 * byte[] result = contract.submitTransaction("putManyObjectsBatch", "1000");
 * }</pre>
 */
public final class LocalPeer {

    private static final Logger LOG = LoggerFactory.getLogger(LocalPeer.class);

    private final WorldState state;
    private final SimulatorOptions options;
    private final Map<String, Chaincode> chaincodes = new ConcurrentHashMap<>();
    private final Object commitLock = new Object();

    public LocalPeer(final WorldState state, final SimulatorOptions options) {
        this.state = Objects.requireNonNull(state, "state");
        this.options = Objects.requireNonNull(options, "options");
    }

    public WorldState worldState() {
        return state;
    }

    public SimulatorOptions options() {
        return options;
    }

    /**
     * Installs a chaincode under {@code name} and runs its {@code init}; init writes
     * are committed.
     *
     * @throws IllegalArgumentException if the name is already taken
     * @throws ChaincodeException       if init returns an error response
     */
    public LocalPeer install(final String name, final Chaincode chaincode) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(chaincode, "chaincode");
        if (chaincodes.putIfAbsent(name, chaincode) != null) {
            throw new IllegalArgumentException("Chaincode already installed: " + name);
        }
        synchronized (commitLock) {
            final SimulatedStub stub = newStub("init", List.of(), Map.of());
            final Response response = chaincode.init(stub);
            if (!response.isSuccess()) {
                chaincodes.remove(name);
                throw new ChaincodeException(response.status(), "init", String.valueOf(response.message()));
            }
            state.apply(stub.writeSet());
        }
        LOG.debug("installed chaincode {}", name);
        return this;
    }

    public boolean isInstalled(final String name) {
        return chaincodes.containsKey(name);
    }

    /**
     * Returns a {@link Contract} bound to an installed chaincode.
     *
     * @throws IllegalArgumentException if no chaincode is installed under that name
     */
    public Contract contract(final String name) {
        chaincode(name);
        return new LocalContract(this, name);
    }

    /**
     * Simulates a transaction and commits its writes on success.
     *
     * @throws IllegalArgumentException if no chaincode is installed under that name
     */
    public Response submit(
            final String chaincodeName,
            final String function,
            final List<String> args,
            final Map<String, byte[]> transientMap) {
        final Chaincode chaincode = chaincode(chaincodeName);
        synchronized (commitLock) {
            final SimulatedStub stub = newStub(function, args, transientMap);
            DebugLogger.logTx(LogFormatter.formatTxSubmit(chaincodeName, function, stub.getTxId()));
            DebugLogger.logTransient(stub.getTxId(), transientMap);
            final long start = System.nanoTime();
            final Response response = chaincode.invoke(stub);
            final int writes = stub.writeSet().size();
            if (response.isSuccess()) {
                state.apply(stub.writeSet());
            }
            logResult(stub, response, response.isSuccess() ? writes : 0, start);
            return response;
        }
    }

    /**
     * Simulates a transaction without committing it.
     *
     * @throws IllegalArgumentException if no chaincode is installed under that name
     */
    public Response evaluate(final String chaincodeName, final String function, final List<String> args) {
        final Chaincode chaincode = chaincode(chaincodeName);
        final SimulatedStub stub = newStub(function, args, Map.of());
        DebugLogger.logTx(LogFormatter.formatTxEvaluate(chaincodeName, function, stub.getTxId()));
        final long start = System.nanoTime();
        final Response response = chaincode.invoke(stub);
        logResult(stub, response, 0, start);
        return response;
    }

    private Chaincode chaincode(final String name) {
        final Chaincode chaincode = chaincodes.get(name);
        if (chaincode == null) {
            throw new IllegalArgumentException("Chaincode not installed: " + name);
        }
        return chaincode;
    }

    private SimulatedStub newStub(
            final String function, final List<String> args, final Map<String, byte[]> transientMap) {
        return new SimulatedStub(
                state,
                options,
                UUID.randomUUID().toString(),
                function,
                args,
                transientMap);
    }

    private static void logResult(
            final SimulatedStub stub, final Response response, final int writes, final long startNanos) {
        final long micros = (System.nanoTime() - startNanos) / 1_000;
        DebugLogger.logTx(LogFormatter.formatTxResult(
                stub.getTxId(), response.status(), response.message(), writes, micros));
        if (!response.isSuccess()) {
            LOG.debug("tx {} {} failed: {}", stub.getTxId(), stub.getFunction(), response.message());
        }
    }
}
