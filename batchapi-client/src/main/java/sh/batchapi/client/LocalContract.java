// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.batchapi.core.error.ChaincodeException;
import sh.batchapi.shim.Response;

/**
 * {@link Contract} backed by a {@link LocalPeer}.
 */
public final class LocalContract implements Contract {

    private final LocalPeer peer;
    private final String chaincodeName;

    LocalContract(final LocalPeer peer, final String chaincodeName) {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.chaincodeName = Objects.requireNonNull(chaincodeName, "chaincodeName");
    }

    @Override
    public String chaincodeName() {
        return chaincodeName;
    }

    @Override
    public byte[] submitTransaction(final String function, final String... args) {
        return submitTransaction(function, Map.of(), args);
    }

    @Override
    public byte[] submitTransaction(final String function, final Map<String, byte[]> transientMap, final String... args) {
        return payloadOf(function, peer.submit(chaincodeName, function, List.of(args), transientMap));
    }

    @Override
    public byte[] evaluateTransaction(final String function, final String... args) {
        return payloadOf(function, peer.evaluate(chaincodeName, function, List.of(args)));
    }

    private static byte[] payloadOf(final String function, final Response response) {
        if (!response.isSuccess()) {
            throw new ChaincodeException(response.status(), function, String.valueOf(response.message()));
        }
        return response.payload();
    }

    @Override
    public String toString() {
        return "LocalContract{chaincode=" + chaincodeName + "}";
    }
}
