// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.benchmark;

import sh.batchapi.contract.ObjectsChaincode;
import sh.batchapi.contract.marbles.MarblesChaincode;

/**
 * Names of a chaincode's seeded stress functions.
 */
record StressFunctions(String put, String get, String delete) {

    static final StressFunctions OBJECTS =
            new StressFunctions("putManyObjectsBatch", "getManyObjectsBatch", "delManyObjectsBatch");

    static final StressFunctions MARBLES =
            new StressFunctions("putManyMarblesBatch", "getManyMarblesBatch", "delManyMarblesBatch");

    /**
     * @throws IllegalArgumentException for a chaincode without stress functions
     */
    static StressFunctions forChaincode(final String chaincodeName) {
        return switch (chaincodeName) {
            case ObjectsChaincode.NAME -> OBJECTS;
            case MarblesChaincode.NAME -> MARBLES;
            default -> throw new IllegalArgumentException("No stress functions for chaincode: " + chaincodeName);
        };
    }
}
