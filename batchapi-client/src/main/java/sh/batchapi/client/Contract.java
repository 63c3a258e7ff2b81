// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.client;

import java.util.Map;

import sh.batchapi.core.error.ChaincodeException;

/**
 * Client view of one deployed chaincode.
 *
 * <p>All methods return the response payload and throw {@link ChaincodeException}
 * when the chaincode answers with an error status.
 */
public interface Contract {

    /**
     * Name of the chaincode this contract invokes.
     */
    String chaincodeName();

    /**
     * Invokes a function and commits its writes.
     */
    byte[] submitTransaction(String function, String... args);

    /**
     * Invokes a function with private inputs in the transient map and commits its writes.
     */
    byte[] submitTransaction(String function, Map<String, byte[]> transientMap, String... args);

    /**
     * Invokes a function without committing anything.
     */
    byte[] evaluateTransaction(String function, String... args);
}
