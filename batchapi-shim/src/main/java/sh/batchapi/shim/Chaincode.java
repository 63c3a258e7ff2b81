// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim;

/**
 * A smart contract hosted by the runtime.
 *
 * <p>Implementations dispatch on {@link ChaincodeStub#getFunction()} and report
 * failures through {@link Response#error(String)} rather than by throwing.
 */
public interface Chaincode {

    /**
     * Called once when the chaincode is installed.
     */
    Response init(ChaincodeStub stub);

    /**
     * Called for every transaction proposal.
     */
    Response invoke(ChaincodeStub stub);
}
