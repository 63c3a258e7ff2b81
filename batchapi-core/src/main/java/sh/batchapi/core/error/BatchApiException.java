// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.error;

/**
 * Base runtime exception for all harness failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * BatchApiException
 * ├── {@link ChaincodeException} - an invocation returned an error response
 * ├── {@link StateAccessException} - the shim rejected a state operation
 * └── {@link MetricsParseException} - a stress log line could not be parsed
 * </pre>
 *
 * <pre>{@code
 * try {
 *     contract.submitTransaction("putManyObjectsBatch", "1000");
 * } catch (ChaincodeException e) {
 *     // chaincode answered with status 500
 * } catch (BatchApiException e) {
 *     // anything else the harness raised
 * }
 * }</pre>
 */
public sealed class BatchApiException extends RuntimeException
        permits ChaincodeException,
        StateAccessException,
        MetricsParseException {

    public BatchApiException(final String message) {
        super(message);
    }

    public BatchApiException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
