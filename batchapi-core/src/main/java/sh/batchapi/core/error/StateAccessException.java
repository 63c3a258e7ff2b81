// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.error;

/**
 * Exception thrown by the shim when a state operation is rejected: empty or
 * reserved keys, null values, undefined private data collections, malformed
 * rich queries or reads from a closed iterator.
 */
public final class StateAccessException extends BatchApiException {

    public StateAccessException(final String message) {
        super(message);
    }

    public StateAccessException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
