// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.error;

/**
 * Thrown on the client side when a chaincode invocation returns an error response.
 *
 * <p>
 * This class is {@code non-sealed} so applications can model their own
 * chaincode failures on top of it.
 */
public non-sealed class ChaincodeException extends BatchApiException {

    private final int status;
    private final String function;

    public ChaincodeException(final int status, final String function, final String message) {
        super(augmentMessage(function, message));
        this.status = status;
        this.function = function;
    }

    public int status() {
        return status;
    }

    public String function() {
        return function;
    }

    public boolean isUnknownFunction() {
        final String msg = getMessage();
        return msg != null && msg.contains("Received unknown function invocation");
    }

    public boolean isNotFound() {
        final String msg = getMessage();
        return msg != null
                && (msg.contains("not found") || msg.contains("does not exist"));
    }

    @Override
    public String toString() {
        return "ChaincodeException{"
                + "status="
                + status
                + ", function="
                + function
                + ", message="
                + getMessage()
                + "}";
    }

    private static String augmentMessage(final String function, final String message) {
        if (function == null || function.isBlank()) {
            return message;
        }
        return "[" + function + "] " + message;
    }
}
