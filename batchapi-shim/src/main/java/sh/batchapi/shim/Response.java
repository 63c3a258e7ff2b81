// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Result of a chaincode invocation.
 *
 * @param status  {@link #OK} or {@link #ERROR}
 * @param message error message, null on success
 * @param payload response bytes, empty on error
 */
public record Response(int status, @Nullable String message, byte[] payload) {

    public static final int OK = 200;
    public static final int ERROR = 500;

    private static final byte[] EMPTY = new byte[0];

    public Response {
        payload = payload == null ? EMPTY : payload.clone();
    }

    public static Response success() {
        return new Response(OK, null, EMPTY);
    }

    public static Response success(final byte @Nullable [] payload) {
        return new Response(OK, null, payload);
    }

    public static Response success(final String payload) {
        return new Response(OK, null, payload.getBytes(StandardCharsets.UTF_8));
    }

    public static Response error(final String message) {
        return new Response(ERROR, message, EMPTY);
    }

    public boolean isSuccess() {
        return status >= OK && status < 400;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Response other)) return false;
        return status == other.status
                && Objects.equals(message, other.message)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, message, Arrays.hashCode(payload));
    }

    @Override
    public String toString() {
        return "Response[status=" + status + ", message=" + message + ", payload=(" + payload.length + " bytes)]";
    }
}
