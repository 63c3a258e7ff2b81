// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The state operation a stress invocation measured.
 *
 * <p>Each method has a wire name (the {@code method} field of the metrics JSON)
 * and a response prefix that precedes the JSON in chaincode responses.
 */
public enum StressMethod {
    PUT("put", "PutState"),
    GET("get", "GetState"),
    DEL("del", "DelState"),
    PUT_RANGE("putrange", "PutRange"),
    GET_RANGE("getrange", "GetRange");

    private final String wireName;
    private final String responsePrefix;

    StressMethod(final String wireName, final String responsePrefix) {
        this.wireName = wireName;
        this.responsePrefix = responsePrefix;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String responsePrefix() {
        return responsePrefix;
    }

    public boolean isRange() {
        return this == PUT_RANGE || this == GET_RANGE;
    }

    @JsonCreator
    public static StressMethod fromWireName(final String wireName) {
        for (StressMethod method : values()) {
            if (method.wireName.equalsIgnoreCase(wireName)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown stress method: " + wireName);
    }
}
