// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ResponseTest {

    @Test
    void successCarriesPayload() {
        Response response = Response.success("PutState:{}");

        assertTrue(response.isSuccess());
        assertEquals(Response.OK, response.status());
        assertNull(response.message());
        assertEquals("PutState:{}", response.payloadAsString());
    }

    @Test
    void errorHasEmptyPayload() {
        Response response = Response.error("Received unknown function invocation");

        assertFalse(response.isSuccess());
        assertEquals(Response.ERROR, response.status());
        assertEquals(0, response.payload().length);
    }

    @Test
    void emptySuccessEqualsNullPayload() {
        assertEquals(Response.success(), Response.success(new byte[0]));
    }
}
