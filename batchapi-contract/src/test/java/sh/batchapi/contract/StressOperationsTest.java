// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.contract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.batchapi.core.model.InvocationMetrics;
import sh.batchapi.core.model.StressMethod;
import sh.batchapi.core.model.StressOptions;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.core.types.StateKey;
import sh.batchapi.shim.ChaincodeStub;
import sh.batchapi.shim.Response;

/**
 * Unit tests for {@link StressOperations} against a mocked stub.
 */
@ExtendWith(MockitoExtension.class)
class StressOperationsTest {

    @Mock
    private ChaincodeStub stub;

    @Captor
    private ArgumentCaptor<List<StateKV>> entriesCaptor;

    @Captor
    private ArgumentCaptor<List<StateKey>> keysCaptor;

    private final StressOperations stress = new StressOperations();

    @Test
    void batchPutIsOneCall() {
        Response response = stress.put(stub, options(10, true, ""));

        verify(stub).putStateBatch(entriesCaptor.capture());
        verify(stub, never()).putState(anyString(), any(byte[].class));
        assertEquals(10, entriesCaptor.getValue().size());
        assertTrue(response.isSuccess());

        InvocationMetrics metrics = InvocationMetrics.parseLine(response.payloadAsString());
        assertEquals(StressMethod.PUT, metrics.method());
        assertEquals(10, metrics.entries());
        assertEquals(9, metrics.keylen());
        assertEquals(3, metrics.seed());
        assertTrue(metrics.batchapi());
    }

    @Test
    void singlePutsUsePublicOrPrivateCalls() {
        stress.put(stub, options(5, false, ""));
        verify(stub, times(5)).putState(anyString(), any(byte[].class));

        stress.put(stub, options(4, false, "coll"));
        verify(stub, times(4)).putPrivateData(eq("coll"), anyString(), any(byte[].class));
        verify(stub, never()).putStateBatch(anyList());
    }

    @Test
    void getAndDeleteAddressTheKeysOfPut() {
        stress.put(stub, options(20, true, "coll"));
        verify(stub).putStateBatch(entriesCaptor.capture());
        List<StateKey> written = entriesCaptor.getValue().stream().map(StateKV::stateKey).toList();

        when(stub.getStateBatch(anyList())).thenReturn(entriesCaptor.getValue());
        stress.get(stub, options(20, true, "coll"));
        verify(stub).getStateBatch(keysCaptor.capture());
        assertEquals(written, keysCaptor.getValue());

        stress.delete(stub, options(20, true, "coll"));
        verify(stub).delStateBatch(keysCaptor.capture());
        assertEquals(written, keysCaptor.getValue());
    }

    @Test
    void getWithNothingFoundIsAnError() {
        when(stub.getStateBatch(anyList())).thenReturn(List.of());

        Response response = stress.get(stub, options(3, true, ""));

        assertFalse(response.isSuccess());
        assertTrue(response.message().startsWith("Assets not found"));
    }

    @Test
    void singleGetsSkipMissingKeys() {
        when(stub.getState(anyString())).thenReturn(null, "v".getBytes());

        Response response = stress.get(stub, verboseOptions(2));

        assertTrue(response.isSuccess());
        String tail = InvocationMetrics.verboseTail(response.payloadAsString());
        assertEquals(1, tail.lines().filter(l -> l.endsWith("(collection:``)")).count());
        assertTrue(tail.endsWith("useBatchAPI: false, Seed: 3"));
        assertEquals(2, InvocationMetrics.parseLine(response.payloadAsString()).entries());
    }

    @Test
    void verbosePutListsKeys() {
        Response response = stress.put(stub, new StressOptions(2, 5, true, 3, "", true));

        verify(stub).putStateBatch(entriesCaptor.capture());
        String tail = InvocationMetrics.verboseTail(response.payloadAsString());
        assertTrue(tail.startsWith("useBatchAPI: true, Collection: ``, Seed: 3, KeyLength: 5, Keys: "));
        assertTrue(tail.endsWith(entriesCaptor.getValue().get(0).key() + ", " + entriesCaptor.getValue().get(1).key()));
    }

    private static StressOptions options(int entries, boolean batch, String collection) {
        return new StressOptions(entries, 9, batch, 3, collection, false);
    }

    private static StressOptions verboseOptions(int entries) {
        return new StressOptions(entries, 9, false, 3, "", true);
    }
}
