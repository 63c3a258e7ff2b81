// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import java.util.List;
import java.util.NoSuchElementException;

import sh.batchapi.core.error.StateAccessException;
import sh.batchapi.core.types.StateKV;
import sh.batchapi.shim.StateIterator;

/**
 * Iterator over a materialized result set that charges one simulated round trip
 * per page, the way the peer streams query results to the chaincode.
 */
final class PagedStateIterator implements StateIterator {

    private final List<StateKV> results;
    private final int pageSize;
    private final Runnable fetchPage;
    private int position;
    private boolean closed;

    PagedStateIterator(final List<StateKV> results, final int pageSize, final Runnable fetchPage) {
        this.results = results;
        this.pageSize = pageSize;
        this.fetchPage = fetchPage;
    }

    @Override
    public boolean hasNext() {
        ensureOpen();
        return position < results.size();
    }

    @Override
    public StateKV next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        // the first page arrives with the query response
        if (position > 0 && position % pageSize == 0) {
            fetchPage.run();
        }
        return results.get(position++);
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StateAccessException("iterator is closed");
        }
    }
}
