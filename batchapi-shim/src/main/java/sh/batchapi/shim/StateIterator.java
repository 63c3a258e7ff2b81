// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim;

import java.util.Iterator;

import sh.batchapi.core.types.StateKV;

/**
 * Key-ordered results of a range or rich query. Must be closed when done.
 */
public interface StateIterator extends Iterator<StateKV>, AutoCloseable {

    @Override
    void close();
}
