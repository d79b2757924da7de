package org.walletsync.sync;

import com.google.common.base.Optional;
import com.google.common.collect.Maps;

import java.util.Iterator;
import java.util.concurrent.ConcurrentMap;

/**
 * Raw transactions and block headers fetched during one connection.
 */
public class ChainDataCache {
    private final ConcurrentMap<String, String> rawTransactions = Maps.newConcurrentMap();
    private final ConcurrentMap<Integer, String> headers = Maps.newConcurrentMap();

    public Optional<String> getRawTransaction(String txId) {
        return Optional.fromNullable(rawTransactions.get(txId));
    }

    public void putRawTransaction(String txId, String rawHex) {
        rawTransactions.put(txId, rawHex);
    }

    public Optional<String> getHeader(int height) {
        return Optional.fromNullable(headers.get(height));
    }

    public void putHeader(int height, String headerHex) {
        headers.put(height, headerHex);
    }

    /** Drop headers at or above a height, after a new tip that may be a reorg */
    public void invalidateHeadersFrom(int height) {
        for (Iterator<Integer> it = headers.keySet().iterator(); it.hasNext(); ) {
            if (it.next() >= height)
                it.remove();
        }
    }

    public int size() {
        return rawTransactions.size() + headers.size();
    }

    public void clear() {
        rawTransactions.clear();
        headers.clear();
    }
}
