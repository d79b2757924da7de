package org.walletsync.chain;

import org.bitcoinj.core.Coin;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Uniform view of a chain indexing backend.
 *
 * <p>Calls are synchronous and may be issued from any thread. Notifications are delivered on
 * a thread owned by the implementation; listeners should hand them off rather than block.</p>
 *
 * <p>Scripthash statuses are reported as the empty string when the scripthash has no history.</p>
 *
 * <p>The batched variants return one entry per key that could be served. A key whose lookup
 * failed is left out of the map instead of failing the whole batch. Implementations without
 * batch support serve them with sequential calls.</p>
 */
public interface ChainClient {
    /**
     * Open the connection.
     *
     * @param onDisconnect run once if the backend drops the connection. Not run for {@link #close()}.
     */
    void connect(Runnable onDisconnect) throws ChainClientException;

    void close();

    boolean supportsBatch();

    HeaderInfo subscribeHeaders(HeaderListener listener) throws ChainClientException;

    void addScripthashListener(ScripthashListener listener);

    String subscribeScripthash(String scripthash) throws ChainClientException;

    Map<String, String> subscribeScripthashes(Collection<String> scripthashes) throws ChainClientException;

    List<HistoryItem> getHistory(String scripthash) throws ChainClientException;

    Map<String, List<HistoryItem>> getHistories(Collection<String> scripthashes) throws ChainClientException;

    String getRawTransaction(String txId) throws ChainClientException;

    Map<String, String> getRawTransactions(Collection<String> txIds) throws ChainClientException;

    String getBlockHeader(int height) throws ChainClientException;

    Map<Integer, String> getBlockHeaders(Collection<Integer> heights) throws ChainClientException;

    /** @return the transaction id reported by the backend */
    String broadcast(String rawHex) throws ChainClientException;

    /** @return fee rate per kvB, negative if the backend has no estimate */
    Coin estimateFee(int targetBlocks) throws ChainClientException;

    /** @return minimum relay fee rate per kvB */
    Coin relayFee() throws ChainClientException;

    List<UnspentOutput> listUnspent(String scripthash) throws ChainClientException;
}
