package org.walletsync.sync;

import com.google.common.base.Optional;
import com.google.common.base.Supplier;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walletsync.chain.ChainClient;
import org.walletsync.chain.ChainClientException;
import org.walletsync.chain.HeaderInfo;
import org.walletsync.chain.HistoryItem;
import org.walletsync.ledger.TransactionDecoder;
import org.walletsync.ledger.TransactionRecord;
import org.walletsync.ledger.TransactionStatus;
import org.walletsync.store.WalletStore;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings the stored transactions of a wallet in line with the histories of some of its addresses.
 *
 * <p>Confirmed records are never rewritten. A pending receive paying one of the reconciled
 * addresses that no longer appears in their histories was replaced, and is deleted.</p>
 */
public class TransactionReconciler {
    private static final Logger log = LoggerFactory.getLogger(TransactionReconciler.class);

    private final WalletStore store;
    private final TransactionDecoder decoder;
    private final ChainDataCache cache;
    private final SyncEventListener listener;
    private final Supplier<Boolean> ready;

    /**
     * @param ready whether per-transaction events should be emitted, true once the initial walk is done
     */
    public TransactionReconciler(WalletStore store, TransactionDecoder decoder, ChainDataCache cache,
                                 SyncEventListener listener, Supplier<Boolean> ready) {
        this.store = store;
        this.decoder = decoder;
        this.cache = cache;
        this.listener = listener;
        this.ready = ready;
    }

    /**
     * @param histories complete history of each reconciled address
     * @return true if every entry was reconciled, false if some fetch failed
     */
    public boolean reconcile(ChainClient client, String walletId, Map<String, List<HistoryItem>> histories) {
        Map<String, HistoryItem> entries = Maps.newLinkedHashMap();
        for (List<HistoryItem> history : histories.values()) {
            for (HistoryItem item : history) {
                if (!entries.containsKey(item.txHash))
                    entries.put(item.txHash, item);
            }
        }

        List<HistoryItem> pending = Lists.newArrayList();
        for (HistoryItem item : entries.values()) {
            Optional<TransactionRecord> known = store.getTransaction(walletId, item.txHash);
            if (known.isPresent() && known.get().getStatus() == TransactionStatus.CONFIRMED)
                continue;
            pending.add(item);
        }

        boolean fullySynced = true;
        if (!pending.isEmpty()) {
            List<String> txIds = Lists.newArrayList();
            Set<Integer> heights = Sets.newLinkedHashSet();
            for (HistoryItem item : pending) {
                txIds.add(item.txHash);
                if (item.height > 0)
                    heights.add(item.height);
            }
            Map<String, String> raws = fetchRawTransactions(client, txIds);
            Map<Integer, String> headers = fetchHeaders(client, heights);

            for (HistoryItem item : pending) {
                if (!apply(walletId, item, raws, headers))
                    fullySynced = false;
            }
        }

        detectReplaced(walletId, histories.keySet(), entries.keySet());
        log.info("reconciled {} entries for {} addresses of {}, fully synced: {}",
                entries.size(), histories.size(), walletId, fullySynced);
        return fullySynced;
    }

    private boolean apply(String walletId, HistoryItem item, Map<String, String> raws, Map<Integer, String> headers) {
        String raw = raws.get(item.txHash);
        if (raw == null) {
            log.warn("could not fetch transaction {}", item.txHash);
            return false;
        }
        int height = Math.max(item.height, 0);
        long blockTime = 0;
        if (height > 0) {
            String header = headers.get(height);
            if (header == null) {
                log.warn("could not fetch header at {} for {}", height, item.txHash);
                return false;
            }
            blockTime = HeaderInfo.timestampOf(header);
        }

        TransactionRecord record;
        try {
            if (!decoder.txIdOf(raw).equals(item.txHash)) {
                log.warn("server sent a different transaction for {}", item.txHash);
                return false;
            }
            Optional<TransactionRecord> known = store.getTransaction(walletId, item.txHash);
            if (!known.isPresent()) {
                record = store.insertTransaction(walletId, raw, height, blockTime, Coin.valueOf(item.getFeeOrZero()));
            } else {
                TransactionRecord stored = known.get();
                if (stored.getSerialized().equals(raw) && stored.getHeight() == height && stored.getBlockTime() == blockTime)
                    return true;
                record = store.updateTransaction(walletId, raw, height, blockTime, null);
            }
        } catch (ProtocolException | IllegalArgumentException e) {
            log.warn("bad transaction {} from server: {}", item.txHash, e.getMessage());
            return false;
        }
        if (ready.get())
            listener.onTransaction(record.getTxId(), record.getStatus(), walletId);
        return true;
    }

    private void detectReplaced(String walletId, Set<String> addresses, Set<String> historyTxIds) {
        for (TransactionRecord record : store.getTransactions(walletId, TransactionStatus.PENDING_CONFIRMATION, true)) {
            if (historyTxIds.contains(record.getTxId()))
                continue;
            List<String> paid;
            try {
                paid = decoder.outputAddresses(decoder.decode(record));
            } catch (ProtocolException | IllegalArgumentException e) {
                continue;
            }
            if (Sets.intersection(Sets.newHashSet(paid), addresses).isEmpty())
                continue;
            log.info("{} no longer in history, replaced", record.getTxId());
            store.deleteTransaction(walletId, record.getTxId());
            listener.onTransaction(record.getTxId(), TransactionStatus.REPLACED, walletId);
        }
    }

    /** Cached, then batched, then one by one. Missing entries could not be fetched. */
    Map<String, String> fetchRawTransactions(ChainClient client, Collection<String> txIds) {
        Map<String, String> result = Maps.newHashMap();
        List<String> missing = Lists.newArrayList();
        for (String txId : txIds) {
            Optional<String> cached = cache.getRawTransaction(txId);
            if (cached.isPresent())
                result.put(txId, cached.get());
            else
                missing.add(txId);
        }
        if (missing.isEmpty())
            return result;
        if (client.supportsBatch()) {
            try {
                result.putAll(client.getRawTransactions(missing));
            } catch (ChainClientException e) {
                log.warn("batched transaction fetch failed: {}", e.getMessage());
            }
        }
        for (String txId : missing) {
            if (result.containsKey(txId))
                continue;
            try {
                result.put(txId, client.getRawTransaction(txId));
            } catch (ChainClientException e) {
                log.warn("transaction fetch {} failed: {}", txId, e.getMessage());
            }
        }
        for (String txId : missing) {
            if (result.containsKey(txId))
                cache.putRawTransaction(txId, result.get(txId));
        }
        return result;
    }

    Map<Integer, String> fetchHeaders(ChainClient client, Collection<Integer> heights) {
        Map<Integer, String> result = Maps.newHashMap();
        List<Integer> missing = Lists.newArrayList();
        for (Integer height : heights) {
            Optional<String> cached = cache.getHeader(height);
            if (cached.isPresent())
                result.put(height, cached.get());
            else
                missing.add(height);
        }
        if (missing.isEmpty())
            return result;
        if (client.supportsBatch()) {
            try {
                result.putAll(client.getBlockHeaders(missing));
            } catch (ChainClientException e) {
                log.warn("batched header fetch failed: {}", e.getMessage());
            }
        }
        for (Integer height : missing) {
            if (result.containsKey(height))
                continue;
            try {
                result.put(height, client.getBlockHeader(height));
            } catch (ChainClientException e) {
                log.warn("header fetch at {} failed: {}", height, e.getMessage());
            }
        }
        for (Integer height : missing) {
            if (result.containsKey(height))
                cache.putHeader(height, result.get(height));
        }
        return result;
    }
}
