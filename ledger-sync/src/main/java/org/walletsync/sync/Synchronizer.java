package org.walletsync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutPoint;
import org.bitcoinj.utils.Threading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walletsync.chain.ChainClient;
import org.walletsync.chain.ChainClientException;
import org.walletsync.chain.ChainClientFactory;
import org.walletsync.chain.ChainServerException;
import org.walletsync.chain.DisconnectedException;
import org.walletsync.chain.HeaderInfo;
import org.walletsync.chain.HeaderListener;
import org.walletsync.chain.HistoryItem;
import org.walletsync.chain.ScripthashListener;
import org.walletsync.chain.UnspentOutput;
import org.walletsync.ledger.CoinStatus;
import org.walletsync.ledger.LedgerCoin;
import org.walletsync.ledger.PsbtParser;
import org.walletsync.ledger.TransactionDecoder;
import org.walletsync.ledger.TransactionRecord;
import org.walletsync.ledger.TransactionStatus;
import org.walletsync.store.AddressStatus;
import org.walletsync.store.WalletStore;
import org.walletsync.wallet.AddressDeriver;
import org.walletsync.wallet.Scripthash;
import org.walletsync.wallet.WalletInfo;

import javax.annotation.concurrent.GuardedBy;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Keeps the wallets of a {@link WalletStore} in sync with a chain backend.
 *
 * <p>Connecting, the sync walk, backend notifications and reconnects all run on one worker
 * thread. Public operations may be called from any thread; those that need the backend run on
 * the caller's thread under the state lock and throw {@link DisconnectedException} unless the
 * state is {@link SyncState#SYNCING} or {@link SyncState#READY}.</p>
 */
public class Synchronizer {
    protected static Logger log = LoggerFactory.getLogger(Synchronizer.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final SyncSettings settings;
    private final WalletStore store;
    private final ChainClientFactory factory;
    private final TransactionDecoder decoder;
    private final SyncEventDispatcher dispatcher = new SyncEventDispatcher();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final ChainDataCache cache = new ChainDataCache();
    private final AtomicInteger chainTip = new AtomicInteger(-1);
    private final TransactionReconciler reconciler;
    private final AddressScanner scanner;
    private final ScheduledThreadPoolExecutor worker;

    private final ReentrantLock lock = Threading.lock("synchronizer");
    private final Condition stateChanged = lock.newCondition();
    @GuardedBy("lock")
    private volatile SyncState state = SyncState.UNINITIALIZED;
    @GuardedBy("lock")
    private ChainClient client;

    public Synchronizer(SyncSettings settings, WalletStore store, AddressDeriver deriver) {
        this(settings, store, deriver, settings.newElectrumClientFactory());
    }

    public Synchronizer(SyncSettings settings, WalletStore store, AddressDeriver deriver, ChainClientFactory factory) {
        this.settings = settings;
        this.store = store;
        this.factory = factory;
        this.decoder = new TransactionDecoder(settings.getParams());
        this.reconciler = new TransactionReconciler(store, decoder, cache, dispatcher, new Supplier<Boolean>() {
            @Override
            public Boolean get() {
                return state == SyncState.READY;
            }
        });
        this.scanner = new AddressScanner(store, deriver);
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("sync-worker")
                .setDaemon(true)
                .setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
                    @Override
                    public void uncaughtException(Thread t, Throwable e) {
                        log.error("uncaught exception", e);
                    }
                }).build();
        this.worker = new ScheduledThreadPoolExecutor(1, threadFactory);
        worker.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    public void addListener(SyncEventListener listener) {
        dispatcher.add(listener);
    }

    public boolean removeListener(SyncEventListener listener) {
        return dispatcher.remove(listener);
    }

    public WalletStore getStore() {
        return store;
    }

    public SyncState getState() {
        return state;
    }

    /** Last seen chain tip, or the persisted one before the first header arrives */
    public int getChainTip() {
        int tip = chainTip.get();
        return tip >= 0 ? tip : store.getChainTip();
    }

    /**
     * Connect and sync in the background. Does nothing once stopped or while a connection is up.
     * A failed connection attempt returns the state to {@link SyncState#UNINITIALIZED} and is
     * not retried.
     */
    public void run() {
        lock.lock();
        try {
            if (state == SyncState.STOPPED || state.isConnected())
                return;
            setState(SyncState.CONNECTING);
        } finally {
            lock.unlock();
        }
        post(new Runnable() {
            @Override
            public void run() {
                connectAndSync();
            }
        });
    }

    /** Block until the synchronizer is connected, or stopped */
    public void waitForReady() throws InterruptedException {
        lock.lock();
        try {
            while (!state.isConnected() && state != SyncState.STOPPED)
                stateChanged.await();
        } finally {
            lock.unlock();
        }
    }

    /** @return true if the state reached {@link SyncState#READY} within the timeout */
    public boolean awaitReady(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (state != SyncState.READY && state != SyncState.STOPPED) {
                if (nanos <= 0)
                    return false;
                nanos = stateChanged.awaitNanos(nanos);
            }
            return state == SyncState.READY;
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        ChainClient toClose;
        lock.lock();
        try {
            if (state == SyncState.STOPPED)
                return;
            setState(SyncState.STOPPED);
            toClose = client;
            client = null;
        } finally {
            lock.unlock();
        }
        if (toClose != null)
            toClose.close();
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(settings.getCallTimeoutMillis(), TimeUnit.MILLISECONDS))
                log.warn("sync worker did not terminate");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("closed");
    }

    @GuardedBy("lock")
    private void setState(SyncState newState) {
        if (state != newState)
            log.info("state {} -> {}", state, newState);
        state = newState;
        stateChanged.signalAll();
    }

    private boolean isActive(ChainClient source) {
        lock.lock();
        try {
            return isActiveLocked(source);
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private boolean isActiveLocked(ChainClient source) {
        return state.isConnected() && client == source;
    }

    @GuardedBy("lock")
    private ChainClient connectedClient() throws DisconnectedException {
        if (!state.isConnected() || client == null)
            throw new DisconnectedException();
        return client;
    }

    private void post(final Runnable task) {
        try {
            worker.execute(logging(task));
        } catch (RejectedExecutionException e) {
            log.debug("worker stopped, dropping task");
        }
    }

    private Runnable logging(final Runnable task) {
        return new Runnable() {
            @Override
            public void run() {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("sync task failed", e);
                }
            }
        };
    }

    @VisibleForTesting
    void connectAndSync() {
        lock.lock();
        try {
            // a second queued attempt finds the first one connected
            if (state == SyncState.STOPPED || state.isConnected())
                return;
        } finally {
            lock.unlock();
        }

        final ChainClient newClient;
        try {
            newClient = factory.create();
        } catch (ChainClientException e) {
            connectFailed(e);
            return;
        }
        try {
            newClient.connect(new Runnable() {
                @Override
                public void run() {
                    post(new Runnable() {
                        @Override
                        public void run() {
                            onDisconnect(newClient);
                        }
                    });
                }
            });
        } catch (ChainClientException e) {
            newClient.close();
            connectFailed(e);
            return;
        }

        ChainClient previous;
        lock.lock();
        try {
            if (state != SyncState.CONNECTING) {
                log.info("state changed to {} while connecting", state);
                newClient.close();
                return;
            }
            chainTip.set(-1);
            registry.clear();
            cache.clear();
            previous = client;
            client = newClient;
            setState(SyncState.SYNCING);
        } finally {
            lock.unlock();
        }
        if (previous != null)
            previous.close();

        SyncWalkResult result = blockchainSync(newClient);
        if (result.getOutcome() == SyncWalkResult.Outcome.FAILED)
            log.error("sync walk failed: {}", result);
        else
            log.info("sync walk {}", result);

        lock.lock();
        try {
            if (state == SyncState.SYNCING && client == newClient)
                setState(SyncState.READY);
        } finally {
            lock.unlock();
        }
    }

    private void connectFailed(ChainClientException e) {
        log.error("could not connect: {}", e.getMessage());
        lock.lock();
        try {
            if (state == SyncState.CONNECTING)
                setState(SyncState.UNINITIALIZED);
        } finally {
            lock.unlock();
        }
    }

    private void onDisconnect(ChainClient source) {
        lock.lock();
        try {
            if (source != client || state == SyncState.STOPPED)
                return;
            client = null;
            setState(SyncState.CONNECTING);
        } finally {
            lock.unlock();
        }
        log.warn("disconnected, reconnecting in {} ms", settings.getReconnectDelayMillis());
        dispatcher.onConnection(ConnectionStatus.OFFLINE, 0);
        try {
            worker.schedule(logging(new Runnable() {
                @Override
                public void run() {
                    if (state != SyncState.STOPPED)
                        Synchronizer.this.run();
                }
            }), settings.getReconnectDelayMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("worker stopped, not reconnecting");
        }
    }

    @VisibleForTesting
    SyncWalkResult blockchainSync(final ChainClient source) {
        int synced = 0;
        try {
            dispatcher.onConnection(ConnectionStatus.OFFLINE, 0);
            HeaderInfo tip = source.subscribeHeaders(new HeaderListener() {
                @Override
                public void onHeader(final HeaderInfo header) {
                    post(new Runnable() {
                        @Override
                        public void run() {
                            if (isActive(source))
                                handleHeader(header);
                        }
                    });
                }
            });
            handleHeader(tip);
            dispatcher.onConnection(ConnectionStatus.SYNCING, 0);

            source.addScripthashListener(new ScripthashListener() {
                @Override
                public void onStatusChange(final String scripthash, final String status) {
                    post(new Runnable() {
                        @Override
                        public void run() {
                            updateScripthashStatus(source, scripthash, status);
                        }
                    });
                }
            });

            List<WalletInfo> wallets = store.listRecentlyUsedWallets();
            for (WalletInfo wallet : wallets) {
                if (!isActive(source))
                    return SyncWalkResult.aborted(synced);
                boolean completed = source.supportsBatch()
                        ? syncWalletBatch(source, wallet)
                        : syncWalletSequential(source, wallet);
                if (!completed)
                    return SyncWalkResult.aborted(synced);
                emitBalances(wallet.getId());
                synced++;
                dispatcher.onConnection(ConnectionStatus.SYNCING, synced * 100 / wallets.size());
            }
            dispatcher.onConnection(ConnectionStatus.ONLINE, 100);
            return SyncWalkResult.completed(synced);
        } catch (ChainClientException | RuntimeException e) {
            return SyncWalkResult.failed(e, synced);
        }
    }

    private boolean syncWalletBatch(ChainClient source, WalletInfo wallet) throws ChainClientException {
        String walletId = wallet.getId();
        Map<String, String> addresses = subscribe(walletId, store.getAllAddresses(walletId));
        if (!isActive(source))
            return false;
        Map<String, String> statuses = source.subscribeScripthashes(addresses.keySet());
        log.info("subscribed {} addresses of {}", statuses.size(), walletId);

        Map<String, String> changed = Maps.newLinkedHashMap();
        for (Map.Entry<String, String> entry : statuses.entrySet()) {
            String address = addresses.get(entry.getKey());
            String remote = entry.getValue();
            if (address == null || remote.isEmpty())
                continue;
            if (!remote.equals(store.getAddressStatus(walletId, address)))
                changed.put(entry.getKey(), remote);
        }
        if (changed.isEmpty())
            return true;
        if (!isActive(source))
            return false;
        reconcileChanged(source, walletId, addresses, changed);
        return true;
    }

    private boolean syncWalletSequential(ChainClient source, WalletInfo wallet) throws ChainClientException {
        String walletId = wallet.getId();
        for (String address : Lists.reverse(store.getAllAddresses(walletId))) {
            lock.lock();
            try {
                if (!isActiveLocked(source))
                    return false;
                String scripthash = Scripthash.of(settings.getParams(), address);
                registry.put(scripthash, walletId, address);
                String remote = source.subscribeScripthash(scripthash);
                if (!remote.isEmpty() && !remote.equals(store.getAddressStatus(walletId, address)))
                    reconcileAddress(source, walletId, address, scripthash, remote);
            } finally {
                lock.unlock();
            }
            pace();
        }
        return true;
    }

    private void pace() {
        try {
            Thread.sleep(settings.getRequestPacingMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Register addresses and return them by scripthash */
    private Map<String, String> subscribe(String walletId, List<String> addresses) {
        Map<String, String> byScripthash = Maps.newLinkedHashMap();
        for (String address : addresses) {
            String scripthash = Scripthash.of(settings.getParams(), address);
            registry.put(scripthash, walletId, address);
            byScripthash.put(scripthash, address);
        }
        return byScripthash;
    }

    /** Fetch and reconcile the history of one address, persisting its status if nothing was missed */
    private boolean reconcileAddress(ChainClient source, String walletId, String address, String scripthash,
                                     String status) throws ChainClientException {
        List<HistoryItem> history = source.getHistory(scripthash);
        log.info("{} history of {}: {} entries", walletId, address, history.size());
        boolean fullySynced = reconciler.reconcile(source, walletId, ImmutableMap.of(address, history));
        if (fullySynced)
            store.setUtxoStatus(walletId, address, AddressStatus.encode(utxoJson(walletId, address), status));
        return fullySynced;
    }

    /**
     * @param addresses all subscribed addresses by scripthash
     * @param changed new statuses by scripthash
     */
    private boolean reconcileChanged(ChainClient source, String walletId, Map<String, String> addresses,
                                     Map<String, String> changed) throws ChainClientException {
        Map<String, List<HistoryItem>> histories = source.getHistories(changed.keySet());
        Map<String, List<HistoryItem>> byAddress = Maps.newLinkedHashMap();
        for (Map.Entry<String, List<HistoryItem>> entry : histories.entrySet()) {
            byAddress.put(addresses.get(entry.getKey()), entry.getValue());
        }
        boolean fullySynced = reconciler.reconcile(source, walletId, byAddress) && histories.size() == changed.size();
        for (Map.Entry<String, String> entry : changed.entrySet()) {
            if (!histories.containsKey(entry.getKey()))
                continue;
            String address = addresses.get(entry.getKey());
            if (fullySynced)
                store.setUtxoStatus(walletId, address, AddressStatus.encode(utxoJson(walletId, address), entry.getValue()));
        }
        return fullySynced;
    }

    /** Unspent coins at an address, stored next to its status */
    private String utxoJson(String walletId, String address) {
        List<UnspentOutput> unspent = Lists.newArrayList();
        for (LedgerCoin coin : store.getCoins(walletId)) {
            if (address.equals(coin.getAddress()) && coin.getStatus() != CoinStatus.SPENT)
                unspent.add(new UnspentOutput(coin.getTxId(), coin.getVout(), coin.getHeight(), coin.getAmount().getValue()));
        }
        try {
            return mapper.writeValueAsString(unspent);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @VisibleForTesting
    void updateScripthashStatus(ChainClient source, String scripthash, String status) {
        if (status == null || status.isEmpty())
            return;
        Optional<WalletAddress> subscribed = registry.lookup(scripthash);
        if (!subscribed.isPresent()) {
            log.debug("status change for unknown scripthash {}", scripthash);
            return;
        }
        if (!isActive(source))
            return;
        WalletAddress target = subscribed.get();
        try {
            reconcileAddress(source, target.getWalletId(), target.getAddress(), scripthash, status);
            emitBalances(target.getWalletId());
        } catch (ChainClientException e) {
            log.warn("could not sync {} after status change: {}", target, e.getMessage());
        }
    }

    private void handleHeader(HeaderInfo header) {
        log.info("block {}", header.height);
        chainTip.set(header.height);
        store.setChainTip(header.height);
        cache.invalidateHeadersFrom(header.height);
        dispatcher.onBlock(header.height, header.hex);
    }

    private void emitBalances(String walletId) {
        Coin balance = store.getBalance(walletId);
        Coin unconfirmed = store.getUnconfirmedBalance(walletId);
        dispatcher.onBalance(walletId, balance);
        dispatcher.onBalances(walletId, balance, unconfirmed);
    }

    /** @return the transaction id reported by the backend */
    public String broadcast(String rawHex) throws ChainClientException {
        lock.lock();
        try {
            return connectedClient().broadcast(rawHex);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Broadcast a stored transaction that is ready. A PSBT must have been finalized and stored
     * as a raw transaction with {@link WalletStore#updatePsbt} first.
     *
     * @throws ChainServerException if the network rejected it, after marking it rejected
     */
    public TransactionRecord broadcastTransaction(String walletId, String txId) throws ChainClientException {
        lock.lock();
        try {
            ChainClient source = connectedClient();
            Optional<TransactionRecord> stored = store.getTransaction(walletId, txId);
            checkArgument(stored.isPresent(), "unknown transaction %s", txId);
            TransactionRecord record = stored.get();
            checkState(record.getStatus() == TransactionStatus.READY_TO_BROADCAST,
                    "%s is %s", txId, record.getStatus());
            String raw = record.getSerialized();
            checkState(!PsbtParser.isPsbt(raw), "%s must be finalized before broadcast", txId);

            try {
                source.broadcast(raw);
            } catch (ChainServerException e) {
                log.warn("{} rejected: {}", txId, e.getMessage());
                TransactionRecord rejected = store.updateTransaction(walletId, raw,
                        TransactionRecord.HEIGHT_REJECTED, 0, e.getMessage());
                dispatcher.onTransaction(txId, rejected.getStatus(), walletId);
                throw e;
            }
            TransactionRecord sent = store.updateTransaction(walletId, raw, TransactionRecord.HEIGHT_PENDING, 0, null);
            log.info("broadcast {}", txId);
            dispatcher.onTransaction(txId, sent.getStatus(), walletId);
            String replaced = sent.getExtra().getReplaceTxId();
            if (replaced != null)
                dispatcher.onTransaction(replaced, TransactionStatus.REPLACED, walletId);
            emitBalances(walletId);
            return sent;
        } finally {
            lock.unlock();
        }
    }

    /** @return fee rate per kvB, the relay fee if the backend has no estimate */
    public Coin estimateFee(int targetBlocks) throws ChainClientException {
        lock.lock();
        try {
            Coin fee = connectedClient().estimateFee(targetBlocks);
            if (fee.isNegative()) {
                log.warn("no fee estimate for {} blocks, using relay fee", targetBlocks);
                return relayFee();
            }
            return fee;
        } finally {
            lock.unlock();
        }
    }

    /** @return relay fee rate per kvB, the configured fallback while disconnected */
    public Coin relayFee() {
        lock.lock();
        try {
            if (!state.isConnected() || client == null)
                return settings.getFallbackRelayFee();
            return client.relayFee();
        } catch (ChainClientException e) {
            log.warn("relay fee unavailable: {}", e.getMessage());
            return settings.getFallbackRelayFee();
        } finally {
            lock.unlock();
        }
    }

    public List<UnspentOutput> listUnspent(String address) throws ChainClientException {
        lock.lock();
        try {
            return connectedClient().listUnspent(Scripthash.of(settings.getParams(), address));
        } finally {
            lock.unlock();
        }
    }

    public String getRawTransaction(String txId) throws ChainClientException {
        lock.lock();
        try {
            return rawTransaction(connectedClient(), txId);
        } finally {
            lock.unlock();
        }
    }

    private String rawTransaction(ChainClient source, String txId) throws ChainClientException {
        Optional<String> cached = cache.getRawTransaction(txId);
        if (cached.isPresent())
            return cached.get();
        String raw = source.getRawTransaction(txId);
        cache.putRawTransaction(txId, raw);
        return raw;
    }

    /**
     * Look up any transaction on chain. Its height comes from the history of its first output,
     * and its fee from the transactions it spends.
     */
    public TransactionRecord getTransaction(String txId) throws ChainClientException {
        lock.lock();
        try {
            ChainClient source = connectedClient();
            String raw = rawTransaction(source, txId);
            Transaction tx = decoder.decode(raw);

            int height = TransactionRecord.HEIGHT_PENDING;
            if (!tx.getOutputs().isEmpty()) {
                String scripthash = Scripthash.of(tx.getOutput(0).getScriptPubKey());
                for (HistoryItem item : source.getHistory(scripthash)) {
                    if (item.txHash.equals(txId)) {
                        height = Math.max(item.height, TransactionRecord.HEIGHT_PENDING);
                        break;
                    }
                }
            }
            TransactionRecord record = new TransactionRecord(txId, raw, height);
            if (height > 0) {
                Optional<String> header = cache.getHeader(height);
                String headerHex = header.isPresent() ? header.get() : source.getBlockHeader(height);
                cache.putHeader(height, headerHex);
                record.setBlockTime(HeaderInfo.timestampOf(headerHex));
            }
            record.setFee(feeOf(source, tx));
            record.setStatus(height > 0 ? TransactionStatus.CONFIRMED : TransactionStatus.PENDING_CONFIRMATION);
            return record;
        } finally {
            lock.unlock();
        }
    }

    private Coin feeOf(ChainClient source, Transaction tx) throws ChainClientException {
        if (tx.isCoinBase())
            return Coin.ZERO;
        Coin in = Coin.ZERO;
        for (TransactionInput input : tx.getInputs()) {
            TransactionOutPoint outpoint = input.getOutpoint();
            Transaction prev = decoder.decode(rawTransaction(source, outpoint.getHash().toString()));
            in = in.add(prev.getOutput(outpoint.getIndex()).getValue());
        }
        return in.subtract(tx.getOutputSum());
    }

    /** Issue the next unused receive or change address, scanning the backend when connected */
    public String newAddress(String walletId, boolean internal) {
        Optional<WalletInfo> wallet = store.getWallet(walletId);
        checkArgument(wallet.isPresent(), "unknown wallet %s", walletId);
        return scanner.newAddress(wallet.get(), internal, new ChainProbe());
    }

    private class ChainProbe implements AddressScanner.AddressProbe {
        @Override
        public boolean supportsBatch() {
            lock.lock();
            try {
                return state.isConnected() && client != null && client.supportsBatch();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean isUsed(WalletInfo wallet, boolean internal, int index, String address) {
            String walletId = wallet.getId();
            lock.lock();
            try {
                if (!state.isConnected() || client == null)
                    return false;
                String stored = store.getAddressStatus(walletId, address);
                String scripthash = Scripthash.of(settings.getParams(), address);
                registry.put(scripthash, walletId, address);
                String remote = client.subscribeScripthash(scripthash);
                if (!remote.equals(stored)) {
                    store.addAddress(walletId, address, index, internal);
                    if (!remote.isEmpty()) {
                        reconcileAddress(client, walletId, address, scripthash, remote);
                        emitBalances(walletId);
                    }
                }
                return !remote.isEmpty() || !stored.isEmpty();
            } catch (ChainClientException e) {
                log.warn("could not probe {}: {}", address, e.getMessage());
                return false;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public int lastUsedOffset(WalletInfo wallet, boolean internal, int startIndex, List<String> window) {
            String walletId = wallet.getId();
            lock.lock();
            try {
                if (!state.isConnected() || client == null)
                    return -1;
                Map<String, String> addresses = subscribe(walletId, window);
                Map<String, String> statuses = client.subscribeScripthashes(addresses.keySet());
                Map<String, String> changed = Maps.newLinkedHashMap();
                int lastUsed = -1;
                for (int i = 0; i < window.size(); i++) {
                    String address = window.get(i);
                    String scripthash = Scripthash.of(settings.getParams(), address);
                    String remote = statuses.get(scripthash);
                    if (remote == null || remote.isEmpty())
                        continue;
                    lastUsed = i;
                    if (!remote.equals(store.getAddressStatus(walletId, address))) {
                        store.addAddress(walletId, address, startIndex + i, internal);
                        changed.put(scripthash, remote);
                    }
                }
                if (!changed.isEmpty()) {
                    reconcileChanged(client, walletId, addresses, changed);
                    emitBalances(walletId);
                }
                return lastUsed;
            } catch (ChainClientException e) {
                log.warn("could not probe addresses of {}: {}", walletId, e.getMessage());
                return -1;
            } finally {
                lock.unlock();
            }
        }
    }
}
