package org.walletsync.electrum;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import org.bitcoinj.core.Coin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walletsync.chain.ChainClient;
import org.walletsync.chain.ChainClientException;
import org.walletsync.chain.ChainServerException;
import org.walletsync.chain.HeaderInfo;
import org.walletsync.chain.HeaderListener;
import org.walletsync.chain.HistoryItem;
import org.walletsync.chain.ScripthashListener;
import org.walletsync.chain.UnspentOutput;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ChainClient} over an {@link ElectrumClient} connection.
 */
public class ElectrumChainClient implements ChainClient {
    public static final String SERVER_VERSION = "server.version";
    public static final String BLOCKCHAIN_HEADERS_SUBSCRIBE = "blockchain.headers.subscribe";
    public static final String BLOCKCHAIN_BLOCK_HEADER = "blockchain.block.header";
    public static final String BLOCKCHAIN_SCRIPTHASH_SUBSCRIBE = "blockchain.scripthash.subscribe";
    public static final String BLOCKCHAIN_SCRIPTHASH_GET_HISTORY = "blockchain.scripthash.get_history";
    public static final String BLOCKCHAIN_SCRIPTHASH_LISTUNSPENT = "blockchain.scripthash.listunspent";
    public static final String BLOCKCHAIN_TRANSACTION_GET = "blockchain.transaction.get";
    public static final String BLOCKCHAIN_TRANSACTION_BROADCAST = "blockchain.transaction.broadcast";
    public static final String BLOCKCHAIN_ESTIMATEFEE = "blockchain.estimatefee";
    public static final String BLOCKCHAIN_RELAYFEE = "blockchain.relayfee";
    public static final String PROTOCOL_VERSION = "1.4";

    private static final TypeReference<List<HistoryItem>> HISTORY_TYPE = new TypeReference<List<HistoryItem>>() {};
    private static final TypeReference<List<UnspentOutput>> UNSPENT_TYPE = new TypeReference<List<UnspentOutput>>() {};

    protected static final Logger log = LoggerFactory.getLogger(ElectrumChainClient.class);

    private final ElectrumClient client;
    private final ObjectMapper mapper;
    private final String clientName;
    private final long callTimeoutMillis;
    private final boolean batch;
    private final CopyOnWriteArrayList<ScripthashListener> scripthashListeners;
    private final AtomicBoolean closing;
    private final AtomicBoolean disconnectReported;
    private volatile HeaderListener headerListener;

    public ElectrumChainClient(ElectrumClient client, String clientName, long callTimeoutMillis, boolean batch) {
        this.client = client;
        this.clientName = clientName;
        this.callTimeoutMillis = callTimeoutMillis;
        this.batch = batch;
        mapper = new ObjectMapper();
        scripthashListeners = new CopyOnWriteArrayList<>();
        closing = new AtomicBoolean();
        disconnectReported = new AtomicBoolean();
        client.addNotificationListener(new ElectrumClient.NotificationListener() {
            @Override
            public void onNotification(ElectrumMessage message) {
                handleNotification(message);
            }
        });
    }

    @Override
    public void connect(final Runnable onDisconnect) throws ChainClientException {
        client.addListener(new Service.Listener() {
            @Override
            public void terminated(Service.State from) {
                reportDisconnect(onDisconnect);
            }

            @Override
            public void failed(Service.State from, Throwable failure) {
                // A failure while starting is reported by connect itself
                if (from != Service.State.STARTING)
                    reportDisconnect(onDisconnect);
            }
        }, MoreExecutors.directExecutor());
        try {
            client.startAsync().awaitRunning(callTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (IllegalStateException e) {
            closing.set(true);
            Throwable cause = client.state() == Service.State.FAILED ? client.failureCause() : e;
            throw new ChainClientException("could not connect: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            close();
            throw new ChainClientException("connection timed out", e);
        }
        try {
            JsonNode version = call(SERVER_VERSION, clientName, PROTOCOL_VERSION);
            log.info("connected to {}, server version {}", client.getConnectedAddress(), version);
        } catch (ChainClientException e) {
            close();
            throw e;
        }
    }

    private void reportDisconnect(Runnable onDisconnect) {
        if (closing.get() || !disconnectReported.compareAndSet(false, true))
            return;
        log.info("disconnected from {}", client.getConnectedAddress());
        onDisconnect.run();
    }

    @Override
    public void close() {
        closing.set(true);
        client.stopAsync();
    }

    @Override
    public boolean supportsBatch() {
        return batch;
    }

    @Override
    public HeaderInfo subscribeHeaders(HeaderListener listener) throws ChainClientException {
        headerListener = listener;
        return convert(call(BLOCKCHAIN_HEADERS_SUBSCRIBE), HeaderInfo.class);
    }

    @Override
    public void addScripthashListener(ScripthashListener listener) {
        scripthashListeners.add(listener);
    }

    @Override
    public String subscribeScripthash(String scripthash) throws ChainClientException {
        return statusOf(call(BLOCKCHAIN_SCRIPTHASH_SUBSCRIBE, scripthash));
    }

    @Override
    public Map<String, String> subscribeScripthashes(Collection<String> scripthashes) throws ChainClientException {
        Map<String, String> statuses = Maps.newLinkedHashMap();
        for (Map.Entry<String, JsonNode> entry : callEach(BLOCKCHAIN_SCRIPTHASH_SUBSCRIBE, scripthashes).entrySet()) {
            statuses.put(entry.getKey(), statusOf(entry.getValue()));
        }
        return statuses;
    }

    @Override
    public List<HistoryItem> getHistory(String scripthash) throws ChainClientException {
        return convert(call(BLOCKCHAIN_SCRIPTHASH_GET_HISTORY, scripthash), HISTORY_TYPE);
    }

    @Override
    public Map<String, List<HistoryItem>> getHistories(Collection<String> scripthashes) throws ChainClientException {
        Map<String, List<HistoryItem>> histories = Maps.newLinkedHashMap();
        for (Map.Entry<String, JsonNode> entry : callEach(BLOCKCHAIN_SCRIPTHASH_GET_HISTORY, scripthashes).entrySet()) {
            histories.put(entry.getKey(), convert(entry.getValue(), HISTORY_TYPE));
        }
        return histories;
    }

    @Override
    public String getRawTransaction(String txId) throws ChainClientException {
        return call(BLOCKCHAIN_TRANSACTION_GET, txId).asText();
    }

    @Override
    public Map<String, String> getRawTransactions(Collection<String> txIds) throws ChainClientException {
        Map<String, String> raws = Maps.newLinkedHashMap();
        for (Map.Entry<String, JsonNode> entry : callEach(BLOCKCHAIN_TRANSACTION_GET, txIds).entrySet()) {
            raws.put(entry.getKey(), entry.getValue().asText());
        }
        return raws;
    }

    @Override
    public String getBlockHeader(int height) throws ChainClientException {
        return call(BLOCKCHAIN_BLOCK_HEADER, height).asText();
    }

    @Override
    public Map<Integer, String> getBlockHeaders(Collection<Integer> heights) throws ChainClientException {
        Map<Integer, String> headers = Maps.newLinkedHashMap();
        for (Map.Entry<Integer, JsonNode> entry : callEach(BLOCKCHAIN_BLOCK_HEADER, heights).entrySet()) {
            headers.put(entry.getKey(), entry.getValue().asText());
        }
        return headers;
    }

    @Override
    public String broadcast(String rawHex) throws ChainClientException {
        return call(BLOCKCHAIN_TRANSACTION_BROADCAST, rawHex).asText();
    }

    @Override
    public Coin estimateFee(int targetBlocks) throws ChainClientException {
        return toFeeRate(call(BLOCKCHAIN_ESTIMATEFEE, targetBlocks));
    }

    @Override
    public Coin relayFee() throws ChainClientException {
        return toFeeRate(call(BLOCKCHAIN_RELAYFEE));
    }

    @Override
    public List<UnspentOutput> listUnspent(String scripthash) throws ChainClientException {
        return convert(call(BLOCKCHAIN_SCRIPTHASH_LISTUNSPENT, scripthash), UNSPENT_TYPE);
    }

    @VisibleForTesting
    void handleNotification(ElectrumMessage message) {
        try {
            if (BLOCKCHAIN_HEADERS_SUBSCRIBE.equals(message.method)) {
                HeaderListener listener = headerListener;
                if (listener != null && !message.params.isEmpty())
                    listener.onHeader(convert(message.params.get(0), HeaderInfo.class));
            } else if (BLOCKCHAIN_SCRIPTHASH_SUBSCRIBE.equals(message.method)) {
                if (message.params.size() < 2) {
                    log.warn("short scripthash notification {}", message.params);
                    return;
                }
                String scripthash = message.params.get(0).asText();
                String status = statusOf(message.params.get(1));
                for (ScripthashListener listener : scripthashListeners) {
                    listener.onStatusChange(scripthash, status);
                }
            } else {
                log.warn("notification for unknown method {}", message.method);
            }
        } catch (ChainClientException e) {
            log.warn("bad notification {}: {}", message.method, e.getMessage());
        }
    }

    private JsonNode call(String method, Object... params) throws ChainClientException {
        return await(method, client.call(method, Lists.newArrayList(params)));
    }

    /**
     * Issue {@code method} once per key, as one batch when enabled. Keys whose call got an
     * error reply are left out. A transport failure fails the whole call.
     */
    private <K> Map<K, JsonNode> callEach(String method, Collection<K> keys) throws ChainClientException {
        List<K> keyList = Lists.newArrayList(Sets.newLinkedHashSet(keys));
        Map<K, JsonNode> results = Maps.newLinkedHashMap();
        if (keyList.isEmpty())
            return results;
        List<ListenableFuture<ElectrumMessage>> futures;
        if (batch) {
            List<List<Object>> paramsList = Lists.newArrayList();
            for (K key : keyList) {
                paramsList.add(Collections.<Object>singletonList(key));
            }
            futures = client.callBatch(method, paramsList);
        } else {
            futures = null;
        }
        for (int i = 0; i < keyList.size(); i++) {
            K key = keyList.get(i);
            ListenableFuture<ElectrumMessage> future = batch ? futures.get(i) : client.call(method, key);
            try {
                results.put(key, await(method, future));
            } catch (ChainServerException e) {
                log.warn("{} {} failed: {}", method, key, e.getMessage());
            }
        }
        return results;
    }

    private JsonNode await(String method, ListenableFuture<ElectrumMessage> future) throws ChainClientException {
        try {
            return future.get(callTimeoutMillis, TimeUnit.MILLISECONDS).result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainClientException("interrupted during " + method, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ElectrumException)
                throw new ChainServerException(method + " rejected: " + cause.getMessage(), cause);
            throw new ChainClientException(method + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ChainClientException(method + " timed out", e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) throws ChainClientException {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ChainClientException("unexpected " + type.getSimpleName() + ": " + node, e);
        }
    }

    private <T> List<T> convert(JsonNode node, TypeReference<List<T>> type) throws ChainClientException {
        if (node == null || node.isNull())
            return Lists.newArrayList();
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new ChainClientException("unexpected reply: " + node, e);
        }
    }

    static String statusOf(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText();
    }

    /** Electrum reports BTC per kvB, negative when unknown */
    static Coin toFeeRate(JsonNode node) {
        double btcPerKb = node.asDouble(-1);
        if (btcPerKb < 0)
            return Coin.NEGATIVE_SATOSHI;
        return Coin.valueOf(Math.round(btcPerKb * Coin.COIN.getValue()));
    }
}
