package org.walletsync.sync;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.Transaction;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.Fixtures;
import org.walletsync.chain.ChainClient;
import org.walletsync.chain.ChainClientFactory;
import org.walletsync.chain.ChainServerException;
import org.walletsync.chain.DisconnectedException;
import org.walletsync.ledger.TransactionDecoder;
import org.walletsync.ledger.TransactionRecord;
import org.walletsync.ledger.TransactionStatus;
import org.walletsync.store.InMemoryWalletStore;
import org.walletsync.wallet.WalletInfo;
import org.walletsync.wallet.XpubAddressDeriver;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;
import static org.walletsync.Fixtures.PARAMS;

public class SynchronizerTest {
    private static final ImmutableList<String> WALK = ImmutableList.of("OFFLINE 0", "SYNCING 0", "SYNCING 100", "ONLINE 100");

    private XpubAddressDeriver deriver;
    private InMemoryWalletStore store;
    private WalletInfo wallet;
    private String receive;
    private String external;
    private Transaction funding;
    private FakeChainClient chain;
    private AtomicInteger creates;
    private RecordingListener listener;
    private Synchronizer sync;

    @Before
    public void setUp() {
        deriver = new XpubAddressDeriver(PARAMS);
        store = new InMemoryWalletStore(deriver, new TransactionDecoder(PARAMS));
        wallet = new WalletInfo("w", "single", Fixtures.xpub(0));
        store.addWallet(wallet);
        receive = deriver.deriveAddress(wallet, false, 0);
        external = deriver.deriveAddress(new WalletInfo("x", "x", Fixtures.xpub(1)), false, 0);
        funding = Fixtures.fund(receive, Coin.COIN, 1);
        listener = new RecordingListener();
        creates = new AtomicInteger();
    }

    @After
    public void tearDown() {
        if (sync != null)
            sync.close();
    }

    private void start(boolean batch) {
        chain = new FakeChainClient(batch);
        chain.add(funding, 90);
        SyncSettings settings = new SyncSettings(PARAMS)
                .setReconnectDelayMillis(10)
                .setRequestPacingMillis(0)
                .setFallbackRelayFee(Coin.valueOf(2000));
        sync = new Synchronizer(settings, store, deriver, new ChainClientFactory() {
            @Override
            public ChainClient create() {
                creates.incrementAndGet();
                return chain;
            }
        });
        sync.addListener(listener);
    }

    private void startReady(boolean batch) throws InterruptedException {
        start(batch);
        sync.run();
        assertTrue(sync.awaitReady(5, TimeUnit.SECONDS));
        listener.drainConnections();
    }

    private void assertWalk() {
        assertEquals(WALK, listener.drainConnections());
        assertEquals(100, sync.getChainTip());
        assertEquals(100, store.getChainTip());
        assertTrue(listener.blocks.contains(100));
        assertEquals(Coin.COIN, listener.lastBalance);
        // the walk itself reports no per-transaction events
        assertTrue(listener.transactions.isEmpty());

        TransactionRecord record = store.getTransaction("w", funding.getTxId().toString()).get();
        assertEquals(TransactionStatus.CONFIRMED, record.getStatus());
        assertEquals(1600000090L, record.getBlockTime());
        assertFalse(store.getAddressStatus("w", receive).isEmpty());
    }

    @Test
    public void batchedWalk() throws Exception {
        start(true);
        assertEquals(SyncState.UNINITIALIZED, sync.getState());
        sync.run();
        assertTrue(sync.awaitReady(5, TimeUnit.SECONDS));
        assertEquals(SyncState.READY, sync.getState());
        assertWalk();
        assertEquals(2 * 20, chain.getSubscribed());
    }

    @Test
    public void sequentialWalk() throws Exception {
        start(false);
        sync.run();
        assertTrue(sync.awaitReady(5, TimeUnit.SECONDS));
        assertWalk();
        assertEquals(2 * 20, chain.getSubscribed());
    }

    @Test
    public void statusChangeAfterReady() throws Exception {
        startReady(true);
        Transaction second = Fixtures.fund(receive, Coin.CENT, 2);
        chain.add(second, 0);
        chain.notifyStatus(receive);
        assertEquals(second.getTxId() + "=PENDING_CONFIRMATION", listener.nextTransaction());
        assertEquals(Coin.COIN.add(Coin.CENT), store.getBalance("w"));
        assertEquals(Coin.COIN, store.getUnconfirmedBalance("w"));
    }

    @Test
    public void runWhileConnectedKeepsSubscriptions() throws Exception {
        start(true);
        sync.run();
        sync.run();
        assertTrue(sync.awaitReady(5, TimeUnit.SECONDS));
        sync.run();
        assertEquals(SyncState.READY, sync.getState());

        Transaction second = Fixtures.fund(receive, Coin.CENT, 2);
        chain.add(second, 0);
        chain.notifyStatus(receive);
        assertEquals(second.getTxId() + "=PENDING_CONFIRMATION", listener.nextTransaction());
        assertEquals(1, creates.get());
        assertEquals(1, chain.getConnects());
    }

    @Test
    public void closeDuringWalkAbortsIt() throws Exception {
        store.addWallet(new WalletInfo("v", "second", Fixtures.xpub(3)));
        start(true);
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final List<String> balanced = Collections.synchronizedList(Lists.<String>newArrayList());
        sync.addListener(new AbstractSyncEventListener() {
            @Override
            public void onBalances(String walletId, Coin balance, Coin unconfirmedBalance) {
                balanced.add(walletId);
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        sync.run();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertEquals(SyncState.SYNCING, sync.getState());

        Thread closer = new Thread(new Runnable() {
            @Override
            public void run() {
                sync.close();
            }
        });
        closer.start();
        // returns false once stopped
        assertFalse(sync.awaitReady(5, TimeUnit.SECONDS));
        release.countDown();
        closer.join(5000);
        assertFalse(closer.isAlive());

        assertEquals(SyncState.STOPPED, sync.getState());
        assertEquals(1, balanced.size());
        // the second wallet was never subscribed
        assertEquals(2 * 20, chain.getSubscribed());
        assertFalse(listener.drainConnections().contains("ONLINE 100"));
    }

    @Test
    public void newBlock() throws Exception {
        startReady(true);
        final CountDownLatch block = new CountDownLatch(1);
        sync.addListener(new AbstractSyncEventListener() {
            @Override
            public void onBlock(int height, String headerHex) {
                if (height == 101)
                    block.countDown();
            }
        });
        chain.newBlock(101);
        assertTrue(block.await(5, TimeUnit.SECONDS));
        assertEquals(101, sync.getChainTip());
    }

    @Test
    public void failedConnectIsNotRetried() throws Exception {
        start(true);
        chain.setFailConnect(true);
        sync.connectAndSync();
        assertEquals(SyncState.UNINITIALIZED, sync.getState());
        assertEquals(1, chain.getConnects());
        assertEquals(Coin.valueOf(2000), sync.relayFee());
        try {
            sync.estimateFee(2);
            fail();
        } catch (DisconnectedException e) {
            // expected
        }
        try {
            sync.getRawTransaction(funding.getTxId().toString());
            fail();
        } catch (DisconnectedException e) {
            // expected
        }
    }

    @Test
    public void closeIsFinal() throws Exception {
        startReady(true);
        sync.close();
        assertEquals(SyncState.STOPPED, sync.getState());
        sync.run();
        assertEquals(SyncState.STOPPED, sync.getState());
        sync.waitForReady();
        assertFalse(sync.awaitReady(10, TimeUnit.MILLISECONDS));
        assertEquals(1, creates.get());
    }

    @Test
    public void reconnectsAfterDisconnect() throws Exception {
        startReady(true);
        chain.disconnect();
        assertEquals("OFFLINE 0", listener.connections.poll(5, TimeUnit.SECONDS));
        for (String event : WALK) {
            assertEquals(event, listener.connections.poll(5, TimeUnit.SECONDS));
        }
        assertTrue(sync.awaitReady(5, TimeUnit.SECONDS));
        assertEquals(2, creates.get());
        assertEquals(2, chain.getConnects());
    }

    @Test
    public void broadcastTransaction() throws Exception {
        startReady(true);
        Transaction spend = Fixtures.spend(funding.getOutput(0), external, Coin.valueOf(99000000L));
        String txId = spend.getTxId().toString();
        store.createPsbt("w", Fixtures.hex(spend), Coin.CENT, "rent", -1,
                ImmutableMap.of(external, Coin.valueOf(99000000L)), Coin.valueOf(1000), false, null);

        TransactionRecord sent = sync.broadcastTransaction("w", txId);
        assertEquals(TransactionStatus.PENDING_CONFIRMATION, sent.getStatus());
        assertEquals(ImmutableList.of(Fixtures.hex(spend)), chain.getBroadcasts());
        assertEquals(txId + "=PENDING_CONFIRMATION", listener.transactions.poll());
        assertEquals(Coin.ZERO, listener.lastBalance);
        try {
            sync.broadcastTransaction("w", txId);
            fail();
        } catch (IllegalStateException e) {
            // already sent
        }
    }

    @Test
    public void rejectedBroadcast() throws Exception {
        startReady(true);
        chain.setRejectBroadcast("min relay fee not met");
        Transaction spend = Fixtures.spend(funding.getOutput(0), external, Coin.valueOf(99999900L));
        String txId = spend.getTxId().toString();
        store.createPsbt("w", Fixtures.hex(spend), Coin.valueOf(100), null, -1,
                ImmutableMap.of(external, Coin.valueOf(99999900L)), Coin.valueOf(1), false, null);
        try {
            sync.broadcastTransaction("w", txId);
            fail();
        } catch (ChainServerException e) {
            assertEquals("min relay fee not met", e.getMessage());
        }
        TransactionRecord record = store.getTransaction("w", txId).get();
        assertEquals(TransactionStatus.NETWORK_REJECTED, record.getStatus());
        assertEquals("min relay fee not met", record.getExtra().getRejectMessage());
        assertEquals(txId + "=NETWORK_REJECTED", listener.transactions.poll());
        assertEquals(Coin.COIN, store.getBalance("w"));
    }

    @Test
    public void feeEstimates() throws Exception {
        startReady(true);
        assertEquals(Coin.valueOf(5000), sync.estimateFee(2));
        chain.setFeeEstimate(Coin.valueOf(-1));
        assertEquals(Coin.valueOf(1000), sync.estimateFee(2));
        assertEquals(Coin.valueOf(1000), sync.relayFee());
    }

    @Test
    public void lookupTransaction() throws Exception {
        startReady(true);
        Transaction spend = Fixtures.spend(funding.getOutput(0), external, Coin.valueOf(99000000L));
        chain.add(spend, 0);
        TransactionRecord record = sync.getTransaction(spend.getTxId().toString());
        assertEquals(TransactionStatus.PENDING_CONFIRMATION, record.getStatus());
        assertEquals(Coin.CENT, record.getFee());
        assertEquals(Fixtures.hex(spend), sync.getRawTransaction(spend.getTxId().toString()));
        assertFalse(store.getTransaction("w", spend.getTxId().toString()).isPresent());
        assertEquals(1, sync.listUnspent(external).size());
    }

    @Test
    public void newAddressOffline() {
        start(true);
        assertEquals(receive, sync.newAddress("w", false));
        assertEquals(0, store.getCurrentAddressIndex("w", false));
    }

    @Test
    public void newAddressSkipsUsed() throws Exception {
        startReady(true);
        assertEquals(deriver.deriveAddress(wallet, false, 1), sync.newAddress("w", false));
        assertEquals(deriver.deriveAddress(wallet, true, 0), sync.newAddress("w", true));
    }

    @Test
    public void newAddressSkipsUsedSequentially() throws Exception {
        startReady(false);
        assertEquals(deriver.deriveAddress(wallet, false, 1), sync.newAddress("w", false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void newAddressUnknownWallet() {
        start(true);
        sync.newAddress("nope", false);
    }
}
