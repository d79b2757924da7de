package org.walletsync.store;

import com.google.common.base.Optional;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ProtocolException;
import org.bitcoinj.core.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walletsync.ledger.AddressBook;
import org.walletsync.ledger.CoinControl;
import org.walletsync.ledger.CoinId;
import org.walletsync.ledger.LedgerCoin;
import org.walletsync.ledger.LedgerProjector;
import org.walletsync.ledger.LedgerView;
import org.walletsync.ledger.PsbtParser;
import org.walletsync.ledger.TransactionDecoder;
import org.walletsync.ledger.TransactionRecord;
import org.walletsync.ledger.TransactionStatus;
import org.walletsync.wallet.AddressDeriver;
import org.walletsync.wallet.WalletInfo;

import javax.annotation.concurrent.GuardedBy;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Keeps all wallet state in memory. Coins and balances are projected from the transaction
 * set on every query.
 */
public class InMemoryWalletStore implements WalletStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryWalletStore.class);

    private final AddressDeriver deriver;
    private final TransactionDecoder decoder;
    private final LedgerProjector projector;

    @GuardedBy("this")
    private final Map<String, WalletData> wallets = Maps.newLinkedHashMap();
    @GuardedBy("this")
    private long clock;
    @GuardedBy("this")
    private int chainTip = -1;

    static class AddressEntry {
        final String address;
        final int index;
        final boolean internal;

        AddressEntry(String address, int index, boolean internal) {
            this.address = address;
            this.index = index;
            this.internal = internal;
        }
    }

    static class WalletData {
        final WalletInfo info;
        final Map<String, TransactionRecord> txs = Maps.newLinkedHashMap();
        final Map<String, AddressEntry> addresses = Maps.newLinkedHashMap();
        final Map<String, String> statuses = Maps.newHashMap();
        final Map<String, String> derived = Maps.newHashMap();
        final CoinControl coinControl = new CoinControl();
        long lastUsed;

        WalletData(WalletInfo info) {
            this.info = info;
        }
    }

    public InMemoryWalletStore(AddressDeriver deriver, TransactionDecoder decoder) {
        this.deriver = deriver;
        this.decoder = decoder;
        this.projector = new LedgerProjector(decoder);
    }

    @Override
    public synchronized void addWallet(WalletInfo wallet) {
        checkArgument(!wallets.containsKey(wallet.getId()), "duplicate wallet %s", wallet.getId());
        WalletData data = new WalletData(wallet);
        data.lastUsed = ++clock;
        wallets.put(wallet.getId(), data);
        log.info("added wallet {}", wallet);
    }

    @Override
    public synchronized Optional<WalletInfo> getWallet(String walletId) {
        WalletData data = wallets.get(walletId);
        return data == null ? Optional.<WalletInfo>absent() : Optional.of(data.info);
    }

    @Override
    public synchronized List<WalletInfo> listRecentlyUsedWallets() {
        List<WalletData> sorted = Ordering.from(new Comparator<WalletData>() {
            @Override
            public int compare(WalletData a, WalletData b) {
                return Long.compare(b.lastUsed, a.lastUsed);
            }
        }).sortedCopy(wallets.values());
        List<WalletInfo> result = Lists.newArrayList();
        for (WalletData data : sorted) {
            result.add(data.info);
        }
        return result;
    }

    @Override
    public synchronized Optional<TransactionRecord> getTransaction(String walletId, String txId) {
        WalletData data = wallet(walletId);
        if (!data.txs.containsKey(txId))
            return Optional.absent();
        for (TransactionRecord record : snapshot(data)) {
            if (record.getTxId().equals(txId))
                return Optional.of(record);
        }
        return Optional.absent();
    }

    @Override
    public synchronized List<TransactionRecord> getTransactions(String walletId) {
        return snapshot(wallet(walletId));
    }

    @Override
    public synchronized List<TransactionRecord> getTransactions(String walletId, TransactionStatus status, boolean receive) {
        List<TransactionRecord> result = Lists.newArrayList();
        for (TransactionRecord record : snapshot(wallet(walletId))) {
            if (record.getStatus() == status && record.isReceive() == receive)
                result.add(record);
        }
        return result;
    }

    @Override
    public synchronized TransactionRecord insertTransaction(String walletId, String rawHex, int height, long blockTime, Coin fee) {
        WalletData data = wallet(walletId);
        String txId = decoder.txIdOf(rawHex);
        checkState(!data.txs.containsKey(txId), "transaction %s already known", txId);
        TransactionRecord record = new TransactionRecord(txId, rawHex, height);
        record.setBlockTime(blockTime);
        record.setFee(fee);
        data.txs.put(txId, record);
        data.lastUsed = ++clock;
        log.info("inserted {} at height {} into {}", txId, height, walletId);
        return getTransaction(walletId, txId).get();
    }

    @Override
    public synchronized TransactionRecord updateTransaction(String walletId, String rawHex, int height, long blockTime,
                                                           String rejectMessage) {
        WalletData data = wallet(walletId);
        String txId = decoder.txIdOf(rawHex);
        TransactionRecord record = data.txs.get(txId);
        checkState(record != null, "unknown transaction %s", txId);
        if (height <= TransactionRecord.HEIGHT_PENDING && record.getHeight() == TransactionRecord.HEIGHT_LOCAL) {
            if (PsbtParser.isPsbt(record.getSerialized()))
                record.getExtra().setSigners(signersOf(record.getSerialized()));
            if (rejectMessage != null)
                record.getExtra().setRejectMessage(rejectMessage);
            String replaceTxId = record.getExtra().getReplaceTxId();
            if (height == TransactionRecord.HEIGHT_PENDING && replaceTxId != null && data.txs.containsKey(replaceTxId)) {
                data.txs.get(replaceTxId).getExtra().setReplacedByTxId(txId);
                log.info("{} replaced by {}", replaceTxId, txId);
            }
        }
        record.setSerialized(rawHex);
        record.setHeight(height);
        record.setBlockTime(blockTime);
        data.lastUsed = ++clock;
        return getTransaction(walletId, txId).get();
    }

    @Override
    public synchronized boolean deleteTransaction(String walletId, String txId) {
        boolean removed = wallet(walletId).txs.remove(txId) != null;
        if (removed)
            log.info("deleted {} from {}", txId, walletId);
        return removed;
    }

    @Override
    public synchronized TransactionRecord createPsbt(String walletId, String psbt, Coin fee, String memo, int changeIndex,
                                                    Map<String, Coin> outputs, Coin feeRate,
                                                    boolean subtractFeeFromAmount, String replaceTxId) {
        WalletData data = wallet(walletId);
        String txId = decoder.txIdOf(psbt);
        checkState(!data.txs.containsKey(txId), "transaction %s already known", txId);
        TransactionRecord record = new TransactionRecord(txId, psbt, TransactionRecord.HEIGHT_LOCAL);
        record.setFee(fee);
        record.setMemo(memo);
        record.setChangeIndex(changeIndex);
        Map<String, Long> amounts = Maps.newLinkedHashMap();
        for (Map.Entry<String, Coin> output : outputs.entrySet()) {
            amounts.put(output.getKey(), output.getValue().getValue());
        }
        record.getExtra().setOutputs(amounts);
        record.getExtra().setFeeRate(feeRate.getValue());
        record.getExtra().setSubtractFeeFromAmount(subtractFeeFromAmount);
        record.getExtra().setReplaceTxId(replaceTxId);
        if (PsbtParser.isPsbt(psbt))
            record.getExtra().setSigners(signersOf(psbt));
        data.txs.put(txId, record);
        data.lastUsed = ++clock;
        log.info("created psbt {} in {}", txId, walletId);
        return getTransaction(walletId, txId).get();
    }

    @Override
    public synchronized TransactionRecord updatePsbt(String walletId, String serialized) {
        WalletData data = wallet(walletId);
        String txId = decoder.txIdOf(serialized);
        TransactionRecord record = data.txs.get(txId);
        checkState(record != null, "unknown transaction %s", txId);
        checkState(record.getHeight() == TransactionRecord.HEIGHT_LOCAL, "transaction %s already broadcast", txId);
        record.setSerialized(serialized);
        if (PsbtParser.isPsbt(serialized))
            record.getExtra().setSigners(signersOf(serialized));
        data.lastUsed = ++clock;
        return getTransaction(walletId, txId).get();
    }

    @Override
    public synchronized boolean updateTransactionMemo(String walletId, String txId, String memo) {
        TransactionRecord record = wallet(walletId).txs.get(txId);
        if (record == null)
            return false;
        record.setMemo(memo);
        return true;
    }

    @Override
    public synchronized boolean updateTransactionSchedule(String walletId, String txId, long scheduleTime) {
        TransactionRecord record = wallet(walletId).txs.get(txId);
        if (record == null)
            return false;
        record.getExtra().setScheduleTime(scheduleTime);
        return true;
    }

    @Override
    public synchronized void setUtxoStatus(String walletId, String address, String encodedStatus) {
        wallet(walletId).statuses.put(address, encodedStatus);
    }

    @Override
    public synchronized String getAddressStatus(String walletId, String address) {
        return AddressStatus.statusOf(wallet(walletId).statuses.get(address));
    }

    @Override
    public synchronized void addAddress(String walletId, String address, int index, boolean internal) {
        WalletData data = wallet(walletId);
        if (!data.addresses.containsKey(address))
            data.addresses.put(address, new AddressEntry(address, index, internal));
    }

    @Override
    public synchronized List<String> getAllAddresses(String walletId) {
        return Lists.newArrayList(allAddresses(wallet(walletId)).keySet());
    }

    @Override
    public synchronized int getCurrentAddressIndex(String walletId, boolean internal) {
        return currentIndex(wallet(walletId), internal);
    }

    @Override
    public synchronized boolean isMyAddress(String walletId, String address) {
        return allAddresses(wallet(walletId)).containsKey(address);
    }

    @Override
    public synchronized int getChainTip() {
        return chainTip;
    }

    @Override
    public synchronized void setChainTip(int height) {
        chainTip = height;
    }

    @Override
    public synchronized Coin getBalance(String walletId) {
        return view(wallet(walletId)).getBalance();
    }

    @Override
    public synchronized Coin getUnconfirmedBalance(String walletId) {
        return view(wallet(walletId)).getUnconfirmedBalance();
    }

    @Override
    public synchronized Coin getAddressBalance(String walletId, String address) {
        return view(wallet(walletId)).getAddressBalance(address);
    }

    @Override
    public synchronized List<LedgerCoin> getCoins(String walletId) {
        return view(wallet(walletId)).getCoins();
    }

    @Override
    public synchronized List<List<LedgerCoin>> getAncestry(String walletId, CoinId coin) {
        WalletData data = wallet(walletId);
        List<TransactionRecord> records = snapshot(data);
        LedgerView view = projector.project(records, bookOf(data), data.coinControl);
        return projector.ancestry(coin, records, view);
    }

    @Override
    public synchronized boolean updateCoinMemo(String walletId, CoinId coin, String memo) {
        wallet(walletId).coinControl.setMemo(coin, memo);
        return true;
    }

    @Override
    public synchronized boolean lockCoin(String walletId, CoinId coin) {
        return wallet(walletId).coinControl.lock(coin);
    }

    @Override
    public synchronized boolean unlockCoin(String walletId, CoinId coin) {
        return wallet(walletId).coinControl.unlock(coin);
    }

    private WalletData wallet(String walletId) {
        WalletData data = wallets.get(walletId);
        checkArgument(data != null, "unknown wallet %s", walletId);
        return data;
    }

    private LedgerView view(WalletData data) {
        return projector.project(snapshot(data), bookOf(data), data.coinControl);
    }

    /** Copies of the records, with status and direction derived */
    private List<TransactionRecord> snapshot(WalletData data) {
        Map<String, Transaction> decoded = projector.decodeAll(data.txs.values());
        AddressBook book = bookOf(data);
        List<TransactionRecord> records = Lists.newArrayList();
        for (TransactionRecord record : data.txs.values()) {
            TransactionRecord copy = record.copy();
            copy.setStatus(statusOf(record, data.info.getM()));
            Transaction tx = decoded.get(record.getTxId());
            copy.setReceive(tx == null || projector.isReceive(tx, decoded, book));
            records.add(copy);
        }
        return records;
    }

    private TransactionStatus statusOf(TransactionRecord record, int requiredSignatures) {
        try {
            return decoder.statusOf(record, requiredSignatures);
        } catch (ProtocolException e) {
            log.warn("cannot parse psbt {}: {}", record.getTxId(), e.getMessage());
            return TransactionStatus.PENDING_SIGNATURES;
        }
    }

    private Map<String, Boolean> signersOf(String psbt) {
        Map<String, Boolean> signers = Maps.newLinkedHashMap();
        for (PsbtParser.InputSignatures input : decoder.parsePsbt(psbt).getInputs()) {
            for (String signer : input.getSigners()) {
                signers.put(signer, true);
            }
        }
        return signers;
    }

    private AddressBook bookOf(WalletData data) {
        final Map<String, Boolean> all = allAddresses(data);
        return new AddressBook() {
            @Override
            public boolean isMine(String address) {
                return all.containsKey(address);
            }

            @Override
            public boolean isChange(String address) {
                return Boolean.TRUE.equals(all.get(address));
            }
        };
    }

    /** Address to whether it is on the change chain */
    private Map<String, Boolean> allAddresses(WalletData data) {
        Map<String, Boolean> all = Maps.newLinkedHashMap();
        if (data.info.isEscrow()) {
            all.put(derive(data, false, -1), false);
            return all;
        }
        for (boolean internal : new boolean[]{false, true}) {
            int end = currentIndex(data, internal) + 1 + ADDRESS_LOOK_AHEAD;
            for (int index = 0; index < end; index++) {
                all.put(derive(data, internal, index), internal);
            }
        }
        for (AddressEntry entry : data.addresses.values()) {
            if (!all.containsKey(entry.address))
                all.put(entry.address, entry.internal);
        }
        return all;
    }

    private int currentIndex(WalletData data, boolean internal) {
        int current = -1;
        for (AddressEntry entry : data.addresses.values()) {
            if (entry.internal == internal)
                current = Math.max(current, entry.index);
        }
        return current;
    }

    private String derive(WalletData data, boolean internal, int index) {
        String key = (internal ? "1/" : "0/") + index;
        String address = data.derived.get(key);
        if (address == null) {
            address = deriver.deriveAddress(data.info, internal, index);
            data.derived.put(key, address);
        }
        return address;
    }
}
