package org.walletsync.ledger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ProtocolException;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives coins and balances from the full transaction set of a wallet.
 *
 * <p>Nothing is kept between calls. Records must carry their derived status. Where several
 * transactions spend the same output, the confirmed spender wins and every other spender is
 * left out of the projection entirely.</p>
 */
public class LedgerProjector {
    private static final Logger log = LoggerFactory.getLogger(LedgerProjector.class);

    private final TransactionDecoder decoder;

    public LedgerProjector(TransactionDecoder decoder) {
        this.decoder = decoder;
    }

    public LedgerView project(Collection<TransactionRecord> records, AddressBook book, CoinControl control) {
        Map<String, Transaction> txs = decodeAll(records);
        Map<String, TransactionRecord> byId = Maps.newHashMap();
        Map<CoinId, String> usedBy = Maps.newHashMap();
        for (TransactionRecord record : records) {
            byId.put(record.getTxId(), record);
            Transaction tx = txs.get(record.getTxId());
            if (tx == null || !record.isConfirmed())
                continue;
            for (TransactionInput input : tx.getInputs()) {
                usedBy.put(CoinId.of(input.getOutpoint()), record.getTxId());
            }
        }

        Map<CoinId, LedgerCoin> coins = Maps.newLinkedHashMap();
        for (TransactionRecord record : records) {
            TransactionStatus status = record.getStatus();
            if (status == TransactionStatus.REPLACED || status == TransactionStatus.NETWORK_REJECTED)
                continue;
            Transaction tx = txs.get(record.getTxId());
            if (tx == null || conflicts(record, tx, usedBy))
                continue;

            for (TransactionInput input : tx.getInputs()) {
                CoinId id = CoinId.of(input.getOutpoint());
                TransactionRecord prevRecord = byId.get(id.getTxId());
                Transaction prevTx = txs.get(id.getTxId());
                if (prevTx == null || id.getVout() >= prevTx.getOutputs().size())
                    continue;
                String address = decoder.addressOf(prevTx.getOutput(id.getVout()));
                if (address == null || !book.isMine(address))
                    continue;
                LedgerCoin coin = fill(coins, id, prevRecord, prevTx, address, book);
                CoinStatus spent = CoinStatus.spentBy(status);
                if (spent != null) {
                    if (coin.getStatus() == null || spent.compareTo(coin.getStatus()) >= 0)
                        coin.setSpentBy(record.getTxId());
                    coin.setStatus(CoinStatus.max(coin.getStatus(), spent));
                }
            }

            for (TransactionOutput output : tx.getOutputs()) {
                String address = decoder.addressOf(output);
                if (address == null || !book.isMine(address))
                    continue;
                CoinId id = new CoinId(record.getTxId(), output.getIndex());
                LedgerCoin coin = fill(coins, id, record, tx, address, book);
                CoinStatus received = record.isConfirmed() ? CoinStatus.CONFIRMED : CoinStatus.INCOMING_PENDING_CONFIRMATION;
                coin.setStatus(CoinStatus.max(coin.getStatus(), received));
            }
        }

        Coin balance = Coin.ZERO;
        Coin unconfirmedBalance = Coin.ZERO;
        for (LedgerCoin coin : coins.values()) {
            if (control.getMemo(coin.getId()).isPresent())
                coin.setMemo(control.getMemo(coin.getId()).get());
            coin.setLocked(control.isLocked(coin.getId()));
            if (coin.getStatus() == CoinStatus.SPENT || coin.getStatus() == CoinStatus.OUTGOING_PENDING_CONFIRMATION)
                continue;
            balance = balance.add(coin.getAmount());
            if (coin.getStatus() == CoinStatus.INCOMING_PENDING_CONFIRMATION && !coin.isChange())
                continue;
            unconfirmedBalance = unconfirmedBalance.add(coin.getAmount());
        }
        return new LedgerView(coins, balance, unconfirmedBalance);
    }

    private LedgerCoin fill(Map<CoinId, LedgerCoin> coins, CoinId id, TransactionRecord record, Transaction tx,
                            String address, AddressBook book) {
        LedgerCoin coin = coins.get(id);
        if (coin == null) {
            coin = new LedgerCoin(id);
            coins.put(id, coin);
        }
        coin.setAddress(address);
        coin.setAmount(tx.getOutput(id.getVout()).getValue());
        coin.setHeight(record.getHeight());
        coin.setBlockTime(record.getBlockTime());
        coin.setScheduleTime(record.getExtra().getScheduleTime());
        coin.setMemo(record.getMemo());
        coin.setChange(book.isChange(address));
        return coin;
    }

    private boolean conflicts(TransactionRecord record, Transaction tx, Map<CoinId, String> usedBy) {
        for (TransactionInput input : tx.getInputs()) {
            String spender = usedBy.get(CoinId.of(input.getOutpoint()));
            if (spender != null && !spender.equals(record.getTxId()))
                return true;
        }
        return false;
    }

    /**
     * Coins consumed to create the given coin, one generation per element, nearest first.
     * The coin itself is not included.
     */
    public List<List<LedgerCoin>> ancestry(CoinId start, Collection<TransactionRecord> records, LedgerView view) {
        Map<String, Transaction> txs = decodeAll(records);
        List<List<LedgerCoin>> ancestry = Lists.newArrayList();
        Set<CoinId> seen = Sets.newHashSet(start);
        List<CoinId> parents = Lists.newArrayList(start);
        while (true) {
            List<LedgerCoin> grandparents = Lists.newArrayList();
            for (CoinId parent : parents) {
                Transaction tx = txs.get(parent.getTxId());
                if (tx == null)
                    continue;
                for (TransactionInput input : tx.getInputs()) {
                    CoinId id = CoinId.of(input.getOutpoint());
                    if (view.getCoin(id).isPresent() && seen.add(id))
                        grandparents.add(view.getCoin(id).get());
                }
            }
            if (grandparents.isEmpty())
                break;
            ancestry.add(ImmutableList.copyOf(grandparents));
            parents = Lists.newArrayList();
            for (LedgerCoin coin : grandparents) {
                parents.add(coin.getId());
            }
        }
        return ancestry;
    }

    /**
     * A transaction is a receive when none of its inputs spends an output of a wallet transaction
     * paying one of the wallet's addresses.
     *
     * @param txs decoded wallet transactions by txid
     */
    public boolean isReceive(Transaction tx, Map<String, Transaction> txs, AddressBook book) {
        for (TransactionInput input : tx.getInputs()) {
            CoinId id = CoinId.of(input.getOutpoint());
            Transaction prevTx = txs.get(id.getTxId());
            if (prevTx == null || id.getVout() >= prevTx.getOutputs().size())
                continue;
            String address = decoder.addressOf(prevTx.getOutput(id.getVout()));
            if (address != null && book.isMine(address))
                return false;
        }
        return true;
    }

    public Map<String, Transaction> decodeAll(Collection<TransactionRecord> records) {
        Map<String, Transaction> txs = Maps.newHashMap();
        for (TransactionRecord record : records) {
            Transaction tx = decodeQuietly(record);
            if (tx != null)
                txs.put(record.getTxId(), tx);
        }
        return txs;
    }

    private Transaction decodeQuietly(TransactionRecord record) {
        try {
            return decoder.decode(record);
        } catch (ProtocolException | IllegalArgumentException e) {
            log.warn("cannot decode transaction {}: {}", record.getTxId(), e.getMessage());
            return null;
        }
    }
}
