package org.walletsync.store;

import com.google.common.base.Optional;
import org.bitcoinj.core.Coin;
import org.walletsync.ledger.CoinId;
import org.walletsync.ledger.LedgerCoin;
import org.walletsync.ledger.TransactionRecord;
import org.walletsync.ledger.TransactionStatus;
import org.walletsync.wallet.WalletInfo;

import java.util.List;
import java.util.Map;

/**
 * Persistent wallet state used by the synchronizer. Implementations serialize their own writes.
 *
 * <p>Transaction records returned from here are copies with status and direction filled in.</p>
 */
public interface WalletStore {
    /** Addresses derived past the last issued index on each chain */
    int ADDRESS_LOOK_AHEAD = 20;

    void addWallet(WalletInfo wallet);

    Optional<WalletInfo> getWallet(String walletId);

    /** Most recently used first */
    List<WalletInfo> listRecentlyUsedWallets();

    Optional<TransactionRecord> getTransaction(String walletId, String txId);

    List<TransactionRecord> getTransactions(String walletId);

    List<TransactionRecord> getTransactions(String walletId, TransactionStatus status, boolean receive);

    /** Record a transaction first seen in a chain history */
    TransactionRecord insertTransaction(String walletId, String rawHex, int height, long blockTime, Coin fee);

    /**
     * Update the raw form, height and block time of a known transaction. Moving a local
     * transaction to height 0 or -2 keeps its signer set, records the reject message if any, and
     * marks the transaction it replaces as replaced by it.
     *
     * @param rejectMessage null unless the broadcast was rejected
     */
    TransactionRecord updateTransaction(String walletId, String rawHex, int height, long blockTime, String rejectMessage);

    boolean deleteTransaction(String walletId, String txId);

    /** Record a locally built, unbroadcast transaction, as a PSBT or as finalized raw hex */
    TransactionRecord createPsbt(String walletId, String psbt, Coin fee, String memo, int changeIndex,
                                 Map<String, Coin> outputs, Coin feeRate, boolean subtractFeeFromAmount,
                                 String replaceTxId);

    /** Replace the serialized form of a local transaction, e.g. after adding signatures or finalizing it */
    TransactionRecord updatePsbt(String walletId, String serialized);

    boolean updateTransactionMemo(String walletId, String txId, String memo);

    boolean updateTransactionSchedule(String walletId, String txId, long scheduleTime);

    /** @param encodedStatus {@code "<utxo json>|<status>"} */
    void setUtxoStatus(String walletId, String address, String encodedStatus);

    /** @return the status part of the last stored encoded status, empty if none */
    String getAddressStatus(String walletId, String address);

    void addAddress(String walletId, String address, int index, boolean internal);

    /** Every issued address plus the look-ahead on both chains */
    List<String> getAllAddresses(String walletId);

    /** @return highest issued index on the chain, -1 if none */
    int getCurrentAddressIndex(String walletId, boolean internal);

    boolean isMyAddress(String walletId, String address);

    /** @return height of the last seen chain tip, -1 if none */
    int getChainTip();

    void setChainTip(int height);

    Coin getBalance(String walletId);

    Coin getUnconfirmedBalance(String walletId);

    Coin getAddressBalance(String walletId, String address);

    List<LedgerCoin> getCoins(String walletId);

    List<List<LedgerCoin>> getAncestry(String walletId, CoinId coin);

    boolean updateCoinMemo(String walletId, CoinId coin, String memo);

    boolean lockCoin(String walletId, CoinId coin);

    boolean unlockCoin(String walletId, CoinId coin);
}
