package org.walletsync.sync;

import org.bitcoinj.core.Coin;
import org.walletsync.ledger.TransactionStatus;

/**
 * Synchronization events. Called synchronously, in reconciliation order, on the sync worker or
 * on the thread that started the operation. Implementations must not block.
 */
public interface SyncEventListener {
    void onBlock(int height, String headerHex);

    void onTransaction(String txId, TransactionStatus status, String walletId);

    void onBalance(String walletId, Coin balance);

    void onBalances(String walletId, Coin balance, Coin unconfirmedBalance);

    /** @param percent progress of the sync walk, 0 to 100 */
    void onConnection(ConnectionStatus status, int percent);
}
