package org.walletsync.sync;

import org.bitcoinj.core.Coin;
import org.walletsync.ledger.TransactionStatus;

/**
 * No-op {@link SyncEventListener}, for listeners interested in a few events only.
 */
public abstract class AbstractSyncEventListener implements SyncEventListener {
    @Override
    public void onBlock(int height, String headerHex) {
    }

    @Override
    public void onTransaction(String txId, TransactionStatus status, String walletId) {
    }

    @Override
    public void onBalance(String walletId, Coin balance) {
    }

    @Override
    public void onBalances(String walletId, Coin balance, Coin unconfirmedBalance) {
    }

    @Override
    public void onConnection(ConnectionStatus status, int percent) {
    }
}
