package org.walletsync.sync;

import org.bitcoinj.core.Coin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walletsync.ledger.TransactionStatus;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to registered listeners. A listener that throws is logged and skipped.
 */
class SyncEventDispatcher implements SyncEventListener {
    private static final Logger log = LoggerFactory.getLogger(SyncEventDispatcher.class);

    private final CopyOnWriteArrayList<SyncEventListener> listeners = new CopyOnWriteArrayList<>();

    void add(SyncEventListener listener) {
        listeners.add(listener);
    }

    boolean remove(SyncEventListener listener) {
        return listeners.remove(listener);
    }

    @Override
    public void onBlock(int height, String headerHex) {
        for (SyncEventListener listener : listeners) {
            try {
                listener.onBlock(height, headerHex);
            } catch (RuntimeException e) {
                log.error("listener failed on block " + height, e);
            }
        }
    }

    @Override
    public void onTransaction(String txId, TransactionStatus status, String walletId) {
        for (SyncEventListener listener : listeners) {
            try {
                listener.onTransaction(txId, status, walletId);
            } catch (RuntimeException e) {
                log.error("listener failed on transaction " + txId, e);
            }
        }
    }

    @Override
    public void onBalance(String walletId, Coin balance) {
        for (SyncEventListener listener : listeners) {
            try {
                listener.onBalance(walletId, balance);
            } catch (RuntimeException e) {
                log.error("listener failed on balance of " + walletId, e);
            }
        }
    }

    @Override
    public void onBalances(String walletId, Coin balance, Coin unconfirmedBalance) {
        for (SyncEventListener listener : listeners) {
            try {
                listener.onBalances(walletId, balance, unconfirmedBalance);
            } catch (RuntimeException e) {
                log.error("listener failed on balances of " + walletId, e);
            }
        }
    }

    @Override
    public void onConnection(ConnectionStatus status, int percent) {
        for (SyncEventListener listener : listeners) {
            try {
                listener.onConnection(status, percent);
            } catch (RuntimeException e) {
                log.error("listener failed on connection " + status, e);
            }
        }
    }
}
