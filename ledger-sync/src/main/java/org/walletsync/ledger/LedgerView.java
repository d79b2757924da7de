package org.walletsync.ledger;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.bitcoinj.core.Coin;

import java.util.List;
import java.util.Map;

/**
 * Result of a projection: the wallet coins and the balances derived from them.
 */
public class LedgerView {
    private final ImmutableMap<CoinId, LedgerCoin> coins;
    private final Coin balance;
    private final Coin unconfirmedBalance;

    LedgerView(Map<CoinId, LedgerCoin> coins, Coin balance, Coin unconfirmedBalance) {
        this.coins = ImmutableMap.copyOf(coins);
        this.balance = balance;
        this.unconfirmedBalance = unconfirmedBalance;
    }

    public List<LedgerCoin> getCoins() {
        return ImmutableList.copyOf(coins.values());
    }

    public Optional<LedgerCoin> getCoin(CoinId id) {
        return Optional.fromNullable(coins.get(id));
    }

    /** All coins not spent and not being spent by a broadcast transaction */
    public Coin getBalance() {
        return balance;
    }

    /** Like {@link #getBalance()}, but without unconfirmed incoming coins other than change */
    public Coin getUnconfirmedBalance() {
        return unconfirmedBalance;
    }

    /**
     * Confirmed amount at the address not yet spent on chain. Coins reserved by a local
     * transaction that was never broadcast still count.
     */
    public Coin getAddressBalance(String address) {
        Coin total = Coin.ZERO;
        for (LedgerCoin coin : coins.values()) {
            if (!address.equals(coin.getAddress()))
                continue;
            CoinStatus status = coin.getStatus();
            if (status == CoinStatus.SPENT || status == CoinStatus.OUTGOING_PENDING_CONFIRMATION
                    || status == CoinStatus.INCOMING_PENDING_CONFIRMATION)
                continue;
            total = total.add(coin.getAmount());
        }
        return total;
    }
}
