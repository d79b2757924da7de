package org.walletsync.sync;

import com.google.common.base.Optional;
import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.Maps;

/**
 * Live subscriptions of one connection, scripthash to wallet address and back.
 * Subscribing an address again replaces its previous entry.
 */
public class SubscriptionRegistry {
    private final BiMap<String, WalletAddress> subscriptions = Maps.synchronizedBiMap(HashBiMap.<String, WalletAddress>create());

    public void put(String scripthash, String walletId, String address) {
        subscriptions.forcePut(scripthash, new WalletAddress(walletId, address));
    }

    public Optional<WalletAddress> lookup(String scripthash) {
        return Optional.fromNullable(subscriptions.get(scripthash));
    }

    public Optional<String> scripthashOf(String walletId, String address) {
        return Optional.fromNullable(subscriptions.inverse().get(new WalletAddress(walletId, address)));
    }

    public int size() {
        return subscriptions.size();
    }

    public void clear() {
        subscriptions.clear();
    }
}
