package org.walletsync.sync;

import com.google.common.base.Objects;

/**
 * An address of a wallet, the value side of a subscription.
 */
public class WalletAddress {
    private final String walletId;
    private final String address;

    public WalletAddress(String walletId, String address) {
        this.walletId = walletId;
        this.address = address;
    }

    public String getWalletId() {
        return walletId;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof WalletAddress))
            return false;
        WalletAddress o = (WalletAddress) obj;
        return walletId.equals(o.walletId) && address.equals(o.address);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(walletId, address);
    }

    @Override
    public String toString() {
        return walletId + "/" + address;
    }
}
