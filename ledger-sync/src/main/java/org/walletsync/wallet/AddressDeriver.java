package org.walletsync.wallet;

/**
 * Maps a wallet and a derivation position to an address.
 */
public interface AddressDeriver {
    /**
     * @param internal true for the change chain
     * @param index position on the chain, ignored for escrow wallets
     */
    String deriveAddress(WalletInfo wallet, boolean internal, int index);
}
