package org.walletsync.wallet;

import com.google.common.collect.Maps;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.SegwitAddress;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;

import java.util.concurrent.ConcurrentMap;

/**
 * Derives native segwit addresses from a single account level extended public key, given as the
 * wallet descriptor. External addresses are at {@code 0/index}, change at {@code 1/index}.
 */
public class XpubAddressDeriver implements AddressDeriver {
    private final NetworkParameters params;
    private final ConcurrentMap<String, DeterministicKey> chainKeys = Maps.newConcurrentMap();

    public XpubAddressDeriver(NetworkParameters params) {
        this.params = params;
    }

    @Override
    public String deriveAddress(WalletInfo wallet, boolean internal, int index) {
        if (wallet.isEscrow() || index < 0)
            return SegwitAddress.fromKey(params, accountKey(wallet)).toString();
        DeterministicKey chainKey = chainKey(wallet, internal);
        DeterministicKey key = HDKeyDerivation.deriveChildKey(chainKey, new ChildNumber(index, false));
        return SegwitAddress.fromKey(params, key).toString();
    }

    private DeterministicKey accountKey(WalletInfo wallet) {
        return DeterministicKey.deserializeB58(wallet.getDescriptor(), params);
    }

    private DeterministicKey chainKey(WalletInfo wallet, boolean internal) {
        String cacheKey = wallet.getId() + (internal ? "/1" : "/0");
        DeterministicKey chainKey = chainKeys.get(cacheKey);
        if (chainKey == null) {
            chainKey = HDKeyDerivation.deriveChildKey(accountKey(wallet), new ChildNumber(internal ? 1 : 0, false));
            chainKeys.put(cacheKey, chainKey);
        }
        return chainKey;
    }
}
