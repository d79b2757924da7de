package org.walletsync.sync;

import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walletsync.store.WalletStore;
import org.walletsync.wallet.AddressDeriver;
import org.walletsync.wallet.WalletInfo;

import java.util.List;

/**
 * Issues new addresses past any that already have on-chain history, scanning ahead by the
 * wallet's gap limit.
 */
public class AddressScanner {
    private static final Logger log = LoggerFactory.getLogger(AddressScanner.class);

    /** Checks derived addresses against the backend */
    public interface AddressProbe {
        boolean supportsBatch();

        /**
         * Probe one address. Returns false when disconnected.
         *
         * @return true if the address has history, remote or stored
         */
        boolean isUsed(WalletInfo wallet, boolean internal, int index, String address);

        /**
         * Probe a window of consecutive addresses starting at {@code startIndex}.
         *
         * @return offset within the window of the last used address, -1 if none or disconnected
         */
        int lastUsedOffset(WalletInfo wallet, boolean internal, int startIndex, List<String> window);
    }

    private final WalletStore store;
    private final AddressDeriver deriver;

    public AddressScanner(WalletStore store, AddressDeriver deriver) {
        this.store = store;
        this.deriver = deriver;
    }

    public String newAddress(WalletInfo wallet, boolean internal, AddressProbe probe) {
        String walletId = wallet.getId();
        if (wallet.isEscrow()) {
            String address = deriver.deriveAddress(wallet, internal, -1);
            store.addAddress(walletId, address, -1, internal);
            return address;
        }

        int index = store.getCurrentAddressIndex(walletId, internal) + 1;
        int gapLimit = wallet.getGapLimit();
        if (probe.supportsBatch()) {
            while (true) {
                List<String> window = Lists.newArrayList();
                for (int i = 0; i < gapLimit; i++) {
                    window.add(deriver.deriveAddress(wallet, internal, index + i));
                }
                int lastUsed = probe.lastUsedOffset(wallet, internal, index, window);
                if (lastUsed < gapLimit - 1) {
                    index += lastUsed + 1;
                    break;
                }
                index += gapLimit;
            }
        } else {
            while (probe.isUsed(wallet, internal, index, deriver.deriveAddress(wallet, internal, index))) {
                index++;
            }
        }

        String address = deriver.deriveAddress(wallet, internal, index);
        store.addAddress(walletId, address, index, internal);
        log.info("new {} address {} at index {} for {}", internal ? "change" : "receive", address, index, walletId);
        return address;
    }
}
