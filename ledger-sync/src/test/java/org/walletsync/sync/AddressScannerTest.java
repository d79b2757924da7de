package org.walletsync.sync;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.Fixtures;
import org.walletsync.ledger.TransactionDecoder;
import org.walletsync.store.InMemoryWalletStore;
import org.walletsync.wallet.WalletInfo;
import org.walletsync.wallet.XpubAddressDeriver;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;
import static org.walletsync.Fixtures.PARAMS;

public class AddressScannerTest {
    private XpubAddressDeriver deriver;
    private InMemoryWalletStore store;
    private AddressScanner scanner;
    private WalletInfo wallet;

    @Before
    public void setUp() {
        deriver = new XpubAddressDeriver(PARAMS);
        store = new InMemoryWalletStore(deriver, new TransactionDecoder(PARAMS));
        scanner = new AddressScanner(store, deriver);
        wallet = new WalletInfo("w", "single", Fixtures.xpub(0));
        store.addWallet(wallet);
    }

    @Test
    public void batchSkipsWholeWindows() {
        UsedIndices probe = new UsedIndices(true, ContiguousSet.create(Range.closed(0, 44), DiscreteDomain.integers()));
        String address = scanner.newAddress(wallet, false, probe);
        assertEquals(deriver.deriveAddress(wallet, false, 45), address);
        assertEquals(3, probe.windows);
        assertEquals(45, store.getCurrentAddressIndex("w", false));
        assertTrue(store.isMyAddress("w", deriver.deriveAddress(wallet, false, 60)));
    }

    @Test
    public void batchWithNothingUsed() {
        UsedIndices probe = new UsedIndices(true, Sets.<Integer>newHashSet());
        assertEquals(deriver.deriveAddress(wallet, true, 0), scanner.newAddress(wallet, true, probe));
        assertEquals(1, probe.windows);
        assertEquals(deriver.deriveAddress(wallet, true, 1), scanner.newAddress(wallet, true, probe));
    }

    @Test
    public void sequentialStopsAtFirstUnused() {
        UsedIndices probe = new UsedIndices(false, Sets.newHashSet(0, 1, 2, 4));
        assertEquals(deriver.deriveAddress(wallet, false, 3), scanner.newAddress(wallet, false, probe));
        assertEquals(deriver.deriveAddress(wallet, false, 5), scanner.newAddress(wallet, false, probe));
        assertEquals(5, store.getCurrentAddressIndex("w", false));
        assertEquals(-1, store.getCurrentAddressIndex("w", true));
    }

    @Test
    public void escrowAlwaysReturnsItsAddress() {
        WalletInfo escrow = new WalletInfo("e", "escrow", 1, 1, true, WalletInfo.DEFAULT_GAP_LIMIT, Fixtures.xpub(2));
        store.addWallet(escrow);
        UsedIndices probe = new UsedIndices(false, Sets.newHashSet(0));
        String address = scanner.newAddress(escrow, false, probe);
        assertEquals(deriver.deriveAddress(escrow, false, -1), address);
        assertEquals(address, scanner.newAddress(escrow, false, probe));
        assertEquals(0, probe.probes);
    }

    private static class UsedIndices implements AddressScanner.AddressProbe {
        private final boolean batch;
        private final Set<Integer> used;
        int windows;
        int probes;

        UsedIndices(boolean batch, Set<Integer> used) {
            this.batch = batch;
            this.used = used;
        }

        @Override
        public boolean supportsBatch() {
            return batch;
        }

        @Override
        public boolean isUsed(WalletInfo wallet, boolean internal, int index, String address) {
            probes++;
            return used.contains(index);
        }

        @Override
        public int lastUsedOffset(WalletInfo wallet, boolean internal, int startIndex, List<String> window) {
            windows++;
            int lastUsed = -1;
            for (int i = 0; i < window.size(); i++) {
                if (used.contains(startIndex + i))
                    lastUsed = i;
            }
            return lastUsed;
        }
    }
}
