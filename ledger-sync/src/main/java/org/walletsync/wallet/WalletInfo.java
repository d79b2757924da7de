package org.walletsync.wallet;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Wallet metadata needed for synchronization. The descriptor is opaque here; it is
 * interpreted by the {@link AddressDeriver}.
 */
public class WalletInfo {
    public static final int DEFAULT_GAP_LIMIT = 20;

    private final String id;
    private final String name;
    private final int m;
    private final int n;
    private final boolean escrow;
    private final int gapLimit;
    private final String descriptor;

    public WalletInfo(String id, String name, int m, int n, boolean escrow, int gapLimit, String descriptor) {
        checkArgument(m >= 1 && m <= n, "invalid %s-of-%s", m, n);
        checkArgument(gapLimit > 0, "gap limit must be positive");
        this.id = checkNotNull(id);
        this.name = name;
        this.m = m;
        this.n = n;
        this.escrow = escrow;
        this.gapLimit = gapLimit;
        this.descriptor = checkNotNull(descriptor);
    }

    public WalletInfo(String id, String name, String descriptor) {
        this(id, name, 1, 1, false, DEFAULT_GAP_LIMIT, descriptor);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Signatures required to spend */
    public int getM() {
        return m;
    }

    public int getN() {
        return n;
    }

    /** Escrow wallets have a single fixed address */
    public boolean isEscrow() {
        return escrow;
    }

    public int getGapLimit() {
        return gapLimit;
    }

    public String getDescriptor() {
        return descriptor;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("m", m)
                .add("n", n)
                .add("escrow", escrow)
                .toString();
    }
}
