package org.walletsync.ledger;

import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;
import org.bitcoinj.core.TransactionOutPoint;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Identity of a transaction output, {@code txid:vout}.
 */
public class CoinId implements Comparable<CoinId> {
    private final String txId;
    private final int vout;

    public CoinId(String txId, int vout) {
        checkArgument(vout >= 0, "negative vout");
        this.txId = checkNotNull(txId);
        this.vout = vout;
    }

    public static CoinId of(TransactionOutPoint outpoint) {
        return new CoinId(outpoint.getHash().toString(), (int) outpoint.getIndex());
    }

    public static CoinId parse(String value) {
        int colon = value.lastIndexOf(':');
        checkArgument(colon > 0, "expected txid:vout, got %s", value);
        return new CoinId(value.substring(0, colon), Integer.parseInt(value.substring(colon + 1)));
    }

    public String getTxId() {
        return txId;
    }

    public int getVout() {
        return vout;
    }

    @Override
    public int compareTo(CoinId o) {
        return ComparisonChain.start()
                .compare(txId, o.txId)
                .compare(vout, o.vout)
                .result();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof CoinId))
            return false;
        CoinId o = (CoinId) obj;
        return vout == o.vout && txId.equals(o.txId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(txId, vout);
    }

    @Override
    public String toString() {
        return txId + ":" + vout;
    }
}
