package org.walletsync.ledger;

import com.google.common.base.MoreObjects;
import org.bitcoinj.core.Coin;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A wallet transaction as kept by the store.
 *
 * <p>Height is -2 when the network rejected the broadcast, -1 while local and unbroadcast,
 * 0 while unconfirmed and the block height once confirmed.</p>
 *
 * <p>Status and direction are not stored. The store fills them in on every read.</p>
 */
public class TransactionRecord {
    public static final int HEIGHT_REJECTED = -2;
    public static final int HEIGHT_LOCAL = -1;
    public static final int HEIGHT_PENDING = 0;

    private final String txId;
    private String serialized;
    private int height;
    private long blockTime;
    private Coin fee = Coin.ZERO;
    private String memo = "";
    private int changeIndex = -1;
    private TransactionExtra extra = new TransactionExtra();

    private TransactionStatus status;
    private boolean receive;

    public TransactionRecord(String txId, String serialized, int height) {
        this.txId = checkNotNull(txId);
        this.serialized = checkNotNull(serialized);
        this.height = height;
    }

    public String getTxId() {
        return txId;
    }

    /** Raw transaction hex, or base64 PSBT before broadcast */
    public String getSerialized() {
        return serialized;
    }

    public void setSerialized(String serialized) {
        this.serialized = checkNotNull(serialized);
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public boolean isConfirmed() {
        return height > 0;
    }

    public long getBlockTime() {
        return blockTime;
    }

    public void setBlockTime(long blockTime) {
        this.blockTime = blockTime;
    }

    public Coin getFee() {
        return fee;
    }

    public void setFee(Coin fee) {
        this.fee = checkNotNull(fee);
    }

    public String getMemo() {
        return memo;
    }

    public void setMemo(String memo) {
        this.memo = memo == null ? "" : memo;
    }

    public int getChangeIndex() {
        return changeIndex;
    }

    public void setChangeIndex(int changeIndex) {
        this.changeIndex = changeIndex;
    }

    public TransactionExtra getExtra() {
        return extra;
    }

    public void setExtra(TransactionExtra extra) {
        this.extra = checkNotNull(extra);
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public void setStatus(TransactionStatus status) {
        this.status = status;
    }

    /** True if no input spends a coin of the wallet */
    public boolean isReceive() {
        return receive;
    }

    public void setReceive(boolean receive) {
        this.receive = receive;
    }

    public TransactionRecord copy() {
        TransactionRecord copy = new TransactionRecord(txId, serialized, height);
        copy.blockTime = blockTime;
        copy.fee = fee;
        copy.memo = memo;
        copy.changeIndex = changeIndex;
        copy.extra = extra.copy();
        copy.status = status;
        copy.receive = receive;
        return copy;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("txId", txId)
                .add("height", height)
                .add("status", status)
                .add("receive", receive)
                .toString();
    }
}
