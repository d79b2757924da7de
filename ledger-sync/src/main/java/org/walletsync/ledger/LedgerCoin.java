package org.walletsync.ledger;

import com.google.common.base.MoreObjects;
import org.bitcoinj.core.Coin;

/**
 * A wallet output with its derived status. Built fresh by each projection.
 */
public class LedgerCoin {
    private final CoinId id;
    private String address;
    private Coin amount = Coin.ZERO;
    private int height;
    private long blockTime;
    private long scheduleTime = -1;
    private String memo = "";
    private boolean change;
    private boolean locked;
    private CoinStatus status;
    private String spentBy;

    public LedgerCoin(CoinId id) {
        this.id = id;
    }

    public CoinId getId() {
        return id;
    }

    public String getTxId() {
        return id.getTxId();
    }

    public int getVout() {
        return id.getVout();
    }

    public String getAddress() {
        return address;
    }

    void setAddress(String address) {
        this.address = address;
    }

    public Coin getAmount() {
        return amount;
    }

    void setAmount(Coin amount) {
        this.amount = amount;
    }

    public int getHeight() {
        return height;
    }

    void setHeight(int height) {
        this.height = height;
    }

    public long getBlockTime() {
        return blockTime;
    }

    void setBlockTime(long blockTime) {
        this.blockTime = blockTime;
    }

    /** Schedule time of the transaction spending this coin, -1 if none */
    public long getScheduleTime() {
        return scheduleTime;
    }

    void setScheduleTime(long scheduleTime) {
        this.scheduleTime = scheduleTime;
    }

    public String getMemo() {
        return memo;
    }

    void setMemo(String memo) {
        this.memo = memo;
    }

    public boolean isChange() {
        return change;
    }

    void setChange(boolean change) {
        this.change = change;
    }

    public boolean isLocked() {
        return locked;
    }

    void setLocked(boolean locked) {
        this.locked = locked;
    }

    public CoinStatus getStatus() {
        return status;
    }

    void setStatus(CoinStatus status) {
        this.status = status;
    }

    /** Txid of the transaction that spends this coin, null if unspent */
    public String getSpentBy() {
        return spentBy;
    }

    void setSpentBy(String spentBy) {
        this.spentBy = spentBy;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("amount", amount.toFriendlyString())
                .add("status", status)
                .toString();
    }
}
