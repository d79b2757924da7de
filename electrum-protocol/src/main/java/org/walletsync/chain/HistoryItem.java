package org.walletsync.chain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;

/**
 * One entry of a scripthash history. Height is 0 (or negative, for mempool transactions with
 * unconfirmed parents) while unconfirmed. The fee is only reported for mempool entries.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryItem {
    @JsonProperty("tx_hash")
    public String txHash;

    @JsonProperty("height")
    public int height;

    @JsonProperty("fee")
    public Long fee;

    public HistoryItem() {
    }

    public HistoryItem(String txHash, int height, Long fee) {
        this.txHash = txHash;
        this.height = height;
        this.fee = fee;
    }

    public long getFeeOrZero() {
        return fee != null ? fee : 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof HistoryItem))
            return false;
        HistoryItem o = (HistoryItem) obj;
        return Objects.equal(txHash, o.txHash) && height == o.height && Objects.equal(fee, o.fee);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(txHash, height, fee);
    }

    @Override
    public String toString() {
        return txHash + "@" + height;
    }
}
