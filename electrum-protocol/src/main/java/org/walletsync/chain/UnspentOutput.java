package org.walletsync.chain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class UnspentOutput {
    @JsonProperty("tx_hash")
    public String txHash;

    @JsonProperty("tx_pos")
    public int vout;

    @JsonProperty("height")
    public int height;

    /** Amount in satoshis */
    @JsonProperty("value")
    public long value;

    public UnspentOutput() {
    }

    public UnspentOutput(String txHash, int vout, int height, long value) {
        this.txHash = txHash;
        this.vout = vout;
        this.height = height;
        this.value = value;
    }

    @Override
    public String toString() {
        return txHash + ":" + vout + "=" + value;
    }
}
