package org.walletsync.chain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.bitcoinj.core.Block;
import org.bitcoinj.core.Utils;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A block header at a height, as reported by a chain tip subscription.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HeaderInfo {
    private static final int TIMESTAMP_OFFSET = 68;

    @JsonProperty("height")
    public int height;

    @JsonProperty("hex")
    public String hex;

    public HeaderInfo() {
    }

    public HeaderInfo(int height, String hex) {
        this.height = height;
        this.hex = hex;
    }

    @JsonIgnore
    public long getTime() {
        return timestampOf(hex);
    }

    /** Block time in seconds, read from a hex encoded 80 byte header */
    public static long timestampOf(String headerHex) {
        byte[] bytes = Utils.HEX.decode(headerHex);
        checkArgument(bytes.length >= Block.HEADER_SIZE, "short block header: %s bytes", bytes.length);
        return Utils.readUint32(bytes, TIMESTAMP_OFFSET);
    }

    @Override
    public String toString() {
        return "HeaderInfo{" + height + "}";
    }
}
