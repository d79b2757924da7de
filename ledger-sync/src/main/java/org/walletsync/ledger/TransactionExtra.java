package org.walletsync.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Sidecar data of a transaction record, kept apart from the serialized transaction so it can
 * change without touching it. Stored as JSON.
 */
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionExtra {
    private static final ObjectMapper mapper = new ObjectMapper();

    /** Signer key (hex pubkey or fingerprint) to whether it signed */
    @JsonProperty("signers")
    private Map<String, Boolean> signers = Maps.newLinkedHashMap();

    /** User requested outputs, address to satoshis */
    @JsonProperty("outputs")
    private Map<String, Long> outputs = Maps.newLinkedHashMap();

    /** Satoshis per kvB */
    @JsonProperty("fee_rate")
    private long feeRate;

    @JsonProperty("subtract")
    private boolean subtractFeeFromAmount;

    @JsonProperty("replace_txid")
    private String replaceTxId;

    @JsonProperty("replaced_by_txid")
    private String replacedByTxId;

    @JsonProperty("reject_msg")
    private String rejectMessage;

    @JsonProperty("schedule_time")
    private long scheduleTime = -1;

    public Map<String, Boolean> getSigners() {
        return signers;
    }

    public void setSigners(Map<String, Boolean> signers) {
        this.signers = Maps.newLinkedHashMap(signers);
    }

    public Map<String, Long> getOutputs() {
        return outputs;
    }

    public void setOutputs(Map<String, Long> outputs) {
        this.outputs = Maps.newLinkedHashMap(outputs);
    }

    public long getFeeRate() {
        return feeRate;
    }

    public void setFeeRate(long feeRate) {
        this.feeRate = feeRate;
    }

    public boolean isSubtractFeeFromAmount() {
        return subtractFeeFromAmount;
    }

    public void setSubtractFeeFromAmount(boolean subtractFeeFromAmount) {
        this.subtractFeeFromAmount = subtractFeeFromAmount;
    }

    public String getReplaceTxId() {
        return replaceTxId;
    }

    public void setReplaceTxId(String replaceTxId) {
        this.replaceTxId = Strings.emptyToNull(replaceTxId);
    }

    public String getReplacedByTxId() {
        return replacedByTxId;
    }

    public void setReplacedByTxId(String replacedByTxId) {
        this.replacedByTxId = Strings.emptyToNull(replacedByTxId);
    }

    public String getRejectMessage() {
        return rejectMessage;
    }

    public void setRejectMessage(String rejectMessage) {
        this.rejectMessage = Strings.emptyToNull(rejectMessage);
    }

    public long getScheduleTime() {
        return scheduleTime;
    }

    public void setScheduleTime(long scheduleTime) {
        this.scheduleTime = scheduleTime;
    }

    public String toJson() {
        try {
            return mapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw Throwables.propagate(e);
        }
    }

    public static TransactionExtra fromJson(String json) {
        if (Strings.isNullOrEmpty(json))
            return new TransactionExtra();
        try {
            return mapper.readValue(json, TransactionExtra.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("bad transaction extra: " + json, e);
        }
    }

    public TransactionExtra copy() {
        return fromJson(toJson());
    }
}
