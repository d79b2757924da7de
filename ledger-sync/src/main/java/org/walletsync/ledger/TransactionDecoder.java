package org.walletsync.ledger;

import com.google.common.collect.Lists;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionOutput;
import org.bitcoinj.core.Utils;
import org.bitcoinj.script.ScriptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Decodes the serialized form of a record, raw hex or base64 PSBT, and derives its status.
 */
public class TransactionDecoder {
    private static final Logger log = LoggerFactory.getLogger(TransactionDecoder.class);

    private final NetworkParameters params;
    private final PsbtParser psbtParser;

    public TransactionDecoder(NetworkParameters params) {
        this.params = params;
        this.psbtParser = new PsbtParser(params);
    }

    public NetworkParameters getParams() {
        return params;
    }

    public Transaction decode(String serialized) {
        if (PsbtParser.isPsbt(serialized))
            return psbtParser.parse(serialized).getUnsignedTx();
        return new Transaction(params, Utils.HEX.decode(serialized));
    }

    public Transaction decode(TransactionRecord record) {
        return decode(record.getSerialized());
    }

    public PsbtParser.Psbt parsePsbt(String base64) {
        return psbtParser.parse(base64);
    }

    public String txIdOf(String serialized) {
        return decode(serialized).getTxId().toString();
    }

    /**
     * @param requiredSignatures signatures needed per input before a PSBT can be broadcast
     */
    public TransactionStatus statusOf(TransactionRecord record, int requiredSignatures) {
        int height = record.getHeight();
        if (height == TransactionRecord.HEIGHT_REJECTED)
            return TransactionStatus.NETWORK_REJECTED;
        if (height == TransactionRecord.HEIGHT_LOCAL) {
            if (!PsbtParser.isPsbt(record.getSerialized()))
                return TransactionStatus.READY_TO_BROADCAST;
            PsbtParser.Psbt psbt = psbtParser.parse(record.getSerialized());
            return psbt.isFullySigned(requiredSignatures)
                    ? TransactionStatus.READY_TO_BROADCAST
                    : TransactionStatus.PENDING_SIGNATURES;
        }
        if (height <= TransactionRecord.HEIGHT_PENDING)
            return record.getExtra().getReplacedByTxId() != null
                    ? TransactionStatus.REPLACED
                    : TransactionStatus.PENDING_CONFIRMATION;
        return TransactionStatus.CONFIRMED;
    }

    /** @return the address paid by the output, or null for scripts without one */
    @Nullable
    public String addressOf(TransactionOutput output) {
        try {
            return output.getScriptPubKey().getToAddress(params).toString();
        } catch (ScriptException | IllegalArgumentException e) {
            // Just means we didn't understand the output script
            log.debug("no address for output {}: {}", output.getIndex(), e.toString());
            return null;
        }
    }

    public List<String> outputAddresses(Transaction tx) {
        List<String> addresses = Lists.newArrayList();
        for (TransactionOutput output : tx.getOutputs()) {
            String address = addressOf(output);
            if (address != null)
                addresses.add(address);
        }
        return addresses;
    }
}
