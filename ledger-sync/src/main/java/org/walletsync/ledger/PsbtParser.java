package org.walletsync.ledger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.BaseEncoding;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.ProtocolException;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.Utils;
import org.bitcoinj.core.VarInt;

import java.util.Arrays;
import java.util.List;

/**
 * Reads the parts of a BIP-174 partially signed transaction needed to track signing progress:
 * the unsigned transaction and, per input, the partial signatures and whether it is finalized.
 */
public class PsbtParser {
    public static final String BASE64_PREFIX = "cHNidP8";
    private static final byte[] MAGIC = {0x70, 0x73, 0x62, 0x74, (byte) 0xff};
    private static final int GLOBAL_UNSIGNED_TX = 0x00;
    private static final int IN_PARTIAL_SIG = 0x02;
    private static final int IN_FINAL_SCRIPTSIG = 0x07;
    private static final int IN_FINAL_SCRIPTWITNESS = 0x08;

    private final NetworkParameters params;

    public PsbtParser(NetworkParameters params) {
        this.params = params;
    }

    public static boolean isPsbt(String serialized) {
        return serialized.startsWith(BASE64_PREFIX);
    }

    public static class InputSignatures {
        private final List<String> signers;
        private final boolean finalized;

        InputSignatures(List<String> signers, boolean finalized) {
            this.signers = ImmutableList.copyOf(signers);
            this.finalized = finalized;
        }

        /** Hex pubkeys that provided a partial signature */
        public List<String> getSigners() {
            return signers;
        }

        public boolean isFinalized() {
            return finalized;
        }

        public boolean isSigned(int requiredSignatures) {
            return finalized || signers.size() >= requiredSignatures;
        }
    }

    public static class Psbt {
        private final Transaction unsignedTx;
        private final List<InputSignatures> inputs;

        Psbt(Transaction unsignedTx, List<InputSignatures> inputs) {
            this.unsignedTx = unsignedTx;
            this.inputs = ImmutableList.copyOf(inputs);
        }

        public Transaction getUnsignedTx() {
            return unsignedTx;
        }

        public List<InputSignatures> getInputs() {
            return inputs;
        }

        public boolean isFullySigned(int requiredSignatures) {
            for (InputSignatures input : inputs) {
                if (!input.isSigned(requiredSignatures))
                    return false;
            }
            return !inputs.isEmpty();
        }
    }

    public Psbt parse(String base64) {
        byte[] bytes;
        try {
            bytes = BaseEncoding.base64().decode(base64.trim());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("PSBT is not valid base64");
        }
        if (bytes.length < MAGIC.length || !Arrays.equals(Arrays.copyOf(bytes, MAGIC.length), MAGIC))
            throw new ProtocolException("missing PSBT magic");
        Cursor cursor = new Cursor(bytes, MAGIC.length);

        Transaction tx = null;
        while (true) {
            byte[] key = cursor.readKey();
            if (key == null)
                break;
            byte[] value = cursor.readBytes();
            if ((key[0] & 0xff) == GLOBAL_UNSIGNED_TX)
                tx = new Transaction(params, value);
        }
        if (tx == null)
            throw new ProtocolException("PSBT has no unsigned transaction");

        List<InputSignatures> inputs = Lists.newArrayList();
        for (int i = 0; i < tx.getInputs().size(); i++) {
            List<String> signers = Lists.newArrayList();
            boolean finalized = false;
            while (true) {
                byte[] key = cursor.readKey();
                if (key == null)
                    break;
                cursor.readBytes();
                int type = key[0] & 0xff;
                if (type == IN_PARTIAL_SIG)
                    signers.add(Utils.HEX.encode(Arrays.copyOfRange(key, 1, key.length)));
                else if (type == IN_FINAL_SCRIPTSIG || type == IN_FINAL_SCRIPTWITNESS)
                    finalized = true;
            }
            inputs.add(new InputSignatures(signers, finalized));
        }
        return new Psbt(tx, inputs);
    }

    private static class Cursor {
        private final byte[] bytes;
        private int offset;

        Cursor(byte[] bytes, int offset) {
            this.bytes = bytes;
            this.offset = offset;
        }

        /** @return the key, or null at a map separator */
        byte[] readKey() {
            byte[] key = readBytes();
            return key.length == 0 ? null : key;
        }

        byte[] readBytes() {
            if (offset >= bytes.length)
                throw new ProtocolException("truncated PSBT");
            VarInt length = new VarInt(bytes, offset);
            offset += length.getOriginalSizeInBytes();
            long size = length.value;
            if (size < 0 || offset + size > bytes.length)
                throw new ProtocolException("truncated PSBT");
            byte[] result = Arrays.copyOfRange(bytes, offset, offset + (int) size);
            offset += (int) size;
            return result;
        }
    }
}
