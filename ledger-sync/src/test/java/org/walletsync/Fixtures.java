package org.walletsync;

import com.google.common.io.BaseEncoding;
import org.bitcoinj.core.Address;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionOutput;
import org.bitcoinj.core.Utils;
import org.bitcoinj.core.VarInt;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.script.ScriptBuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * Wallets, transactions, PSBTs and headers for tests, all on regtest.
 */
public class Fixtures {
    public static final NetworkParameters PARAMS = RegTestParams.get();

    private Fixtures() {
    }

    /** Account xpub of a fixed test seed */
    public static String xpub(int account) {
        byte[] seed = new byte[32];
        Arrays.fill(seed, (byte) 7);
        DeterministicKey master = HDKeyDerivation.createMasterPrivateKey(seed);
        DeterministicKey key = HDKeyDerivation.deriveChildKey(master, new ChildNumber(account, true));
        return key.serializePubB58(PARAMS);
    }

    /** Pays {@code value} to {@code address} from an outpoint of no wallet */
    public static Transaction fund(String address, Coin value, int nonce) {
        Transaction tx = new Transaction(PARAMS);
        tx.addInput(Sha256Hash.of(("funding" + nonce).getBytes()), 0, ScriptBuilder.createEmpty());
        tx.addOutput(value, Address.fromString(PARAMS, address));
        return tx;
    }

    /** Spends {@code from}, paying {@code value} to {@code address} */
    public static Transaction spend(TransactionOutput from, String address, Coin value) {
        Transaction tx = new Transaction(PARAMS);
        tx.addInput(from);
        tx.addOutput(value, Address.fromString(PARAMS, address));
        return tx;
    }

    public static String hex(Transaction tx) {
        return Utils.HEX.encode(tx.bitcoinSerialize());
    }

    /** An 80 byte header carrying only a timestamp */
    public static String header(long time) {
        byte[] header = new byte[80];
        Utils.uint32ToByteArrayLE(time, header, 68);
        return Utils.HEX.encode(header);
    }

    /**
     * A base64 PSBT over the unsigned form of {@code tx}.
     *
     * @param signatures partial signatures per input, -1 for a finalized input
     */
    public static String psbt(Transaction tx, int... signatures) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.write(new byte[]{0x70, 0x73, 0x62, 0x74, (byte) 0xff});
            writePair(out, new byte[]{0x00}, tx.bitcoinSerialize());
            out.write(0);
            for (int i = 0; i < tx.getInputs().size(); i++) {
                int count = i < signatures.length ? signatures[i] : 0;
                if (count < 0) {
                    writePair(out, new byte[]{0x08}, new byte[]{0x01, 0x00});
                }
                for (int s = 0; s < count; s++) {
                    byte[] key = new byte[34];
                    key[0] = 0x02;
                    key[1] = 0x03;
                    key[2] = (byte) (s + 1);
                    writePair(out, key, new byte[]{0x30, 0x01});
                }
                out.write(0);
            }
            for (int i = 0; i < tx.getOutputs().size(); i++) {
                out.write(0);
            }
            return BaseEncoding.base64().encode(out.toByteArray());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static void writePair(ByteArrayOutputStream out, byte[] key, byte[] value) throws IOException {
        out.write(new VarInt(key.length).encode());
        out.write(key);
        out.write(new VarInt(value.length).encode());
        out.write(value);
    }
}
