package org.walletsync.wallet;

import org.bitcoinj.core.Address;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;

/**
 * Electrum subscription key of an address: the byte reversed SHA-256 of its output script, hex encoded.
 */
public class Scripthash {
    private Scripthash() {
    }

    public static String of(NetworkParameters params, String address) {
        return of(ScriptBuilder.createOutputScript(Address.fromString(params, address)));
    }

    public static String of(Script script) {
        byte[] hash = Sha256Hash.hash(script.getProgram());
        return Utils.HEX.encode(Utils.reverseBytes(hash));
    }
}
