package org.walletsync.ledger;

import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ProtocolException;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionOutput;
import org.bitcoinj.script.ScriptBuilder;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.Fixtures;
import org.walletsync.wallet.WalletInfo;
import org.walletsync.wallet.XpubAddressDeriver;

import static org.junit.Assert.*;
import static org.walletsync.Fixtures.PARAMS;

public class TransactionDecoderTest {
    private TransactionDecoder decoder;
    private String address;
    private Transaction funding;
    private Transaction spend;

    @Before
    public void setUp() {
        decoder = new TransactionDecoder(PARAMS);
        WalletInfo wallet = new WalletInfo("w", "test", Fixtures.xpub(0));
        address = new XpubAddressDeriver(PARAMS).deriveAddress(wallet, false, 0);
        funding = Fixtures.fund(address, Coin.COIN, 1);
        spend = new Transaction(PARAMS);
        spend.addInput(funding.getOutput(0));
        spend.addInput(Fixtures.fund(address, Coin.CENT, 2).getOutput(0));
        spend.addOutput(Coin.valueOf(90000000), funding.getOutput(0).getScriptPubKey());
    }

    private TransactionRecord record(String serialized, int height) {
        return new TransactionRecord(decoder.txIdOf(serialized), serialized, height);
    }

    @Test
    public void decodesRawAndPsbt() {
        assertEquals(funding.getTxId(), decoder.decode(Fixtures.hex(funding)).getTxId());
        String psbt = Fixtures.psbt(spend, 1, 1);
        assertTrue(PsbtParser.isPsbt(psbt));
        assertEquals(spend.getTxId().toString(), decoder.txIdOf(psbt));
    }

    @Test
    public void psbtSignatures() {
        PsbtParser.Psbt psbt = decoder.parsePsbt(Fixtures.psbt(spend, 2, -1));
        assertEquals(2, psbt.getInputs().size());
        assertEquals(2, psbt.getInputs().get(0).getSigners().size());
        assertFalse(psbt.getInputs().get(0).isFinalized());
        assertTrue(psbt.getInputs().get(1).isFinalized());
        assertTrue(psbt.isFullySigned(2));
        assertFalse(psbt.isFullySigned(3));
    }

    @Test(expected = ProtocolException.class)
    public void truncatedPsbt() {
        String psbt = Fixtures.psbt(spend, 1, 1);
        decoder.parsePsbt(psbt.substring(0, 40));
    }

    @Test
    public void status() {
        String raw = Fixtures.hex(funding);
        assertEquals(TransactionStatus.NETWORK_REJECTED, decoder.statusOf(record(raw, -2), 1));
        assertEquals(TransactionStatus.READY_TO_BROADCAST, decoder.statusOf(record(raw, -1), 1));
        assertEquals(TransactionStatus.PENDING_CONFIRMATION, decoder.statusOf(record(raw, 0), 1));
        assertEquals(TransactionStatus.CONFIRMED, decoder.statusOf(record(raw, 700000), 1));

        TransactionRecord replaced = record(raw, 0);
        replaced.getExtra().setReplacedByTxId("ff");
        assertEquals(TransactionStatus.REPLACED, decoder.statusOf(replaced, 1));
    }

    @Test
    public void psbtStatusCountsSignatures() {
        assertEquals(TransactionStatus.PENDING_SIGNATURES, decoder.statusOf(record(Fixtures.psbt(spend, 1, 1), -1), 2));
        assertEquals(TransactionStatus.PENDING_SIGNATURES, decoder.statusOf(record(Fixtures.psbt(spend, 2, 1), -1), 2));
        assertEquals(TransactionStatus.READY_TO_BROADCAST, decoder.statusOf(record(Fixtures.psbt(spend, 2, 2), -1), 2));
        assertEquals(TransactionStatus.READY_TO_BROADCAST, decoder.statusOf(record(Fixtures.psbt(spend, -1, 1), -1), 1));
    }

    @Test
    public void outputAddresses() {
        Transaction tx = Fixtures.fund(address, Coin.COIN, 3);
        TransactionOutput opReturn = tx.addOutput(Coin.ZERO, ScriptBuilder.createOpReturnScript(new byte[]{1, 2, 3, 4}));
        assertNull(decoder.addressOf(opReturn));
        assertEquals(1, decoder.outputAddresses(tx).size());
        assertEquals(address, decoder.outputAddresses(tx).get(0));
    }
}
