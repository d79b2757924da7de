package org.walletsync.electrum;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.bitcoinj.core.Coin;
import org.easymock.EasyMock;
import org.easymock.IMocksControl;
import org.junit.Before;
import org.junit.Test;
import org.walletsync.chain.ChainServerException;
import org.walletsync.chain.HeaderInfo;
import org.walletsync.chain.HeaderListener;
import org.walletsync.chain.HistoryItem;
import org.walletsync.chain.ScripthashListener;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.junit.Assert.*;

public class ElectrumChainClientTest {
    private static final String SH1 = "8b01df4e368ea28f8dc0423bcf7a4923e3a12d307c875e47a0cfbf90b5c39161";
    private static final String SH2 = "2fcd8eb5a2e3c0b4d1d6e2c0a6f7e8d9c0b1a29384756647382910abcdef0123";

    private ObjectMapper mapper;
    private IMocksControl control;
    private ElectrumClient client;

    @Before
    public void setUp() {
        mapper = new ObjectMapper();
        control = EasyMock.createStrictControl();
        client = control.createMock(ElectrumClient.class);
        client.addNotificationListener(anyObject(ElectrumClient.NotificationListener.class));
        expectLastCall();
    }

    private ElectrumChainClient newChainClient(boolean batch) {
        return new ElectrumChainClient(client, "test", 1000, batch);
    }

    private ListenableFuture<ElectrumMessage> reply(JsonNode result) {
        return Futures.immediateFuture(new ElectrumMessage(1L, result));
    }

    private ListenableFuture<ElectrumMessage> errorReply(String message) {
        return Futures.immediateFailedFuture(new ElectrumException(mapper.createObjectNode().put("code", 1).put("message", message)));
    }

    @Test
    public void subscribeWithoutHistory() throws Exception {
        expect(client.call("blockchain.scripthash.subscribe", Lists.<Object>newArrayList(SH1)))
                .andReturn(reply(NullNode.getInstance()));
        expect(client.call("blockchain.scripthash.subscribe", Lists.<Object>newArrayList(SH2)))
                .andReturn(reply(mapper.valueToTree("status2")));
        control.replay();
        ElectrumChainClient chainClient = newChainClient(false);
        assertEquals("", chainClient.subscribeScripthash(SH1));
        assertEquals("status2", chainClient.subscribeScripthash(SH2));
        control.verify();
    }

    @Test
    public void history() throws Exception {
        JsonNode result = mapper.readTree("[{\"tx_hash\":\"aa\",\"height\":100},{\"tx_hash\":\"bb\",\"height\":0,\"fee\":500}]");
        expect(client.call("blockchain.scripthash.get_history", Lists.<Object>newArrayList(SH1)))
                .andReturn(reply(result));
        control.replay();
        List<HistoryItem> history = newChainClient(false).getHistory(SH1);
        assertEquals(ImmutableList.of(new HistoryItem("aa", 100, null), new HistoryItem("bb", 0, 500L)), history);
        assertEquals(0, history.get(0).getFeeOrZero());
        control.verify();
    }

    @Test
    public void batchOmitsRejectedKeys() throws Exception {
        List<List<Object>> params = Lists.newArrayList();
        params.add(Collections.<Object>singletonList(SH1));
        params.add(Collections.<Object>singletonList(SH2));
        List<ListenableFuture<ElectrumMessage>> replies = Lists.newArrayList();
        replies.add(reply(mapper.valueToTree("s1")));
        replies.add(errorReply("unknown scripthash"));
        expect(client.callBatch("blockchain.scripthash.subscribe", params)).andReturn(replies);
        control.replay();
        Map<String, String> statuses = newChainClient(true).subscribeScripthashes(Lists.newArrayList(SH1, SH2, SH1));
        assertEquals(1, statuses.size());
        assertEquals("s1", statuses.get(SH1));
        control.verify();
    }

    @Test
    public void sequentialWithoutBatch() throws Exception {
        expect(client.call("blockchain.transaction.get", (Object) "aa")).andReturn(reply(mapper.valueToTree("01")));
        expect(client.call("blockchain.transaction.get", (Object) "bb")).andReturn(reply(mapper.valueToTree("02")));
        control.replay();
        ElectrumChainClient chainClient = newChainClient(false);
        assertFalse(chainClient.supportsBatch());
        Map<String, String> raws = chainClient.getRawTransactions(Lists.newArrayList("aa", "bb"));
        assertEquals("01", raws.get("aa"));
        assertEquals("02", raws.get("bb"));
        control.verify();
    }

    @Test
    public void feeRates() throws Exception {
        expect(client.call("blockchain.estimatefee", Lists.<Object>newArrayList(2)))
                .andReturn(reply(mapper.valueToTree(0.00012)));
        expect(client.call("blockchain.estimatefee", Lists.<Object>newArrayList(100)))
                .andReturn(reply(mapper.valueToTree(-1)));
        expect(client.call("blockchain.relayfee", Lists.newArrayList()))
                .andReturn(reply(mapper.valueToTree(0.00001)));
        control.replay();
        ElectrumChainClient chainClient = newChainClient(false);
        assertEquals(Coin.valueOf(12000), chainClient.estimateFee(2));
        assertTrue(chainClient.estimateFee(100).isNegative());
        assertEquals(Coin.valueOf(1000), chainClient.relayFee());
        control.verify();
    }

    @Test
    public void broadcastRejected() throws Exception {
        expect(client.call("blockchain.transaction.broadcast", Lists.<Object>newArrayList("00")))
                .andReturn(errorReply("bad-txns-inputs-missingorspent"));
        control.replay();
        try {
            newChainClient(false).broadcast("00");
            fail();
        } catch (ChainServerException e) {
            assertTrue(e.getMessage().contains("bad-txns-inputs-missingorspent"));
        }
        control.verify();
    }

    @Test
    public void notifications() throws Exception {
        expect(client.call("blockchain.headers.subscribe", Lists.newArrayList()))
                .andReturn(reply(mapper.readTree("{\"height\":10,\"hex\":\"00\"}")));
        control.replay();
        ElectrumChainClient chainClient = newChainClient(false);
        final List<HeaderInfo> headers = Lists.newArrayList();
        final List<String> statuses = Lists.newArrayList();
        HeaderInfo tip = chainClient.subscribeHeaders(new HeaderListener() {
            @Override
            public void onHeader(HeaderInfo header) {
                headers.add(header);
            }
        });
        assertEquals(10, tip.height);
        chainClient.addScripthashListener(new ScripthashListener() {
            @Override
            public void onStatusChange(String scripthash, String status) {
                statuses.add(scripthash + "=" + status);
            }
        });

        chainClient.handleNotification(notification("blockchain.headers.subscribe", "[{\"height\":11,\"hex\":\"01\"}]"));
        chainClient.handleNotification(notification("blockchain.scripthash.subscribe", "[\"" + SH1 + "\",null]"));
        chainClient.handleNotification(notification("blockchain.scripthash.subscribe", "[\"" + SH2 + "\",\"abc\"]"));
        chainClient.handleNotification(notification("blockchain.scripthash.subscribe", "[\"" + SH2 + "\"]"));

        assertEquals(1, headers.size());
        assertEquals(11, headers.get(0).height);
        assertEquals(ImmutableList.of(SH1 + "=", SH2 + "=abc"), statuses);
        control.verify();
    }

    @Test
    public void fromBtcPerKb() {
        assertEquals(Coin.valueOf(100000), ElectrumChainClient.toFeeRate(mapper.valueToTree(0.001)));
        assertEquals("", ElectrumChainClient.statusOf(null));
    }

    private ElectrumMessage notification(String method, String params) throws Exception {
        return mapper.readValue("{\"method\":\"" + method + "\",\"params\":" + params + "}", ElectrumMessage.class);
    }
}
