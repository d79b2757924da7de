package org.walletsync.electrum;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.collect.Lists;
import org.junit.Test;

import static org.junit.Assert.*;

public class ElectrumMessageTest {
    ObjectMapper mapper = new ObjectMapper();

    @Test
    public void deserialize() throws Exception {
        ElectrumMessage m1 = readValue("{\"id\":123, \"method\":\"a.b\", \"params\":[1, \"x\", null]}");
        assertEquals(123L, (long) m1.id);
        assertEquals("a.b", m1.method);
        assertEquals(Lists.newArrayList(new IntNode(1), new TextNode("x"), NullNode.getInstance()), m1.params);
        ElectrumMessage m2 = readValue("{\"jsonrpc\":\"2.0\", \"id\":123, \"result\":{\"x\": 123}}");
        assertTrue(m2.isResult());
        assertFalse(m2.isMessage());
        assertEquals(mapper.createObjectNode().put("x", 123), m2.result);

        ElectrumMessage m3 = readValue("{\"id\":124, \"result\":[\"x\"], \"extra\":1}");
        assertEquals(124L, (long) m3.id);
        //noinspection AssertEqualsBetweenInconvertibleTypes
        assertEquals(mapper.createArrayNode().add("x"), m3.result);
    }

    @Test
    public void notification() throws Exception {
        ElectrumMessage m = readValue("{\"jsonrpc\":\"2.0\", \"method\":\"blockchain.scripthash.subscribe\", \"params\":[\"ab\", \"cd\"]}");
        assertTrue(m.isMessage());
        assertFalse(m.isResult());
        assertFalse(m.isError());
    }

    @Test
    public void error() throws Exception {
        ElectrumMessage m = readValue("{\"id\":5, \"error\":{\"code\":1, \"message\":\"bad tx\"}}");
        assertTrue(m.isError());
        assertFalse(m.isResult());
        ElectrumException e = new ElectrumException(m.error);
        assertEquals(1, e.getCode());
        assertEquals("bad tx", e.getMessage());

        ElectrumMessage nullError = readValue("{\"id\":6, \"result\":\"ok\", \"error\":null}");
        assertFalse(nullError.isError());
        assertTrue(nullError.isResult());
    }

    @Test
    public void serializeRequest() throws JsonProcessingException {
        ElectrumMessage m = new ElectrumMessage(7L, "server.version", Lists.<Object>newArrayList("me", "1.4"), mapper);
        JsonNode node = mapper.readTree(mapper.writeValueAsString(m));
        assertEquals("2.0", node.get("jsonrpc").asText());
        assertEquals(7, node.get("id").asInt());
        assertEquals("server.version", node.get("method").asText());
        assertEquals(mapper.createArrayNode().add("me").add("1.4"), node.get("params"));
        assertFalse(node.has("result"));
        assertFalse(node.has("error"));
    }

    @Test
    public void serializeLineFeed() throws JsonProcessingException {
        assertEquals("[123]", mapper.writeValueAsString(new Integer[]{123}));
    }

    private ElectrumMessage readValue(String content) throws java.io.IOException {
        return mapper.readValue(content, ElectrumMessage.class);
    }
}
