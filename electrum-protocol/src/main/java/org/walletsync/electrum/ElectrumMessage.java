package org.walletsync.electrum;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * A JSON-RPC request, reply or server notification on an Electrum connection.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ElectrumMessage {
    public static final String JSONRPC_VERSION = "2.0";

    public String jsonrpc;

    public Long id;

    /** RPC method - for calls and notifications */
    public String method;

    /** Parameters - for calls and notifications */
    public List<JsonNode> params;

    /** Result - for replies */
    @JsonProperty("result")
    public JsonNode result;

    /** Error object or string - for failed replies */
    @JsonProperty("error")
    public JsonNode error;

    public ElectrumMessage() {
    }

    @JsonIgnore
    public ElectrumMessage(Long id, String method, List<Object> params, ObjectMapper mapper) {
        this.jsonrpc = JSONRPC_VERSION;
        this.id = id;
        this.method = method;
        this.params = Lists.newArrayList();
        for (Object param : params) {
            this.params.add(mapper.valueToTree(param));
        }
    }

    @JsonIgnore
    public ElectrumMessage(Long id, JsonNode result) {
        this.id = id;
        this.result = result;
    }

    @JsonIgnore
    public boolean isResult() {
        return id != null && result != null && !isError();
    }

    @JsonIgnore
    public boolean isMessage() {
        return id == null && method != null && params != null;
    }

    @JsonIgnore
    public boolean isError() {
        return id != null && error != null && !error.isNull();
    }
}
