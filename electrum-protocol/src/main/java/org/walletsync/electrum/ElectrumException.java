package org.walletsync.electrum;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An error reply from the server.
 */
public class ElectrumException extends RuntimeException {
    private final int code;

    public ElectrumException(JsonNode error) {
        super(messageOf(error));
        this.code = error.isObject() && error.has("code") ? error.get("code").asInt() : 0;
    }

    public int getCode() {
        return code;
    }

    private static String messageOf(JsonNode error) {
        if (error.isObject() && error.has("message"))
            return error.get("message").asText();
        return error.isTextual() ? error.asText() : error.toString();
    }
}
