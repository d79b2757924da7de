package org.walletsync.chain;

/**
 * Thrown by network-dependent operations while there is no live backend connection.
 */
public class DisconnectedException extends ChainClientException {
    public DisconnectedException() {
        super("not connected to a chain backend");
    }

    public DisconnectedException(String message) {
        super(message);
    }
}
