package org.walletsync.chain;

/**
 * Failure of a chain backend call: transport error, server error reply or timeout.
 */
public class ChainClientException extends Exception {
    public ChainClientException(String message) {
        super(message);
    }

    public ChainClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
