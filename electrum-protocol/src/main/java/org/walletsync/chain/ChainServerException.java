package org.walletsync.chain;

/**
 * The backend answered the call with an error, for example a rejected broadcast. The
 * connection itself is still usable.
 */
public class ChainServerException extends ChainClientException {
    public ChainServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
