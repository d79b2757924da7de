package org.walletsync.chain;

/**
 * Builds a fresh, unconnected client for each connection attempt.
 */
public interface ChainClientFactory {
    ChainClient create() throws ChainClientException;
}
