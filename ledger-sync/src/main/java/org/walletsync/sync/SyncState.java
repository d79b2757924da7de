package org.walletsync.sync;

/**
 * Connection state of a {@link Synchronizer}. {@link #STOPPED} is terminal.
 */
public enum SyncState {
    UNINITIALIZED,
    CONNECTING,
    SYNCING,
    READY,
    STOPPED;

    /** Network dependent operations are only allowed in these states */
    public boolean isConnected() {
        return this == SYNCING || this == READY;
    }
}
