package org.walletsync.sync;

public enum ConnectionStatus {
    OFFLINE,
    SYNCING,
    ONLINE
}
