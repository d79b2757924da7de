package org.walletsync.ledger;

/**
 * Lifecycle of a wallet transaction, derived from its height, serialized form and sidecar data.
 */
public enum TransactionStatus {
    PENDING_SIGNATURES,
    READY_TO_BROADCAST,
    PENDING_CONFIRMATION,
    CONFIRMED,
    NETWORK_REJECTED,
    REPLACED
}
