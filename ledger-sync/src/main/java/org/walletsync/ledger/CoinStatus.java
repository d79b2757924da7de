package org.walletsync.ledger;

/**
 * Status of a wallet coin. Declaration order is significant: when several transactions
 * reference a coin, the coin takes the greatest status among them.
 */
public enum CoinStatus {
    INCOMING_PENDING_CONFIRMATION,
    CONFIRMED,
    OUTGOING_PENDING_SIGNATURES,
    OUTGOING_PENDING_BROADCAST,
    OUTGOING_PENDING_CONFIRMATION,
    SPENT;

    public static CoinStatus max(CoinStatus a, CoinStatus b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** Status of a coin spent by a transaction in the given state, null if the spend does not count */
    public static CoinStatus spentBy(TransactionStatus status) {
        switch (status) {
            case CONFIRMED:
                return SPENT;
            case PENDING_CONFIRMATION:
                return OUTGOING_PENDING_CONFIRMATION;
            case READY_TO_BROADCAST:
                return OUTGOING_PENDING_BROADCAST;
            case PENDING_SIGNATURES:
                return OUTGOING_PENDING_SIGNATURES;
            default:
                return null;
        }
    }
}
