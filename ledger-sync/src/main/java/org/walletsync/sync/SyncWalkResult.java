package org.walletsync.sync;

import com.google.common.base.Optional;

/**
 * Outcome of one sync walk over all wallets.
 */
public class SyncWalkResult {
    public enum Outcome {
        COMPLETED,
        /** The state left SYNCING/READY during the walk */
        ABORTED,
        FAILED
    }

    private final Outcome outcome;
    private final Throwable cause;
    private final int walletsSynced;

    private SyncWalkResult(Outcome outcome, Throwable cause, int walletsSynced) {
        this.outcome = outcome;
        this.cause = cause;
        this.walletsSynced = walletsSynced;
    }

    public static SyncWalkResult completed(int walletsSynced) {
        return new SyncWalkResult(Outcome.COMPLETED, null, walletsSynced);
    }

    public static SyncWalkResult aborted(int walletsSynced) {
        return new SyncWalkResult(Outcome.ABORTED, null, walletsSynced);
    }

    public static SyncWalkResult failed(Throwable cause, int walletsSynced) {
        return new SyncWalkResult(Outcome.FAILED, cause, walletsSynced);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Optional<Throwable> getCause() {
        return Optional.fromNullable(cause);
    }

    public int getWalletsSynced() {
        return walletsSynced;
    }

    @Override
    public String toString() {
        return outcome + " after " + walletsSynced + " wallets" + (cause != null ? ": " + cause : "");
    }
}
