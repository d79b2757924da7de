package org.walletsync.ledger;

/**
 * Which addresses belong to a wallet, and which of those are change.
 */
public interface AddressBook {
    boolean isMine(String address);

    boolean isChange(String address);
}
