package org.walletsync.store;

/**
 * Stored address status: {@code "<utxo json>|<status>"}. Only the part after the first
 * {@code |} is compared against the backend status.
 */
public class AddressStatus {
    public static final char SEPARATOR = '|';

    private AddressStatus() {
    }

    public static String encode(String utxoJson, String status) {
        return utxoJson + SEPARATOR + status;
    }

    /** @return the status part, empty if there is none */
    public static String statusOf(String encoded) {
        if (encoded == null)
            return "";
        int separator = encoded.indexOf(SEPARATOR);
        return separator < 0 ? "" : encoded.substring(separator + 1);
    }
}
