package org.walletsync.chain;

public interface ScripthashListener {
    /**
     * @param status the new status hash, empty if the scripthash has no history
     */
    void onStatusChange(String scripthash, String status);
}
