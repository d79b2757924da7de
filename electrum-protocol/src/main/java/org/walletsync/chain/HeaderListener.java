package org.walletsync.chain;

public interface HeaderListener {
    void onHeader(HeaderInfo header);
}
