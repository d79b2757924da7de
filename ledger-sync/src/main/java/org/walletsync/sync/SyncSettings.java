package org.walletsync.sync;

import com.google.common.collect.ImmutableList;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.NetworkParameters;
import org.walletsync.chain.ChainClientFactory;
import org.walletsync.electrum.ElectrumChainClientFactory;
import org.walletsync.electrum.ElectrumServers;

import java.net.InetSocketAddress;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Synchronizer configuration. Every setting has a default; setters chain.
 */
public class SyncSettings {
    public static final long RECONNECT_DELAY_MILLIS = 3000;
    public static final long REQUEST_PACING_MILLIS = 50;
    public static final long CALL_TIMEOUT_MILLIS = 30000;
    public static final int PING_PERIOD_SECONDS = 60;
    public static final Coin FALLBACK_RELAY_FEE = Coin.valueOf(1000);
    public static final String CLIENT_NAME = "wallet-sync";

    private final NetworkParameters params;
    private List<InetSocketAddress> servers;
    private boolean tls = true;
    private boolean batchRequests = true;
    private long reconnectDelayMillis = RECONNECT_DELAY_MILLIS;
    private long requestPacingMillis = REQUEST_PACING_MILLIS;
    private long callTimeoutMillis = CALL_TIMEOUT_MILLIS;
    private int pingPeriodSeconds = PING_PERIOD_SECONDS;
    private Coin fallbackRelayFee = FALLBACK_RELAY_FEE;
    private String clientName = CLIENT_NAME;

    public SyncSettings(NetworkParameters params) {
        this.params = params;
    }

    public NetworkParameters getParams() {
        return params;
    }

    /** Configured servers, or the bundled list for the network */
    public List<InetSocketAddress> getServers() {
        if (servers == null)
            servers = ElectrumServers.defaultServers(params);
        return servers;
    }

    public SyncSettings setServers(List<InetSocketAddress> servers) {
        checkArgument(!servers.isEmpty(), "no servers");
        this.servers = ImmutableList.copyOf(servers);
        return this;
    }

    public boolean isTls() {
        return tls;
    }

    public SyncSettings setTls(boolean tls) {
        this.tls = tls;
        return this;
    }

    public boolean isBatchRequests() {
        return batchRequests;
    }

    public SyncSettings setBatchRequests(boolean batchRequests) {
        this.batchRequests = batchRequests;
        return this;
    }

    public long getReconnectDelayMillis() {
        return reconnectDelayMillis;
    }

    public SyncSettings setReconnectDelayMillis(long reconnectDelayMillis) {
        checkArgument(reconnectDelayMillis >= 0);
        this.reconnectDelayMillis = reconnectDelayMillis;
        return this;
    }

    public long getRequestPacingMillis() {
        return requestPacingMillis;
    }

    public SyncSettings setRequestPacingMillis(long requestPacingMillis) {
        checkArgument(requestPacingMillis >= 0);
        this.requestPacingMillis = requestPacingMillis;
        return this;
    }

    public long getCallTimeoutMillis() {
        return callTimeoutMillis;
    }

    public SyncSettings setCallTimeoutMillis(long callTimeoutMillis) {
        checkArgument(callTimeoutMillis > 0);
        this.callTimeoutMillis = callTimeoutMillis;
        return this;
    }

    public int getPingPeriodSeconds() {
        return pingPeriodSeconds;
    }

    public SyncSettings setPingPeriodSeconds(int pingPeriodSeconds) {
        checkArgument(pingPeriodSeconds > 0);
        this.pingPeriodSeconds = pingPeriodSeconds;
        return this;
    }

    /** Relay fee rate per kvB reported while disconnected */
    public Coin getFallbackRelayFee() {
        return fallbackRelayFee;
    }

    public SyncSettings setFallbackRelayFee(Coin fallbackRelayFee) {
        this.fallbackRelayFee = fallbackRelayFee;
        return this;
    }

    public String getClientName() {
        return clientName;
    }

    public SyncSettings setClientName(String clientName) {
        this.clientName = clientName;
        return this;
    }

    public ChainClientFactory newElectrumClientFactory() {
        return new ElectrumChainClientFactory(getServers(), tls, clientName, callTimeoutMillis,
                pingPeriodSeconds, batchRequests);
    }
}
