package org.walletsync.electrum;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.walletsync.chain.ChainClient;
import org.walletsync.chain.ChainClientFactory;

import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Creates Electrum clients, starting each new connection attempt at the next server in the list.
 */
public class ElectrumChainClientFactory implements ChainClientFactory {
    private static final Logger log = LoggerFactory.getLogger(ElectrumChainClientFactory.class);

    private final List<InetSocketAddress> servers;
    private final boolean tls;
    private final String clientName;
    private final long callTimeoutMillis;
    private final int pingPeriodSeconds;
    private final boolean batch;
    private final AtomicInteger rotation = new AtomicInteger();

    public ElectrumChainClientFactory(List<InetSocketAddress> servers, boolean tls, String clientName,
                                      long callTimeoutMillis, int pingPeriodSeconds, boolean batch) {
        checkArgument(!servers.isEmpty(), "no servers");
        this.servers = ImmutableList.copyOf(servers);
        this.tls = tls;
        this.clientName = clientName;
        this.callTimeoutMillis = callTimeoutMillis;
        this.pingPeriodSeconds = pingPeriodSeconds;
        this.batch = batch;
    }

    @Override
    public ChainClient create() {
        List<InetSocketAddress> order = Lists.newArrayList(servers);
        Collections.rotate(order, -(rotation.getAndIncrement() % order.size()));
        log.info("new electrum client, first server {}", order.get(0));
        ElectrumClient client = new ElectrumClient(order, tls, pingPeriodSeconds);
        return new ElectrumChainClient(client, clientName, callTimeoutMillis, batch);
    }
}
