package org.walletsync.electrum;

import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import org.bitcoinj.core.NetworkParameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Default server lists, one {@code host:port} per line in a classpath resource.
 */
public class ElectrumServers {
    public static final String MAINNET_LIST = "electrum-servers";
    public static final String TESTNET_LIST = "electrum-servers-testnet";
    public static final String REGTEST_LIST = "electrum-servers-regtest";

    private ElectrumServers() {
    }

    public static String listName(NetworkParameters params) {
        String id = params.getId();
        if (id.equals(NetworkParameters.ID_MAINNET))
            return MAINNET_LIST;
        if (id.equals(NetworkParameters.ID_REGTEST))
            return REGTEST_LIST;
        return TESTNET_LIST;
    }

    public static List<InetSocketAddress> defaultServers(NetworkParameters params) {
        String listName = listName(params);
        ClassLoader classloader = Thread.currentThread().getContextClassLoader();
        InputStream stream = classloader.getResourceAsStream(listName);
        checkState(stream != null, "missing server list %s", listName);
        List<InetSocketAddress> addresses = Lists.newArrayList();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#"))
                    continue;
                addresses.add(parse(line));
            }
        } catch (IOException e) {
            throw Throwables.propagate(e);
        }
        return addresses;
    }

    /** Parse {@code host:port} without resolving the host */
    public static InetSocketAddress parse(String hostPort) {
        int colon = hostPort.lastIndexOf(':');
        checkArgument(colon > 0 && colon < hostPort.length() - 1, "expected host:port, got %s", hostPort);
        String host = hostPort.substring(0, colon);
        int port = Integer.parseInt(hostPort.substring(colon + 1));
        return InetSocketAddress.createUnresolved(host, port);
    }
}
