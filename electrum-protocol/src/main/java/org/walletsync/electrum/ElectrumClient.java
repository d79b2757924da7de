package org.walletsync.electrum;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.AbstractExecutionThreadService;
import com.google.common.util.concurrent.CycleDetectingLockFactory;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import javax.net.SocketFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Newline delimited JSON-RPC connection to one Electrum server.
 *
 * <p>{@link #startUp()} opens the socket, trying each configured server in turn. The service
 * thread then reads replies and notifications until the socket closes, at which point the
 * service terminates. A new client is needed for the next connection.</p>
 */
public class ElectrumClient extends AbstractExecutionThreadService {
    public static final int PING_PERIOD = 60;
    public static final int CONNECT_TIMEOUT_MILLIS = 10000;
    public static final String SERVER_PING = "server.ping";
    protected static Logger logger = LoggerFactory.getLogger("ElectrumClient");
    private static CycleDetectingLockFactory lockFactory = CycleDetectingLockFactory.newInstance(CycleDetectingLockFactory.Policies.DISABLED);
    protected final ObjectMapper mapper;
    private final ConcurrentMap<Long, PendingCall> calls;
    private final ReentrantLock lock;
    private final CopyOnWriteArrayList<NotificationListener> notificationListeners;
    private final List<InetSocketAddress> serverAddresses;
    private final boolean isTls;
    private final int pingPeriod;
    private final AtomicLong currentId;

    protected Socket socket;
    protected OutputStream outputStream;
    protected BufferedReader reader;
    private Pinger pinger;
    private InetSocketAddress connectedAddress;

    @GuardedBy("ElectrumClient-stream")
    private boolean isConnected;

    /** Receives server initiated messages, on the reader thread */
    public interface NotificationListener {
        void onNotification(ElectrumMessage message);
    }

    static class PendingCall {
        final ElectrumMessage message;
        final SettableFuture<ElectrumMessage> future;

        PendingCall(ElectrumMessage message, SettableFuture<ElectrumMessage> future) {
            this.message = message;
            this.future = future;
        }
    }

    static ThreadFactory threadFactory =
            new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
                        @Override
                        public void uncaughtException(Thread t, Throwable e) {
                            logger.error("uncaught exception", e);
                        }
                    }).build();
    static ThreadFactory pingerThreadFactory =
            new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("pinger-%d")
                    .setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
                        @Override
                        public void uncaughtException(Thread t, Throwable e) {
                            logger.error("uncaught exception", e);
                        }
                    }).build();

    public ElectrumClient(List<InetSocketAddress> addresses, boolean isTls) {
        this(addresses, isTls, PING_PERIOD);
    }

    public ElectrumClient(List<InetSocketAddress> addresses, boolean isTls, int pingPeriod) {
        checkArgument(!addresses.isEmpty(), "no servers");
        serverAddresses = ImmutableList.copyOf(addresses);
        this.isTls = isTls;
        this.pingPeriod = pingPeriod;
        mapper = new ObjectMapper();
        currentId = new AtomicLong(1000);
        calls = Maps.newConcurrentMap();
        lock = lockFactory.newReentrantLock("ElectrumClient-stream");
        notificationListeners = new CopyOnWriteArrayList<>();
    }

    public void addNotificationListener(NotificationListener listener) {
        notificationListeners.add(listener);
    }

    public InetSocketAddress getConnectedAddress() {
        return connectedAddress;
    }

    @Override
    protected String serviceName() {
        return "electrum-client";
    }

    @Override
    protected Executor executor() {
        return makeExecutor(serviceName());
    }

    private static Executor makeExecutor(final String name) {
        return new Executor() {
            @Override
            public void execute(Runnable command) {
                Thread thread = threadFactory.newThread(command);
                try {
                    thread.setName(name);
                } catch (SecurityException e) {
                    // OK if we can't set the name in this environment.
                }
                thread.start();
            }
        };
    }

    static class TrustAllX509TrustManager implements X509TrustManager {
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }

        public void checkClientTrusted(X509Certificate[] certs, String authType) {
        }

        public void checkServerTrusted(X509Certificate[] certs, String authType) {
        }
    }

    protected Socket createSocket() throws IOException {
        if (isTls) {
            try {
                SSLContext sc = SSLContext.getInstance("TLS");
                sc.init(null, new TrustManager[]{new TrustAllX509TrustManager()}, new SecureRandom());
                SocketFactory factory = sc.getSocketFactory();
                return factory.createSocket();
            } catch (NoSuchAlgorithmException | KeyManagementException e) {
                throw new IOException("TLS unavailable", e);
            }
        }
        return new Socket();
    }

    @Override
    protected void startUp() throws Exception {
        IOException lastFailure = null;
        for (InetSocketAddress unresolved : serverAddresses) {
            // Force resolution
            InetSocketAddress address = new InetSocketAddress(unresolved.getHostString(), unresolved.getPort());
            logger.info("Opening a socket to {}:{}", address.getHostString(), address.getPort());
            Socket candidate = createSocket();
            try {
                candidate.connect(address, CONNECT_TIMEOUT_MILLIS);
            } catch (IOException e) {
                logger.warn("could not connect to {}: {}", address.getHostString(), e.toString());
                closeQuietly(candidate);
                lastFailure = e;
                continue;
            }
            lock.lock();
            try {
                socket = candidate;
                outputStream = socket.getOutputStream();
                reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                connectedAddress = unresolved;
                isConnected = true;
            } finally {
                lock.unlock();
            }
            pinger = new Pinger();
            pinger.start();
            return;
        }
        throw lastFailure;
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.warn("failed to close socket: {}", e.toString());
        }
    }

    class Pinger implements Runnable {
        private final ScheduledExecutorService scheduler =
                Executors.newSingleThreadScheduledExecutor(pingerThreadFactory);
        private ScheduledFuture<?> handle;
        private ListenableFuture<ElectrumMessage> future;

        public void start() {
            checkState(handle == null);
            handle = scheduler.scheduleAtFixedRate(this, pingPeriod, pingPeriod, TimeUnit.SECONDS);
        }

        public void stop() {
            if (handle != null)
                handle.cancel(true);
            if (future != null)
                future.cancel(true);
            scheduler.shutdownNow();
        }

        @Override
        public void run() {
            if (future != null) {
                if (future.cancel(true)) {
                    // Cancel succeeded means the previous ping never got a reply
                    logger.error("ping timed out");
                    closeSocket();
                    return;
                }
            }
            future = call(SERVER_PING, Collections.emptyList());
            Futures.addCallback(future, new FutureCallback<ElectrumMessage>() {
                @Override
                public void onSuccess(ElectrumMessage result) {
                    logger.debug("pong");
                }

                @Override
                public void onFailure(Throwable t) {
                    if (isRunning())
                        logger.error("ping failure: {}", t.toString());
                }
            }, MoreExecutors.directExecutor());
        }
    }

    @Override
    protected void triggerShutdown() {
        logger.info("trigger shutdown");
        closeSocket();
    }

    public void closeSocket() {
        lock.lock();
        try {
            isConnected = false;
            if (socket != null)
                socket.close();
        } catch (IOException e) {
            logger.error("failed to close socket", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void shutDown() {
        logger.info("shutdown");
        if (pinger != null)
            pinger.stop();
        closeSocket();
        Exception e = new EOFException("connection closed");
        for (PendingCall value : calls.values()) {
            value.future.setException(e);
        }
        calls.clear();
    }

    @Override
    protected void run() {
        try {
            runClient();
        } catch (IOException e) {
            if (isRunning())
                logger.error("connection lost", e);
        }
    }

    protected void runClient() throws IOException {
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                logger.info("server closed the connection");
                return;
            }
            logger.debug("< {}", line);
            handleLine(line);
        }
    }

    void handleLine(String line) {
        try {
            JsonNode node = mapper.readTree(line);
            if (node.isArray()) {
                for (JsonNode item : node) {
                    handle(mapper.treeToValue(item, ElectrumMessage.class));
                }
            } else {
                handle(mapper.treeToValue(node, ElectrumMessage.class));
            }
        } catch (JsonProcessingException e) {
            logger.warn("unparseable line from server: {}", e.getOriginalMessage());
        }
    }

    private void handle(ElectrumMessage message) {
        if (message.isError())
            handleError(message);
        else if (message.isResult())
            handleResult(message);
        else if (message.isMessage())
            handleMessage(message);
        else
            logger.warn("unknown message type");
    }

    public ListenableFuture<ElectrumMessage> call(String method, Object param) {
        return call(method, Lists.newArrayList(param));
    }

    public ListenableFuture<ElectrumMessage> call(String method, List<Object> params) {
        ElectrumMessage message = new ElectrumMessage(currentId.getAndIncrement(), method, params, mapper);
        SettableFuture<ElectrumMessage> future = SettableFuture.create();
        lock.lock();
        try {
            if (!isConnected)
                return Futures.immediateFailedFuture(new EOFException("not connected"));
            PendingCall call = new PendingCall(message, future);
            calls.put(message.id, call);
            writePayload(message, Collections.singletonList(call));
        } finally {
            lock.unlock();
        }
        return future;
    }

    /**
     * Send one request per parameter list, written as a single JSON array.
     *
     * @return futures in the order of {@code paramsList}
     */
    public List<ListenableFuture<ElectrumMessage>> callBatch(String method, List<List<Object>> paramsList) {
        List<ElectrumMessage> messages = Lists.newArrayList();
        List<PendingCall> pending = Lists.newArrayList();
        List<ListenableFuture<ElectrumMessage>> futures = Lists.newArrayList();
        for (List<Object> params : paramsList) {
            ElectrumMessage message = new ElectrumMessage(currentId.getAndIncrement(), method, params, mapper);
            SettableFuture<ElectrumMessage> future = SettableFuture.create();
            messages.add(message);
            pending.add(new PendingCall(message, future));
            futures.add(future);
        }
        if (messages.isEmpty())
            return futures;
        lock.lock();
        try {
            if (!isConnected) {
                EOFException e = new EOFException("not connected");
                for (PendingCall call : pending)
                    call.future.setException(e);
                return futures;
            }
            for (PendingCall call : pending)
                calls.put(call.message.id, call);
            writePayload(messages, pending);
        } finally {
            lock.unlock();
        }
        return futures;
    }

    @GuardedBy("ElectrumClient-stream")
    private void writePayload(Object payload, List<PendingCall> pending) {
        try {
            byte[] bytes = mapper.writeValueAsBytes(payload);
            if (logger.isDebugEnabled())
                logger.debug("> {}", new String(bytes, StandardCharsets.UTF_8));
            outputStream.write(bytes);
            outputStream.write('\n');
            outputStream.flush();
        } catch (IOException e) {
            logger.error("failed to write: {}", e.toString());
            for (PendingCall call : pending) {
                calls.remove(call.message.id);
                call.future.setException(e);
            }
            closeSocket();
        }
    }

    protected void handleResult(ElectrumMessage message) {
        PendingCall call = calls.remove(message.id);
        if (call == null) {
            logger.warn("reply for unknown id {}", message.id);
            return;
        }
        call.future.set(message);
    }

    protected void handleMessage(ElectrumMessage message) {
        for (NotificationListener listener : notificationListeners) {
            try {
                listener.onNotification(message);
            } catch (RuntimeException e) {
                logger.error("notification listener failed for " + message.method, e);
            }
        }
    }

    private void handleError(ElectrumMessage message) {
        PendingCall call = calls.remove(message.id);
        if (call == null) {
            logger.warn("error reply for unknown id {}", message.id);
            return;
        }
        call.future.setException(new ElectrumException(message.error));
    }

    /** Use an already open stream instead of a socket */
    @VisibleForTesting
    void attach(OutputStream stream) {
        lock.lock();
        try {
            outputStream = stream;
            isConnected = true;
        } finally {
            lock.unlock();
        }
    }

    @VisibleForTesting
    int getPendingCallCount() {
        return calls.size();
    }
}
