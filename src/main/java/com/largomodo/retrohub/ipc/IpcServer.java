package com.largomodo.retrohub.ipc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loopback TCP server speaking newline-delimited JSON.
 * <p>
 * Threading: one accept thread plus one worker thread per open connection. Workers block
 * on their socket; there is no idle timeout, so a silent client holds its worker until it
 * disconnects or the server stops.
 * <p>
 * Lifecycle policy:
 * <ul>
 *   <li>{@link #start()} on a running server is a no-op (logged).</li>
 *   <li>{@link #stop()} on a stopped server is a no-op.</li>
 *   <li>A stopped server can be started again; it binds a fresh listener.</li>
 * </ul>
 * {@link #stop()} is best-effort: it force-closes sockets without waiting for in-flight
 * handlers, so a response being computed at that moment may never be delivered.
 */
public class IpcServer implements AutoCloseable {

    public static final int DEFAULT_PORT = 9847;

    private static final Logger log = LoggerFactory.getLogger(IpcServer.class);

    private final int configuredPort;
    private final MessageCodec codec;
    private final Set<ClientConnection> clients = ConcurrentHashMap.newKeySet();

    private volatile ServerState state = ServerState.STOPPED;
    private volatile RequestHandler handler;
    private volatile ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptThread;

    public IpcServer(int port) {
        this(port, new MessageCodec());
    }

    /**
     * @param port  TCP port on the loopback interface; 0 binds an ephemeral port
     * @param codec Line codec shared by all connections
     */
    public IpcServer(int port, MessageCodec codec) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.configuredPort = port;
        this.codec = codec;
    }

    /**
     * Install the request handler. Takes effect for the next request on every connection.
     *
     * @param handler Handler, or null to fall back to the built-in "ready" responder
     */
    public void setHandler(RequestHandler handler) {
        this.handler = handler;
    }

    /**
     * Bind the listener and start accepting connections in the background.
     * Returns once the listener is bound.
     *
     * @throws IOException if the port cannot be bound; the server stays STOPPED
     */
    public synchronized void start() throws IOException {
        if (state != ServerState.STOPPED) {
            log.warn("IPC server already {} on port {}, ignoring start", state, getPort());
            return;
        }
        state = ServerState.STARTING;

        ServerSocket socket = new ServerSocket();
        try {
            // Allows an immediate restart on the same port while old sockets sit in TIME_WAIT
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), configuredPort));
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            state = ServerState.STOPPED;
            throw e;
        }

        // One thread per connection, created on demand and discarded when the client leaves
        ExecutorService pool = new ThreadPoolExecutor(
                0,                          // Core pool size: no idle workers kept
                Integer.MAX_VALUE,          // Max pool size: bounded only by open connections
                30L,                        // Keep-alive for finished worker threads
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),   // Direct hand-off: every connection gets its own thread
                namedThreads("retrohub-client-")
        );

        serverSocket = socket;
        workers = pool;
        state = ServerState.RUNNING;

        acceptThread = new Thread(() -> acceptLoop(socket, pool), "retrohub-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        log.info("IPC server started on {}:{}", socket.getInetAddress().getHostAddress(), socket.getLocalPort());
    }

    /**
     * Close every connection and the listener, then settle to STOPPED.
     * Does not wait for in-flight requests.
     */
    public synchronized void stop() {
        if (state != ServerState.RUNNING) {
            log.debug("IPC server not running ({}), ignoring stop", state);
            return;
        }
        state = ServerState.STOPPING;

        // Listener and pool first so the accept thread cannot register new clients after the sweep
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Error closing listener: {}", e.getMessage());
        }
        workers.shutdownNow();

        for (ClientConnection client : clients) {
            client.close();
        }
        clients.clear();

        serverSocket = null;
        workers = null;
        acceptThread = null;
        state = ServerState.STOPPED;
        log.info("IPC server stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void acceptLoop(ServerSocket socket, ExecutorService pool) {
        while (state == ServerState.RUNNING) {
            Socket client;
            try {
                client = socket.accept();
            } catch (IOException e) {
                if (socket.isClosed()) {
                    // Listener closed by stop()
                    break;
                }
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }

            ClientConnection connection = new ClientConnection(client, codec, this::currentHandler, clients::remove);
            clients.add(connection);
            try {
                pool.execute(connection);
            } catch (RejectedExecutionException e) {
                // stop() raced with accept; the pool is gone
                log.debug("Dropping connection {} accepted during shutdown", connection.getRemoteAddress());
                clients.remove(connection);
                connection.close();
            }
        }
        log.debug("Accept loop finished");
    }

    private RequestHandler currentHandler() {
        RequestHandler installed = handler;
        return installed != null ? installed : IpcServer::defaultResponse;
    }

    private static Response defaultResponse(Request request) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("status", "ready");
        return Response.status(request.id(), data);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * @return The bound port while running, otherwise the configured port
     */
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : configuredPort;
    }

    public boolean isRunning() {
        return state == ServerState.RUNNING;
    }

    public ServerState getState() {
        return state;
    }

    public int getClientCount() {
        return clients.size();
    }
}
