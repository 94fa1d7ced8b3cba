package org.abstractica.chat.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * The chat relay server.
 *
 * <p>An accept thread hands every connection to its own task, and every
 * active user gets a second task draining its {@link Outbox}. Connections are
 * admitted into a shared {@link UserRegistry} and everything they send is
 * relayed by one {@link MessageRouter}.</p>
 */
public class ChatServer implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(ChatServer.class);
    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final ServerConfig config;
    private final UserRegistry registry;
    private final MessageRouter router;
    private final Set<ConnectionHandler> connections;
    private final ExecutorService executor;
    private final AtomicBoolean closed;

    private ServerSocket serverSocket;
    private Thread acceptThread;

    /**
     * Creates a server. Nothing is bound until {@link #start()}.
     *
     * @param config the server settings
     */
    public ChatServer(ServerConfig config)
    {
        this(config, registry -> new MessageRouter(registry, config.routerQueueCapacity()));
    }

    ChatServer(ServerConfig config, Function<UserRegistry, MessageRouter> routerFactory)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = new UserRegistry(config.maxUsers());
        this.router = Objects.requireNonNull(routerFactory.apply(registry), "router");
        this.connections = ConcurrentHashMap.newKeySet();
        this.executor = Executors.newCachedThreadPool(new ConnectionThreadFactory());
        this.closed = new AtomicBoolean(false);
    }

    /**
     * Binds the listener and starts accepting connections.
     *
     * @throws IOException if the address cannot be bound
     */
    public synchronized void start() throws IOException
    {
        if (serverSocket != null)
        {
            throw new IllegalStateException("Server already started");
        }
        if (closed.get())
        {
            throw new IllegalStateException("Server is closed");
        }

        LOG.info("Starting server");
        if (config.encryptionRequired())
        {
            LOG.info("This server only accepts encrypted connections");
        }
        else
        {
            LOG.info("This server is operating in unencrypted mode");
        }

        ServerSocket socket = new ServerSocket();
        try
        {
            socket.setReuseAddress(true);
            socket.bind(config.socketAddress());
        }
        catch (IOException e)
        {
            socket.close();
            throw e;
        }
        serverSocket = socket;

        router.start();
        acceptThread = new Thread(this::acceptLoop, "chat-accept");
        acceptThread.start();

        LOG.info("Listening to connections on {}", serverSocket.getLocalSocketAddress());
    }

    /**
     * Shuts the server down: stops accepting, closes every user's transport and
     * stops relaying. Safe to call more than once.
     */
    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        LOG.info("Closing server");
        synchronized (this)
        {
            if (serverSocket != null)
            {
                try
                {
                    serverSocket.close();
                }
                catch (IOException e)
                {
                    LOG.warn("Error closing listener: {}", e.getMessage());
                }
            }
        }

        registry.closeAll();
        // Connections still negotiating are not in the registry yet
        for (ConnectionHandler connection : connections)
        {
            connection.abort();
        }
        router.stop();

        executor.shutdownNow();
        try
        {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS))
            {
                LOG.warn("Connection tasks still running after {}s", TERMINATION_TIMEOUT_SECONDS);
            }
            if (acceptThread != null)
            {
                acceptThread.join(TimeUnit.SECONDS.toMillis(TERMINATION_TIMEOUT_SECONDS));
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }

        LOG.info("Server closed");
    }

    /**
     * Returns the port the listener is bound to.
     *
     * @return the local port
     */
    public synchronized int getLocalPort()
    {
        if (serverSocket == null)
        {
            throw new IllegalStateException("Server not started");
        }
        return serverSocket.getLocalPort();
    }

    public ServerConfig getConfig()
    {
        return config;
    }

    public UserRegistry getRegistry()
    {
        return registry;
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    // ========== Accept Loop ==========

    private void acceptLoop()
    {
        while (!closed.get())
        {
            Socket socket;
            try
            {
                socket = serverSocket.accept();
            }
            catch (IOException e)
            {
                if (closed.get() || serverSocket.isClosed())
                {
                    break;
                }
                LOG.error("Error accepting connection", e);
                continue;
            }
            dispatch(socket);
        }
        LOG.debug("Accept loop stopped");
    }

    private void dispatch(Socket socket)
    {
        try
        {
            socket.setTcpNoDelay(true);
        }
        catch (IOException e)
        {
            LOG.debug("Could not disable Nagle for {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
        }

        ConnectionHandler handler = new ConnectionHandler(socket, registry, router, executor, config);
        connections.add(handler);
        try
        {
            executor.execute(() ->
            {
                try
                {
                    handler.run();
                }
                finally
                {
                    connections.remove(handler);
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            connections.remove(handler);
            handler.abort();
        }
    }

    private static class ConnectionThreadFactory implements ThreadFactory
    {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task)
        {
            Thread thread = new Thread(task, "chat-connection-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
