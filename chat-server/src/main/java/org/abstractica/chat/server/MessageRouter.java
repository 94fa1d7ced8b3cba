package org.abstractica.chat.server;

import org.abstractica.chat.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Fans relayed messages out to every registered user.
 *
 * <p>Connection tasks enqueue; a single consumer thread drains the queue in
 * FIFO order, so messages from one connection reach every user in the order
 * they were read. Delivery happens outside the registry lock on a snapshot of
 * the entries and only hands each message to the user's {@link Outbox}, so the
 * consumer never waits on a socket. A user whose outbox is full is
 * disconnected by it and misses the message.</p>
 *
 * <p>The queue is bounded. A full queue blocks the enqueuing connection.</p>
 */
public class MessageRouter
{
    private static final Logger LOG = LoggerFactory.getLogger(MessageRouter.class);

    private final UserRegistry registry;
    private final BlockingQueue<RoutedMessage> queue;

    private Thread routerThread;
    private volatile boolean running;

    /**
     * Creates a router.
     *
     * @param registry the users to deliver to
     * @param capacity number of queued messages before enqueuing blocks
     */
    public MessageRouter(UserRegistry registry, int capacity)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (capacity <= 0)
        {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Starts the consumer thread.
     */
    public synchronized void start()
    {
        if (routerThread != null)
        {
            throw new IllegalStateException("Router already started");
        }
        running = true;
        routerThread = new Thread(this::routeLoop, "chat-router");
        routerThread.setDaemon(true);
        routerThread.start();
    }

    /**
     * Stops the consumer thread. Messages still queued are dropped.
     */
    public synchronized void stop()
    {
        if (!running)
        {
            return;
        }
        running = false;
        routerThread.interrupt();
        LOG.debug("Router stopped with {} message(s) undelivered", queue.size());
    }

    /**
     * Queues a message for every registered user.
     *
     * @param message the message
     * @throws InterruptedException if interrupted while the queue is full
     */
    public void broadcast(Message message) throws InterruptedException
    {
        submit(RoutedMessage.broadcast(message));
    }

    /**
     * Queues a message, blocking while the queue is full.
     *
     * <p>Ignored once the router has stopped.</p>
     *
     * @param routed the message and its recipient
     * @throws InterruptedException if interrupted while the queue is full
     */
    public void submit(RoutedMessage routed) throws InterruptedException
    {
        Objects.requireNonNull(routed, "routed");
        if (!running)
        {
            LOG.debug("Router stopped, dropping {}", routed.message().type());
            return;
        }
        queue.put(routed);
    }

    public boolean isRunning()
    {
        return running;
    }

    // ========== Consumer ==========

    private void routeLoop()
    {
        LOG.debug("Router started");
        while (running)
        {
            RoutedMessage routed;
            try
            {
                routed = queue.take();
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }

            try
            {
                deliver(routed);
            }
            catch (RuntimeException e)
            {
                LOG.error("Failed to route {}", routed.message().type(), e);
            }
        }
    }

    private void deliver(RoutedMessage routed)
    {
        if (!routed.isBroadcast())
        {
            // Nothing produces directed messages yet
            LOG.warn("Dropping {} addressed to {}: directed delivery is not supported",
                    routed.message().type(), routed.recipient().get());
            return;
        }

        Message message = routed.message();
        for (Map.Entry<String, Outbox> user : registry.snapshot().entrySet())
        {
            if (!user.getValue().offer(message))
            {
                LOG.debug("Could not deliver {} to {}", message.type(), user.getKey());
            }
        }
    }
}
