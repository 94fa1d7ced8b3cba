package org.abstractica.chat.server;

import org.abstractica.chat.protocol.Message;
import org.abstractica.chat.session.ChatWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded queue of messages waiting to be written to one user.
 *
 * <p>The router only ever calls {@link #offer(Message)}, which never blocks.
 * A drain task started with {@link #start(Executor)} performs the blocking
 * writes, so a user that stops reading holds up nobody but itself. When the
 * queue overflows the user is disconnected; its read loop then fails and the
 * connection tears down as for any other transport error.</p>
 */
public class Outbox implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(Outbox.class);

    private static final long POLL_INTERVAL_MS = 100;

    private final String nick;
    private final ChatWriter writer;
    private final BlockingQueue<Message> queue;

    private volatile boolean closed;

    /**
     * Creates an outbox. Nothing is written until it is started.
     *
     * @param nick     the user, for logging
     * @param writer   the write half of the user's session
     * @param capacity number of pending messages before the user is disconnected
     */
    public Outbox(String nick, ChatWriter writer, int capacity)
    {
        this.nick = Objects.requireNonNull(nick, "nick");
        this.writer = Objects.requireNonNull(writer, "writer");
        if (capacity <= 0)
        {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Starts the drain task.
     *
     * @param executor runs the task for as long as the outbox is open
     */
    public void start(Executor executor)
    {
        executor.execute(this::drainLoop);
    }

    /**
     * Queues a message without blocking.
     *
     * @param message the message
     * @return true if queued, false if the outbox is closed or just overflowed
     */
    public boolean offer(Message message)
    {
        Objects.requireNonNull(message, "message");
        if (closed)
        {
            return false;
        }
        if (queue.offer(message))
        {
            return true;
        }
        LOG.warn("{} is not keeping up ({} messages pending), disconnecting", nick, queue.size());
        close();
        return false;
    }

    public int pending()
    {
        return queue.size();
    }

    public boolean isClosed()
    {
        return closed;
    }

    /**
     * Stops the drain task and closes the user's transport. Pending messages
     * are discarded.
     */
    @Override
    public void close()
    {
        closed = true;
        queue.clear();
        try
        {
            writer.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing {}: {}", nick, e.getMessage());
        }
    }

    // ========== Drain ==========

    private void drainLoop()
    {
        try
        {
            while (!closed)
            {
                Message message = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (message != null && !closed)
                {
                    writer.send(message);
                }
            }
        }
        catch (IOException e)
        {
            LOG.debug("Could not write to {}: {}", nick, e.getMessage());
            close();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            close();
        }
    }
}
