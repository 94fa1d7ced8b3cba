package org.abstractica.chat.server;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Hands a shutdown request from a signal handler to the thread that performs
 * the shutdown.
 *
 * <p>The handler only calls {@link #requestShutdown()} and then waits in
 * {@link #awaitCompletion(Duration)}; the shutdown itself runs on the thread
 * blocked in {@link #awaitShutdownRequest()}.</p>
 */
public class ShutdownCoordinator
{
    private final CountDownLatch requested = new CountDownLatch(1);
    private final CountDownLatch completed = new CountDownLatch(1);

    public void requestShutdown()
    {
        requested.countDown();
    }

    public boolean isShutdownRequested()
    {
        return requested.getCount() == 0;
    }

    /**
     * Blocks until a shutdown is requested.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitShutdownRequest() throws InterruptedException
    {
        requested.await();
    }

    public void shutdownComplete()
    {
        completed.countDown();
    }

    public boolean isShutdownComplete()
    {
        return completed.getCount() == 0;
    }

    /**
     * Waits for the shutdown to finish.
     *
     * @param timeout how long to wait
     * @return true if it finished in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException
    {
        return completed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
