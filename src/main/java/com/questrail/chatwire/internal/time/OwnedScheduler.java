package com.questrail.chatwire.internal.time;

import java.time.Duration;

/**
 * A {@link MonotonicScheduler} that owns the thread its tasks run on.
 *
 * <p>Each reliable-datagram peer and the datagram reaper get one of these, so
 * that stopping a session or a server can release (and join) exactly the
 * threads it started.</p>
 */
public interface OwnedScheduler extends MonotonicScheduler, AutoCloseable
{
    /**
     * Stop accepting tasks and cancel anything still queued. Safe to call from
     * one of this scheduler's own tasks; never blocks.
     */
    @Override
    void close();

    /**
     * Wait for the owned thread to exit after {@link #close()}.
     *
     * @return {@code true} if the thread exited within the timeout
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;
}
