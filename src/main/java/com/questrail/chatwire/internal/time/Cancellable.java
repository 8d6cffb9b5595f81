package com.questrail.chatwire.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task armed on a {@link MonotonicScheduler}.
 *
 * <p>Retry sweeps and the stale-peer reaper re-arm themselves one shot at a
 * time; tearing a session down cancels whatever shot is currently armed.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
