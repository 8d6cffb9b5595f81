package com.questrail.chatwire.internal.time;

/**
 * Opens {@link OwnedScheduler}s on demand.
 *
 * <p>Production code uses {@link DedicatedThreadScheduler#factory(MonotonicClock)};
 * tests substitute a deterministic scheduler driven by a manual clock.</p>
 */
@FunctionalInterface
public interface SchedulerFactory
{
    /**
     * @param name thread name prefix for the scheduler's worker thread
     */
    OwnedScheduler open(String name);
}
