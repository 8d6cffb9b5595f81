package com.questrail.chatwire.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Absolute monotonic deadlines are converted to relative delays at the
 * moment of scheduling, using the same {@link MonotonicClock} the callers use
 * to compute those deadlines.</p>
 *
 * <p>This class does not own the executor. {@link DedicatedThreadScheduler}
 * pairs it with an executor it does own.</p>
 *
 * <p>Scheduling after the executor has been shut down is not an error: a
 * session that is being torn down may race one last re-arm of its retry sweep.
 * Such tasks are discarded and the returned handle reports nothing to cancel.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        }
        catch (RejectedExecutionException e) {
            return () -> false;
        }
        return () -> future.cancel(false);
    }
}
