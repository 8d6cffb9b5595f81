package com.questrail.chatwire.internal.time;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * DedicatedThreadScheduler
 * =============================================================================
 * {@link OwnedScheduler} running its tasks on a single named daemon thread.
 *
 * <h2>Thread lifecycle</h2>
 * The worker thread is created lazily by the underlying
 * {@link ScheduledThreadPoolExecutor} when the first task is scheduled, and
 * exits once the queue has been empty for the idle keep-alive. A peer that
 * never has an outstanding reliable send therefore never costs a thread, and
 * one whose sends have all been acknowledged stops costing one shortly after.
 */
public final class DedicatedThreadScheduler implements OwnedScheduler {

    /** How long an idle worker thread lingers before exiting. */
    public static final Duration DEFAULT_IDLE_KEEP_ALIVE = Duration.ofSeconds(1);

    private final ScheduledThreadPoolExecutor pool;
    private final ScheduledExecutorService executor;
    private final ScheduledExecutorScheduler delegate;

    public DedicatedThreadScheduler(String name, MonotonicClock clock) {
        this(name, clock, DEFAULT_IDLE_KEEP_ALIVE);
    }

    public DedicatedThreadScheduler(String name, MonotonicClock clock, Duration idleKeepAlive) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(idleKeepAlive, "idleKeepAlive");
        if (idleKeepAlive.isNegative() || idleKeepAlive.isZero()) {
            throw new IllegalArgumentException("idleKeepAlive must be positive");
        }

        pool = new ScheduledThreadPoolExecutor(1, new DefaultThreadFactory(name, true));
        pool.setRemoveOnCancelPolicy(true);
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        // Keep-alive must be set before core threads may time out.
        pool.setKeepAliveTime(idleKeepAlive.toNanos(), TimeUnit.NANOSECONDS);
        pool.allowCoreThreadTimeOut(true);

        this.executor = Executors.unconfigurableScheduledExecutorService(pool);
        this.delegate = new ScheduledExecutorScheduler(executor, clock);
    }

    /**
     * Factory opening one dedicated scheduler per call.
     */
    public static SchedulerFactory factory(MonotonicClock clock) {
        Objects.requireNonNull(clock, "clock");
        return name -> new DedicatedThreadScheduler(name, clock);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        return delegate.scheduleAtNanos(deadlineNanos, task);
    }

    /**
     * {@code true} while the worker thread exists.
     */
    public boolean hasWorkerThread() {
        return pool.getPoolSize() > 0;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
