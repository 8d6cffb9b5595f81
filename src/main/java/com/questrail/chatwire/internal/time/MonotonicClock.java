package com.questrail.chatwire.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every correctness decision in the transport: retry timeouts,
 * retry sweep spacing and datagram peer inactivity.
 *
 * <p>Message timestamps on the wire come from a {@link WallClock}; they are
 * never compared against this clock.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful as differences.
     */
    long nowNanos();
}
