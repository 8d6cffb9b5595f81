package com.questrail.chatwire.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to stamp outbound messages and observability events.
 *
 * <p>May jump under NTP or manual adjustment. Nothing that decides when to
 * retransmit or expire a peer may read it.</p>
 */
public interface WallClock
{
    Instant now();
}
