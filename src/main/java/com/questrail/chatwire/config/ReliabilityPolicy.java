package com.questrail.chatwire.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ReliabilityPolicy
 * -----------------------------------------------------------------------------
 * Timing and bookkeeping limits for the reliable datagram layer.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>retryInterval</b>: spacing between retry sweeps over the pending set.</li>
 *   <li><b>retryTimeout</b>: age after which an unacknowledged send is retransmitted.
 *       Measured from the last (re)transmission.</li>
 *   <li><b>maxRetries</b>: retransmissions allowed per send before the send is
 *       abandoned and the session torn down. {@link #UNBOUNDED} retries forever.</li>
 *   <li><b>duplicateWindow</b>: number of recently delivered sequence numbers
 *       remembered per peer for duplicate suppression.</li>
 * </ul>
 */
public record ReliabilityPolicy(
        Duration retryInterval,
        Duration retryTimeout,
        int maxRetries,
        int duplicateWindow
) {
    /** {@code maxRetries} value meaning "never give up". */
    public static final int UNBOUNDED = -1;

    public ReliabilityPolicy {
        Objects.requireNonNull(retryInterval, "retryInterval");
        Objects.requireNonNull(retryTimeout, "retryTimeout");

        if (retryInterval.isNegative() || retryInterval.isZero()) {
            throw new IllegalArgumentException("retryInterval must be positive");
        }
        if (retryTimeout.isNegative()) {
            throw new IllegalArgumentException("retryTimeout must be non-negative");
        }
        if (maxRetries < UNBOUNDED) {
            throw new IllegalArgumentException("maxRetries must be >= 0 or UNBOUNDED");
        }
        if (duplicateWindow <= 0) {
            throw new IllegalArgumentException("duplicateWindow must be positive");
        }
    }

    /**
     * Defaults: sweep every 500ms, retransmit after 2s, give up after 10
     * retransmissions, remember the last 1024 sequence numbers.
     */
    public static ReliabilityPolicy defaults() {
        return new ReliabilityPolicy(Duration.ofMillis(500), Duration.ofSeconds(2), 10, 1024);
    }

    public boolean retriesBounded() {
        return maxRetries != UNBOUNDED;
    }

    public ReliabilityPolicy withMaxRetries(int maxRetries) {
        return new ReliabilityPolicy(retryInterval, retryTimeout, maxRetries, duplicateWindow);
    }

    public ReliabilityPolicy withRetryTiming(Duration retryInterval, Duration retryTimeout) {
        return new ReliabilityPolicy(retryInterval, retryTimeout, maxRetries, duplicateWindow);
    }
}
