package com.questrail.chatwire.protocol.reliable;

import java.util.LinkedHashSet;
import java.util.Iterator;

/**
 * Recently-seen sequence numbers for one peer, bounded to the most recent
 * {@code capacity} entries in arrival order.
 *
 * <p>A sequence that falls out of the window and is then retransmitted will be
 * delivered again; the window must cover the retransmissions in flight.</p>
 */
public final class SequenceWindow
{
    private final int capacity;
    private final LinkedHashSet<Long> seen = new LinkedHashSet<>();

    public SequenceWindow(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Records {@code sequence}.
     *
     * @return {@code true} the first time a sequence is seen within the window
     */
    public synchronized boolean firstSight(long sequence)
    {
        if (!seen.add(sequence)) {
            return false;
        }
        if (seen.size() > capacity) {
            Iterator<Long> oldest = seen.iterator();
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    public synchronized int size() {
        return seen.size();
    }
}
