package com.questrail.chatwire.protocol.codec.stream;

import java.io.IOException;

/**
 * A frame header claimed (or an outbound payload needed) more bytes than the
 * frame limit allows. Fatal to the connection.
 */
public final class FrameTooLargeException extends IOException
{
    private final long claimedBytes;
    private final int limitBytes;

    public FrameTooLargeException(long claimedBytes, int limitBytes) {
        super("Frame too large: " + claimedBytes + " bytes exceeds limit of " + limitBytes);
        this.claimedBytes = claimedBytes;
        this.limitBytes = limitBytes;
    }

    public long claimedBytes() {
        return claimedBytes;
    }

    public int limitBytes() {
        return limitBytes;
    }
}
