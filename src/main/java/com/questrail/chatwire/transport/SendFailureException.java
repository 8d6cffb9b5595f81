package com.questrail.chatwire.transport;

import java.io.IOException;

/**
 * A single outbound send failed. The socket is presumed broken and the owning
 * session is torn down.
 */
public final class SendFailureException extends IOException
{
    public SendFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
