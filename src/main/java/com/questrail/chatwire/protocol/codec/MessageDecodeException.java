package com.questrail.chatwire.protocol.codec;

/**
 * Indicates that a payload could not be turned into a {@code ChatMessage}.
 *
 * <p>Protocol-level: the session drops the offending frame and keeps the
 * connection, unless failures repeat.</p>
 */
public class MessageDecodeException extends RuntimeException
{
    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
