package com.questrail.chatwire.protocol.codec;

/**
 * Payload is not valid JSON, is not an object, or is missing a required field.
 */
public final class MalformedMessageException extends MessageDecodeException
{
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
