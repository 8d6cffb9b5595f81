package com.questrail.chatwire.protocol.codec;

/**
 * Payload is well-formed but its {@code type} names no known message kind.
 *
 * <p>Rejected explicitly so that protocol drift between client and server
 * versions surfaces instead of being read as a status notice.</p>
 */
public final class UnknownMessageKindException extends MessageDecodeException
{
    private final String wireType;

    public UnknownMessageKindException(String wireType) {
        super("Unknown message type: " + wireType);
        this.wireType = wireType;
    }

    public String wireType() {
        return wireType;
    }
}
