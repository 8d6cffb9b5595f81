package com.questrail.chatwire.protocol.codec;

import com.questrail.chatwire.protocol.model.ChatMessage;

/**
 * WireCodec
 * -----------------------------------------------------------------------------
 * Encodes a single {@link ChatMessage} to its self-describing textual payload
 * and back.
 *
 * <p>The codec knows nothing about framing or reliability. Stream transports
 * put its output inside a length-prefixed frame; datagram transports send it as
 * the whole datagram.</p>
 */
public interface WireCodec
{
    /**
     * Encode a message. Pure and deterministic.
     *
     * @return UTF-8 payload bytes
     */
    byte[] encode(ChatMessage message);

    /**
     * Decode one payload.
     *
     * <p>Leading bytes before the start of the structured payload are skipped.
     * A payload missing {@code type}, {@code content} or {@code timestamp} is
     * rejected as a whole.</p>
     *
     * @throws MalformedMessageException   if the payload is not a well-formed message
     * @throws UnknownMessageKindException if {@code type} names no known kind
     */
    ChatMessage decode(byte[] payload);
}
