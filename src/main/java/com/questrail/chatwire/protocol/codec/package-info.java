/**
 * Wire codec for chat messages
 * =============================================================================
 *
 * <p>One message is one JSON object:</p>
 *
 * <pre>
 *   { "type": "connect|disconnect|message|status|error|test|ack",
 *     "content": "...",
 *     "username": "..." | null,
 *     "timestamp": 1712345678.123,
 *     "version": "1.0" }
 * </pre>
 *
 * <h2>Placement</h2>
 * <pre>
 *   ChatMessage
 *        → WireCodec.encode
 *            → StreamFramer (stream) | datagram as-is (datagram)
 *                → socket
 * </pre>
 *
 * <p>Decoding failures are unchecked {@link com.questrail.chatwire.protocol.codec.MessageDecodeException}s.
 * They are protocol-level: sessions drop the frame and continue.</p>
 */
package com.questrail.chatwire.protocol.codec;
