package com.questrail.chatwire.protocol.codec.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * StreamFramer
 * -----------------------------------------------------------------------------
 * Length-prefix framing for connection-oriented transports.
 *
 * <p>Each payload travels as a 4-byte big-endian unsigned length followed by
 * exactly that many bytes.</p>
 *
 * <h2>Reassembly state machine (one instance per connection)</h2>
 * <pre>
 *   AWAITING_LENGTH (0-3 header bytes buffered)
 *        → AWAITING_BODY (length known, body incomplete)
 *            → payload emitted, back to AWAITING_LENGTH
 * </pre>
 *
 * <p>{@link #feed(byte[], int, int)} accepts chunks of any size. A chunk may
 * complete zero, one or many frames and may end anywhere inside a frame.
 * Bytes are buffered only up to the announced body length, and a header
 * announcing more than the limit fails before any body buffer is allocated.</p>
 *
 * <p>Not thread-safe; a connection's read loop owns its framer.</p>
 */
public final class StreamFramer
{
    /** Largest body a frame may carry: 1 MiB. */
    public static final int MAX_FRAME_BYTES = 1024 * 1024;

    /** Size of the length prefix. */
    public static final int HEADER_BYTES = 4;

    public enum State {
        AWAITING_LENGTH,
        AWAITING_BODY
    }

    private final int maxFrameBytes;

    private final byte[] header = new byte[HEADER_BYTES];
    private int headerFilled;

    private byte[] body;
    private int bodyFilled;

    public StreamFramer() {
        this(MAX_FRAME_BYTES);
    }

    public StreamFramer(int maxFrameBytes) {
        if (maxFrameBytes <= 0 || maxFrameBytes > MAX_FRAME_BYTES) {
            throw new IllegalArgumentException("maxFrameBytes must be in 1.." + MAX_FRAME_BYTES);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Prefix a payload with its length.
     *
     * @throws FrameTooLargeException if the payload exceeds {@link #MAX_FRAME_BYTES}
     */
    public static byte[] frame(byte[] payload) throws FrameTooLargeException
    {
        Objects.requireNonNull(payload, "payload");
        if (payload.length > MAX_FRAME_BYTES) {
            throw new FrameTooLargeException(payload.length, MAX_FRAME_BYTES);
        }

        byte[] framed = new byte[HEADER_BYTES + payload.length];
        int n = payload.length;
        framed[0] = (byte) (n >>> 24);
        framed[1] = (byte) (n >>> 16);
        framed[2] = (byte) (n >>> 8);
        framed[3] = (byte) n;
        System.arraycopy(payload, 0, framed, HEADER_BYTES, n);
        return framed;
    }

    public List<byte[]> feed(byte[] chunk) throws FrameTooLargeException
    {
        Objects.requireNonNull(chunk, "chunk");
        return feed(chunk, 0, chunk.length);
    }

    /**
     * Consume {@code length} bytes of {@code chunk} starting at {@code offset}.
     *
     * @return payloads completed by this chunk, in arrival order; empty if none
     * @throws FrameTooLargeException if a header announces more than the limit.
     *         The framer must not be fed again afterwards.
     */
    public List<byte[]> feed(byte[] chunk, int offset, int length) throws FrameTooLargeException
    {
        Objects.requireNonNull(chunk, "chunk");
        Objects.checkFromIndexSize(offset, length, chunk.length);

        List<byte[]> completed = null;
        int pos = offset;
        final int end = offset + length;

        while (pos < end) {
            if (body == null) {
                int take = Math.min(HEADER_BYTES - headerFilled, end - pos);
                System.arraycopy(chunk, pos, header, headerFilled, take);
                headerFilled += take;
                pos += take;

                if (headerFilled < HEADER_BYTES) {
                    break;
                }

                long announced = readUnsignedInt(header);
                if (announced > maxFrameBytes) {
                    throw new FrameTooLargeException(announced, maxFrameBytes);
                }
                body = new byte[(int) announced];
                bodyFilled = 0;
            }

            int take = Math.min(body.length - bodyFilled, end - pos);
            System.arraycopy(chunk, pos, body, bodyFilled, take);
            bodyFilled += take;
            pos += take;

            if (bodyFilled == body.length) {
                if (completed == null) {
                    completed = new ArrayList<>();
                }
                completed.add(body);
                body = null;
                bodyFilled = 0;
                headerFilled = 0;
            }
        }

        return completed == null ? Collections.emptyList() : completed;
    }

    public State state() {
        return body == null ? State.AWAITING_LENGTH : State.AWAITING_BODY;
    }

    /**
     * Bytes buffered towards the frame currently being assembled.
     */
    public int bufferedBytes() {
        return body == null ? headerFilled : HEADER_BYTES + bodyFilled;
    }

    private static long readUnsignedInt(byte[] b)
    {
        return ((long) (b[0] & 0xFF) << 24)
                | ((b[1] & 0xFF) << 16)
                | ((b[2] & 0xFF) << 8)
                | (b[3] & 0xFF);
    }
}
