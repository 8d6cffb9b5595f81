package com.questrail.chatwire.protocol.codec.stream;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Objects;

/**
 * StreamFrameReader
 * -----------------------------------------------------------------------------
 * Pulls bytes from a blocking {@link InputStream} and runs them through a
 * {@link StreamFramer}.
 *
 * <p>Each {@link #read()} performs exactly one underlying read and reports one
 * of three outcomes:</p>
 * <ul>
 *   <li>{@link Frames}: zero or more complete payloads</li>
 *   <li>{@link PeerClosed}: end-of-stream, a clean close by the peer</li>
 *   <li>{@link Idle}: the socket read timed out; lets the caller check its
 *       running flag</li>
 * </ul>
 *
 * <p>Any other {@link IOException} propagates and is a transport error.</p>
 */
public final class StreamFrameReader
{
    private static final int READ_BUFFER_BYTES = 4096;

    public sealed interface ReadResult permits Frames, PeerClosed, Idle {}

    /** Payloads completed by the last read; possibly empty. */
    public record Frames(List<byte[]> payloads) implements ReadResult {}

    /** The peer closed its side of the stream. */
    public record PeerClosed() implements ReadResult {}

    /** No bytes arrived within the socket read timeout. */
    public record Idle() implements ReadResult {}

    private final InputStream in;
    private final StreamFramer framer;
    private final byte[] buffer = new byte[READ_BUFFER_BYTES];

    public StreamFrameReader(InputStream in) {
        this(in, new StreamFramer());
    }

    public StreamFrameReader(InputStream in, StreamFramer framer) {
        this.in = Objects.requireNonNull(in, "in");
        this.framer = Objects.requireNonNull(framer, "framer");
    }

    public ReadResult read() throws IOException
    {
        final int n;
        try {
            n = in.read(buffer);
        }
        catch (SocketTimeoutException e) {
            return new Idle();
        }

        if (n < 0) {
            return new PeerClosed();
        }
        return new Frames(framer.feed(buffer, 0, n));
    }

    public StreamFramer framer() {
        return framer;
    }
}
