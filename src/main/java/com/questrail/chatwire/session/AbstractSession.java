package com.questrail.chatwire.session;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.PeerInfo;
import com.questrail.chatwire.observability.ChatErrorEvent;
import com.questrail.chatwire.observability.SessionTransitionEvent;
import com.questrail.chatwire.protocol.codec.MessageDecodeException;
import com.questrail.chatwire.protocol.codec.UnknownMessageKindException;
import com.questrail.chatwire.protocol.codec.stream.FrameTooLargeException;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.transport.SendFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * AbstractSession
 * =============================================================================
 * Transport-independent half of a server-side peer session: lifecycle, the
 * dispatch table over {@link MessageKind}, decode failure accounting and
 * teardown. Subclasses supply the bytes and the socket.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   HANDSHAKING --Connect--> ACTIVE --> CLOSING --> CLOSED
 * </pre>
 * Messages other than Connect are dispatched while handshaking; only Connect
 * completes the handshake. Peers are announced as connected (and later as
 * disconnected) only if they reached {@link SessionState#ACTIVE}.
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>A frame that fails to decode is logged, answered with an {@code error}
 *       message and dropped.</li>
 *   <li>{@link com.questrail.chatwire.config.ServerConfig#maxConsecutiveDecodeFailures()}
 *       consecutive failures close the session with {@link CloseReason#DECODE_FAILURES}.</li>
 *   <li>A failed send closes the session with {@link CloseReason#SEND_FAILURE}.</li>
 * </ul>
 *
 * <h2>Teardown</h2>
 * {@link #close(CloseReason)} runs exactly once, whichever thread gets there
 * first: release the transport, deregister, notify.
 */
public abstract class AbstractSession
{
    private static final Logger log = LoggerFactory.getLogger(AbstractSession.class);

    /** Reserved sender for server-generated notices. */
    public static final String SYSTEM_SENDER = "System";

    /**
     * Result of dispatching one inbound message; logged at DEBUG.
     */
    protected enum DispatchOutcome {
        HANDSHAKE_COMPLETED,
        RENAMED,
        DELIVERED,
        STATUS_REPORTED,
        ECHOED,
        CLOSING,
        IGNORED
    }

    protected final SessionContext context;
    private final PeerRecord record;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.HANDSHAKING);
    private final AtomicBoolean closeStarted = new AtomicBoolean(false);
    private final AtomicInteger consecutiveDecodeFailures = new AtomicInteger();

    protected AbstractSession(PeerRecord record, SessionContext context)
    {
        this.record = Objects.requireNonNull(record, "record");
        this.context = Objects.requireNonNull(context, "context");
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public final String identifier() {
        return record.identifier();
    }

    public final String displayName() {
        return record.displayName();
    }

    public final PeerRecord record() {
        return record;
    }

    public final SessionState state() {
        return state.get();
    }

    public final boolean isOpen() {
        SessionState s = state.get();
        return s == SessionState.HANDSHAKING || s == SessionState.ACTIVE;
    }

    public final boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    public final PeerInfo peerInfo() {
        return record.toPeerInfo();
    }

    // -------------------------------------------------------------------------
    // Transport hooks
    // -------------------------------------------------------------------------

    /**
     * Puts one message on the wire.
     *
     * @throws FrameTooLargeException if the encoded message cannot be framed;
     *         nothing was written and the connection is still usable
     * @throws SendFailureException   if the transport rejected the send
     */
    protected abstract void transmit(ChatMessage message) throws FrameTooLargeException, SendFailureException;

    /**
     * Releases the socket and any threads owned by this session. Called once,
     * from {@link #close(CloseReason)}; must not throw.
     */
    protected abstract void releaseTransport(CloseReason reason);

    /**
     * Filters a decoded message before dispatch. The datagram session routes
     * it through the reliability layer here.
     *
     * @return the message to dispatch, or empty if it was consumed
     * @throws MessageDecodeException if the message's content is malformed
     */
    protected Optional<ChatMessage> admit(ChatMessage message) {
        return Optional.of(message);
    }

    /**
     * Called after every Connect.
     *
     * @param firstConnect {@code true} if this Connect completed the handshake
     */
    protected void onConnectAccepted(boolean firstConnect) {
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Handles one complete frame or datagram from the peer.
     */
    protected final void onPayload(byte[] payload)
    {
        record.touch(context.clock().nowNanos());

        final Optional<ChatMessage> admitted;
        try {
            admitted = admit(context.codec().decode(payload));
        }
        catch (MessageDecodeException e) {
            onDecodeFailure(e);
            return;
        }
        consecutiveDecodeFailures.set(0);

        if (admitted.isPresent() && isOpen()) {
            ChatMessage message = admitted.get();
            DispatchOutcome outcome = dispatch(message);
            log.debug("Peer {}: {} from {} -> {}", identifier(), message.kind(), message.sender(), outcome);
        }
    }

    private DispatchOutcome dispatch(ChatMessage message)
    {
        return switch (message.kind()) {
            case CONNECT -> handleConnect(message);
            case DISCONNECT -> {
                log.info("Peer {} requested disconnect", identifier());
                close(CloseReason.PEER_DISCONNECTED);
                yield DispatchOutcome.CLOSING;
            }
            case CHAT -> {
                context.callbacks().messages().onMessage(peerInfo(), message.content());
                yield DispatchOutcome.DELIVERED;
            }
            case STATUS -> {
                context.callbacks().status().onStatus(statusText(message), false);
                yield DispatchOutcome.STATUS_REPORTED;
            }
            case ERROR -> {
                context.callbacks().status().onStatus(statusText(message), true);
                yield DispatchOutcome.STATUS_REPORTED;
            }
            case TEST -> {
                // Timestamp, version and content must survive unchanged.
                send(message.withSender(context.config().serverIdentity()));
                yield DispatchOutcome.ECHOED;
            }
            case ACK -> DispatchOutcome.IGNORED;
        };
    }

    private DispatchOutcome handleConnect(ChatMessage message)
    {
        String name = message.content().isBlank() ? message.sender() : message.content();
        if (name != null && !name.isBlank()) {
            record.rename(name.strip());
        }

        boolean activated = transition(SessionState.HANDSHAKING, SessionState.ACTIVE, "connect");
        if (activated) {
            log.info("Peer {} connected as '{}'", identifier(), displayName());
            context.callbacks().lifecycle().onPeerConnected(peerInfo());
            context.owner().peerJoined(this);
        }
        onConnectAccepted(activated);
        return activated ? DispatchOutcome.HANDSHAKE_COMPLETED : DispatchOutcome.RENAMED;
    }

    private void onDecodeFailure(MessageDecodeException e)
    {
        int failures = consecutiveDecodeFailures.incrementAndGet();
        int limit = context.config().maxConsecutiveDecodeFailures();

        log.warn("Peer {}: dropped undecodable frame ({}/{}): {}",
                identifier(), failures, limit, e.getMessage());
        context.observability().onError(new ChatErrorEvent(
                context.wallClock().now(), identifier(), "Undecodable frame", e));

        if (failures >= limit) {
            close(CloseReason.DECODE_FAILURES);
            return;
        }

        String reply = e instanceof UnknownMessageKindException unknown
                ? "Unknown message type: " + unknown.wireType()
                : "Invalid message format";
        send(serverMessage(MessageKind.ERROR, reply));
    }

    private static String statusText(ChatMessage message)
    {
        return message.sender() != null ? message.sender() + ": " + message.content() : message.content();
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Sends {@code message} to the peer. A send failure tears the session down;
     * a message too large to frame is refused and the session stays open.
     *
     * @return {@code false} if the session is closed, the message was refused
     *         or the send failed
     */
    public final boolean send(ChatMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (!isOpen()) {
            return false;
        }
        try {
            transmit(message);
            return true;
        }
        catch (FrameTooLargeException e) {
            log.warn("Peer {}: {} not sent: {}", identifier(), message.kind(), e.getMessage());
            return false;
        }
        catch (SendFailureException e) {
            log.warn("Peer {}: send failed, closing session", identifier(), e);
            context.observability().onError(new ChatErrorEvent(
                    context.wallClock().now(), identifier(), "Send failed", e));
            close(CloseReason.SEND_FAILURE);
            return false;
        }
    }

    /**
     * A message from this server, stamped now.
     */
    public final ChatMessage serverMessage(MessageKind kind, String content)
    {
        return ChatMessage.of(kind, content, context.config().serverIdentity(), context.wallClock().now());
    }

    /**
     * A {@code status} notice from {@link #SYSTEM_SENDER}, stamped now.
     */
    protected final ChatMessage systemNotice(String text)
    {
        return ChatMessage.of(MessageKind.STATUS, text, SYSTEM_SENDER, context.wallClock().now());
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Tears the session down. Idempotent and safe to call concurrently; only the
     * first call has any effect.
     */
    public final void close(CloseReason reason)
    {
        Objects.requireNonNull(reason, "reason");
        if (!closeStarted.compareAndSet(false, true)) {
            return;
        }

        SessionState previous = state.getAndSet(SessionState.CLOSING);
        emitTransition(previous, SessionState.CLOSING, reason.name());

        try {
            releaseTransport(reason);
        }
        catch (RuntimeException e) {
            log.debug("Peer {}: error releasing transport", identifier(), e);
        }

        context.registry().remove(this);
        state.set(SessionState.CLOSED);
        emitTransition(SessionState.CLOSING, SessionState.CLOSED, reason.name());

        if (reason.isConnectionLost()) {
            log.warn("Peer {} ({}) lost: {}", identifier(), displayName(), reason);
        }
        else {
            log.info("Peer {} ({}) closed: {}", identifier(), displayName(), reason);
        }

        context.callbacks().status().onStatus("Client disconnected: " + identifier(), false);
        if (previous == SessionState.ACTIVE) {
            context.callbacks().lifecycle().onPeerDisconnected(peerInfo(), reason);
            context.owner().peerLeft(this, reason);
        }
    }

    private boolean transition(SessionState from, SessionState to, String cause)
    {
        if (!state.compareAndSet(from, to)) {
            return false;
        }
        emitTransition(from, to, cause);
        return true;
    }

    private void emitTransition(SessionState from, SessionState to, String cause)
    {
        context.observability().onSessionTransition(new SessionTransitionEvent(
                context.wallClock().now(), identifier(), from, to, cause));
    }
}
