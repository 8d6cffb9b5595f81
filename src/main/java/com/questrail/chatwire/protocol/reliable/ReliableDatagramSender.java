package com.questrail.chatwire.protocol.reliable;

import com.questrail.chatwire.config.ReliabilityPolicy;
import com.questrail.chatwire.internal.time.Cancellable;
import com.questrail.chatwire.internal.time.MonotonicScheduler;
import com.questrail.chatwire.observability.ChatErrorEvent;
import com.questrail.chatwire.observability.RecoveryModeEvent;
import com.questrail.chatwire.observability.RetransmissionEvent;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.transport.DatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * ReliableDatagramSender
 * =============================================================================
 * Sender half of the reliable datagram layer for one remote peer.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Each outbound chat message gets the next sequence number (from 0) and is
 *       wrapped in a {@link ReliableEnvelope}.</li>
 *   <li>The encoded datagram is kept as a {@link PendingSend} until a matching
 *       acknowledgement arrives.</li>
 *   <li>While anything is pending, a sweep runs every
 *       {@link ReliabilityPolicy#retryInterval()} and resends, byte for byte,
 *       every entry whose last transmission is older than
 *       {@link ReliabilityPolicy#retryTimeout()}.</li>
 *   <li>Any retransmission puts the sender in recovery mode; it leaves recovery
 *       mode once nothing is pending. Recovery mode is advisory only.</li>
 *   <li>With bounded retries, an entry that would exceed
 *       {@link ReliabilityPolicy#maxRetries()} is dropped and reported to the
 *       exhaustion callback, which is expected to tear the session down.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link #send(ChatMessage, String)} and {@link #onAck(AckPayload)} may be called
 * from any thread; sweeps run on the supplied scheduler. All bookkeeping is
 * guarded by one lock which is never held across an endpoint send or a callback.
 *
 * <h2>Ordering</h2>
 * None. A retransmitted earlier sequence may arrive after a later one.
 */
public final class ReliableDatagramSender
{
    private static final Logger log = LoggerFactory.getLogger(ReliableDatagramSender.class);

    private final String peerIdentifier;
    private final SocketAddress remote;
    private final DatagramEndpoint endpoint;
    private final ReliableTransportContext context;
    private final MonotonicScheduler scheduler;
    private final Consumer<PendingSend> onRetriesExhausted;

    private final Object lock = new Object();

    // Guarded by lock.
    private final Map<Long, PendingSend> pending = new LinkedHashMap<>();
    private long nextSequence;
    private boolean recoveryMode;
    private boolean closed;
    private Cancellable armedSweep;

    public ReliableDatagramSender(String peerIdentifier,
                                  SocketAddress remote,
                                  DatagramEndpoint endpoint,
                                  ReliableTransportContext context,
                                  MonotonicScheduler scheduler,
                                  Consumer<PendingSend> onRetriesExhausted)
    {
        this.peerIdentifier = Objects.requireNonNull(peerIdentifier, "peerIdentifier");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.context = Objects.requireNonNull(context, "context");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.onRetriesExhausted = Objects.requireNonNull(onRetriesExhausted, "onRetriesExhausted");
    }

    /**
     * Sends {@code message} reliably. Its content is replaced on the wire by an
     * envelope carrying the assigned sequence number and the original content.
     *
     * @param message a {@link MessageKind#CHAT} message
     * @param testId  optional correlation tag, echoed in the acknowledgement
     * @return the assigned sequence number
     * @throws IllegalStateException if the sender has been closed
     */
    public long send(ChatMessage message, String testId)
    {
        Objects.requireNonNull(message, "message");
        if (message.kind() != MessageKind.CHAT) {
            throw new IllegalArgumentException("Only chat messages are sent reliably: " + message.kind());
        }

        final long sequence;
        final byte[] bytes;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Sender for " + peerIdentifier + " is closed");
            }
            sequence = nextSequence++;
            String envelope = context.envelopes()
                    .encodeEnvelope(new ReliableEnvelope(sequence, message.content(), testId));
            bytes = context.codec().encode(message.withContent(envelope));
            pending.put(sequence, new PendingSend(sequence, bytes, context.clock().nowNanos()));
            armSweepIfIdle();
        }

        log.debug("Peer {}: sending sequence {}", peerIdentifier, sequence);
        endpoint.send(remote, bytes);
        return sequence;
    }

    public long send(ChatMessage message)
    {
        return send(message, null);
    }

    /**
     * Removes the pending send matching {@code ack}.
     *
     * @return {@code true} if a pending send was removed; {@code false} for a
     *         duplicate or unknown acknowledgement
     */
    public boolean onAck(AckPayload ack)
    {
        Objects.requireNonNull(ack, "ack");

        boolean removed;
        boolean leftRecovery = false;
        synchronized (lock) {
            removed = pending.remove(ack.sequence()) != null;
            if (pending.isEmpty()) {
                cancelSweep();
                leftRecovery = leaveRecoveryMode();
            }
        }

        if (removed) {
            log.debug("Peer {}: sequence {} acknowledged", peerIdentifier, ack.sequence());
        }
        if (leftRecovery) {
            emitRecoveryMode(false, 0);
        }
        return removed;
    }

    /**
     * One retry pass over the pending set.
     *
     * <p>Normally driven by the scheduler; exposed so deterministic tests can
     * drive it directly.</p>
     */
    void sweep()
    {
        final List<PendingSend> resend = new ArrayList<>();
        final List<PendingSend> exhausted = new ArrayList<>();
        boolean enteredRecovery = false;
        boolean leftRecovery = false;
        int stillPending;

        synchronized (lock) {
            if (closed) {
                return;
            }

            final ReliabilityPolicy policy = context.policy();
            final long now = context.clock().nowNanos();
            final long timeoutNanos = policy.retryTimeout().toNanos();

            Iterator<PendingSend> it = pending.values().iterator();
            while (it.hasNext()) {
                PendingSend p = it.next();
                if (!p.isOlderThan(timeoutNanos, now)) {
                    continue;
                }
                if (policy.retriesBounded() && p.retryCount() >= policy.maxRetries()) {
                    it.remove();
                    exhausted.add(p);
                    continue;
                }
                p.recordRetransmission(now);
                resend.add(p);
            }

            if (!resend.isEmpty() && !recoveryMode) {
                recoveryMode = true;
                enteredRecovery = true;
            }
            if (pending.isEmpty()) {
                leftRecovery = leaveRecoveryMode();
            }
            stillPending = pending.size();
        }

        if (enteredRecovery) {
            emitRecoveryMode(true, stillPending);
        }
        for (PendingSend p : resend) {
            endpoint.send(remote, p.payload());
            context.observability().onRetransmission(new RetransmissionEvent(
                    context.wallClock().now(), peerIdentifier, p.sequence(), p.retryCount()));
        }
        if (leftRecovery) {
            emitRecoveryMode(false, 0);
        }
        for (PendingSend p : exhausted) {
            log.warn("Peer {}: sequence {} unacknowledged after {} retries",
                    peerIdentifier, p.sequence(), p.retryCount());
            try {
                onRetriesExhausted.accept(p);
            }
            catch (RuntimeException e) {
                log.error("Peer {}: retries-exhausted handler failed for sequence {}",
                        peerIdentifier, p.sequence(), e);
                reportError("Retries-exhausted handler failed", e);
            }
        }
    }

    /**
     * Discards every pending send and stops the retry loop. Nothing is
     * retransmitted after this returns. Idempotent.
     *
     * @return number of pending sends discarded
     */
    public int close()
    {
        synchronized (lock) {
            if (closed) {
                return 0;
            }
            closed = true;
            int discarded = pending.size();
            pending.clear();
            recoveryMode = false;
            cancelSweep();
            if (discarded > 0) {
                log.debug("Peer {}: discarded {} pending sends", peerIdentifier, discarded);
            }
            return discarded;
        }
    }

    public int pendingCount()
    {
        synchronized (lock) {
            return pending.size();
        }
    }

    public List<Long> pendingSequences()
    {
        synchronized (lock) {
            return List.copyOf(pending.keySet());
        }
    }

    public boolean inRecoveryMode()
    {
        synchronized (lock) {
            return recoveryMode;
        }
    }

    public boolean isClosed()
    {
        synchronized (lock) {
            return closed;
        }
    }

    // -------------------------------------------------------------------------
    // Retry loop
    // -------------------------------------------------------------------------

    private void runScheduledSweep()
    {
        synchronized (lock) {
            armedSweep = null;
        }

        try {
            sweep();
        }
        catch (RuntimeException e) {
            log.error("Peer {}: retry sweep failed", peerIdentifier, e);
            reportError("Retry sweep failed", e);
        }
        finally {
            synchronized (lock) {
                if (!pending.isEmpty()) {
                    armSweepIfIdle();
                }
            }
        }
    }

    // Caller holds lock.
    private void armSweepIfIdle()
    {
        if (closed || armedSweep != null) {
            return;
        }
        armedSweep = scheduler.scheduleAfter(
                context.policy().retryInterval(), context.clock(), this::runScheduledSweep);
    }

    // Caller holds lock.
    private void cancelSweep()
    {
        Cancellable sweepHandle = armedSweep;
        armedSweep = null;
        if (sweepHandle != null) {
            sweepHandle.cancel();
        }
    }

    // Caller holds lock.
    private boolean leaveRecoveryMode()
    {
        if (!recoveryMode) {
            return false;
        }
        recoveryMode = false;
        return true;
    }

    private void reportError(String what, Throwable cause)
    {
        context.observability().onError(new ChatErrorEvent(
                context.wallClock().now(), peerIdentifier, what, cause));
    }

    private void emitRecoveryMode(boolean active, int pendingSends)
    {
        context.observability().onRecoveryModeChanged(new RecoveryModeEvent(
                context.wallClock().now(), peerIdentifier, active, pendingSends));
    }
}
