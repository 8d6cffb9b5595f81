package com.questrail.chatwire.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ChatObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jChatObservabilitySink implements ChatObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jChatObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        if (event.isActivation()) {
            log.info("Session {}: {} -> {} ({})",
                event.peerIdentifier(),
                event.oldState(),
                event.newState(),
                event.cause());
        }
        else {
            log.debug("Session {}: {} -> {} ({})",
                event.peerIdentifier(),
                event.oldState(),
                event.newState(),
                event.cause());
        }
    }

    @Override
    public void onRetransmission(RetransmissionEvent event) {
        log.debug("Peer {}: retransmitting sequence {} (retry {})",
            event.peerIdentifier(), event.sequence(), event.retryCount());
    }

    @Override
    public void onRecoveryModeChanged(RecoveryModeEvent event) {
        if (event.active()) {
            log.warn("Peer {}: entering recovery mode, {} pending",
                event.peerIdentifier(), event.pendingSends());
        }
        else {
            log.info("Peer {}: recovery complete", event.peerIdentifier());
        }
    }

    @Override
    public void onError(ChatErrorEvent event) {
        log.error("Chat transport error [{}]: {}",
            event.peerIdentifier() != null ? event.peerIdentifier() : "-",
            event.message(),
            event.cause());
    }
}
