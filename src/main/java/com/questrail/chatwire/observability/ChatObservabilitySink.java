package com.questrail.chatwire.observability;

/**
 * Main interface for receiving chat transport observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked synchronously from whichever thread observed the
 * event. Implementations must be thread-safe and must not block.</p>
 */
public interface ChatObservabilitySink {
    /**
     * Called when a session moves between lifecycle states.
     * @param event the transition event details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called for every retransmission of a pending reliable send.
     * @param event the retransmission details
     */
    void onRetransmission(RetransmissionEvent event);

    /**
     * Called when a peer's reliable sender enters or leaves recovery mode.
     * @param event the recovery mode change
     */
    void onRecoveryModeChanged(RecoveryModeEvent event);

    /**
     * Called when an error or anomaly occurs in the transport stack.
     * @param event the error event
     */
    void onError(ChatErrorEvent event);
}
