package com.questrail.chatwire.observability;

/**
 * No-op implementation of ChatObservabilitySink.
 */
public final class NullObservabilitySink implements ChatObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onRetransmission(RetransmissionEvent event) {}

    @Override
    public void onRecoveryModeChanged(RecoveryModeEvent event) {}

    @Override
    public void onError(ChatErrorEvent event) {}
}
