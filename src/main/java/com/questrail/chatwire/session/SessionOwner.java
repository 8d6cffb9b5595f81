package com.questrail.chatwire.session;

import com.questrail.chatwire.api.CloseReason;

/**
 * Server-side hooks a session calls on lifecycle edges.
 *
 * <p>Both hooks run on the thread that caused the edge, after the session's
 * own callbacks, with no lock held.</p>
 */
public interface SessionOwner
{
    /** The session completed its handshake. */
    void peerJoined(AbstractSession session);

    /** A session that had completed its handshake was torn down. */
    void peerLeft(AbstractSession session, CloseReason reason);
}
