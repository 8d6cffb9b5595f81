package com.questrail.chatwire.api;

/**
 * Receives status and log notices: peer status messages, lifecycle notices
 * and transport errors.
 *
 * <p>Same threading rules as {@link MessageDeliveryListener}.</p>
 */
@FunctionalInterface
public interface StatusListener
{
    void onStatus(String text, boolean error);
}
