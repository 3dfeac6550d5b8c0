package com.example.automation.service.webhook;

/**
 * What happened to an accepted inbound webhook request.
 */
public enum InboundResult {
    /**
     * Turned into a platform event
     */
    ACCEPTED,
    /**
     * The webhook is not subscribed to this event type
     */
    IGNORED,
    /**
     * Already received once; dropped
     */
    DUPLICATE
}
