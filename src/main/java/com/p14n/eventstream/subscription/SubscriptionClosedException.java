package com.p14n.eventstream.subscription;

/**
 * Thrown when a subscription has been closed by the server, for example after
 * its token was revoked. The handle cannot be reused: the client should
 * unsubscribe and subscribe again.
 */
public class SubscriptionClosedException extends RuntimeException {

    public SubscriptionClosedException() {
        super("Subscription closed by server, client should resubscribe");
    }

    public SubscriptionClosedException(Throwable cause) {
        super("Subscription closed by server, client should resubscribe", cause);
    }
}
