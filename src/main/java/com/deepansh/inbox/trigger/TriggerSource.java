package com.deepansh.inbox.trigger;

/** Where trigger events come from. Each {@link #open()} is one connection attempt. */
public interface TriggerSource {

    /**
     * @throws com.deepansh.inbox.exception.SubscriptionConnectionException when the connection cannot be made
     */
    TriggerConnection open();
}
