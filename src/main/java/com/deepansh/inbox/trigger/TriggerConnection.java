package com.deepansh.inbox.trigger;

import java.util.function.Consumer;

/** One open connection to the trigger source. */
public interface TriggerConnection extends AutoCloseable {

    /**
     * Delivers raw events, in arrival order, until the stream ends.
     * Returns normally when the source closes the stream or {@link #close()} is called.
     *
     * @throws com.deepansh.inbox.exception.SubscriptionConnectionException when the connection drops
     */
    void forEachEvent(Consumer<String> handler);

    /** True once the source accepted the connection, even if it dropped afterwards. */
    boolean isConnected();

    /** Safe to call from another thread; unblocks {@link #forEachEvent}. */
    @Override
    void close();
}
