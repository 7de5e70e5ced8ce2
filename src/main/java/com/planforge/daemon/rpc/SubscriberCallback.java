package com.planforge.daemon.rpc;

import com.planforge.daemon.SessionRecord;

/**
 * Receives notifications pushed by the daemon. Called on the subscriber's reader thread.
 */
public interface SubscriberCallback {

    void sessionChanged(SessionRecord record);

    void daemonRestarting(String newSha);

    /** Health check; a subscriber that answers anything but {@code true} is dropped. */
    default boolean ping() {
        return true;
    }
}
