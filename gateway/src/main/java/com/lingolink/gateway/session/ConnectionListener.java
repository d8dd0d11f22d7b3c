package com.lingolink.gateway.session;

import com.lingolink.core.model.Identity;

/**
 * Registry lifecycle callbacks. Invoked synchronously on the thread that changed the
 * registry; implementations must not block.
 */
public interface ConnectionListener {

    /**
     * The user's first live connection was registered.
     */
    default void userOnline(Identity identity) {
    }

    /**
     * The user's last live connection was unregistered.
     */
    default void userOffline(String userId) {
    }

    /**
     * A registered connection was unregistered; drop anything keyed by it.
     */
    default void connectionRemoved(Connection connection) {
    }
}
