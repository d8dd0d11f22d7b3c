package com.lingolink.gateway.backend;

import com.lingolink.core.model.Identity;
import reactor.core.publisher.Mono;

/**
 * Read access to user accounts.
 */
public interface IdentityLookup {

    /**
     * @param firebaseUid identity provider subject
     * @return the user, or empty when no account is linked to the subject
     */
    Mono<Identity> findByFirebaseUid(String firebaseUid);

    /**
     * @param userId application user id
     * @return the user, or empty when absent
     */
    Mono<Identity> findById(String userId);
}
