package com.lingolink.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Application user resolved from a verified credential.
 * <p>
 * A read-only snapshot taken at authentication time; later profile changes do not
 * reach connections that are already authenticated.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class Identity {
    /**
     * Application user identifier.
     */
    @JsonProperty("id")
    String userId;

    /**
     * Identity provider subject (Firebase uid).
     */
    @JsonProperty("firebaseUid")
    String firebaseUid;

    @JsonProperty("email")
    String email;

    @JsonProperty("displayName")
    String displayName;

    /**
     * Deactivated accounts never authenticate.
     */
    @JsonProperty("isActive")
    boolean active;

    @JsonCreator
    public Identity(
        @JsonProperty("id") String userId,
        @JsonProperty("firebaseUid") String firebaseUid,
        @JsonProperty("email") String email,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("isActive") boolean active
    ) {
        this.userId = userId;
        this.firebaseUid = firebaseUid;
        this.email = email;
        this.displayName = displayName;
        this.active = active;
    }
}
