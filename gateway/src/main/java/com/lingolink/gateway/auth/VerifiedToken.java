package com.lingolink.gateway.auth;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Claims of a provider token whose signature has been checked.
 */
@Value
@Builder
public class VerifiedToken {
    String subject;
    String issuer;
    Set<String> audience;
    Instant issuedAt;
    Instant expiresAt;
}
