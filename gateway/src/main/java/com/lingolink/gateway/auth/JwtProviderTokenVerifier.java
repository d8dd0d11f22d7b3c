package com.lingolink.gateway.auth;

import com.lingolink.core.auth.CredentialException;
import com.lingolink.core.auth.CredentialFailure;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Verifies HMAC-signed JWTs with jjwt.
 * <p>
 * The parser reads time from the gateway scheduler so expiry agrees with every other
 * timer on the node.
 * </p>
 */
public class JwtProviderTokenVerifier implements ProviderTokenVerifier {

    private final JwtParser parser;

    /**
     * @param signingKey HMAC key, at least 32 bytes of UTF-8
     * @param scheduler  clock source
     */
    public JwtProviderTokenVerifier(String signingKey, Scheduler scheduler) {
        SecretKey key = Keys.hmacShaKeyFor(signingKey.getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser()
            .verifyWith(key)
            .clock(() -> new Date(scheduler.now(TimeUnit.MILLISECONDS)))
            .build();
    }

    @Override
    public Mono<VerifiedToken> verify(String token) {
        return Mono.fromCallable(() -> toVerifiedToken(parser.parseSignedClaims(token).getPayload()))
            .onErrorMap(err -> !(err instanceof CredentialException), JwtProviderTokenVerifier::toCredentialException);
    }

    private static VerifiedToken toVerifiedToken(Claims claims) {
        Set<String> audience = claims.getAudience();
        return VerifiedToken.builder()
            .subject(claims.getSubject())
            .issuer(claims.getIssuer())
            .audience(audience == null ? Set.of() : Set.copyOf(audience))
            .issuedAt(toInstant(claims.getIssuedAt()))
            .expiresAt(toInstant(claims.getExpiration()))
            .build();
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static CredentialException toCredentialException(Throwable err) {
        if (err instanceof ExpiredJwtException) {
            return new CredentialException(CredentialFailure.EXPIRED, "token expired", err);
        }
        if (err instanceof io.jsonwebtoken.security.SecurityException) {
            return new CredentialException(CredentialFailure.INVALID_SIGNATURE, "signature rejected", err);
        }
        if (err instanceof JwtException || err instanceof IllegalArgumentException) {
            return new CredentialException(CredentialFailure.MALFORMED, "token rejected: " + err.getMessage(), err);
        }
        return new CredentialException(CredentialFailure.MALFORMED, "unexpected verification error", err);
    }
}
