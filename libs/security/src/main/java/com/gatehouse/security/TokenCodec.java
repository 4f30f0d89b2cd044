package com.gatehouse.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and validates HMAC-signed JWT access tokens.
 *
 * <p>A token carries exactly three claims: {@code sub}, {@code scopes} (JSON array of strings)
 * and {@code exp}. Signing uses the secret and algorithm from {@link TokenSettings}; time comes
 * from the injected {@link Clock}. Decoding applies no clock-skew leeway: a token is valid strictly
 * before its {@code exp} second.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class TokenCodec {

    /** Lifetime used when the caller does not supply one. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    /** Claim name for the granted scopes. */
    public static final String SCOPES_CLAIM = "scopes";

    private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

    private final JWSAlgorithm algorithm;
    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final Clock clock;

    public TokenCodec(TokenSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public TokenCodec(TokenSettings settings, Clock clock) {
        if (settings == null || clock == null) {
            throw new IllegalArgumentException("settings and clock must not be null");
        }
        this.algorithm = settings.jwsAlgorithm();
        this.clock = clock;
        try {
            this.signer = new MACSigner(settings.secretBytes());
            this.verifier = new MACVerifier(settings.secretBytes());
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Signing secret rejected: " + e.getMessage(), e);
        }
    }

    /**
     * Issues a token valid for {@link #DEFAULT_TTL}.
     */
    public String issue(String subject, List<String> scopes) {
        return issue(subject, scopes, null);
    }

    /**
     * Issues a signed token.
     *
     * @param subject principal id
     * @param scopes granted scopes, in order
     * @param ttl lifetime from now; {@link #DEFAULT_TTL} when null
     * @return the compact serialized token
     * @throws IllegalArgumentException if the subject is blank or the ttl is not positive
     */
    public String issue(String subject, List<String> scopes, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        Duration lifetime = ttl == null ? DEFAULT_TTL : ttl;
        if (lifetime.isZero() || lifetime.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        Instant expiresAt = clock.instant().plus(lifetime).truncatedTo(ChronoUnit.SECONDS);
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(subject)
                .claim(SCOPES_CLAIM, scopes == null ? List.of() : List.copyOf(scopes))
                .expirationTime(Date.from(expiresAt))
                .build();
        JWSHeader header = new JWSHeader.Builder(algorithm).type(JOSEObjectType.JWT).build();

        SignedJWT jwt = new SignedJWT(header, claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Unable to sign access token", e);
        }
        log.debug("Issued access token sub={} scopes={} exp={}", subject, scopes, expiresAt);
        return jwt.serialize();
    }

    /**
     * Verifies a token and returns its claims.
     *
     * @param token compact serialized token
     * @return the verified claims
     * @throws InvalidTokenException on malformed structure, wrong algorithm, bad signature,
     *     missing subject or expiry, or expiry at or before now
     */
    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("token is empty");
        }
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new InvalidTokenException("token is malformed", e);
        }

        if (!algorithm.equals(jwt.getHeader().getAlgorithm())) {
            throw new InvalidTokenException("unexpected signing algorithm " + jwt.getHeader().getAlgorithm());
        }
        try {
            if (!jwt.verify(verifier)) {
                throw new InvalidTokenException("signature verification failed");
            }
        } catch (JOSEException e) {
            throw new InvalidTokenException("signature verification failed", e);
        }

        JWTClaimsSet claims;
        List<String> scopes;
        try {
            claims = jwt.getJWTClaimsSet();
            scopes = claims.getStringListClaim(SCOPES_CLAIM);
        } catch (ParseException e) {
            throw new InvalidTokenException("token claims are malformed", e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException("token has no subject");
        }
        Date exp = claims.getExpirationTime();
        if (exp == null) {
            throw new InvalidTokenException("token has no expiry");
        }
        Instant expiresAt = exp.toInstant();
        if (!clock.instant().isBefore(expiresAt)) {
            throw new InvalidTokenException("token expired at " + expiresAt);
        }
        return new TokenClaims(subject, scopes, expiresAt);
    }
}
