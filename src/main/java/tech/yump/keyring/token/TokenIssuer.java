package tech.yump.keyring.token;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.keyring.config.KeyringProperties;
import tech.yump.keyring.events.KeyEventSink;
import tech.yump.keyring.keys.KeyRecord;
import tech.yump.keyring.keys.SigningKeyStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Signs claim sets with the current active key and stamps its id into the "kid" header.
 * Only the active key is ever used; the key is read once per token, so a concurrent
 * rotation yields either the old or the new key, never a gap.
 */
@Service
@Slf4j
public class TokenIssuer {

    private final SigningKeyStore keyStore;
    private final KeyEventSink eventSink;
    private final Clock clock;
    private final String issuer;
    private final Duration defaultLifetime;

    public TokenIssuer(SigningKeyStore keyStore, KeyEventSink eventSink, Clock clock, KeyringProperties properties) {
        this.keyStore = keyStore;
        this.eventSink = eventSink;
        this.clock = clock;
        this.issuer = properties.signing().issuer();
        this.defaultLifetime = properties.signing().defaultTokenLifetime();
    }

    /**
     * Signs the claims with the configured default lifetime.
     */
    public String issue(Map<String, Object> claims) {
        return issue(claims, defaultLifetime);
    }

    /**
     * Signs the claims. "iat", "exp" ({@code iat + lifetime}) are always set by the issuer;
     * "iss" and "jti" are filled in unless the caller supplied them.
     *
     * @throws IllegalArgumentException if the lifetime is not positive.
     * @throws tech.yump.keyring.keys.NoActiveKeyException before bootstrap.
     */
    public String issue(Map<String, Object> claims, Duration lifetime) {
        if (lifetime == null || lifetime.isZero() || lifetime.isNegative()) {
            throw new IllegalArgumentException("Token lifetime must be positive, got: " + lifetime);
        }
        KeyRecord active = keyStore.getActive();
        Instant now = clock.instant();
        Map<String, Object> safeClaims = new LinkedHashMap<>(claims == null ? Map.of() : claims);
        // Time claims belong to the issuer.
        safeClaims.remove(Claims.ISSUED_AT);
        safeClaims.remove(Claims.EXPIRATION);

        String token = Jwts.builder()
                .header()
                .keyId(active.keyId())
                .and()
                .claims(safeClaims)
                .issuer(stringClaim(safeClaims, Claims.ISSUER, issuer))
                .id(stringClaim(safeClaims, Claims.ID, UUID.randomUUID().toString()))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(lifetime)))
                .signWith(active.privateKey(), active.algorithm().signatureAlgorithm())
                .compact();

        log.debug("Issued token with key {} ({}), expires in {}", active.keyId(), active.algorithm(), lifetime);
        eventSink.tokenIssued(active.keyId());
        return token;
    }

    private static String stringClaim(Map<String, Object> claims, String name, String fallback) {
        Object value = claims.get(name);
        return value != null ? value.toString() : fallback;
    }
}
