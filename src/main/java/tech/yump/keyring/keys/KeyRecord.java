package tech.yump.keyring.keys;

import org.springframework.lang.Nullable;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One generated key pair plus its lifecycle metadata. Instances are immutable; every state
 * transition returns a new record. The private key is only held while the key is
 * {@link KeyState#STANDBY} or {@link KeyState#ACTIVE} and is dropped on retirement.
 *
 * @param keyId         random UUID, published as the JWS "kid"
 * @param algorithm     JWS algorithm the key is bound to
 * @param publicKey     verification key (X.509 encodable)
 * @param privateKey    signing key (PKCS#8 encodable), null once the key has left ACTIVE
 * @param createdAt     generation time
 * @param state         current lifecycle state
 * @param activatedAt   promotion time, null while standby
 * @param retiringSince time the key was superseded, null until RETIRING
 * @param expiresAt     {@code retiringSince + overlap}, null until RETIRING
 */
public record KeyRecord(
        String keyId,
        KeyAlgorithm algorithm,
        PublicKey publicKey,
        @Nullable PrivateKey privateKey,
        Instant createdAt,
        KeyState state,
        @Nullable Instant activatedAt,
        @Nullable Instant retiringSince,
        @Nullable Instant expiresAt
) {

    public KeyRecord {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(state, "state");
        boolean signingCapable = state == KeyState.STANDBY || state == KeyState.ACTIVE;
        if (signingCapable && privateKey == null) {
            throw new IllegalArgumentException("A " + state + " key must carry its private key (kid: " + keyId + ")");
        }
        if (!signingCapable && privateKey != null) {
            throw new IllegalArgumentException("A " + state + " key must not carry a private key (kid: " + keyId + ")");
        }
        if (state == KeyState.ACTIVE && activatedAt == null) {
            throw new IllegalArgumentException("An ACTIVE key requires activatedAt (kid: " + keyId + ")");
        }
        if (state == KeyState.RETIRING && (retiringSince == null || expiresAt == null)) {
            throw new IllegalArgumentException("A RETIRING key requires retiringSince and expiresAt (kid: " + keyId + ")");
        }
    }

    /**
     * Creates a freshly generated, not yet promoted key.
     */
    public static KeyRecord standby(String keyId, KeyAlgorithm algorithm, PublicKey publicKey,
                                    PrivateKey privateKey, Instant createdAt) {
        return new KeyRecord(keyId, algorithm, publicKey, privateKey, createdAt,
                KeyState.STANDBY, null, null, null);
    }

    /**
     * Recreates a superseded key from its persisted public half.
     */
    public static KeyRecord retired(String keyId, KeyAlgorithm algorithm, PublicKey publicKey, Instant createdAt,
                                    @Nullable Instant activatedAt, Instant retiringSince, Instant expiresAt) {
        return new KeyRecord(keyId, algorithm, publicKey, null, createdAt,
                KeyState.RETIRING, activatedAt, retiringSince, expiresAt);
    }

    KeyRecord activate(Instant now) {
        if (state != KeyState.STANDBY) {
            throw new IllegalStateException("Only a STANDBY key can be activated; kid " + keyId + " is " + state);
        }
        return new KeyRecord(keyId, algorithm, publicKey, privateKey, createdAt,
                KeyState.ACTIVE, now, null, null);
    }

    KeyRecord retire(Instant now, Duration overlap) {
        if (state != KeyState.ACTIVE) {
            throw new IllegalStateException("Only an ACTIVE key can be retired; kid " + keyId + " is " + state);
        }
        return new KeyRecord(keyId, algorithm, publicKey, null, createdAt,
                KeyState.RETIRING, activatedAt, now, now.plus(overlap));
    }

    KeyRecord expire() {
        if (state != KeyState.RETIRING) {
            throw new IllegalStateException("Only a RETIRING key can expire; kid " + keyId + " is " + state);
        }
        return new KeyRecord(keyId, algorithm, publicKey, null, createdAt,
                KeyState.EXPIRED, activatedAt, retiringSince, expiresAt);
    }

    /**
     * Whether tokens signed by this key are still accepted at {@code now}: always for the
     * active key, and for a retiring key strictly before {@code expiresAt + validationGrace}.
     */
    public boolean isEligibleAt(Instant now, Duration validationGrace) {
        return switch (state) {
            case ACTIVE -> true;
            case RETIRING -> now.isBefore(expiresAt.plus(validationGrace));
            case STANDBY, EXPIRED -> false;
        };
    }

    boolean isPastGrace(Instant now, Duration validationGrace) {
        return state == KeyState.RETIRING && expiresAt.plus(validationGrace).isBefore(now);
    }

    @Override
    public String toString() {
        return "KeyRecord[keyId=" + keyId
                + ", algorithm=" + algorithm
                + ", state=" + state
                + ", createdAt=" + createdAt
                + ", activatedAt=" + activatedAt
                + ", retiringSince=" + retiringSince
                + ", expiresAt=" + expiresAt + "]";
    }
}
