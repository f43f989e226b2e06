package tech.yump.keyring.events;

import org.springframework.lang.Nullable;
import tech.yump.keyring.keys.KeyAlgorithm;
import tech.yump.keyring.token.ValidationOutcome;

import java.util.List;

/**
 * Receives keyring events for monitoring. Implementations must be thread-safe, must not
 * block, and must not throw: they are called from issuance, validation and rotation paths.
 */
public interface KeyEventSink {

    void keyGenerated(String keyId, KeyAlgorithm algorithm);

    void keyGenerationFailed(Throwable cause);

    /**
     * The keyring activated its first key at startup.
     *
     * @param restoredKeys number of retiring keys recovered from persistence
     */
    void bootstrapCompleted(String activeKeyId, int restoredKeys);

    void rotationCompleted(@Nullable String previousKeyId, String newKeyId, boolean forced);

    void rotationFailed(Throwable cause, boolean forced);

    void keysRemoved(List<String> keyIds);

    void persistenceFailed(Throwable cause);

    void tokenIssued(String keyId);

    /**
     * @param keyId the key that verified the signature, null when none did
     */
    void validationCompleted(ValidationOutcome outcome, @Nullable String keyId);
}
