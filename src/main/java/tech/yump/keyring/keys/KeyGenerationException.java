package tech.yump.keyring.keys;

/**
 * Thrown when a new key pair cannot be produced, e.g. the JCA provider or the random source fails.
 */
public class KeyGenerationException extends KeyringException {
    public KeyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
