package tech.yump.keyring.keys;

/**
 * Base exception for errors raised by the keyring: key generation, the key store and rotation.
 */
public class KeyringException extends RuntimeException {
    public KeyringException(String message) {
        super(message);
    }

    public KeyringException(String message, Throwable cause) {
        super(message, cause);
    }
}
