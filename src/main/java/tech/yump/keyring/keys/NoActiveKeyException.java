package tech.yump.keyring.keys;

/**
 * Thrown when the keyring is used before an active key has been bootstrapped.
 */
public class NoActiveKeyException extends KeyringException {
    public NoActiveKeyException() {
        super("No active signing key is available; the keyring has not been bootstrapped.");
    }
}
