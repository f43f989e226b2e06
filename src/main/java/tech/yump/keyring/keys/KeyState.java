package tech.yump.keyring.keys;

/**
 * Lifecycle of a signing key. Keys only ever move forward through these states.
 */
public enum KeyState {
    STANDBY,
    ACTIVE,
    RETIRING,
    EXPIRED
}
