package tech.yump.keyring.keys;

public class NoStandbyKeyException extends KeyringException {
    public NoStandbyKeyException() {
        super("Cannot promote: no standby key is present in the key store.");
    }
}
