package tech.yump.keyring.keys;

public class StandbyAlreadyExistsException extends KeyringException {
    public StandbyAlreadyExistsException(String existingKeyId) {
        super("A standby key already exists (kid: " + existingKeyId + "); at most one standby key is allowed.");
    }
}
