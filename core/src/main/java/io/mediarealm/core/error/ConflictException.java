package io.mediarealm.core.error;

/** A concurrent structural mutation collided with this one. Safe to retry. */
public class ConflictException extends MediaRealmException {
    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
