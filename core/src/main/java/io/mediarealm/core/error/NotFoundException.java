package io.mediarealm.core.error;

/** A referenced id does not exist (anymore). */
public class NotFoundException extends MediaRealmException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
