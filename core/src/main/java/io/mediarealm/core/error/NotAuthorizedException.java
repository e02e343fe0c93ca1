package io.mediarealm.core.error;

public class NotAuthorizedException extends MediaRealmException {
    public NotAuthorizedException(String message) {
        super(ErrorKind.NOT_AUTHORIZED, message);
    }
}
