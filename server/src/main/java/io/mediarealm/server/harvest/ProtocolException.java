package io.mediarealm.server.harvest;

import io.mediarealm.core.error.ErrorKind;
import io.mediarealm.core.error.MediaRealmException;

/**
 * The source answered with something we cannot interpret. Not retryable:
 * sync for the source halts until an operator resumes it.
 */
public class ProtocolException extends MediaRealmException {
    public ProtocolException(String message) {
        super(ErrorKind.PROTOCOL, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorKind.PROTOCOL, message, cause);
    }
}
