package io.mediarealm.server.harvest;

import io.mediarealm.core.error.ErrorKind;
import io.mediarealm.core.error.MediaRealmException;

/** Source unreachable or temporarily failing. Retried with backoff. */
public class TransientHarvestException extends MediaRealmException {
    public TransientHarvestException(String message) {
        super(ErrorKind.TRANSIENT_HARVEST, message);
    }

    public TransientHarvestException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_HARVEST, message, cause);
    }
}
