package io.mediarealm.core.error;

import java.util.Objects;

/**
 * Root of all domain failures. Carries an {@link ErrorKind} so adapters
 * (HTTP, CLI, daemon) can decide how to react without inspecting types.
 */
public class MediaRealmException extends RuntimeException {
    private final ErrorKind kind;

    public MediaRealmException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public MediaRealmException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
