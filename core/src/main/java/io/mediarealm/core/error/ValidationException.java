package io.mediarealm.core.error;

import java.util.List;

/**
 * Bad input to a mutation: invalid path segment, blank name, sibling
 * collision, malformed child order. Lists every rule that failed, using
 * stable keys such as {@code path-too-short}.
 */
public class ValidationException extends MediaRealmException {
    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(ErrorKind.VALIDATION, "invalid input: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String violation, String message) {
        super(ErrorKind.VALIDATION, message);
        this.violations = List.of(violation);
    }

    public List<String> violations() {
        return violations;
    }
}
