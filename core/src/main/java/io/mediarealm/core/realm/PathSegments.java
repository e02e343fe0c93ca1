package io.mediarealm.core.realm;

import io.mediarealm.core.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation rules for a realm path segment. Each failed rule is reported by
 * a stable key so callers can show a matching message.
 */
public final class PathSegments {

    public static final String ILLEGAL_CHARS = "<>\"[\\]^`{|}#%/?";
    public static final String RESERVED_START_CHARS = "-+~@_!$&;:.,=*'()";

    public static final String EMPTY = "path-must-not-be-empty";
    public static final String TOO_SHORT = "path-too-short";
    public static final String CONTROL_CHAR = "no-control-in-path";
    public static final String WHITESPACE = "no-space-in-path";
    public static final String ILLEGAL_CHAR = "illegal-chars-in-path";
    public static final String RESERVED_CHAR = "reserved-char-in-path";

    private PathSegments() {
    }

    public static List<String> violations(String segment) {
        List<String> out = new ArrayList<>();
        if (segment == null || segment.isEmpty()) {
            out.add(EMPTY);
            return out;
        }
        if (segment.codePointCount(0, segment.length()) < 2) {
            out.add(TOO_SHORT);
        }
        if (segment.codePoints().anyMatch(Character::isISOControl)) {
            out.add(CONTROL_CHAR);
        }
        if (segment.codePoints().anyMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp))) {
            out.add(WHITESPACE);
        }
        if (segment.chars().anyMatch(c -> ILLEGAL_CHARS.indexOf(c) >= 0)) {
            out.add(ILLEGAL_CHAR);
        }
        if (RESERVED_START_CHARS.indexOf(segment.charAt(0)) >= 0) {
            out.add(RESERVED_CHAR);
        }
        return out;
    }

    public static void requireValid(String segment) {
        List<String> v = violations(segment);
        if (!v.isEmpty()) {
            throw new ValidationException(v);
        }
    }
}
