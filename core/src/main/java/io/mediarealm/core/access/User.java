package io.mediarealm.core.access;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The caller of an operation. Authentication happens elsewhere; by the time
 * a User exists, its username and roles are trusted.
 * <p>
 * Every user, logged in or not, holds {@link #ROLE_ANONYMOUS}.
 */
public record User(String username, String displayName, Set<String> roles) {

    public static final String ROLE_ANONYMOUS = "ROLE_ANONYMOUS";

    private static final User ANONYMOUS = new User(null, null, Set.of());

    public User {
        Set<String> r = new HashSet<>(roles == null ? Set.of() : roles);
        r.add(ROLE_ANONYMOUS);
        roles = Set.copyOf(r);
    }

    public static User anonymous() {
        return ANONYMOUS;
    }

    public static User of(String username, String... roles) {
        Objects.requireNonNull(username, "username");
        return new User(username, username, Set.of(roles));
    }

    public boolean loggedIn() {
        return username != null;
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
