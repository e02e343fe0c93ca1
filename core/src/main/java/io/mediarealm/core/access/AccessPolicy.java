package io.mediarealm.core.access;

import java.util.Objects;

/** The distinguished roles the resolver needs to know about. */
public record AccessPolicy(String adminRole, String moderatorRole) {

    public static final String DEFAULT_ADMIN_ROLE = "ROLE_ADMIN";
    public static final String DEFAULT_MODERATOR_ROLE = "ROLE_TOBIRA_MODERATOR";

    public AccessPolicy {
        Objects.requireNonNull(adminRole, "adminRole");
        Objects.requireNonNull(moderatorRole, "moderatorRole");
    }

    public static AccessPolicy defaults() {
        return new AccessPolicy(DEFAULT_ADMIN_ROLE, DEFAULT_MODERATOR_ROLE);
    }
}
