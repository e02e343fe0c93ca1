package io.mediarealm.core.access;

import io.mediarealm.core.mirror.Acl;
import io.mediarealm.core.mirror.Event;
import io.mediarealm.core.mirror.Series;
import io.mediarealm.core.realm.Realm;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Computes effective read/write permissions.
 * <p>
 * Rules:
 *  - The admin role may do anything.
 *  - Events: read/write if the user's roles intersect the ACL's read/write set.
 *  - Series and realms have no ACL: everybody may read them.
 *  - Realms: user realms are writable by their owner; all other realms by the
 *    moderator role.
 * <p>
 * Stateless apart from the configured policy; safe to share between the
 * query surface and the mutation API.
 */
public final class AccessControl {

    private final AccessPolicy policy;

    public AccessControl(AccessPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public AccessPolicy policy() {
        return policy;
    }

    public boolean isAdmin(User user) {
        return user.hasRole(policy.adminRole());
    }

    public boolean canRead(User user, Event event) {
        return isAdmin(user) || intersects(user.roles(), event.acl().readRoles());
    }

    public boolean canWrite(User user, Event event) {
        return isAdmin(user) || intersects(user.roles(), event.acl().writeRoles());
    }

    public boolean canRead(User user, Acl acl) {
        return isAdmin(user) || intersects(user.roles(), acl.readRoles());
    }

    public boolean canRead(User user, Series series) {
        return true;
    }

    public boolean canRead(User user, Realm realm) {
        return true;
    }

    public boolean canWrite(User user, Realm realm) {
        if (isAdmin(user)) {
            return true;
        }
        if (realm.isUserRealm()) {
            return user.loggedIn() && realm.owner().equals(user.username());
        }
        return user.hasRole(policy.moderatorRole());
    }

    /** Whether the user may create their own user realm. */
    public boolean canCreateUserRealm(User user) {
        return user.loggedIn();
    }

    private static boolean intersects(Set<String> a, Set<String> b) {
        return !Collections.disjoint(a, b);
    }
}
