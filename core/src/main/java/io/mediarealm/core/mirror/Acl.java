package io.mediarealm.core.mirror;

import java.util.Set;

/**
 * Access-control list: paired read/write role sets attached to an event.
 * An empty set grants nothing on its own; admins bypass the ACL entirely.
 */
public record Acl(Set<String> readRoles, Set<String> writeRoles) {

    public Acl {
        readRoles = readRoles == null ? Set.of() : Set.copyOf(readRoles);
        writeRoles = writeRoles == null ? Set.of() : Set.copyOf(writeRoles);
    }

    public static Acl empty() {
        return new Acl(Set.of(), Set.of());
    }
}
