package io.mediarealm.core.realm;

/** Helpers for materialized realm paths. The root's path is the empty string. */
public final class RealmPaths {

    private RealmPaths() {
    }

    public static String child(String parentPath, String segment) {
        return parentPath + "/" + segment;
    }

    /** True if {@code path} equals {@code ancestor} or lies below it. */
    public static boolean isWithin(String path, String ancestor) {
        if (ancestor.isEmpty()) {
            return true;
        }
        return path.equals(ancestor) || path.startsWith(ancestor + "/");
    }

    /** Re-roots {@code path} from {@code oldPrefix} to {@code newPrefix}. */
    public static String rebase(String path, String oldPrefix, String newPrefix) {
        if (!isWithin(path, oldPrefix)) {
            throw new IllegalArgumentException(path + " is not below " + oldPrefix);
        }
        return newPrefix + path.substring(oldPrefix.length());
    }

    /** Accepts "/", "" and paths with a trailing slash; returns the canonical form. */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String p = path.trim();
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        if (!p.isEmpty() && !p.startsWith("/")) {
            p = "/" + p;
        }
        return p;
    }

    public static String userRealmSegment(String username) {
        return "@" + username;
    }
}
