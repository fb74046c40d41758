package io.pipingrelay.core.registry;

import java.util.Set;

/**
 * Paths served by fixed handlers. They never take part in a rendezvous.
 */
public final class ReservedPaths {

    public static final String INDEX = "/";
    public static final String NO_SCRIPT = "/noscript";
    public static final String VERSION = "/version";
    public static final String HELP = "/help";
    public static final String ROBOTS_TXT = "/robots.txt";
    public static final String FAVICON_ICO = "/favicon.ico";

    private static final Set<String> ALL = Set.of(INDEX, NO_SCRIPT, VERSION, HELP, ROBOTS_TXT, FAVICON_ICO);

    private ReservedPaths() {
        // utility class
    }

    /** Exact, case-sensitive match against the raw request path. */
    public static boolean isReserved(String path) {
        return path != null && ALL.contains(path);
    }

    /** All reserved paths. */
    public static Set<String> all() {
        return ALL;
    }
}
