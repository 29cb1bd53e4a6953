package dev.automate.model;

import java.util.Locale;

/**
 * Which forms a catalog command supports.
 */
public enum CommandKind {
    SET_ONLY,
    QUERY_ONLY,
    BOTH;

    public static CommandKind fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "set", "set-only", "write" -> SET_ONLY;
            case "query", "query-only" -> QUERY_ONLY;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException("Unknown command kind: " + name);
        };
    }
}
