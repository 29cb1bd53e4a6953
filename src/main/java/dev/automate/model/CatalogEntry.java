package dev.automate.model;

import java.util.List;

/**
 * One command of the template catalog.
 */
public record CatalogEntry(
    String name,
    String template,
    CommandKind kind,
    List<CommandParam> params
) {
    public CatalogEntry {
        params = params == null ? List.of() : List.copyOf(params);
    }
}
