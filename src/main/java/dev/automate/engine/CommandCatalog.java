package dev.automate.engine;

import dev.automate.model.CatalogEntry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only command catalog, looked up by name without regard to case.
 */
public final class CommandCatalog {

    private static final CommandCatalog EMPTY = new CommandCatalog(List.of());

    private final Map<String, CatalogEntry> entries;

    public CommandCatalog(List<CatalogEntry> entries) {
        var byName = new LinkedHashMap<String, CatalogEntry>();
        for (CatalogEntry entry : entries) {
            byName.putIfAbsent(key(entry.name()), entry);
        }
        this.entries = Collections.unmodifiableMap(byName);
    }

    public static CommandCatalog empty() {
        return EMPTY;
    }

    public Optional<CatalogEntry> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key(name)));
    }

    public Collection<CatalogEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
