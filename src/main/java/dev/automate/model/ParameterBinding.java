package dev.automate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bound parameter values of one step. Lookups are case-insensitive; keys are normalized
 * once on construction ({@code "Digital-Bit"} and {@code "digital_bit"} are the same key).
 */
public final class ParameterBinding {

    private static final List<String> COMPANION_SUFFIXES = List.of("_number", "_custom");

    private static final ParameterBinding EMPTY = new ParameterBinding(Map.of());

    private final Map<String, String> values;        // normalized key -> value
    private final Map<String, String> originalKeys;  // normalized key -> key as declared

    private ParameterBinding(Map<String, String> declared) {
        var normalizedValues = new LinkedHashMap<String, String>();
        var keys = new LinkedHashMap<String, String>();
        for (var entry : declared.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            String key = normalize(entry.getKey());
            if (!normalizedValues.containsKey(key)) {
                normalizedValues.put(key, entry.getValue());
                keys.put(key, entry.getKey());
            }
        }
        this.values = Collections.unmodifiableMap(normalizedValues);
        this.originalKeys = Collections.unmodifiableMap(keys);
    }

    public static ParameterBinding of(Map<String, String> declared) {
        return declared.isEmpty() ? EMPTY : new ParameterBinding(declared);
    }

    public static ParameterBinding empty() {
        return EMPTY;
    }

    public static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }

    /** Bound value, or null. */
    public String get(String name) {
        return values.get(normalize(name));
    }

    public boolean has(String name) {
        return values.containsKey(normalize(name));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Copy with values bound under a key of {@code renames} moved to the mapped key, along with
     * their {@code _number} and {@code _custom} companions. A value stays where it is when its
     * target key is already bound.
     */
    public ParameterBinding renamed(Map<String, String> renames) {
        if (renames.isEmpty() || values.isEmpty()) {
            return this;
        }
        var result = new LinkedHashMap<String, String>();
        for (var entry : values.entrySet()) {
            String target = renamedKey(entry.getKey(), renames);
            if (target == null || values.containsKey(target) || result.containsKey(target)) {
                result.putIfAbsent(originalKeys.get(entry.getKey()), entry.getValue());
            } else {
                result.put(target, entry.getValue());
            }
        }
        return new ParameterBinding(result);
    }

    private static String renamedKey(String key, Map<String, String> renames) {
        String direct = renames.get(key);
        if (direct != null) {
            return direct;
        }
        for (String suffix : COMPANION_SUFFIXES) {
            if (key.endsWith(suffix)) {
                String base = renames.get(key.substring(0, key.length() - suffix.length()));
                if (base != null) {
                    return base + suffix;
                }
            }
        }
        return null;
    }

    /** Normalized key to value, in declaration order. */
    public Map<String, String> normalized() {
        return values;
    }

    /** Declared key to value, in declaration order. */
    public Map<String, String> asDeclared() {
        var declared = new LinkedHashMap<String, String>();
        values.forEach((key, value) -> declared.put(originalKeys.get(key), value));
        return declared;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParameterBinding other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
