package dev.automate.model;

import java.util.Locale;

/**
 * Communication strategy a generated program uses to talk to an instrument.
 */
public enum Backend {
    DIRECT_RAW("pyvisa"),
    HIGH_LEVEL_DRIVER("tm_devices"),
    STREAMING("tekhsi"),
    HYBRID("hybrid");

    private final String jsonName;

    Backend(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    /**
     * Parse a backend from its JSON name or its enum name. {@code vxi11} is accepted as a
     * raw command interface.
     */
    public static Backend fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("vxi11".equals(normalized)) {
            return DIRECT_RAW;
        }
        for (Backend backend : values()) {
            if (backend.jsonName.equals(normalized) || backend.name().equalsIgnoreCase(normalized)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + name);
    }
}
