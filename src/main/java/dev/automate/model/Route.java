package dev.automate.model;

import java.util.Locale;

/**
 * Sub-backend a step targets on a hybrid device.
 */
public enum Route {
    /** Handled by the raw command interface or the driver framework. */
    COMMAND,
    /** Handled by the streaming client inside a data-access context. */
    STREAMING;

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Route fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
