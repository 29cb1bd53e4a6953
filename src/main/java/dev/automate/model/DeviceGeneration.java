package dev.automate.model;

/**
 * Instrument firmware generation, which decides the screenshot protocol.
 */
public enum DeviceGeneration {
    MODERN,
    LEGACY;

    public static DeviceGeneration fromName(String name) {
        return "LEGACY".equalsIgnoreCase(name.trim()) ? LEGACY : MODERN;
    }
}
