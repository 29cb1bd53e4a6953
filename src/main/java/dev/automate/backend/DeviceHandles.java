package dev.automate.backend;

/**
 * Python expressions naming a device's open connections. A hybrid device has a command
 * handle and a separate streaming handle; every other device uses one handle for both.
 */
public record DeviceHandles(String command, String streaming) {

    public static DeviceHandles single(String handle) {
        return new DeviceHandles(handle, handle);
    }

    /** Expression used when the device is the only one: a variable named after the alias. */
    public static String variable(String alias) {
        return PythonLiterals.identifier(alias);
    }

    /** Expression used when the program talks to several devices. */
    public static String mapEntry(String alias) {
        return "devices['%s']".formatted(alias);
    }
}
