package dev.automate.model;

/**
 * An instrument endpoint the generated program connects to.
 */
public record Device(
    String id,
    String alias,
    Backend backend,
    ConnectionDescriptor connection,
    String deviceType,         // SCOPE, AFG, AWG, SMU, PSU, DMM, ...
    String driver,             // nullable, driver class hint for the driver framework
    DeviceGeneration generation,
    Backend hybridCommandBackend // command side of a hybrid device: DIRECT_RAW or HIGH_LEVEL_DRIVER
) {
    public static final String DEFAULT_DEVICE_TYPE = "SCOPE";

    public Device {
        if (deviceType == null || deviceType.isBlank()) {
            deviceType = DEFAULT_DEVICE_TYPE;
        }
        if (generation == null) {
            generation = DeviceGeneration.MODERN;
        }
        if (hybridCommandBackend == null) {
            hybridCommandBackend = Backend.DIRECT_RAW;
        }
    }

    /** A raw-command scope reached over VISA TCPIP. */
    public static Device scope(String id, String alias, Backend backend, String host) {
        return new Device(id, alias, backend, ConnectionDescriptor.tcpip(host),
            DEFAULT_DEVICE_TYPE, null, DeviceGeneration.MODERN, Backend.DIRECT_RAW);
    }

    public Device withBackend(Backend newBackend) {
        return new Device(id, alias, newBackend, connection, deviceType, driver, generation, hybridCommandBackend);
    }
}
