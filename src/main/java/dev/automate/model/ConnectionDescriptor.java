package dev.automate.model;

/**
 * Where and how an instrument is reached.
 */
public record ConnectionDescriptor(
    ConnectionType type,
    String host,
    int port,
    int timeoutMs,
    String resource // nullable, explicit VISA resource string, wins over type/host/port
) {
    public static final int DEFAULT_SOCKET_PORT = 4000;
    public static final int DEFAULT_TIMEOUT_MS = 5000;

    public static ConnectionDescriptor tcpip(String host) {
        return new ConnectionDescriptor(ConnectionType.TCPIP, host, DEFAULT_SOCKET_PORT, DEFAULT_TIMEOUT_MS, null);
    }

    public static ConnectionDescriptor socket(String host, int port) {
        return new ConnectionDescriptor(ConnectionType.SOCKET, host, port, DEFAULT_TIMEOUT_MS, null);
    }

    /**
     * VISA resource string for this connection.
     */
    public String visaResource() {
        if (resource != null && !resource.isBlank()) {
            return resource;
        }
        return switch (type) {
            case TCPIP -> "TCPIP::%s::INSTR".formatted(host);
            case SOCKET -> "TCPIP::%s::%d::SOCKET".formatted(host, port);
            case USB -> "USB::%s::INSTR".formatted(host);
            case GPIB -> "GPIB::%d::INSTR".formatted(port);
        };
    }

    public boolean isSocket() {
        return type == ConnectionType.SOCKET;
    }
}
