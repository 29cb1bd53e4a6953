package dev.automate.model;

import java.util.Locale;

public enum ConnectionType {
    TCPIP,
    SOCKET,
    USB,
    GPIB;

    public static ConnectionType fromName(String name) {
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "TCPIP", "INSTR", "LAN" -> TCPIP;
            case "SOCKET" -> SOCKET;
            case "USB" -> USB;
            case "GPIB" -> GPIB;
            default -> throw new IllegalArgumentException("Unknown connection type: " + name);
        };
    }
}
