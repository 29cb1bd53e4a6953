package dev.automate.model;

import java.util.Locale;

public enum ParamType {
    NUMBER,
    ENUMERATION,
    TEXT;

    public static ParamType fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "number", "numeric", "integer", "float" -> NUMBER;
            case "enumeration", "enum", "choice" -> ENUMERATION;
            case "text", "string", "qstring" -> TEXT;
            default -> throw new IllegalArgumentException("Unknown parameter type: " + name);
        };
    }
}
