package dev.automate.backend;

/**
 * Something the generated program needs at the top: an import or a helper function.
 * Declared in emission order.
 */
public enum ScriptFeature {
    OS("import os"),
    SOCKET("import socket"),
    TIME("import time"),
    PYVISA("import pyvisa"),
    TM_DEVICES("from tm_devices import DeviceManager"),
    TEKHSI("from tekhsi import TekHSIConnect"),
    TM_DATA_TYPES("from tm_data_types import write_file"),
    SOCKET_SCREENSHOT_HELPER(null);

    private final String importLine;

    ScriptFeature(String importLine) {
        this.importLine = importLine;
    }

    /** Import statement, or null for helpers. */
    public String importLine() {
        return importLine;
    }
}
