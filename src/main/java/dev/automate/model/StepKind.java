package dev.automate.model;

/**
 * Discriminator of the serialized step form.
 */
public enum StepKind {
    CONNECT("connect"),
    DISCONNECT("disconnect"),
    WRITE("write"),
    QUERY("query"),
    SET_AND_QUERY("set_and_query"),
    SLEEP("sleep"),
    COMMENT("comment"),
    PYTHON_PASSTHROUGH("python"),
    SAVE_WAVEFORM("save_waveform"),
    SAVE_SCREENSHOT("save_screenshot"),
    ERROR_CHECK("error_check"),
    RECALL("recall"),
    GROUP("group"),
    DRIVER_CALL("tm_device_command");

    private final String jsonName;

    StepKind(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public static StepKind fromJsonName(String name) {
        for (StepKind kind : values()) {
            if (kind.jsonName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + name);
    }
}
