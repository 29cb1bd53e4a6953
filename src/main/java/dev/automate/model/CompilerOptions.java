package dev.automate.model;

/**
 * Knobs of the generated program that are not part of the step tree.
 */
public record CompilerOptions(
    String indent,
    int streamingPort,
    String instrumentTempFolder,
    String screenshotFolder,
    int transferTimeoutMs,
    boolean includeHeader
) {
    public static final String DEFAULT_INDENT = "    ";
    public static final int DEFAULT_STREAMING_PORT = 5000;
    public static final String DEFAULT_INSTRUMENT_TEMP_FOLDER = "C:/Temp";
    public static final String DEFAULT_SCREENSHOT_FOLDER = "./screenshots";
    public static final int DEFAULT_TRANSFER_TIMEOUT_MS = 30000;
    public static final boolean DEFAULT_INCLUDE_HEADER = true;

    public static CompilerOptions defaults() {
        return new CompilerOptions(DEFAULT_INDENT, DEFAULT_STREAMING_PORT, DEFAULT_INSTRUMENT_TEMP_FOLDER,
            DEFAULT_SCREENSHOT_FOLDER, DEFAULT_TRANSFER_TIMEOUT_MS, DEFAULT_INCLUDE_HEADER);
    }
}
