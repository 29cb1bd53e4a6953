package dev.automate.model;

import java.util.Locale;

/**
 * Output protocol of a waveform save. Chosen from the step's declared format only.
 */
public enum WaveformFormat {
    /** Raw bytes streamed straight to a local file. */
    BINARY("bin"),
    /** Scaled engineering units written as two-column rows. */
    TEXT("csv"),
    /** Instrument writes its own file, which is copied off and deleted. */
    NATIVE("wfm"),
    /** {@link #NATIVE} in MATLAB file format. */
    MATLAB("mat");

    private final String extension;

    WaveformFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static WaveformFormat fromName(String name) {
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "BIN", "BINARY" -> BINARY;
            case "CSV", "ASCII", "TEXT" -> TEXT;
            case "WFM", "NATIVE" -> NATIVE;
            case "MAT", "MATLAB" -> MATLAB;
            default -> throw new IllegalArgumentException("Unknown waveform format: " + name);
        };
    }
}
