package dev.automate.model;

import java.util.Locale;

public enum RecallKind {
    FACTORY,
    SETUP,
    SESSION,
    WAVEFORM;

    public static RecallKind fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
