package dev.automate.backend;

import dev.automate.model.Route;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes command text that is already a Python API call rather than a raw instrument
 * command, and which side of a hybrid device it belongs to.
 */
public final class ApiCallDetector {

    static final List<String> STREAMING_MARKERS = List.of(
        ".get_data(", ".access_data(", "TekHSIConnect", ".available_symbols", ".active_symbols",
        ".force_sequence(", "write_file(");

    static final List<String> DRIVER_MARKERS = List.of(
        ".commands.", ".save_screenshot(", ".set_and_check(", ".recall_", ".reset(", "visa_resource",
        ".turn_channel_", ".add_", "device_manager.", ".idn_string", ".get_eventlog_status(");

    static final List<String> COMMAND_MARKERS = List.of(
        ".write(", ".query(", ".read(", ".read_raw(", ".query_binary_values(", ".commands.", "visa_resource");

    private ApiCallDetector() {}

    public static boolean isStreamingCall(String text) {
        return containsAny(text, STREAMING_MARKERS);
    }

    public static boolean isDriverCall(String text) {
        return containsAny(text, DRIVER_MARKERS);
    }

    /** Whether the text is a Python call expression of any kind, to be emitted verbatim. */
    public static boolean isApiCall(String text) {
        return isStreamingCall(text) || isDriverCall(text) || containsAny(text, COMMAND_MARKERS);
    }

    /** Side of a hybrid device the text targets, when its markers tell. */
    public static Optional<Route> classify(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        if (isStreamingCall(text)) {
            return Optional.of(Route.STREAMING);
        }
        if (isDriverCall(text) || containsAny(text, COMMAND_MARKERS)) {
            return Optional.of(Route.COMMAND);
        }
        return Optional.empty();
    }

    private static boolean containsAny(String text, List<String> markers) {
        if (text == null) {
            return false;
        }
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
