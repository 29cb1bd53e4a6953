package dev.automate.backend;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Python string literals and identifiers for generated code.
 */
public final class PythonLiterals {

    private static final Pattern DOLLAR_VARIABLE = Pattern.compile("\\$\\{(\\w+)\\}");
    private static final Pattern BRACE_VARIABLE = Pattern.compile("\\{\\w+");

    private PythonLiterals() {}

    /** A string literal, single-quoted when the text holds double quotes. */
    public static String quote(String text) {
        String escaped = text.replace("\\", "\\\\").replace("\n", "\\n");
        if (escaped.contains("\"") && !escaped.contains("'")) {
            return "'" + escaped + "'";
        }
        return "\"" + escaped.replace("\"", "\\\"") + "\"";
    }

    /** An f-string literal. */
    public static String fquote(String text) {
        return "f" + quote(text);
    }

    /**
     * A filename literal: {@code ${var}} becomes {@code {var}} and the literal is an f-string
     * when it references variables.
     */
    public static String filename(String name) {
        String interpolated = interpolate(name);
        return hasVariables(interpolated) ? fquote(interpolated) : quote(interpolated);
    }

    public static String interpolate(String text) {
        return DOLLAR_VARIABLE.matcher(text).replaceAll("{$1}");
    }

    public static boolean hasVariables(String text) {
        return BRACE_VARIABLE.matcher(interpolate(text)).find();
    }

    /** A valid Python identifier derived from {@code name}. */
    public static String identifier(String name) {
        if (name == null || name.isBlank()) {
            return "device";
        }
        String cleaned = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (Character.isDigit(cleaned.charAt(0))) {
            cleaned = "_" + cleaned;
        }
        return cleaned;
    }

    /** A number as Python source, without a trailing {@code .0} for whole values. */
    public static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    /** Last path segment of {@code path}, for either slash style. */
    public static String baseName(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }
}
