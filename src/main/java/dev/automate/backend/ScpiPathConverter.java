package dev.automate.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a raw SCPI command into a call on the driver framework's command tree:
 * {@code CH1:SCAle 1} becomes {@code commands.ch[1].scale.write(1)}.
 */
public final class ScpiPathConverter {

    private static final Pattern SEGMENT = Pattern.compile("([A-Za-z]+)(\\d*)");
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> PYTHON_KEYWORDS = Set.of(
        "and", "as", "assert", "break", "class", "continue", "def", "del", "elif", "else", "except", "finally",
        "for", "from", "global", "if", "import", "in", "is", "lambda", "not", "or", "pass", "raise", "return",
        "try", "while", "with", "yield");

    private ScpiPathConverter() {}

    /**
     * Command-tree call for {@code scpi}, without the device handle, or empty when the
     * command has no command-tree form.
     */
    public static Optional<String> convert(String scpi) {
        if (scpi == null || scpi.isBlank() || scpi.contains(";")) {
            return Optional.empty();
        }
        String text = scpi.trim();
        int space = text.indexOf(' ');
        String header = space < 0 ? text : text.substring(0, space);
        String value = space < 0 ? null : text.substring(space + 1).trim();

        boolean query = header.endsWith("?");
        if (query) {
            header = header.substring(0, header.length() - 1);
        }
        if (header.startsWith(":")) {
            header = header.substring(1);
        }
        if (header.startsWith("*")) {
            header = header.substring(1);
        }

        List<String> path = new ArrayList<>();
        for (String part : header.split(":")) {
            Matcher matcher = SEGMENT.matcher(part);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            String name = matcher.group(1).toLowerCase(Locale.ROOT);
            if (PYTHON_KEYWORDS.contains(name)) {
                name = name + "_";
            }
            path.add(matcher.group(2).isEmpty() ? name : "%s[%s]".formatted(name, Integer.parseInt(matcher.group(2))));
        }

        String call;
        if (query) {
            call = "query()";
        } else if (value == null || value.isEmpty()) {
            call = "write()";
        } else {
            call = "write(%s)".formatted(argument(value));
        }
        return Optional.of("commands." + String.join(".", path) + "." + call);
    }

    private static String argument(String value) {
        return NUMBER.matcher(value).matches() ? value : PythonLiterals.quote(value);
    }
}
