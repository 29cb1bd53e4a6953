package dev.automate.engine;

import dev.automate.model.CommandParam;
import dev.automate.model.ParamType;
import dev.automate.model.ParameterBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a command template plus bound values into concrete command text.
 *
 * <p>A template is {@code HEADER[ ARGUMENTS]}. The header may hold mnemonic placeholders
 * ({@code CH<x>}, {@code CH<x>_D<x>}) and choice groups ({@code {A|B}}); both parts may hold
 * named placeholders ({@code {filename}}). Resolution never fails for a missing value: it falls
 * back to the declared default, then to the first option or index 1. Only malformed grammar
 * raises {@link TemplateSyntaxException}.
 */
public final class TemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(TemplateResolver.class);

    public static final String CUSTOM_SENTINEL = "custom";
    public static final String CUSTOM_SEGMENT = ":CUSTom";

    static final int MIN_INDEX = 1;
    static final int MAX_INDEX = 99;
    static final int MIN_BIT = 0;
    static final int DEFAULT_BIT = 0;

    private static final Pattern NAMED_PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)\\}");
    private static final Pattern BRACE_GROUP = Pattern.compile("\\{([^{}]*)\\}");
    private static final Pattern MNEMONIC = Pattern.compile("([A-Za-z]*)<([A-Za-z])>(?:(_?[A-Za-z]*)<([A-Za-z])>)?");
    private static final Pattern INDEX_MARKER = Pattern.compile("<[A-Za-z]>");
    private static final Pattern GENERIC_NUMBER = Pattern.compile("<(NR[0-9]?|NRf|NRx|number)>", Pattern.CASE_INSENSITIVE);
    private static final Pattern GENERIC_STRING = Pattern.compile("<(QString|string)>", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIRST_INTEGER = Pattern.compile("\\d+");
    private static final Pattern FLOAT_LITERAL =
        Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+)([eE][+-]?\\d+)?|[+-]?\\d+[eE][+-]?\\d+");
    private static final Pattern LEADING_LETTERS = Pattern.compile("^[A-Za-z]+");

    private static final List<String> GENERIC_INDEX_KEYS = List.of("x", "n", "index", "idx");

    private enum Shape { AS_WRITTEN, WRITE, QUERY }

    private TemplateResolver() {}

    /** Resolves the template in the shape it is written: a query header gets no arguments. */
    public static String resolve(String template, List<CommandParam> params, ParameterBinding bindings) {
        return resolve(template, params, bindings, Shape.AS_WRITTEN);
    }

    /** Value-bearing form; never ends in {@code ?}. */
    public static String resolveWrite(String template, List<CommandParam> params, ParameterBinding bindings) {
        return resolve(template, params, bindings, Shape.WRITE);
    }

    /** Header-only form; always ends in {@code ?}. */
    public static String resolveQuery(String template, List<CommandParam> params, ParameterBinding bindings) {
        return resolve(template, params, bindings, Shape.QUERY);
    }

    /** Header part of a command, up to the first whitespace outside braces and quotes. */
    public static String header(String command) {
        int split = argumentSplit(command.trim());
        return split < 0 ? command.trim() : command.trim().substring(0, split);
    }

    public static boolean isQuery(String command) {
        return header(command).endsWith("?");
    }

    static boolean isGenericNumber(String value) {
        return value != null && GENERIC_NUMBER.matcher(value.trim()).matches();
    }

    static boolean isGenericString(String value) {
        return value != null && GENERIC_STRING.matcher(value.trim()).matches();
    }

    private static String resolve(String template, List<CommandParam> params, ParameterBinding bindings, Shape shape) {
        if (template == null || template.isBlank()) {
            throw new TemplateSyntaxException("Empty template", String.valueOf(template));
        }
        String text = template.trim();
        checkGrammar(text);

        int split = argumentSplit(text);
        String header = split < 0 ? text : text.substring(0, split);
        String arguments = split < 0 ? "" : text.substring(split).trim();

        var consumed = new HashSet<String>();
        header = substituteNamed(header, params, bindings, consumed);
        arguments = substituteNamed(arguments, params, bindings, consumed);
        header = substituteChoices(header, bindings, consumed);
        header = substituteMnemonics(header, bindings, consumed);
        if (header.contains("<")) {
            throw new TemplateSyntaxException("Unresolvable placeholder '%s'".formatted(header), template);
        }

        boolean queryHeader = header.endsWith("?");
        String bareHeader = queryHeader ? header.substring(0, header.length() - 1) : header;

        ArgumentList assembled = params.isEmpty()
            ? ArgumentList.NONE
            : assembleArguments(params, bindings, consumed);
        if (assembled.customMode() && !hasCustomSegment(bareHeader)) {
            bareHeader = bareHeader + CUSTOM_SEGMENT;
        }

        if (shape == Shape.QUERY || (shape == Shape.AS_WRITTEN && queryHeader)) {
            return bareHeader + "?";
        }

        String argumentText;
        if (!arguments.isEmpty() && !hasGrammar(arguments)) {
            argumentText = arguments;
        } else if (!assembled.text().isEmpty()) {
            argumentText = assembled.text();
        } else {
            argumentText = resolveLiteralArguments(arguments, bindings, consumed);
        }

        String command = argumentText.isEmpty() ? bareHeader : bareHeader + " " + argumentText;
        while (command.endsWith("?")) {
            command = command.substring(0, command.length() - 1);
        }
        log.debug("Resolved '{}' -> '{}'", template, command);
        return command;
    }

    private static boolean hasCustomSegment(String header) {
        return header.toUpperCase(Locale.ROOT).endsWith(CUSTOM_SEGMENT.toUpperCase(Locale.ROOT));
    }

    private static void checkGrammar(String template) {
        int braces = 0;
        int angles = 0;
        boolean quoted = false;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            }
            if (quoted) {
                continue;
            }
            switch (c) {
                case '{' -> {
                    if (++braces > 1) {
                        throw new TemplateSyntaxException("Nested choice group", template);
                    }
                }
                case '}' -> {
                    if (--braces < 0) {
                        throw new TemplateSyntaxException("Unbalanced '}'", template);
                    }
                }
                case '<' -> {
                    if (++angles > 1) {
                        throw new TemplateSyntaxException("Nested placeholder marker", template);
                    }
                }
                case '>' -> {
                    if (--angles < 0) {
                        throw new TemplateSyntaxException("Unbalanced '>'", template);
                    }
                }
                default -> { }
            }
        }
        if (braces != 0) {
            throw new TemplateSyntaxException("Unbalanced '{'", template);
        }
        if (angles != 0) {
            throw new TemplateSyntaxException("Unbalanced '<'", template);
        }
        Matcher groups = BRACE_GROUP.matcher(template);
        while (groups.find()) {
            String body = groups.group(1);
            if (body.isBlank()) {
                throw new TemplateSyntaxException("Empty choice group", template);
            }
            for (String option : body.split("\\|", -1)) {
                if (option.isBlank()) {
                    throw new TemplateSyntaxException("Empty option in choice group '{%s}'".formatted(body), template);
                }
            }
        }
    }

    /** Index of the first whitespace outside braces and quotes, or -1. */
    private static int argumentSplit(String text) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (Character.isWhitespace(c) && depth == 0 && !quoted) {
                return i;
            }
        }
        return -1;
    }

    private static boolean hasGrammar(String text) {
        return stripQuoted(text).matches("(?s).*[{}<>].*");
    }

    private static String stripQuoted(String text) {
        return text.replaceAll("\"[^\"]*\"", "\"\"");
    }

    private static String substituteNamed(String text, List<CommandParam> params, ParameterBinding bindings,
                                          Set<String> consumed) {
        if (text.isEmpty()) {
            return text;
        }
        Matcher matcher = NAMED_PLACEHOLDER.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = bindings.get(name);
            if (value == null) {
                value = declaredDefault(params, name);
            }
            if (value == null) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
            } else {
                consumed.add(ParameterBinding.normalize(name));
                matcher.appendReplacement(out, Matcher.quoteReplacement(value));
            }
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String declaredDefault(List<CommandParam> params, String name) {
        for (CommandParam param : params) {
            if (param.name().equalsIgnoreCase(name)) {
                return param.defaultValue();
            }
        }
        return null;
    }

    private static String substituteChoices(String text, ParameterBinding bindings, Set<String> consumed) {
        Matcher matcher = BRACE_GROUP.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            String body = matcher.group(1);
            String replacement;
            if (body.contains("|") || body.contains("<")) {
                replacement = selectOption(List.of(body.split("\\|")), bindings, consumed);
            } else {
                // a named placeholder nothing was bound to
                replacement = matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String selectOption(List<String> rawOptions, ParameterBinding bindings, Set<String> consumed) {
        List<String> options = rawOptions.stream().map(String::trim).toList();

        for (Map.Entry<String, String> binding : bindings.normalized().entrySet()) {
            if (!MnemonicRole.isRoleName(binding.getKey())) {
                continue;
            }
            String value = binding.getValue().trim();
            for (String option : options) {
                if (INDEX_MARKER.matcher(option).find()) {
                    String stem = leadingLetters(option);
                    if (!stem.isEmpty() && prefixMatches(stem, value)) {
                        consumed.add(binding.getKey());
                        OptionalInt index = extractIndex(value, MIN_INDEX, MAX_INDEX);
                        return index.isPresent()
                            ? INDEX_MARKER.matcher(option).replaceFirst(String.valueOf(index.getAsInt()))
                            : option;
                    }
                } else if (option.equalsIgnoreCase(value)) {
                    consumed.add(binding.getKey());
                    return option;
                }
            }
        }

        if (options.size() != 2) {
            return options.get(0);
        }
        // boolean-like pairs such as {ON|OFF} match any binding by value
        for (Map.Entry<String, String> binding : bindings.normalized().entrySet()) {
            for (String option : options) {
                if (option.equalsIgnoreCase(binding.getValue().trim())) {
                    consumed.add(binding.getKey());
                    return option;
                }
            }
        }
        return options.get(0);
    }

    private static String substituteMnemonics(String text, ParameterBinding bindings, Set<String> consumed) {
        Matcher matcher = MNEMONIC.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            String word = matcher.group(1);
            var replacement = new StringBuilder(word);
            replacement.append(resolveIndex(word, bindings, consumed));
            String suffix = matcher.group(3);
            if (suffix != null) {
                replacement.append(suffix).append(resolveBit(suffix, bindings, consumed));
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement.toString()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static int resolveIndex(String word, ParameterBinding bindings, Set<String> consumed) {
        var keys = new LinkedHashSet<String>();
        if (!word.isEmpty()) {
            keys.add(ParameterBinding.normalize(word));
        }
        keys.addAll(GENERIC_INDEX_KEYS);
        for (MnemonicRole role : MnemonicRole.forMnemonic(word)) {
            keys.addAll(role.bindingNames());
        }
        for (String key : keys) {
            OptionalInt index = extractIndex(bindings.get(key), MIN_INDEX, MAX_INDEX);
            if (index.isPresent()) {
                consumed.add(key);
                log.debug("Index of {}<x> taken from '{}': {}", word, key, index.getAsInt());
                return index.getAsInt();
            }
        }
        if (!word.isEmpty()) {
            for (Map.Entry<String, String> binding : bindings.normalized().entrySet()) {
                if (keys.contains(binding.getKey()) || !MnemonicRole.isRoleName(binding.getKey())
                    || !prefixMatches(word, binding.getValue().trim())) {
                    continue;
                }
                OptionalInt index = extractIndex(binding.getValue(), MIN_INDEX, MAX_INDEX);
                if (index.isPresent()) {
                    consumed.add(binding.getKey());
                    log.debug("Index of {}<x> taken from role '{}': {}", word, binding.getKey(), index.getAsInt());
                    return index.getAsInt();
                }
            }
        }
        return MIN_INDEX;
    }

    private static int resolveBit(String suffix, ParameterBinding bindings, Set<String> consumed) {
        var keys = new LinkedHashSet<String>();
        String word = suffix.replace("_", "");
        if (!word.isEmpty()) {
            keys.add(ParameterBinding.normalize(word));
        }
        keys.addAll(MnemonicRole.DIGITAL_BIT.bindingNames());
        for (String key : keys) {
            OptionalInt bit = extractIndex(bindings.get(key), MIN_BIT, MAX_INDEX);
            if (bit.isPresent()) {
                consumed.add(key);
                return bit.getAsInt();
            }
        }
        return DEFAULT_BIT;
    }

    /**
     * First integer embedded in {@code value} when it lies in range. Float and scientific
     * literals yield nothing, so {@code 25.0E-3} never becomes 25.
     */
    static OptionalInt extractIndex(String value, int min, int max) {
        if (value == null) {
            return OptionalInt.empty();
        }
        String trimmed = value.trim();
        if (FLOAT_LITERAL.matcher(trimmed).matches()) {
            return OptionalInt.empty();
        }
        Matcher digits = FIRST_INTEGER.matcher(trimmed);
        if (!digits.find()) {
            return OptionalInt.empty();
        }
        if (digits.start() > 0 && trimmed.charAt(digits.start() - 1) == '.') {
            return OptionalInt.empty();
        }
        if (digits.end() < trimmed.length()) {
            char next = trimmed.charAt(digits.end());
            if (next == '.' || next == 'e' || next == 'E') {
                if (digits.end() + 1 < trimmed.length()
                    && "+-0123456789".indexOf(trimmed.charAt(digits.end() + 1)) >= 0) {
                    return OptionalInt.empty();
                }
            }
        }
        String number = digits.group();
        if (number.length() > 3) {
            return OptionalInt.empty();
        }
        int index = Integer.parseInt(number);
        return index >= min && index <= max ? OptionalInt.of(index) : OptionalInt.empty();
    }

    private static String leadingLetters(String text) {
        Matcher matcher = LEADING_LETTERS.matcher(text);
        return matcher.find() ? matcher.group() : "";
    }

    /** Whether the alphabetic prefix of {@code value} names the mnemonic {@code word}. */
    private static boolean prefixMatches(String word, String value) {
        String prefix = leadingLetters(value).toUpperCase(Locale.ROOT);
        String upper = word.toUpperCase(Locale.ROOT);
        if (prefix.isEmpty() || upper.isEmpty()) {
            return false;
        }
        return prefix.equals(upper)
            || (upper.length() >= 3 && prefix.startsWith(upper))
            || (prefix.length() >= 3 && upper.startsWith(prefix));
    }

    private record ArgumentList(String text, boolean customMode) {
        static final ArgumentList NONE = new ArgumentList("", false);
    }

    private static ArgumentList assembleArguments(List<CommandParam> params, ParameterBinding bindings,
                                                  Set<String> consumed) {
        var ordered = new ArrayList<CommandParam>(params);
        ordered.sort(Comparator.comparing(
            (CommandParam p) -> p.position() == null ? Integer.MAX_VALUE : p.position()));

        var values = new ArrayList<String>();
        var seen = new HashSet<String>();
        boolean customMode = false;
        for (CommandParam param : ordered) {
            String key = ParameterBinding.normalize(param.name());
            if (consumed.contains(key)) {
                continue;
            }
            List<String> options = param.effectiveOptions(dependencyValue(param, params, bindings));
            String value = bindings.get(param.name());
            if (value == null) {
                value = param.defaultValue();
            }
            if (value == null && options.size() == 1) {
                value = options.get(0);
            }
            if (value == null) {
                continue;
            }
            value = value.trim();

            if (isGenericNumber(value)) {
                value = companion(bindings, key, "number");
            } else if (isGenericString(value)) {
                String custom = companion(bindings, key, "custom");
                value = custom == null ? null : quote(custom);
            } else if (value.equalsIgnoreCase(CUSTOM_SENTINEL) && companion(bindings, key, "custom") != null) {
                customMode = true;
                value = quoteText(companion(bindings, key, "custom"), param, options);
            } else {
                value = quoteText(value, param, options);
            }
            if (value == null || value.isEmpty()) {
                continue;
            }
            if (seen.add(value.toLowerCase(Locale.ROOT))) {
                values.add(value);
            }
        }
        return new ArgumentList(String.join(",", values), customMode);
    }

    private static String dependencyValue(CommandParam param, List<CommandParam> params, ParameterBinding bindings) {
        if (param.dependsOn() == null) {
            return null;
        }
        String bound = bindings.get(param.dependsOn());
        return bound != null ? bound : declaredDefault(params, param.dependsOn());
    }

    /** {@code <name>_<kind>} binding, else the bare {@code <kind>} binding. */
    private static String companion(ParameterBinding bindings, String key, String kind) {
        String specific = bindings.get(key + "_" + kind);
        return specific != null ? specific : bindings.get(kind);
    }

    private static String quoteText(String value, CommandParam param, List<String> options) {
        if (param.type() != ParamType.TEXT || isQuoted(value)) {
            return value;
        }
        for (String option : options) {
            if (option.equalsIgnoreCase(value)) {
                return value;
            }
        }
        return quote(value);
    }

    private static boolean isQuoted(String value) {
        return value.length() >= 2
            && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")));
    }

    private static String quote(String value) {
        return isQuoted(value) ? value : "\"" + value + "\"";
    }

    /** Literal argument text with its remaining grammar resolved or dropped. */
    private static String resolveLiteralArguments(String arguments, ParameterBinding bindings, Set<String> consumed) {
        if (arguments.isEmpty()) {
            return "";
        }
        String text = substituteChoices(arguments, bindings, consumed);
        text = substituteMnemonics(text, bindings, consumed);

        String number = bindings.get("value") != null ? bindings.get("value") : bindings.get("number");
        text = GENERIC_NUMBER.matcher(text).replaceAll(number == null ? "" : Matcher.quoteReplacement(number));
        String custom = bindings.get("custom") != null ? bindings.get("custom") : bindings.get("value");
        text = GENERIC_STRING.matcher(text).replaceAll(custom == null ? "" : Matcher.quoteReplacement(quote(custom)));

        return text.replaceAll(",{2,}", ",").replaceAll("^[,\\s]+|[,\\s]+$", "");
    }
}
