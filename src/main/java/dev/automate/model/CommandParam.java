package dev.automate.model;

import java.util.List;
import java.util.Map;

/**
 * A declared argument of a catalog command.
 */
public record CommandParam(
    String name,
    ParamType type,
    String defaultValue,                        // nullable
    boolean required,
    List<String> options,                       // ordered literals, may hold <NR1>/<QString> markers
    Integer position,                           // nullable, declared argument position
    String dependsOn,                           // nullable, parameter whose value selects the option set
    Map<String, List<String>> conditionalValues // option sets keyed by the dependency's value
) {
    public CommandParam {
        options = options == null ? List.of() : List.copyOf(options);
        conditionalValues = conditionalValues == null ? Map.of() : Map.copyOf(conditionalValues);
    }

    public static CommandParam number(String name, String defaultValue) {
        return new CommandParam(name, ParamType.NUMBER, defaultValue, false, List.of(), null, null, null);
    }

    public static CommandParam enumeration(String name, List<String> options) {
        return new CommandParam(name, ParamType.ENUMERATION, null, false, options, null, null, null);
    }

    public static CommandParam text(String name, String defaultValue) {
        return new CommandParam(name, ParamType.TEXT, defaultValue, false, List.of(), null, null, null);
    }

    public CommandParam withPosition(Integer newPosition) {
        return new CommandParam(name, type, defaultValue, required, options, newPosition, dependsOn, conditionalValues);
    }

    /**
     * Options in effect once the dependency has resolved to {@code dependencyValue}.
     */
    public List<String> effectiveOptions(String dependencyValue) {
        if (dependsOn == null || dependencyValue == null) {
            return options;
        }
        for (var entry : conditionalValues.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(dependencyValue)) {
                return entry.getValue();
            }
        }
        return options;
    }
}
