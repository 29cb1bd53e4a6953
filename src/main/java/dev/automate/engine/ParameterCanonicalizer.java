package dev.automate.engine;

import dev.automate.model.CommandParam;
import dev.automate.model.ParamType;
import dev.automate.model.ParameterBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Removes parameter declarations that describe an argument slot already declared, so a
 * catalog entry merged from several source records does not yield duplicate arguments.
 *
 * <p>Applying {@link #canonicalize} to its own output returns the same list.
 */
public final class ParameterCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(ParameterCanonicalizer.class);

    static final String GENERIC_VALUE_NAME = "value";
    private static final String NUMBER_SIGNATURE = "#number";
    private static final String STRING_SIGNATURE = "#string";

    /**
     * Kept parameters, plus the name of the kept parameter standing in for each dropped one.
     */
    public record Canonical(List<CommandParam> params, Map<String, String> replacedBy) {

        public Canonical {
            params = List.copyOf(params);
            replacedBy = Map.copyOf(replacedBy);
        }

        /** {@code bindings} with values bound under a dropped name moved to its replacement. */
        public ParameterBinding rebind(ParameterBinding bindings) {
            return bindings.renamed(replacedBy);
        }
    }

    private ParameterCanonicalizer() {}

    public static List<CommandParam> canonicalize(List<CommandParam> rawParams, String template) {
        return canonicalizeWithReplacements(rawParams, template).params();
    }

    public static Canonical canonicalizeWithReplacements(List<CommandParam> rawParams, String template) {
        var replacedBy = new LinkedHashMap<String, String>();
        List<CommandParam> unique = dropDuplicateNames(rawParams);
        List<CommandParam> grouped = collapseSameOptionSets(unique, replacedBy);
        List<CommandParam> kept = dropRedundantValue(grouped, template == null ? "" : template, replacedBy);
        return new Canonical(kept, replacedBy);
    }

    private static void replace(Map<String, String> replacedBy, String dropped, String kept) {
        String from = ParameterBinding.normalize(dropped);
        String to = ParameterBinding.normalize(kept);
        replacedBy.replaceAll((name, target) -> target.equals(from) ? to : target);
        replacedBy.put(from, to);
    }

    private static List<CommandParam> dropDuplicateNames(List<CommandParam> params) {
        var seen = new HashSet<String>();
        var result = new ArrayList<CommandParam>();
        for (CommandParam param : params) {
            if (seen.add(param.name().toLowerCase(Locale.ROOT))) {
                result.add(param);
            } else {
                log.debug("Dropping duplicate parameter '{}'", param.name());
            }
        }
        return result;
    }

    private static List<CommandParam> collapseSameOptionSets(List<CommandParam> params,
                                                             Map<String, String> replacedBy) {
        var groups = new LinkedHashMap<String, List<Integer>>();
        for (int i = 0; i < params.size(); i++) {
            CommandParam param = params.get(i);
            if (param.type() == ParamType.ENUMERATION || !param.options().isEmpty()) {
                groups.computeIfAbsent(signature(param.options()), k -> new ArrayList<>()).add(i);
            }
        }

        var dropped = new HashSet<Integer>();
        for (List<Integer> members : groups.values()) {
            if (members.size() < 2) {
                continue;
            }
            int keep = pickRepresentative(params, members);
            for (int index : members) {
                if (index != keep) {
                    dropped.add(index);
                    replace(replacedBy, params.get(index).name(), params.get(keep).name());
                    log.debug("Parameter '{}' describes the same argument as '{}'",
                        params.get(index).name(), params.get(keep).name());
                }
            }
        }

        var result = new ArrayList<CommandParam>();
        for (int i = 0; i < params.size(); i++) {
            if (!dropped.contains(i)) {
                result.add(params.get(i));
            }
        }
        return result;
    }

    private static int pickRepresentative(List<CommandParam> params, List<Integer> members) {
        for (int index : members) {
            if (params.get(index).position() != null) {
                return index;
            }
        }
        for (int index : members) {
            if (!params.get(index).name().equalsIgnoreCase(GENERIC_VALUE_NAME)) {
                return index;
            }
        }
        return members.get(0);
    }

    /** Option set with numeric and string markers collapsed, compared case-insensitively. */
    static String signature(List<String> options) {
        var normalized = new TreeSet<String>();
        for (String option : options) {
            if (TemplateResolver.isGenericNumber(option)) {
                normalized.add(NUMBER_SIGNATURE);
            } else if (TemplateResolver.isGenericString(option)) {
                normalized.add(STRING_SIGNATURE);
            } else {
                normalized.add(option.trim().toLowerCase(Locale.ROOT));
            }
        }
        return String.join("|", normalized);
    }

    private static List<CommandParam> dropRedundantValue(List<CommandParam> params, String template,
                                                         Map<String, String> replacedBy) {
        CommandParam generic = null;
        for (CommandParam param : params) {
            if (param.name().equalsIgnoreCase(GENERIC_VALUE_NAME) && param.type() == ParamType.NUMBER
                && isUnconstrained(param)) {
                generic = param;
            }
        }
        if (generic == null) {
            return params;
        }

        Set<String> words = mnemonicWords(template);
        for (CommandParam param : params) {
            if (param == generic || param.type() != ParamType.NUMBER || MnemonicRole.isRoleName(param.name())) {
                continue;
            }
            if (namesMnemonicWord(param.name(), words)) {
                log.debug("Dropping generic '{}' in favour of '{}'", generic.name(), param.name());
                replace(replacedBy, generic.name(), param.name());
                var result = new ArrayList<>(params);
                result.remove(generic);
                return result;
            }
        }
        return params;
    }

    private static boolean isUnconstrained(CommandParam param) {
        return param.options().stream().allMatch(TemplateResolver::isGenericNumber);
    }

    /** Literal words of the template header, each as typed ({@code SCAle}). */
    static Set<String> mnemonicWords(String template) {
        String header = TemplateResolver.header(template)
            .replaceAll("\\{[^}]*\\}", ":")
            .replaceAll("<[^>]*>", ":");
        var words = new HashSet<String>();
        for (String word : header.split("[^A-Za-z]+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Whether a parameter name matches a header word in its long form ({@code scale}), its
     * short form made of the upper-case letters ({@code sca}), or by containment.
     */
    private static boolean namesMnemonicWord(String name, Set<String> words) {
        String candidate = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        if (candidate.isEmpty()) {
            return false;
        }
        for (String word : words) {
            String longForm = word.toLowerCase(Locale.ROOT);
            String shortForm = word.replaceAll("[^A-Z]", "").toLowerCase(Locale.ROOT);
            if (MnemonicRole.isRoleName(longForm)) {
                continue;
            }
            if (candidate.equals(longForm) || candidate.equals(shortForm)) {
                return true;
            }
            if ((candidate.length() >= 3 && longForm.contains(candidate))
                || (longForm.length() >= 3 && candidate.contains(longForm))) {
                return true;
            }
        }
        return false;
    }
}
