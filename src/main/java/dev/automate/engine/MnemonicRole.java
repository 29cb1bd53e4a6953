package dev.automate.engine;

import dev.automate.model.ParameterBinding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Numbered instrument resources a mnemonic placeholder such as {@code CH<x>} can stand for,
 * with the binding names that carry their value and the mnemonic stems that name them.
 */
public enum MnemonicRole {
    CHANNEL(Set.of("channel", "ch"), Set.of("CH", "CHANNEL")),
    SOURCE(Set.of("source"), Set.of("SOURCE", "GSOURCE", "SOUR")),
    MATH(Set.of("math"), Set.of("MATH")),
    BUS(Set.of("bus"), Set.of("B", "BUS")),
    REFERENCE(Set.of("reference", "ref"), Set.of("REF", "REFERENCE")),
    MEASUREMENT(Set.of("measurement", "meas"), Set.of("MEAS", "MEASUREMENT")),
    CURSOR(Set.of("cursor"), Set.of("CURSOR")),
    SEARCH(Set.of("search"), Set.of("SEARCH")),
    ZOOM(Set.of("zoom"), Set.of("ZOOM")),
    VIEW(Set.of("view"), Set.of("VIEW", "WAVEVIEW", "PLOTVIEW", "MATHFFTVIEW", "REFFFTVIEW", "SPECVIEW")),
    POWER(Set.of("power"), Set.of("POWER")),
    HISTOGRAM(Set.of("histogram"), Set.of("HISTOGRAM")),
    CALLOUT(Set.of("callout"), Set.of("CALLOUT")),
    MASK(Set.of("mask"), Set.of("MASK")),
    DIGITAL_BIT(Set.of("digital_bit", "bit"), Set.of("D")),
    AREA(Set.of("area"), Set.of("AREA"));

    private final Set<String> bindingNames;
    private final Set<String> stems;

    MnemonicRole(Set<String> bindingNames, Set<String> stems) {
        this.bindingNames = bindingNames;
        this.stems = stems;
    }

    public Set<String> bindingNames() {
        return bindingNames;
    }

    /**
     * Whether a mnemonic word from a template names this role. Words of three letters or more
     * also match as an abbreviation ({@code SOU} for {@code SOURCE}).
     */
    public boolean matchesMnemonic(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        for (String stem : stems) {
            if (stem.equals(upper) || (upper.length() >= 3 && stem.startsWith(upper))) {
                return true;
            }
        }
        return false;
    }

    public static List<MnemonicRole> forMnemonic(String word) {
        var roles = new ArrayList<MnemonicRole>();
        for (MnemonicRole role : values()) {
            if (role.matchesMnemonic(word)) {
                roles.add(role);
            }
        }
        return roles;
    }

    /** The role a binding or parameter name stands for, if any. */
    public static Optional<MnemonicRole> forBindingName(String name) {
        String key = ParameterBinding.normalize(name);
        for (MnemonicRole role : values()) {
            if (role.bindingNames.contains(key)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isRoleName(String name) {
        return forBindingName(name).isPresent();
    }
}
