package dev.automate.engine;

import dev.automate.model.CommandParam;
import dev.automate.model.ParamType;
import dev.automate.model.ParameterBinding;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ParameterCanonicalizerTest {

    private static CommandParam withOptions(String name, ParamType type, List<String> options, Integer position) {
        return new CommandParam(name, type, null, false, options, position, null, null);
    }

    @Test
    void keepsOneOfTwoParamsDescribingSameSlot() {
        var params = List.of(
            withOptions("value", ParamType.NUMBER, List.of("<NR1>"), null),
            withOptions("Rate", ParamType.NUMBER, List.of("<NR1>"), null));

        List<CommandParam> result = ParameterCanonicalizer.canonicalize(params, "ACQuire:RATE {<NR1>}");

        assertThat(result).extracting(CommandParam::name).containsExactly("Rate");
    }

    @Test
    void reportsKeptParamForEachDroppedOne() {
        var params = List.of(
            withOptions("value", ParamType.NUMBER, List.of("<NR1>"), null),
            withOptions("Rate", ParamType.NUMBER, List.of("<NR1>"), null));

        var canonical = ParameterCanonicalizer.canonicalizeWithReplacements(params, "HORizontal:MODE:SAMPLERate");

        assertThat(canonical.params()).extracting(CommandParam::name).containsExactly("Rate");
        assertThat(canonical.replacedBy()).containsExactly(entry("value", "rate"));
    }

    @Test
    void replacementFollowsGenericValueToHeaderNamedParam() {
        var params = List.of(
            CommandParam.enumeration("channel", List.of("CH1", "CH2")),
            CommandParam.number("scale", "1"),
            CommandParam.number("value", null));

        var canonical = ParameterCanonicalizer.canonicalizeWithReplacements(params, "CH<x>:SCAle <NR3>");

        assertThat(canonical.replacedBy()).containsExactly(entry("value", "scale"));
        assertThat(canonical.rebind(ParameterBinding.of(Map.of("channel", "CH2", "value", "0.5"))).normalized())
            .containsOnly(entry("channel", "CH2"), entry("scale", "0.5"));
    }

    @Test
    void prefersPositionedParamWithinGroup() {
        var params = List.of(
            withOptions("mode", ParamType.ENUMERATION, List.of("AUTO", "NORMal"), null),
            withOptions("value", ParamType.ENUMERATION, List.of("auto", "normal"), 0));

        List<CommandParam> result = ParameterCanonicalizer.canonicalize(params, "TRIGger:A:MODe {AUTO|NORMal}");

        assertThat(result).extracting(CommandParam::name).containsExactly("value");
    }

    @Test
    void numericMarkersShareOneSignature() {
        assertThat(ParameterCanonicalizer.signature(List.of("<NR1>")))
            .isEqualTo(ParameterCanonicalizer.signature(List.of("<NR3>")));
        assertThat(ParameterCanonicalizer.signature(List.of("ON", "OFF")))
            .isEqualTo(ParameterCanonicalizer.signature(List.of("off", "on")));
    }

    @Test
    void dropsDuplicateNamesIgnoringCase() {
        var params = List.of(CommandParam.number("scale", "1"), CommandParam.number("Scale", "2"));

        List<CommandParam> result = ParameterCanonicalizer.canonicalize(params, "CH1:SCAle <NR3>");

        assertThat(result).hasSize(1);
        assertThat(result.get(0).defaultValue()).isEqualTo("1");
    }

    @Test
    void dropsGenericValueWhenNamedParamMatchesHeaderWord() {
        var params = List.of(
            CommandParam.enumeration("channel", List.of("CH1", "CH2")),
            CommandParam.number("scale", "1"),
            CommandParam.number("value", null));

        List<CommandParam> result = ParameterCanonicalizer.canonicalize(params, "CH<x>:SCAle <NR3>");

        assertThat(result).extracting(CommandParam::name).containsExactly("channel", "scale");
    }

    @Test
    void keepsGenericValueWhenNothingElseNamesTheSlot() {
        var params = List.of(
            CommandParam.enumeration("channel", List.of("CH1", "CH2")),
            CommandParam.number("value", "1"));

        List<CommandParam> result = ParameterCanonicalizer.canonicalize(params, "CH<x>:SCAle {<NR1>}");

        assertThat(result).isEqualTo(params);
    }

    @Test
    void isIdempotent() {
        var params = List.of(
            withOptions("value", ParamType.NUMBER, List.of("<NR1>"), null),
            withOptions("Rate", ParamType.NUMBER, List.of("<NR1>"), null),
            CommandParam.number("rate", "5"),
            CommandParam.enumeration("channel", List.of("CH1", "CH2")));
        String template = "ACQuire:RATE {<NR1>}";

        List<CommandParam> once = ParameterCanonicalizer.canonicalize(params, template);

        assertThat(ParameterCanonicalizer.canonicalize(once, template)).isEqualTo(once);
    }

    @Test
    void extractsHeaderWords() {
        assertThat(ParameterCanonicalizer.mnemonicWords("CH<x>:SCAle {<NR1>}")).containsExactlyInAnyOrder("CH", "SCAle");
    }
}
