package dev.automate.engine;

import dev.automate.model.*;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgramValidatorTest {

    @Test
    void validProgramHasNoErrors() throws IOException {
        Program program = ProgramLoader.loadFromFile(Fixtures.program("scope-basic.json"));

        assertThat(ProgramValidator.validate(program)).isEmpty();
    }

    @Test
    void multiDeviceProgramResolvesAliases() throws IOException {
        Program program = ProgramLoader.loadFromFile(Fixtures.program("two-scopes.json"));

        assertThat(ProgramValidator.validate(program)).isEmpty();
    }

    @Test
    void reportsEveryProblem() throws IOException {
        Program program = ProgramLoader.loadFromFile(Fixtures.program("invalid.json"));

        List<String> errors = ProgramValidator.validate(program);

        assertThat(errors).anyMatch(e -> e.contains("Duplicate device id 'scope'"));
        assertThat(errors).anyMatch(e -> e.contains("share the connection resource TCPIP::10.0.0.1::INSTR"));
        assertThat(errors).anyMatch(e -> e.contains("Step '1' has an empty command"));
        assertThat(errors).anyMatch(e -> e.contains("Duplicate step id '1'"));
        assertThat(errors).anyMatch(e -> e.contains("negative duration"));
        assertThat(errors).anyMatch(e -> e.contains("unknown device 'afg'"));
        assertThat(errors).anyMatch(e -> e.contains("SETUP recall needs a file path"));
    }

    @Test
    void reportsMissingDevices() {
        var program = new Program(Backend.DIRECT_RAW, List.of(),
            List.of(new Step("1", null, null, null, new StepAction.Connect())));

        assertThat(ProgramValidator.validate(program)).containsExactly("Program declares no devices");
    }

    @Test
    void catalogKeyStandsInForCommandText() {
        var invocation = new CommandInvocation("", "channel-scale", List.of(), ParameterBinding.empty());
        var program = new Program(Backend.DIRECT_RAW,
            List.of(Device.scope("scope", "scope", Backend.DIRECT_RAW, "10.0.0.1")),
            List.of(new Step("1", null, null, null, new StepAction.Write(invocation))));

        assertThat(ProgramValidator.validate(program)).isEmpty();
    }

    @Test
    void findsDuplicateIdsInsideGroups() {
        var program = new Program(Backend.DIRECT_RAW,
            List.of(Device.scope("scope", "scope", Backend.DIRECT_RAW, "10.0.0.1")),
            List.of(
                new Step("1", null, null, null, new StepAction.Comment("a")),
                new Step("g", null, null, null, new StepAction.Group(List.of(
                    new Step("1", null, null, null, new StepAction.Comment("b")))))));

        assertThat(ProgramValidator.validate(program)).containsExactly("Duplicate step id '1'");
    }

    @Test
    void driverCallNeedsCodeOrPath() {
        var program = new Program(Backend.HIGH_LEVEL_DRIVER,
            List.of(Device.scope("scope", "scope", Backend.HIGH_LEVEL_DRIVER, "10.0.0.1")),
            List.of(new Step("1", null, null, null, new StepAction.DriverCall(null, " ", null))));

        assertThat(ProgramValidator.validate(program)).containsExactly("Step '1' has neither code nor a command path");
    }
}
