package dev.automate.engine;

import dev.automate.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgramLoaderTest {

    @Test
    void loadsProgramFromFile() throws IOException {
        Program program = ProgramLoader.loadFromFile(Fixtures.program("scope-basic.json"));

        assertThat(program.backend()).isEqualTo(Backend.DIRECT_RAW);
        assertThat(program.devices()).hasSize(1);

        Device scope = program.devices().get(0);
        assertThat(scope.id()).isEqualTo("dev-1");
        assertThat(scope.alias()).isEqualTo("scope");
        assertThat(scope.backend()).isEqualTo(Backend.DIRECT_RAW);
        assertThat(scope.driver()).isEqualTo("MSO6B");
        assertThat(scope.connection().visaResource()).isEqualTo("TCPIP::192.168.1.50::INSTR");
        assertThat(scope.connection().timeoutMs()).isEqualTo(10000);

        assertThat(program.steps()).extracting(Step::kind).containsExactly(
            StepKind.CONNECT, StepKind.WRITE, StepKind.GROUP, StepKind.SAVE_WAVEFORM,
            StepKind.ERROR_CHECK, StepKind.DISCONNECT);

        // Verify the command step
        var write = (StepAction.Write) program.steps().get(1).action();
        assertThat(write.invocation().command()).isEqualTo("CH<x>:SCAle {<NR1>}");
        assertThat(write.invocation().params()).hasSize(2);
        assertThat(write.invocation().params().get(0).type()).isEqualTo(ParamType.ENUMERATION);
        assertThat(write.invocation().params().get(1).type()).isEqualTo(ParamType.NUMBER);
        assertThat(write.invocation().bindings().get("Channel")).isEqualTo("CH2");

        // Verify group children
        Step group = program.steps().get(2);
        assertThat(group.children()).extracting(Step::id).containsExactly("s3a", "s3b", "s3c");
        assertThat(((StepAction.Query) group.children().get(0).action()).saveAs()).isEqualTo("idn");
        assertThat(((StepAction.Sleep) group.children().get(1).action()).seconds()).isEqualTo(0.5);

        var save = (StepAction.SaveWaveform) program.steps().get(3).action();
        assertThat(save.format()).isEqualTo(WaveformFormat.BINARY);
        assertThat(save.recordLength()).isNull();
        assertThat(save.width()).isEqualTo(1);

        assertThat(((StepAction.ErrorCheck) program.steps().get(4).action()).command()).isEqualTo("ALLEV?");
    }

    @Test
    void appliesStepDefaults() throws IOException {
        String json = """
            [
              { "id": "1", "type": "sleep" },
              { "id": "2", "type": "save_waveform" },
              { "id": "3", "type": "recall" },
              { "id": "4", "type": "save_screenshot", "params": { "scopeType": "legacy" } }
            ]
            """;

        Program program = ProgramLoader.loadFromString(json);

        assertThat(program.devices()).isEmpty();
        assertThat(((StepAction.Sleep) program.steps().get(0).action()).seconds()).isEqualTo(1.0);
        var save = (StepAction.SaveWaveform) program.steps().get(1).action();
        assertThat(save.source()).isEqualTo("CH1");
        assertThat(save.format()).isEqualTo(WaveformFormat.TEXT);
        assertThat(((StepAction.Recall) program.steps().get(2).action()).recallKind()).isEqualTo(RecallKind.FACTORY);
        var screenshot = (StepAction.SaveScreenshot) program.steps().get(3).action();
        assertThat(screenshot.imageFormat()).isEqualTo("PNG");
        assertThat(screenshot.generation()).isEqualTo(DeviceGeneration.LEGACY);
    }

    @Test
    void readsRouteFromStepOrParams() throws IOException {
        String json = """
            [
              { "id": "1", "type": "query", "route": "streaming", "params": { "command": "x" } },
              { "id": "2", "type": "query", "params": { "command": "y", "route": "command" } }
            ]
            """;

        Program program = ProgramLoader.loadFromString(json);

        assertThat(program.steps().get(0).route()).isEqualTo(Route.STREAMING);
        assertThat(program.steps().get(1).route()).isEqualTo(Route.COMMAND);
    }

    @Test
    void rejectsStepWithoutId() {
        assertThatThrownBy(() -> ProgramLoader.loadFromString("[{\"type\": \"connect\"}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("without id");
    }

    @Test
    void rejectsUnknownStepType() {
        assertThatThrownBy(() -> ProgramLoader.loadFromString("[{\"id\": \"1\", \"type\": \"teleport\"}]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("teleport");
    }

    @Test
    void loadsCompilerOptionsOverDefaults() throws IOException {
        CompilerOptions options = ProgramLoader.loadOptionsFromFile(Fixtures.program("options.json"));

        assertThat(options.indent()).isEqualTo("  ");
        assertThat(options.streamingPort()).isEqualTo(5001);
        assertThat(options.includeHeader()).isFalse();
        assertThat(options.screenshotFolder()).isEqualTo(CompilerOptions.DEFAULT_SCREENSHOT_FOLDER);
    }

    @Test
    void writerOutputLoadsBackUnchanged(@TempDir Path dir) throws IOException {
        Program original = ProgramLoader.loadFromFile(Fixtures.program("scope-basic.json"));
        Path copy = dir.resolve("copy.json");

        ProgramWriter.writeToFile(original, copy);

        assertThat(ProgramLoader.loadFromFile(copy)).isEqualTo(original);
    }
}
