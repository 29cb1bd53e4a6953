package dev.automate.backend;

import dev.automate.model.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingEmitterTest {

    private static final Device SCOPE = Device.scope("scope", "scope", Backend.STREAMING, "10.0.0.1");

    private final StreamingEmitter emitter = new StreamingEmitter();

    @Test
    void opensClientOnStreamingPort() {
        var out = new CodeWriter("    ");
        emitter.openConnection(SCOPE, DeviceHandles.single("scope"), out, CompilerOptions.defaults(), true);

        assertThat(out.toString()).isEqualTo("scope = TekHSIConnect(\"10.0.0.1:5000\")\n");
    }

    @Test
    void waveformOutsideContextOpensOne() {
        var ctx = Contexts.of(SCOPE, new StepAction.SaveWaveform("CH3", "w", WaveformFormat.BINARY, null, 1), null);

        String code = Contexts.emit(emitter, ctx);

        assertThat(code).contains("with scope.access_data():\n    _wfm = scope.get_data(\"ch3\")\n");
        assertThat(code).contains("f.write(_wfm.y_axis_values.tobytes())");
        assertThat(ctx.features()).doesNotContain(ScriptFeature.TM_DATA_TYPES);
    }

    @Test
    void waveformInsideContextReadsDirectly() {
        var ctx = Contexts.of(SCOPE, DeviceHandles.single("scope"),
            new StepAction.SaveWaveform("CH1", "w", WaveformFormat.TEXT, null, 1), null, true);

        String code = Contexts.emit(emitter, ctx);

        assertThat(code).startsWith("# Stream CH1 to a local file\n_wfm = scope.get_data(\"ch1\")\n");
        assertThat(code).doesNotContain("access_data");
        assertThat(code).contains("write_file(_wfm_file, _wfm)");
        assertThat(ctx.features()).contains(ScriptFeature.TM_DATA_TYPES);
    }

    @Test
    void nativeWaveformIsUnsupported() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.SaveWaveform("CH2", "w", WaveformFormat.NATIVE, null, 1), null));

        assertThat(code).startsWith("# UNSUPPORTED: Saving CH2 as native");
        assertThat(code).doesNotContain("get_data").doesNotContain("write_file");
    }

    @Test
    void matlabWaveformIsUnsupported() {
        var ctx = Contexts.of(SCOPE, new StepAction.SaveWaveform("CH2", "w", WaveformFormat.MATLAB, null, 1), null);

        String code = Contexts.emit(emitter, ctx);

        assertThat(code).startsWith("# UNSUPPORTED: Saving CH2 as matlab");
        assertThat(code).doesNotContain("_wfm_file").doesNotContain("write_file");
        assertThat(ctx.features()).doesNotContain(ScriptFeature.TM_DATA_TYPES);
    }

    @Test
    void rawCommandsAreMarkedUnsupported() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Write(CommandInvocation.of("CH1:SCAle 1")), ResolvedCommand.write("CH1:SCAle 1")));

        assertThat(code).startsWith("# UNSUPPORTED: Raw command 'CH1:SCAle 1' is not supported on scope (step s1)\n");
        assertThat(code).contains("print(\"WARNING: Raw command 'CH1:SCAle 1' is not supported on scope (step s1)\")");
    }

    @Test
    void screenshotIsUnsupported() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.SaveScreenshot("s", "PNG", null, null), null));

        assertThat(code).startsWith("# UNSUPPORTED: Screenshot");
    }

    @Test
    void streamingQueriesAreEmittedAsCalls() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Query(CommandInvocation.of("x"), "symbols"), ResolvedCommand.query("scope.available_symbols")));

        assertThat(code).isEqualTo("symbols = scope.available_symbols\nprint(\"symbols:\", symbols)\n");
    }
}
