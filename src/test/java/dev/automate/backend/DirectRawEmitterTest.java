package dev.automate.backend;

import dev.automate.model.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DirectRawEmitterTest {

    private static final Device SCOPE = Device.scope("scope", "scope", Backend.DIRECT_RAW, "10.0.0.1");
    private static final Device LEGACY_SCOPE = new Device("old", "old", Backend.DIRECT_RAW,
        ConnectionDescriptor.tcpip("10.0.0.2"), "SCOPE", null, DeviceGeneration.LEGACY, null);
    private static final Device SOCKET_SCOPE = new Device("sock", "sock", Backend.DIRECT_RAW,
        ConnectionDescriptor.socket("10.0.0.3", 4000), "SCOPE", null, DeviceGeneration.MODERN, null);

    private final DirectRawEmitter emitter = new DirectRawEmitter();

    @Test
    void writesAndQueriesThroughResource() {
        String write = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Write(CommandInvocation.of("CH1:SCAle 1")), ResolvedCommand.write("CH1:SCAle 1")));
        String query = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Query(CommandInvocation.of("CH1:SCAle?"), "ch1 scale"), ResolvedCommand.query("CH1:SCAle?")));

        assertThat(write).isEqualTo("scope.write(\"CH1:SCAle 1\")\n");
        assertThat(query).isEqualTo("ch1_scale = scope.query(\"CH1:SCAle?\").strip()\n"
            + "print(\"ch1_scale:\", ch1_scale)\n");
    }

    @Test
    void setAndQueryWritesThenReadsBack() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.SetAndQuery(CommandInvocation.of("CH1:SCAle 1"), null),
            new ResolvedCommand("CH1:SCAle 1", "CH1:SCAle?")));

        assertThat(code).isEqualTo("scope.write(\"CH1:SCAle 1\")\nprint(scope.query(\"CH1:SCAle?\").strip())\n");
    }

    @Test
    void commandsWithQuotesUseSingleQuotedLiteral() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Write(CommandInvocation.of("x")), ResolvedCommand.write("SAVe:IMAGe \"C:/a.png\"")));

        assertThat(code).isEqualTo("scope.write('SAVe:IMAGe \"C:/a.png\"')\n");
    }

    @Test
    void binaryWaveformUsesDeclaredRecordLength() {
        var ctx = Contexts.of(SCOPE, new StepAction.SaveWaveform("CH2", "run_${n}", WaveformFormat.BINARY, 5000, 2),
            null);

        String code = Contexts.emit(emitter, ctx);

        assertThat(code).contains("scope.write(\"WFMOutpre:BYT_Nr 2\")");
        assertThat(code).contains("scope.write(\"DATa:STOP 5000\")");
        assertThat(code).doesNotContain("RECOrdlength");
        assertThat(code).contains("_wfm_file = f\"run_{n}.bin\"");
    }

    @Test
    void textWaveformScalesSamples() {
        var ctx = Contexts.of(SCOPE, new StepAction.SaveWaveform("CH1", "trace.csv", WaveformFormat.TEXT, null, 1), null);

        String code = Contexts.emit(emitter, ctx);

        assertThat(code).contains("scope.write(\"DATa:ENCdg ASCii\")");
        assertThat(code).contains("_x_incr = float(scope.query(\"WFMOutpre:XINcr?\").strip())");
        assertThat(code).contains("_y_zero = float(scope.query(\"WFMOutpre:YZEro?\").strip())");
        assertThat(code).contains("f.write(f\"{i * _x_incr:.9e},{(raw - _y_off) * _y_mult + _y_zero:.6e}\\n\")");
        assertThat(code).contains("_wfm_file = \"trace.csv\"");
    }

    @Test
    void matlabWaveformSavesOnInstrumentThenTransfers() {
        var ctx = Contexts.of(SCOPE, new StepAction.SaveWaveform("MATH1", "math", WaveformFormat.MATLAB, null, 1), null);

        String code = Contexts.emit(emitter, ctx);

        assertThat(code).contains("_wfm_remote = \"C:/Temp/math.mat\"");
        int format = code.indexOf("SAVe:WAVEform:FILEFormat MATLab");
        int save = code.indexOf("SAVe:WAVEform MATH1,");
        int read = code.indexOf("FILESystem:READFile");
        int delete = code.indexOf("FILESystem:DELEte");
        assertThat(format).isNotNegative().isLessThan(save);
        assertThat(save).isLessThan(read);
        assertThat(read).isLessThan(delete);
        assertThat(code).contains("scope.timeout = 30000");
        assertThat(code).contains("scope.timeout = _old_timeout");
    }

    @Test
    void modernScreenshotSavesImageAndCopiesIt() {
        var ctx = Contexts.of(SCOPE, new StepAction.SaveScreenshot("screen", "PNG", null, null), null);

        String code = Contexts.emit(emitter, ctx);

        assertThat(ctx.features()).contains(ScriptFeature.OS);
        assertThat(code).contains("os.makedirs(\"./screenshots\", exist_ok=True)");
        assertThat(code).contains("_ss_local = \"./screenshots/screen.png\"");
        assertThat(code).contains("scope.write(f'SAVe:IMAGe \"{_ss_remote}\"')");
        assertThat(code).contains("except Exception:\n    pass\n");
        assertThat(code).doesNotContain("HARDCopy");
        assertThat(code).endsWith("print(f\"Saved screenshot to {_ss_local}\")\n");
    }

    @Test
    void legacyScreenshotUsesHardcopy() {
        var ctx = Contexts.of(LEGACY_SCOPE, new StepAction.SaveScreenshot("screen.png", "PNG", "out", null), null);

        String code = Contexts.emit(emitter, ctx);

        assertThat(code).contains("old.write(\"HARDCopy:PORT FILE\")");
        assertThat(code).contains("old.write(\"HARDCopy STARt\")");
        assertThat(code).contains("_ss_remote = \"C:/TekScope/Temp/screenshot.png\"");
        assertThat(code).contains("_ss_local = \"out/screen.png\"");
        assertThat(ctx.features()).contains(ScriptFeature.TIME);
    }

    @Test
    void stepGenerationOverridesDevice() {
        var ctx = Contexts.of(SCOPE, new StepAction.SaveScreenshot("s", "PNG", null, DeviceGeneration.LEGACY), null);

        assertThat(Contexts.emit(emitter, ctx)).contains("HARDCopy:PORT FILE");
    }

    @Test
    void socketScreenshotUsesHelper() {
        var ctx = Contexts.of(SOCKET_SCOPE, new StepAction.SaveScreenshot("s", "PNG", null, null), null);

        String code = Contexts.emit(emitter, ctx);

        assertThat(code).contains(
            "_ss_data = capture_screenshot_socket(\"10.0.0.3\", 4000, \"C:/Temp/automate_screenshot.png\", timeout=30)");
        assertThat(ctx.features()).contains(ScriptFeature.SOCKET, ScriptFeature.SOCKET_SCREENSHOT_HELPER);
    }

    @Test
    void socketConnectionSetsTerminations() {
        var out = new CodeWriter("    ");
        emitter.openConnection(SOCKET_SCOPE, DeviceHandles.single("sock"), out, CompilerOptions.defaults(), true);

        assertThat(out.toString()).isEqualTo("""
            sock = rm.open_resource("TCPIP::10.0.0.3::4000::SOCKET")
            sock.timeout = 5000
            sock.read_termination = "\\n"
            sock.write_termination = "\\n"
            """);
    }

    @Test
    void recallsEachKind() {
        String factory = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Recall(RecallKind.FACTORY, null, null), null));
        String session = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Recall(RecallKind.SESSION, "C:/s.tss", null), null));
        String waveform = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Recall(RecallKind.WAVEFORM, "C:/w.wfm", null), null));

        assertThat(factory).startsWith("scope.write(\"RECALL:SETUP FACTORY\")\n");
        assertThat(session).contains("scope.write('RECALL:SESSION \"C:/s.tss\"')\ntime.sleep(2)\n");
        assertThat(waveform).contains("scope.write('RECALL:WAVEFORM \"C:/w.wfm\",REF1')");
    }

    @Test
    void errorCheckNeverRaises() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE, new StepAction.ErrorCheck("*ESR?"), null));

        assertThat(code).isEqualTo("""
            try:
                _status = scope.query("*ESR?").strip()
                print("Status of scope:", _status)
            except Exception as exc:
                print("Error check failed:", exc)
            """);
    }

    @Test
    void waveformFilenameGetsFormatExtension() {
        assertThat(DirectRawEmitter.waveformFilename("data.csv", WaveformFormat.BINARY)).isEqualTo("data.bin");
        assertThat(DirectRawEmitter.waveformFilename("${run}_ch1", WaveformFormat.NATIVE)).isEqualTo("{run}_ch1.wfm");
    }
}
