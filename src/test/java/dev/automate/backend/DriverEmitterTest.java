package dev.automate.backend;

import dev.automate.model.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DriverEmitterTest {

    private static final Device SCOPE = new Device("scope", "scope", Backend.HIGH_LEVEL_DRIVER,
        ConnectionDescriptor.tcpip("10.0.0.1"), "SCOPE", "MSO6B", DeviceGeneration.MODERN, null);

    private final DriverEmitter emitter = new DriverEmitter();

    @Test
    void addsTypedDeviceThroughManager() {
        var out = new CodeWriter("    ");
        emitter.openConnection(SCOPE, DeviceHandles.single("scope"), out, CompilerOptions.defaults(), true);

        assertThat(out.toString()).isEqualTo("scope: MSO6B = device_manager.add_scope(\"10.0.0.1\", alias=\"scope\")\n");
    }

    @Test
    void socketDevicesPassConnectionType() {
        var afg = new Device("afg", "afg", Backend.HIGH_LEVEL_DRIVER, ConnectionDescriptor.socket("10.0.0.9", 4001),
            "AFG", null, null, null);
        var out = new CodeWriter("    ");
        emitter.openConnection(afg, DeviceHandles.single("devices['afg']"), out, CompilerOptions.defaults(), false);

        assertThat(out.toString()).isEqualTo(
            "devices['afg'] = device_manager.add_afg(\"10.0.0.9\", alias=\"afg\", connection_type=\"SOCKET\", port=4001)\n");
    }

    @Test
    void unknownDeviceTypeIsAddedAsScope() {
        var odd = new Device("x", "x", Backend.HIGH_LEVEL_DRIVER, ConnectionDescriptor.tcpip("10.0.0.4"),
            "SPECTRUM", null, null, null);
        var out = new CodeWriter("    ");
        emitter.openConnection(odd, DeviceHandles.single("x"), out, CompilerOptions.defaults(), true);

        assertThat(out.toString()).startsWith("x = device_manager.add_scope(");
    }

    @Test
    void convertsRawCommandsToCommandTree() {
        String write = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Write(CommandInvocation.of("CH1:SCAle 0.5")), ResolvedCommand.write("CH1:SCAle 0.5")));
        String query = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Query(CommandInvocation.of("CH1:SCAle?"), "scale"), ResolvedCommand.query("CH1:SCAle?")));

        assertThat(write).isEqualTo("scope.commands.ch[1].scale.write(0.5)\n");
        assertThat(query).isEqualTo("scale = scope.commands.ch[1].scale.query()\nprint(\"scale:\", scale)\n");
    }

    @Test
    void fallsBackToVisaResourceForCompoundCommands() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Write(CommandInvocation.of("x")), ResolvedCommand.write("HEADer OFF;VERBose ON")));

        assertThat(code).isEqualTo("scope.visa_resource.write(\"HEADer OFF;VERBose ON\")\n");
    }

    @Test
    void keepsApiCallsVerbatim() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Write(CommandInvocation.of("x")), ResolvedCommand.write("scope.turn_channel_on(\"CH2\")")));

        assertThat(code).isEqualTo("scope.turn_channel_on(\"CH2\")\n");
    }

    @Test
    void waveformRunsOnVisaResource() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.SaveWaveform("CH1", "w", WaveformFormat.BINARY, null, 1), null));

        assertThat(code).contains("scope.visa_resource.write(\"DATa:SOUrce CH1\")");
        assertThat(code).contains("scope.visa_resource.query_binary_values(");
    }

    @Test
    void screenshotUsesDriverMethod() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.SaveScreenshot("shot", "PNG", "captures", null), null));

        assertThat(code).startsWith("scope.save_screenshot(\"shot.png\", local_folder=\"captures\")\n");
    }

    @Test
    void defaultErrorCheckReadsEventLog() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.ErrorCheck(StepAction.ErrorCheck.DEFAULT_COMMAND), null));

        assertThat(code).contains("_status = scope.get_eventlog_status()");
    }

    @Test
    void recallsThroughDriver() {
        String factory = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Recall(RecallKind.FACTORY, null, null), null));
        String reference = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.Recall(RecallKind.WAVEFORM, "C:/w.wfm", "REF3"), null));

        assertThat(factory).isEqualTo("scope.reset()\n");
        assertThat(reference).isEqualTo("scope.recall_reference(\"C:/w.wfm\", 3)\n");
    }

    @Test
    void driverCallBuildsFromPath() {
        String code = Contexts.emit(emitter, Contexts.of(SCOPE,
            new StepAction.DriverCall(null, "commands.acquire.state.write", "\"RUN\""), null));

        assertThat(code).isEqualTo("scope.commands.acquire.state.write(\"RUN\")\n");
    }
}
