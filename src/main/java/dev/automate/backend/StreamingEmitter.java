package dev.automate.backend;

import dev.automate.model.Backend;
import dev.automate.model.CompilerOptions;
import dev.automate.model.Device;
import dev.automate.model.StepAction;
import dev.automate.model.WaveformFormat;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static dev.automate.backend.PythonLiterals.filename;
import static dev.automate.backend.PythonLiterals.quote;

/**
 * Streaming strategy: a TekHSI client pulls waveforms inside {@code access_data()} contexts.
 * It has no raw command path, so command-only steps degrade to a visible marker.
 */
public class StreamingEmitter extends AbstractStepEmitter {

    @Override
    public Backend backend() {
        return Backend.STREAMING;
    }

    @Override
    public Set<ScriptFeature> requirements(Device device) {
        return EnumSet.of(ScriptFeature.TEKHSI);
    }

    /** {@code host:port} the streaming client connects to. */
    static String endpoint(Device device, CompilerOptions options) {
        return device.connection().host() + ":" + options.streamingPort();
    }

    @Override
    public void openConnection(Device device, DeviceHandles handles, CodeWriter out, CompilerOptions options,
                               boolean typed) {
        out.line("%s = TekHSIConnect(%s)".formatted(handles.streaming(), quote(endpoint(device, options))));
    }

    @Override
    public void closeConnection(Device device, DeviceHandles handles, CodeWriter out) {
        out.line(handles.streaming() + ".close()");
    }

    @Override
    public void connect(EmitContext ctx) {
        ctx.out().line("print(%s, %s.available_symbols)".formatted(
            quote("Streaming from " + endpoint(ctx.device(), ctx.options()) + ":"), ctx.handles().streaming()));
    }

    @Override
    public void write(EmitContext ctx, StepAction.Write action) {
        String command = ctx.command().writeForm();
        if (ApiCallDetector.isApiCall(command)) {
            ctx.out().lines(command);
        } else {
            unsupported(ctx, "Raw command '%s'".formatted(command));
        }
    }

    @Override
    public void query(EmitContext ctx, StepAction.Query action) {
        streamingQuery(ctx, ctx.command().queryForm(), action.saveAs());
    }

    @Override
    public void setAndQuery(EmitContext ctx, StepAction.SetAndQuery action) {
        write(ctx, new StepAction.Write(action.invocation()));
        streamingQuery(ctx, ctx.command().queryForm(), action.saveAs());
    }

    private static void streamingQuery(EmitContext ctx, String command, String saveAs) {
        if (ApiCallDetector.isApiCall(command)) {
            emitResult(ctx, command.strip(), saveAs);
        } else {
            unsupported(ctx, "Raw query '%s'".formatted(command));
        }
    }

    /** Streams BINARY and TEXT captures; instrument-side file formats need a command path. */
    @Override
    public void saveWaveform(EmitContext ctx, StepAction.SaveWaveform action) {
        if (action.format() == WaveformFormat.NATIVE || action.format() == WaveformFormat.MATLAB) {
            unsupported(ctx, "Saving %s as %s".formatted(action.source(), action.format().name().toLowerCase(Locale.ROOT)));
            return;
        }
        CodeWriter out = ctx.out();
        String h = ctx.handles().streaming();
        String symbol = action.source().toLowerCase(Locale.ROOT);
        out.line("# Stream %s to a local file".formatted(action.source()));
        if (ctx.inDataAccess()) {
            out.line("_wfm = %s.get_data(%s)".formatted(h, quote(symbol)));
        } else {
            out.line("with %s.access_data():".formatted(h));
            out.indent().line("_wfm = %s.get_data(%s)".formatted(h, quote(symbol))).dedent();
        }
        out.line("_wfm_file = " + filename(DirectRawEmitter.waveformFilename(action.filename(), action.format())));
        if (action.format() == WaveformFormat.BINARY) {
            writeLocalFile(ctx, "_wfm_file", "_wfm.y_axis_values.tobytes()");
        } else {
            ctx.require(ScriptFeature.TM_DATA_TYPES);
            out.line("write_file(_wfm_file, _wfm)");
        }
        out.line("print(f\"Saved %s to {_wfm_file}\")".formatted(action.source()));
    }

    @Override
    public void saveScreenshot(EmitContext ctx, StepAction.SaveScreenshot action) {
        unsupported(ctx, "Screenshot");
    }

    @Override
    public void errorCheck(EmitContext ctx, StepAction.ErrorCheck action) {
        unsupported(ctx, "Error check");
    }

    @Override
    public void recall(EmitContext ctx, StepAction.Recall action) {
        unsupported(ctx, "Recall of %s".formatted(action.recallKind().name().toLowerCase(Locale.ROOT)));
    }
}
