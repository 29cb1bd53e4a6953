package dev.automate.backend;

import dev.automate.model.Backend;
import dev.automate.model.CompilerOptions;
import dev.automate.model.Device;
import dev.automate.model.DeviceGeneration;
import dev.automate.model.StepAction;
import dev.automate.model.WaveformFormat;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static dev.automate.backend.PythonLiterals.baseName;
import static dev.automate.backend.PythonLiterals.filename;
import static dev.automate.backend.PythonLiterals.fquote;
import static dev.automate.backend.PythonLiterals.interpolate;
import static dev.automate.backend.PythonLiterals.quote;

/**
 * Raw command strategy: every step becomes PyVISA {@code write}/{@code query}/{@code read_raw}
 * calls on an open VISA resource.
 */
public class DirectRawEmitter extends AbstractStepEmitter {

    static final String LEGACY_TEMP_FOLDER = "C:/TekScope/Temp";
    static final String SCREENSHOT_TEMP_NAME = "automate_screenshot";
    static final String IDENTITY_QUERY = "*IDN?";

    @Override
    public Backend backend() {
        return Backend.DIRECT_RAW;
    }

    @Override
    public Set<ScriptFeature> requirements(Device device) {
        return EnumSet.of(ScriptFeature.PYVISA);
    }

    @Override
    public void openConnection(Device device, DeviceHandles handles, CodeWriter out, CompilerOptions options,
                               boolean typed) {
        String h = handles.command();
        out.line("%s = rm.open_resource(%s)".formatted(h, quote(device.connection().visaResource())));
        out.line("%s.timeout = %d".formatted(h, device.connection().timeoutMs()));
        if (device.connection().isSocket()) {
            out.line("%s.read_termination = \"\\n\"".formatted(h));
            out.line("%s.write_termination = \"\\n\"".formatted(h));
        }
    }

    @Override
    public void closeConnection(Device device, DeviceHandles handles, CodeWriter out) {
        out.line(handles.command() + ".close()");
    }

    @Override
    public void connect(EmitContext ctx) {
        ctx.out().line("print(%s, %s.query(%s).strip())".formatted(
            quote("Connected to " + ctx.device().alias() + ":"), ctx.handle(), quote(IDENTITY_QUERY)));
    }

    @Override
    public void write(EmitContext ctx, StepAction.Write action) {
        sendWrite(ctx, ctx.command().writeForm());
    }

    @Override
    public void query(EmitContext ctx, StepAction.Query action) {
        sendQuery(ctx, ctx.command().queryForm(), action.saveAs());
    }

    @Override
    public void setAndQuery(EmitContext ctx, StepAction.SetAndQuery action) {
        sendWrite(ctx, ctx.command().writeForm());
        sendQuery(ctx, ctx.command().queryForm(), action.saveAs());
    }

    private static void sendWrite(EmitContext ctx, String command) {
        ctx.out().line("%s.write(%s)".formatted(ctx.handle(), quote(command)));
    }

    private static void sendQuery(EmitContext ctx, String command, String saveAs) {
        emitResult(ctx, "%s.query(%s).strip()".formatted(ctx.handle(), quote(command)), saveAs);
    }

    @Override
    public void saveWaveform(EmitContext ctx, StepAction.SaveWaveform action) {
        switch (action.format()) {
            case BINARY -> saveBinaryWaveform(ctx, action);
            case TEXT -> saveTextWaveform(ctx, action);
            case NATIVE, MATLAB -> saveNativeWaveform(ctx, action);
        }
    }

    /** Local filename with the format's extension, replacing any waveform extension given. */
    static String waveformFilename(String requested, WaveformFormat format) {
        String name = interpolate(requested).replaceAll("(?i)\\.(csv|bin|wfm|mat)$", "");
        return name + "." + format.extension();
    }

    private void saveBinaryWaveform(EmitContext ctx, StepAction.SaveWaveform action) {
        CodeWriter out = ctx.out();
        String h = ctx.handle();
        out.line("# Save %s as binary waveform".formatted(action.source()));
        out.line("%s.write(%s)".formatted(h, quote("DATa:SOUrce " + action.source())));
        out.line("%s.write(%s)".formatted(h, quote("DATa:ENCdg RIBinary")));
        out.line("%s.write(%s)".formatted(h, quote("WFMOutpre:BYT_Nr " + action.width())));
        out.line("%s.write(%s)".formatted(h, quote("HEADer OFF")));
        out.line("%s.write(%s)".formatted(h, quote("DATa:STARt 1")));
        if (action.recordLength() == null) {
            out.line("_record_length = int(%s.query(%s).strip())".formatted(h, quote("HORizontal:RECOrdlength?")));
            out.line("%s.write(%s)".formatted(h, fquote("DATa:STOP {_record_length}")));
        } else {
            out.line("%s.write(%s)".formatted(h, quote("DATa:STOP " + action.recordLength())));
        }
        out.line("_wfm_data = %s.query_binary_values(%s, datatype=\"B\", container=bytes)".formatted(h, quote("CURVe?")));
        out.line("_wfm_file = " + filename(waveformFilename(action.filename(), action.format())));
        writeLocalFile(ctx, "_wfm_file", "_wfm_data");
        out.line("print(f\"Saved {len(_wfm_data)} bytes to {_wfm_file}\")");
    }

    private void saveTextWaveform(EmitContext ctx, StepAction.SaveWaveform action) {
        CodeWriter out = ctx.out();
        String h = ctx.handle();
        out.line("# Save %s as scaled text waveform".formatted(action.source()));
        out.line("%s.write(%s)".formatted(h, quote("DATa:SOUrce " + action.source())));
        out.line("%s.write(%s)".formatted(h, quote("DATa:ENCdg ASCii")));
        out.line("%s.write(%s)".formatted(h, quote("HEADer OFF")));
        out.line("_x_incr = float(%s.query(%s).strip())".formatted(h, quote("WFMOutpre:XINcr?")));
        out.line("_y_mult = float(%s.query(%s).strip())".formatted(h, quote("WFMOutpre:YMUlt?")));
        out.line("_y_off = float(%s.query(%s).strip())".formatted(h, quote("WFMOutpre:YOFf?")));
        out.line("_y_zero = float(%s.query(%s).strip())".formatted(h, quote("WFMOutpre:YZEro?")));
        out.line("_raw = [int(v) for v in %s.query(%s).strip().split(\",\") if v.strip()]".formatted(h, quote("CURVe?")));
        out.line("_wfm_file = " + filename(waveformFilename(action.filename(), action.format())));
        out.line("with open(_wfm_file, \"w\") as f:");
        out.indent();
        out.line("f.write(\"Time (s),Amplitude (V)\\n\")");
        out.line("for i, raw in enumerate(_raw):");
        out.indent().line("f.write(f\"{i * _x_incr:.9e},{(raw - _y_off) * _y_mult + _y_zero:.6e}\\n\")").dedent();
        out.dedent();
        out.line("print(f\"Saved {len(_raw)} points to {_wfm_file}\")");
    }

    private void saveNativeWaveform(EmitContext ctx, StepAction.SaveWaveform action) {
        CodeWriter out = ctx.out();
        String h = ctx.handle();
        String local = waveformFilename(action.filename(), action.format());
        String remote = ctx.options().instrumentTempFolder() + "/" + baseName(local);
        out.line("# Save %s as %s file on the instrument and copy it here".formatted(
            action.source(), action.format().name().toLowerCase(Locale.ROOT)));
        out.line("_wfm_remote = " + filename(remote));
        if (action.format() == WaveformFormat.MATLAB) {
            out.line("%s.write(%s)".formatted(h, quote("SAVe:WAVEform:FILEFormat MATLab")));
        }
        out.line("%s.write(%s)".formatted(h, fquote("SAVe:WAVEform " + action.source() + ",\"{_wfm_remote}\"")));
        out.line("%s.query(%s)".formatted(h, quote("*OPC?")));
        transferFile(ctx, "_wfm_remote", "_wfm_data");
        out.line("_wfm_file = " + filename(local));
        writeLocalFile(ctx, "_wfm_file", "_wfm_data");
        out.line("%s.write(%s)".formatted(h, fquote("FILESystem:DELEte \"{_wfm_remote}\"")));
        out.line("print(f\"Saved %s to {_wfm_file}\")".formatted(action.source()));
    }

    /** Reads an instrument-side file into {@code dataVariable} under the transfer timeout. */
    private static void transferFile(EmitContext ctx, String remoteVariable, String dataVariable) {
        CodeWriter out = ctx.out();
        String h = ctx.handle();
        out.line("_old_timeout = %s.timeout".formatted(h));
        out.line("%s.timeout = %d".formatted(h, ctx.options().transferTimeoutMs()));
        out.line("%s.write(%s)".formatted(h, fquote("FILESystem:READFile \"{" + remoteVariable + "}\"")));
        out.line("%s = %s.read_raw()".formatted(dataVariable, h));
        out.line("%s.timeout = _old_timeout".formatted(h));
    }

    @Override
    public void saveScreenshot(EmitContext ctx, StepAction.SaveScreenshot action) {
        CodeWriter out = ctx.out();
        String folder = action.localFolder() != null ? action.localFolder() : ctx.options().screenshotFolder();
        String extension = action.imageFormat().toLowerCase(Locale.ROOT);
        String base = baseName(interpolate(action.filename()));
        if (base.isBlank()) {
            base = "screenshot";
        }
        if (!base.toLowerCase(Locale.ROOT).matches(".*\\.(png|jpg|jpeg|bmp)$")) {
            base = base + "." + extension;
        }

        ctx.require(ScriptFeature.OS);
        out.line("os.makedirs(%s, exist_ok=True)".formatted(quote(folder)));
        out.line("_ss_local = " + filename(folder + "/" + base));

        DeviceGeneration generation = action.generation() != null ? action.generation() : ctx.device().generation();
        if (ctx.device().connection().isSocket()) {
            socketScreenshot(ctx, extension);
        } else if (generation == DeviceGeneration.LEGACY) {
            legacyScreenshot(ctx, action, extension);
        } else {
            modernScreenshot(ctx, extension);
        }

        writeLocalFile(ctx, "_ss_local", "_ss_data");
        out.line("print(f\"Saved screenshot to {_ss_local}\")");
    }

    private void socketScreenshot(EmitContext ctx, String extension) {
        ctx.require(ScriptFeature.SOCKET).require(ScriptFeature.TIME).require(ScriptFeature.SOCKET_SCREENSHOT_HELPER);
        var connection = ctx.device().connection();
        String remote = ctx.options().instrumentTempFolder() + "/" + SCREENSHOT_TEMP_NAME + "." + extension;
        ctx.out().line("_ss_data = capture_screenshot_socket(%s, %d, %s, timeout=%d)".formatted(
            quote(connection.host()), connection.port(), quote(remote), ctx.options().transferTimeoutMs() / 1000));
    }

    private void modernScreenshot(EmitContext ctx, String extension) {
        CodeWriter out = ctx.out();
        String h = ctx.handle();
        String folder = ctx.options().instrumentTempFolder();
        out.line("_ss_remote = " + quote(folder + "/" + SCREENSHOT_TEMP_NAME + "." + extension));
        tolerantWrite(ctx, "FILESystem:MKDir \"" + folder + "\"");
        out.line("%s.write(%s)".formatted(h, quote("SAVe:IMAGe:COMPosition NORMal")));
        out.line("%s.write(%s)".formatted(h, fquote("SAVe:IMAGe \"{_ss_remote}\"")));
        out.line("%s.query(%s)".formatted(h, quote("*OPC?")));
        transferFile(ctx, "_ss_remote", "_ss_data");
        out.line("%s.write(%s)".formatted(h, fquote("FILESystem:DELEte \"{_ss_remote}\"")));
    }

    private void legacyScreenshot(EmitContext ctx, StepAction.SaveScreenshot action, String extension) {
        CodeWriter out = ctx.out();
        String h = ctx.handle();
        ctx.require(ScriptFeature.TIME);
        out.line("_ss_remote = " + quote(LEGACY_TEMP_FOLDER + "/screenshot." + extension));
        tolerantWrite(ctx, "FILESystem:MKDir \"C:/TekScope\"");
        tolerantWrite(ctx, "FILESystem:MKDir \"" + LEGACY_TEMP_FOLDER + "\"");
        out.line("%s.write(%s)".formatted(h, quote("HARDCopy:PORT FILE")));
        out.line("%s.write(%s)".formatted(h, quote("HARDCopy:FORMat " + action.imageFormat().toUpperCase(Locale.ROOT))));
        out.line("%s.write(%s)".formatted(h, fquote("HARDCopy:FILEName \"{_ss_remote}\"")));
        out.line("%s.write(%s)".formatted(h, quote("HARDCopy STARt")));
        out.line("time.sleep(1.0)");
        transferFile(ctx, "_ss_remote", "_ss_data");
        out.line("%s.write(%s)".formatted(h, fquote("FILESystem:DELEte \"{_ss_remote}\"")));
    }

    /** A write whose failure is expected and ignored, such as creating an existing folder. */
    private static void tolerantWrite(EmitContext ctx, String command) {
        CodeWriter out = ctx.out();
        out.line("try:");
        out.indent().line("%s.write(%s)".formatted(ctx.handle(), quote(command))).dedent();
        out.line("except Exception:");
        out.indent().line("pass").dedent();
    }

    @Override
    public void errorCheck(EmitContext ctx, StepAction.ErrorCheck action) {
        CodeWriter out = ctx.out();
        out.line("try:");
        out.indent();
        out.line("_status = %s.query(%s).strip()".formatted(ctx.handle(), quote(action.command())));
        out.line("print(%s, _status)".formatted(quote("Status of " + ctx.device().alias() + ":")));
        out.dedent();
        out.line("except Exception as exc:");
        out.indent().line("print(%s, exc)".formatted(quote("Error check failed:"))).dedent();
    }

    @Override
    public void recall(EmitContext ctx, StepAction.Recall action) {
        CodeWriter out = ctx.out();
        String h = ctx.handle();
        String path = action.filePath();
        switch (action.recallKind()) {
            case FACTORY -> {
                out.line("%s.write(%s)".formatted(h, quote("RECALL:SETUP FACTORY")));
                out.line("print(\"Recalled factory defaults\")");
            }
            case SETUP -> {
                out.line("%s.write(%s)".formatted(h, quote("RECALL:SETUP \"" + path + "\"")));
                out.line("print(%s)".formatted(quote("Recalled setup from " + path)));
            }
            case SESSION -> {
                ctx.require(ScriptFeature.TIME);
                out.line("%s.write(%s)".formatted(h, quote("RECALL:SESSION \"" + path + "\"")));
                out.line("time.sleep(2)");
                out.line("print(%s)".formatted(quote("Recalled session from " + path)));
            }
            case WAVEFORM -> {
                String reference = action.reference() != null ? action.reference() : "REF1";
                out.line("%s.write(%s)".formatted(h, quote("RECALL:WAVEFORM \"" + path + "\"," + reference)));
                out.line("print(%s)".formatted(quote("Recalled waveform to " + reference + " from " + path)));
            }
        }
    }
}
