package dev.automate.backend;

import dev.automate.model.Backend;
import dev.automate.model.CompilerOptions;
import dev.automate.model.ConnectionDescriptor;
import dev.automate.model.Device;
import dev.automate.model.StepAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static dev.automate.backend.PythonLiterals.baseName;
import static dev.automate.backend.PythonLiterals.filename;
import static dev.automate.backend.PythonLiterals.interpolate;
import static dev.automate.backend.PythonLiterals.quote;

/**
 * Driver-framework strategy: devices come from a tm_devices {@code DeviceManager} and
 * commands go through their command tree, with the raw VISA resource as fallback.
 */
public class DriverEmitter extends AbstractStepEmitter {

    private static final Logger log = LoggerFactory.getLogger(DriverEmitter.class);

    static final Set<String> DEVICE_KINDS = Set.of("scope", "afg", "awg", "smu", "psu", "dmm", "daq", "ss", "mf", "mt");

    private final DirectRawEmitter rawFallback = new DirectRawEmitter();

    @Override
    public Backend backend() {
        return Backend.HIGH_LEVEL_DRIVER;
    }

    @Override
    public Set<ScriptFeature> requirements(Device device) {
        return EnumSet.of(ScriptFeature.TM_DEVICES);
    }

    @Override
    public void openConnection(Device device, DeviceHandles handles, CodeWriter out, CompilerOptions options,
                               boolean typed) {
        String kind = device.deviceType().toLowerCase(Locale.ROOT);
        if (!DEVICE_KINDS.contains(kind)) {
            log.warn("Device '{}' has unknown type '{}'; adding it as a scope", device.alias(), device.deviceType());
            kind = "scope";
        }
        ConnectionDescriptor connection = device.connection();
        var args = new StringBuilder(quote(address(connection)));
        args.append(", alias=").append(quote(device.alias()));
        switch (connection.type()) {
            case SOCKET -> args.append(", connection_type=\"SOCKET\", port=").append(connection.port());
            case USB -> args.append(", connection_type=\"USB\"");
            case GPIB -> args.append(", connection_type=\"GPIB\"");
            case TCPIP -> { }
        }

        String target = typed && device.driver() != null
            ? "%s: %s".formatted(handles.command(), device.driver())
            : handles.command();
        out.line("%s = device_manager.add_%s(%s)".formatted(target, kind, args));
    }

    private static String address(ConnectionDescriptor connection) {
        return switch (connection.type()) {
            case GPIB -> String.valueOf(connection.port());
            default -> connection.resource() != null && !connection.resource().isBlank()
                ? connection.resource() : connection.host();
        };
    }

    @Override
    public void closeConnection(Device device, DeviceHandles handles, CodeWriter out) {
        out.line(handles.command() + ".close()");
    }

    @Override
    public void connect(EmitContext ctx) {
        ctx.out().line("print(%s, %s.idn_string)".formatted(quote("Connected to " + ctx.device().alias() + ":"),
            ctx.handle()));
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
        if (ApiCallDetector.isApiCall(command)) {
            ctx.out().lines(command);
            return;
        }
        Optional<String> path = ScpiPathConverter.convert(command);
        if (path.isPresent()) {
            ctx.out().line(ctx.handle() + "." + path.get());
        } else {
            ctx.out().line("%s.visa_resource.write(%s)".formatted(ctx.handle(), quote(command)));
        }
    }

    private static void sendQuery(EmitContext ctx, String command, String saveAs) {
        if (ApiCallDetector.isApiCall(command)) {
            emitResult(ctx, command.strip(), saveAs);
            return;
        }
        String expression = ScpiPathConverter.convert(command)
            .map(path -> ctx.handle() + "." + path)
            .orElse("%s.visa_resource.query(%s).strip()".formatted(ctx.handle(), quote(command)));
        emitResult(ctx, expression, saveAs);
    }

    /** The driver has no waveform transfer of its own; the raw protocol runs on its VISA resource. */
    @Override
    public void saveWaveform(EmitContext ctx, StepAction.SaveWaveform action) {
        rawFallback.saveWaveform(ctx.withHandle(ctx.handle() + ".visa_resource"), action);
    }

    @Override
    public void saveScreenshot(EmitContext ctx, StepAction.SaveScreenshot action) {
        String folder = action.localFolder() != null ? action.localFolder() : ctx.options().screenshotFolder();
        String base = baseName(interpolate(action.filename()));
        if (!base.contains(".")) {
            base = base + "." + action.imageFormat().toLowerCase(Locale.ROOT);
        }
        ctx.out().line("%s.save_screenshot(%s, local_folder=%s)".formatted(ctx.handle(), filename(base), quote(folder)));
        ctx.out().line("print(%s)".formatted(filename("Saved screenshot to " + folder + "/" + base)));
    }

    @Override
    public void errorCheck(EmitContext ctx, StepAction.ErrorCheck action) {
        CodeWriter out = ctx.out();
        out.line("try:");
        out.indent();
        if (StepAction.ErrorCheck.DEFAULT_COMMAND.equalsIgnoreCase(action.command())) {
            out.line("_status = %s.get_eventlog_status()".formatted(ctx.handle()));
        } else {
            out.line("_status = %s.visa_resource.query(%s).strip()".formatted(ctx.handle(), quote(action.command())));
        }
        out.line("print(%s, _status)".formatted(quote("Status of " + ctx.device().alias() + ":")));
        out.dedent();
        out.line("except Exception as exc:");
        out.indent().line("print(%s, exc)".formatted(quote("Error check failed:"))).dedent();
    }

    @Override
    public void recall(EmitContext ctx, StepAction.Recall action) {
        CodeWriter out = ctx.out();
        String h = ctx.handle();
        switch (action.recallKind()) {
            case FACTORY -> out.line(h + ".reset()");
            case SETUP -> out.line("%s.visa_resource.write(%s)".formatted(h,
                quote("RECALL:SETUP \"" + action.filePath() + "\"")));
            case SESSION -> out.line("%s.recall_session(%s)".formatted(h, quote(action.filePath())));
            case WAVEFORM -> out.line("%s.recall_reference(%s, %d)".formatted(h, quote(action.filePath()),
                referenceNumber(action.reference())));
        }
    }

    static int referenceNumber(String reference) {
        if (reference == null) {
            return 1;
        }
        String digits = reference.replaceAll("\\D", "");
        return digits.isEmpty() ? 1 : Integer.parseInt(digits);
    }
}
