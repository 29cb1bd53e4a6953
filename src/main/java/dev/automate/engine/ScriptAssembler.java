package dev.automate.engine;

import dev.automate.backend.CodeWriter;
import dev.automate.backend.DeviceHandles;
import dev.automate.backend.EmitContext;
import dev.automate.backend.Emitters;
import dev.automate.backend.HybridEmitter;
import dev.automate.backend.HybridRouter;
import dev.automate.backend.PythonHelpers;
import dev.automate.backend.ScriptFeature;
import dev.automate.backend.StepEmitter;
import dev.automate.model.Backend;
import dev.automate.model.CompilerOptions;
import dev.automate.model.Device;
import dev.automate.model.Program;
import dev.automate.model.ResolvedCommand;
import dev.automate.model.Step;
import dev.automate.model.StepAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compiles a step tree into one Python program: header, imports, helpers, backend setup,
 * one connection-open block per device, the step body inside {@code try:}, and one
 * connection-close block per device inside {@code finally:}.
 */
public final class ScriptAssembler {

    private static final Logger log = LoggerFactory.getLogger(ScriptAssembler.class);

    private final CommandStepResolver resolver;
    private final CompilerOptions options;
    private final Emitters emitters = new Emitters();

    public ScriptAssembler(CommandCatalog catalog, CompilerOptions options) {
        this.resolver = new CommandStepResolver(catalog);
        this.options = options;
    }

    public ScriptAssembler() {
        this(CommandCatalog.empty(), CompilerOptions.defaults());
    }

    public String assemble(Program program) {
        return assemble(program.steps(), program.devices(), program.backend());
    }

    /**
     * Compile {@code steps} for {@code devices}. Devices without a backend of their own use
     * {@code backend}.
     *
     * @throws CompileException         if a step's command template is malformed
     * @throws IllegalArgumentException if there are no devices
     */
    public String assemble(List<Step> steps, List<Device> devices, Backend backend) {
        if (devices.isEmpty()) {
            throw new IllegalArgumentException("Cannot compile a program without devices");
        }
        var compilation = new Compilation(effectiveDevices(devices, backend));
        List<Step> bound = DeviceBinder.bind(steps, compilation.devices);
        String text = compilation.render(bound);
        log.info("Compiled {} top-level steps for {} device(s)", steps.size(), devices.size());
        return text;
    }

    private static List<Device> effectiveDevices(List<Device> devices, Backend backend) {
        var effective = new ArrayList<Device>();
        for (Device device : devices) {
            effective.add(device.backend() == null ? device.withBackend(backend) : device);
        }
        return effective;
    }

    /**
     * Outline of the bound tree, one line per step, for previews.
     */
    public static String outline(Program program) {
        List<Device> devices = effectiveDevices(program.devices(), program.backend());
        var sb = new StringBuilder();
        outline(DeviceBinder.bind(program.steps(), devices), devices, 0, sb);
        return sb.toString();
    }

    private static void outline(List<Step> steps, List<Device> devices, int depth, StringBuilder sb) {
        for (Step step : steps) {
            Device device = DeviceBinder.find(step.deviceId(), devices).orElseThrow();
            sb.append("  ".repeat(depth))
              .append("[").append(step.id()).append("] ")
              .append(step.kind().jsonName());
            if (step.label() != null) {
                sb.append(" \"").append(step.label()).append("\"");
            }
            sb.append(" -> ").append(device.alias()).append(" (").append(device.backend().jsonName()).append(")");
            if (step.route() != null) {
                sb.append(" route=").append(step.route().jsonName());
            }
            sb.append("\n");
            outline(step.children(), devices, depth + 1, sb);
        }
    }

    /** State of one compilation. */
    private final class Compilation {

        private final List<Device> devices;
        private final Map<String, Device> byId = new LinkedHashMap<>();
        private final Map<String, DeviceHandles> handles = new LinkedHashMap<>();
        private final Map<Step, ResolvedCommand> resolved = new IdentityHashMap<>();
        private final Set<ScriptFeature> features = EnumSet.noneOf(ScriptFeature.class);
        private final boolean multiDevice;

        Compilation(List<Device> devices) {
            this.devices = devices;
            this.multiDevice = devices.size() > 1;
            for (Device device : devices) {
                byId.put(device.id(), device);
                String command = multiDevice
                    ? DeviceHandles.mapEntry(device.alias())
                    : DeviceHandles.variable(device.alias());
                handles.put(device.id(), device.backend() == Backend.HYBRID
                    ? new DeviceHandles(command, HybridEmitter.streamingHandle(command))
                    : DeviceHandles.single(command));
            }
        }

        String render(List<Step> steps) {
            var body = new CodeWriter(options.indent());
            body.indent();
            emitSteps(steps, body);

            for (Device device : devices) {
                features.addAll(emitter(device).requirements(device));
            }

            var out = new CodeWriter(options.indent());
            if (options.includeHeader()) {
                header(out);
            }
            imports(out);
            helpers(out);
            setup(out);

            out.line("try:");
            out.append(body.toString());
            if (!hasStatements(body.toString())) {
                out.indent().line("pass").dedent();
            }
            out.line("finally:");
            out.indent();
            for (Device device : devices) {
                emitter(device).closeConnection(device, handles.get(device.id()), out);
            }
            if (features.contains(ScriptFeature.PYVISA)) {
                out.line("rm.close()");
            }
            out.dedent();
            return out.toString();
        }

        private void header(CodeWriter out) {
            out.line("#!/usr/bin/env python3");
            out.line("\"\"\"");
            out.line("Generated by automate-compile.");
            out.line("");
            for (Device device : devices) {
                out.line("%s: %s via %s".formatted(device.alias(), device.connection().visaResource(),
                    device.backend().jsonName()));
            }
            out.line("\"\"\"");
            out.blank();
        }

        private void imports(CodeWriter out) {
            for (ScriptFeature feature : features) {
                if (feature.importLine() != null) {
                    out.line(feature.importLine());
                }
            }
            var drivers = new TreeSet<String>();
            for (Device device : devices) {
                if (device.driver() != null && usesDriverFramework(device)) {
                    drivers.add(device.driver());
                }
            }
            if (!drivers.isEmpty()) {
                out.line("from tm_devices.drivers import " + String.join(", ", drivers));
            }
            out.blank();
        }

        private void helpers(CodeWriter out) {
            for (ScriptFeature feature : features) {
                String source = PythonHelpers.source(feature);
                if (source != null) {
                    out.blank();
                    out.lines(source);
                    out.blank();
                    out.blank();
                }
            }
        }

        private void setup(CodeWriter out) {
            if (features.contains(ScriptFeature.PYVISA)) {
                out.line("rm = pyvisa.ResourceManager()");
            }
            if (features.contains(ScriptFeature.TM_DEVICES)) {
                out.line("device_manager = DeviceManager(verbose=False)");
                out.line("device_manager.setup_cleanup_enabled = False");
                out.line("device_manager.teardown_cleanup_enabled = False");
            }
            if (multiDevice) {
                out.line("devices = {}");
            }
            out.blank();
            for (Device device : devices) {
                out.line("# Connect to " + device.alias());
                emitter(device).openConnection(device, handles.get(device.id()), out, options, !multiDevice);
            }
            out.blank();
        }

        private void emitSteps(List<Step> steps, CodeWriter out) {
            for (HybridRouter.Run run : HybridRouter.partition(steps, this::deviceOf, this::commandOf)) {
                Step first = run.steps().get(0);
                if (first.action() instanceof StepAction.Group group) {
                    out.line("# --- Group: %s ---".formatted(first.label() != null ? first.label() : first.id()));
                    emitSteps(group.children(), out);
                } else if (run.isStreaming()) {
                    out.line("with %s.access_data():".formatted(handles.get(run.device().id()).streaming()));
                    out.indent();
                    for (Step step : run.steps()) {
                        emitStep(step, out, true);
                    }
                    out.dedent();
                } else {
                    emitStep(first, out, false);
                }
            }
        }

        private void emitStep(Step step, CodeWriter out, boolean inDataAccess) {
            Device device = deviceOf(step);
            var ctx = new EmitContext(step, device, handles.get(device.id()), commandOf(step), options, out,
                features, inDataAccess);
            log.debug("Emitting step '{}' ({}) for {}", step.id(), step.kind(), device.alias());
            emitter(device).emit(ctx);
        }

        private Device deviceOf(Step step) {
            return byId.get(step.deviceId());
        }

        private ResolvedCommand commandOf(Step step) {
            if (!resolved.containsKey(step)) {
                resolved.put(step, resolver.resolve(step));
            }
            return resolved.get(step);
        }

        private StepEmitter emitter(Device device) {
            return emitters.forBackend(device.backend());
        }

        private boolean usesDriverFramework(Device device) {
            return device.backend() == Backend.HIGH_LEVEL_DRIVER
                || (device.backend() == Backend.HYBRID && device.hybridCommandBackend() == Backend.HIGH_LEVEL_DRIVER);
        }
    }

    /** Whether generated code holds anything besides comments and blank lines. */
    static boolean hasStatements(String code) {
        for (String line : code.split("\n")) {
            String stripped = line.strip();
            if (!stripped.isEmpty() && !stripped.startsWith("#")) {
                return true;
            }
        }
        return false;
    }
}
