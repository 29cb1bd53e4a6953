package dev.automate.cli;

import ch.qos.logback.classic.Level;
import dev.automate.engine.CatalogLoader;
import dev.automate.engine.CommandCatalog;
import dev.automate.engine.CompileException;
import dev.automate.engine.ProgramLoader;
import dev.automate.engine.ProgramValidator;
import dev.automate.engine.ScriptAssembler;
import dev.automate.model.Backend;
import dev.automate.model.CompilerOptions;
import dev.automate.model.Device;
import dev.automate.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for automate-compile.
 */
@Command(
    name = "automate-compile",
    mixinStandardHelpOptions = true,
    description = "Compile an instrument automation program into a runnable Python script."
)
public class AutomateCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AutomateCli.class);

    @Parameters(index = "0", description = "Program JSON file (devices and steps)")
    private Path program;

    @Option(names = "--catalog", description = "Command catalog JSON used to resolve catalog keys")
    private Path catalog;

    @Option(names = "--backend",
        description = "Default backend for devices without one: pyvisa, tm_devices, tekhsi, hybrid")
    private String backend;

    @Option(names = "--config", description = "Compiler options JSON")
    private Path config;

    @Option(names = {"-o", "--output"}, description = "Write the script here instead of standard output")
    private Path output;

    @Option(names = "--validate", description = "Only validate the program")
    private boolean validateOnly;

    @Option(names = "--dry-run", description = "Print the bound step tree without compiling")
    private boolean dryRun;

    @Option(names = "--verbose", description = "Log resolution and emission details")
    private boolean verbose;

    private PrintStream out = System.out;
    private PrintStream err = System.err;

    AutomateCli redirect(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        return this;
    }

    @Override
    public Integer call() {
        if (verbose) {
            var root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }

        Program loaded;
        CommandCatalog commands;
        CompilerOptions options;
        try {
            loaded = ProgramLoader.loadFromFile(program);
            commands = catalog != null ? CatalogLoader.loadFromFile(catalog) : CommandCatalog.empty();
            options = config != null ? ProgramLoader.loadOptionsFromFile(config) : CompilerOptions.defaults();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: cannot load input: " + e.getMessage());
            return 1;
        }

        if (backend != null) {
            Backend override;
            try {
                override = Backend.fromName(backend);
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
            loaded = withDefaultBackend(loaded, override);
        }

        List<String> errors = ProgramValidator.validate(loaded);
        if (!errors.isEmpty()) {
            err.println("Program is invalid:");
            errors.forEach(e -> err.println("  - " + e));
            return 1;
        }
        if (validateOnly) {
            out.println("Program is valid: %d device(s), %d top-level step(s)"
                .formatted(loaded.devices().size(), loaded.steps().size()));
            return 0;
        }
        if (dryRun) {
            out.print(ScriptAssembler.outline(loaded));
            return 0;
        }

        String script;
        try {
            script = new ScriptAssembler(commands, options).assemble(loaded);
        } catch (CompileException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (output == null) {
            out.print(script);
            return 0;
        }
        try {
            Files.writeString(output, script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot write %s: %s".formatted(output, e.getMessage()));
            return 1;
        }
        log.info("Wrote {}", output);
        return 0;
    }

    /** Replaces the program default and the backend of every device that inherited it. */
    static Program withDefaultBackend(Program program, Backend backend) {
        var devices = new ArrayList<Device>();
        for (Device device : program.devices()) {
            devices.add(device.backend() == program.backend() ? device.withBackend(backend) : device);
        }
        return new Program(backend, devices, program.steps());
    }
}
