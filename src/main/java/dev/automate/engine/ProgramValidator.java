package dev.automate.engine;

import dev.automate.model.CommandInvocation;
import dev.automate.model.Device;
import dev.automate.model.Program;
import dev.automate.model.RecallKind;
import dev.automate.model.Step;
import dev.automate.model.StepAction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates a program before compilation.
 */
public final class ProgramValidator {

    private ProgramValidator() {}

    /**
     * Validate a program. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(Program program) {
        var errors = new ArrayList<String>();

        if (program.devices().isEmpty()) {
            errors.add("Program declares no devices");
        }

        var deviceNames = new HashSet<String>();
        var deviceIds = new HashSet<String>();
        Map<String, String> resources = new HashMap<>();
        for (Device device : program.devices()) {
            if (!deviceIds.add(device.id().toLowerCase(Locale.ROOT))) {
                errors.add("Duplicate device id '%s'".formatted(device.id()));
            }
            deviceNames.add(device.id().toLowerCase(Locale.ROOT));
            if (device.alias() != null) {
                deviceNames.add(device.alias().toLowerCase(Locale.ROOT));
            }
            String resource = device.connection().visaResource();
            String owner = resources.putIfAbsent(resource, device.id());
            if (owner != null) {
                errors.add("Devices '%s' and '%s' share the connection resource %s"
                    .formatted(owner, device.id(), resource));
            }
        }

        validateSteps(program.steps(), deviceNames, new HashSet<>(), errors);
        return errors;
    }

    private static void validateSteps(List<Step> steps, Set<String> deviceNames, Set<String> stepIds,
                                      List<String> errors) {
        for (Step step : steps) {
            if (!stepIds.add(step.id())) {
                errors.add("Duplicate step id '%s'".formatted(step.id()));
            }
            if (step.deviceId() != null && !deviceNames.contains(step.deviceId().toLowerCase(Locale.ROOT))) {
                errors.add("Step '%s' is bound to unknown device '%s'".formatted(step.id(), step.deviceId()));
            }

            StepAction action = step.action();
            CommandInvocation invocation = invocationOf(action);
            if (invocation != null && invocation.command().isBlank() && invocation.catalogKey() == null) {
                errors.add("Step '%s' has an empty command".formatted(step.id()));
            } else if (action instanceof StepAction.Sleep sleep && sleep.seconds() < 0) {
                errors.add("Step '%s' sleeps for a negative duration: %s".formatted(step.id(), sleep.seconds()));
            } else if (action instanceof StepAction.Recall recall && recall.recallKind() != RecallKind.FACTORY
                && isBlank(recall.filePath())) {
                errors.add("Step '%s': %s recall needs a file path".formatted(step.id(), recall.recallKind()));
            } else if (action instanceof StepAction.DriverCall call && isBlank(call.code()) && isBlank(call.commandPath())) {
                errors.add("Step '%s' has neither code nor a command path".formatted(step.id()));
            }

            validateSteps(step.children(), deviceNames, stepIds, errors);
        }
    }

    static CommandInvocation invocationOf(StepAction action) {
        if (action instanceof StepAction.Write write) {
            return write.invocation();
        } else if (action instanceof StepAction.Query query) {
            return query.invocation();
        } else if (action instanceof StepAction.SetAndQuery setAndQuery) {
            return setAndQuery.invocation();
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
