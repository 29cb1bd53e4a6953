package dev.automate.backend;

import dev.automate.model.Backend;
import dev.automate.model.Device;
import dev.automate.model.ResolvedCommand;
import dev.automate.model.Route;
import dev.automate.model.Step;
import dev.automate.model.StepAction;
import dev.automate.model.WaveformFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Decides which side of a hybrid device handles each step and groups consecutive streaming
 * steps so each group opens one data-access context.
 */
public final class HybridRouter {

    private static final Logger log = LoggerFactory.getLogger(HybridRouter.class);

    /**
     * Consecutive sibling steps rendered together. A streaming run holds one or more steps of
     * one hybrid device; every other run holds a single step. {@code route} is null for steps
     * of non-hybrid devices and for groups.
     */
    public record Run(Device device, Route route, List<Step> steps) {
        public boolean isStreaming() {
            return route == Route.STREAMING;
        }
    }

    private HybridRouter() {}

    /**
     * Side of a hybrid device that handles {@code step}. An explicit route wins; otherwise the
     * command or code text is inspected, and waveform saves that pull samples go to streaming.
     */
    public static Route classify(Step step, ResolvedCommand command) {
        if (step.route() != null) {
            return step.route();
        }
        StepAction action = step.action();
        Route sniffed = null;
        if (action instanceof StepAction.SaveWaveform save) {
            return save.format() == WaveformFormat.BINARY || save.format() == WaveformFormat.TEXT
                ? Route.STREAMING : Route.COMMAND;
        } else if (action instanceof StepAction.PythonPassthrough python) {
            sniffed = ApiCallDetector.classify(python.code()).orElse(null);
        } else if (action instanceof StepAction.DriverCall call) {
            sniffed = ApiCallDetector.classify(call.code() != null ? call.code() : "." + call.commandPath() + "(")
                .orElse(null);
        } else if (command != null) {
            String text = command.writeForm() != null ? command.writeForm() : command.queryForm();
            sniffed = ApiCallDetector.classify(text).orElse(null);
        }
        if (sniffed != null) {
            log.debug("Step '{}' routed to {} by its text", step.id(), sniffed);
            return sniffed;
        }
        return Route.COMMAND;
    }

    /**
     * Splits sibling steps into runs.
     *
     * @param siblings  steps sharing one parent, in order
     * @param deviceOf  bound device of a step
     * @param commandOf resolved command of a step, or null
     */
    public static List<Run> partition(List<Step> siblings, Function<Step, Device> deviceOf,
                                      Function<Step, ResolvedCommand> commandOf) {
        var runs = new ArrayList<Run>();
        for (Step step : siblings) {
            if (step.action() instanceof StepAction.Group) {
                runs.add(new Run(null, null, List.of(step)));
                continue;
            }
            Device device = deviceOf.apply(step);
            Route route = device.backend() == Backend.HYBRID ? classify(step, commandOf.apply(step)) : null;

            Run last = runs.isEmpty() ? null : runs.get(runs.size() - 1);
            if (route == Route.STREAMING && last != null && last.isStreaming()
                && last.device().id().equals(device.id())) {
                last.steps().add(step);
            } else {
                var steps = new ArrayList<Step>();
                steps.add(step);
                runs.add(new Run(device, route, steps));
            }
        }
        return runs;
    }
}
