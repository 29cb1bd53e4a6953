package dev.automate.backend;

import dev.automate.model.CompilerOptions;
import dev.automate.model.Device;
import dev.automate.model.ResolvedCommand;
import dev.automate.model.Step;

import java.util.Set;

/**
 * Everything an emitter needs to render one step.
 *
 * @param step         the step being rendered
 * @param device       the device the step is bound to
 * @param handles      Python expressions for the device's connections
 * @param command      resolved command text, or null for steps without one
 * @param options      compiler options
 * @param out          destination of the generated lines
 * @param features     imports and helpers the rendered code relies on, filled in by emitters
 * @param inDataAccess whether the step sits inside an open streaming data-access context
 */
public record EmitContext(
    Step step,
    Device device,
    DeviceHandles handles,
    ResolvedCommand command,
    CompilerOptions options,
    CodeWriter out,
    Set<ScriptFeature> features,
    boolean inDataAccess
) {
    public String handle() {
        return handles.command();
    }

    public EmitContext withHandle(String handle) {
        return new EmitContext(step, device, new DeviceHandles(handle, handles.streaming()), command, options, out,
            features, inDataAccess);
    }

    public EmitContext require(ScriptFeature feature) {
        features.add(feature);
        return this;
    }
}
