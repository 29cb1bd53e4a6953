package dev.automate.backend;

import dev.automate.model.CompilerOptions;
import dev.automate.model.Device;
import dev.automate.model.ResolvedCommand;
import dev.automate.model.Step;
import dev.automate.model.StepAction;

import java.util.EnumSet;

/** Builds emit contexts writing at column zero. */
final class Contexts {

    private Contexts() {}

    static EmitContext of(Device device, StepAction action, ResolvedCommand command) {
        return of(device, DeviceHandles.single(DeviceHandles.variable(device.alias())), action, command, false);
    }

    static EmitContext of(Device device, DeviceHandles handles, StepAction action, ResolvedCommand command,
                          boolean inDataAccess) {
        var step = new Step("s1", null, device.id(), null, action);
        return new EmitContext(step, device, handles, command, CompilerOptions.defaults(),
            new CodeWriter(CompilerOptions.DEFAULT_INDENT), EnumSet.noneOf(ScriptFeature.class), inDataAccess);
    }

    static String emit(StepEmitter emitter, EmitContext ctx) {
        emitter.emit(ctx);
        return ctx.out().toString();
    }
}
