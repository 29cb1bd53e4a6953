package dev.automate.backend;

import dev.automate.model.Backend;
import dev.automate.model.CompilerOptions;
import dev.automate.model.Device;
import dev.automate.model.Route;
import dev.automate.model.StepAction;

import java.util.EnumSet;
import java.util.Set;

/**
 * Hybrid strategy: a command-side handle (raw or driver) and a streaming handle kept open
 * together. Each step goes to the side {@link HybridRouter} picks for it.
 */
public class HybridEmitter implements StepEmitter {

    private final StepEmitter rawSide = new DirectRawEmitter();
    private final StepEmitter driverSide = new DriverEmitter();
    private final StepEmitter streamingSide = new StreamingEmitter();

    @Override
    public Backend backend() {
        return Backend.HYBRID;
    }

    StepEmitter commandSide(Device device) {
        return device.hybridCommandBackend() == Backend.HIGH_LEVEL_DRIVER ? driverSide : rawSide;
    }

    @Override
    public Set<ScriptFeature> requirements(Device device) {
        Set<ScriptFeature> features = EnumSet.noneOf(ScriptFeature.class);
        features.addAll(commandSide(device).requirements(device));
        features.addAll(streamingSide.requirements(device));
        return features;
    }

    /** Streaming handle name paired with a command handle. */
    public static String streamingHandle(String commandHandle) {
        if (commandHandle.endsWith("']")) {
            return commandHandle.substring(0, commandHandle.length() - 2) + "_hsi']";
        }
        return commandHandle + "_hsi";
    }

    @Override
    public void openConnection(Device device, DeviceHandles handles, CodeWriter out, CompilerOptions options,
                               boolean typed) {
        commandSide(device).openConnection(device, handles, out, options, typed);
        streamingSide.openConnection(device, handles, out, options, typed);
    }

    @Override
    public void closeConnection(Device device, DeviceHandles handles, CodeWriter out) {
        streamingSide.closeConnection(device, handles, out);
        commandSide(device).closeConnection(device, handles, out);
    }

    private StepEmitter side(EmitContext ctx) {
        return HybridRouter.classify(ctx.step(), ctx.command()) == Route.STREAMING
            ? streamingSide : commandSide(ctx.device());
    }

    @Override
    public void connect(EmitContext ctx) {
        commandSide(ctx.device()).connect(ctx);
        streamingSide.connect(ctx);
    }

    @Override
    public void disconnect(EmitContext ctx) {
        commandSide(ctx.device()).disconnect(ctx);
    }

    @Override
    public void write(EmitContext ctx, StepAction.Write action) {
        side(ctx).write(ctx, action);
    }

    @Override
    public void query(EmitContext ctx, StepAction.Query action) {
        side(ctx).query(ctx, action);
    }

    @Override
    public void setAndQuery(EmitContext ctx, StepAction.SetAndQuery action) {
        side(ctx).setAndQuery(ctx, action);
    }

    @Override
    public void sleep(EmitContext ctx, StepAction.Sleep action) {
        side(ctx).sleep(ctx, action);
    }

    @Override
    public void comment(EmitContext ctx, StepAction.Comment action) {
        side(ctx).comment(ctx, action);
    }

    @Override
    public void pythonPassthrough(EmitContext ctx, StepAction.PythonPassthrough action) {
        side(ctx).pythonPassthrough(ctx, action);
    }

    @Override
    public void saveWaveform(EmitContext ctx, StepAction.SaveWaveform action) {
        side(ctx).saveWaveform(ctx, action);
    }

    @Override
    public void saveScreenshot(EmitContext ctx, StepAction.SaveScreenshot action) {
        commandSide(ctx.device()).saveScreenshot(ctx, action);
    }

    @Override
    public void errorCheck(EmitContext ctx, StepAction.ErrorCheck action) {
        commandSide(ctx.device()).errorCheck(ctx, action);
    }

    @Override
    public void recall(EmitContext ctx, StepAction.Recall action) {
        commandSide(ctx.device()).recall(ctx, action);
    }

    @Override
    public void driverCall(EmitContext ctx, StepAction.DriverCall action) {
        side(ctx).driverCall(ctx, action);
    }
}
