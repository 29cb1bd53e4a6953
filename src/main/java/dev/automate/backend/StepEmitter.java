package dev.automate.backend;

import dev.automate.model.Backend;
import dev.automate.model.CompilerOptions;
import dev.automate.model.Device;
import dev.automate.model.StepAction;

import java.util.Set;

/**
 * Renders steps as Python source for one communication strategy. Groups never reach an
 * emitter; the assembler walks into their children.
 */
public interface StepEmitter {

    Backend backend();

    /** Imports and helpers needed to open and close {@code device}. */
    Set<ScriptFeature> requirements(Device device);

    /**
     * Emit the setup lines that open the device's connections.
     *
     * @param device  the device to open
     * @param handles expressions the opened connections are assigned to
     * @param out     destination, positioned at module level
     * @param options compiler options
     * @param typed   whether the handle is a plain variable that may carry a type hint
     */
    void openConnection(Device device, DeviceHandles handles, CodeWriter out, CompilerOptions options, boolean typed);

    /** Emit the teardown lines that close every connection {@link #openConnection} opened. */
    void closeConnection(Device device, DeviceHandles handles, CodeWriter out);

    void connect(EmitContext ctx);

    void disconnect(EmitContext ctx);

    void write(EmitContext ctx, StepAction.Write action);

    void query(EmitContext ctx, StepAction.Query action);

    void setAndQuery(EmitContext ctx, StepAction.SetAndQuery action);

    void sleep(EmitContext ctx, StepAction.Sleep action);

    void comment(EmitContext ctx, StepAction.Comment action);

    void pythonPassthrough(EmitContext ctx, StepAction.PythonPassthrough action);

    void saveWaveform(EmitContext ctx, StepAction.SaveWaveform action);

    void saveScreenshot(EmitContext ctx, StepAction.SaveScreenshot action);

    void errorCheck(EmitContext ctx, StepAction.ErrorCheck action);

    void recall(EmitContext ctx, StepAction.Recall action);

    void driverCall(EmitContext ctx, StepAction.DriverCall action);

    /**
     * Render one non-group step through the method for its kind.
     */
    default void emit(EmitContext ctx) {
        ctx.step().action().accept(new StepAction.Visitor<Void>() {
            public Void visitConnect(StepAction.Connect action) { connect(ctx); return null; }
            public Void visitDisconnect(StepAction.Disconnect action) { disconnect(ctx); return null; }
            public Void visitWrite(StepAction.Write action) { write(ctx, action); return null; }
            public Void visitQuery(StepAction.Query action) { query(ctx, action); return null; }
            public Void visitSetAndQuery(StepAction.SetAndQuery action) { setAndQuery(ctx, action); return null; }
            public Void visitSleep(StepAction.Sleep action) { sleep(ctx, action); return null; }
            public Void visitComment(StepAction.Comment action) { comment(ctx, action); return null; }
            public Void visitPythonPassthrough(StepAction.PythonPassthrough action) {
                pythonPassthrough(ctx, action);
                return null;
            }
            public Void visitSaveWaveform(StepAction.SaveWaveform action) { saveWaveform(ctx, action); return null; }
            public Void visitSaveScreenshot(StepAction.SaveScreenshot action) {
                saveScreenshot(ctx, action);
                return null;
            }
            public Void visitErrorCheck(StepAction.ErrorCheck action) { errorCheck(ctx, action); return null; }
            public Void visitRecall(StepAction.Recall action) { recall(ctx, action); return null; }
            public Void visitGroup(StepAction.Group action) {
                throw new IllegalStateException("Group step '%s' reached an emitter".formatted(ctx.step().id()));
            }
            public Void visitDriverCall(StepAction.DriverCall action) { driverCall(ctx, action); return null; }
        });
    }
}
