package dev.automate.backend;

import dev.automate.model.StepAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.automate.backend.PythonLiterals.identifier;
import static dev.automate.backend.PythonLiterals.quote;

/**
 * Step renderings every strategy shares: pauses, comments, pasted Python and driver calls.
 */
public abstract class AbstractStepEmitter implements StepEmitter {

    private static final Logger log = LoggerFactory.getLogger(AbstractStepEmitter.class);

    @Override
    public void disconnect(EmitContext ctx) {
        ctx.out().line("# %s is closed during teardown".formatted(ctx.device().alias()));
    }

    @Override
    public void sleep(EmitContext ctx, StepAction.Sleep action) {
        ctx.require(ScriptFeature.TIME);
        ctx.out().line("time.sleep(%s)".formatted(PythonLiterals.number(action.seconds())));
    }

    @Override
    public void comment(EmitContext ctx, StepAction.Comment action) {
        for (String line : action.text().split("\n")) {
            ctx.out().line(line.isBlank() ? "#" : "# " + line.strip());
        }
    }

    @Override
    public void pythonPassthrough(EmitContext ctx, StepAction.PythonPassthrough action) {
        if (!action.code().isBlank()) {
            ctx.out().lines(action.code());
        }
    }

    @Override
    public void driverCall(EmitContext ctx, StepAction.DriverCall action) {
        if (action.code() != null && !action.code().isBlank()) {
            ctx.out().lines(action.code());
            return;
        }
        String args = action.args() == null ? "" : action.args();
        ctx.out().line("%s.%s(%s)".formatted(ctx.handle(), action.commandPath(), args));
    }

    /** Binds a call's result to the step's variable, or prints it when there is none. */
    protected static void emitResult(EmitContext ctx, String expression, String saveAs) {
        if (saveAs == null || saveAs.isBlank()) {
            ctx.out().line("print(%s)".formatted(expression));
            return;
        }
        String name = identifier(saveAs);
        ctx.out().line("%s = %s".formatted(name, expression));
        ctx.out().line("print(%s, %s)".formatted(quote(name + ":"), name));
    }

    /** Marks a step this strategy cannot perform, visibly in the source and at run time. */
    protected static void unsupported(EmitContext ctx, String what) {
        String message = "%s is not supported on %s (step %s)".formatted(what, ctx.device().alias(), ctx.step().id());
        log.warn("Step '{}': {}", ctx.step().id(), message);
        ctx.out().line("# UNSUPPORTED: " + message);
        ctx.out().line("print(%s)".formatted(quote("WARNING: " + message)));
    }

    /** Writes {@code dataVariable} to {@code localVariable} and reports it. */
    protected static void writeLocalFile(EmitContext ctx, String localVariable, String dataVariable) {
        ctx.out().line("with open(%s, \"wb\") as f:".formatted(localVariable));
        ctx.out().indent().line("f.write(%s)".formatted(dataVariable)).dedent();
    }
}
