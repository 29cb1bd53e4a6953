package dev.automate.engine;

/**
 * Compilation failure attributed to one step of the tree.
 */
public class CompileException extends RuntimeException {

    private final String stepId;

    public CompileException(String stepId, String message, Throwable cause) {
        super("Step '%s': %s".formatted(stepId, message), cause);
        this.stepId = stepId;
    }

    public String stepId() {
        return stepId;
    }
}
