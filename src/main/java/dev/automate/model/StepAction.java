package dev.automate.model;

import java.util.List;

/**
 * What a step does. Exactly one record per step kind; {@link Visitor} makes every new kind a
 * compile error in each place that renders steps.
 */
public sealed interface StepAction {

    StepKind kind();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitConnect(Connect action);
        R visitDisconnect(Disconnect action);
        R visitWrite(Write action);
        R visitQuery(Query action);
        R visitSetAndQuery(SetAndQuery action);
        R visitSleep(Sleep action);
        R visitComment(Comment action);
        R visitPythonPassthrough(PythonPassthrough action);
        R visitSaveWaveform(SaveWaveform action);
        R visitSaveScreenshot(SaveScreenshot action);
        R visitErrorCheck(ErrorCheck action);
        R visitRecall(Recall action);
        R visitGroup(Group action);
        R visitDriverCall(DriverCall action);
    }

    /** Open the bound device's handle. */
    record Connect() implements StepAction {
        public StepKind kind() { return StepKind.CONNECT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitConnect(this); }
    }

    /** Release the bound device's handle. */
    record Disconnect() implements StepAction {
        public StepKind kind() { return StepKind.DISCONNECT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitDisconnect(this); }
    }

    record Write(CommandInvocation invocation) implements StepAction {
        public StepKind kind() { return StepKind.WRITE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitWrite(this); }
    }

    record Query(CommandInvocation invocation, String saveAs) implements StepAction {
        public StepKind kind() { return StepKind.QUERY; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitQuery(this); }
    }

    /** Write the value-bearing form, then read back through the header-only query form. */
    record SetAndQuery(CommandInvocation invocation, String saveAs) implements StepAction {
        public StepKind kind() { return StepKind.SET_AND_QUERY; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSetAndQuery(this); }
    }

    record Sleep(double seconds) implements StepAction {
        public StepKind kind() { return StepKind.SLEEP; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSleep(this); }
    }

    record Comment(String text) implements StepAction {
        public StepKind kind() { return StepKind.COMMENT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitComment(this); }
    }

    record PythonPassthrough(String code) implements StepAction {
        public StepKind kind() { return StepKind.PYTHON_PASSTHROUGH; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPythonPassthrough(this); }
    }

    record SaveWaveform(
        String source,
        String filename,
        WaveformFormat format,
        Integer recordLength, // nullable, absent means auto-detect on the instrument
        int width
    ) implements StepAction {
        public StepKind kind() { return StepKind.SAVE_WAVEFORM; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSaveWaveform(this); }
    }

    record SaveScreenshot(
        String filename,
        String imageFormat,
        String localFolder,
        DeviceGeneration generation // nullable, falls back to the device's generation
    ) implements StepAction {
        public StepKind kind() { return StepKind.SAVE_SCREENSHOT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSaveScreenshot(this); }
    }

    record ErrorCheck(String command) implements StepAction {
        public static final String DEFAULT_COMMAND = "ALLEV?";

        public StepKind kind() { return StepKind.ERROR_CHECK; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitErrorCheck(this); }
    }

    record Recall(RecallKind recallKind, String filePath, String reference) implements StepAction {
        public StepKind kind() { return StepKind.RECALL; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitRecall(this); }
    }

    record Group(List<Step> children) implements StepAction {
        public Group {
            children = children == null ? List.of() : List.copyOf(children);
        }

        public StepKind kind() { return StepKind.GROUP; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitGroup(this); }
    }

    /**
     * A driver-framework call emitted as written. When {@code code} is absent the call is
     * built from {@code commandPath} and {@code args} on the device handle.
     */
    record DriverCall(String code, String commandPath, String args) implements StepAction {
        public StepKind kind() { return StepKind.DRIVER_CALL; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitDriverCall(this); }
    }
}
