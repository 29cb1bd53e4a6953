package dev.automate.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.automate.model.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Serializes a program back to the JSON form {@link ProgramLoader} reads.
 */
public final class ProgramWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProgramWriter() {}

    public static String writeToString(Program program) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(program));
    }

    public static void writeToFile(Program program, Path path) throws IOException {
        Files.writeString(path, writeToString(program));
    }

    static ObjectNode toJson(Program program) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("backend", program.backend().jsonName());
        ArrayNode devices = root.putArray("devices");
        for (Device device : program.devices()) {
            devices.add(deviceJson(device));
        }
        root.set("steps", stepsJson(program.steps()));
        return root;
    }

    private static ObjectNode deviceJson(Device device) {
        ObjectNode node = MAPPER.createObjectNode();
        ConnectionDescriptor connection = device.connection();
        node.put("id", device.id());
        node.put("alias", device.alias());
        if (device.backend() != null) {
            node.put("backend", device.backend().jsonName());
        }
        node.put("connectionType", connection.type().name().toLowerCase(Locale.ROOT));
        node.put("host", connection.host());
        node.put("port", connection.port());
        node.put("timeout", connection.timeoutMs());
        if (connection.resource() != null) {
            node.put("resource", connection.resource());
        }
        node.put("deviceType", device.deviceType());
        if (device.driver() != null) {
            node.put("deviceDriver", device.driver());
        }
        node.put("generation", device.generation().name());
        node.put("hybridCommandBackend", device.hybridCommandBackend().jsonName());
        return node;
    }

    private static ArrayNode stepsJson(List<Step> steps) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Step step : steps) {
            array.add(stepJson(step));
        }
        return array;
    }

    private static ObjectNode stepJson(Step step) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", step.id());
        node.put("type", step.kind().jsonName());
        if (step.label() != null) {
            node.put("label", step.label());
        }
        if (step.deviceId() != null) {
            node.put("boundDeviceId", step.deviceId());
        }
        if (step.route() != null) {
            node.put("route", step.route().jsonName());
        }
        ObjectNode params = node.putObject("params");
        step.action().accept(new ParamsWriter(params));
        if (step.action() instanceof StepAction.Group group) {
            node.set("children", stepsJson(group.children()));
        }
        return node;
    }

    private static void invocationJson(ObjectNode params, CommandInvocation invocation) {
        params.put("command", invocation.command());
        if (invocation.catalogKey() != null) {
            params.put("catalogKey", invocation.catalogKey());
        }
        if (!invocation.params().isEmpty()) {
            ArrayNode declared = params.putArray("cmdParams");
            for (CommandParam param : invocation.params()) {
                declared.add(paramJson(param));
            }
        }
        if (!invocation.bindings().isEmpty()) {
            ObjectNode values = params.putObject("paramValues");
            invocation.bindings().asDeclared().forEach(values::put);
        }
    }

    private static ObjectNode paramJson(CommandParam param) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", param.name());
        node.put("type", param.type().name().toLowerCase(Locale.ROOT));
        if (param.defaultValue() != null) {
            node.put("default", param.defaultValue());
        }
        if (param.required()) {
            node.put("required", true);
        }
        if (!param.options().isEmpty()) {
            ArrayNode options = node.putArray("options");
            param.options().forEach(options::add);
        }
        if (param.position() != null) {
            node.put("position", param.position());
        }
        if (param.dependsOn() != null) {
            node.put("dependsOn", param.dependsOn());
        }
        if (!param.conditionalValues().isEmpty()) {
            ObjectNode conditional = node.putObject("conditionalValues");
            param.conditionalValues().forEach((key, values) -> {
                ArrayNode array = conditional.putArray(key);
                values.forEach(array::add);
            });
        }
        return node;
    }

    private static final class ParamsWriter implements StepAction.Visitor<Void> {

        private final ObjectNode params;

        ParamsWriter(ObjectNode params) {
            this.params = params;
        }

        @Override
        public Void visitConnect(StepAction.Connect action) {
            return null;
        }

        @Override
        public Void visitDisconnect(StepAction.Disconnect action) {
            return null;
        }

        @Override
        public Void visitWrite(StepAction.Write action) {
            invocationJson(params, action.invocation());
            return null;
        }

        @Override
        public Void visitQuery(StepAction.Query action) {
            invocationJson(params, action.invocation());
            putIfPresent("saveAs", action.saveAs());
            return null;
        }

        @Override
        public Void visitSetAndQuery(StepAction.SetAndQuery action) {
            invocationJson(params, action.invocation());
            putIfPresent("saveAs", action.saveAs());
            return null;
        }

        @Override
        public Void visitSleep(StepAction.Sleep action) {
            params.put("duration", action.seconds());
            return null;
        }

        @Override
        public Void visitComment(StepAction.Comment action) {
            params.put("text", action.text());
            return null;
        }

        @Override
        public Void visitPythonPassthrough(StepAction.PythonPassthrough action) {
            params.put("code", action.code());
            return null;
        }

        @Override
        public Void visitSaveWaveform(StepAction.SaveWaveform action) {
            params.put("source", action.source());
            params.put("filename", action.filename());
            params.put("format", action.format().name());
            if (action.recordLength() != null) {
                params.put("recordLength", action.recordLength());
            }
            params.put("width", action.width());
            return null;
        }

        @Override
        public Void visitSaveScreenshot(StepAction.SaveScreenshot action) {
            params.put("filename", action.filename());
            params.put("format", action.imageFormat());
            putIfPresent("localFolder", action.localFolder());
            if (action.generation() != null) {
                params.put("scopeType", action.generation().name());
            }
            return null;
        }

        @Override
        public Void visitErrorCheck(StepAction.ErrorCheck action) {
            params.put("command", action.command());
            return null;
        }

        @Override
        public Void visitRecall(StepAction.Recall action) {
            params.put("recallType", action.recallKind().name());
            putIfPresent("filePath", action.filePath());
            putIfPresent("reference", action.reference());
            return null;
        }

        @Override
        public Void visitGroup(StepAction.Group action) {
            return null;
        }

        @Override
        public Void visitDriverCall(StepAction.DriverCall action) {
            putIfPresent("code", action.code());
            putIfPresent("commandPath", action.commandPath());
            putIfPresent("args", action.args());
            return null;
        }

        private void putIfPresent(String field, String value) {
            if (value != null) {
                params.put(field, value);
            }
        }
    }
}
