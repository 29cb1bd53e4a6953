package dev.automate.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.automate.model.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.automate.engine.CatalogLoader.text;

/**
 * Loads programs (devices plus step tree) and compiler options from JSON.
 */
public final class ProgramLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double DEFAULT_SLEEP_SECONDS = 1.0;
    static final String DEFAULT_WAVEFORM_SOURCE = "CH1";
    static final String DEFAULT_WAVEFORM_NAME = "waveform";
    static final String DEFAULT_SCREENSHOT_NAME = "screenshot";
    static final String DEFAULT_IMAGE_FORMAT = "PNG";
    static final int DEFAULT_WAVEFORM_WIDTH = 1;

    private ProgramLoader() {}

    /**
     * Load a program from a JSON file.
     */
    public static Program loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseProgram(root);
    }

    /**
     * Load a program from a JSON string.
     */
    public static Program loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseProgram(root);
    }

    public static CompilerOptions loadOptionsFromFile(Path path) throws IOException {
        return parseOptions(MAPPER.readTree(path.toFile()));
    }

    public static CompilerOptions loadOptionsFromString(String json) throws IOException {
        return parseOptions(MAPPER.readTree(json));
    }

    private static Program parseProgram(JsonNode root) {
        if (root.isArray()) {
            return new Program(Backend.DIRECT_RAW, List.of(), parseSteps(root));
        }
        Backend backend = root.has("backend") ? Backend.fromName(root.get("backend").asText()) : Backend.DIRECT_RAW;

        var devices = new ArrayList<Device>();
        JsonNode devicesNode = root.get("devices");
        if (devicesNode != null) {
            for (JsonNode node : devicesNode) {
                devices.add(parseDevice(node, backend));
            }
        }
        return new Program(backend, devices, parseSteps(root.get("steps")));
    }

    private static Device parseDevice(JsonNode node, Backend programBackend) {
        String id = text(node, "id");
        String alias = node.has("alias") ? node.get("alias").asText() : id;
        if (id == null) {
            id = alias;
        }
        if (id == null) {
            throw new IllegalArgumentException("Device needs an id or an alias: " + node);
        }
        Backend backend = node.has("backend") ? Backend.fromName(node.get("backend").asText()) : programBackend;

        ConnectionType type = node.has("connectionType")
            ? ConnectionType.fromName(node.get("connectionType").asText()) : ConnectionType.TCPIP;
        int port = node.has("port") ? node.get("port").asInt() : ConnectionDescriptor.DEFAULT_SOCKET_PORT;
        int timeout = node.has("timeout") ? node.get("timeout").asInt() : ConnectionDescriptor.DEFAULT_TIMEOUT_MS;
        String host = node.has("host") ? node.get("host").asText() : "localhost";
        var connection = new ConnectionDescriptor(type, host, port, timeout, text(node, "resource"));

        return new Device(
            id,
            alias,
            backend,
            connection,
            text(node, "deviceType"),
            text(node, "deviceDriver"),
            node.has("generation") ? DeviceGeneration.fromName(node.get("generation").asText()) : null,
            node.has("hybridCommandBackend") ? Backend.fromName(node.get("hybridCommandBackend").asText()) : null);
    }

    private static List<Step> parseSteps(JsonNode stepsNode) {
        var steps = new ArrayList<Step>();
        if (stepsNode == null) {
            return steps;
        }
        for (JsonNode node : stepsNode) {
            steps.add(parseStep(node));
        }
        return steps;
    }

    private static Step parseStep(JsonNode node) {
        String id = text(node, "id");
        if (id == null) {
            throw new IllegalArgumentException("Step without id: " + node);
        }
        StepKind kind = StepKind.fromJsonName(node.get("type").asText());
        String label = text(node, "label");
        String deviceId = text(node, "boundDeviceId");
        JsonNode params = node.has("params") ? node.get("params") : MAPPER.createObjectNode();
        String routeName = node.has("route") ? text(node, "route") : text(params, "route");
        Route route = routeName == null ? null : Route.fromName(routeName);

        return new Step(id, label, deviceId, route, parseAction(kind, params, node.get("children")));
    }

    private static StepAction parseAction(StepKind kind, JsonNode params, JsonNode children) {
        return switch (kind) {
            case CONNECT -> new StepAction.Connect();
            case DISCONNECT -> new StepAction.Disconnect();
            case WRITE -> new StepAction.Write(parseInvocation(params));
            case QUERY -> new StepAction.Query(parseInvocation(params), text(params, "saveAs"));
            case SET_AND_QUERY -> new StepAction.SetAndQuery(parseInvocation(params), text(params, "saveAs"));
            case SLEEP -> new StepAction.Sleep(
                params.has("duration") ? params.get("duration").asDouble() : DEFAULT_SLEEP_SECONDS);
            case COMMENT -> new StepAction.Comment(textOr(params, "text", ""));
            case PYTHON_PASSTHROUGH -> new StepAction.PythonPassthrough(textOr(params, "code", ""));
            case SAVE_WAVEFORM -> new StepAction.SaveWaveform(
                textOr(params, "source", DEFAULT_WAVEFORM_SOURCE),
                textOr(params, "filename", DEFAULT_WAVEFORM_NAME),
                params.has("format") ? WaveformFormat.fromName(params.get("format").asText()) : WaveformFormat.TEXT,
                params.has("recordLength") ? params.get("recordLength").asInt() : null,
                params.has("width") ? params.get("width").asInt() : DEFAULT_WAVEFORM_WIDTH);
            case SAVE_SCREENSHOT -> new StepAction.SaveScreenshot(
                textOr(params, "filename", DEFAULT_SCREENSHOT_NAME),
                textOr(params, "format", DEFAULT_IMAGE_FORMAT),
                text(params, "localFolder"),
                params.has("scopeType") ? DeviceGeneration.fromName(params.get("scopeType").asText()) : null);
            case ERROR_CHECK -> new StepAction.ErrorCheck(textOr(params, "command", StepAction.ErrorCheck.DEFAULT_COMMAND));
            case RECALL -> new StepAction.Recall(
                params.has("recallType") ? RecallKind.fromName(params.get("recallType").asText()) : RecallKind.FACTORY,
                text(params, "filePath"),
                text(params, "reference"));
            case GROUP -> new StepAction.Group(parseSteps(children));
            case DRIVER_CALL -> new StepAction.DriverCall(
                text(params, "code"), text(params, "commandPath"), text(params, "args"));
        };
    }

    private static CommandInvocation parseInvocation(JsonNode params) {
        Map<String, String> values = new LinkedHashMap<>();
        JsonNode valuesNode = params.get("paramValues");
        if (valuesNode != null) {
            for (var entry : valuesNode.properties()) {
                if (!entry.getValue().isNull()) {
                    values.put(entry.getKey(), entry.getValue().asText());
                }
            }
        }
        return new CommandInvocation(
            textOr(params, "command", ""),
            text(params, "catalogKey"),
            CatalogLoader.parseParams(params.get("cmdParams")),
            ParameterBinding.of(values));
    }

    private static CompilerOptions parseOptions(JsonNode node) {
        return new CompilerOptions(
            node.has("indent") ? node.get("indent").asText() : CompilerOptions.DEFAULT_INDENT,
            node.has("streamingPort") ? node.get("streamingPort").asInt() : CompilerOptions.DEFAULT_STREAMING_PORT,
            node.has("instrumentTempFolder")
                ? node.get("instrumentTempFolder").asText() : CompilerOptions.DEFAULT_INSTRUMENT_TEMP_FOLDER,
            node.has("screenshotFolder")
                ? node.get("screenshotFolder").asText() : CompilerOptions.DEFAULT_SCREENSHOT_FOLDER,
            node.has("transferTimeoutMs")
                ? node.get("transferTimeoutMs").asInt() : CompilerOptions.DEFAULT_TRANSFER_TIMEOUT_MS,
            node.has("includeHeader") ? node.get("includeHeader").asBoolean() : CompilerOptions.DEFAULT_INCLUDE_HEADER);
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value == null ? fallback : value;
    }
}
