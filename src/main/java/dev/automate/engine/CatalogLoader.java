package dev.automate.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.automate.model.CatalogEntry;
import dev.automate.model.CommandKind;
import dev.automate.model.CommandParam;
import dev.automate.model.ParamType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a command catalog from JSON: {@code {"commands": [{"name", "template", "kind", "params"}]}}.
 */
public final class CatalogLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CatalogLoader() {}

    public static CommandCatalog loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseCatalog(root);
    }

    public static CommandCatalog loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseCatalog(root);
    }

    private static CommandCatalog parseCatalog(JsonNode root) {
        JsonNode commands = root.get("commands");
        if (commands == null || !commands.isArray()) {
            throw new IllegalArgumentException("Catalog has no 'commands' array");
        }
        var entries = new ArrayList<CatalogEntry>();
        for (JsonNode node : commands) {
            String template = text(node, "template");
            if (template == null) {
                template = text(node, "scpi");
            }
            String name = node.has("name") ? node.get("name").asText() : template;
            if (name == null || template == null) {
                throw new IllegalArgumentException("Catalog command needs a name and a template: " + node);
            }
            CommandKind kind = node.has("kind") ? CommandKind.fromName(node.get("kind").asText()) : CommandKind.BOTH;
            entries.add(new CatalogEntry(name, template, kind, parseParams(node.get("params"))));
        }
        return new CommandCatalog(entries);
    }

    /** Parameter declarations as catalog entries and inline step commands write them. */
    static List<CommandParam> parseParams(JsonNode node) {
        var params = new ArrayList<CommandParam>();
        if (node == null || !node.isArray()) {
            return params;
        }
        for (JsonNode param : node) {
            String name = param.get("name").asText();
            ParamType type = param.has("type") ? ParamType.fromName(param.get("type").asText()) : ParamType.TEXT;

            var options = new ArrayList<String>();
            JsonNode optionsNode = param.has("options") ? param.get("options") : param.get("validValues");
            if (optionsNode != null) {
                optionsNode.forEach(o -> options.add(o.asText()));
            }
            if (type == ParamType.TEXT && !options.isEmpty() && !param.has("type")) {
                type = ParamType.ENUMERATION;
            }

            var conditional = new LinkedHashMap<String, List<String>>();
            JsonNode conditionalNode = param.get("conditionalValues");
            if (conditionalNode != null) {
                for (Map.Entry<String, JsonNode> entry : conditionalNode.properties()) {
                    var values = new ArrayList<String>();
                    entry.getValue().forEach(v -> values.add(v.asText()));
                    conditional.put(entry.getKey(), values);
                }
            }

            params.add(new CommandParam(
                name,
                type,
                text(param, "default"),
                param.has("required") && param.get("required").asBoolean(),
                options,
                param.has("position") ? param.get("position").asInt() : null,
                text(param, "dependsOn"),
                conditional));
        }
        return params;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
