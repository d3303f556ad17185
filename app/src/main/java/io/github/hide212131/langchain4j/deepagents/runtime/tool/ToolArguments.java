package io.github.hide212131.langchain4j.deepagents.runtime.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import java.util.Objects;

/**
 * JSON arguments of a single tool call with typed, validating accessors.
 * <p>
 * Every accessor reports problems as {@link ToolErrorKind#INVALID_ARGUMENT} so the tool can hand them back to
 * the model as text.
 */
public final class ToolArguments {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final ToolArguments EMPTY = new ToolArguments(OBJECT_MAPPER.createObjectNode());

    private final ObjectNode root;

    private ToolArguments(ObjectNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public static ToolArguments empty() {
        return EMPTY;
    }

    public static ToolArguments parse(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new WorkspaceToolException(
                    ToolErrorKind.INVALID_ARGUMENT, "Arguments are not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (node == null || node.isNull()) {
            return EMPTY;
        }
        if (!(node instanceof ObjectNode objectNode)) {
            throw WorkspaceToolException.invalidArgument("Arguments must be a JSON object");
        }
        return new ToolArguments(objectNode);
    }

    public static ToolArguments of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        return new ToolArguments(OBJECT_MAPPER.valueToTree(values));
    }

    public String requiredString(String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            throw WorkspaceToolException.invalidArgument("Missing required argument '" + name + "'");
        }
        if (!node.isTextual()) {
            throw WorkspaceToolException.invalidArgument("Argument '" + name + "' must be a string");
        }
        return node.textValue();
    }

    public int optionalInt(String name, int defaultValue) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException ex) {
                throw WorkspaceToolException.invalidArgument("Argument '" + name + "' must be an integer");
            }
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw WorkspaceToolException.invalidArgument("Argument '" + name + "' must be an integer");
        }
        return node.intValue();
    }

    public boolean optionalBoolean(String name, boolean defaultValue) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            String text = node.textValue().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        throw WorkspaceToolException.invalidArgument("Argument '" + name + "' must be a boolean");
    }

    /**
     * Binds a required argument to a Java type through Jackson.
     */
    public <T> T required(String name, TypeReference<T> type) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            throw WorkspaceToolException.invalidArgument("Missing required argument '" + name + "'");
        }
        try {
            return OBJECT_MAPPER.convertValue(node, type);
        } catch (IllegalArgumentException ex) {
            throw new WorkspaceToolException(
                    ToolErrorKind.INVALID_ARGUMENT, "Argument '" + name + "' is malformed: " + rootCauseMessage(ex), ex);
        }
    }

    public boolean has(String name) {
        JsonNode node = root.get(name);
        return node != null && !node.isNull();
    }

    public String toJson() {
        return root.toString();
    }

    @Override
    public String toString() {
        return toJson();
    }

    private static String rootCauseMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
