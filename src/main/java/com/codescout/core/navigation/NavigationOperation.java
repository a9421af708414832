package com.codescout.core.navigation;

import com.codescout.core.llm.ToolSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The closed set of navigation operations offered to the reasoning engine.
 * Wire names and argument names are part of the tool-call contract.
 */
public enum NavigationOperation {

    READ_FILE("read_file",
            "Read and return the content of a file in the project",
            List.of(Parameter.required("filepath", "Path to the file relative to the project root"))),

    SEARCH_SYMBOL("search_symbol",
            "Find where a class, function, method or property is defined",
            List.of(Parameter.required("symbol_name", "Name of the symbol to locate"))),

    FIND_USAGES("find_usages",
            "Find all places where a symbol is used in the codebase",
            List.of(Parameter.required("symbol_name", "Name of the symbol to find usages of"))),

    GET_IMPORTS("get_imports",
            "Get the resolved imports of a specific file",
            List.of(Parameter.required("filepath", "Path to the file relative to the project root"))),

    GET_FILE_TREE("get_file_tree",
            "Get the project directory structure as a tree",
            List.of()),

    SEARCH_TEXT("search_text",
            "Search for a regular expression across the codebase",
            List.of(Parameter.required("pattern", "Regular expression to search for"),
                    Parameter.optional("file_pattern", "Glob such as *.py, or a directory or file prefix")));

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String toolName;
    private final String description;
    private final List<Parameter> parameters;

    NavigationOperation(String toolName, String description, List<Parameter> parameters) {
        this.toolName = toolName;
        this.description = description;
        this.parameters = parameters;
    }

    public record Parameter(String name, String description, boolean required) {
        static Parameter required(String name, String description) {
            return new Parameter(name, description, true);
        }

        static Parameter optional(String name, String description) {
            return new Parameter(name, description, false);
        }
    }

    public String toolName() {
        return toolName;
    }

    public String description() {
        return description;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public static Optional<NavigationOperation> fromToolName(String name) {
        return Arrays.stream(values()).filter(op -> op.toolName.equals(name)).findFirst();
    }

    /**
     * JSON schema of the arguments object.
     */
    public String inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        var required = schema.putArray("required");
        for (Parameter parameter : parameters) {
            ObjectNode property = properties.putObject(parameter.name());
            property.put("type", "string");
            property.put("description", parameter.description());
            if (parameter.required()) {
                required.add(parameter.name());
            }
        }
        return schema.toString();
    }

    public ToolSpec toToolSpec() {
        return new ToolSpec(toolName, description, inputSchema());
    }

    /**
     * Checks the decoded arguments against this operation's parameters.
     *
     * @return arguments as strings, sorted by name, with unknown keys dropped
     * @throws InvalidToolCallException if a required argument is missing or not a string
     */
    public Map<String, String> validate(Map<String, Object> arguments) {
        Map<String, Object> given = arguments != null ? arguments : Map.of();
        Map<String, String> normalized = new TreeMap<>();
        for (Parameter parameter : parameters) {
            Object value = given.get(parameter.name());
            if (value == null) {
                if (parameter.required()) {
                    throw new InvalidToolCallException(
                            toolName + " requires argument '" + parameter.name() + "'");
                }
                continue;
            }
            if (!(value instanceof String text)) {
                throw new InvalidToolCallException(
                        toolName + " argument '" + parameter.name() + "' must be a string");
            }
            if (parameter.required() && text.isBlank()) {
                throw new InvalidToolCallException(
                        toolName + " argument '" + parameter.name() + "' must not be blank");
            }
            normalized.put(parameter.name(), parameter.name().equals("filepath") ? text.strip() : text);
        }
        return normalized;
    }
}
