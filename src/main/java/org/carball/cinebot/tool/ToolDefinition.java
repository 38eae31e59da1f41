package org.carball.cinebot.tool;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What a tool advertises to the model: its name, a description and its parameter schema.
 */
@Value
public class ToolDefinition {
    ToolName name;
    String description;
    List<ToolParameter> parameters;

    public ToolDefinition(ToolName name, String description, List<ToolParameter> parameters) {
        this.name = name;
        this.description = description;
        this.parameters = List.copyOf(parameters);
    }

    public List<String> getRequiredParameterNames() {
        return parameters.stream()
                .filter(ToolParameter::isRequired)
                .map(ToolParameter::getName)
                .collect(Collectors.toList());
    }
}
