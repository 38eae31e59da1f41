package org.carball.cinebot.tool;

import lombok.Value;

@Value
public class ToolParameter {
    String name;
    ParameterType type;
    String description;
    boolean required;

    public static ToolParameter required(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, description, true);
    }

    public static ToolParameter optional(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, description, false);
    }
}
