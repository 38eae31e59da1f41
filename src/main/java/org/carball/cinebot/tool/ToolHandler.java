package org.carball.cinebot.tool;

/**
 * Fixed-signature operation bound to a {@link ToolName}. Returns plain descriptive text.
 */
@FunctionalInterface
public interface ToolHandler {

    String execute(ToolArguments arguments);
}
