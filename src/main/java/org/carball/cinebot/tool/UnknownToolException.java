package org.carball.cinebot.tool;

public class UnknownToolException extends ToolException {

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
    }
}
