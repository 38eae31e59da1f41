package org.carball.cinebot.tool;

/**
 * Base class for failures raised while dispatching or executing a tool.
 */
public class ToolException extends RuntimeException {

    public ToolException(String message) {
        super(message);
    }

    public ToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
