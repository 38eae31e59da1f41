package org.carball.cinebot.tool;

public class InvalidArgumentsException extends ToolException {

    public InvalidArgumentsException(String message) {
        super(message);
    }
}
