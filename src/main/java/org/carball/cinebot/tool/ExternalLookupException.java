package org.carball.cinebot.tool;

/**
 * The online movie service could not answer: no key, network or HTTP failure, not found, or a
 * response that could not be read.
 */
public class ExternalLookupException extends ToolException {

    public ExternalLookupException(String message) {
        super(message);
    }

    public ExternalLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
