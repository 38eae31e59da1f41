package org.carball.cinebot.model.conversation;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single tool call requested by the model within one step.
 */
@Value
public class ToolInvocation {
    String callId;
    String toolName;
    Map<String, Object> arguments;

    public ToolInvocation(String callId, String toolName, Map<String, Object> arguments) {
        this.callId = callId;
        this.toolName = toolName;
        this.arguments = arguments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolInvocation of(String toolName, Map<String, Object> arguments) {
        return new ToolInvocation(null, toolName, arguments);
    }
}
