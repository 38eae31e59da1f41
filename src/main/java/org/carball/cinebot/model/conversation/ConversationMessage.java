package org.carball.cinebot.model.conversation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Role-tagged message of the session history. Assistant messages either carry answer text or the
 * tool calls the model requested; tool messages carry the result text of one invocation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConversationMessage {
    MessageRole role;
    String content;
    List<ToolInvocation> toolInvocations;
    String toolCallId;
    String toolName;

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageRole.USER, content, Collections.emptyList(), null, null);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, Collections.emptyList(), null, null);
    }

    public static ConversationMessage toolRequest(List<ToolInvocation> invocations) {
        return new ConversationMessage(MessageRole.ASSISTANT, null, List.copyOf(invocations), null, null);
    }

    public static ConversationMessage toolResult(ToolInvocation invocation, String result) {
        return new ConversationMessage(MessageRole.TOOL, result, Collections.emptyList(),
                invocation.getCallId(), invocation.getToolName());
    }

    public boolean isToolRequest() {
        return role == MessageRole.ASSISTANT && !toolInvocations.isEmpty();
    }

    /**
     * User messages and plain assistant answers, the part of a turn that outlives it.
     */
    public boolean isDialogue() {
        return role == MessageRole.USER || (role == MessageRole.ASSISTANT && !isToolRequest());
    }
}
