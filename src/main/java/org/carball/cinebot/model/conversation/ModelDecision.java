package org.carball.cinebot.model.conversation;

import java.util.List;

/**
 * What the model decided in one step: a final answer or an ordered list of tool calls.
 */
public interface ModelDecision {

    boolean isFinal();

    static ModelDecision finalAnswer(String text) {
        return new FinalAnswer(text);
    }

    static ModelDecision toolRequests(List<ToolInvocation> invocations) {
        return new ToolRequests(invocations);
    }
}
