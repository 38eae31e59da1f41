package org.carball.cinebot.model.conversation;

import lombok.Value;

import java.util.List;

@Value
public class ToolRequests implements ModelDecision {
    List<ToolInvocation> invocations;

    public ToolRequests(List<ToolInvocation> invocations) {
        if (invocations == null || invocations.isEmpty()) {
            throw new IllegalArgumentException("A tool request needs at least one invocation");
        }
        this.invocations = List.copyOf(invocations);
    }

    @Override
    public boolean isFinal() {
        return false;
    }
}
