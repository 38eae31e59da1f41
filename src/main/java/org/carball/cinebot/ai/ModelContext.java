package org.carball.cinebot.ai;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.cinebot.model.conversation.ConversationMessage;
import org.carball.cinebot.tool.ToolDefinition;

import java.util.List;

/**
 * Everything the model sees for one decision: rules, the user profile snapshot, the visible
 * history and the tools it may call.
 */
@Value
@Builder
public class ModelContext {
    String systemRules;
    String profileSnapshot;
    @Singular
    List<ConversationMessage> messages;
    @Singular
    List<ToolDefinition> tools;

    public String getSystemContent() {
        if (profileSnapshot == null || profileSnapshot.isBlank()) {
            return systemRules;
        }
        return systemRules + "\n\n" + profileSnapshot;
    }
}
