package org.carball.cinebot.agent;

import lombok.Value;
import org.carball.cinebot.model.conversation.ConversationMessage;
import org.carball.cinebot.model.profile.UserProfile;

import java.util.List;

/**
 * What a turn produced: the formatted answer, how the turn ended, the messages it added and the
 * profile as it stands after finalizing.
 */
@Value
public class TurnResult {
    String answer;
    TurnOutcome outcome;
    int stepsTaken;
    List<ConversationMessage> messages;
    UserProfile profile;
}
