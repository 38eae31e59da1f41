package org.carball.cinebot.ai;

import org.carball.cinebot.model.conversation.ModelDecision;

/**
 * Blocking call to the language model for the next step of a turn.
 */
public interface ModelDecisionClient {

    /**
     * @throws ModelClientException when no decision could be obtained
     */
    ModelDecision decide(ModelContext context);
}
