package org.carball.cinebot.agent;

import org.carball.cinebot.ai.ModelClientException;
import org.carball.cinebot.ai.ModelContext;
import org.carball.cinebot.ai.ModelDecisionClient;
import org.carball.cinebot.model.conversation.ModelDecision;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Model client that replays prepared decisions and records every context it was given.
 */
class ScriptedModelClient implements ModelDecisionClient {

    private final Deque<Supplier<ModelDecision>> script = new ArrayDeque<>();
    private Supplier<ModelDecision> whenExhausted = () -> {
        throw new ModelClientException("script exhausted");
    };
    final List<ModelContext> contexts = new ArrayList<>();

    ScriptedModelClient then(ModelDecision decision) {
        script.add(() -> decision);
        return this;
    }

    ScriptedModelClient thenFail(String message) {
        script.add(() -> {
            throw new ModelClientException(message);
        });
        return this;
    }

    ScriptedModelClient always(ModelDecision decision) {
        whenExhausted = () -> decision;
        return this;
    }

    @Override
    public ModelDecision decide(ModelContext context) {
        contexts.add(context);
        Supplier<ModelDecision> next = script.isEmpty() ? whenExhausted : script.poll();
        return next.get();
    }
}
