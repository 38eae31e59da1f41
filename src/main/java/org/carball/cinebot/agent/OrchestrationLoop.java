package org.carball.cinebot.agent;

import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.ai.ModelContext;
import org.carball.cinebot.ai.ModelDecisionClient;
import org.carball.cinebot.model.conversation.ConversationMessage;
import org.carball.cinebot.model.conversation.FinalAnswer;
import org.carball.cinebot.model.conversation.ModelDecision;
import org.carball.cinebot.model.conversation.ToolInvocation;
import org.carball.cinebot.model.conversation.ToolRequests;
import org.carball.cinebot.model.profile.UserProfile;
import org.carball.cinebot.tool.ToolException;
import org.carball.cinebot.tool.ToolRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one user turn: ask the model, run the tools it requests in order, feed the results back,
 * and repeat until it answers or the step budget runs out.
 */
@Slf4j
public class OrchestrationLoop {

    static final String STEP_LIMIT_ANSWER = "This request turned out to be too involved for one exchange: "
            + "I reached the limit of reasoning steps before finishing. Could you narrow it down?";
    static final String ERROR_ANSWER = "Sorry, I couldn't reach the language model to answer that. Please try again.";

    private final ModelDecisionClient client;
    private final ToolRegistry registry;
    private final ProfileUpdater profileUpdater;
    private final AnswerFormatter formatter;
    private final String systemRules;
    private final int maxSteps;

    OrchestrationLoop(ModelDecisionClient client, ToolRegistry registry, ProfileUpdater profileUpdater,
                      AnswerFormatter formatter, String systemRules, int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }
        this.client = client;
        this.registry = registry;
        this.profileUpdater = profileUpdater;
        this.formatter = formatter;
        this.systemRules = systemRules;
        this.maxSteps = maxSteps;
    }

    /**
     * Runs a turn to completion. The profile is updated in place and also returned in the result.
     *
     * @param history earlier dialogue messages the model may see, oldest first
     */
    public TurnResult runTurn(String userText, List<ConversationMessage> history, UserProfile profile) {
        List<ConversationMessage> turn = new ArrayList<>();
        turn.add(ConversationMessage.user(userText));

        LoopState state = LoopState.AWAITING_MODEL_DECISION;
        List<ToolInvocation> pending = null;
        String answer = null;
        TurnOutcome outcome = null;
        int steps = 0;

        while (state != LoopState.DONE) {
            switch (state) {
                case AWAITING_MODEL_DECISION:
                    if (steps >= maxSteps) {
                        log.warn("Step budget of {} exhausted without a final answer", maxSteps);
                        answer = STEP_LIMIT_ANSWER;
                        outcome = TurnOutcome.STEP_BUDGET_EXCEEDED;
                        state = transition(state, LoopState.FINALIZING);
                        break;
                    }
                    steps++;
                    ModelDecision decision;
                    try {
                        decision = client.decide(buildContext(history, turn, profile));
                    } catch (RuntimeException e) {
                        log.error("Model decision failed at step {}: {}", steps, e.getMessage());
                        log.debug("Model failure details", e);
                        state = transition(state, LoopState.ERROR);
                        break;
                    }
                    if (decision.isFinal()) {
                        answer = ((FinalAnswer) decision).getText();
                        outcome = TurnOutcome.ANSWERED;
                        state = transition(state, LoopState.FINALIZING);
                    } else {
                        pending = withCallIds(((ToolRequests) decision).getInvocations(), steps);
                        state = transition(state, LoopState.EXECUTING_TOOLS);
                    }
                    break;

                case EXECUTING_TOOLS:
                    executeTools(pending, turn);
                    pending = null;
                    state = transition(state, LoopState.AWAITING_MODEL_DECISION);
                    break;

                case FINALIZING:
                    profile = profileUpdater.update(userText, profile);
                    answer = formatter.format(answer);
                    turn.add(ConversationMessage.assistant(answer));
                    state = transition(state, LoopState.DONE);
                    break;

                case ERROR:
                    answer = formatter.format(ERROR_ANSWER);
                    outcome = TurnOutcome.FAILED;
                    turn.add(ConversationMessage.assistant(answer));
                    state = transition(state, LoopState.DONE);
                    break;

                default:
                    throw new IllegalStateException("Unexpected loop state: " + state);
            }
        }

        log.info("Turn finished: {} after {} step(s)", outcome, steps);
        return new TurnResult(answer, outcome, steps, List.copyOf(turn), profile);
    }

    private ModelContext buildContext(List<ConversationMessage> history, List<ConversationMessage> turn,
                                      UserProfile profile) {
        return ModelContext.builder()
                .systemRules(systemRules)
                .profileSnapshot(profile.toSnapshot())
                .messages(history)
                .messages(turn)
                .tools(registry.definitions())
                .build();
    }

    private void executeTools(List<ToolInvocation> invocations, List<ConversationMessage> turn) {
        turn.add(ConversationMessage.toolRequest(invocations));
        for (ToolInvocation invocation : invocations) {
            String result;
            try {
                result = registry.dispatch(invocation.getToolName(), invocation.getArguments());
            } catch (ToolException e) {
                log.warn("Tool {} failed: {}", invocation.getToolName(), e.getMessage());
                result = "Error: " + e.getMessage();
            } catch (RuntimeException e) {
                log.error("Tool {} crashed: {}", invocation.getToolName(), e.getMessage(), e);
                result = "Error: tool " + invocation.getToolName() + " failed unexpectedly: " + e.getMessage();
            }
            turn.add(ConversationMessage.toolResult(invocation, result));
        }
    }

    private static List<ToolInvocation> withCallIds(List<ToolInvocation> invocations, int step) {
        List<ToolInvocation> identified = new ArrayList<>(invocations.size());
        for (int i = 0; i < invocations.size(); i++) {
            ToolInvocation invocation = invocations.get(i);
            if (invocation.getCallId() == null) {
                invocation = new ToolInvocation("call_" + step + "_" + i,
                        invocation.getToolName(), invocation.getArguments());
            }
            identified.add(invocation);
        }
        return identified;
    }

    private static LoopState transition(LoopState from, LoopState to) {
        log.debug("Loop state {} -> {}", from, to);
        return to;
    }
}
