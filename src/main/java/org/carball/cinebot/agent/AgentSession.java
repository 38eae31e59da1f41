package org.carball.cinebot.agent;

import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.ai.ModelDecisionClient;
import org.carball.cinebot.ai.SystemPrompt;
import org.carball.cinebot.config.AgentSettings;
import org.carball.cinebot.memory.MemoryAnswerer;
import org.carball.cinebot.memory.PreferenceExtractor;
import org.carball.cinebot.memory.PreferenceMemory;
import org.carball.cinebot.model.conversation.ConversationMessage;
import org.carball.cinebot.model.profile.UserProfile;
import org.carball.cinebot.tool.ToolRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single conversation of the process. Owns the user profile and the dialogue history, and
 * handles one turn at a time.
 */
@Slf4j
public class AgentSession {

    private final OrchestrationLoop loop;
    private final MemoryAnswerer memoryAnswerer;
    private final ProfileUpdater profileUpdater;
    private final AnswerFormatter formatter;
    private final int historyWindow;
    private final List<ConversationMessage> history = new ArrayList<>();
    private UserProfile profile;

    AgentSession(OrchestrationLoop loop, MemoryAnswerer memoryAnswerer, ProfileUpdater profileUpdater,
                 AnswerFormatter formatter, UserProfile profile, int historyWindow) {
        if (historyWindow < 0) {
            throw new IllegalArgumentException("historyWindow must not be negative, got " + historyWindow);
        }
        this.loop = loop;
        this.memoryAnswerer = memoryAnswerer;
        this.profileUpdater = profileUpdater;
        this.formatter = formatter;
        this.profile = profile;
        this.historyWindow = historyWindow;
    }

    /**
     * Wires a session from settings, loading the stored profile.
     */
    public static AgentSession create(AgentSettings settings, ModelDecisionClient client,
                                      ToolRegistry registry, PreferenceMemory memory) {
        ProfileUpdater profileUpdater = new ProfileUpdater(new PreferenceExtractor(memory), memory);
        AnswerFormatter formatter = new AnswerFormatter();
        OrchestrationLoop loop = new OrchestrationLoop(client, registry, profileUpdater, formatter,
                SystemPrompt.RULES, settings.getMaxSteps());
        return new AgentSession(loop, new MemoryAnswerer(), profileUpdater, formatter,
                memory.load(), settings.getHistoryWindow());
    }

    public TurnResult handle(String userText) {
        if (memoryAnswerer.canAnswer(userText)) {
            // the question may come with a new fact, as in "my name is Ann, what is my name?"
            profileUpdater.update(userText, profile);
            String direct = memoryAnswerer.answer(userText, profile);
            log.debug("Answered from memory without a model call");
            String answer = formatter.format(direct);
            List<ConversationMessage> messages = List.of(
                    ConversationMessage.user(userText), ConversationMessage.assistant(answer));
            history.addAll(messages);
            return new TurnResult(answer, TurnOutcome.ANSWERED_FROM_MEMORY, 0, messages, profile);
        }

        TurnResult result = loop.runTurn(userText, visibleHistory(), profile);
        profile = result.getProfile();
        result.getMessages().stream()
                .filter(ConversationMessage::isDialogue)
                .forEach(history::add);
        return result;
    }

    public UserProfile getProfile() {
        return profile;
    }

    public List<ConversationMessage> getHistory() {
        return Collections.unmodifiableList(history);
    }

    List<ConversationMessage> visibleHistory() {
        int from = Math.max(0, history.size() - historyWindow);
        return new ArrayList<>(history.subList(from, history.size()));
    }
}
