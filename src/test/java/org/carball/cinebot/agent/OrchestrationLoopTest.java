package org.carball.cinebot.agent;

import org.carball.cinebot.memory.PreferenceExtractor;
import org.carball.cinebot.memory.PreferenceMemory;
import org.carball.cinebot.model.conversation.ConversationMessage;
import org.carball.cinebot.model.conversation.MessageRole;
import org.carball.cinebot.model.conversation.ModelDecision;
import org.carball.cinebot.model.conversation.ToolInvocation;
import org.carball.cinebot.model.profile.PreferenceCategory;
import org.carball.cinebot.model.profile.UserProfile;
import org.carball.cinebot.tool.ExternalLookupException;
import org.carball.cinebot.tool.ParameterType;
import org.carball.cinebot.tool.ToolDefinition;
import org.carball.cinebot.tool.ToolName;
import org.carball.cinebot.tool.ToolParameter;
import org.carball.cinebot.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class OrchestrationLoopTest {

    @TempDir
    Path tempDir;

    private ScriptedModelClient client;
    private ToolRegistry registry;
    private List<String> executed;
    private PreferenceMemory memory;

    @BeforeEach
    void setUp() {
        client = new ScriptedModelClient();
        executed = new ArrayList<>();
        registry = new ToolRegistry();
        registry.register(new ToolDefinition(ToolName.CATALOG_MOVIE_RATING, "Rating",
                        List.of(ToolParameter.required("title", ParameterType.STRING, "Title"))),
                arguments -> {
                    executed.add("rating:" + arguments.getString("title"));
                    return "rating of " + arguments.getString("title");
                });
        registry.register(new ToolDefinition(ToolName.OMDB_MOVIE_INFO, "Online info",
                        List.of(ToolParameter.required("title", ParameterType.STRING, "Title"))),
                arguments -> {
                    executed.add("omdb:" + arguments.getString("title"));
                    throw new ExternalLookupException("OMDb request failed: timeout");
                });
        memory = new PreferenceMemory(tempDir.resolve("memory.json"));
    }

    private OrchestrationLoop loop(int maxSteps, PreferenceMemory preferenceMemory) {
        return new OrchestrationLoop(client, registry,
                new ProfileUpdater(new PreferenceExtractor(preferenceMemory), preferenceMemory),
                new AnswerFormatter(), "rules", maxSteps);
    }

    private static ModelDecision tools(ToolInvocation... invocations) {
        return ModelDecision.toolRequests(List.of(invocations));
    }

    @Test
    void shouldReturnImmediateFinalAnswer() {
        // Given
        client.then(ModelDecision.finalAnswer("Up is rated 8.2."));

        // When
        TurnResult result = loop(8, memory).runTurn("How good is Up?", List.of(), UserProfile.empty());

        // Then
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.ANSWERED);
        assertThat(result.getStepsTaken()).isEqualTo(1);
        assertThat(result.getAnswer()).startsWith("Up is rated 8.2.").contains("Explanation:");
        assertThat(result.getMessages()).extracting(ConversationMessage::getRole)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(client.contexts).hasSize(1);
        assertThat(client.contexts.get(0).getTools()).hasSize(2);
        assertThat(client.contexts.get(0).getSystemRules()).isEqualTo("rules");
    }

    @Test
    void shouldRunTwoRequestedToolsInOrderBeforeNextDecision() {
        // Given
        client.then(tools(ToolInvocation.of("catalog_movie_rating", Map.of("title", "Up")),
                        ToolInvocation.of("catalog_movie_rating", Map.of("title", "Alien"))))
                .then(ModelDecision.finalAnswer("Both are great."));

        // When
        TurnResult result = loop(8, memory).runTurn("Compare Up and Alien", List.of(), UserProfile.empty());

        // Then
        assertThat(executed).containsExactly("rating:Up", "rating:Alien");
        assertThat(client.contexts).hasSize(2);

        List<ConversationMessage> seen = client.contexts.get(1).getMessages();
        assertThat(seen).extracting(ConversationMessage::getRole)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT, MessageRole.TOOL, MessageRole.TOOL);
        assertThat(seen.get(1).isToolRequest()).isTrue();
        assertThat(seen.get(2).getContent()).isEqualTo("rating of Up");
        assertThat(seen.get(3).getContent()).isEqualTo("rating of Alien");
        assertThat(seen.get(2).getToolCallId()).isEqualTo(seen.get(1).getToolInvocations().get(0).getCallId());
        assertThat(seen.get(3).getToolCallId()).isEqualTo(seen.get(1).getToolInvocations().get(1).getCallId());
        assertThat(seen.get(2).getToolCallId()).isNotEqualTo(seen.get(3).getToolCallId());

        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.ANSWERED);
        assertThat(result.getStepsTaken()).isEqualTo(2);
        assertThat(result.getMessages()).hasSize(5);
    }

    @Test
    void shouldReportToolFailuresInBandAndContinue() {
        // Given
        client.then(tools(ToolInvocation.of("omdb_movie_info", Map.of("title", "Dune")),
                        ToolInvocation.of("no_such_tool", Map.of()),
                        ToolInvocation.of("catalog_movie_rating", Map.of()),
                        ToolInvocation.of("catalog_movie_rating", Map.of("title", "Up"))))
                .then(ModelDecision.finalAnswer("Only Up worked."));

        // When
        TurnResult result = loop(8, memory).runTurn("Tell me things", List.of(), UserProfile.empty());

        // Then
        List<ConversationMessage> seen = client.contexts.get(1).getMessages();
        assertThat(seen.get(2).getContent()).isEqualTo("Error: OMDb request failed: timeout");
        assertThat(seen.get(3).getContent()).isEqualTo("Error: Unknown tool: no_such_tool");
        assertThat(seen.get(4).getContent()).startsWith("Error: Missing required argument(s)").contains("title");
        assertThat(seen.get(5).getContent()).isEqualTo("rating of Up");
        assertThat(executed).containsExactly("omdb:Dune", "rating:Up");
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.ANSWERED);
    }

    @Test
    void shouldStopAtStepBudgetWithFallbackAnswer() {
        // Given
        client.always(tools(ToolInvocation.of("catalog_movie_rating", Map.of("title", "Up"))));

        // When
        TurnResult result = loop(3, memory).runTurn("Loop forever", List.of(), UserProfile.empty());

        // Then
        assertThat(client.contexts).hasSize(3);
        assertThat(executed).hasSize(3);
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.STEP_BUDGET_EXCEEDED);
        assertThat(result.getStepsTaken()).isEqualTo(3);
        assertThat(result.getAnswer()).startsWith(OrchestrationLoop.STEP_LIMIT_ANSWER);
    }

    @Test
    void shouldShowEarlierHistoryBeforeCurrentTurn() {
        // Given
        client.then(ModelDecision.finalAnswer("Sure."));
        List<ConversationMessage> history = List.of(
                ConversationMessage.user("Hi"), ConversationMessage.assistant("Hello!"));

        // When
        loop(8, memory).runTurn("Recommend a movie", history, UserProfile.empty());

        // Then
        assertThat(client.contexts.get(0).getMessages()).extracting(ConversationMessage::getContent)
                .containsExactly("Hi", "Hello!", "Recommend a movie");
    }

    @Test
    void shouldPersistPreferencesStatedInTheTurn() {
        // Given
        client.then(ModelDecision.finalAnswer("Nice to meet you, Sam!"));
        UserProfile profile = UserProfile.empty();

        // When
        TurnResult result = loop(8, memory).runTurn("My name is Sam and I love comedy movies", List.of(), profile);

        // Then
        assertThat(result.getProfile().getName()).isEqualTo("Sam");
        assertThat(result.getProfile().getPreferences(PreferenceCategory.GENRE)).containsExactly("comedy");
        UserProfile stored = memory.load();
        assertThat(stored.getName()).isEqualTo("Sam");
        assertThat(stored.getPreferences(PreferenceCategory.GENRE)).containsExactly("comedy");
    }

    @Test
    void shouldKeepProfileInMemoryWhenSaveFails() throws IOException {
        // Given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        PreferenceMemory broken = new PreferenceMemory(blocker.resolve("memory.json"));
        client.then(ModelDecision.finalAnswer("Hi Sam!"));

        // When
        TurnResult result = loop(8, broken).runTurn("My name is Sam", List.of(), UserProfile.empty());

        // Then
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.ANSWERED);
        assertThat(result.getAnswer()).startsWith("Hi Sam!");
        assertThat(result.getProfile().getName()).isEqualTo("Sam");
    }

    @Test
    void shouldEndInErrorWhenModelFails() {
        // Given
        client.then(tools(ToolInvocation.of("catalog_movie_rating", Map.of("title", "Up"))))
                .thenFail("connection reset");

        // When
        TurnResult result = loop(8, memory).runTurn("My name is Sam", List.of(), UserProfile.empty());

        // Then
        assertThat(result.getOutcome()).isEqualTo(TurnOutcome.FAILED);
        assertThat(result.getAnswer()).startsWith(OrchestrationLoop.ERROR_ANSWER);
        assertThat(result.getStepsTaken()).isEqualTo(2);
        assertThat(result.getProfile().hasName()).isFalse();
        assertThat(Files.exists(tempDir.resolve("memory.json"))).isFalse();
    }

    @Test
    void shouldFormatEmptyModelAnswer() {
        // Given
        client.then(ModelDecision.finalAnswer("   "));

        // When
        TurnResult result = loop(8, memory).runTurn("?", List.of(), UserProfile.empty());

        // Then
        assertThat(result.getAnswer()).startsWith(AnswerFormatter.EMPTY_ANSWER);
    }
}
