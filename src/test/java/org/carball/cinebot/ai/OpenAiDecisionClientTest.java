package org.carball.cinebot.ai;

import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionTool;
import org.carball.cinebot.config.AgentSettings;
import org.carball.cinebot.model.conversation.ConversationMessage;
import org.carball.cinebot.model.conversation.ToolInvocation;
import org.carball.cinebot.tool.ParameterType;
import org.carball.cinebot.tool.ToolDefinition;
import org.carball.cinebot.tool.ToolName;
import org.carball.cinebot.tool.ToolParameter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OpenAiDecisionClientTest {

    private final OpenAiDecisionClient client = new OpenAiDecisionClient(null, "gpt-4o-mini", 0.2);

    @Test
    void shouldParseToolArguments() {
        // When
        Map<String, Object> arguments = client.parseArguments("{\"actor\":\"Jackie Chan\",\"limit\":3}");

        // Then
        assertThat(arguments).containsEntry("actor", "Jackie Chan").containsEntry("limit", 3);
    }

    @Test
    void shouldTurnUnreadableArgumentsIntoEmptyMap() {
        assertThat(client.parseArguments("{broken")).isEmpty();
        assertThat(client.parseArguments("")).isEmpty();
        assertThat(client.parseArguments(null)).isEmpty();
    }

    @Test
    void shouldTranslateContextIntoChatRequest() {
        // Given
        ToolInvocation invocation = new ToolInvocation("call_1", "catalog_movie_rating", Map.of("title", "Up"));
        ModelContext context = ModelContext.builder()
                .systemRules("rules")
                .profileSnapshot("[User profile]\nName: Sam")
                .message(ConversationMessage.user("Rating of Up?"))
                .message(ConversationMessage.toolRequest(List.of(invocation)))
                .message(ConversationMessage.toolResult(invocation, "IMDb rating of 'Up' (2009) is 8.2"))
                .tool(new ToolDefinition(ToolName.CATALOG_MOVIE_RATING, "Rating",
                        List.of(ToolParameter.required("title", ParameterType.STRING, "Title"))))
                .build();

        // When
        ChatCompletionCreateParams params = client.buildParams(context);

        // Then
        List<ChatCompletionMessageParam> messages = params.messages();
        assertThat(messages).hasSize(4);
        assertThat(messages.get(0).isSystem()).isTrue();
        assertThat(messages.get(1).isUser()).isTrue();
        assertThat(messages.get(2).isAssistant()).isTrue();
        assertThat(messages.get(2).asAssistant().toolCalls()).hasValueSatisfying(calls -> {
            assertThat(calls).hasSize(1);
            assertThat(calls.get(0).id()).isEqualTo("call_1");
            assertThat(calls.get(0).function().name()).isEqualTo("catalog_movie_rating");
            assertThat(calls.get(0).function().arguments()).isEqualTo("{\"title\":\"Up\"}");
        });
        assertThat(messages.get(3).isTool()).isTrue();
        assertThat(messages.get(3).asTool().toolCallId()).isEqualTo("call_1");

        List<ChatCompletionTool> tools = params.tools().orElseThrow();
        assertThat(tools).hasSize(1);
        assertThat(tools.get(0).function().name()).isEqualTo("catalog_movie_rating");
    }

    @Test
    void shouldPutProfileSnapshotIntoSystemContent() {
        // Given
        ModelContext context = ModelContext.builder()
                .systemRules("rules")
                .profileSnapshot("[User profile]\nName: Sam")
                .build();

        // Then
        assertThat(context.getSystemContent()).isEqualTo("rules\n\n[User profile]\nName: Sam");
    }

    @Test
    void shouldRequireApiKey() {
        assertThatThrownBy(() -> OpenAiDecisionClient.fromSettings(AgentSettings.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("OpenAI API key is required");
    }
}
