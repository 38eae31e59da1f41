package org.carball.cinebot.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.JsonValue;
import com.openai.models.FunctionDefinition;
import com.openai.models.FunctionParameters;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionAssistantMessageParam;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessage;
import com.openai.models.chat.completions.ChatCompletionMessageToolCall;
import com.openai.models.chat.completions.ChatCompletionTool;
import com.openai.models.chat.completions.ChatCompletionToolMessageParam;
import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.config.AgentSettings;
import org.carball.cinebot.model.conversation.ConversationMessage;
import org.carball.cinebot.model.conversation.ModelDecision;
import org.carball.cinebot.model.conversation.ToolInvocation;
import org.carball.cinebot.tool.ToolDefinition;
import org.carball.cinebot.tool.ToolParameter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model decisions through the OpenAI chat completions API with function calling.
 */
@Slf4j
public class OpenAiDecisionClient implements ModelDecisionClient {

    private final OpenAIClient openAiClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String model;
    private final double temperature;

    public OpenAiDecisionClient(OpenAIClient openAiClient, String model, double temperature) {
        this.openAiClient = openAiClient;
        this.model = model;
        this.temperature = temperature;
    }

    public static OpenAiDecisionClient fromSettings(AgentSettings settings) {
        if (settings.getOpenAiApiKey() == null || settings.getOpenAiApiKey().isBlank()) {
            throw new IllegalArgumentException(
                    "OpenAI API key is required. Use --api-key or set OPENAI_API_KEY environment variable");
        }
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(settings.getOpenAiApiKey())
                .build();
        return new OpenAiDecisionClient(client, settings.getModel(), settings.getTemperature());
    }

    @Override
    public ModelDecision decide(ModelContext context) {
        ChatCompletionCreateParams params = buildParams(context);
        log.debug("Requesting decision from {} with {} messages", model, context.getMessages().size());
        log.trace("System content:\n{}", context.getSystemContent());

        ChatCompletion completion;
        try {
            completion = openAiClient.chat().completions().create(params);
        } catch (RuntimeException e) {
            throw new ModelClientException("OpenAI request failed: " + e.getMessage(), e);
        }
        if (completion.choices().isEmpty()) {
            throw new ModelClientException("OpenAI returned no choices");
        }

        ChatCompletionMessage message = completion.choices().get(0).message();
        List<ChatCompletionMessageToolCall> toolCalls = message.toolCalls().orElse(Collections.emptyList());
        if (!toolCalls.isEmpty()) {
            List<ToolInvocation> invocations = new ArrayList<>();
            for (ChatCompletionMessageToolCall call : toolCalls) {
                log.trace("Tool call {} {} {}", call.id(), call.function().name(), call.function().arguments());
                invocations.add(new ToolInvocation(call.id(), call.function().name(),
                        parseArguments(call.function().arguments())));
            }
            return ModelDecision.toolRequests(invocations);
        }

        String content = message.content().orElse("");
        log.trace("Model answer:\n{}", content);
        return ModelDecision.finalAnswer(content);
    }

    ChatCompletionCreateParams buildParams(ModelContext context) {
        ChatCompletionCreateParams.Builder builder = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(temperature)
                .addSystemMessage(context.getSystemContent());

        for (ConversationMessage message : context.getMessages()) {
            switch (message.getRole()) {
                case USER:
                    builder.addUserMessage(message.getContent());
                    break;
                case ASSISTANT:
                    if (message.isToolRequest()) {
                        builder.addMessage(ChatCompletionAssistantMessageParam.builder()
                                .toolCalls(toToolCalls(message.getToolInvocations()))
                                .build());
                    } else {
                        builder.addMessage(ChatCompletionAssistantMessageParam.builder()
                                .content(message.getContent())
                                .build());
                    }
                    break;
                case TOOL:
                    builder.addMessage(ChatCompletionToolMessageParam.builder()
                            .toolCallId(message.getToolCallId())
                            .content(message.getContent())
                            .build());
                    break;
            }
        }

        for (ToolDefinition tool : context.getTools()) {
            builder.addTool(toTool(tool));
        }
        return builder.build();
    }

    /**
     * Reads the JSON argument object of a tool call. Unreadable arguments become an empty map so
     * the registry reports the missing parameters back to the model.
     */
    Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> arguments = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() { });
            return arguments != null ? arguments : Collections.emptyMap();
        } catch (IOException e) {
            log.warn("Could not parse tool arguments '{}': {}", json, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private List<ChatCompletionMessageToolCall> toToolCalls(List<ToolInvocation> invocations) {
        List<ChatCompletionMessageToolCall> calls = new ArrayList<>();
        for (ToolInvocation invocation : invocations) {
            String arguments;
            try {
                arguments = objectMapper.writeValueAsString(invocation.getArguments());
            } catch (IOException e) {
                throw new ModelClientException("Cannot serialize arguments of " + invocation.getToolName(), e);
            }
            calls.add(ChatCompletionMessageToolCall.builder()
                    .id(invocation.getCallId())
                    .function(ChatCompletionMessageToolCall.Function.builder()
                            .name(invocation.getToolName())
                            .arguments(arguments)
                            .build())
                    .build());
        }
        return calls;
    }

    private static ChatCompletionTool toTool(ToolDefinition tool) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ToolParameter parameter : tool.getParameters()) {
            properties.put(parameter.getName(), Map.of(
                    "type", parameter.getType().getJsonType(),
                    "description", parameter.getDescription()));
        }

        FunctionParameters parameters = FunctionParameters.builder()
                .putAdditionalProperty("type", JsonValue.from("object"))
                .putAdditionalProperty("properties", JsonValue.from(properties))
                .putAdditionalProperty("required", JsonValue.from(tool.getRequiredParameterNames()))
                .build();

        return ChatCompletionTool.builder()
                .function(FunctionDefinition.builder()
                        .name(tool.getName().getWireName())
                        .description(tool.getDescription())
                        .parameters(parameters)
                        .build())
                .build();
    }
}
