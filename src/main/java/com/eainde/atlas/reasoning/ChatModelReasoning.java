package com.eainde.atlas.reasoning;

import com.eainde.atlas.error.ReasoningUnavailableException;
import com.eainde.atlas.run.ConversationMessage;
import com.eainde.atlas.run.ToolCallRequest;
import com.eainde.atlas.run.ToolInvocation;
import com.eainde.atlas.tools.ToolManifestEntry;
import com.eainde.atlas.tools.ToolSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link ReasoningModel} backed by a langchain4j {@link ChatModel} with native tool calling.
 */
@Slf4j
public class ChatModelReasoning implements ReasoningModel {

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public ChatModelReasoning(ChatModel chatModel, ObjectMapper objectMapper, String systemPrompt) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public ReasoningOutput reason(List<ConversationMessage> history, Iterable<ToolManifestEntry> manifest) {
        List<ToolSpecification> tools = ToolSpecificationMapper.toSpecifications(manifest);
        ChatRequest.Builder request = ChatRequest.builder().messages(toChatMessages(history));
        if (!tools.isEmpty()) {
            request.toolSpecifications(tools);
        }

        ChatResponse response;
        try {
            response = chatModel.chat(request.build());
        } catch (RuntimeException e) {
            throw new ReasoningUnavailableException("Chat model call failed: " + e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null) {
            throw new ReasoningUnavailableException("Chat model returned no message");
        }

        AiMessage aiMessage = response.aiMessage();
        if (!aiMessage.hasToolExecutionRequests()) {
            return ReasoningOutput.finalAnswer(aiMessage.text());
        }
        List<ToolCallRequest> requests = new ArrayList<>();
        for (ToolExecutionRequest toolRequest : aiMessage.toolExecutionRequests()) {
            String id = toolRequest.id() != null ? toolRequest.id() : "call_" + UUID.randomUUID();
            requests.add(new ToolCallRequest(id, toolRequest.name(), parseArguments(toolRequest)));
        }
        return new ReasoningOutput(aiMessage.text(), requests);
    }

    List<ChatMessage> toChatMessages(List<ConversationMessage> history) {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 1);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        for (ConversationMessage message : history) {
            messages.add(toChatMessage(message));
        }
        return messages;
    }

    private ChatMessage toChatMessage(ConversationMessage message) {
        return switch (message.role()) {
            case USER -> UserMessage.from(message.content());
            case SYSTEM -> SystemMessage.from(message.content());
            case ASSISTANT -> toAiMessage(message);
            case TOOL_RESULT -> {
                ToolInvocation invocation = message.toolInvocation();
                yield ToolExecutionResultMessage.from(invocation.callId(), invocation.name(), message.content());
            }
        };
    }

    private AiMessage toAiMessage(ConversationMessage message) {
        if (!message.hasToolCalls()) {
            return AiMessage.from(message.content());
        }
        List<ToolExecutionRequest> requests = message.toolCalls().stream()
                .map(call -> ToolExecutionRequest.builder()
                        .id(call.id())
                        .name(call.name())
                        .arguments(writeArguments(call.arguments()))
                        .build())
                .toList();
        return message.content().isBlank() ? AiMessage.from(requests) : AiMessage.from(message.content(), requests);
    }

    private Map<String, Object> parseArguments(ToolExecutionRequest request) {
        String json = request.arguments();
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, ARGUMENTS);
        } catch (JsonProcessingException e) {
            // Left to schema validation, which reports it as a failed tool result.
            log.warn("Unparseable arguments for tool call {} ({}): {}", request.id(), request.name(), e.getOriginalMessage());
            return Map.of(ToolSchema.RAW_ARGUMENTS, json);
        }
    }

    private String writeArguments(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new ReasoningUnavailableException("Could not serialize tool arguments", e);
        }
    }
}
