package io.github.hide212131.langchain4j.deepagents.runtime.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic stand-in for a real provider, used by {@code --dry-run} and tests.
 * <p>
 * On the first turn after a user message it records the task as an in-progress todo and writes it to
 * {@value #TASK_FILE} (when those tools are offered); once tool results are present it answers in plain text.
 */
public final class DryRunChatModel implements ChatModel {

    static final String TASK_FILE = "/task.md";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public ChatResponse doChat(ChatRequest request) {
        List<ChatMessage> messages = request.messages();
        int lastUser = lastUserIndex(messages);
        String task = lastUser < 0 ? "" : textOf(messages.get(lastUser));
        boolean answeredTools = messages.subList(Math.max(lastUser, 0), messages.size()).stream()
                .anyMatch(ToolExecutionResultMessage.class::isInstance);
        Set<String> offered = offeredTools(request);

        AiMessage reply;
        if (!answeredTools && offered.contains("write_todos") && offered.contains("write_file")) {
            List<ToolExecutionRequest> calls = new ArrayList<>();
            calls.add(call("dry-run-1", "write_todos",
                    Map.of("todos", List.of(Map.of("content", task, "status", "in_progress")))));
            calls.add(call("dry-run-2", "write_file", Map.of("file_path", TASK_FILE, "content", task)));
            reply = AiMessage.from(calls);
        } else {
            reply = AiMessage.from("dry-run: completed '" + task + "'");
        }
        return ChatResponse.builder()
                .aiMessage(reply)
                .tokenUsage(new TokenUsage(0, 0, 0))
                .build();
    }

    private static Set<String> offeredTools(ChatRequest request) {
        List<ToolSpecification> specifications = request.toolSpecifications();
        if (specifications == null) {
            return Set.of();
        }
        return specifications.stream().map(ToolSpecification::name).collect(Collectors.toSet());
    }

    private static int lastUserIndex(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i) instanceof UserMessage) {
                return i;
            }
        }
        return -1;
    }

    private static String textOf(ChatMessage message) {
        if (message instanceof UserMessage user && user.hasSingleText()) {
            return user.singleText();
        }
        return "";
    }

    private static ToolExecutionRequest call(String id, String name, Map<String, Object> arguments) {
        try {
            return ToolExecutionRequest.builder()
                    .id(id)
                    .name(name)
                    .arguments(OBJECT_MAPPER.writeValueAsString(arguments))
                    .build();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode dry-run tool arguments", ex);
        }
    }
}
