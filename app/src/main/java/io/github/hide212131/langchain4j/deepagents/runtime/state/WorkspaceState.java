package io.github.hide212131.langchain4j.deepagents.runtime.state;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable workspace threaded through one agent invocation: transcript, plan and virtual files.
 * <p>
 * Every change goes through {@link #apply(StateDelta)}, which delegates to {@link WorkspaceReducers}
 * and returns a new instance. Two states are equal when all three fields are equal.
 */
public record WorkspaceState(List<ChatMessage> messages, List<Todo> todos, Map<String, String> files) {

    private static final WorkspaceState EMPTY = new WorkspaceState(List.of(), List.of(), Map.of());

    public WorkspaceState {
        messages = messages == null ? List.of() : List.copyOf(messages);
        todos = todos == null ? List.of() : List.copyOf(todos);
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public static WorkspaceState empty() {
        return EMPTY;
    }

    /** Fresh history containing a single user message, used to seed top-level runs and sub-agents. */
    public static WorkspaceState forUserMessage(String text, List<Todo> todos, Map<String, String> files) {
        Objects.requireNonNull(text, "text");
        return new WorkspaceState(List.of(UserMessage.from(text)), todos, files);
    }

    public WorkspaceState apply(StateDelta delta) {
        if (delta == null || delta.isEmpty()) {
            return this;
        }
        return new WorkspaceState(
                WorkspaceReducers.appendMessages(messages, delta.messagesAdd()),
                WorkspaceReducers.replaceTodos(todos, delta.todos()),
                WorkspaceReducers.mergeFiles(files, delta.files()));
    }

    public WorkspaceState appendMessage(ChatMessage message) {
        return apply(StateDelta.ofMessages(List.of(Objects.requireNonNull(message, "message"))));
    }

    public Optional<String> file(String path) {
        return Optional.ofNullable(files.get(path));
    }

    /** Text content of the final message, if it has any. */
    public Optional<String> lastMessageText() {
        if (messages.isEmpty()) {
            return Optional.empty();
        }
        String text = textOf(messages.get(messages.size() - 1));
        return text == null || text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    private static String textOf(ChatMessage message) {
        if (message instanceof AiMessage ai) {
            return ai.text();
        }
        if (message instanceof ToolExecutionResultMessage result) {
            return result.text();
        }
        if (message instanceof UserMessage user && user.hasSingleText()) {
            return user.singleText();
        }
        return null;
    }
}
