package io.github.hide212131.langchain4j.deepagents.runtime.state;

import dev.langchain4j.data.message.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level update produced by a tool call. A {@code null} field means "leave this field alone", which
 * is distinct from an empty value (an empty {@code todos} list clears the plan).
 */
public record StateDelta(List<ChatMessage> messagesAdd, List<Todo> todos, Map<String, String> files) {

    private static final StateDelta NONE = new StateDelta(null, null, null);

    public StateDelta {
        messagesAdd = messagesAdd == null ? null : List.copyOf(messagesAdd);
        todos = todos == null ? null : List.copyOf(todos);
        files = files == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public static StateDelta none() {
        return NONE;
    }

    public static StateDelta ofFiles(Map<String, String> files) {
        return new StateDelta(null, null, files);
    }

    public static StateDelta ofTodos(List<Todo> todos) {
        return new StateDelta(null, todos, null);
    }

    public static StateDelta ofMessages(List<ChatMessage> messages) {
        return new StateDelta(messages, null, null);
    }

    public boolean isEmpty() {
        return messagesAdd == null && todos == null && files == null;
    }

    /**
     * Returns a copy of this delta with the given messages placed in front of the ones already carried.
     */
    public StateDelta withLeadingMessages(List<ChatMessage> leading) {
        List<ChatMessage> combined = new ArrayList<>(leading);
        if (messagesAdd != null) {
            combined.addAll(messagesAdd);
        }
        return new StateDelta(combined, todos, files);
    }
}
