package io.github.hide212131.langchain4j.deepagents.runtime.state;

import dev.langchain4j.data.message.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure per-field merge functions applied after every tool call. None of them mutates its arguments.
 */
public final class WorkspaceReducers {

    private WorkspaceReducers() {
    }

    /**
     * Key-wise union of both maps; {@code right} wins on shared keys. Keys keep their first-seen order.
     */
    public static Map<String, String> mergeFiles(Map<String, String> left, Map<String, String> right) {
        if (left == null) {
            return right == null ? Map.of() : unmodifiableCopy(right);
        }
        if (right == null) {
            return left;
        }
        Map<String, String> merged = new LinkedHashMap<>(left);
        merged.putAll(right);
        return Collections.unmodifiableMap(merged);
    }

    /** Wholesale replacement: a non-null {@code right} (even empty) always wins. */
    public static List<Todo> replaceTodos(List<Todo> left, List<Todo> right) {
        if (right != null) {
            return List.copyOf(right);
        }
        return left == null ? List.of() : left;
    }

    public static List<ChatMessage> appendMessages(List<ChatMessage> left, List<ChatMessage> right) {
        if (right == null || right.isEmpty()) {
            return left == null ? List.of() : left;
        }
        if (left == null || left.isEmpty()) {
            return List.copyOf(right);
        }
        List<ChatMessage> combined = new ArrayList<>(left.size() + right.size());
        combined.addAll(left);
        combined.addAll(right);
        return Collections.unmodifiableList(combined);
    }

    private static Map<String, String> unmodifiableCopy(Map<String, String> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
