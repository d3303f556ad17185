package io.github.hide212131.langchain4j.deepagents.runtime.tool;

import dev.langchain4j.data.message.ToolExecutionResultMessage;
import io.github.hide212131.langchain4j.deepagents.runtime.state.StateDelta;
import java.util.List;
import java.util.Objects;

/**
 * Value returned by every tool: the text shown to the model and an optional state delta.
 */
public record ToolResult(String message, StateDelta delta) {

    public ToolResult {
        message = message == null ? "" : message;
        delta = delta == null ? StateDelta.none() : delta;
    }

    public static ToolResult message(String message) {
        return new ToolResult(message, StateDelta.none());
    }

    public static ToolResult of(String message, StateDelta delta) {
        return new ToolResult(message, delta);
    }

    public static ToolResult error(WorkspaceToolException error) {
        Objects.requireNonNull(error, "error");
        return message("Error: " + error.getMessage());
    }

    public boolean isError() {
        return message.startsWith("Error:");
    }

    /**
     * Delta the runtime folds into the workspace: the tool-result message for {@code callId} first, then the
     * fields the tool updated.
     */
    public StateDelta toDelta(String callId, String toolName) {
        ToolExecutionResultMessage resultMessage = ToolExecutionResultMessage.from(callId, toolName, message);
        return delta.withLeadingMessages(List.of(resultMessage));
    }
}
