package io.github.hide212131.langchain4j.deepagents.runtime.tool;

import java.util.Objects;

/**
 * Raised by workspace operations; converted to an {@code Error: ...} string at the tool boundary and never
 * allowed to reach the agent loop.
 */
public class WorkspaceToolException extends RuntimeException {

    private final ToolErrorKind kind;

    public WorkspaceToolException(ToolErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public WorkspaceToolException(ToolErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ToolErrorKind kind() {
        return kind;
    }

    public static WorkspaceToolException notFound(String message) {
        return new WorkspaceToolException(ToolErrorKind.NOT_FOUND, message);
    }

    public static WorkspaceToolException invalidArgument(String message) {
        return new WorkspaceToolException(ToolErrorKind.INVALID_ARGUMENT, message);
    }
}
