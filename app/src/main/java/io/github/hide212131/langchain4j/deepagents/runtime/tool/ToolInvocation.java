package io.github.hide212131.langchain4j.deepagents.runtime.tool;

import io.github.hide212131.langchain4j.deepagents.runtime.state.WorkspaceState;
import java.util.Objects;

/**
 * One tool call as seen by the tool: correlation id, decoded arguments and the workspace snapshot the
 * runtime supplies for this call.
 */
public record ToolInvocation(String callId, String toolName, ToolArguments arguments, WorkspaceState state) {

    public ToolInvocation {
        callId = callId == null ? "" : callId;
        Objects.requireNonNull(toolName, "toolName");
        arguments = arguments == null ? ToolArguments.empty() : arguments;
        state = state == null ? WorkspaceState.empty() : state;
    }
}
