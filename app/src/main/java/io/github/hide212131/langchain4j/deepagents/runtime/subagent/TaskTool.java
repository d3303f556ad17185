package io.github.hide212131.langchain4j.deepagents.runtime.subagent;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import io.github.hide212131.langchain4j.deepagents.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.deepagents.runtime.state.StateDelta;
import io.github.hide212131.langchain4j.deepagents.runtime.state.WorkspaceState;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolArguments;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolErrorKind;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolInvocation;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolResult;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceToolException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@code task}: hands one task to a registered sub-agent and folds back a narrow result.
 * <p>
 * The child starts from the parent's files and todos but sees a single user message instead of the parent's
 * transcript. It runs synchronously to completion. On success only the files it changed travel back, together
 * with exactly one tool-result message summarising its final reply; its todos and transcript stay behind. A
 * failed child run is reported as text and leaves the parent workspace untouched.
 */
public final class TaskTool implements WorkspaceTool {

    public static final String TOOL_NAME = "task";
    static final String DEFAULT_RESULT = "Task completed";

    private final SubAgentRegistry registry;
    private final WorkflowLogger logger;
    private final ToolSpecification specification;

    TaskTool(SubAgentRegistry registry, WorkflowLogger logger) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.logger = Objects.requireNonNull(logger, "logger");
        String catalogue = registry.specs().stream()
                .map(spec -> spec.name() + " - " + spec.description())
                .collect(Collectors.joining("; "));
        String names = String.join(", ", registry.names());
        this.specification = ToolSpecification.builder()
                .name(TOOL_NAME)
                .description("Execute a task using a specialized sub-agent. The sub-agent only sees the task text, "
                        + "so include all context it needs. Available agents: " + catalogue)
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty("agent_name", "Name of the agent to use. Available: " + names)
                        .addStringProperty("task", "The task to execute with the selected agent")
                        .required("agent_name", "task")
                        .build())
                .build();
    }

    @Override
    public ToolSpecification specification() {
        return specification;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        String agentName;
        String task;
        try {
            ToolArguments arguments = invocation.arguments();
            agentName = arguments.requiredString("agent_name").trim();
            task = arguments.requiredString("task");
        } catch (WorkspaceToolException ex) {
            return ToolResult.error(ex);
        }
        Optional<SubAgentRegistry.RegisteredSubAgent> target = registry.find(agentName);
        if (target.isEmpty()) {
            return ToolResult.error(WorkspaceToolException.notFound("Agent '" + agentName
                    + "' not found. Available agents: " + String.join(", ", registry.names())));
        }

        WorkspaceState parent = invocation.state();
        WorkspaceState childInput = WorkspaceState.forUserMessage(task, parent.todos(), parent.files());
        logger.info("Dispatching task to sub-agent {} (call {})", agentName, invocation.callId());
        WorkspaceState childResult;
        try {
            childResult = target.get().agent().invoke(childInput);
        } catch (RuntimeException | StackOverflowError ex) {
            WorkspaceToolException failure = new WorkspaceToolException(
                    ToolErrorKind.DELEGATION_FAILURE,
                    "Error executing task '" + task + "' with agent '" + agentName + "': " + describe(ex),
                    ex);
            logger.warn("Sub-agent {} failed: {}", agentName, failure.getMessage());
            return ToolResult.message(failure.getMessage());
        }

        Map<String, String> changedFiles = changedFiles(parent.files(), childResult.files());
        String summary = childResult.lastMessageText().orElse(DEFAULT_RESULT);
        logger.info("Sub-agent {} completed; {} file(s) changed", agentName, changedFiles.size());
        return ToolResult.of(
                "Completed task '" + task + "' using agent '" + agentName + "'. Result: " + summary,
                StateDelta.ofFiles(changedFiles));
    }

    /** Entries of {@code after} that are new or differ from {@code before}. */
    static Map<String, String> changedFiles(Map<String, String> before, Map<String, String> after) {
        Map<String, String> changed = new LinkedHashMap<>();
        after.forEach((path, content) -> {
            if (!Objects.equals(before.get(path), content)) {
                changed.put(path, content);
            }
        });
        return changed;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
