package io.github.hide212131.langchain4j.deepagents.runtime.agent;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.hide212131.langchain4j.deepagents.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.deepagents.runtime.state.StateDelta;
import io.github.hide212131.langchain4j.deepagents.runtime.state.WorkspaceState;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolArguments;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolCatalog;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolInvocation;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolResult;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceToolException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AgentRuntime} backed by a LangChain4j {@link ChatModel} with native tool calling.
 * <p>
 * Each step sends the system prompt, the transcript and the tool specifications. All tool calls requested in
 * one model turn run against the workspace as it stood at the start of that turn; their deltas are then folded
 * in call order. The run ends with the first reply that requests no tool, or fails once {@code maxSteps} model
 * calls have been made.
 */
public final class ToolLoopAgentRuntime implements AgentRuntime {

    public static final int DEFAULT_MAX_STEPS = 25;

    private final ChatModel chatModel;
    private final int maxSteps;
    private final WorkflowLogger logger;

    public ToolLoopAgentRuntime(ChatModel chatModel) {
        this(chatModel, DEFAULT_MAX_STEPS);
    }

    public ToolLoopAgentRuntime(ChatModel chatModel, int maxSteps) {
        this(chatModel, maxSteps, new WorkflowLogger(ToolLoopAgentRuntime.class));
    }

    public ToolLoopAgentRuntime(ChatModel chatModel, int maxSteps, WorkflowLogger logger) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        this.maxSteps = maxSteps;
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public RunnableAgent construct(String name, String systemPrompt, List<WorkspaceTool> tools) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tools, "tools");
        ToolCatalog catalog = ToolCatalog.of(tools);
        logger.debug("Constructed agent {} with tools {}", name, catalog.names());
        return new ToolLoopAgent(name, systemPrompt, catalog);
    }

    private final class ToolLoopAgent implements RunnableAgent {

        private final String name;
        private final String systemPrompt;
        private final ToolCatalog catalog;
        private final List<ToolSpecification> specifications;

        ToolLoopAgent(String name, String systemPrompt, ToolCatalog catalog) {
            this.name = name;
            this.systemPrompt = systemPrompt;
            this.catalog = catalog;
            this.specifications = catalog.tools().stream().map(WorkspaceTool::specification).toList();
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<String> toolNames() {
            return catalog.names();
        }

        @Override
        public WorkspaceState invoke(WorkspaceState initialState) {
            WorkspaceState state = Objects.requireNonNull(initialState, "initialState");
            for (int step = 1; step <= maxSteps; step++) {
                AiMessage reply = callModel(state, step);
                state = state.appendMessage(reply);
                if (!reply.hasToolExecutionRequests()) {
                    logger.debug("Agent {} finished after {} step(s)", name, step);
                    return state;
                }
                WorkspaceState snapshot = state;
                List<StateDelta> deltas = new ArrayList<>();
                List<ToolExecutionRequest> requests = reply.toolExecutionRequests();
                for (int index = 0; index < requests.size(); index++) {
                    deltas.add(executeTool(requests.get(index), snapshot, step, index));
                }
                for (StateDelta delta : deltas) {
                    state = state.apply(delta);
                }
            }
            throw new AgentRunException("Agent '" + name + "' exceeded the step limit of " + maxSteps);
        }

        private AiMessage callModel(WorkspaceState state, int step) {
            List<ChatMessage> messages = new ArrayList<>(state.messages().size() + 1);
            if (systemPrompt != null && !systemPrompt.isBlank()) {
                messages.add(SystemMessage.from(systemPrompt));
            }
            messages.addAll(state.messages());
            ChatRequest.Builder request = ChatRequest.builder().messages(messages);
            if (!specifications.isEmpty()) {
                request.toolSpecifications(specifications);
            }
            ChatResponse response;
            try {
                response = chatModel.chat(request.build());
            } catch (RuntimeException ex) {
                throw new AgentRunException(
                        "Model call failed for agent '" + name + "' at step " + step + ": " + ex.getMessage(), ex);
            }
            if (response == null || response.aiMessage() == null) {
                throw new AgentRunException("Model returned no message for agent '" + name + "' at step " + step);
            }
            return response.aiMessage();
        }

        private StateDelta executeTool(ToolExecutionRequest request, WorkspaceState snapshot, int step, int index) {
            String callId = request.id() != null ? request.id() : "call_" + step + "_" + index;
            String toolName = request.name();
            Optional<WorkspaceTool> tool = toolName == null ? Optional.empty() : catalog.find(toolName);
            if (tool.isEmpty()) {
                logger.warn("Agent {} requested unknown tool {}", name, toolName);
                return ToolResult.message("Error: " + toolName + " is not a valid tool, try one of "
                        + catalog.names()).toDelta(callId, String.valueOf(toolName));
            }
            if (logger.isDebugEnabled()) {
                logger.debug("Agent {} step {} calls {} {}", name, step, toolName, request.arguments());
            }
            ToolResult result;
            try {
                ToolArguments arguments = ToolArguments.parse(request.arguments());
                result = tool.get().execute(new ToolInvocation(callId, toolName, arguments, snapshot));
            } catch (WorkspaceToolException ex) {
                result = ToolResult.error(ex);
            } catch (RuntimeException ex) {
                logger.warn("Tool {} failed for agent {}: {}", toolName, name, ex.toString());
                result = ToolResult.message("Error: tool '" + toolName + "' failed: " + ex.getMessage());
            }
            if (result.isError()) {
                logger.warn("Tool {} returned an error for agent {}: {}", toolName, name, result.message());
            }
            return result.toDelta(callId, toolName);
        }
    }
}
