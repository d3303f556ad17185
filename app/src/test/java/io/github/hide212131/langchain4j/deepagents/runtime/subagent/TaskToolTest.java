package io.github.hide212131.langchain4j.deepagents.runtime.subagent;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import io.github.hide212131.langchain4j.deepagents.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.deepagents.runtime.agent.AgentRunException;
import io.github.hide212131.langchain4j.deepagents.runtime.state.StateDelta;
import io.github.hide212131.langchain4j.deepagents.runtime.state.Todo;
import io.github.hide212131.langchain4j.deepagents.runtime.state.TodoStatus;
import io.github.hide212131.langchain4j.deepagents.runtime.state.WorkspaceState;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolArguments;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolCatalog;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolInvocation;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskToolTest {

    private final RecordingAgentRuntime runtime = new RecordingAgentRuntime();
    private final WorkspaceState parent = new WorkspaceState(
            List.of(UserMessage.from("parent question"), AiMessage.from("thinking")),
            List.of(Todo.pending("parent plan")),
            Map.of("/shared.md", "v1", "/keep.md", "same"));

    @Test
    void unknownAgentLeavesStateUntouched() {
        TaskTool tool = registry().taskTool();

        ToolResult result = tool.execute(invocation("nobody", "anything"));

        assertThat(result.message()).isEqualTo("Error: Agent 'nobody' not found. Available agents: writer, broken");
        assertThat(result.delta().isEmpty()).isTrue();
        assertThat(parent.apply(result.delta())).isEqualTo(parent);
        assertThat(runtime.inputs()).isEmpty();
    }

    @Test
    void childSeesOnlyTaskMessageWithParentFilesAndTodos() {
        registry().taskTool().execute(invocation("writer", "draft the intro"));

        WorkspaceState childInput = runtime.inputs().get(0);
        assertThat(childInput.messages()).containsExactly(UserMessage.from("draft the intro"));
        assertThat(childInput.files()).isEqualTo(parent.files());
        assertThat(childInput.todos()).isEqualTo(parent.todos());
    }

    @Test
    void successPropagatesOnlyChangedFiles() {
        ToolResult result = registry().taskTool().execute(invocation("writer", "draft the intro"));

        assertThat(result.message())
                .isEqualTo("Completed task 'draft the intro' using agent 'writer'. Result: intro written");
        assertThat(result.delta().files()).containsOnly(
                Map.entry("/shared.md", "v2"), Map.entry("/intro.md", "Hello"));
        assertThat(result.delta().todos()).isNull();
        assertThat(result.delta().messagesAdd()).isNull();

        WorkspaceState merged = parent.apply(result.toDelta("call-7", TaskTool.TOOL_NAME));
        assertThat(merged.messages()).hasSize(parent.messages().size() + 1);
        assertThat(merged.todos()).isEqualTo(parent.todos());
        assertThat(merged.files()).containsOnly(
                Map.entry("/shared.md", "v2"), Map.entry("/keep.md", "same"), Map.entry("/intro.md", "Hello"));
    }

    @Test
    void childWithoutTextReportsDefaultResult() {
        runtime.behave("writer", state -> state.apply(StateDelta.ofFiles(Map.of("/x", "y"))));

        ToolResult result = registry().taskTool().execute(invocation("writer", "quiet"));

        assertThat(result.message()).endsWith("Result: " + TaskTool.DEFAULT_RESULT);
    }

    @Test
    void failureBecomesMessageWithoutDelta() {
        ToolResult result = registry().taskTool().execute(invocation("broken", "explode"));

        assertThat(result.message())
                .isEqualTo("Error executing task 'explode' with agent 'broken': step limit reached");
        assertThat(result.delta().isEmpty()).isTrue();
    }

    @Test
    void stackOverflowInChildIsReportedNotRaised() {
        runtime.behave("broken", state -> {
            throw new StackOverflowError("too deep");
        });

        ToolResult result = registry().taskTool().execute(invocation("broken", "recurse"));

        assertThat(result.message())
                .isEqualTo("Error executing task 'recurse' with agent 'broken': too deep");
        assertThat(result.delta().isEmpty()).isTrue();
    }

    @Test
    void agentNameIsTrimmedBeforeLookup() {
        ToolResult result = registry().taskTool().execute(invocation(" writer ", "draft the intro"));

        assertThat(result.message())
                .isEqualTo("Completed task 'draft the intro' using agent 'writer'. Result: intro written");
        assertThat(runtime.inputs()).hasSize(1);
    }

    @Test
    void changedFilesIgnoresUntouchedEntries() {
        assertThat(TaskTool.changedFiles(Map.of("/a", "1", "/b", "2"), Map.of("/a", "1", "/b", "3", "/c", "4")))
                .containsOnly(Map.entry("/b", "3"), Map.entry("/c", "4"));
    }

    @BeforeEach
    void setUp() {
        runtime.behave("writer", this::writerBehaviour);
        runtime.behave("broken", state -> {
            throw new AgentRunException("step limit reached");
        });
    }

    private SubAgentRegistry registry() {
        return SubAgentRegistry.create(
                List.of(new SubAgentSpec("writer", "writes", "You write.", List.of()),
                        new SubAgentSpec("broken", "fails", "You fail.", List.of())),
                ToolCatalog.empty(), runtime, new WorkflowLogger(TaskToolTest.class));
    }

    private WorkspaceState writerBehaviour(WorkspaceState state) {
        return state
                .apply(StateDelta.ofFiles(Map.of("/shared.md", "v2", "/intro.md", "Hello")))
                .apply(StateDelta.ofTodos(List.of(new Todo("child plan", TodoStatus.COMPLETED))))
                .appendMessage(AiMessage.from("intro written"));
    }

    private ToolInvocation invocation(String agentName, String task) {
        return new ToolInvocation("call-7", TaskTool.TOOL_NAME,
                ToolArguments.of(Map.of("agent_name", agentName, "task", task)), parent);
    }
}
