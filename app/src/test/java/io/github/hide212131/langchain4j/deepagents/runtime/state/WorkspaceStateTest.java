package io.github.hide212131.langchain4j.deepagents.runtime.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WorkspaceStateTest {

    @Test
    void applyReturnsNewInstanceAndLeavesOriginalUntouched() {
        WorkspaceState original = WorkspaceState.forUserMessage("start", List.of(Todo.pending("x")), Map.of());

        WorkspaceState updated = original.apply(new StateDelta(
                List.of(AiMessage.from("done")), List.of(), Map.of("/a.txt", "a")));

        assertThat(original.messages()).hasSize(1);
        assertThat(original.todos()).hasSize(1);
        assertThat(original.files()).isEmpty();
        assertThat(updated.messages()).hasSize(2);
        assertThat(updated.todos()).isEmpty();
        assertThat(updated.files()).containsEntry("/a.txt", "a");
    }

    @Test
    void emptyDeltaKeepsState() {
        WorkspaceState state = WorkspaceState.forUserMessage("start", List.of(), Map.of("/a", "1"));

        assertThat(state.apply(StateDelta.none())).isSameAs(state);
        assertThat(state.apply(null)).isSameAs(state);
    }

    @Test
    void fieldsAreImmutable() {
        WorkspaceState state = WorkspaceState.empty().apply(StateDelta.ofFiles(Map.of("/a", "1")));

        assertThat(state.file("/a")).contains("1");
        assertThat(state.file("/b")).isEmpty();
        assertThatThrownBy(() -> state.files().put("/b", "2")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> state.todos().add(Todo.pending("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void lastMessageTextReadsFinalMessage() {
        WorkspaceState state = WorkspaceState.forUserMessage("question", List.of(), Map.of())
                .appendMessage(AiMessage.from("answer"));

        assertThat(state.lastMessageText()).contains("answer");
        assertThat(WorkspaceState.empty().lastMessageText()).isEmpty();
        assertThat(state.appendMessage(ToolExecutionResultMessage.from("1", "ls", "[]")).lastMessageText())
                .contains("[]");
    }

    @Test
    void forUserMessageSeedsSingleUserMessage() {
        WorkspaceState state = WorkspaceState.forUserMessage("do X", List.of(), Map.of());

        assertThat(state.messages()).containsExactly(UserMessage.from("do X"));
    }
}
