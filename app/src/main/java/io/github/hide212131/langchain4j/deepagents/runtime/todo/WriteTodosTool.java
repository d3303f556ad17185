package io.github.hide212131.langchain4j.deepagents.runtime.todo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import io.github.hide212131.langchain4j.deepagents.runtime.state.StateDelta;
import io.github.hide212131.langchain4j.deepagents.runtime.state.Todo;
import io.github.hide212131.langchain4j.deepagents.runtime.state.TodoStatus;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolInvocation;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolResult;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceToolException;
import java.util.List;

/**
 * {@code write_todos}: replaces the whole todo list with the one supplied by the model.
 * <p>
 * The model always sends the complete desired list, so there is no element-wise merge; an empty list clears
 * the plan.
 */
public final class WriteTodosTool implements WorkspaceTool {

    public static final String TOOL_NAME = "write_todos";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<Todo>> TODO_LIST_TYPE = new TypeReference<>() {};

    private final ToolSpecification specification = ToolSpecification.builder()
            .name(TOOL_NAME)
            .description("Create or update the todo list for the current task. Always send the complete list: "
                    + "it replaces the previous one. Mark an item in_progress before starting it and completed "
                    + "as soon as it is done.")
            .parameters(JsonObjectSchema.builder()
                    .addProperty("todos", JsonArraySchema.builder()
                            .description("List of todo items to update")
                            .items(JsonObjectSchema.builder()
                                    .addStringProperty("content", "Content of the todo item")
                                    .addEnumProperty("status", TodoStatus.wireValues(), "Status of the todo")
                                    .required("content", "status")
                                    .build())
                            .build())
                    .required("todos")
                    .build())
            .build();

    @Override
    public ToolSpecification specification() {
        return specification;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        List<Todo> todos;
        try {
            todos = invocation.arguments().required("todos", TODO_LIST_TYPE);
        } catch (WorkspaceToolException ex) {
            return ToolResult.error(ex);
        }
        if (todos.contains(null)) {
            return ToolResult.error(WorkspaceToolException.invalidArgument("todos must not contain null items"));
        }
        List<Todo> replacement = List.copyOf(todos);
        return ToolResult.of("Updated todo list to " + render(replacement), StateDelta.ofTodos(replacement));
    }

    private static String render(List<Todo> todos) {
        try {
            return OBJECT_MAPPER.writeValueAsString(todos);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render todo list", ex);
        }
    }
}
