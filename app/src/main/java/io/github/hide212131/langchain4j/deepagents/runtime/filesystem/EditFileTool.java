package io.github.hide212131.langchain4j.deepagents.runtime.filesystem;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import io.github.hide212131.langchain4j.deepagents.runtime.state.StateDelta;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolArguments;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolInvocation;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolResult;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceToolException;
import java.util.Map;

/**
 * {@code edit_file}: exact string replacement inside a virtual file.
 */
public final class EditFileTool implements WorkspaceTool {

    public static final String TOOL_NAME = "edit_file";

    private final ToolSpecification specification = ToolSpecification.builder()
            .name(TOOL_NAME)
            .description("Perform an exact string replacement in a file of the virtual filesystem. "
                    + "The edit fails if old_string is not found, or if it occurs more than once and "
                    + "replace_all is not set. Read the file before editing it.")
            .parameters(JsonObjectSchema.builder()
                    .addStringProperty("file_path", "Absolute path to the file to edit")
                    .addStringProperty("old_string", "String to be replaced (must match exactly)")
                    .addStringProperty("new_string", "String to replace with")
                    .addBooleanProperty("replace_all", "Whether to replace all occurrences (default false)")
                    .required("file_path", "old_string", "new_string")
                    .build())
            .build();

    @Override
    public ToolSpecification specification() {
        return specification;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        try {
            ToolArguments arguments = invocation.arguments();
            String path = arguments.requiredString("file_path");
            String oldString = arguments.requiredString("old_string");
            String newString = arguments.requiredString("new_string");
            boolean replaceAll = arguments.optionalBoolean("replace_all", false);
            Map<String, String> update =
                    VirtualFileSystem.edit(invocation.state().files(), path, oldString, newString, replaceAll);
            return ToolResult.of("Updated file " + path, StateDelta.ofFiles(update));
        } catch (WorkspaceToolException ex) {
            return ToolResult.error(ex);
        }
    }
}
