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
 * {@code write_file}: creates or overwrites a virtual file.
 */
public final class WriteFileTool implements WorkspaceTool {

    public static final String TOOL_NAME = "write_file";

    private final ToolSpecification specification = ToolSpecification.builder()
            .name(TOOL_NAME)
            .description("Write content to a file in the virtual filesystem, replacing any existing content")
            .parameters(JsonObjectSchema.builder()
                    .addStringProperty("file_path", "Absolute path to the file to write")
                    .addStringProperty("content", "Content to write to the file")
                    .required("file_path", "content")
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
            String content = arguments.requiredString("content");
            Map<String, String> update = VirtualFileSystem.write(path, content);
            return ToolResult.of("Updated file " + path, StateDelta.ofFiles(update));
        } catch (WorkspaceToolException ex) {
            return ToolResult.error(ex);
        }
    }
}
