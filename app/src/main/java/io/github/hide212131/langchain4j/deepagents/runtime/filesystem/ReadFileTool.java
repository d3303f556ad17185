package io.github.hide212131.langchain4j.deepagents.runtime.filesystem;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolArguments;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolInvocation;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolResult;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceTool;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceToolException;

/**
 * {@code read_file}: numbered, paginated view of one virtual file.
 */
public final class ReadFileTool implements WorkspaceTool {

    public static final String TOOL_NAME = "read_file";

    private final ToolSpecification specification = ToolSpecification.builder()
            .name(TOOL_NAME)
            .description("Read a file from the virtual filesystem. Lines are returned with 1-based line numbers. "
                    + "Use offset and limit to page through long files; lines longer than "
                    + VirtualFileSystem.MAX_LINE_LENGTH + " characters are truncated.")
            .parameters(JsonObjectSchema.builder()
                    .addStringProperty("file_path", "Absolute path to the file to read")
                    .addIntegerProperty("offset", "Line offset to start reading from (default 0)")
                    .addIntegerProperty("limit", "Maximum number of lines to read (default "
                            + VirtualFileSystem.DEFAULT_READ_LIMIT + ")")
                    .required("file_path")
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
            int offset = arguments.optionalInt("offset", 0);
            int limit = arguments.optionalInt("limit", VirtualFileSystem.DEFAULT_READ_LIMIT);
            return ToolResult.message(VirtualFileSystem.read(invocation.state().files(), path, offset, limit));
        } catch (WorkspaceToolException ex) {
            return ToolResult.error(ex);
        }
    }
}
