package io.github.hide212131.langchain4j.deepagents.runtime.filesystem;

import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolErrorKind;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceToolException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pure operations over the flat {@code path -> content} map held in the workspace.
 * <p>
 * Nothing here touches a real disk. Mutating operations return only the changed entry; the caller merges it
 * into the workspace through the files reducer, so two writes to different paths in the same turn combine
 * and writes to the same path resolve to the last one applied.
 */
public final class VirtualFileSystem {

    public static final int DEFAULT_READ_LIMIT = 2000;
    public static final int MAX_LINE_LENGTH = 2000;
    public static final String EMPTY_FILE_REMINDER = "System reminder: File exists but has empty contents";
    private static final int LINE_NUMBER_WIDTH = 6;

    private VirtualFileSystem() {
    }

    public static List<String> list(Map<String, String> files) {
        return files == null ? List.of() : List.copyOf(files.keySet());
    }

    /**
     * Renders lines {@code [offset, offset + limit)} in {@code cat -n} style: a right-aligned 1-based line
     * number, a tab, then the line cut at {@value #MAX_LINE_LENGTH} characters.
     */
    public static String read(Map<String, String> files, String path, int offset, int limit) {
        String content = existing(files, path);
        if (offset < 0) {
            throw WorkspaceToolException.invalidArgument("offset must not be negative: " + offset);
        }
        if (limit <= 0) {
            throw WorkspaceToolException.invalidArgument("limit must be positive: " + limit);
        }
        if (content.isBlank()) {
            return EMPTY_FILE_REMINDER;
        }
        String[] lines = content.split("\n", -1);
        if (offset >= lines.length) {
            throw new WorkspaceToolException(
                    ToolErrorKind.RANGE_ERROR,
                    "Line offset " + offset + " exceeds file length (" + lines.length + " lines)");
        }
        int end = (int) Math.min((long) offset + limit, lines.length);
        StringBuilder rendered = new StringBuilder();
        for (int i = offset; i < end; i++) {
            String line = lines[i];
            if (line.length() > MAX_LINE_LENGTH) {
                line = line.substring(0, MAX_LINE_LENGTH);
            }
            if (i > offset) {
                rendered.append('\n');
            }
            rendered.append(String.format("%" + LINE_NUMBER_WIDTH + "d", i + 1)).append('\t').append(line);
        }
        return rendered.toString();
    }

    /** Creates or overwrites {@code path}; returns the single-entry update. */
    public static Map<String, String> write(String path, String content) {
        requireAbsolute(path);
        Objects.requireNonNull(content, "content");
        return Map.of(path, content);
    }

    /**
     * Literal (non-regex) string replacement inside one file. Without {@code replaceAll} the target must occur
     * exactly once.
     */
    public static Map<String, String> edit(
            Map<String, String> files, String path, String oldString, String newString, boolean replaceAll) {
        String content = existing(files, path);
        Objects.requireNonNull(newString, "newString");
        if (oldString == null || oldString.isEmpty()) {
            throw WorkspaceToolException.invalidArgument("old_string must not be empty");
        }
        int occurrences = countOccurrences(content, oldString);
        if (occurrences == 0) {
            throw WorkspaceToolException.notFound("String not found in file: '" + oldString + "'");
        }
        String updated;
        if (replaceAll) {
            updated = content.replace(oldString, newString);
        } else {
            if (occurrences > 1) {
                throw new WorkspaceToolException(
                        ToolErrorKind.AMBIGUOUS_MATCH,
                        "String '" + oldString + "' appears " + occurrences + " times in file. "
                                + "Use replace_all=true to replace all instances, "
                                + "or provide a more specific string with surrounding context.");
            }
            int index = content.indexOf(oldString);
            updated = content.substring(0, index) + newString + content.substring(index + oldString.length());
        }
        return Map.of(path, updated);
    }

    static int countOccurrences(String content, String target) {
        int count = 0;
        int from = 0;
        while (true) {
            int index = content.indexOf(target, from);
            if (index < 0) {
                return count;
            }
            count++;
            from = index + target.length();
        }
    }

    private static String existing(Map<String, String> files, String path) {
        if (path == null || files == null || !files.containsKey(path)) {
            throw WorkspaceToolException.notFound("File '" + path + "' not found");
        }
        String content = files.get(path);
        return content == null ? "" : content;
    }

    private static void requireAbsolute(String path) {
        if (path == null || path.isBlank()) {
            throw WorkspaceToolException.invalidArgument("file_path must not be empty");
        }
        if (!path.startsWith("/")) {
            throw WorkspaceToolException.invalidArgument("file_path must be an absolute path: '" + path + "'");
        }
    }
}
