package io.github.hide212131.langchain4j.deepagents.runtime.filesystem;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.deepagents.runtime.state.WorkspaceReducers;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.ToolErrorKind;
import io.github.hide212131.langchain4j.deepagents.runtime.tool.WorkspaceToolException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class VirtualFileSystemTest {

    private static final Map<String, String> FILES = Map.of("/a.txt", "l1\nl2\nl3");

    @Test
    @DisplayName("行番号付きで指定範囲の行を返す")
    void readRendersNumberedLines() {
        assertThat(VirtualFileSystem.read(FILES, "/a.txt", 0, 2)).isEqualTo("     1\tl1\n     2\tl2");
        assertThat(VirtualFileSystem.read(FILES, "/a.txt", 2, 10)).isEqualTo("     3\tl3");
    }

    @Test
    void readWithDefaultLimitReturnsWholeFile() {
        String rendered = VirtualFileSystem.read(FILES, "/a.txt", 0, VirtualFileSystem.DEFAULT_READ_LIMIT);

        assertThat(rendered.split("\n")).hasSize(3);
    }

    @Test
    void readBeyondEndIsRangeError() {
        assertThatThrownBy(() -> VirtualFileSystem.read(FILES, "/a.txt", 5, 2))
                .isInstanceOfSatisfying(WorkspaceToolException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(ToolErrorKind.RANGE_ERROR))
                .hasMessage("Line offset 5 exceeds file length (3 lines)");
        assertThatThrownBy(() -> VirtualFileSystem.read(FILES, "/a.txt", 3, 1))
                .isInstanceOf(WorkspaceToolException.class);
    }

    @Test
    void readMissingFileIsNotFound() {
        assertThatThrownBy(() -> VirtualFileSystem.read(FILES, "/missing.txt", 0, 10))
                .isInstanceOfSatisfying(WorkspaceToolException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(ToolErrorKind.NOT_FOUND))
                .hasMessage("File '/missing.txt' not found");
    }

    @Test
    void readEmptyOrBlankFileReturnsReminder() {
        Map<String, String> files = Map.of("/empty", "", "/blank", "  \n ");

        assertThat(VirtualFileSystem.read(files, "/empty", 0, 10)).isEqualTo(VirtualFileSystem.EMPTY_FILE_REMINDER);
        assertThat(VirtualFileSystem.read(files, "/blank", 3, 10)).isEqualTo(VirtualFileSystem.EMPTY_FILE_REMINDER);
    }

    @Test
    void readTruncatesLongLines() {
        String longLine = "x".repeat(VirtualFileSystem.MAX_LINE_LENGTH + 50);

        String rendered = VirtualFileSystem.read(Map.of("/long", longLine), "/long", 0, 1);

        assertThat(rendered).isEqualTo("     1\t" + "x".repeat(VirtualFileSystem.MAX_LINE_LENGTH));
    }

    @Test
    void readRejectsNegativeOffsetAndNonPositiveLimit() {
        assertThatThrownBy(() -> VirtualFileSystem.read(FILES, "/a.txt", -1, 2))
                .isInstanceOfSatisfying(WorkspaceToolException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(ToolErrorKind.INVALID_ARGUMENT));
        assertThatThrownBy(() -> VirtualFileSystem.read(FILES, "/a.txt", 0, 0))
                .isInstanceOf(WorkspaceToolException.class);
    }

    @Test
    void writeThenReadRoundTripsThroughReducer() {
        Map<String, String> files = WorkspaceReducers.mergeFiles(Map.of(), VirtualFileSystem.write("/a.txt", "l1\nl2\nl3"));

        assertThat(files).containsOnly(Map.entry("/a.txt", "l1\nl2\nl3"));
        assertThat(VirtualFileSystem.read(files, "/a.txt", 0, 2)).isEqualTo("     1\tl1\n     2\tl2");
    }

    @Test
    void writeRequiresAbsolutePath() {
        assertThatThrownBy(() -> VirtualFileSystem.write("notes.txt", "x"))
                .isInstanceOfSatisfying(WorkspaceToolException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(ToolErrorKind.INVALID_ARGUMENT));
    }

    @Test
    void editReplacesSingleOccurrence() {
        Map<String, String> update = VirtualFileSystem.edit(Map.of("/f", "hello world"), "/f", "world", "java", false);

        assertThat(update).containsOnly(Map.entry("/f", "hello java"));
    }

    @Test
    @DisplayName("複数一致で replace_all=false の場合はファイルを変更しない")
    void ambiguousEditLeavesFilesUnchanged() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("/f", "a-a-a");

        assertThatThrownBy(() -> VirtualFileSystem.edit(files, "/f", "a", "b", false))
                .isInstanceOfSatisfying(WorkspaceToolException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(ToolErrorKind.AMBIGUOUS_MATCH))
                .hasMessageStartingWith("String 'a' appears 3 times in file.");
        assertThat(files).containsOnly(Map.entry("/f", "a-a-a"));
    }

    @Test
    void replaceAllReplacesEveryOccurrence() {
        Map<String, String> update = VirtualFileSystem.edit(Map.of("/f", "a-a-a"), "/f", "a", "bb", true);

        assertThat(update.get("/f")).isEqualTo("bb-bb-bb");
        assertThat(VirtualFileSystem.countOccurrences(update.get("/f"), "a")).isZero();
    }

    @Test
    void editMatchesLiterallyNotAsRegex() {
        Map<String, String> update = VirtualFileSystem.edit(Map.of("/f", "price: $1.00 (a+b)"), "/f", "$1.00 (a+b)",
                "$2", false);

        assertThat(update.get("/f")).isEqualTo("price: $2");
    }

    @Test
    void editReportsMissingPathAndMissingString() {
        assertThatThrownBy(() -> VirtualFileSystem.edit(Map.of(), "/f", "a", "b", false))
                .isInstanceOfSatisfying(WorkspaceToolException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(ToolErrorKind.NOT_FOUND));
        assertThatThrownBy(() -> VirtualFileSystem.edit(Map.of("/f", "abc"), "/f", "zzz", "b", true))
                .isInstanceOfSatisfying(WorkspaceToolException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(ToolErrorKind.NOT_FOUND))
                .hasMessage("String not found in file: 'zzz'");
    }

    @Test
    void countOccurrencesIsNonOverlapping() {
        assertThat(VirtualFileSystem.countOccurrences("aaaa", "aa")).isEqualTo(2);
        assertThat(VirtualFileSystem.countOccurrences("abc", "d")).isZero();
    }

    @Test
    void listKeepsInsertionOrder() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("/b", "");
        files.put("/a", "");

        assertThat(VirtualFileSystem.list(files)).containsExactly("/b", "/a");
        assertThat(VirtualFileSystem.list(null)).isEmpty();
    }
}
