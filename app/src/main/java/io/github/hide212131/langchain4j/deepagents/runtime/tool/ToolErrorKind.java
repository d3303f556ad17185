package io.github.hide212131.langchain4j.deepagents.runtime.tool;

/**
 * Categories of failures reported back to the model as tool-result text.
 */
public enum ToolErrorKind {
    /** Missing file path or unregistered sub-agent name. */
    NOT_FOUND,
    /** Edit target occurs more than once and replace_all was not requested. */
    AMBIGUOUS_MATCH,
    /** Read offset at or beyond the end of the file. */
    RANGE_ERROR,
    /** Arguments that are missing, malformed or of the wrong type. */
    INVALID_ARGUMENT,
    /** A nested sub-agent run failed. */
    DELEGATION_FAILURE
}
