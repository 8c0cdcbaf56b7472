package org.pragmatica.alang.unparse;

/**
 * How a statement is rendered.
 */
public enum RenderMode {
    /**
     * On its own line: leading indentation, terminating {@code ;} and newline.
     */
    STANDALONE,
    /**
     * As a clause of a larger construct: no indentation and no terminator.
     * Supported by call, increment, decrement and maybe statements only.
     */
    EMBEDDED
}
