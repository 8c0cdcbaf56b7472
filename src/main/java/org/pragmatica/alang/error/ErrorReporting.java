package org.pragmatica.alang.error;
/**
 * Controls how a failed parse is reported.
 */
public enum ErrorReporting {
    /**
     * Single line: {@code input:line:column: error: message (label)}, for example
     * {@code input:3:15: error: unexpected '<' (comparisons do not chain)}.
     */
    BASIC,
    /**
     * Rust-style report with source excerpt and underline.
     *
     * <p>Example output:
     * <pre>
     * error[E0001]: unexpected '&lt;'
     *   --> input:3:15
     *   |
     * 3 |     if (a &lt; b &lt; c) {
     *   |           -   ^ comparisons do not chain
     *   |           |
     *   |           first comparison
     *   |
     *   = help: parenthesize one of the comparisons
     * </pre>
     * Falls back to {@link #BASIC} when the source text is not available.
     */
    ADVANCED
}
