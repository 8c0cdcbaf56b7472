package org.pragmatica.alang;

import org.pragmatica.alang.error.ErrorReporting;
import org.pragmatica.alang.lexer.Lexer;
import org.pragmatica.alang.parser.Parser;
import org.pragmatica.alang.unparse.Unparser;

import java.util.Objects;

/**
 * Front end configuration options.
 *
 * @param maxInputSize    largest source text, in characters, the lexer accepts
 * @param indentUnit      text emitted per nesting level when unparsing
 * @param errorReporting  how failures are rendered into their report
 * @param maxNestingDepth deepest nesting of parentheses, unary operators, call arguments and blocks
 */
public record FrontendConfig(
    int maxInputSize,
    String indentUnit,
    ErrorReporting errorReporting,
    int maxNestingDepth
) {
    public static final FrontendConfig DEFAULT = new FrontendConfig(
        Lexer.DEFAULT_MAX_INPUT_SIZE,
        Unparser.DEFAULT_INDENT,
        ErrorReporting.BASIC,
        Parser.DEFAULT_MAX_NESTING_DEPTH
    );

    public FrontendConfig {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive, got " + maxInputSize);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        Objects.requireNonNull(indentUnit, "indentUnit");
        Objects.requireNonNull(errorReporting, "errorReporting");
    }
}
