package org.pragmatica.alang.error;

import org.pragmatica.alang.tree.Position;

/**
 * Fatal syntax error with location and expected-token context.
 */
public sealed interface ParseError {
    Position position();

    String message();

    /**
     * Stable error code shown in diagnostics.
     */
    String code();

    default Diagnostic toDiagnostic() {
        return Diagnostic.error(code(), message(), position());
    }

    /**
     * Token that no grammar production accepts at this point.
     */
    record UnexpectedToken(
    Position position,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "syntax error: unexpected " + found + " at " + position.span() + ", expected " + expected;
        }

        @Override
        public String code() {
            return "E0001";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(code(), "unexpected " + found, position)
                             .withLabel("expected " + expected);
        }
    }

    /**
     * Second comparison right after a first one at the same level, as in {@code a < b < c}.
     *
     * @param first span of the first comparison operator
     */
    record ChainedComparison(
    Position position,
    String found,
    Position first) implements ParseError {
        @Override
        public String message() {
            return "syntax error: unexpected " + found + " at " + position.span()
                   + ", expected ')', ';' or a non-comparison operator (comparisons do not chain)";
        }

        @Override
        public String code() {
            return "E0001";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(code(), "unexpected " + found, position)
                             .withLabel("comparisons do not chain")
                             .withSecondaryLabel(first, "first comparison")
                             .withHelp("parenthesize one of the comparisons");
        }
    }

    /**
     * Input ended while a production was still open.
     */
    record UnexpectedEof(
    Position position,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "syntax error: unexpected end of input at " + position.span() + ", expected " + expected;
        }

        @Override
        public String code() {
            return "E0002";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(code(), "unexpected end of input", position)
                             .withLabel("expected " + expected);
        }
    }

    /**
     * Malformed token reported by the scanner.
     */
    record LexicalError(
    Position position,
    String reason) implements ParseError {
        @Override
        public String message() {
            return "syntax error: " + reason + " at " + position.span();
        }

        @Override
        public String code() {
            return "E0003";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(code(), reason, position)
                             .withHelp("the scanner could not turn this text into a token");
        }
    }

    /**
     * Parentheses, unary operators, call arguments or blocks nested past the configured limit.
     */
    record NestingTooDeep(
    Position position,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "syntax error: nesting deeper than " + limit + " levels at " + position.span();
        }

        @Override
        public String code() {
            return "E0004";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(code(), "nesting too deep", position)
                             .withLabel("more than " + limit + " levels")
                             .withHelp("split the expression or raise maxNestingDepth");
        }
    }
}
