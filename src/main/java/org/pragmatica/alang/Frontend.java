package org.pragmatica.alang;

import org.pragmatica.alang.ast.AstNode;
import org.pragmatica.alang.ast.ProgramNode;
import org.pragmatica.alang.error.ErrorReporting;
import org.pragmatica.alang.lexer.Lexer;
import org.pragmatica.alang.lexer.TokenSource;
import org.pragmatica.alang.parser.ParseResult;
import org.pragmatica.alang.parser.Parser;
import org.pragmatica.alang.unparse.Unparser;

/**
 * Entry point of the a-lang front end: source text to AST and back.
 *
 * <p>Example usage:
 * <pre>{@code
 * var frontend = Frontend.create();
 * var result = frontend.parse("""
 *     main : () -> void {
 *         toconsole 2 + 3 * 4;
 *     }
 *     """);
 *
 * var text = frontend.unparse(result.unwrap());
 * }</pre>
 *
 * <p>Instances hold only configuration; every call uses a fresh lexer and parser.
 */
public final class Frontend {
    private final FrontendConfig config;
    private final Unparser unparser;

    private Frontend(FrontendConfig config) {
        this.config = config;
        this.unparser = Unparser.withIndent(config.indentUnit());
    }

    public static Frontend create() {
        return create(FrontendConfig.DEFAULT);
    }

    public static Frontend create(FrontendConfig config) {
        return new Frontend(config);
    }

    /**
     * Create a builder for more complex front end configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public FrontendConfig config() {
        return config;
    }

    /**
     * Scan and parse source text. Failure reports are named after {@code input}.
     */
    public ParseResult<ProgramNode> parse(String source) {
        return parse(source, null);
    }

    /**
     * Scan and parse source text, naming {@code filename} in failure reports.
     */
    public ParseResult<ProgramNode> parse(String source, String filename) {
        var result = Parser.parse(Lexer.of(source, config.maxInputSize()), config.maxNestingDepth());
        if (result instanceof ParseResult.Failure<ProgramNode> failure) {
            var diagnostic = failure.error().toDiagnostic();
            var report = config.errorReporting() == ErrorReporting.ADVANCED
                         ? diagnostic.format(source, filename)
                         : filename == null ? diagnostic.formatSimple() : diagnostic.formatSimple(filename);
            return failure.withReport(report);
        }
        return result;
    }

    /**
     * Parse tokens supplied by any scanner. Reports are single-line, the source text being unknown.
     */
    public ParseResult<ProgramNode> parse(TokenSource tokens) {
        return Parser.parse(tokens, config.maxNestingDepth());
    }

    /**
     * Canonical text of a tree.
     */
    public String unparse(AstNode node) {
        return unparser.render(node);
    }

    /**
     * Parse, then unparse: the canonical form of {@code source}.
     */
    public ParseResult<String> canonicalize(String source) {
        return parse(source).map(unparser::render);
    }

    public static final class Builder {
        private int maxInputSize = FrontendConfig.DEFAULT.maxInputSize();
        private String indentUnit = FrontendConfig.DEFAULT.indentUnit();
        private ErrorReporting errorReporting = FrontendConfig.DEFAULT.errorReporting();
        private int maxNestingDepth = FrontendConfig.DEFAULT.maxNestingDepth();

        private Builder() {}

        public Builder maxInputSize(int size) {
            this.maxInputSize = size;
            return this;
        }

        public Builder indent(String unit) {
            this.indentUnit = unit;
            return this;
        }

        public Builder errorReporting(ErrorReporting reporting) {
            this.errorReporting = reporting;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Frontend build() {
            return create(new FrontendConfig(maxInputSize, indentUnit, errorReporting, maxNestingDepth));
        }
    }
}
