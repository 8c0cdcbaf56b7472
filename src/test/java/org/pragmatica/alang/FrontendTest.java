package org.pragmatica.alang;

import org.junit.jupiter.api.Test;
import org.pragmatica.alang.ast.ProgramNode;
import org.pragmatica.alang.error.ErrorReporting;
import org.pragmatica.alang.error.ParseError;
import org.pragmatica.alang.lexer.Lexer;
import org.pragmatica.alang.parser.ParseResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrontendTest {

    @Test
    void create_usesDefaultConfig() {
        assertThat(Frontend.create().config()).isEqualTo(FrontendConfig.DEFAULT);
        assertThat(FrontendConfig.DEFAULT.indentUnit()).isEqualTo("\t");
        assertThat(FrontendConfig.DEFAULT.errorReporting()).isEqualTo(ErrorReporting.BASIC);
    }

    @Test
    void parse_validSource_succeeds() {
        var result = Frontend.create().parse("x: int = 5;");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.unwrap().globals()).hasSize(1);
    }

    @Test
    void parse_basicReporting_singleLineWithExpectedContext() {
        var result = Frontend.create().parse("x int;");

        assertThat(result.isFailure()).isTrue();
        var failure = (ParseResult.Failure<ProgramNode>) result;
        assertThat(failure.error()).isInstanceOf(ParseError.UnexpectedToken.class);
        assertThat(failure.report()).isEqualTo("input:1:3: error: unexpected 'int' (expected ':')");
    }

    @Test
    void parse_basicReporting_namesFile() {
        var failure = (ParseResult.Failure<ProgramNode>) Frontend.create().parse("x int;", "main.a");

        assertThat(failure.report()).startsWith("main.a:1:3: error:");
    }

    @Test
    void parse_advancedReporting_showsSourceExcerpt() {
        var frontend = Frontend.builder()
                               .errorReporting(ErrorReporting.ADVANCED)
                               .build();

        var failure = (ParseResult.Failure<ProgramNode>) frontend.parse("x int;");

        assertThat(failure.report()).isEqualTo("""
            error[E0001]: unexpected 'int'
              --> input:1:3
              |
            1 | x int;
              |   ^^^ expected ':'
              |
            """);
    }

    @Test
    void parse_advancedReporting_lexicalErrorHasHelp() {
        var frontend = Frontend.builder()
                               .errorReporting(ErrorReporting.ADVANCED)
                               .build();

        var failure = (ParseResult.Failure<ProgramNode>) frontend.parse("a: int;\nb: int = 1 $ 2;", "prog.a");

        assertThat(failure.error()).isInstanceOf(ParseError.LexicalError.class);
        assertThat(failure.report())
            .startsWith("error[E0003]: Illegal character: $\n  --> prog.a:2:12\n")
            .contains("2 | b: int = 1 $ 2;")
            .contains("= help:");
    }

    @Test
    void parse_inputAboveLimit_rejected() {
        var frontend = Frontend.builder()
                               .maxInputSize(4)
                               .build();

        assertThatThrownBy(() -> frontend.parse("x: int;")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_tokenSource_fromReferenceLexer() {
        var result = Frontend.create().parse(Lexer.of("f: () -> void { }"));

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void unparse_usesConfiguredIndent() {
        var frontend = Frontend.builder()
                               .indent("    ")
                               .build();

        var text = frontend.canonicalize("f: () -> void { x++; }").unwrap();

        assertThat(text).isEqualTo("f: () -> void {\n    x++;\n}\n");
    }

    @Test
    void canonicalize_failure_keepsError() {
        var result = Frontend.create().canonicalize("f: () -> void { a < b < c; }");

        assertThat(result.isFailure()).isTrue();
        assertThat(result.value()).isEmpty();
    }

    @Test
    void parse_advancedReporting_chainedComparisonPointsAtBothOperators() {
        var frontend = Frontend.builder()
                               .errorReporting(ErrorReporting.ADVANCED)
                               .build();

        var failure = (ParseResult.Failure<ProgramNode>) frontend.parse("f: () -> void {\n    if (a < b < c) {\n    }\n}");

        assertThat(failure.error()).isInstanceOf(ParseError.ChainedComparison.class);
        assertThat(failure.report()).isEqualTo(
            "error[E0001]: unexpected '<'\n"
            + "  --> input:2:15\n"
            + "  |\n"
            + "2 |     if (a < b < c) {\n"
            + "  | " + " ".repeat(10) + "-   ^ comparisons do not chain\n"
            + "  | " + " ".repeat(10) + "|\n"
            + "  | " + " ".repeat(10) + "first comparison\n"
            + "  |\n"
            + "  = help: parenthesize one of the comparisons\n");
    }

    @Test
    void parse_deepNesting_failsWithinConfiguredLimit() {
        var frontend = Frontend.builder()
                               .maxNestingDepth(8)
                               .build();

        assertThat(frontend.parse("x: int = ((((((1))))));").isSuccess()).isTrue();

        var failure = (ParseResult.Failure<ProgramNode>) frontend.parse("x: int = (((((((((1)))))))));");
        assertThat(failure.error()).isInstanceOf(ParseError.NestingTooDeep.class);
        assertThat(failure.report()).isEqualTo("input:1:18: error: nesting too deep (more than 8 levels)");
    }

    @Test
    void parse_deepNestingFarBelowInputLimit_returnsFailure() {
        var source = "x: int = " + "(".repeat(20_000) + "1" + ")".repeat(20_000) + ";";

        var result = Frontend.create().parse(source);

        assertThat(result.isFailure()).isTrue();
        var failure = (ParseResult.Failure<ProgramNode>) result;
        assertThat(failure.error().code()).isEqualTo("E0004");
    }

    @Test
    void config_rejectsNonPositiveNestingDepth() {
        assertThatThrownBy(() -> Frontend.builder().maxNestingDepth(0).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void config_rejectsNonPositiveInputSize() {
        assertThatThrownBy(() -> new FrontendConfig(0, "\t", ErrorReporting.BASIC, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
