package org.pragmatica.alang.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.alang.tree.Position;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    @Test
    void format_unexpectedToken_underlinesTokenWithExpectation() {
        var error = new ParseError.UnexpectedToken(Position.of(1, 3, 1, 6), "'int'", "':'");

        assertThat(error.toDiagnostic().format("x int;", null)).isEqualTo("""
            error[E0001]: unexpected 'int'
              --> input:1:3
              |
            1 | x int;
              |   ^^^ expected ':'
              |
            """);
    }

    @Test
    void formatSimple_includesPrimaryLabel() {
        var error = new ParseError.UnexpectedToken(Position.of(1, 3, 1, 6), "'int'", "':'");

        assertThat(error.toDiagnostic().formatSimple()).isEqualTo("input:1:3: error: unexpected 'int' (expected ':')");
        assertThat(error.toDiagnostic().formatSimple("a.a")).startsWith("a.a:1:3:");
    }

    @Test
    void format_widensGutterForLaterLines() {
        var source = "a\nb\nc\nd\ne\nf\ng\nh\ni\nlast: int = @;";
        var diagnostic = Diagnostic.error("E0003", "bad", Position.of(10, 13, 10, 14));

        var text = diagnostic.format(source, "f.a");

        assertThat(text).startsWith("error[E0003]: bad\n  --> f.a:10:13\n");
        assertThat(text).contains("10 | last: int = @;\n");
        assertThat(text).contains("   | " + " ".repeat(12) + "^\n");
    }

    @Test
    void format_secondaryLabelAndNotes() {
        var diagnostic = Diagnostic.error("E9", "mismatch", Position.of(1, 5, 1, 6))
                                   .withLabel("here")
                                   .withSecondaryLabel(Position.of(1, 1, 1, 2), "opened")
                                   .withNote("note text")
                                   .withHelp("try again");

        var text = diagnostic.format("( a b", null);

        assertThat(text).isEqualTo("""
            error[E9]: mismatch
              --> input:1:5
              |
            1 | ( a b
              | -   ^ here
              | |
              | opened
              |
              = note text
              = help: try again
            """);
    }

    @Test
    void format_twoHangingLabels_nestPipes() {
        var diagnostic = Diagnostic.error("E9", "third", Position.of(1, 9, 1, 10))
                                   .withLabel("here")
                                   .withSecondaryLabel(Position.of(1, 1, 1, 2), "one")
                                   .withSecondaryLabel(Position.of(1, 5, 1, 6), "two");

        var text = diagnostic.format("a + b + c", null);

        assertThat(text).contains("""
              | -   -   ^ here
              | |   |
              | |   two
              | |
              | one
            """);
    }

    @Test
    void chainedComparison_labelsBothOperators() {
        var error = new ParseError.ChainedComparison(Position.of(1, 7, 1, 8), "'<'", Position.of(1, 3, 1, 4));

        var diagnostic = error.toDiagnostic();

        assertThat(diagnostic.labels()).extracting(Diagnostic.Label::primary).containsExactly(true, false);
        assertThat(diagnostic.formatSimple()).isEqualTo("input:1:7: error: unexpected '<' (comparisons do not chain)");
    }

    @Test
    void nestingTooDeep_hasOwnCode() {
        var error = new ParseError.NestingTooDeep(Position.of(1, 5, 1, 6), 4);

        assertThat(error.code()).isEqualTo("E0004");
        assertThat(error.message()).isEqualTo("syntax error: nesting deeper than 4 levels at [1,5]-[1,6]");
    }

    @Test
    void lexicalError_carriesHelp() {
        var error = new ParseError.LexicalError(Position.of(2, 1, 2, 2), "Illegal character: @");

        assertThat(error.code()).isEqualTo("E0003");
        assertThat(error.message()).isEqualTo("syntax error: Illegal character: @ at [2,1]-[2,2]");
        assertThat(error.toDiagnostic().notes()).singleElement().asString().startsWith("help:");
    }

    @Test
    void unexpectedEof_message() {
        var error = new ParseError.UnexpectedEof(Position.of(1, 8, 1, 8), "'}'");

        assertThat(error.code()).isEqualTo("E0002");
        assertThat(error.message()).isEqualTo("syntax error: unexpected end of input at [1,8]-[1,8], expected '}'");
    }
}
