package org.pragmatica.alang.unparse;

import org.junit.jupiter.api.Test;
import org.pragmatica.alang.ast.BinaryOp;
import org.pragmatica.alang.ast.Decl;
import org.pragmatica.alang.ast.Exp;
import org.pragmatica.alang.ast.ProgramNode;
import org.pragmatica.alang.ast.Stmt;
import org.pragmatica.alang.ast.TypeNode;
import org.pragmatica.alang.ast.UnaryOp;
import org.pragmatica.alang.lexer.Lexer;
import org.pragmatica.alang.parser.Parser;
import org.pragmatica.alang.tree.Position;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnparserTest {

    private static final Position POS = Position.of(1, 1, 1, 2);

    @Test
    void unparse_whileBody_indentedOneLevelDeeper() {
        var text = Unparser.unparse(parse("main: () -> void { while (true) { x++; } }"));

        assertThat(text).isEqualTo("""
            main: () -> void {
            \twhile (true) {
            \t\tx++;
            \t}
            }
            """);
    }

    @Test
    void unparse_varDecls() {
        assertThat(Unparser.unparse(parse("x: int; y : bool = true;")))
            .isEqualTo("x: int;\ny: bool = true;\n");
    }

    @Test
    void unparse_class_membersIndented() {
        var text = Unparser.unparse(parse("P: custom { x: int; f: (a: int) -> void { } }"));

        assertThat(text).isEqualTo("P: custom {\n\tx: int;\n\tf: (a: int) -> void {\n\t}\n};\n");
    }

    @Test
    void unparse_function_formalsAndReturnType() {
        var text = Unparser.unparse(parse("f: (a: int, b: immutable ref P) -> bool { return a; }"));

        assertThat(text).isEqualTo("f: (a: int, b: immutable ref P) -> bool {\n\treturn a;\n}\n");
    }

    @Test
    void unparse_nestedOperators_parenthesized() {
        assertThat(Unparser.unparse(parse("x: int = 2 + 3 * 4;"))).isEqualTo("x: int = 2 + (3 * 4);\n");
        assertThat(Unparser.unparse(parse("x: bool = !a * b;"))).isEqualTo("x: bool = (!a) * b;\n");
        assertThat(Unparser.unparse(parse("x: int = - -y;"))).isEqualTo("x: int = -(-y);\n");
        assertThat(Unparser.unparse(parse("x: int = (a - b) - c;"))).isEqualTo("x: int = (a - b) - c;\n");
    }

    @Test
    void unparse_callArguments_notParenthesized() {
        assertThat(Unparser.unparse(parse("x: int = f(a + 1, g(), b->c);")))
            .isEqualTo("x: int = f(a + 1, g(), b->c);\n");
    }

    @Test
    void unparse_ifElse() {
        var text = Unparser.unparse(parse("main: () -> void { if (a and b) { x = 1; } else { x--; } }"));

        assertThat(text).isEqualTo("""
            main: () -> void {
            \tif (a and b) {
            \t\tx = 1;
            \t} else {
            \t\tx--;
            \t}
            }
            """);
    }

    @Test
    void unparse_simpleStatements() {
        var text = Unparser.unparse(parse("""
            main: () -> void {
                fromconsole p->x;
                toconsole "a\\"b";
                maybe x means eh? otherwise false;
                return;
            }
            """));

        assertThat(text).isEqualTo("""
            main: () -> void {
            \tfromconsole p->x;
            \ttoconsole "a\\"b";
            \tmaybe x means eh? otherwise false;
            \treturn;
            }
            """);
    }

    @Test
    void unparse_stringLiteral_reescaped() {
        var lit = new Exp.StrLit(POS, "tab\there\nquote\"slash\\");

        assertThat(Unparser.unparse(lit)).isEqualTo("\"tab\\there\\nquote\\\"slash\\\\\"");
    }

    @Test
    void unparse_emptyProgram_isEmptyText() {
        assertThat(Unparser.unparse(ProgramNode.of(List.of()))).isEmpty();
    }

    @Test
    void unparse_types() {
        var type = new TypeNode.ImmutableType(POS, new TypeNode.RefType(POS, new TypeNode.VoidType(POS)));

        assertThat(Unparser.unparse(type)).isEqualTo("immutable ref void");
    }

    @Test
    void renderStatement_embedded_omitsIndentAndTerminator() {
        var unparser = Unparser.create();
        var x = new Exp.IdNode(POS, "x");
        var call = new Stmt.CallStmt(POS, new Exp.CallExp(POS, new Exp.IdNode(POS, "f"),
                                                          List.of(new Exp.IntLit(POS, 1))));

        assertThat(unparser.renderStatement(call, 2, RenderMode.EMBEDDED)).isEqualTo("f(1)");
        assertThat(unparser.renderStatement(call, 2, RenderMode.STANDALONE)).isEqualTo("\t\tf(1);\n");
        assertThat(unparser.renderStatement(new Stmt.PostInc(POS, x), 3, RenderMode.EMBEDDED)).isEqualTo("x++");
        assertThat(unparser.renderStatement(new Stmt.PostDec(POS, x), 3, RenderMode.EMBEDDED)).isEqualTo("x--");

        var maybe = new Stmt.Maybe(POS, x, new Exp.TrueLit(POS), new Exp.FalseLit(POS));
        assertThat(unparser.renderStatement(maybe, 1, RenderMode.EMBEDDED))
            .isEqualTo("maybe x means true otherwise false");
        assertThat(unparser.renderStatement(maybe, 1, RenderMode.STANDALONE))
            .isEqualTo("\tmaybe x means true otherwise false;\n");
    }

    @Test
    void renderStatement_embeddedUnsupportedKind_rejected() {
        var assign = new Stmt.Assign(POS, new Exp.IdNode(POS, "x"), new Exp.IntLit(POS, 1));

        assertThat(Unparser.embeddable(assign)).isFalse();
        assertThatThrownBy(() -> Unparser.create().renderStatement(assign, 0, RenderMode.EMBEDDED))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Assign");
    }

    @Test
    void withIndent_usesGivenUnit() {
        var program = parse("main: () -> void { while (a) { x++; } }");

        assertThat(Unparser.withIndent("  ").render(program))
            .isEqualTo("main: () -> void {\n  while (a) {\n    x++;\n  }\n}\n");
    }

    @Test
    void withIndent_nonWhitespace_rejected() {
        assertThatThrownBy(() -> Unparser.withIndent("x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Unparser.withIndent("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unparse_handBuiltTree() {
        var x = new Exp.IdNode(POS, "x");
        var sum = new Exp.Binary(POS, BinaryOp.PLUS, x, new Exp.Unary(POS, UnaryOp.NEG, new Exp.IntLit(POS, 1)));
        var decl = new Decl.VarDecl(POS, x, new TypeNode.IntType(POS), Optional.of(sum));

        assertThat(Unparser.unparse(decl)).isEqualTo("x: int = x + (-1);\n");
    }

    private static ProgramNode parse(String source) {
        return Parser.parse(Lexer.of(source)).unwrap();
    }
}
