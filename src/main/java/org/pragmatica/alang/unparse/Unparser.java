package org.pragmatica.alang.unparse;

import org.pragmatica.alang.ast.AstNode;
import org.pragmatica.alang.ast.Decl;
import org.pragmatica.alang.ast.Exp;
import org.pragmatica.alang.ast.ProgramNode;
import org.pragmatica.alang.ast.Stmt;
import org.pragmatica.alang.ast.TypeNode;

import java.util.List;
import java.util.Objects;

/**
 * Renders a tree back to canonical a-lang text.
 *
 * <p>Output re-parses to a structurally identical tree: operator and keyword spelling is canonical,
 * and binary or unary expressions used as operands are always parenthesized, so operator nesting
 * never depends on precedence. Each nesting level adds one indentation unit.
 */
public final class Unparser {
    public static final String DEFAULT_INDENT = "\t";

    private static final Unparser DEFAULT = new Unparser(DEFAULT_INDENT);

    private final String indentUnit;

    private Unparser(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public static Unparser create() {
        return DEFAULT;
    }

    public static Unparser withIndent(String indentUnit) {
        Objects.requireNonNull(indentUnit, "indentUnit");
        if (!indentUnit.isBlank() || indentUnit.isEmpty()) {
            throw new IllegalArgumentException("Indentation unit must be non-empty whitespace");
        }
        return new Unparser(indentUnit);
    }

    /**
     * Render with the default indentation unit.
     */
    public static String unparse(AstNode node) {
        return DEFAULT.render(node);
    }

    /**
     * Render any node at indentation level zero.
     */
    public String render(AstNode node) {
        var out = new StringBuilder();
        render(node, out, 0);
        return out.toString();
    }

    public void render(AstNode node, StringBuilder out, int indent) {
        if (node instanceof ProgramNode program) {
            for (var global : program.globals()) {
                renderDecl(global, out, indent);
            }
        } else if (node instanceof Decl decl) {
            renderDecl(decl, out, indent);
        } else if (node instanceof Stmt stmt) {
            renderStmt(stmt, out, indent, RenderMode.STANDALONE);
        } else if (node instanceof Exp exp) {
            renderExp(exp, out);
        } else if (node instanceof TypeNode type) {
            renderType(type, out);
        }
    }

    /**
     * Render one statement in the given mode.
     *
     * @throws IllegalArgumentException if {@code mode} is {@link RenderMode#EMBEDDED} and the statement
     *                                  cannot be embedded
     */
    public String renderStatement(Stmt stmt, int indent, RenderMode mode) {
        var out = new StringBuilder();
        renderStmt(stmt, out, indent, mode);
        return out.toString();
    }

    public static boolean embeddable(Stmt stmt) {
        return stmt instanceof Stmt.CallStmt
               || stmt instanceof Stmt.PostInc
               || stmt instanceof Stmt.PostDec
               || stmt instanceof Stmt.Maybe;
    }

    // === Declarations ===

    private void renderDecl(Decl decl, StringBuilder out, int indent) {
        if (decl instanceof Decl.VarDecl varDecl) {
            renderVarDecl(varDecl, out, indent);
        } else if (decl instanceof Decl.ClassDefn classDefn) {
            doIndent(out, indent);
            out.append(classDefn.id().name()).append(": custom {\n");
            for (var member : classDefn.members()) {
                renderDecl(member, out, indent + 1);
            }
            doIndent(out, indent);
            out.append("};\n");
        } else if (decl instanceof Decl.FnDecl fnDecl) {
            doIndent(out, indent);
            out.append(fnDecl.id().name()).append(": (");
            var first = true;
            for (var formal : fnDecl.formals()) {
                if (!first) {
                    out.append(", ");
                }
                first = false;
                renderFormal(formal, out);
            }
            out.append(") -> ");
            renderType(fnDecl.returnType(), out);
            out.append(" {\n");
            renderBody(fnDecl.body(), out, indent + 1);
            doIndent(out, indent);
            out.append("}\n");
        } else if (decl instanceof Decl.FormalDecl formal) {
            // formals only appear inside a parameter list
            renderFormal(formal, out);
        }
    }

    private void renderVarDecl(Decl.VarDecl varDecl, StringBuilder out, int indent) {
        doIndent(out, indent);
        out.append(varDecl.id().name()).append(": ");
        renderType(varDecl.type(), out);
        varDecl.init().ifPresent(init -> {
            out.append(" = ");
            renderExp(init, out);
        });
        out.append(";\n");
    }

    private void renderFormal(Decl.FormalDecl formal, StringBuilder out) {
        out.append(formal.id().name()).append(": ");
        renderType(formal.type(), out);
    }

    // === Types ===

    private void renderType(TypeNode type, StringBuilder out) {
        if (type instanceof TypeNode.IntType) {
            out.append("int");
        } else if (type instanceof TypeNode.BoolType) {
            out.append("bool");
        } else if (type instanceof TypeNode.VoidType) {
            out.append("void");
        } else if (type instanceof TypeNode.ClassType classType) {
            out.append(classType.name().name());
        } else if (type instanceof TypeNode.ImmutableType immutable) {
            out.append("immutable ");
            renderType(immutable.sub(), out);
        } else if (type instanceof TypeNode.RefType ref) {
            out.append("ref ");
            renderType(ref.sub(), out);
        }
    }

    // === Statements ===

    private void renderBody(List<Stmt> body, StringBuilder out, int indent) {
        for (var stmt : body) {
            renderStmt(stmt, out, indent, RenderMode.STANDALONE);
        }
    }

    private void renderStmt(Stmt stmt, StringBuilder out, int indent, RenderMode mode) {
        if (mode == RenderMode.EMBEDDED && !embeddable(stmt)) {
            throw new IllegalArgumentException(stmt.getClass().getSimpleName() + " cannot be rendered embedded");
        }
        if (stmt instanceof Decl.VarDecl varDecl) {
            renderVarDecl(varDecl, out, indent);
            return;
        }
        if (stmt instanceof Stmt.If ifStmt) {
            doIndent(out, indent);
            out.append("if (");
            renderExp(ifStmt.cond(), out);
            out.append(") {\n");
            renderBody(ifStmt.body(), out, indent + 1);
            doIndent(out, indent);
            out.append("}\n");
            return;
        }
        if (stmt instanceof Stmt.IfElse ifElse) {
            doIndent(out, indent);
            out.append("if (");
            renderExp(ifElse.cond(), out);
            out.append(") {\n");
            renderBody(ifElse.trueBody(), out, indent + 1);
            doIndent(out, indent);
            out.append("} else {\n");
            renderBody(ifElse.falseBody(), out, indent + 1);
            doIndent(out, indent);
            out.append("}\n");
            return;
        }
        if (stmt instanceof Stmt.While whileStmt) {
            doIndent(out, indent);
            out.append("while (");
            renderExp(whileStmt.cond(), out);
            out.append(") {\n");
            renderBody(whileStmt.body(), out, indent + 1);
            doIndent(out, indent);
            out.append("}\n");
            return;
        }

        var standalone = mode == RenderMode.STANDALONE;
        if (standalone) {
            doIndent(out, indent);
        }
        renderSimpleStmt(stmt, out);
        if (standalone) {
            out.append(";\n");
        }
    }

    private void renderSimpleStmt(Stmt stmt, StringBuilder out) {
        if (stmt instanceof Stmt.Assign assign) {
            renderExp(assign.target(), out);
            out.append(" = ");
            renderExp(assign.value(), out);
        } else if (stmt instanceof Stmt.CallStmt callStmt) {
            renderExp(callStmt.call(), out);
        } else if (stmt instanceof Stmt.Return returnStmt) {
            out.append("return");
            returnStmt.value().ifPresent(value -> {
                out.append(" ");
                renderExp(value, out);
            });
        } else if (stmt instanceof Stmt.Maybe maybe) {
            out.append("maybe ");
            renderExp(maybe.target(), out);
            out.append(" means ");
            renderExp(maybe.means(), out);
            out.append(" otherwise ");
            renderExp(maybe.otherwise(), out);
        } else if (stmt instanceof Stmt.FromConsole fromConsole) {
            out.append("fromconsole ");
            renderExp(fromConsole.target(), out);
        } else if (stmt instanceof Stmt.ToConsole toConsole) {
            out.append("toconsole ");
            renderExp(toConsole.value(), out);
        } else if (stmt instanceof Stmt.PostDec postDec) {
            renderExp(postDec.loc(), out);
            out.append("--");
        } else if (stmt instanceof Stmt.PostInc postInc) {
            renderExp(postInc.loc(), out);
            out.append("++");
        }
    }

    // === Expressions ===

    private void renderExp(Exp exp, StringBuilder out) {
        if (exp instanceof Exp.IdNode id) {
            out.append(id.name());
        } else if (exp instanceof Exp.MemberLoc member) {
            renderExp(member.base(), out);
            out.append("->").append(member.field().name());
        } else if (exp instanceof Exp.IntLit intLit) {
            out.append(intLit.value());
        } else if (exp instanceof Exp.StrLit strLit) {
            renderString(strLit.value(), out);
        } else if (exp instanceof Exp.TrueLit) {
            out.append("true");
        } else if (exp instanceof Exp.FalseLit) {
            out.append("false");
        } else if (exp instanceof Exp.EhLit) {
            out.append("eh?");
        } else if (exp instanceof Exp.Binary binary) {
            renderNested(binary.lhs(), out);
            out.append(" ").append(binary.op().symbol()).append(" ");
            renderNested(binary.rhs(), out);
        } else if (exp instanceof Exp.Unary unary) {
            out.append(unary.op().symbol());
            renderNested(unary.operand(), out);
        } else if (exp instanceof Exp.CallExp call) {
            renderExp(call.callee(), out);
            out.append("(");
            var first = true;
            for (var arg : call.args()) {
                if (!first) {
                    out.append(", ");
                }
                first = false;
                renderExp(arg, out);
            }
            out.append(")");
        }
    }

    /**
     * Operand of another expression: operators parenthesize themselves, atoms do not.
     */
    private void renderNested(Exp exp, StringBuilder out) {
        if (exp instanceof Exp.Binary || exp instanceof Exp.Unary) {
            out.append("(");
            renderExp(exp, out);
            out.append(")");
        } else {
            renderExp(exp, out);
        }
    }

    private static void renderString(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                default -> out.append(c);
            }
        }
        out.append('"');
    }

    private void doIndent(StringBuilder out, int indent) {
        for (int k = 0; k < indent; k++) {
            out.append(indentUnit);
        }
    }
}
