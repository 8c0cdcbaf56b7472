package org.pragmatica.alang.ast;

import org.pragmatica.alang.tree.Position;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Statement nodes. A variable declaration is also a statement.
 */
public sealed interface Stmt extends AstNode
    permits Decl.VarDecl, Stmt.Assign, Stmt.CallStmt, Stmt.Return, Stmt.Maybe, Stmt.FromConsole,
            Stmt.ToConsole, Stmt.PostDec, Stmt.PostInc, Stmt.If, Stmt.IfElse, Stmt.While {

    record Assign(Position position, Exp.Loc target, Exp value) implements Stmt {
        public Assign {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }
    }

    record CallStmt(Position position, Exp.CallExp call) implements Stmt {
        public CallStmt {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(call, "call");
        }
    }

    record Return(Position position, Optional<Exp> value) implements Stmt {
        public Return {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Conditional assignment: {@code maybe target means a otherwise b}.
     */
    record Maybe(Position position, Exp.Loc target, Exp means, Exp otherwise) implements Stmt {
        public Maybe {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(means, "means");
            Objects.requireNonNull(otherwise, "otherwise");
        }
    }

    record FromConsole(Position position, Exp.Loc target) implements Stmt {
        public FromConsole {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(target, "target");
        }
    }

    record ToConsole(Position position, Exp value) implements Stmt {
        public ToConsole {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(value, "value");
        }
    }

    record PostDec(Position position, Exp.Loc loc) implements Stmt {
        public PostDec {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(loc, "loc");
        }
    }

    record PostInc(Position position, Exp.Loc loc) implements Stmt {
        public PostInc {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(loc, "loc");
        }
    }

    // === Block statements ===

    record If(Position position, Exp cond, List<Stmt> body) implements Stmt {
        public If {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(cond, "cond");
            body = List.copyOf(body);
        }
    }

    record IfElse(Position position, Exp cond, List<Stmt> trueBody, List<Stmt> falseBody) implements Stmt {
        public IfElse {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(cond, "cond");
            trueBody = List.copyOf(trueBody);
            falseBody = List.copyOf(falseBody);
        }
    }

    record While(Position position, Exp cond, List<Stmt> body) implements Stmt {
        public While {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(cond, "cond");
            body = List.copyOf(body);
        }
    }
}
