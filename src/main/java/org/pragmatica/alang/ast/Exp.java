package org.pragmatica.alang.ast;

import org.pragmatica.alang.tree.Position;

import java.util.List;
import java.util.Objects;

/**
 * Expression nodes.
 */
public sealed interface Exp extends AstNode {

    // === Locations ===

    /**
     * Assignable expression: an identifier or a member access chain.
     */
    sealed interface Loc extends Exp {}

    record IdNode(Position position, String name) implements Loc {
        public IdNode {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Member access: {@code base->field}.
     */
    record MemberLoc(Position position, Loc base, IdNode field) implements Loc {
        public MemberLoc {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(field, "field");
        }
    }

    // === Literals ===

    record IntLit(Position position, int value) implements Exp {
        public IntLit {
            Objects.requireNonNull(position, "position");
            // a minus sign is always a NEG node
            if (value < 0) {
                throw new IllegalArgumentException("Integer literal must be non-negative, got " + value);
            }
        }
    }

    /**
     * String literal; {@code value} holds the decoded characters, without quotes.
     */
    record StrLit(Position position, String value) implements Exp {
        public StrLit {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(value, "value");
        }
    }

    record TrueLit(Position position) implements Exp {
        public TrueLit {
            Objects.requireNonNull(position, "position");
        }
    }

    record FalseLit(Position position) implements Exp {
        public FalseLit {
            Objects.requireNonNull(position, "position");
        }
    }

    /**
     * The {@code eh?} placeholder value.
     */
    record EhLit(Position position) implements Exp {
        public EhLit {
            Objects.requireNonNull(position, "position");
        }
    }

    // === Operators ===

    record Binary(Position position, BinaryOp op, Exp lhs, Exp rhs) implements Exp {
        public Binary {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }
    }

    record Unary(Position position, UnaryOp op, Exp operand) implements Exp {
        public Unary {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }
    }

    // === Calls ===

    record CallExp(Position position, Loc callee, List<Exp> args) implements Exp {
        public CallExp {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(callee, "callee");
            args = List.copyOf(args);
        }
    }
}
