package org.pragmatica.alang.ast;

import org.pragmatica.alang.tree.Position;

import java.util.Objects;

/**
 * Data types written in declarations.
 */
public sealed interface TypeNode extends AstNode {

    record IntType(Position position) implements TypeNode {
        public IntType {
            Objects.requireNonNull(position, "position");
        }
    }

    record BoolType(Position position) implements TypeNode {
        public BoolType {
            Objects.requireNonNull(position, "position");
        }
    }

    record VoidType(Position position) implements TypeNode {
        public VoidType {
            Objects.requireNonNull(position, "position");
        }
    }

    /**
     * Type named by a class definition.
     */
    record ClassType(Position position, Exp.IdNode name) implements TypeNode {
        public ClassType {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(name, "name");
        }
    }

    record ImmutableType(Position position, TypeNode sub) implements TypeNode {
        public ImmutableType {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(sub, "sub");
        }
    }

    record RefType(Position position, TypeNode sub) implements TypeNode {
        public RefType {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(sub, "sub");
        }
    }
}
