package org.pragmatica.alang.ast;

import org.pragmatica.alang.tree.Position;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarations: variables, classes, functions and function formals.
 */
public sealed interface Decl extends AstNode {
    /**
     * The declared name.
     */
    Exp.IdNode id();

    /**
     * Variable declaration, {@code id : type [= init]}; usable both globally and as a statement.
     */
    record VarDecl(Position position, Exp.IdNode id, TypeNode type, Optional<Exp> init) implements Decl, Stmt {
        public VarDecl {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(init, "init");
        }
    }

    /**
     * Class definition; members are variable and function declarations in declaration order.
     */
    record ClassDefn(Position position, Exp.IdNode id, List<Decl> members) implements Decl {
        public ClassDefn {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(id, "id");
            members = List.copyOf(members);
            for (var member : members) {
                if (!(member instanceof VarDecl || member instanceof FnDecl)) {
                    throw new IllegalArgumentException("Class member must be a variable or function, got "
                                                       + member.getClass().getSimpleName());
                }
            }
        }
    }

    record FnDecl(Position position,
                  Exp.IdNode id,
                  List<FormalDecl> formals,
                  TypeNode returnType,
                  List<Stmt> body) implements Decl {
        public FnDecl {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(id, "id");
            formals = List.copyOf(formals);
            Objects.requireNonNull(returnType, "returnType");
            body = List.copyOf(body);
        }
    }

    /**
     * Function parameter: a variable declaration that never has an initializer.
     */
    record FormalDecl(Position position, Exp.IdNode id, TypeNode type) implements Decl {
        public FormalDecl {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(type, "type");
        }
    }
}
