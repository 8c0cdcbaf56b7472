package org.pragmatica.alang.ast;

import org.pragmatica.alang.tree.Position;

import java.util.List;
import java.util.Objects;

/**
 * Root of the tree: global declarations in source order.
 */
public record ProgramNode(Position position, List<Decl> globals) implements AstNode {

    public ProgramNode {
        Objects.requireNonNull(position, "position");
        globals = List.copyOf(globals);
        for (var global : globals) {
            if (global instanceof Decl.FormalDecl) {
                throw new IllegalArgumentException("Formal parameter cannot be a global declaration");
            }
        }
    }

    /**
     * Program whose position spans its first to last global, or {@link Position#ZERO} when empty.
     */
    public static ProgramNode of(List<Decl> globals) {
        if (globals.isEmpty()) {
            return new ProgramNode(Position.ZERO, globals);
        }
        var first = globals.get(0).position();
        var last = globals.get(globals.size() - 1).position();
        return new ProgramNode(Position.between(first, last), globals);
    }
}
