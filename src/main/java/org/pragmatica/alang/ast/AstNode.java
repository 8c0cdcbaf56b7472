package org.pragmatica.alang.ast;

import org.pragmatica.alang.tree.Position;

/**
 * Abstract syntax tree node. Nodes are immutable and each one is owned by exactly one parent.
 */
public sealed interface AstNode permits ProgramNode, Decl, Stmt, Exp, TypeNode {
    /**
     * Source span from the first to the last symbol this node was built from.
     */
    Position position();

    default String posStr() {
        return position().span();
    }
}
