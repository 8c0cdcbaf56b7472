package org.pragmatica.alang.ast;

/**
 * Prefix operators. Both bind tighter than any binary operator.
 */
public enum UnaryOp {
    NEG("-"),
    NOT("!");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
