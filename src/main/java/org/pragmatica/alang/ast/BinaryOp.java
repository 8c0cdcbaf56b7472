package org.pragmatica.alang.ast;

import org.pragmatica.alang.lexer.TokenKind;

import java.util.Optional;

/**
 * Binary operators with their declared precedence and associativity.
 */
public enum BinaryOp {
    OR("or", TokenKind.OR, Precedence.OR),
    AND("and", TokenKind.AND, Precedence.AND),
    EQUALS("==", TokenKind.EQUALS, Precedence.RELATIONAL),
    NOT_EQUALS("!=", TokenKind.NOTEQUALS, Precedence.RELATIONAL),
    LESS("<", TokenKind.LESS, Precedence.RELATIONAL),
    LESS_EQ("<=", TokenKind.LESSEQ, Precedence.RELATIONAL),
    GREATER(">", TokenKind.GREATER, Precedence.RELATIONAL),
    GREATER_EQ(">=", TokenKind.GREATEREQ, Precedence.RELATIONAL),
    PLUS("+", TokenKind.CROSS, Precedence.ADDITIVE),
    MINUS("-", TokenKind.DASH, Precedence.ADDITIVE),
    TIMES("*", TokenKind.STAR, Precedence.MULTIPLICATIVE),
    DIVIDE("/", TokenKind.SLASH, Precedence.MULTIPLICATIVE);

    /**
     * Precedence levels, lowest binding first.
     */
    public enum Precedence {
        OR(Associativity.LEFT),
        AND(Associativity.LEFT),
        RELATIONAL(Associativity.NONE),
        ADDITIVE(Associativity.LEFT),
        MULTIPLICATIVE(Associativity.LEFT);

        private final Associativity associativity;

        Precedence(Associativity associativity) {
            this.associativity = associativity;
        }

        public Associativity associativity() {
            return associativity;
        }

        public boolean bindsTighterThan(Precedence other) {
            return ordinal() > other.ordinal();
        }
    }

    public enum Associativity {
        LEFT,
        NONE
    }

    private final String symbol;
    private final TokenKind token;
    private final Precedence precedence;

    BinaryOp(String symbol, TokenKind token, Precedence precedence) {
        this.symbol = symbol;
        this.token = token;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public TokenKind token() {
        return token;
    }

    public Precedence precedence() {
        return precedence;
    }

    public static Optional<BinaryOp> forToken(TokenKind kind) {
        for (var op : values()) {
            if (op.token == kind) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
