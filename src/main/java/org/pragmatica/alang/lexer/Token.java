package org.pragmatica.alang.lexer;

import org.pragmatica.alang.tree.Position;

/**
 * Tokens produced by a scanner and consumed once by the parser.
 */
public sealed interface Token {
    Position position();

    /**
     * Human-readable form used in syntax error messages.
     */
    String describe();

    // Keywords, operators and punctuation
    record Simple(TokenKind kind, Position position) implements Token {
        @Override
        public String describe() {
            return kind.quoted();
        }
    }

    // Payload-bearing tokens
    record IdToken(Position position, String name) implements Token {
        @Override
        public String describe() {
            return "identifier '" + name + "'";
        }
    }

    record IntLitToken(Position position, int value) implements Token {
        @Override
        public String describe() {
            return "integer literal " + value;
        }
    }

    record StrToken(Position position, String value) implements Token {
        @Override
        public String describe() {
            return "string literal";
        }
    }

    // Special
    record Eof(Position position) implements Token {
        @Override
        public String describe() {
            return "end of input";
        }
    }

    /**
     * Malformed input reported by the scanner.
     */
    record ErrorToken(Position position, String message) implements Token {
        @Override
        public String describe() {
            return "invalid token";
        }
    }

    default boolean is(TokenKind kind) {
        return this instanceof Simple simple && simple.kind() == kind;
    }
}
