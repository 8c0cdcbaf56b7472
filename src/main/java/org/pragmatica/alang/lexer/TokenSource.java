package org.pragmatica.alang.lexer;

import org.pragmatica.alang.tree.Position;

import java.util.List;

/**
 * Pull-based token stream. Once {@link Token.Eof} has been returned, every further call returns it again.
 */
@FunctionalInterface
public interface TokenSource {

    Token next();

    /**
     * Token source over a pre-built list. A missing trailing {@link Token.Eof} is supplied.
     */
    static TokenSource of(List<Token> tokens) {
        var copy = List.copyOf(tokens);
        return new TokenSource() {
            private int pos;

            @Override
            public Token next() {
                if (pos < copy.size()) {
                    var token = copy.get(pos);
                    if (!(token instanceof Token.Eof)) {
                        pos++;
                    }
                    return token;
                }
                if (copy.isEmpty()) {
                    return new Token.Eof(Position.ZERO);
                }
                var last = copy.get(copy.size() - 1).position();
                return new Token.Eof(Position.of(last.endLine(), last.endCol(), last.endLine(), last.endCol()));
            }
        };
    }
}
