package org.pragmatica.alang.lexer;

import org.pragmatica.alang.tree.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reference scanner for a-lang source text.
 * Tokens are produced on demand; malformed input yields {@link Token.ErrorToken} and scanning continues after it.
 */
public final class Lexer implements TokenSource {
    public static final int DEFAULT_MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
        Map.entry("int", TokenKind.INT),
        Map.entry("bool", TokenKind.BOOL),
        Map.entry("void", TokenKind.VOID),
        Map.entry("immutable", TokenKind.IMMUTABLE),
        Map.entry("custom", TokenKind.CUSTOM),
        Map.entry("if", TokenKind.IF),
        Map.entry("else", TokenKind.ELSE),
        Map.entry("while", TokenKind.WHILE),
        Map.entry("maybe", TokenKind.MAYBE),
        Map.entry("means", TokenKind.MEANS),
        Map.entry("otherwise", TokenKind.OTHERWISE),
        Map.entry("fromconsole", TokenKind.FROMCONSOLE),
        Map.entry("toconsole", TokenKind.TOCONSOLE),
        Map.entry("return", TokenKind.RETURN),
        Map.entry("true", TokenKind.TRUE),
        Map.entry("false", TokenKind.FALSE),
        Map.entry("ref", TokenKind.REF),
        Map.entry("and", TokenKind.AND),
        Map.entry("or", TokenKind.OR),
        Map.entry("not", TokenKind.NOT)
    );

    private final String input;
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static Lexer of(String input) {
        return of(input, DEFAULT_MAX_INPUT_SIZE);
    }

    public static Lexer of(String input, int maxInputSize) {
        if (input.length() > maxInputSize) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + maxInputSize + " characters");
        }
        return new Lexer(input);
    }

    /**
     * Scan the whole input. The returned list always ends with {@link Token.Eof}.
     */
    public static List<Token> tokenize(String input) {
        var lexer = of(input);
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (!(token instanceof Token.Eof));
        return tokens;
    }

    @Override
    public Token next() {
        skipWhitespaceAndComments();
        if (isAtEnd()) {
            return new Token.Eof(span(line, column));
        }
        return nextToken();
    }

    private Token nextToken() {
        int startLine = line;
        int startCol = column;
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanWord(startLine, startCol);
        }
        if (isDigit(c)) {
            return scanNumber(startLine, startCol);
        }
        if (c == '"') {
            return scanStringLiteral(startLine, startCol);
        }
        return scanOperator(startLine, startCol);
    }

    private Token scanWord(int startLine, int startCol) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var word = sb.toString();
        // eh? is the only keyword spelled with punctuation
        if (word.equals("eh") && !isAtEnd() && peek() == '?') {
            advance();
            return simple(TokenKind.EH, startLine, startCol);
        }
        var keyword = KEYWORDS.get(word);
        if (keyword != null) {
            return simple(keyword, startLine, startCol);
        }
        return new Token.IdToken(span(startLine, startCol), word);
    }

    private Token scanNumber(int startLine, int startCol) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        try{
            return new Token.IntLitToken(span(startLine, startCol), Integer.parseInt(sb.toString()));
        } catch (NumberFormatException e) {
            return new Token.ErrorToken(span(startLine, startCol), "Integer literal overflow: " + sb);
        }
    }

    private Token scanStringLiteral(int startLine, int startCol) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        String badEscape = null;
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> {
                        if (badEscape == null) {
                            badEscape = "\\" + escaped;
                        }
                    }
                }
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd() || peek() == '\n') {
            return new Token.ErrorToken(span(startLine, startCol), "Unterminated string literal");
        }
        advance();
        // skip closing quote
        if (badEscape != null) {
            return new Token.ErrorToken(span(startLine, startCol),
                                        "String literal with bad escape sequence " + badEscape);
        }
        return new Token.StrToken(span(startLine, startCol), sb.toString());
    }

    private Token scanOperator(int startLine, int startCol) {
        char c = advance();
        return switch (c) {
            case '-' -> {
                if (match('>')) {
                    yield simple(TokenKind.ARROW, startLine, startCol);
                }
                if (match('-')) {
                    yield simple(TokenKind.POSTDEC, startLine, startCol);
                }
                yield simple(TokenKind.DASH, startLine, startCol);
            }
            case '+' -> match('+')
                        ? simple(TokenKind.POSTINC, startLine, startCol)
                        : simple(TokenKind.CROSS, startLine, startCol);
            case '=' -> match('=')
                        ? simple(TokenKind.EQUALS, startLine, startCol)
                        : simple(TokenKind.ASSIGN, startLine, startCol);
            case '!' -> match('=')
                        ? simple(TokenKind.NOTEQUALS, startLine, startCol)
                        : simple(TokenKind.NOT, startLine, startCol);
            case '<' -> match('=')
                        ? simple(TokenKind.LESSEQ, startLine, startCol)
                        : simple(TokenKind.LESS, startLine, startCol);
            case '>' -> match('=')
                        ? simple(TokenKind.GREATEREQ, startLine, startCol)
                        : simple(TokenKind.GREATER, startLine, startCol);
            case '*' -> simple(TokenKind.STAR, startLine, startCol);
            case '/' -> simple(TokenKind.SLASH, startLine, startCol);
            case ':' -> simple(TokenKind.COLON, startLine, startCol);
            case ',' -> simple(TokenKind.COMMA, startLine, startCol);
            case '{' -> simple(TokenKind.LCURLY, startLine, startCol);
            case '}' -> simple(TokenKind.RCURLY, startLine, startCol);
            case '(' -> simple(TokenKind.LPAREN, startLine, startCol);
            case ')' -> simple(TokenKind.RPAREN, startLine, startCol);
            case ';' -> simple(TokenKind.SEMICOL, startLine, startCol);
            default -> new Token.ErrorToken(span(startLine, startCol), "Illegal character: " + c);
        };
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '#' || (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/')) {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean match(char expected) {
        if (!isAtEnd() && peek() == expected) {
            advance();
            return true;
        }
        return false;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    private Token simple(TokenKind kind, int startLine, int startCol) {
        return new Token.Simple(kind, span(startLine, startCol));
    }

    private Position span(int startLine, int startCol) {
        return Position.of(startLine, startCol, line, column);
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
