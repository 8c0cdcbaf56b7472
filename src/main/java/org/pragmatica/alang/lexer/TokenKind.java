package org.pragmatica.alang.lexer;

/**
 * Kinds of tokens that carry no payload besides their position.
 */
public enum TokenKind {
    // Keywords
    INT("int"),
    BOOL("bool"),
    VOID("void"),
    IMMUTABLE("immutable"),
    CUSTOM("custom"),
    IF("if"),
    ELSE("else"),
    WHILE("while"),
    MAYBE("maybe"),
    MEANS("means"),
    OTHERWISE("otherwise"),
    FROMCONSOLE("fromconsole"),
    TOCONSOLE("toconsole"),
    RETURN("return"),
    TRUE("true"),
    FALSE("false"),
    REF("ref"),
    EH("eh?"),

    // Operators
    CROSS("+"),
    DASH("-"),
    STAR("*"),
    SLASH("/"),
    AND("and"),
    OR("or"),
    NOT("not"),
    EQUALS("=="),
    NOTEQUALS("!="),
    LESS("<"),
    LESSEQ("<="),
    GREATER(">"),
    GREATEREQ(">="),
    ASSIGN("="),
    POSTINC("++"),
    POSTDEC("--"),

    // Punctuation
    COLON(":"),
    COMMA(","),
    ARROW("->"),
    LCURLY("{"),
    RCURLY("}"),
    LPAREN("("),
    RPAREN(")"),
    SEMICOL(";");

    private final String text;

    TokenKind(String text) {
        this.text = text;
    }

    /**
     * Canonical spelling in source text.
     */
    public String text() {
        return text;
    }

    public String quoted() {
        return "'" + text + "'";
    }
}
