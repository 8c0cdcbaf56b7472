package org.pragmatica.alang.parser;

import org.pragmatica.alang.ast.BinaryOp;
import org.pragmatica.alang.ast.Decl;
import org.pragmatica.alang.ast.Exp;
import org.pragmatica.alang.ast.ProgramNode;
import org.pragmatica.alang.ast.Stmt;
import org.pragmatica.alang.ast.TypeNode;
import org.pragmatica.alang.ast.UnaryOp;
import org.pragmatica.alang.error.ParseError;
import org.pragmatica.alang.lexer.Token;
import org.pragmatica.alang.lexer.TokenKind;
import org.pragmatica.alang.lexer.TokenSource;
import org.pragmatica.alang.tree.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for a-lang with one token of lookahead and no backtracking.
 * Every production builds its node as soon as it is matched; the first token that fits no
 * production aborts the parse.
 *
 * <p>Instances are single-use: create one per token stream through {@link #parse(TokenSource)}.
 */
public final class Parser {
    /**
     * Deepest accepted nesting of parentheses, unary operators, call arguments and blocks.
     */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private static final BinaryOp.Precedence[] LEVELS = BinaryOp.Precedence.values();

    private final TokenSource tokens;
    private final int maxNestingDepth;
    private Token current;
    private int depth;

    private Parser(TokenSource tokens, int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
        this.current = tokens.next();
    }

    /**
     * Parse a whole program.
     */
    public static ParseResult<ProgramNode> parse(TokenSource tokens) {
        return parse(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Parse a whole program, failing with {@link ParseError.NestingTooDeep} past {@code maxNestingDepth}.
     */
    public static ParseResult<ProgramNode> parse(TokenSource tokens, int maxNestingDepth) {
        try{
            return ParseResult.success(new Parser(tokens, maxNestingDepth).parseProgram());
        } catch (SyntaxError e) {
            return ParseResult.failure(e.error());
        }
    }

    /**
     * Parse a single expression followed by end of input.
     */
    public static ParseResult<Exp> parseExpression(TokenSource tokens) {
        try{
            var parser = new Parser(tokens, DEFAULT_MAX_NESTING_DEPTH);
            var exp = parser.parseExp();
            parser.expectEnd("operator or end of input");
            return ParseResult.success(exp);
        } catch (SyntaxError e) {
            return ParseResult.failure(e.error());
        }
    }

    // === Declarations ===

    private ProgramNode parseProgram() {
        var globals = new ArrayList<Decl>();
        while (!(current instanceof Token.Eof)) {
            globals.add(parseDecl());
        }
        return ProgramNode.of(globals);
    }

    private Decl parseDecl() {
        var id = parseName("declaration or end of input");
        expect(TokenKind.COLON);
        if (current.is(TokenKind.CUSTOM)) {
            return parseClassTail(id);
        }
        if (current.is(TokenKind.LPAREN)) {
            return parseFnTail(id);
        }
        var decl = parseVarDeclTail(id, "'custom', '(' or type");
        expect(TokenKind.SEMICOL, "'=' or ';'");
        return decl;
    }

    private Decl.ClassDefn parseClassTail(Exp.IdNode id) {
        expect(TokenKind.CUSTOM);
        expect(TokenKind.LCURLY);
        var members = new ArrayList<Decl>();
        while (!current.is(TokenKind.RCURLY)) {
            members.add(parseMember());
        }
        var end = expect(TokenKind.RCURLY).position();
        if (current.is(TokenKind.SEMICOL)) {
            end = advance().position();
        }
        return new Decl.ClassDefn(Position.between(id.position(), end), id, members);
    }

    private Decl parseMember() {
        var id = parseName("class member or '}'");
        expect(TokenKind.COLON);
        if (current.is(TokenKind.LPAREN)) {
            return parseFnTail(id);
        }
        var decl = parseVarDeclTail(id, "'(' or type");
        expect(TokenKind.SEMICOL, "'=' or ';'");
        return decl;
    }

    private Decl.FnDecl parseFnTail(Exp.IdNode id) {
        expect(TokenKind.LPAREN);
        var formals = new ArrayList<Decl.FormalDecl>();
        if (!current.is(TokenKind.RPAREN)) {
            formals.add(parseFormal());
            while (accept(TokenKind.COMMA)) {
                formals.add(parseFormal());
            }
        }
        expect(TokenKind.RPAREN, formals.isEmpty() ? "formal parameter or ')'" : "',' or ')'");
        expect(TokenKind.ARROW);
        var returnType = parseType();
        expect(TokenKind.LCURLY);
        var body = parseStmtList();
        var end = expect(TokenKind.RCURLY).position();
        return new Decl.FnDecl(Position.between(id.position(), end), id, formals, returnType, body);
    }

    private Decl.FormalDecl parseFormal() {
        var id = parseName("formal parameter");
        expect(TokenKind.COLON);
        var type = parseType();
        return new Decl.FormalDecl(Position.between(id.position(), type.position()), id, type);
    }

    /**
     * {@code type [= exp]} after {@code name :} has been matched.
     */
    private Decl.VarDecl parseVarDeclTail(Exp.IdNode id, String expectedType) {
        var type = parseType(expectedType);
        if (accept(TokenKind.ASSIGN)) {
            var init = parseExp();
            return new Decl.VarDecl(Position.between(id.position(), init.position()), id, type, Optional.of(init));
        }
        return new Decl.VarDecl(Position.between(id.position(), type.position()), id, type, Optional.empty());
    }

    // === Types ===

    private TypeNode parseType() {
        return parseType("type");
    }

    private TypeNode parseType(String expected) {
        if (current.is(TokenKind.IMMUTABLE)) {
            var start = advance().position();
            var sub = parseDatatype();
            return new TypeNode.ImmutableType(Position.between(start, sub.position()), sub);
        }
        return parseDatatype(expected);
    }

    private TypeNode parseDatatype() {
        return parseDatatype("'ref' or type");
    }

    private TypeNode parseDatatype(String expected) {
        if (current.is(TokenKind.REF)) {
            var start = advance().position();
            var sub = parsePrimType("type");
            return new TypeNode.RefType(Position.between(start, sub.position()), sub);
        }
        return parsePrimType(expected);
    }

    private TypeNode parsePrimType(String expected) {
        if (current.is(TokenKind.INT)) {
            return new TypeNode.IntType(advance().position());
        }
        if (current.is(TokenKind.BOOL)) {
            return new TypeNode.BoolType(advance().position());
        }
        if (current.is(TokenKind.VOID)) {
            return new TypeNode.VoidType(advance().position());
        }
        if (current instanceof Token.IdToken) {
            var name = parseName(expected);
            return new TypeNode.ClassType(name.position(), name);
        }
        throw unexpected(expected);
    }

    // === Statements ===

    private List<Stmt> parseStmtList() {
        enter();
        var stmts = new ArrayList<Stmt>();
        while (!current.is(TokenKind.RCURLY)) {
            if (current.is(TokenKind.WHILE)) {
                stmts.add(parseWhile());
            } else if (current.is(TokenKind.IF)) {
                stmts.add(parseIf());
            } else {
                stmts.add(parseStmt());
                expect(TokenKind.SEMICOL);
            }
        }
        leave();
        return stmts;
    }

    private Stmt parseWhile() {
        var start = advance().position();
        var cond = parseCondition();
        var body = parseBlock();
        var end = expect(TokenKind.RCURLY).position();
        return new Stmt.While(Position.between(start, end), cond, body);
    }

    private Stmt parseIf() {
        var start = advance().position();
        var cond = parseCondition();
        var trueBody = parseBlock();
        var end = expect(TokenKind.RCURLY).position();
        if (!accept(TokenKind.ELSE)) {
            return new Stmt.If(Position.between(start, end), cond, trueBody);
        }
        var falseBody = parseBlock();
        end = expect(TokenKind.RCURLY).position();
        return new Stmt.IfElse(Position.between(start, end), cond, trueBody, falseBody);
    }

    private Exp parseCondition() {
        expect(TokenKind.LPAREN);
        var cond = parseExp();
        expect(TokenKind.RPAREN);
        return cond;
    }

    /**
     * {@code '{' stmtList} - the closing brace is left for the caller so it can take its position.
     */
    private List<Stmt> parseBlock() {
        expect(TokenKind.LCURLY);
        return parseStmtList();
    }

    private Stmt parseStmt() {
        if (current instanceof Token.IdToken) {
            return parseNameStmt();
        }
        if (current.is(TokenKind.FROMCONSOLE)) {
            var start = advance().position();
            var target = parseLoc();
            return new Stmt.FromConsole(Position.between(start, target.position()), target);
        }
        if (current.is(TokenKind.TOCONSOLE)) {
            var start = advance().position();
            var value = parseExp();
            return new Stmt.ToConsole(Position.between(start, value.position()), value);
        }
        if (current.is(TokenKind.MAYBE)) {
            var start = advance().position();
            var target = parseLoc();
            expect(TokenKind.MEANS, "'->' or 'means'");
            var means = parseExp();
            expect(TokenKind.OTHERWISE, "operator or 'otherwise'");
            var otherwise = parseExp();
            return new Stmt.Maybe(Position.between(start, otherwise.position()), target, means, otherwise);
        }
        if (current.is(TokenKind.RETURN)) {
            var start = advance().position();
            if (!startsExpression(current)) {
                return new Stmt.Return(start, Optional.empty());
            }
            var value = parseExp();
            return new Stmt.Return(Position.between(start, value.position()), Optional.of(value));
        }
        throw unexpected("statement or '}'");
    }

    /**
     * Statements that start with an identifier: declaration, assignment, increment, decrement or call.
     */
    private Stmt parseNameStmt() {
        var id = parseName("statement");
        if (accept(TokenKind.COLON)) {
            return parseVarDeclTail(id, "type");
        }
        var loc = parseLocTail(id);
        if (accept(TokenKind.ASSIGN)) {
            var value = parseExp();
            return new Stmt.Assign(Position.between(loc.position(), value.position()), loc, value);
        }
        if (current.is(TokenKind.POSTINC)) {
            var end = advance().position();
            return new Stmt.PostInc(Position.between(loc.position(), end), loc);
        }
        if (current.is(TokenKind.POSTDEC)) {
            var end = advance().position();
            return new Stmt.PostDec(Position.between(loc.position(), end), loc);
        }
        if (current.is(TokenKind.LPAREN)) {
            var call = parseCallTail(loc);
            return new Stmt.CallStmt(call.position(), call);
        }
        throw unexpected(loc == id
                         ? "':', '->', '=', '++', '--' or '('"
                         : "'->', '=', '++', '--' or '('");
    }

    // === Expressions ===

    private Exp parseExp() {
        enter();
        var exp = parseBinary(LEVELS[0]);
        leave();
        return exp;
    }

    /**
     * Precedence climbing over the declared operator table. Relational operators are
     * non-associative, so a second operator of that level right after the first is an error.
     */
    private Exp parseBinary(BinaryOp.Precedence minLevel) {
        var lhs = parseUnary();
        while (true) {
            var op = binaryOperator();
            if (op.isEmpty() || minLevel.bindsTighterThan(op.get().precedence())) {
                return lhs;
            }
            var level = op.get().precedence();
            var opPosition = advance().position();
            var rhs = parseOperand(level);
            lhs = new Exp.Binary(Position.between(lhs.position(), rhs.position()), op.get(), lhs, rhs);
            if (level.associativity() == BinaryOp.Associativity.NONE
                && binaryOperator().filter(next -> next.precedence() == level).isPresent()) {
                throw new SyntaxError(new ParseError.ChainedComparison(current.position(),
                                                                       current.describe(),
                                                                       opPosition));
            }
        }
    }

    private Exp parseOperand(BinaryOp.Precedence level) {
        var next = level.ordinal() + 1;
        return next < LEVELS.length
               ? parseBinary(LEVELS[next])
               : parseUnary();
    }

    private Optional<BinaryOp> binaryOperator() {
        return current instanceof Token.Simple simple
               ? BinaryOp.forToken(simple.kind())
               : Optional.empty();
    }

    private Exp parseUnary() {
        if (current.is(TokenKind.NOT) || current.is(TokenKind.DASH)) {
            var op = current.is(TokenKind.NOT) ? UnaryOp.NOT : UnaryOp.NEG;
            var start = advance().position();
            enter();
            var operand = parseUnary();
            leave();
            return new Exp.Unary(Position.between(start, operand.position()), op, operand);
        }
        return parsePrimary();
    }

    private Exp parsePrimary() {
        var token = current;
        if (token instanceof Token.IntLitToken intLit) {
            if (intLit.value() < 0) {
                throw new SyntaxError(new ParseError.LexicalError(intLit.position(),
                                                                  "Negative integer literal: " + intLit.value()));
            }
            advance();
            return new Exp.IntLit(intLit.position(), intLit.value());
        }
        if (token instanceof Token.StrToken str) {
            advance();
            return new Exp.StrLit(str.position(), str.value());
        }
        if (token.is(TokenKind.TRUE)) {
            return new Exp.TrueLit(advance().position());
        }
        if (token.is(TokenKind.FALSE)) {
            return new Exp.FalseLit(advance().position());
        }
        if (token.is(TokenKind.EH)) {
            return new Exp.EhLit(advance().position());
        }
        if (token.is(TokenKind.LPAREN)) {
            advance();
            var inner = parseExp();
            expect(TokenKind.RPAREN, "operator or ')'");
            return inner;
        }
        if (token instanceof Token.IdToken) {
            var loc = parseLoc();
            if (current.is(TokenKind.LPAREN)) {
                return parseCallTail(loc);
            }
            return loc;
        }
        throw unexpected("expression");
    }

    private Exp.CallExp parseCallTail(Exp.Loc callee) {
        expect(TokenKind.LPAREN);
        var args = new ArrayList<Exp>();
        if (!current.is(TokenKind.RPAREN)) {
            args.add(parseExp());
            while (accept(TokenKind.COMMA)) {
                args.add(parseExp());
            }
        }
        var end = expect(TokenKind.RPAREN, args.isEmpty() ? "expression or ')'" : "',' or ')'").position();
        return new Exp.CallExp(Position.between(callee.position(), end), callee, args);
    }

    // === Locations ===

    private Exp.Loc parseLoc() {
        return parseLocTail(parseName("identifier"));
    }

    private Exp.Loc parseLocTail(Exp.IdNode id) {
        Exp.Loc loc = id;
        while (accept(TokenKind.ARROW)) {
            var field = parseName("member name");
            loc = new Exp.MemberLoc(Position.between(loc.position(), field.position()), loc, field);
        }
        return loc;
    }

    private Exp.IdNode parseName(String expected) {
        if (current instanceof Token.IdToken id) {
            advance();
            return new Exp.IdNode(id.position(), id.name());
        }
        throw unexpected(expected);
    }

    // === Nesting ===

    private void enter() {
        if (++depth > maxNestingDepth) {
            throw new SyntaxError(new ParseError.NestingTooDeep(current.position(), maxNestingDepth));
        }
    }

    private void leave() {
        depth--;
    }

    // === Token handling ===

    private static boolean startsExpression(Token token) {
        return token instanceof Token.IdToken
               || token instanceof Token.IntLitToken
               || token instanceof Token.StrToken
               || token.is(TokenKind.TRUE)
               || token.is(TokenKind.FALSE)
               || token.is(TokenKind.EH)
               || token.is(TokenKind.LPAREN)
               || token.is(TokenKind.NOT)
               || token.is(TokenKind.DASH);
    }

    private Token advance() {
        var consumed = current;
        if (!(consumed instanceof Token.Eof)) {
            current = tokens.next();
        }
        return consumed;
    }

    private boolean accept(TokenKind kind) {
        if (current.is(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenKind kind) {
        return expect(kind, kind.quoted());
    }

    private Token expect(TokenKind kind, String expected) {
        if (current.is(kind)) {
            return advance();
        }
        throw unexpected(expected);
    }

    private void expectEnd(String expected) {
        if (!(current instanceof Token.Eof)) {
            throw unexpected(expected);
        }
    }

    private SyntaxError unexpected(String expected) {
        if (current instanceof Token.ErrorToken error) {
            return new SyntaxError(new ParseError.LexicalError(error.position(), error.message()));
        }
        if (current instanceof Token.Eof) {
            return new SyntaxError(new ParseError.UnexpectedEof(current.position(), expected));
        }
        return new SyntaxError(new ParseError.UnexpectedToken(current.position(), current.describe(), expected));
    }

    /**
     * Unwinds the descent on the first error; never escapes {@link Parser}.
     */
    private static final class SyntaxError extends RuntimeException {
        private final transient ParseError error;

        SyntaxError(ParseError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }

        ParseError error() {
            return error;
        }
    }
}
