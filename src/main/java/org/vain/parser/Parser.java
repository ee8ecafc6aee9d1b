package org.vain.parser;

import org.vain.astnode.ErrorNode;
import org.vain.astnode.Node;
import org.vain.astnode.TopLevelNode;
import org.vain.codegen.EmitterContext;
import org.vain.lexer.LexerToken;
import org.vain.lexer.LexerTokenType;
import org.vain.runtime.ErrorMessageUtil;
import org.vain.runtime.VainCompilerException;

import java.util.List;

/**
 * The Parser class turns a token stream into an abstract syntax tree (AST).
 * <p>
 * The grammar is handled by recursive descent, one static method per
 * production, spread over {@link ParseStatement}, {@link ParseExpression},
 * {@link ParsePrimary} and {@link ParseFunction}.
 * <p>
 * A whole file is one top-level unit. The first syntax error aborts the unit
 * and is returned as an {@link ErrorNode}; there is no recovery.
 */
public class Parser {

    // Context for error messages and debug output.
    public final EmitterContext ctx;
    // Source of tokens.
    private final TokenStream tokens;
    // True once the unit has been returned.
    private boolean finished;

    public Parser(EmitterContext ctx, TokenStream tokens) {
        this.ctx = ctx;
        this.tokens = tokens;
    }

    public Parser(EmitterContext ctx, List<LexerToken> tokens) {
        this(ctx, new TokenStream(tokens));
    }

    /**
     * Parses the next top-level unit.
     *
     * @return a {@link TopLevelNode}, an {@link ErrorNode} for a syntax or lexical
     * error, or null when there is no more input
     */
    public Node parse() {
        if (finished) {
            return null;
        }
        finished = true;
        LexerToken first = peek();
        try {
            List<Node> body = ParseStatement.parseStatements(this, false);
            ctx.logDebug("parse: " + ctx.fileName + " " + body.size() + " statements");
            return new TopLevelNode(body, first.position);
        } catch (VainCompilerException e) {
            ctx.logDebug("parse error: " + e.getMessage());
            return new ErrorNode(e.getMessage(), e.getPosition());
        }
    }

    public LexerToken next() {
        return tokens.next();
    }

    public LexerToken peek() {
        return tokens.peek();
    }

    public void backup() {
        tokens.backup();
    }

    /**
     * Consumes the next token if it has the given type.
     */
    public boolean accept(LexerTokenType type) {
        if (peek().type == type) {
            next();
            return true;
        }
        return false;
    }

    /**
     * Consumes the next token, which must have the given type.
     *
     * @throws VainCompilerException if it does not
     */
    public LexerToken expect(LexerTokenType type) {
        LexerToken token = next();
        if (token.type != type) {
            throw unexpected(token, type.display);
        }
        return token;
    }

    /**
     * Skips newlines and comments, where they are not significant.
     */
    public void skipNewlines() {
        while (peek().type == LexerTokenType.NEWLINE || peek().type == LexerTokenType.COMMENT) {
            next();
        }
    }

    public VainCompilerException error(LexerToken token, String message) {
        if (token.type == LexerTokenType.ERROR) {
            return new VainCompilerException(token.text, token.position);
        }
        return new VainCompilerException(token.position, message, ctx.errorUtil);
    }

    public VainCompilerException unexpected(LexerToken token, String expected) {
        return error(token, "expected " + expected + " but got " + describe(token));
    }

    static String describe(LexerToken token) {
        switch (token.type) {
            case EOF:
            case NEWLINE:
                return token.type.display;
            case IDENTIFIER:
            case INT:
            case FLOAT:
            case STRING:
                return token.type.display + " " + ErrorMessageUtil.errorMessageQuote(token.text);
            default:
                return ErrorMessageUtil.errorMessageQuote(token.text);
        }
    }
}
