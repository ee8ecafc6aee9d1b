package org.vain.parser;

import org.vain.astnode.*;
import org.vain.lexer.LexerToken;
import org.vain.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * The ParseStatement class parses statements and blocks.
 */
public class ParseStatement {

    /**
     * Parses statements up to EOF or, inside a block, up to the closing brace,
     * which is left for the caller.
     */
    public static List<Node> parseStatements(Parser parser, boolean inBlock) {
        List<Node> body = new ArrayList<>();
        while (true) {
            LexerToken token = parser.peek();
            switch (token.type) {
                case NEWLINE:
                    parser.next();
                    continue;
                case COMMENT:
                    parser.next();
                    body.add(new CommentNode(token.text, token.position));
                    continue;
                case EOF:
                    if (inBlock) {
                        throw parser.unexpected(token, "\"}\"");
                    }
                    return body;
                case C_CLOSE:
                    if (inBlock) {
                        return body;
                    }
                    throw parser.error(token, "unexpected \"}\"");
                case ERROR:
                    throw parser.error(token, token.text);
                default:
                    body.add(parseStatement(parser));
                    expectStatementEnd(parser);
            }
        }
    }

    private static void expectStatementEnd(Parser parser) {
        LexerToken token = parser.peek();
        switch (token.type) {
            case NEWLINE:
            case COMMENT:
            case EOF:
            case C_CLOSE:
                return;
            default:
                throw parser.unexpected(token, "newline after statement");
        }
    }

    /**
     * Parses a single statement.
     *
     * @param parser The parser instance used for parsing.
     * @return A Node representing the parsed statement.
     */
    public static Node parseStatement(Parser parser) {
        LexerToken token = parser.peek();
        parser.ctx.logDebug("parseStatement `" + token.text + "`");

        switch (token.type) {
            case IMPORT:
            case FROM:
                return parseImport(parser);
            case FUNC:
                return ParseFunction.parseFunction(parser, false);
            case RETURN:
                return parseReturn(parser);
            case CONST:
            case LET:
                return parseDeclaration(parser);
            case IF:
                return parseIf(parser);
            case WHILE:
                return parseWhile(parser);
            case FOR:
                return parseFor(parser);
            default:
                return parseExpressionStatement(parser);
        }
    }

    /**
     * Parses {@code { statements }}.
     */
    public static List<Node> parseBlock(Parser parser) {
        parser.expect(LexerTokenType.C_OPEN);
        List<Node> body = parseStatements(parser, true);
        parser.expect(LexerTokenType.C_CLOSE);
        return body;
    }

    private static Node parseImport(Parser parser) {
        LexerToken keyword = parser.next();
        if (keyword.type == LexerTokenType.IMPORT) {
            String pkg = parser.expect(LexerTokenType.STRING).text;
            String alias = null;
            if (parser.accept(LexerTokenType.AS)) {
                alias = parser.expect(LexerTokenType.IDENTIFIER).text;
            }
            return new ImportNode(pkg, alias, null, keyword.position);
        }
        String pkg = parser.expect(LexerTokenType.STRING).text;
        parser.expect(LexerTokenType.IMPORT);
        List<ImportNode.Name> names = new ArrayList<>();
        do {
            String original = parser.expect(LexerTokenType.IDENTIFIER).text;
            String renamed = null;
            if (parser.accept(LexerTokenType.AS)) {
                renamed = parser.expect(LexerTokenType.IDENTIFIER).text;
            }
            names.add(new ImportNode.Name(original, renamed));
        } while (parser.accept(LexerTokenType.COMMA));
        return new ImportNode(pkg, null, names, keyword.position);
    }

    private static Node parseReturn(Parser parser) {
        LexerToken keyword = parser.next();
        switch (parser.peek().type) {
            case NEWLINE:
            case COMMENT:
            case EOF:
            case C_CLOSE:
                return new ReturnNode(null, keyword.position);
            default:
                return new ReturnNode(ParseExpression.parseExpr1(parser), keyword.position);
        }
    }

    private static Node parseDeclaration(Parser parser) {
        LexerToken keyword = parser.next();
        boolean isConst = keyword.type == LexerTokenType.CONST;
        Node left = parseDeclarationTarget(parser);
        boolean hasUnderscore = false;
        for (IdentifierNode id : DeclarationNode.identifiersOf(left)) {
            if (id.name.equals("_")) {
                hasUnderscore = true;
            }
        }
        if (!isConst && left instanceof IdentifierNode && parser.peek().type == LexerTokenType.COLON) {
            parser.next();
            String type = parser.expect(LexerTokenType.IDENTIFIER).text;
            return new DeclarationNode(false, left, type, null, hasUnderscore, keyword.position);
        }
        parser.expect(LexerTokenType.EQUAL);
        Node right = ParseExpression.parseExpr1(parser);
        return new DeclarationNode(isConst, left, null, right, hasUnderscore, keyword.position);
    }

    /**
     * Parses {@code name} or {@code [name, name, ...]}.
     */
    static Node parseDeclarationTarget(Parser parser) {
        LexerToken token = parser.next();
        if (token.type == LexerTokenType.IDENTIFIER) {
            return new IdentifierNode(token.text, token.position);
        }
        if (token.type != LexerTokenType.SQ_OPEN) {
            throw parser.unexpected(token, "identifier or \"[\"");
        }
        List<Node> names = new ArrayList<>();
        do {
            parser.skipNewlines();
            LexerToken name = parser.expect(LexerTokenType.IDENTIFIER);
            names.add(new IdentifierNode(name.text, name.position));
            parser.skipNewlines();
        } while (parser.accept(LexerTokenType.COMMA));
        parser.expect(LexerTokenType.SQ_CLOSE);
        return new ListNode(names, token.position);
    }

    private static Node parseIf(Parser parser) {
        LexerToken keyword = parser.expect(LexerTokenType.IF);
        Node condition = ParseExpression.parseExpr1(parser);
        List<Node> body = parseBlock(parser);
        if (!parser.accept(LexerTokenType.ELSE)) {
            return new IfNode(condition, body, null, false, keyword.position);
        }
        if (parser.peek().type == LexerTokenType.IF) {
            List<Node> elseBody = new ArrayList<>();
            elseBody.add(parseIf(parser));
            return new IfNode(condition, body, elseBody, true, keyword.position);
        }
        return new IfNode(condition, body, parseBlock(parser), false, keyword.position);
    }

    private static Node parseWhile(Parser parser) {
        LexerToken keyword = parser.expect(LexerTokenType.WHILE);
        Node condition = ParseExpression.parseExpr1(parser);
        return new WhileNode(condition, parseBlock(parser), keyword.position);
    }

    private static Node parseFor(Parser parser) {
        LexerToken keyword = parser.expect(LexerTokenType.FOR);
        Node left = parseDeclarationTarget(parser);
        parser.expect(LexerTokenType.IN);
        Node right = ParseExpression.parseExpr1(parser);
        return new ForNode(left, right, parseBlock(parser), keyword.position);
    }

    private static Node parseExpressionStatement(Parser parser) {
        LexerToken start = parser.peek();
        Node left = ParseExpression.parseExpr1(parser);
        if (parser.peek().type != LexerTokenType.EQUAL) {
            return left;
        }
        LexerToken equal = parser.next();
        if (!isAssignable(left)) {
            throw parser.error(equal, "invalid assignment target");
        }
        Node right = ParseExpression.parseExpr1(parser);
        return new AssignNode(left, right, start.position);
    }

    private static boolean isAssignable(Node node) {
        if (node instanceof IdentifierNode || node instanceof SubscriptNode
                || node instanceof SliceNode || node instanceof DotNode
                || node instanceof OptionNode || node instanceof EnvNode || node instanceof RegisterNode) {
            return true;
        }
        if (node instanceof ListNode) {
            for (Node element : ((ListNode) node).elements) {
                if (!isAssignable(element) || element instanceof ListNode) {
                    return false;
                }
            }
            return !((ListNode) node).elements.isEmpty();
        }
        return false;
    }
}
