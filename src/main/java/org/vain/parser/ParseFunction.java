package org.vain.parser;

import org.vain.astnode.ArgumentNode;
import org.vain.astnode.FunctionNode;
import org.vain.astnode.Node;
import org.vain.lexer.LexerToken;
import org.vain.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses functions, shared by statement and expression position:
 * <pre>
 *   func [&lt;mod, ...&gt;] [name] (args) [: Type] { block }
 *   func [&lt;mod, ...&gt;] [name] (args) [: Type] expr
 * </pre>
 */
public class ParseFunction {
    public static final Set<String> MODIFIERS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("autoload", "global", "range", "dict", "closure", "noabort")));

    /**
     * Parses a function.
     *
     * @param parser       The parser instance used for parsing.
     * @param isExpression true when the function is used as a value
     * @return the FunctionNode
     */
    public static Node parseFunction(Parser parser, boolean isExpression) {
        LexerToken keyword = parser.expect(LexerTokenType.FUNC);

        List<String> modifiers = new ArrayList<>();
        if (parser.accept(LexerTokenType.LT)) {
            do {
                LexerToken modifier = parser.expect(LexerTokenType.IDENTIFIER);
                if (!MODIFIERS.contains(modifier.text)) {
                    throw parser.error(modifier, "unknown function modifier " + Parser.describe(modifier));
                }
                modifiers.add(modifier.text);
            } while (parser.accept(LexerTokenType.COMMA));
            parser.expect(LexerTokenType.GT);
        }

        String name = null;
        if (parser.peek().type == LexerTokenType.IDENTIFIER) {
            name = parser.next().text;
        }

        parser.expect(LexerTokenType.P_OPEN);
        List<Node> arguments = parseArguments(parser);

        String returnType = null;
        if (parser.accept(LexerTokenType.COLON)) {
            returnType = parser.expect(LexerTokenType.IDENTIFIER).text;
        }

        boolean bodyIsBlock = parser.peek().type == LexerTokenType.C_OPEN;
        List<Node> body;
        if (bodyIsBlock) {
            body = ParseStatement.parseBlock(parser);
        } else {
            body = new ArrayList<>();
            body.add(ParseExpression.parseExpr1(parser));
        }
        parser.ctx.logDebug("parseFunction " + (name == null ? "<anon>" : name)
                + " args=" + arguments.size() + " block=" + bodyIsBlock);
        return new FunctionNode(modifiers, name, arguments, returnType, bodyIsBlock, body, isExpression,
                keyword.position);
    }

    private static List<Node> parseArguments(Parser parser) {
        List<Node> arguments = new ArrayList<>();
        parser.skipNewlines();
        while (!parser.accept(LexerTokenType.P_CLOSE)) {
            LexerToken name = parser.expect(LexerTokenType.IDENTIFIER);
            String type = null;
            Node defaultValue = null;
            if (parser.accept(LexerTokenType.COLON)) {
                type = parser.expect(LexerTokenType.IDENTIFIER).text;
            } else if (parser.accept(LexerTokenType.EQUAL)) {
                defaultValue = ParseExpression.parseExpr1(parser);
            }
            arguments.add(new ArgumentNode(name.text, type, defaultValue, name.position));
            parser.skipNewlines();
            if (!parser.accept(LexerTokenType.COMMA)) {
                parser.expect(LexerTokenType.P_CLOSE);
                break;
            }
            parser.skipNewlines();
        }
        return arguments;
    }
}
