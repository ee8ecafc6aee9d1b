package org.vain.parser;

import org.vain.astnode.*;
import org.vain.lexer.LexerToken;
import org.vain.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The ParsePrimary class parses atoms: literals, list and dictionary literals,
 * parenthesized expressions, function literals and variable references.
 */
public class ParsePrimary {
    private static final Pattern BARE_KEY = Pattern.compile("^[A-Za-z_]\\w*$");

    public static Node parseExpr9(Parser parser) {
        LexerToken token = parser.next();
        switch (token.type) {
            case INT:
                return new IntNode(token.text, token.position);
            case FLOAT:
                return new FloatNode(token.text, token.position);
            case STRING:
                return parseString(parser, token);
            case BOOL:
            case NONE:
                return new SpecialLiteralNode(SpecialLiteral.fromText(token.text), token.position);
            case OPTION:
                return new OptionNode(token.text.substring(1), token.position);
            case ENV:
                return new EnvNode(token.text.substring(1), token.position);
            case REGISTER:
                return new RegisterNode(token.text.substring(1), token.position);
            case IDENTIFIER:
                return new IdentifierNode(token.text, token.position);
            case SQ_OPEN:
                return parseList(parser, token);
            case C_OPEN:
                return parseDictionary(parser, token);
            case P_OPEN: {
                parser.skipNewlines();
                Node expr = ParseExpression.parseExpr1(parser);
                parser.skipNewlines();
                parser.expect(LexerTokenType.P_CLOSE);
                return expr;
            }
            case FUNC:
                parser.backup();
                return ParseFunction.parseFunction(parser, true);
            default:
                throw parser.unexpected(token, "expression");
        }
    }

    /**
     * Returns true if the token could be written as an identifier, such as a
     * dictionary key or a member name after {@code .}. Keywords qualify.
     */
    static boolean isIdentifierLike(LexerToken token) {
        return token.type == LexerTokenType.IDENTIFIER || BARE_KEY.matcher(token.text).matches();
    }

    private static Node parseString(Parser parser, LexerToken token) {
        try {
            StringLiteral.eval(token.text);
        } catch (IllegalArgumentException e) {
            throw parser.error(token, "invalid string literal: " + e.getMessage());
        }
        return new StringNode(token.text, token.position);
    }

    private static Node parseList(Parser parser, LexerToken open) {
        List<Node> elements = new ArrayList<>();
        parser.skipNewlines();
        while (!parser.accept(LexerTokenType.SQ_CLOSE)) {
            elements.add(ParseExpression.parseExpr1(parser));
            parser.skipNewlines();
            if (!parser.accept(LexerTokenType.COMMA)) {
                parser.expect(LexerTokenType.SQ_CLOSE);
                break;
            }
            parser.skipNewlines();
        }
        return new ListNode(elements, open.position);
    }

    private static Node parseDictionary(Parser parser, LexerToken open) {
        List<DictionaryNode.Entry> entries = new ArrayList<>();
        parser.skipNewlines();
        while (!parser.accept(LexerTokenType.C_CLOSE)) {
            LexerToken keyToken = parser.next();
            Node key;
            boolean bareKey = false;
            if (isIdentifierLike(keyToken) && parser.peek().type == LexerTokenType.COLON) {
                key = new StringNode(StringLiteral.uneval(keyToken.text), keyToken.position);
                bareKey = true;
            } else {
                parser.backup();
                key = ParseExpression.parseExpr1(parser);
            }
            parser.skipNewlines();
            parser.expect(LexerTokenType.COLON);
            parser.skipNewlines();
            Node value = ParseExpression.parseExpr1(parser);
            entries.add(new DictionaryNode.Entry(key, value, bareKey));
            parser.skipNewlines();
            if (!parser.accept(LexerTokenType.COMMA)) {
                parser.expect(LexerTokenType.C_CLOSE);
                break;
            }
            parser.skipNewlines();
        }
        return new DictionaryNode(entries, open.position);
    }
}
