package org.vain.parser;

import org.vain.astnode.*;
import org.vain.lexer.LexerToken;
import org.vain.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Expression levels 1 to 8, lowest precedence first:
 * <pre>
 *   expr1  ternary           a ? b : c
 *   expr2  ||
 *   expr3  &amp;&amp;
 *   expr4  comparison        at most one operator, no chaining
 *   expr5  + -               left associative
 *   expr6  * / %             left associative
 *   expr7  ! - +             prefix
 *   expr8  postfix           a[i]  a[i:j]  a.b  a(x)
 * </pre>
 * Atoms (expr9) are parsed by {@link ParsePrimary}.
 */
public class ParseExpression {
    private static final Map<LexerTokenType, BinaryOperator> COMPARISON = new EnumMap<>(LexerTokenType.class);

    static {
        COMPARISON.put(LexerTokenType.EQ_EQ, BinaryOperator.EQUAL);
        COMPARISON.put(LexerTokenType.EQ_EQ_CI, BinaryOperator.EQUAL_CI);
        COMPARISON.put(LexerTokenType.NEQ, BinaryOperator.NOT_EQUAL);
        COMPARISON.put(LexerTokenType.NEQ_CI, BinaryOperator.NOT_EQUAL_CI);
        COMPARISON.put(LexerTokenType.GT, BinaryOperator.GREATER);
        COMPARISON.put(LexerTokenType.GT_CI, BinaryOperator.GREATER_CI);
        COMPARISON.put(LexerTokenType.GT_EQ, BinaryOperator.GREATER_EQUAL);
        COMPARISON.put(LexerTokenType.GT_EQ_CI, BinaryOperator.GREATER_EQUAL_CI);
        COMPARISON.put(LexerTokenType.LT, BinaryOperator.SMALLER);
        COMPARISON.put(LexerTokenType.LT_CI, BinaryOperator.SMALLER_CI);
        COMPARISON.put(LexerTokenType.LT_EQ, BinaryOperator.SMALLER_EQUAL);
        COMPARISON.put(LexerTokenType.LT_EQ_CI, BinaryOperator.SMALLER_EQUAL_CI);
        COMPARISON.put(LexerTokenType.MATCH, BinaryOperator.MATCH);
        COMPARISON.put(LexerTokenType.MATCH_CI, BinaryOperator.MATCH_CI);
        COMPARISON.put(LexerTokenType.NO_MATCH, BinaryOperator.NO_MATCH);
        COMPARISON.put(LexerTokenType.NO_MATCH_CI, BinaryOperator.NO_MATCH_CI);
        COMPARISON.put(LexerTokenType.IS, BinaryOperator.IS);
        COMPARISON.put(LexerTokenType.IS_CI, BinaryOperator.IS_CI);
        COMPARISON.put(LexerTokenType.IS_NOT, BinaryOperator.IS_NOT);
        COMPARISON.put(LexerTokenType.IS_NOT_CI, BinaryOperator.IS_NOT_CI);
    }

    public static Node parseExpr1(Parser parser) {
        Node condition = parseExpr2(parser);
        if (parser.peek().type != LexerTokenType.QUESTION) {
            return condition;
        }
        LexerToken question = parser.next();
        Node trueExpr = parseExpr1(parser);
        parser.expect(LexerTokenType.COLON);
        Node falseExpr = parseExpr1(parser);
        return new TernaryNode(condition, trueExpr, falseExpr, question.position);
    }

    static Node parseExpr2(Parser parser) {
        Node left = parseExpr3(parser);
        while (parser.peek().type == LexerTokenType.OR_OR) {
            LexerToken op = parser.next();
            left = new BinaryOperatorNode(BinaryOperator.OR, left, parseExpr3(parser), op.position);
        }
        return left;
    }

    static Node parseExpr3(Parser parser) {
        Node left = parseExpr4(parser);
        while (parser.peek().type == LexerTokenType.AND_AND) {
            LexerToken op = parser.next();
            left = new BinaryOperatorNode(BinaryOperator.AND, left, parseExpr4(parser), op.position);
        }
        return left;
    }

    static Node parseExpr4(Parser parser) {
        Node left = parseExpr5(parser);
        BinaryOperator operator = COMPARISON.get(parser.peek().type);
        if (operator == null) {
            return left;
        }
        LexerToken op = parser.next();
        Node right = parseExpr5(parser);
        LexerToken after = parser.peek();
        if (COMPARISON.containsKey(after.type)) {
            throw parser.error(after, "comparison operators cannot be chained");
        }
        return new BinaryOperatorNode(operator, left, right, op.position);
    }

    static Node parseExpr5(Parser parser) {
        Node left = parseExpr6(parser);
        while (true) {
            LexerTokenType type = parser.peek().type;
            BinaryOperator operator;
            if (type == LexerTokenType.PLUS) {
                operator = BinaryOperator.ADD;
            } else if (type == LexerTokenType.MINUS) {
                operator = BinaryOperator.SUBTRACT;
            } else {
                return left;
            }
            LexerToken op = parser.next();
            left = new BinaryOperatorNode(operator, left, parseExpr6(parser), op.position);
        }
    }

    static Node parseExpr6(Parser parser) {
        Node left = parseExpr7(parser);
        while (true) {
            LexerTokenType type = parser.peek().type;
            BinaryOperator operator;
            if (type == LexerTokenType.STAR) {
                operator = BinaryOperator.MULTIPLY;
            } else if (type == LexerTokenType.SLASH) {
                operator = BinaryOperator.DIVIDE;
            } else if (type == LexerTokenType.PERCENT) {
                operator = BinaryOperator.REMAINDER;
            } else {
                return left;
            }
            LexerToken op = parser.next();
            left = new BinaryOperatorNode(operator, left, parseExpr7(parser), op.position);
        }
    }

    static Node parseExpr7(Parser parser) {
        LexerToken token = parser.peek();
        UnaryOperator operator;
        switch (token.type) {
            case NOT:
                operator = UnaryOperator.NOT;
                break;
            case MINUS:
                operator = UnaryOperator.MINUS;
                break;
            case PLUS:
                operator = UnaryOperator.PLUS;
                break;
            default:
                return parseExpr8(parser);
        }
        parser.next();
        return new UnaryOperatorNode(operator, parseExpr7(parser), token.position);
    }

    static Node parseExpr8(Parser parser) {
        Node left = ParsePrimary.parseExpr9(parser);
        while (true) {
            LexerToken token = parser.peek();
            switch (token.type) {
                case SQ_OPEN:
                    parser.next();
                    left = parseSubscriptOrSlice(parser, left, token);
                    break;
                case DOT: {
                    parser.next();
                    LexerToken name = parser.next();
                    if (!ParsePrimary.isIdentifierLike(name)) {
                        throw parser.unexpected(name, "member name after \".\"");
                    }
                    left = new DotNode(left, new IdentifierNode(name.text, name.position), token.position);
                    break;
                }
                case P_OPEN:
                    parser.next();
                    left = new CallNode(left, parseCallArguments(parser), token.position);
                    break;
                default:
                    return left;
            }
        }
    }

    private static Node parseSubscriptOrSlice(Parser parser, Node left, LexerToken open) {
        parser.skipNewlines();
        Node from = null;
        if (parser.peek().type != LexerTokenType.COLON) {
            from = parseExpr1(parser);
            parser.skipNewlines();
            if (parser.peek().type != LexerTokenType.COLON) {
                parser.expect(LexerTokenType.SQ_CLOSE);
                return new SubscriptNode(left, from, open.position);
            }
        }
        parser.expect(LexerTokenType.COLON);
        parser.skipNewlines();
        Node to = null;
        if (parser.peek().type != LexerTokenType.SQ_CLOSE) {
            to = parseExpr1(parser);
            parser.skipNewlines();
        }
        parser.expect(LexerTokenType.SQ_CLOSE);
        return new SliceNode(left, from, to, open.position);
    }

    private static List<Node> parseCallArguments(Parser parser) {
        List<Node> arguments = new ArrayList<>();
        parser.skipNewlines();
        while (!parser.accept(LexerTokenType.P_CLOSE)) {
            arguments.add(parseExpr1(parser));
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
