package org.vain.codegen;

import org.vain.astnode.*;
import org.vain.parser.StringLiteral;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Dumps a tree as s-expressions, one top-level statement per line.
 * <p>
 * Identifiers are quoted symbols ({@code 'x}), string values are printed as
 * JSON strings, operators keep their source spelling:
 * <pre>
 *   const x = 1 + 2 * 3     (const 'x (+ 1 (* 2 3)))
 *   f([1], {a: 2})          (call 'f (list 1) (dict ("a" 2)))
 * </pre>
 */
public class SexpDumpGenerator extends AbstractGenerator {

    public static final String EXTENSION = ".sexp";

    public SexpDumpGenerator(EmitterContext ctx) {
        super(ctx);
    }

    @Override
    public Path outputPath(Path source) {
        return source.resolveSibling(source.getFileName() + EXTENSION);
    }

    @Override
    protected String renderStatement(Node node) {
        return expr(node) + "\n";
    }

    @Override
    protected void expressionStatement(Node node) {
        sb.append(expr(node));
    }

    @Override
    protected int precedenceOf(Node node) {
        return Precedence.ATOM;
    }

    private String list(List<Node> nodes) {
        return "(" + join(nodes, " ") + ")";
    }

    private String target(Node node) {
        // destructuring targets are a bare list of symbols
        if (node.terminalNode() instanceof ListNode list) {
            return list(list.elements);
        }
        return expr(node);
    }

    private String json(Node node, String literal) {
        try {
            return jsonQuote(StringLiteral.eval(literal));
        } catch (IllegalArgumentException e) {
            throw fatal(node, e.getMessage());
        }
    }

    static String jsonQuote(String value) {
        StringBuilder quoted = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                case '\b' -> quoted.append("\\b");
                case '\f' -> quoted.append("\\f");
                default -> {
                    if (c < 0x20) {
                        quoted.append(String.format("\\u%04x", (int) c));
                    } else {
                        quoted.append(c);
                    }
                }
            }
        }
        return quoted.append('"').toString();
    }

    @Override
    public void visit(CommentNode node) {
        sb.append("(# ").append(jsonQuote(node.content())).append(")");
    }

    @Override
    public void visit(ImportNode node) {
        sb.append("(import (").append(json(node, node.packageLiteral));
        if (node.alias != null) {
            sb.append(" '").append(node.alias);
        }
        sb.append(")");
        if (node.isFromImport()) {
            List<String> pairs = new ArrayList<>();
            for (ImportNode.Name name : node.names) {
                pairs.add(name.renamed == null ? "(" + name.original + ")" : "(" + name.original + " " + name.renamed + ")");
            }
            sb.append(" (").append(String.join(" ", pairs)).append(")");
        }
        sb.append(")");
    }

    @Override
    public void visit(FunctionNode node) {
        sb.append("(func (").append(String.join(" ", node.modifiers)).append(") ");
        sb.append(node.name == null ? "null" : node.name).append(" (");
        for (int i = 0; i < node.arguments.size(); i++) {
            if (i > 0) {
                sb.append(" ");
            }
            node.arguments.get(i).accept(this);
        }
        sb.append(") ").append(jsonQuote(node.returnType == null ? "" : node.returnType)).append(" ");
        if (node.bodyIsBlock) {
            sb.append(list(node.body));
        } else {
            sb.append(node.body.isEmpty() ? "null" : expr(node.body.get(0)));
        }
        sb.append(")");
    }

    @Override
    public void visit(ArgumentNode node) {
        if (node.type != null) {
            sb.append("(").append(node.name).append(" : ").append(node.type).append(")");
        } else if (node.defaultValue != null) {
            sb.append("(").append(node.name).append(" = ").append(expr(node.defaultValue)).append(")");
        } else {
            sb.append("(").append(node.name).append(")");
        }
    }

    @Override
    public void visit(ReturnNode node) {
        sb.append(node.value == null ? "(return)" : "(return " + expr(node.value) + ")");
    }

    @Override
    public void visit(DeclarationNode node) {
        sb.append(node.isConst ? "(const " : "(let ").append(target(node.left)).append(" ");
        if (node.right == null) {
            sb.append(": ").append(node.type);
        } else {
            sb.append(expr(node.right));
        }
        sb.append(")");
    }

    @Override
    public void visit(AssignNode node) {
        sb.append("(= ").append(target(node.left)).append(" ").append(expr(node.right)).append(")");
    }

    @Override
    public void visit(IfNode node) {
        sb.append("(if ").append(expr(node.condition)).append(" ").append(list(node.body));
        if (node.elseBody != null) {
            sb.append(" ").append(list(node.elseBody));
        }
        sb.append(")");
    }

    @Override
    public void visit(WhileNode node) {
        sb.append("(while ").append(expr(node.condition)).append(" ").append(list(node.body)).append(")");
    }

    @Override
    public void visit(ForNode node) {
        sb.append("(for ").append(target(node.left)).append(" ").append(expr(node.right))
                .append(" ").append(list(node.body)).append(")");
    }

    @Override
    public void visit(TernaryNode node) {
        sb.append("(?: ").append(expr(node.condition)).append(" ").append(expr(node.trueExpr))
                .append(" ").append(expr(node.falseExpr)).append(")");
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        sb.append("(").append(node.operator.text).append(" ").append(expr(node.left))
                .append(" ").append(expr(node.right)).append(")");
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        sb.append("(").append(node.operator.text).append(" ").append(expr(node.operand)).append(")");
    }

    @Override
    public void visit(SliceNode node) {
        sb.append("(slice ").append(expr(node.left))
                .append(" ").append(node.from == null ? "null" : expr(node.from))
                .append(" ").append(node.to == null ? "null" : expr(node.to)).append(")");
    }

    @Override
    public void visit(CallNode node) {
        sb.append("(call ").append(expr(node.callee));
        if (!node.arguments.isEmpty()) {
            sb.append(" ").append(join(node.arguments, " "));
        }
        sb.append(")");
    }

    @Override
    public void visit(SubscriptNode node) {
        sb.append("(subscript ").append(expr(node.left)).append(" ").append(expr(node.index)).append(")");
    }

    @Override
    public void visit(DotNode node) {
        sb.append("(dot ").append(expr(node.left)).append(" ").append(expr(node.right)).append(")");
    }

    @Override
    public void visit(IdentifierNode node) {
        sb.append("'").append(node.name);
    }

    @Override
    public void visit(StringNode node) {
        sb.append(json(node, node.literal));
    }

    @Override
    public void visit(ListNode node) {
        sb.append("(list");
        for (Node element : node.elements) {
            sb.append(" ").append(expr(element));
        }
        sb.append(")");
    }

    @Override
    public void visit(DictionaryNode node) {
        sb.append("(dict");
        for (DictionaryNode.Entry entry : node.entries) {
            sb.append(" (").append(expr(entry.key)).append(" ").append(expr(entry.value)).append(")");
        }
        sb.append(")");
    }

    @Override
    public void visit(OptionNode node) {
        sb.append("(option ").append(jsonQuote(node.name)).append(")");
    }

    @Override
    public void visit(EnvNode node) {
        sb.append("(env ").append(jsonQuote(node.name)).append(")");
    }

    @Override
    public void visit(RegisterNode node) {
        sb.append("(reg ").append(jsonQuote(node.name)).append(")");
    }

    @Override
    public void visit(SpecialLiteralNode node) {
        sb.append(node.literal.text);
    }
}
