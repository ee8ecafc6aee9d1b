package org.vain.codegen;

import org.vain.astnode.*;

import java.nio.file.Path;
import java.util.List;

/**
 * Prints a tree back as canonical vain source.
 * <p>
 * Two-space indentation, one statement per line, {@code else} on the line of
 * the closing brace, single spaces around binary operators and after commas.
 * Parentheses are re-derived from precedence, so printing the output of a
 * parse of this printer's output yields the same text.
 */
public class PrettyPrintGenerator extends AbstractGenerator {

    public static final String EXTENSION = ".pretty";

    public PrettyPrintGenerator(EmitterContext ctx) {
        super(ctx);
    }

    @Override
    public Path outputPath(Path source) {
        return source.resolveSibling(source.getFileName() + EXTENSION);
    }

    @Override
    protected void expressionStatement(Node node) {
        if (node instanceof FunctionNode) {
            // a leading "func" would read back as a function statement
            line("(" + expr(node) + ")");
        } else {
            line(expr(node));
        }
    }

    @Override
    public void visit(CommentNode node) {
        line(node.text);
    }

    @Override
    public void visit(ImportNode node) {
        if (!node.isFromImport()) {
            line("import " + node.packageLiteral + (node.alias != null ? " as " + node.alias : ""));
            return;
        }
        StringBuilder text = new StringBuilder("from ").append(node.packageLiteral).append(" import ");
        for (int i = 0; i < node.names.size(); i++) {
            ImportNode.Name name = node.names.get(i);
            if (i > 0) {
                text.append(", ");
            }
            text.append(name.original);
            if (name.renamed != null) {
                text.append(" as ").append(name.renamed);
            }
        }
        line(text.toString());
    }

    @Override
    public void visit(FunctionNode node) {
        if (node.isExpression()) {
            sb.append(function(node));
        } else {
            line(function(node));
        }
    }

    private String function(FunctionNode node) {
        StringBuilder text = new StringBuilder("func");
        if (!node.modifiers.isEmpty()) {
            text.append(" <").append(String.join(", ", node.modifiers)).append(">");
        }
        if (node.name != null) {
            text.append(" ").append(node.name);
        }
        text.append("(");
        for (int i = 0; i < node.arguments.size(); i++) {
            if (i > 0) {
                text.append(", ");
            }
            ArgumentNode argument = (ArgumentNode) node.arguments.get(i).terminalNode();
            text.append(argument.name);
            if (argument.type != null) {
                text.append(": ").append(argument.type);
            } else if (argument.defaultValue != null) {
                text.append(" = ").append(expr(argument.defaultValue));
            }
        }
        text.append(")");
        if (node.returnType != null) {
            text.append(": ").append(node.returnType);
        }
        if (!node.bodyIsBlock) {
            return text.append(" ").append(expr(node.body.get(0))).toString();
        }
        StringBuilder saved = sb;
        sb = new StringBuilder();
        try {
            block(node.body);
            text.append(" {\n").append(sb);
        } finally {
            sb = saved;
        }
        return text.append("  ".repeat(indentLevel)).append("}").toString();
    }

    @Override
    public void visit(ReturnNode node) {
        line(node.value == null ? "return" : "return " + expr(node.value));
    }

    @Override
    public void visit(DeclarationNode node) {
        String keyword = node.isConst ? "const " : "let ";
        if (node.right == null) {
            line(keyword + expr(node.left) + ": " + node.type);
        } else {
            line(keyword + expr(node.left) + " = " + expr(node.right));
        }
    }

    @Override
    public void visit(AssignNode node) {
        line(expr(node.left) + " = " + expr(node.right));
    }

    @Override
    public void visit(IfNode node) {
        ifChain(node, "if ");
    }

    private void ifChain(IfNode node, String keyword) {
        line(keyword + expr(node.condition) + " {");
        block(node.body);
        if (node.elseBody == null) {
            line("}");
        } else if (node.elseIf && node.elseBody.get(0).terminalNode() instanceof IfNode elseIf) {
            ifChain(elseIf, "} else if ");
        } else {
            line("} else {");
            block(node.elseBody);
            line("}");
        }
    }

    @Override
    public void visit(WhileNode node) {
        line("while " + expr(node.condition) + " {");
        block(node.body);
        line("}");
    }

    @Override
    public void visit(ForNode node) {
        line("for " + expr(node.left) + " in " + expr(node.right) + " {");
        block(node.body);
        line("}");
    }

    @Override
    public void visit(SliceNode node) {
        sb.append(expr(node.left, Precedence.POSTFIX)).append("[");
        if (node.from != null) {
            sb.append(expr(node.from));
        }
        sb.append(":");
        if (node.to != null) {
            sb.append(expr(node.to));
        }
        sb.append("]");
    }

    @Override
    public void visit(CallNode node) {
        sb.append(expr(node.callee, Precedence.POSTFIX)).append("(").append(join(node.arguments, ", ")).append(")");
    }

    @Override
    public void visit(SubscriptNode node) {
        sb.append(expr(node.left, Precedence.POSTFIX)).append("[").append(expr(node.index)).append("]");
    }

    @Override
    public void visit(DotNode node) {
        sb.append(expr(node.left, Precedence.POSTFIX)).append(".").append(expr(node.right));
    }

    @Override
    public void visit(IdentifierNode node) {
        sb.append(node.name);
    }

    @Override
    public void visit(StringNode node) {
        sb.append(node.literal);
    }

    @Override
    public void visit(ListNode node) {
        sb.append("[").append(join(node.elements, ", ")).append("]");
    }

    @Override
    public void visit(DictionaryNode node) {
        sb.append("{");
        List<DictionaryNode.Entry> entries = node.entries;
        for (int i = 0; i < entries.size(); i++) {
            DictionaryNode.Entry entry = entries.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            if (entry.bareKey && entry.key.terminalNode() instanceof StringNode key) {
                sb.append(key.evaluate());
            } else {
                sb.append(expr(entry.key));
            }
            sb.append(": ").append(expr(entry.value));
        }
        sb.append("}");
    }

    @Override
    public void visit(RegisterNode node) {
        sb.append(RegisterNode.SIGIL).append(node.name);
    }

    @Override
    public void visit(SpecialLiteralNode node) {
        sb.append(node.literal.text);
    }
}
