package org.vain.astvisitor;

import org.vain.astnode.*;

import java.util.List;

/*
 * Debug dump of a tree, one node per line.
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void header(String text, Node node) {
        appendIndent();
        sb.append(text);
        if (node.getPosition() != null) {
            sb.append("  pos:").append(node.getPosition());
        }
        sb.append("\n");
    }

    private void child(Node node) {
        if (node == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            node.accept(this);
        }
    }

    private void children(String label, List<Node> nodes) {
        appendIndent();
        sb.append(label).append(":\n");
        indentLevel++;
        for (Node node : nodes) {
            child(node);
        }
        indentLevel--;
    }

    @Override
    public void visit(TopLevelNode node) {
        header("TopLevelNode:", node);
        indentLevel++;
        for (Node element : node.body) {
            child(element);
        }
        indentLevel--;
    }

    @Override
    public void visit(CommentNode node) {
        header("CommentNode: " + node.text, node);
    }

    @Override
    public void visit(ImportNode node) {
        StringBuilder text = new StringBuilder("ImportNode: ").append(node.packageLiteral);
        if (node.alias != null) {
            text.append(" as ").append(node.alias);
        }
        if (node.names != null) {
            for (ImportNode.Name name : node.names) {
                text.append(" ").append(name.original);
                if (name.renamed != null) {
                    text.append("->").append(name.renamed);
                }
            }
        }
        header(text.toString(), node);
    }

    @Override
    public void visit(FunctionNode node) {
        header("FunctionNode: " + (node.name == null ? "<anon>" : node.name)
                + " " + node.modifiers
                + (node.returnType == null ? "" : " : " + node.returnType)
                + (node.isExpression() ? " expr" : " stmt"), node);
        indentLevel++;
        children("args", node.arguments);
        children(node.bodyIsBlock ? "block" : "body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ArgumentNode node) {
        header("ArgumentNode: " + node.name + (node.type == null ? "" : " : " + node.type), node);
        if (node.defaultValue != null) {
            indentLevel++;
            child(node.defaultValue);
            indentLevel--;
        }
    }

    @Override
    public void visit(ReturnNode node) {
        header("ReturnNode:", node);
        indentLevel++;
        child(node.value);
        indentLevel--;
    }

    @Override
    public void visit(DeclarationNode node) {
        header("DeclarationNode: " + (node.isConst ? "const" : "let")
                + (node.type == null ? "" : " : " + node.type), node);
        indentLevel++;
        child(node.left);
        child(node.right);
        indentLevel--;
    }

    @Override
    public void visit(AssignNode node) {
        header("AssignNode:", node);
        indentLevel++;
        child(node.left);
        child(node.right);
        indentLevel--;
    }

    @Override
    public void visit(IfNode node) {
        header("IfNode:", node);
        indentLevel++;
        child(node.condition);
        children("then", node.body);
        if (node.elseBody != null) {
            children(node.elseIf ? "else if" : "else", node.elseBody);
        }
        indentLevel--;
    }

    @Override
    public void visit(WhileNode node) {
        header("WhileNode:", node);
        indentLevel++;
        child(node.condition);
        children("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(ForNode node) {
        header("ForNode:", node);
        indentLevel++;
        child(node.left);
        child(node.right);
        children("body", node.body);
        indentLevel--;
    }

    @Override
    public void visit(TernaryNode node) {
        header("TernaryNode:", node);
        indentLevel++;
        child(node.condition);
        child(node.trueExpr);
        child(node.falseExpr);
        indentLevel--;
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        header("BinaryOperatorNode: " + node.operator, node);
        indentLevel++;
        child(node.left);
        child(node.right);
        indentLevel--;
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        header("UnaryOperatorNode: " + node.operator, node);
        indentLevel++;
        child(node.operand);
        indentLevel--;
    }

    @Override
    public void visit(SliceNode node) {
        header("SliceNode:", node);
        indentLevel++;
        child(node.left);
        child(node.from);
        child(node.to);
        indentLevel--;
    }

    @Override
    public void visit(CallNode node) {
        header("CallNode:", node);
        indentLevel++;
        child(node.callee);
        children("args", node.arguments);
        indentLevel--;
    }

    @Override
    public void visit(SubscriptNode node) {
        header("SubscriptNode:", node);
        indentLevel++;
        child(node.left);
        child(node.index);
        indentLevel--;
    }

    @Override
    public void visit(DotNode node) {
        header("DotNode:", node);
        indentLevel++;
        child(node.left);
        child(node.right);
        indentLevel--;
    }

    @Override
    public void visit(IdentifierNode node) {
        header("IdentifierNode: " + node.name, node);
    }

    @Override
    public void visit(IntNode node) {
        header("IntNode: " + node.value, node);
    }

    @Override
    public void visit(FloatNode node) {
        header("FloatNode: " + node.value, node);
    }

    @Override
    public void visit(StringNode node) {
        header("StringNode: " + node.literal, node);
    }

    @Override
    public void visit(ListNode node) {
        header("ListNode:", node);
        indentLevel++;
        for (Node element : node.elements) {
            child(element);
        }
        indentLevel--;
    }

    @Override
    public void visit(DictionaryNode node) {
        header("DictionaryNode:", node);
        indentLevel++;
        for (DictionaryNode.Entry entry : node.entries) {
            appendIndent();
            sb.append(entry.bareKey ? "entry (bare key):\n" : "entry:\n");
            indentLevel++;
            child(entry.key);
            child(entry.value);
            indentLevel--;
        }
        indentLevel--;
    }

    @Override
    public void visit(OptionNode node) {
        header("OptionNode: " + node.name, node);
    }

    @Override
    public void visit(EnvNode node) {
        header("EnvNode: " + node.name, node);
    }

    @Override
    public void visit(RegisterNode node) {
        header("RegisterNode: " + node.name, node);
    }

    @Override
    public void visit(SpecialLiteralNode node) {
        header("SpecialLiteralNode: " + node.literal, node);
    }

    @Override
    public void visit(ErrorNode node) {
        header("ErrorNode: " + node.message, node);
    }

    @Override
    public void visit(TypedNode node) {
        appendIndent();
        sb.append("TypedNode: ").append(node.type).append("\n");
        indentLevel++;
        node.inner.accept(this);
        indentLevel--;
    }
}
