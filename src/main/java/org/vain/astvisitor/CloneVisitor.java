package org.vain.astvisitor;

import org.vain.astnode.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Deep clones AST nodes so that rewriting passes never touch the tree the
 * parser handed over. Positions are immutable and shared; everything else,
 * leaves included, is copied because rewrites rename identifiers in place.
 */
public class CloneVisitor implements Visitor {
    private Node clonedNode;

    public static Node clone(Node node) {
        if (node == null) return null;
        CloneVisitor visitor = new CloneVisitor();
        node.accept(visitor);
        return visitor.clonedNode;
    }

    public static List<Node> cloneList(List<Node> nodes) {
        if (nodes == null) return null;
        List<Node> cloned = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            cloned.add(clone(node));
        }
        return cloned;
    }

    private void done(Node original, Node copy) {
        copy.setId(original.getId());
        clonedNode = copy;
    }

    @Override
    public void visit(TopLevelNode node) {
        done(node, new TopLevelNode(cloneList(node.body), node.position));
    }

    @Override
    public void visit(CommentNode node) {
        done(node, new CommentNode(node.text, node.position));
    }

    @Override
    public void visit(ImportNode node) {
        List<ImportNode.Name> names = node.names == null ? null : new ArrayList<>(node.names);
        done(node, new ImportNode(node.packageLiteral, node.alias, names, node.position));
    }

    @Override
    public void visit(FunctionNode node) {
        FunctionNode copy = new FunctionNode(
                new ArrayList<>(node.modifiers),
                node.name,
                cloneList(node.arguments),
                node.returnType,
                node.bodyIsBlock,
                cloneList(node.body),
                node.isExpression(),
                node.position
        );
        done(node, copy);
    }

    @Override
    public void visit(ArgumentNode node) {
        done(node, new ArgumentNode(node.name, node.type, clone(node.defaultValue), node.position));
    }

    @Override
    public void visit(ReturnNode node) {
        done(node, new ReturnNode(clone(node.value), node.position));
    }

    @Override
    public void visit(DeclarationNode node) {
        DeclarationNode copy = new DeclarationNode(
                node.isConst,
                clone(node.left),
                node.type,
                clone(node.right),
                node.hasUnderscore,
                node.position
        );
        done(node, copy);
    }

    @Override
    public void visit(AssignNode node) {
        done(node, new AssignNode(clone(node.left), clone(node.right), node.position));
    }

    @Override
    public void visit(IfNode node) {
        IfNode copy = new IfNode(
                clone(node.condition),
                cloneList(node.body),
                cloneList(node.elseBody),
                node.elseIf,
                node.position
        );
        done(node, copy);
    }

    @Override
    public void visit(WhileNode node) {
        done(node, new WhileNode(clone(node.condition), cloneList(node.body), node.position));
    }

    @Override
    public void visit(ForNode node) {
        done(node, new ForNode(clone(node.left), clone(node.right), cloneList(node.body), node.position));
    }

    @Override
    public void visit(TernaryNode node) {
        TernaryNode copy = new TernaryNode(
                clone(node.condition),
                clone(node.trueExpr),
                clone(node.falseExpr),
                node.position
        );
        done(node, copy);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        done(node, new BinaryOperatorNode(node.operator, clone(node.left), clone(node.right), node.position));
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        done(node, new UnaryOperatorNode(node.operator, clone(node.operand), node.position));
    }

    @Override
    public void visit(SliceNode node) {
        done(node, new SliceNode(clone(node.left), clone(node.from), clone(node.to), node.position));
    }

    @Override
    public void visit(CallNode node) {
        done(node, new CallNode(clone(node.callee), cloneList(node.arguments), node.position));
    }

    @Override
    public void visit(SubscriptNode node) {
        done(node, new SubscriptNode(clone(node.left), clone(node.index), node.position));
    }

    @Override
    public void visit(DotNode node) {
        done(node, new DotNode(clone(node.left), clone(node.right), node.position));
    }

    @Override
    public void visit(IdentifierNode node) {
        done(node, new IdentifierNode(node.name, node.position));
    }

    @Override
    public void visit(IntNode node) {
        done(node, new IntNode(node.value, node.position));
    }

    @Override
    public void visit(FloatNode node) {
        done(node, new FloatNode(node.value, node.position));
    }

    @Override
    public void visit(StringNode node) {
        done(node, new StringNode(node.literal, node.position));
    }

    @Override
    public void visit(ListNode node) {
        done(node, new ListNode(cloneList(node.elements), node.position));
    }

    @Override
    public void visit(DictionaryNode node) {
        List<DictionaryNode.Entry> entries = new ArrayList<>(node.entries.size());
        for (DictionaryNode.Entry entry : node.entries) {
            entries.add(new DictionaryNode.Entry(clone(entry.key), clone(entry.value), entry.bareKey));
        }
        done(node, new DictionaryNode(entries, node.position));
    }

    @Override
    public void visit(OptionNode node) {
        done(node, new OptionNode(node.name, node.position));
    }

    @Override
    public void visit(EnvNode node) {
        done(node, new EnvNode(node.name, node.position));
    }

    @Override
    public void visit(RegisterNode node) {
        done(node, new RegisterNode(node.name, node.position));
    }

    @Override
    public void visit(SpecialLiteralNode node) {
        done(node, new SpecialLiteralNode(node.literal, node.position));
    }

    @Override
    public void visit(ErrorNode node) {
        done(node, new ErrorNode(node.message, node.position));
    }

    @Override
    public void visit(TypedNode node) {
        clonedNode = new TypedNode(clone(node.inner), node.type);
    }
}
