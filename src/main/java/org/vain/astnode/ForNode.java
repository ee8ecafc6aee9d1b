package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

/**
 * {@code for left in right { body }}. The loop variable(s) in {@code left}
 * are declared in the scope of the body.
 */
public class ForNode extends AbstractNode {
    public Node left;
    public Node right;
    public final List<Node> body;

    public ForNode(Node left, Node right, List<Node> body, Position position) {
        this.left = left;
        this.right = right;
        this.body = body;
        this.position = position;
    }

    @Override
    public boolean isExpression() {
        return false;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
