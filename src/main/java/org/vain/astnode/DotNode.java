package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * Dictionary member access {@code left.name}. The right side is the member
 * name, not a variable reference.
 */
public class DotNode extends AbstractNode {
    public Node left;
    public Node right;

    public DotNode(Node left, Node right, Position position) {
        this.left = left;
        this.right = right;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
