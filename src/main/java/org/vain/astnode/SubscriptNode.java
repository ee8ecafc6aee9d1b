package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * {@code left[index]}
 */
public class SubscriptNode extends AbstractNode {
    public Node left;
    public Node index;

    public SubscriptNode(Node left, Node index, Position position) {
        this.left = left;
        this.index = index;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
