package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * An assignment statement {@code left = right}.
 * The target is an identifier, subscript, slice, dot access or a list of those.
 */
public class AssignNode extends AbstractNode {
    public Node left;
    public Node right;

    public AssignNode(Node left, Node right, Position position) {
        this.left = left;
        this.right = right;
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
