package org.vain.astnode;

import org.vain.astvisitor.Visitor;

public class ReturnNode extends AbstractNode {
    /**
     * The returned expression, or null for a bare {@code return}.
     */
    public Node value;

    public ReturnNode(Node value, Position position) {
        this.value = value;
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
