package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * {@code condition ? trueExpr : falseExpr}
 */
public class TernaryNode extends AbstractNode {
    public Node condition;
    public Node trueExpr;
    public Node falseExpr;

    public TernaryNode(Node condition, Node trueExpr, Node falseExpr, Position position) {
        this.condition = condition;
        this.trueExpr = trueExpr;
        this.falseExpr = falseExpr;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
