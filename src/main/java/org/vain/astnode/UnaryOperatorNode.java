package org.vain.astnode;

import org.vain.astvisitor.Visitor;

public class UnaryOperatorNode extends AbstractNode {
    public final UnaryOperator operator;
    public Node operand;

    public UnaryOperatorNode(UnaryOperator operator, Node operand, Position position) {
        this.operator = operator;
        this.operand = operand;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
