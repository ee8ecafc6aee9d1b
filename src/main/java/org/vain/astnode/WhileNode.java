package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

public class WhileNode extends AbstractNode {
    public Node condition;
    public final List<Node> body;

    public WhileNode(Node condition, List<Node> body, Position position) {
        this.condition = condition;
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
