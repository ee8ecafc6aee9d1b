package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

/**
 * The root of one parsed source file: its statements in order.
 */
public class TopLevelNode extends AbstractNode {
    public final List<Node> body;

    public TopLevelNode(List<Node> body, Position position) {
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
