package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

public class CallNode extends AbstractNode {
    public Node callee;
    public final List<Node> arguments;

    public CallNode(Node callee, List<Node> arguments, Position position) {
        this.callee = callee;
        this.arguments = arguments;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
