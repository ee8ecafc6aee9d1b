package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

/**
 * The IfNode class represents an {@code if} statement.
 * <p>
 * {@code elseBody} is null when there is no else branch. For {@code else if}
 * it holds exactly one IfNode and {@code elseIf} is true.
 */
public class IfNode extends AbstractNode {
    public Node condition;
    public final List<Node> body;
    public final List<Node> elseBody;
    public final boolean elseIf;

    public IfNode(Node condition, List<Node> body, List<Node> elseBody, boolean elseIf, Position position) {
        this.condition = condition;
        this.body = body;
        this.elseBody = elseBody;
        this.elseIf = elseIf;
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
