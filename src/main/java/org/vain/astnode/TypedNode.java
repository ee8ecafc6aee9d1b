package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * A transparent decorator pairing a node with its inferred type.
 * <p>
 * Visitors see the wrapper only if they override {@link Visitor#visit(TypedNode)};
 * the default forwards to the wrapped node.
 */
public class TypedNode implements Node {
    public final Node inner;
    public VainType type;

    public TypedNode(Node inner, VainType type) {
        this.inner = inner;
        this.type = type;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }

    @Override
    public Position getPosition() {
        return inner.getPosition();
    }

    @Override
    public void setPosition(Position position) {
        inner.setPosition(position);
    }

    @Override
    public boolean isExpression() {
        return inner.isExpression();
    }

    @Override
    public int getId() {
        return inner.getId();
    }

    @Override
    public void setId(int id) {
        inner.setId(id);
    }

    @Override
    public Node terminalNode() {
        return inner.terminalNode();
    }

    @Override
    public String toString() {
        return inner.toString();
    }
}
