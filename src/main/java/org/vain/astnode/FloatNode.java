package org.vain.astnode;

import org.vain.astvisitor.Visitor;

public class FloatNode extends AbstractNode {
    public final String value;

    public FloatNode(String value, Position position) {
        this.value = value;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
